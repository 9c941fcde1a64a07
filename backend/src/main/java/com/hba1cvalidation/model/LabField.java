package com.hba1cvalidation.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Optional numeric lab fields of a patient record.
 *
 * Each field carries its wire key, the population-typical value used when the
 * field is absent, and the physically plausible range outside of which a
 * supplied value is ignored. Glucose-derived fields are imputed from fasting
 * glucose instead of a constant.
 */
public enum LabField {

    RANDOM_GLUCOSE("random_glucose", "mg/dL", 120.0, 20.0, 1500.0, 1.05 / 0.85),
    OGTT_2HR("ogtt_2hr", "mg/dL", 140.0, 20.0, 1500.0, 1.25 / 0.85),
    AVG_GLUCOSE_CGM("avg_glucose_cgm", "mg/dL", 115.0, 20.0, 1000.0, 1.0 / 0.85),
    RBC_COUNT("rbc_count", "10^12/L", 4.75, 0.5, 10.0, 0.0),
    MCV("mcv", "fL", 90.0, 40.0, 150.0, 0.0),
    MCH("mch", "pg", 30.0, 10.0, 50.0, 0.0),
    MCHC("mchc", "g/dL", 34.0, 20.0, 45.0, 0.0),
    RETICULOCYTE_COUNT("reticulocyte_count", "%", 1.0, 0.0, 40.0, 0.0),
    WBC_COUNT("wbc_count", "10^9/L", 7.0, 0.1, 100.0, 0.0),
    PLATELET_COUNT("platelet_count", "10^9/L", 250.0, 1.0, 2000.0, 0.0),
    SERUM_IRON("serum_iron", "ug/dL", 100.0, 1.0, 500.0, 0.0),
    FERRITIN("ferritin", "ng/mL", 100.0, 0.5, 5000.0, 0.0),
    TRANSFERRIN_SATURATION("transferrin_saturation", "%", 30.0, 0.0, 100.0, 0.0),
    TIBC("tibc", "ug/dL", 320.0, 50.0, 800.0, 0.0),
    BILIRUBIN("bilirubin", "mg/dL", 0.7, 0.0, 40.0, 0.0),
    LDH("ldh", "U/L", 170.0, 20.0, 5000.0, 0.0),
    HAPTOGLOBIN("haptoglobin", "mg/dL", 120.0, 0.0, 500.0, 0.0),
    AGE("age", "years", 50.0, 0.0, 120.0, 0.0),
    RBC_LIFESPAN_DAYS("rbc_lifespan_days", "days", 120.0, 5.0, 200.0, 0.0);

    private final String key;
    private final String unit;
    private final double defaultValue;
    private final double minValue;
    private final double maxValue;
    private final double fastingGlucoseRatio;

    LabField(String key, String unit, double defaultValue, double minValue, double maxValue,
             double fastingGlucoseRatio) {
        this.key = key;
        this.unit = unit;
        this.defaultValue = defaultValue;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.fastingGlucoseRatio = fastingGlucoseRatio;
    }

    public String getKey() { return key; }
    public String getUnit() { return unit; }
    public double getDefaultValue() { return defaultValue; }
    public double getMinValue() { return minValue; }
    public double getMaxValue() { return maxValue; }

    public boolean isGlucoseDerived() {
        return fastingGlucoseRatio > 0.0;
    }

    public boolean isPlausible(double value) {
        return Double.isFinite(value) && value >= minValue && value <= maxValue;
    }

    /**
     * Value substituted when the field is absent.
     */
    public double imputedValue(double fastingGlucose) {
        return isGlucoseDerived() ? fastingGlucose * fastingGlucoseRatio : defaultValue;
    }

    public static Optional<LabField> fromKey(String key) {
        return Arrays.stream(values())
            .filter(f -> f.key.equals(key))
            .findFirst();
    }
}
