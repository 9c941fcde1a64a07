package com.hba1cvalidation.ml;

import com.hba1cvalidation.exception.InvalidRecordException;
import com.hba1cvalidation.model.Gender;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.PatientRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Maps a {@link PatientRecord} to a fixed-shape {@link FeatureVector}.
 *
 * Layout:
 * <pre>
 *   [0..2]            hba1c, fasting_glucose, haemoglobin
 *   [3..21]           optional labs in {@link LabField} order
 *   [22]              gender_female (0.5 when unknown)
 *   [23..41]          missingness bit per optional lab
 *   [42]              missingness bit for gender
 * </pre>
 * The value block is standardized with a scaler fitted once on the training
 * corpus; vectorizing is a pure function of the record and that scaler.
 */
public final class FeatureVectorizer {

    public static final double HBA1C_MAX = 20.0;
    public static final double FASTING_GLUCOSE_MAX = 1000.0;
    public static final double HAEMOGLOBIN_MAX = 25.0;

    private static final LabField[] LABS = LabField.values();
    private static final int REQUIRED_COUNT = 3;
    private static final int LAB_OFFSET = REQUIRED_COUNT;
    private static final int GENDER_INDEX = LAB_OFFSET + LABS.length;

    public static final int VALUE_COUNT = GENDER_INDEX + 1;
    public static final int SIZE = VALUE_COUNT + LABS.length + 1;

    private static final List<String> VALUE_NAMES = buildValueNames();

    private final FeatureScaler scaler;

    public FeatureVectorizer(FeatureScaler scaler) {
        if (scaler.width() != VALUE_COUNT) {
            throw new IllegalArgumentException("Scaler width " + scaler.width() + " != " + VALUE_COUNT);
        }
        this.scaler = scaler;
    }

    /**
     * Fits the standardization on the given corpus and returns a vectorizer using it.
     */
    public static FeatureVectorizer fit(List<PatientRecord> corpus) {
        List<double[]> rows = new ArrayList<>(corpus.size());
        for (PatientRecord record : corpus) {
            validateRequired(record);
            rows.add(rawValues(record));
        }
        return new FeatureVectorizer(FeatureScaler.fit(rows));
    }

    public FeatureVector vectorize(PatientRecord record) {
        validateRequired(record);
        double[] raw = rawValues(record);
        double[] features = new double[SIZE];
        for (int j = 0; j < VALUE_COUNT; j++) {
            features[j] = scaler.scale(j, raw[j]);
        }
        for (int i = 0; i < LABS.length; i++) {
            features[VALUE_COUNT + i] = usableLab(record, LABS[i]).isPresent() ? 0.0 : 1.0;
        }
        features[SIZE - 1] = genderFemale(record) < 0 ? 1.0 : 0.0;
        return new FeatureVector(features);
    }

    /**
     * Replaces the value of an absent lab with a context-specific raw value.
     * The missingness bit stays set.
     */
    public FeatureVector withImputedLab(FeatureVector vector, LabField field, double rawValue) {
        int index = valueIndex(field);
        return vector.withValue(index, scaler.scale(index, rawValue));
    }

    public static int valueIndex(LabField field) {
        return LAB_OFFSET + field.ordinal();
    }

    public static int missingBitIndex(LabField field) {
        return VALUE_COUNT + field.ordinal();
    }

    /**
     * Missingness bit for a value-block index, or -1 for the always-present required values.
     */
    static int missingBitForValue(int valueIndex) {
        if (valueIndex < LAB_OFFSET) {
            return -1;
        }
        if (valueIndex == GENDER_INDEX) {
            return SIZE - 1;
        }
        return VALUE_COUNT + (valueIndex - LAB_OFFSET);
    }

    /** Field name of each value-block column. */
    public static List<String> valueNames() {
        return VALUE_NAMES;
    }

    static double[] rawValues(PatientRecord record) {
        double[] raw = new double[VALUE_COUNT];
        raw[0] = record.getHba1c();
        raw[1] = record.getFastingGlucose();
        raw[2] = record.getHaemoglobin();
        for (LabField field : LABS) {
            OptionalDouble value = usableLab(record, field);
            raw[valueIndex(field)] = value.isPresent()
                ? value.getAsDouble()
                : field.imputedValue(record.getFastingGlucose());
        }
        double female = genderFemale(record);
        raw[GENDER_INDEX] = female < 0 ? 0.5 : female;
        return raw;
    }

    private static OptionalDouble usableLab(PatientRecord record, LabField field) {
        OptionalDouble value = record.lab(field);
        if (value.isPresent() && !field.isPlausible(value.getAsDouble())) {
            return OptionalDouble.empty();
        }
        return value;
    }

    /** 1 for female, 0 for male, -1 when not usable. */
    private static double genderFemale(PatientRecord record) {
        return record.gender()
            .map(g -> g == Gender.FEMALE ? 1.0 : g == Gender.MALE ? 0.0 : -1.0)
            .orElse(-1.0);
    }

    static void validateRequired(PatientRecord record) {
        List<String> invalid = new ArrayList<>();
        if (!inRange(record.getHba1c(), HBA1C_MAX)) {
            invalid.add("hba1c");
        }
        if (!inRange(record.getFastingGlucose(), FASTING_GLUCOSE_MAX)) {
            invalid.add("fasting_glucose");
        }
        if (!inRange(record.getHaemoglobin(), HAEMOGLOBIN_MAX)) {
            invalid.add("haemoglobin");
        }
        if (!invalid.isEmpty()) {
            throw new InvalidRecordException(
                "Required fields outside physically possible range: " + String.join(", ", invalid), invalid);
        }
    }

    private static boolean inRange(double value, double max) {
        return Double.isFinite(value) && value > 0.0 && value <= max;
    }

    private static List<String> buildValueNames() {
        List<String> names = new ArrayList<>(VALUE_COUNT);
        names.add("hba1c");
        names.add("fasting_glucose");
        names.add("haemoglobin");
        for (LabField field : LABS) {
            names.add(field.getKey());
        }
        names.add("gender");
        return Collections.unmodifiableList(names);
    }
}
