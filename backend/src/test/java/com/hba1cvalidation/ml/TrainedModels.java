package com.hba1cvalidation.ml;

import java.util.List;

import com.hba1cvalidation.model.Gender;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.PatientRecord;
import com.hba1cvalidation.model.TrainingExample;

/**
 * Shared seeded corpus and model suite, trained once per test JVM.
 */
public final class TrainedModels {

    public static final long SEED = 42L;
    public static final int TRAINING_SIZE = 1000;

    private static List<TrainingExample> corpus;
    private static ClinicalDecisionSupport decisionSupport;

    private TrainedModels() {
    }

    public static synchronized List<TrainingExample> corpus() {
        if (corpus == null) {
            corpus = new SyntheticPatientGenerator(SEED).generate(TRAINING_SIZE);
        }
        return corpus;
    }

    public static synchronized ClinicalDecisionSupport decisionSupport() {
        if (decisionSupport == null) {
            ClinicalDecisionSupport cds = new ClinicalDecisionSupport(
                    ModelHyperparameters.defaults(), ReliabilityThresholds.defaults());
            cds.initializeModels(corpus());
            decisionSupport = cds;
        }
        return decisionSupport;
    }

    public static ModelSuite suite() {
        return decisionSupport().currentSuite().orElseThrow();
    }

    /**
     * The documented example: microcytic, iron-depleted, short RBC lifespan.
     */
    public static PatientRecord ironDeficiencyRecord() {
        return PatientRecord.builder()
                .patientId("P12345")
                .hba1c(7.2)
                .fastingGlucose(120)
                .haemoglobin(9.5)
                .lab(LabField.RANDOM_GLUCOSE, 140.0)
                .lab(LabField.OGTT_2HR, 160.0)
                .lab(LabField.AVG_GLUCOSE_CGM, 125.0)
                .lab(LabField.RBC_COUNT, 4.2)
                .lab(LabField.MCV, 75.0)
                .lab(LabField.MCH, 25.0)
                .lab(LabField.MCHC, 32.0)
                .lab(LabField.RETICULOCYTE_COUNT, 0.8)
                .lab(LabField.WBC_COUNT, 6.5)
                .lab(LabField.PLATELET_COUNT, 280.0)
                .lab(LabField.SERUM_IRON, 30.0)
                .lab(LabField.FERRITIN, 12.0)
                .lab(LabField.TRANSFERRIN_SATURATION, 15.0)
                .lab(LabField.TIBC, 450.0)
                .lab(LabField.BILIRUBIN, 0.6)
                .lab(LabField.LDH, 140.0)
                .lab(LabField.HAPTOGLOBIN, 100.0)
                .lab(LabField.AGE, 35.0)
                .lab(LabField.RBC_LIFESPAN_DAYS, 90.0)
                .gender(Gender.FEMALE)
                .build();
    }

    /**
     * The minimal iron deficiency presentation: required fields plus ferritin, MCV and lifespan.
     */
    public static PatientRecord sparseIronDeficiencyRecord() {
        return PatientRecord.builder()
                .patientId("P12345")
                .hba1c(7.2)
                .fastingGlucose(120)
                .haemoglobin(9.5)
                .lab(LabField.FERRITIN, 12.0)
                .lab(LabField.MCV, 75.0)
                .lab(LabField.RBC_LIFESPAN_DAYS, 90.0)
                .build();
    }

    /**
     * A full panel with every lab at its population-typical value and consistent glycemia.
     */
    public static PatientRecord typicalNormalRecord() {
        PatientRecord.PatientRecordBuilder builder = PatientRecord.builder()
                .patientId("N00001")
                .hba1c(5.6)
                .fastingGlucose(97)
                .haemoglobin(14.2)
                .gender(Gender.FEMALE);
        for (LabField field : LabField.values()) {
            builder.lab(field, field.imputedValue(97));
        }
        return builder.lab(LabField.AGE, 45.0).build();
    }

    /**
     * Florid hemolysis far outside anything seen in training.
     */
    public static PatientRecord extremeHemolysisRecord() {
        return typicalNormalRecord().toBuilder()
                .patientId("X99999")
                .haemoglobin(5.0)
                .lab(LabField.LDH, 3000.0)
                .lab(LabField.BILIRUBIN, 20.0)
                .lab(LabField.HAPTOGLOBIN, 1.0)
                .lab(LabField.RETICULOCYTE_COUNT, 35.0)
                .build();
    }
}
