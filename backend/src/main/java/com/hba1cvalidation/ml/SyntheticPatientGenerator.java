package com.hba1cvalidation.ml;

import com.hba1cvalidation.model.DisorderCategory;
import com.hba1cvalidation.model.Gender;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.PatientRecord;
import com.hba1cvalidation.model.TrainingExample;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates labelled synthetic patients with physiologically consistent lab panels.
 *
 * For every example a disorder is drawn from the fixed prevalence of
 * {@link DisorderCategory}, then a lab panel matching that disorder's signature.
 * Glycemia is sampled as mean glucose exposure (eAG); the true HbA1c follows the
 * ADAG relation and the measured HbA1c is biased by the shortened or prolonged
 * red cell lifespan of the disorder.
 */
@Slf4j
public class SyntheticPatientGenerator {

    public static final double DEFAULT_MISSING_RATE = 0.15;

    private static final double ASSAY_NOISE_SD = 0.05;

    private final Long seed;
    private final double missingRate;

    public SyntheticPatientGenerator(long seed) {
        this(seed, DEFAULT_MISSING_RATE);
    }

    public SyntheticPatientGenerator(Long seed, double missingRate) {
        if (missingRate < 0.0 || missingRate >= 1.0) {
            throw new IllegalArgumentException("missingRate must be in [0, 1): " + missingRate);
        }
        this.seed = seed;
        this.missingRate = missingRate;
    }

    /**
     * Unseeded generator, randomized per call.
     */
    public static SyntheticPatientGenerator randomized() {
        return new SyntheticPatientGenerator(null, DEFAULT_MISSING_RATE);
    }

    public List<TrainingExample> generate(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        Random random = seed != null ? new Random(seed) : new Random();
        List<TrainingExample> examples = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            examples.add(generateOne(random, "SYN-" + (i + 1)));
        }
        log.debug("Generated {} synthetic patients (seeded: {})", count, seed != null);
        return examples;
    }

    private TrainingExample generateOne(Random random, String patientId) {
        DisorderCategory label = sampleCategory(random);
        Gender gender = random.nextBoolean() ? Gender.FEMALE : Gender.MALE;
        boolean female = gender == Gender.FEMALE;

        Map<LabField, Double> labs = new EnumMap<>(LabField.class);
        double haemoglobin = sampleHaematology(random, label, female, labs);
        sampleIronStudies(random, label, labs);
        sampleHemolysisMarkers(random, label, labs);
        labs.put(LabField.AGE, uniform(random, 20, 80));

        double lifespan = sampleLifespan(random, label);
        labs.put(LabField.RBC_LIFESPAN_DAYS, lifespan);

        // Glycemia
        double eag = clamp(normal(random, 135, 35), 70, 350);
        double trueHba1c = (eag + 46.7) / 28.7;
        double fasting = Math.max(50, eag * 0.85 + normal(random, 0, 6));
        labs.put(LabField.RANDOM_GLUCOSE, Math.max(50, eag * 1.05 + normal(random, 0, 12)));
        labs.put(LabField.OGTT_2HR, Math.max(50, eag * 1.25 + normal(random, 0, 15)));
        labs.put(LabField.AVG_GLUCOSE_CGM, Math.max(50, eag + normal(random, 0, 5)));

        double shortening = (DisorderCategory.NORMAL_RBC_LIFESPAN_DAYS - lifespan)
            / DisorderCategory.NORMAL_RBC_LIFESPAN_DAYS;
        double measured = trueHba1c * (1.0 + label.getHba1cBiasFactor() * shortening)
            + normal(random, 0, ASSAY_NOISE_SD);
        measured = clamp(measured, 3.5, 19.5);

        PatientRecord.PatientRecordBuilder record = PatientRecord.builder()
            .patientId(patientId)
            .hba1c(measured)
            .fastingGlucose(fasting)
            .haemoglobin(haemoglobin)
            .disorder(label);
        if (random.nextDouble() >= missingRate) {
            record.gender(gender);
        }
        for (Map.Entry<LabField, Double> lab : labs.entrySet()) {
            if (random.nextDouble() >= missingRate) {
                record.lab(lab.getKey(), lab.getValue());
            }
        }

        return TrainingExample.builder()
            .record(record.build())
            .label(label)
            .trueHba1c(trueHba1c)
            .build();
    }

    private static DisorderCategory sampleCategory(Random random) {
        double u = random.nextDouble();
        double cumulative = 0.0;
        for (DisorderCategory category : DisorderCategory.values()) {
            cumulative += category.getPrevalence();
            if (u < cumulative) {
                return category;
            }
        }
        return DisorderCategory.NONE;
    }

    /**
     * Red cell indices and counts. Returns haemoglobin.
     */
    private static double sampleHaematology(Random random, DisorderCategory label, boolean female,
                                            Map<LabField, Double> labs) {
        double hb;
        switch (label) {
            case IRON_DEFICIENCY -> {
                hb = normal(random, female ? 10.0 : 11.0, 1.0);
                labs.put(LabField.RBC_COUNT, normal(random, 4.2, 0.35));
                labs.put(LabField.MCV, normal(random, 74, 4));
                labs.put(LabField.MCH, normal(random, 24, 2));
                labs.put(LabField.MCHC, normal(random, 31, 1.0));
                labs.put(LabField.RETICULOCYTE_COUNT, normal(random, 0.8, 0.3));
                labs.put(LabField.WBC_COUNT, normal(random, 7, 1.5));
                labs.put(LabField.PLATELET_COUNT, normal(random, 330, 60));
            }
            case THALASSEMIA -> {
                hb = normal(random, female ? 10.3 : 10.8, 1.0);
                labs.put(LabField.RBC_COUNT, normal(random, 5.6, 0.4));
                labs.put(LabField.MCV, normal(random, 64, 4));
                labs.put(LabField.MCH, normal(random, 20, 1.5));
                labs.put(LabField.MCHC, normal(random, 31.5, 1.0));
                labs.put(LabField.RETICULOCYTE_COUNT, normal(random, 2.5, 0.7));
                labs.put(LabField.WBC_COUNT, normal(random, 7, 1.5));
                labs.put(LabField.PLATELET_COUNT, normal(random, 260, 50));
            }
            case SICKLE_CELL -> {
                hb = normal(random, 8.5, 1.0);
                labs.put(LabField.RBC_COUNT, normal(random, 3.0, 0.4));
                labs.put(LabField.MCV, normal(random, 88, 5));
                labs.put(LabField.MCH, normal(random, 29, 2));
                labs.put(LabField.MCHC, normal(random, 34, 1.0));
                labs.put(LabField.RETICULOCYTE_COUNT, normal(random, 10, 3));
                labs.put(LabField.WBC_COUNT, normal(random, 11, 2.5));
                labs.put(LabField.PLATELET_COUNT, normal(random, 380, 70));
            }
            case G6PD -> {
                hb = normal(random, female ? 10.8 : 11.5, 1.2);
                labs.put(LabField.RBC_COUNT, normal(random, 3.9, 0.4));
                labs.put(LabField.MCV, normal(random, 92, 4));
                labs.put(LabField.MCH, normal(random, 31, 1.5));
                labs.put(LabField.MCHC, normal(random, 34, 0.8));
                labs.put(LabField.RETICULOCYTE_COUNT, normal(random, 5, 1.5));
                labs.put(LabField.WBC_COUNT, normal(random, 8, 1.8));
                labs.put(LabField.PLATELET_COUNT, normal(random, 270, 55));
            }
            default -> {
                hb = normal(random, female ? 13.5 : 15.0, female ? 0.9 : 1.0);
                labs.put(LabField.RBC_COUNT, normal(random, female ? 4.5 : 5.0, female ? 0.3 : 0.35));
                labs.put(LabField.MCV, normal(random, 90, 4));
                labs.put(LabField.MCH, normal(random, 30, 1.5));
                labs.put(LabField.MCHC, normal(random, 34, 0.8));
                labs.put(LabField.RETICULOCYTE_COUNT, normal(random, 1.0, 0.3));
                labs.put(LabField.WBC_COUNT, normal(random, 7, 1.5));
                labs.put(LabField.PLATELET_COUNT, normal(random, 250, 50));
            }
        }
        floor(labs, LabField.RETICULOCYTE_COUNT, 0.2);
        floor(labs, LabField.WBC_COUNT, 2.0);
        floor(labs, LabField.PLATELET_COUNT, 50);
        floor(labs, LabField.RBC_COUNT, 1.5);
        return clamp(hb, 4.0, 19.0);
    }

    private static void sampleIronStudies(Random random, DisorderCategory label, Map<LabField, Double> labs) {
        switch (label) {
            case IRON_DEFICIENCY -> {
                labs.put(LabField.SERUM_IRON, normal(random, 35, 10));
                labs.put(LabField.FERRITIN, clamp(logNormal(random, 10, 0.4), 2, 30));
                labs.put(LabField.TRANSFERRIN_SATURATION, normal(random, 10, 3));
                labs.put(LabField.TIBC, normal(random, 430, 40));
            }
            case THALASSEMIA -> {
                labs.put(LabField.SERUM_IRON, normal(random, 110, 25));
                labs.put(LabField.FERRITIN, logNormal(random, 150, 0.5));
                labs.put(LabField.TRANSFERRIN_SATURATION, normal(random, 35, 8));
                labs.put(LabField.TIBC, normal(random, 300, 35));
            }
            case SICKLE_CELL -> {
                labs.put(LabField.SERUM_IRON, normal(random, 90, 25));
                labs.put(LabField.FERRITIN, logNormal(random, 250, 0.6));
                labs.put(LabField.TRANSFERRIN_SATURATION, normal(random, 32, 8));
                labs.put(LabField.TIBC, normal(random, 290, 35));
            }
            case G6PD -> {
                labs.put(LabField.SERUM_IRON, normal(random, 105, 25));
                labs.put(LabField.FERRITIN, logNormal(random, 160, 0.5));
                labs.put(LabField.TRANSFERRIN_SATURATION, normal(random, 33, 8));
                labs.put(LabField.TIBC, normal(random, 310, 35));
            }
            default -> {
                labs.put(LabField.SERUM_IRON, normal(random, 100, 20));
                labs.put(LabField.FERRITIN, logNormal(random, 100, 0.45));
                labs.put(LabField.TRANSFERRIN_SATURATION, normal(random, 30, 6));
                labs.put(LabField.TIBC, normal(random, 320, 35));
            }
        }
        floor(labs, LabField.SERUM_IRON, 5);
        labs.put(LabField.TRANSFERRIN_SATURATION, clamp(labs.get(LabField.TRANSFERRIN_SATURATION), 2, 95));
        floor(labs, LabField.TIBC, 150);
    }

    private static void sampleHemolysisMarkers(Random random, DisorderCategory label, Map<LabField, Double> labs) {
        switch (label) {
            case THALASSEMIA -> {
                labs.put(LabField.BILIRUBIN, normal(random, 1.4, 0.4));
                labs.put(LabField.LDH, normal(random, 230, 40));
                labs.put(LabField.HAPTOGLOBIN, normal(random, 70, 25));
            }
            case SICKLE_CELL -> {
                labs.put(LabField.BILIRUBIN, normal(random, 3.0, 0.8));
                labs.put(LabField.LDH, normal(random, 450, 90));
                labs.put(LabField.HAPTOGLOBIN, normal(random, 20, 10));
            }
            case G6PD -> {
                labs.put(LabField.BILIRUBIN, normal(random, 2.2, 0.6));
                labs.put(LabField.LDH, normal(random, 350, 70));
                labs.put(LabField.HAPTOGLOBIN, normal(random, 40, 15));
            }
            case IRON_DEFICIENCY -> {
                labs.put(LabField.BILIRUBIN, normal(random, 0.6, 0.2));
                labs.put(LabField.LDH, normal(random, 165, 25));
                labs.put(LabField.HAPTOGLOBIN, normal(random, 120, 30));
            }
            default -> {
                labs.put(LabField.BILIRUBIN, normal(random, 0.7, 0.2));
                labs.put(LabField.LDH, normal(random, 170, 25));
                labs.put(LabField.HAPTOGLOBIN, normal(random, 120, 30));
            }
        }
        floor(labs, LabField.BILIRUBIN, 0.1);
        floor(labs, LabField.LDH, 60);
        floor(labs, LabField.HAPTOGLOBIN, 1);
    }

    private static double sampleLifespan(Random random, DisorderCategory label) {
        return switch (label) {
            case IRON_DEFICIENCY -> clamp(normal(random, 105, 8), 88, 122);
            case THALASSEMIA -> clamp(normal(random, 85, 8), 60, 105);
            case SICKLE_CELL -> clamp(normal(random, 45, 10), 15, 70);
            case G6PD -> clamp(normal(random, 70, 10), 40, 95);
            default -> clamp(normal(random, 120, 5), 105, 135);
        };
    }

    private static double normal(Random random, double mean, double sd) {
        return mean + sd * random.nextGaussian();
    }

    private static double logNormal(Random random, double median, double sigma) {
        return median * Math.exp(sigma * random.nextGaussian());
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static void floor(Map<LabField, Double> labs, LabField field, double min) {
        labs.computeIfPresent(field, (k, v) -> Math.max(min, v));
    }
}
