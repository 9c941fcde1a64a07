package com.hba1cvalidation.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of blood-disorder categories.
 *
 * Declaration order is the tie-break priority used by the classifier: the most
 * prevalent category wins a tie, so NONE beats every disorder.
 */
public enum DisorderCategory {

    NONE("none", 0.50, 120.0, 0.0),
    IRON_DEFICIENCY("iron_deficiency", 0.20, 105.0, 0.4),
    THALASSEMIA("thalassemia", 0.10, 85.0, -0.5),
    SICKLE_CELL("sickle_cell", 0.10, 45.0, -0.5),
    G6PD("g6pd", 0.10, 70.0, -0.5);

    public static final double NORMAL_RBC_LIFESPAN_DAYS = 120.0;

    private final String code;
    private final double prevalence;
    private final double typicalLifespanDays;
    private final double hba1cBiasFactor;

    DisorderCategory(String code, double prevalence, double typicalLifespanDays, double hba1cBiasFactor) {
        this.code = code;
        this.prevalence = prevalence;
        this.typicalLifespanDays = typicalLifespanDays;
        this.hba1cBiasFactor = hba1cBiasFactor;
    }

    public String getCode() { return code; }

    /** Share of this category in the synthetic training corpus. */
    public double getPrevalence() { return prevalence; }

    public double getTypicalLifespanDays() { return typicalLifespanDays; }

    /**
     * Relative HbA1c bias per unit of fractional lifespan shortening. Positive
     * means the measured value over-reads, negative means it under-reads.
     */
    public double getHba1cBiasFactor() { return hba1cBiasFactor; }

    public boolean isDisorder() {
        return this != NONE;
    }

    public static List<String> codes() {
        return Arrays.stream(values()).map(DisorderCategory::getCode).toList();
    }

    public static Optional<DisorderCategory> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(c -> c.code.equals(normalized))
            .findFirst();
    }
}
