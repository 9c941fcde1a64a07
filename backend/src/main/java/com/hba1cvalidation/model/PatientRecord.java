package com.hba1cvalidation.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A single patient's lab panel around one HbA1c measurement.
 *
 * Required values are primitives. Optional labs, gender and the training label
 * are only reachable through Optional accessors so every consumer has to decide
 * what absence means.
 */
@Value
@Builder(toBuilder = true)
public class PatientRecord {

    String patientId;

    double hba1c;

    double fastingGlucose;

    double haemoglobin;

    @Getter(AccessLevel.NONE)
    @Singular("lab")
    Map<LabField, Double> labs;

    @Getter(AccessLevel.NONE)
    Gender gender;

    // Training label only, never used as ground truth at inference
    @Getter(AccessLevel.NONE)
    DisorderCategory disorder;

    /** Optional fields that were supplied but unusable and therefore treated as absent. */
    @Singular
    List<String> ignoredFields;

    public OptionalDouble lab(LabField field) {
        Double value = labs.get(field);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean hasLab(LabField field) {
        return labs.containsKey(field);
    }

    public int presentLabCount() {
        return labs.size();
    }

    public Optional<Gender> gender() {
        return Optional.ofNullable(gender);
    }

    public Optional<DisorderCategory> disorder() {
        return Optional.ofNullable(disorder);
    }
}
