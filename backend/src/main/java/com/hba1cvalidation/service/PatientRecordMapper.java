package com.hba1cvalidation.service;

import com.hba1cvalidation.exception.InvalidRecordException;
import com.hba1cvalidation.model.DisorderCategory;
import com.hba1cvalidation.model.Gender;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.PatientRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a loosely typed JSON payload into a {@link PatientRecord}.
 *
 * Required fields must be present and numeric. Optional fields that cannot be
 * used are dropped and listed on the record instead of failing the request.
 */
@Component
@Slf4j
public class PatientRecordMapper {

    public static final String PATIENT_ID = "patient_id";
    public static final String HBA1C = "hba1c";
    public static final String FASTING_GLUCOSE = "fasting_glucose";
    public static final String HAEMOGLOBIN = "haemoglobin";
    public static final String GENDER = "gender";
    public static final String DISORDER = "disorder";

    public static final List<String> REQUIRED_FIELDS = List.of(PATIENT_ID, HBA1C, FASTING_GLUCOSE, HAEMOGLOBIN);

    public PatientRecord toRecord(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            throw new InvalidRecordException("No patient data provided", REQUIRED_FIELDS);
        }

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (payload.get(field) == null) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw InvalidRecordException.missingFields(missing);
        }

        List<String> nonNumeric = new ArrayList<>();
        Optional<Double> hba1c = toDouble(payload.get(HBA1C));
        Optional<Double> fastingGlucose = toDouble(payload.get(FASTING_GLUCOSE));
        Optional<Double> haemoglobin = toDouble(payload.get(HAEMOGLOBIN));
        if (hba1c.isEmpty()) nonNumeric.add(HBA1C);
        if (fastingGlucose.isEmpty()) nonNumeric.add(FASTING_GLUCOSE);
        if (haemoglobin.isEmpty()) nonNumeric.add(HAEMOGLOBIN);
        if (!nonNumeric.isEmpty()) {
            throw new InvalidRecordException("Required fields must be numeric: " + String.join(", ", nonNumeric),
                nonNumeric);
        }

        PatientRecord.PatientRecordBuilder builder = PatientRecord.builder()
            .patientId(String.valueOf(payload.get(PATIENT_ID)))
            .hba1c(hba1c.get())
            .fastingGlucose(fastingGlucose.get())
            .haemoglobin(haemoglobin.get());

        for (LabField field : LabField.values()) {
            Object raw = payload.get(field.getKey());
            if (raw == null) {
                continue;
            }
            Optional<Double> value = toDouble(raw).filter(field::isPlausible);
            if (value.isPresent()) {
                builder.lab(field, value.get());
            } else {
                log.debug("Ignoring unusable {}={}", field.getKey(), raw);
                builder.ignoredField(field.getKey());
            }
        }

        Object gender = payload.get(GENDER);
        if (gender != null) {
            Gender.fromCode(gender.toString()).ifPresentOrElse(builder::gender, () -> builder.ignoredField(GENDER));
        }
        Object disorder = payload.get(DISORDER);
        if (disorder != null) {
            DisorderCategory.fromCode(disorder.toString())
                .ifPresentOrElse(builder::disorder, () -> builder.ignoredField(DISORDER));
        }
        return builder.build();
    }

    /** Patient id as echoed in responses, also for payloads that fail validation. */
    public static String patientIdOf(Map<String, Object> payload) {
        if (payload == null || payload.get(PATIENT_ID) == null) {
            return "unknown";
        }
        return String.valueOf(payload.get(PATIENT_ID));
    }

    static Optional<Double> toDouble(Object raw) {
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                double value = Double.parseDouble(text.trim());
                return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
