package com.hba1cvalidation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Labelled synthetic example consumed once when the models are fitted.
 */
@Value
@Builder
public class TrainingExample {

    PatientRecord record;

    DisorderCategory label;

    /** HbA1c implied by the patient's actual mean glucose exposure. */
    double trueHba1c;

    /**
     * Amount that must be added to the measured HbA1c to recover the true value.
     */
    public double correctionResidual() {
        return trueHba1c - record.getHba1c();
    }
}
