package com.hba1cvalidation.ml;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Hba1cCorrection {

    public enum LifespanSource {
        OBSERVED,
        PREDICTED_DISORDER,
        POPULATION_DEFAULT
    }

    /** The value as reported by the lab, never altered. */
    double reportedHba1c;

    double correctedHba1c;

    /** corrected - reported */
    double delta;

    double rbcLifespanDays;

    LifespanSource lifespanSource;

    String rationale;
}
