package com.hba1cvalidation.ml;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReliabilityVerdict {

    boolean reliable;

    @Singular
    List<ReliabilityCondition> violations;

    /** One line per violated condition with the values that violated it. */
    @Singular("reason")
    List<String> reasoning;

    public boolean violates(ReliabilityCondition condition) {
        return violations.contains(condition);
    }
}
