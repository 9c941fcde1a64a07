package com.hba1cvalidation.ml;

/**
 * Conditions that each make an HbA1c result unreliable on their own.
 */
public enum ReliabilityCondition {
    ANOMALOUS_PROFILE,
    SUSPECTED_DISORDER,
    SIGNIFICANT_CORRECTION
}
