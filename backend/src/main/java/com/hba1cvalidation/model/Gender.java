package com.hba1cvalidation.model;

import java.util.Locale;
import java.util.Optional;

public enum Gender {
    MALE,
    FEMALE,
    OTHER,
    UNKNOWN;

    public static Optional<Gender> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "M", "MALE" -> Optional.of(MALE);
            case "F", "FEMALE" -> Optional.of(FEMALE);
            case "O", "OTHER" -> Optional.of(OTHER);
            case "U", "UNKNOWN" -> Optional.of(UNKNOWN);
            default -> Optional.empty();
        };
    }
}
