package com.sampling.service;

public class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(null);

    private final String errorMessage;

    private ValidationResult(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public static ValidationResult valid() { return VALID; }

    public static ValidationResult error(String message) { return new ValidationResult(message); }

    public boolean isValid() { return errorMessage == null; }

    /** null si es válido. */
    public String errorMessage() { return errorMessage; }
}
