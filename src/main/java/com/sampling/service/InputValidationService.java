package com.sampling.service;

import com.sampling.model.CalculatorInput;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Validación de campos de entrada. El motor de cálculo asume que todo lo que
 * recibe ya pasó por aquí.
 */
public final class InputValidationService {

    public static final String FIELD_FOCAL = "baseFocalLength";
    public static final String FIELD_APERTURE = "apertureDiameter";
    public static final String FIELD_REDUCER = "reducerFactor";
    public static final String FIELD_BARLOW = "barlowFactor";
    public static final String FIELD_PIXEL = "pixelSize";
    public static final String FIELD_SENSOR_WIDTH = "sensorWidthPx";
    public static final String FIELD_SENSOR_HEIGHT = "sensorHeightPx";
    public static final String FIELD_BINNING = "binning";
    public static final String FIELD_SEEING = "seeing";

    private static final String NOT_A_NUMBER = "Must be a number.";
    private static final String NOT_POSITIVE = "Must be greater than 0.";

    private InputValidationService() {}

    public static ValidationResult validateFocalLength(double value) {
        if (!Double.isFinite(value)) return ValidationResult.error(NOT_A_NUMBER);
        if (value <= 0) return ValidationResult.error(NOT_POSITIVE);
        if (value > 50000) return ValidationResult.error("Value seems unreasonably large (max 50 000 mm).");
        return ValidationResult.valid();
    }

    // Campo opcional: vacío es válido
    public static ValidationResult validateAperture(OptionalDouble value) {
        if (value.isEmpty()) return ValidationResult.valid();
        double v = value.getAsDouble();
        if (!Double.isFinite(v)) return ValidationResult.error(NOT_A_NUMBER);
        if (v <= 0) return ValidationResult.error(NOT_POSITIVE);
        if (v > 10000) return ValidationResult.error("Value seems unreasonably large (max 10 000 mm).");
        return ValidationResult.valid();
    }

    public static ValidationResult validateReducerFactor(double value) {
        if (!Double.isFinite(value)) return ValidationResult.error(NOT_A_NUMBER);
        if (value < 0.1) return ValidationResult.error("Minimum is 0.1×.");
        if (value > 1.0) return ValidationResult.error("Reducer factor must be ≤ 1.0× (use Barlow for magnification).");
        return ValidationResult.valid();
    }

    public static ValidationResult validateBarlowFactor(double value) {
        if (!Double.isFinite(value)) return ValidationResult.error(NOT_A_NUMBER);
        if (value < 1.0) return ValidationResult.error("Barlow factor must be ≥ 1.0× (use Reducer for reduction).");
        if (value > 5.0) return ValidationResult.error("Maximum is 5.0×.");
        return ValidationResult.valid();
    }

    public static ValidationResult validatePixelSize(double value) {
        if (!Double.isFinite(value)) return ValidationResult.error(NOT_A_NUMBER);
        if (value <= 0) return ValidationResult.error(NOT_POSITIVE);
        if (value > 50) return ValidationResult.error("Value seems unreasonably large (max 50 µm).");
        return ValidationResult.valid();
    }

    public static ValidationResult validateSensorDimension(int value) {
        if (value <= 0) return ValidationResult.error(NOT_POSITIVE);
        if (value > 100000) return ValidationResult.error("Value seems unreasonably large.");
        return ValidationResult.valid();
    }

    public static ValidationResult validateBinning(int value) {
        if (value < 1 || value > 4) return ValidationResult.error("Binning must be 1, 2, 3 or 4.");
        return ValidationResult.valid();
    }

    public static ValidationResult validateSeeing(double value) {
        if (!Double.isFinite(value)) return ValidationResult.error(NOT_A_NUMBER);
        if (value <= 0) return ValidationResult.error(NOT_POSITIVE);
        if (value > 20) return ValidationResult.error("Value seems unreasonably large (max 20″).");
        return ValidationResult.valid();
    }

    /**
     * Valida la entrada completa.
     *
     * @return campo -> mensaje de error, solo para los campos inválidos (vacío si todo está bien)
     */
    public static Map<String, String> validate(CalculatorInput input) {
        Map<String, String> errors = new LinkedHashMap<>();
        put(errors, FIELD_FOCAL, validateFocalLength(input.baseFocalLength));
        put(errors, FIELD_APERTURE, validateAperture(input.apertureDiameter()));
        put(errors, FIELD_REDUCER, validateReducerFactor(input.reducerFactor));
        put(errors, FIELD_BARLOW, validateBarlowFactor(input.barlowFactor));
        put(errors, FIELD_PIXEL, validatePixelSize(input.pixelSize));
        put(errors, FIELD_SENSOR_WIDTH, validateSensorDimension(input.sensorWidthPx));
        put(errors, FIELD_SENSOR_HEIGHT, validateSensorDimension(input.sensorHeightPx));
        put(errors, FIELD_BINNING, validateBinning(input.binning));
        put(errors, FIELD_SEEING, validateSeeing(input.seeing));
        return errors;
    }

    private static void put(Map<String, String> errors, String field, ValidationResult r) {
        if (!r.isValid()) errors.put(field, r.errorMessage());
    }

    // --- PARSEO DE TEXTO (UI) ---

    /** Acepta punto o coma decimal. Vacío si el texto no es un número. */
    public static OptionalDouble parseDouble(String text) {
        if (text == null || text.trim().isEmpty()) return OptionalDouble.empty();
        try {
            return OptionalDouble.of(Double.parseDouble(text.trim().replace(',', '.')));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public static OptionalInt parseInt(String text) {
        if (text == null || text.trim().isEmpty()) return OptionalInt.empty();
        try {
            return OptionalInt.of(Integer.parseInt(text.trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
