package com.sampling.service;

import com.sampling.model.CalculatorInput;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codifica / decodifica el estado de la calculadora en un query string compacto
 * (?fl=1000&px=2.4&bin=2...). Solo se escriben los valores distintos del equipo por defecto.
 */
public final class UrlStateService {

    private static final Logger log = LoggerFactory.getLogger(UrlStateService.class);

    // Claves cortas
    private static final String KEY_FOCAL = "fl";
    private static final String KEY_APERTURE = "ap";
    private static final String KEY_REDUCER = "rd";
    private static final String KEY_BARLOW = "bl";
    private static final String KEY_PIXEL = "px";
    private static final String KEY_SENSOR_W = "sw";
    private static final String KEY_SENSOR_H = "sh";
    private static final String KEY_BINNING = "bin";
    private static final String KEY_SEEING = "see";
    private static final String KEY_COMPARE = "cmp";

    // El setup B usa las mismas claves con prefijo "b"
    private static final String PREFIX_B = "b";


    private UrlStateService() {}

    public static String encodeState(CalculatorInput inputA) {
        return encodeState(inputA, null, false);
    }

    public static String encodeState(CalculatorInput inputA, CalculatorInput inputB, boolean compareMode) {
        List<String> params = new ArrayList<>();
        addSetup(params, "", inputA);

        if (compareMode) {
            params.add(KEY_COMPARE + "=1");
            if (inputB != null) addSetup(params, PREFIX_B, inputB);
        }
        return params.isEmpty() ? "" : "?" + String.join("&", params);
    }

    /** Decodifica un query string. Parámetros inválidos o fuera de rango se quedan con el valor por defecto. */
    public static UrlState decodeState(String queryString) {
        CalculatorInput inputA = CalculatorInput.defaults();
        CalculatorInput inputB = CalculatorInput.defaults();

        if (queryString == null || queryString.trim().isEmpty()) {
            return new UrlState(inputA, inputB, false);
        }

        Map<String, String> params = parseQuery(queryString.trim());
        inputA = readSetup(params, "", inputA);

        boolean compareMode = "1".equals(params.get(KEY_COMPARE));
        if (compareMode) {
            // B parte de los valores por defecto, no de una copia de A
            inputB = readSetup(params, PREFIX_B, inputB);
        }
        log.debug("URL decodificada: A={} B={} cmp={}", inputA, inputB, compareMode);
        return new UrlState(inputA, inputB, compareMode);
    }

    /** URL compartible: base sin query ni fragmento + estado codificado. */
    public static String buildShareableUrl(String baseUrl, CalculatorInput inputA, CalculatorInput inputB, boolean compareMode) {
        URI uri = URI.create(baseUrl);
        String basePath = uri.getScheme() + "://" + uri.getRawAuthority() + (uri.getRawPath() == null ? "" : uri.getRawPath());
        return basePath + encodeState(inputA, inputB, compareMode);
    }

    /** Parte de query de una URL pegada por el usuario, sin fragmento. Vacío si no tiene. */
    public static String queryOf(String url) {
        if (url == null) return "";
        String u = url.trim();
        int hash = u.indexOf('#');
        if (hash >= 0) u = u.substring(0, hash);
        int q = u.indexOf('?');
        return q < 0 ? "" : u.substring(q);
    }

    // --- ESCRITURA ---

    private static void addSetup(List<String> params, String prefix, CalculatorInput in) {
        CalculatorInput def = CalculatorInput.defaults();
        addIfNotDefault(params, prefix + KEY_FOCAL, in.baseFocalLength, def.baseFocalLength);
        addApertureIfNotDefault(params, prefix + KEY_APERTURE, in.hasAperture() ? in.apertureDiameter().getAsDouble() : null,
                def.hasAperture() ? def.apertureDiameter().getAsDouble() : null);
        addIfNotDefault(params, prefix + KEY_REDUCER, in.reducerFactor, def.reducerFactor);
        addIfNotDefault(params, prefix + KEY_BARLOW, in.barlowFactor, def.barlowFactor);
        addIfNotDefault(params, prefix + KEY_PIXEL, in.pixelSize, def.pixelSize);
        addIfNotDefault(params, prefix + KEY_SENSOR_W, in.sensorWidthPx, def.sensorWidthPx);
        addIfNotDefault(params, prefix + KEY_SENSOR_H, in.sensorHeightPx, def.sensorHeightPx);
        addIfNotDefault(params, prefix + KEY_BINNING, in.binning, def.binning);
        addIfNotDefault(params, prefix + KEY_SEEING, in.seeing, def.seeing);
    }

    private static void addIfNotDefault(List<String> params, String key, double value, double defaultValue) {
        if (Math.abs(value - defaultValue) > CalculatorInput.EPSILON) params.add(key + "=" + format(value));
    }

    private static void addIfNotDefault(List<String> params, String key, int value, int defaultValue) {
        if (value != defaultValue) params.add(key + "=" + value);
    }

    // "ap=" vacío significa "sin apertura"
    private static void addApertureIfNotDefault(List<String> params, String key, Double value, Double defaultValue) {
        if (Objects.equals(value, defaultValue)) return;
        params.add(key + "=" + (value == null ? "" : format(value)));
    }

    // Siempre con punto decimal y sin ".0" sobrante, independiente del Locale
    static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    // --- LECTURA ---

    private static CalculatorInput readSetup(Map<String, String> p, String prefix, CalculatorInput in) {
        return in.withBaseFocalLength(parseDouble(p.get(prefix + KEY_FOCAL), in.baseFocalLength, 1, 100000))
                .withApertureDiameter(parseAperture(p, prefix + KEY_APERTURE, in))
                .withReducerFactor(parseDouble(p.get(prefix + KEY_REDUCER), in.reducerFactor, 0.1, 10))
                .withBarlowFactor(parseDouble(p.get(prefix + KEY_BARLOW), in.barlowFactor, 0.1, 10))
                .withPixelSize(parseDouble(p.get(prefix + KEY_PIXEL), in.pixelSize, 0.1, 100))
                .withSensorSize(parseInt(p.get(prefix + KEY_SENSOR_W), in.sensorWidthPx, 1, 100000),
                        parseInt(p.get(prefix + KEY_SENSOR_H), in.sensorHeightPx, 1, 100000))
                .withBinning(parseInt(p.get(prefix + KEY_BINNING), in.binning, 1, 4))
                .withSeeing(parseDouble(p.get(prefix + KEY_SEEING), in.seeing, 0.1, 20));
    }

    private static Map<String, String> parseQuery(String query) {
        if (query.startsWith("?")) query = query.substring(1);
        Map<String, String> params = new HashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            params.putIfAbsent(key, value); // la primera aparición gana
        }
        return params;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    private static double parseDouble(String value, double defaultValue, double min, double max) {
        if (value == null || value.trim().isEmpty()) return defaultValue;
        try {
            double v = Double.parseDouble(value.trim());
            if (v >= min && v <= max) return v;
        } catch (NumberFormatException e) {
            log.debug("Valor decimal inválido en URL: '{}'", value);
        }
        return defaultValue;
    }

    // Ausente -> se mantiene; presente y vacío -> sin apertura
    private static Double parseAperture(Map<String, String> p, String key, CalculatorInput in) {
        Double current = in.hasAperture() ? in.apertureDiameter().getAsDouble() : null;
        String value = p.get(key);
        if (value == null) return current;
        if (value.isEmpty()) return null;
        try {
            double v = Double.parseDouble(value.trim());
            if (v >= 1 && v <= 10000) return v;
        } catch (NumberFormatException e) {
            log.debug("Apertura inválida en URL: '{}'", value);
        }
        return current;
    }

    private static int parseInt(String value, int defaultValue, int min, int max) {
        if (value == null || value.trim().isEmpty()) return defaultValue;
        try {
            int v = Integer.parseInt(value.trim());
            if (v >= min && v <= max) return v;
        } catch (NumberFormatException e) {
            log.debug("Entero inválido en URL: '{}'", value);
        }
        return defaultValue;
    }
}
