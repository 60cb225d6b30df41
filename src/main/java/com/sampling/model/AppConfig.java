package com.sampling.model;

import java.util.prefs.Preferences;

/**
 * Preferencias de usuario (java.util.prefs): último equipo usado, última carpeta FITS
 * y el nodo donde se guardan los presets.
 */
public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Último equipo
    private static final String KEY_FOCAL = "focal_length";
    private static final String KEY_APERTURE = "aperture";          // "" = sin apertura
    private static final String KEY_REDUCER = "reducer_factor";
    private static final String KEY_BARLOW = "barlow_factor";
    private static final String KEY_PIXEL = "pixel_size";
    private static final String KEY_SENSOR_W = "sensor_width";
    private static final String KEY_SENSOR_H = "sensor_height";
    private static final String KEY_BINNING = "binning";
    private static final String KEY_SEEING = "seeing";
    private static final String KEY_CAMERA = "camera_name";

    private static final String KEY_FITS_DIR = "last_fits_dir";
    private static final String KEY_BASE_URL = "share_base_url";

    private static final String PRESETS_NODE = "presets";

    public static Preferences presetsNode() { return prefs.node(PRESETS_NODE); }

    // --- ÚLTIMO EQUIPO ---
    public static CalculatorInput getLastInput() {
        CalculatorInput d = CalculatorInput.defaults();
        String ap = prefs.get(KEY_APERTURE, String.valueOf(d.apertureDiameter().getAsDouble()));
        Double aperture;
        try {
            aperture = ap.isEmpty() ? null : Double.valueOf(ap);
        } catch (NumberFormatException e) {
            aperture = d.apertureDiameter().getAsDouble();
        }
        String camera = prefs.get(KEY_CAMERA, "");
        return new CalculatorInput(
                prefs.getDouble(KEY_FOCAL, d.baseFocalLength),
                aperture,
                prefs.getDouble(KEY_REDUCER, d.reducerFactor),
                prefs.getDouble(KEY_BARLOW, d.barlowFactor),
                prefs.getDouble(KEY_PIXEL, d.pixelSize),
                prefs.getInt(KEY_SENSOR_W, d.sensorWidthPx),
                prefs.getInt(KEY_SENSOR_H, d.sensorHeightPx),
                prefs.getInt(KEY_BINNING, d.binning),
                prefs.getDouble(KEY_SEEING, d.seeing),
                camera.isEmpty() ? null : camera);
    }

    public static void setLastInput(CalculatorInput in) {
        prefs.putDouble(KEY_FOCAL, in.baseFocalLength);
        prefs.put(KEY_APERTURE, in.hasAperture() ? String.valueOf(in.apertureDiameter().getAsDouble()) : "");
        prefs.putDouble(KEY_REDUCER, in.reducerFactor);
        prefs.putDouble(KEY_BARLOW, in.barlowFactor);
        prefs.putDouble(KEY_PIXEL, in.pixelSize);
        prefs.putInt(KEY_SENSOR_W, in.sensorWidthPx);
        prefs.putInt(KEY_SENSOR_H, in.sensorHeightPx);
        prefs.putInt(KEY_BINNING, in.binning);
        prefs.putDouble(KEY_SEEING, in.seeing);
        prefs.put(KEY_CAMERA, in.cameraName == null ? "" : in.cameraName);
    }

    // --- VARIOS ---
    public static String getLastFitsDir() { return prefs.get(KEY_FITS_DIR, System.getProperty("user.home")); }
    public static void setLastFitsDir(String v) { prefs.put(KEY_FITS_DIR, v); }

    public static String getShareBaseUrl() { return prefs.get(KEY_BASE_URL, "https://sampling.example.org/"); }
    public static void setShareBaseUrl(String v) { prefs.put(KEY_BASE_URL, v); }
}
