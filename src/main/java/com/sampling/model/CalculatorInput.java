package com.sampling.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Una configuración de equipo (telescopio + cámara + seeing).
 * Inmutable: las variantes se crean con los métodos {@code withX}.
 */
public final class CalculatorInput {

    /** Tolerancia absoluta para comparar los campos decimales. */
    public static final double EPSILON = 1e-6;

    // Óptica
    public final double baseFocalLength;    // mm
    private final Double apertureDiameter;  // mm, null = sin apertura
    public final double reducerFactor;
    public final double barlowFactor;

    // Cámara
    public final double pixelSize;          // μm
    public final int sensorWidthPx;
    public final int sensorHeightPx;
    public final int binning;
    public final String cameraName;

    // Cielo
    public final double seeing;             // arcsec FWHM

    public CalculatorInput(double baseFocalLength, Double apertureDiameter, double reducerFactor, double barlowFactor,
                           double pixelSize, int sensorWidthPx, int sensorHeightPx, int binning,
                           double seeing, String cameraName) {
        this.baseFocalLength = baseFocalLength;
        this.apertureDiameter = apertureDiameter;
        this.reducerFactor = reducerFactor;
        this.barlowFactor = barlowFactor;
        this.pixelSize = pixelSize;
        this.sensorWidthPx = sensorWidthPx;
        this.sensorHeightPx = sensorHeightPx;
        this.binning = binning;
        this.seeing = seeing;
        this.cameraName = cameraName;
    }

    /** Equipo por defecto: 800 mm / 200 mm con una IMX455 (3.76 μm) y seeing de 2". */
    public static CalculatorInput defaults() {
        return new CalculatorInput(800, 200.0, 1.0, 1.0, 3.76, 6248, 4176, 1, 2.0, null);
    }

    /**
     * Focal efectiva = focal * barlow / reductor.
     * Se divide por el reductor: con factores menores que 1 la focal efectiva crece.
     * Todo el cálculo de muestreo depende de esta fórmula, no cambiarla.
     */
    public double effectiveFocalLength() {
        return baseFocalLength * barlowFactor / reducerFactor;
    }

    public OptionalDouble apertureDiameter() {
        return apertureDiameter == null ? OptionalDouble.empty() : OptionalDouble.of(apertureDiameter);
    }

    public boolean hasAperture() {
        return apertureDiameter != null;
    }

    // --- COPIAS ---
    public CalculatorInput withBaseFocalLength(double v) {
        return new CalculatorInput(v, apertureDiameter, reducerFactor, barlowFactor, pixelSize, sensorWidthPx, sensorHeightPx, binning, seeing, cameraName);
    }

    public CalculatorInput withApertureDiameter(Double v) {
        return new CalculatorInput(baseFocalLength, v, reducerFactor, barlowFactor, pixelSize, sensorWidthPx, sensorHeightPx, binning, seeing, cameraName);
    }

    public CalculatorInput withoutAperture() {
        return withApertureDiameter(null);
    }

    public CalculatorInput withReducerFactor(double v) {
        return new CalculatorInput(baseFocalLength, apertureDiameter, v, barlowFactor, pixelSize, sensorWidthPx, sensorHeightPx, binning, seeing, cameraName);
    }

    public CalculatorInput withBarlowFactor(double v) {
        return new CalculatorInput(baseFocalLength, apertureDiameter, reducerFactor, v, pixelSize, sensorWidthPx, sensorHeightPx, binning, seeing, cameraName);
    }

    public CalculatorInput withPixelSize(double v) {
        return new CalculatorInput(baseFocalLength, apertureDiameter, reducerFactor, barlowFactor, v, sensorWidthPx, sensorHeightPx, binning, seeing, cameraName);
    }

    public CalculatorInput withSensorSize(int widthPx, int heightPx) {
        return new CalculatorInput(baseFocalLength, apertureDiameter, reducerFactor, barlowFactor, pixelSize, widthPx, heightPx, binning, seeing, cameraName);
    }

    public CalculatorInput withBinning(int v) {
        return new CalculatorInput(baseFocalLength, apertureDiameter, reducerFactor, barlowFactor, pixelSize, sensorWidthPx, sensorHeightPx, v, seeing, cameraName);
    }

    public CalculatorInput withSeeing(double v) {
        return new CalculatorInput(baseFocalLength, apertureDiameter, reducerFactor, barlowFactor, pixelSize, sensorWidthPx, sensorHeightPx, binning, v, cameraName);
    }

    public CalculatorInput withCameraName(String v) {
        return new CalculatorInput(baseFocalLength, apertureDiameter, reducerFactor, barlowFactor, pixelSize, sensorWidthPx, sensorHeightPx, binning, seeing, v);
    }

    // --- IGUALDAD ---

    /**
     * Dos entradas son iguales si coinciden todos los campos; los decimales con
     * tolerancia {@link #EPSILON} y la apertura por presencia y valor.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalculatorInput)) return false;
        CalculatorInput other = (CalculatorInput) o;
        return close(baseFocalLength, other.baseFocalLength)
                && closeOptional(apertureDiameter, other.apertureDiameter)
                && close(reducerFactor, other.reducerFactor)
                && close(barlowFactor, other.barlowFactor)
                && close(pixelSize, other.pixelSize)
                && sensorWidthPx == other.sensorWidthPx
                && sensorHeightPx == other.sensorHeightPx
                && binning == other.binning
                && close(seeing, other.seeing)
                && Objects.equals(cameraName, other.cameraName);
    }

    // Los doubles no entran en el hash: con tolerancia no hay forma estable de redondearlos.
    @Override
    public int hashCode() {
        return Objects.hash(sensorWidthPx, sensorHeightPx, binning, apertureDiameter != null, cameraName);
    }

    private static boolean close(double a, double b) {
        return Math.abs(a - b) <= EPSILON;
    }

    private static boolean closeOptional(Double a, Double b) {
        if (a == null || b == null) return a == b;
        return close(a, b);
    }

    @Override
    public String toString() {
        return "CalculatorInput{focal=" + baseFocalLength + ", aperture=" + apertureDiameter
                + ", reducer=" + reducerFactor + ", barlow=" + barlowFactor
                + ", pixel=" + pixelSize + ", sensor=" + sensorWidthPx + "x" + sensorHeightPx
                + ", bin=" + binning + ", seeing=" + seeing + ", camera=" + cameraName + "}";
    }
}
