package com.sampling.service;

import com.sampling.model.BinningRecommendation;
import com.sampling.model.CalculatorInput;
import com.sampling.model.CalculatorResult;
import com.sampling.model.CorrectorRecommendation;
import com.sampling.model.SamplingStatus;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Calcula escala de píxel, campo, clasificación de muestreo y sugerencias.
 * Sin estado: se puede llamar desde cualquier hilo.
 * <p>
 * No valida la entrada (eso lo hace {@link InputValidationService}). Con reductor,
 * focal o binning a 0 no lanza excepción: devuelve infinitos / NaN.
 */
public class SamplingCalculatorService {

    // μm/mm -> arcsec (206265 "/rad con el cambio de unidades incluido)
    private static final double ARCSEC_PER_RADIAN_MICRON_MM = 206.265;
    private static final double DAWES_CONSTANT = 116.0;
    private static final int MAX_BINNING = 4;

    // Rango plausible para un reductor / barlow comercial
    private static final double MIN_REDUCER_RATIO = 0.5;
    private static final double MAX_REDUCER_RATIO = 1.0;
    private static final double MIN_BARLOW = 1.5;
    private static final double MAX_BARLOW = 5.0;

    // Avisos de escala extrema ("/px)
    private static final double EXTREME_LARGE_SCALE = 4.0;
    private static final double EXTREME_SMALL_SCALE = 0.2;

    public CalculatorResult calculate(CalculatorInput input) {
        double effectiveFocal = input.effectiveFocalLength();
        double effectivePixelSize = input.pixelSize * input.binning;

        double pixelScale = ARCSEC_PER_RADIAN_MICRON_MM * effectivePixelSize / effectiveFocal;

        // El binning se cancela: cambia la resolución, no el campo
        double fovWidthDeg = (pixelScale * input.sensorWidthPx / input.binning) / 3600.0;
        double fovHeightDeg = (pixelScale * input.sensorHeightPx / input.binning) / 3600.0;

        // 2-3 píxeles por FWHM del seeing
        double optimalMin = input.seeing / 3.0;
        double optimalMax = input.seeing / 2.0;

        SamplingStatus status;
        if (pixelScale > optimalMax) status = SamplingStatus.UNDERSAMPLED;
        else if (pixelScale < optimalMin) status = SamplingStatus.OVERSAMPLED;
        else status = SamplingStatus.OPTIMAL;

        OptionalDouble fRatio = OptionalDouble.empty();
        OptionalDouble dawes = OptionalDouble.empty();
        OptionalDouble aperture = input.apertureDiameter();
        if (aperture.isPresent() && aperture.getAsDouble() > 0) {
            fRatio = OptionalDouble.of(effectiveFocal / aperture.getAsDouble());
            dawes = OptionalDouble.of(DAWES_CONSTANT / aperture.getAsDouble());
        }

        double targetScale = (optimalMin + optimalMax) / 2.0;

        return new CalculatorResult(
                pixelScale, fovWidthDeg, fovHeightDeg, effectiveFocal, fRatio, dawes,
                status, optimalMin, optimalMax,
                statusMessage(status, input.seeing),
                recommendBinning(status, input.binning, pixelScale, targetScale),
                recommendCorrector(status, input, pixelScale, effectivePixelSize, effectiveFocal, targetScale),
                extremeWarning(pixelScale));
    }

    private String statusMessage(SamplingStatus status, double seeing) {
        switch (status) {
            case UNDERSAMPLED:
                return String.format(Locale.ROOT,
                        "Your setup is likely undersampled for %.1f″ seeing. Stars may look blocky and fine detail is lost.", seeing);
            case OVERSAMPLED:
                return String.format(Locale.ROOT,
                        "Your setup is likely oversampled for %.1f″ seeing. Extra resolution is lost to the atmosphere and signal per pixel drops.", seeing);
            default:
                return String.format(Locale.ROOT, "Your setup is well-matched for %.1f″ seeing.", seeing);
        }
    }

    /**
     * Solo con sobremuestreo: subir el binning agranda el píxel efectivo.
     * Con submuestreo nunca se sugiere, empeoraría.
     */
    private Optional<BinningRecommendation> recommendBinning(SamplingStatus status, int binning, double pixelScale, double targetScale) {
        if (status != SamplingStatus.OVERSAMPLED || binning >= MAX_BINNING) return Optional.empty();

        double scalePerBin = pixelScale / binning;
        int needed = (int) Math.ceil(targetScale / scalePerBin);
        needed = Math.max(binning + 1, Math.min(MAX_BINNING, needed));

        double newScale = scalePerBin * needed;
        String msg = String.format(Locale.ROOT, "Consider %d×%d binning for ~%.2f″/px.", needed, needed, newScale);
        return Optional.of(new BinningRecommendation(needed, newScale, msg));
    }

    private Optional<CorrectorRecommendation> recommendCorrector(SamplingStatus status, CalculatorInput input, double pixelScale,
                                                                 double effectivePixelSize, double effectiveFocal, double targetScale) {
        if (status == SamplingStatus.OVERSAMPLED) {
            double ratio = pixelScale / targetScale;
            // Fuera de rango: un solo reductor no alcanza
            if (ratio < MIN_REDUCER_RATIO || ratio >= MAX_REDUCER_RATIO) return Optional.empty();

            double factor = round(ratio, 2);
            double newScale = pixelScale / ratio;
            long newFocal = Math.round(effectiveFocal * ratio);
            String msg = String.format(Locale.ROOT,
                    "Consider a %.2f× reducer for ~%.2f″/px (effective focal length ~%d mm).", factor, newScale, newFocal);
            return Optional.of(new CorrectorRecommendation(CorrectorRecommendation.Kind.REDUCER, factor, newScale, newFocal, msg));
        }

        if (status == SamplingStatus.UNDERSAMPLED) {
            double newEffectiveFocal = ARCSEC_PER_RADIAN_MICRON_MM * effectivePixelSize / targetScale;
            double barlow = newEffectiveFocal * input.reducerFactor / input.baseFocalLength;
            if (barlow < MIN_BARLOW || barlow > MAX_BARLOW) return Optional.empty();

            double factor = round(barlow, 1);
            double newScale = ARCSEC_PER_RADIAN_MICRON_MM * effectivePixelSize / newEffectiveFocal;
            String msg = String.format(Locale.ROOT, "Consider a %.1f× Barlow for ~%.2f″/px.", factor, newScale);
            return Optional.of(new CorrectorRecommendation(CorrectorRecommendation.Kind.BARLOW, factor, newScale, null, msg));
        }

        return Optional.empty();
    }

    private Optional<String> extremeWarning(double pixelScale) {
        if (pixelScale > EXTREME_LARGE_SCALE) {
            return Optional.of("Pixel scale is extremely large (>4″/px). Stars will be undersampled and blocky; "
                    + "consider a longer focal length or smaller pixels.");
        }
        if (pixelScale < EXTREME_SMALL_SCALE) {
            return Optional.of("Pixel scale is extremely small (<0.2″/px). Guiding must be very precise and signal "
                    + "per pixel will be low; consider binning or a reducer.");
        }
        return Optional.empty();
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
