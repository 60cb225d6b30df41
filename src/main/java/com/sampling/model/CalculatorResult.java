package com.sampling.model;

import java.util.Optional;
import java.util.OptionalDouble;

public class CalculatorResult {

    public final double pixelScale;          // "/px
    public final double fovWidthDeg;
    public final double fovHeightDeg;
    public final double fovWidthArcmin;
    public final double fovHeightArcmin;
    public final double effectiveFocalLength;
    public final OptionalDouble fRatio;
    public final OptionalDouble dawesLimitArcsec;

    public final SamplingStatus status;
    public final double optimalRangeMin;
    public final double optimalRangeMax;
    public final String statusMessage;

    // Sugerencias (vacías si no aplican)
    public final Optional<BinningRecommendation> binningRecommendation;
    public final Optional<CorrectorRecommendation> correctorRecommendation;
    public final Optional<String> extremeWarning;

    public CalculatorResult(double pixelScale, double fovWidthDeg, double fovHeightDeg, double effectiveFocalLength,
                            OptionalDouble fRatio, OptionalDouble dawesLimitArcsec,
                            SamplingStatus status, double optimalRangeMin, double optimalRangeMax, String statusMessage,
                            Optional<BinningRecommendation> binningRecommendation,
                            Optional<CorrectorRecommendation> correctorRecommendation,
                            Optional<String> extremeWarning) {
        this.pixelScale = pixelScale;
        this.fovWidthDeg = fovWidthDeg;
        this.fovHeightDeg = fovHeightDeg;
        this.fovWidthArcmin = fovWidthDeg * 60.0;
        this.fovHeightArcmin = fovHeightDeg * 60.0;
        this.effectiveFocalLength = effectiveFocalLength;
        this.fRatio = fRatio;
        this.dawesLimitArcsec = dawesLimitArcsec;
        this.status = status;
        this.optimalRangeMin = optimalRangeMin;
        this.optimalRangeMax = optimalRangeMax;
        this.statusMessage = statusMessage;
        this.binningRecommendation = binningRecommendation;
        this.correctorRecommendation = correctorRecommendation;
        this.extremeWarning = extremeWarning;
    }
}
