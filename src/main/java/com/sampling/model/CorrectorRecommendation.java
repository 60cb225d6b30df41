package com.sampling.model;

import java.util.OptionalLong;

public class CorrectorRecommendation {
    public enum Kind { REDUCER, BARLOW }

    public final Kind kind;
    public final double factor;
    public final double resultingPixelScale;
    public final String message;
    private final Long projectedFocalLength; // mm, solo para el reductor

    public CorrectorRecommendation(Kind kind, double factor, double resultingPixelScale, Long projectedFocalLength, String message) {
        this.kind = kind;
        this.factor = factor;
        this.resultingPixelScale = resultingPixelScale;
        this.projectedFocalLength = projectedFocalLength;
        this.message = message;
    }

    public OptionalLong projectedFocalLength() {
        return projectedFocalLength == null ? OptionalLong.empty() : OptionalLong.of(projectedFocalLength);
    }
}
