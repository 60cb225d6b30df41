package com.sampling.model;

public class BinningRecommendation {
    public final int binning;
    public final double resultingPixelScale; // "/px con el nuevo binning
    public final String message;

    public BinningRecommendation(int binning, double resultingPixelScale, String message) {
        this.binning = binning;
        this.resultingPixelScale = resultingPixelScale;
        this.message = message;
    }
}
