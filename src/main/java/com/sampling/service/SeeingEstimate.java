package com.sampling.service;

public class SeeingEstimate {
    public final int starCount;       // estrellas usadas para la mediana
    public final double fwhmPx;
    public final double seeingArcsec;

    public SeeingEstimate(int starCount, double fwhmPx, double seeingArcsec) {
        this.starCount = starCount;
        this.fwhmPx = fwhmPx;
        this.seeingArcsec = seeingArcsec;
    }
}
