package com.sampling.model;

public class FullRigPreset extends Preset {

    // Telescopio
    private double baseFocalLength;
    private Double apertureDiameter;
    private double reducerFactor = 1.0;
    private double barlowFactor = 1.0;

    // Cámara
    private double pixelSize;
    private int sensorWidthPx;
    private int sensorHeightPx;
    private int binning = 1;

    // Seeing
    private double seeing = 2.0;

    public static FullRigPreset fromInput(CalculatorInput input, String name) {
        FullRigPreset p = new FullRigPreset();
        p.setName(name);
        p.baseFocalLength = input.baseFocalLength;
        p.apertureDiameter = input.hasAperture() ? input.apertureDiameter().getAsDouble() : null;
        p.reducerFactor = input.reducerFactor;
        p.barlowFactor = input.barlowFactor;
        p.pixelSize = input.pixelSize;
        p.sensorWidthPx = input.sensorWidthPx;
        p.sensorHeightPx = input.sensorHeightPx;
        p.binning = input.binning;
        p.seeing = input.seeing;
        return p;
    }

    @Override
    public PresetType getType() { return PresetType.FULL_RIG; }

    @Override
    public CalculatorInput applyTo(CalculatorInput input) {
        return new CalculatorInput(baseFocalLength, apertureDiameter, reducerFactor, barlowFactor,
                pixelSize, sensorWidthPx, sensorHeightPx, binning, seeing, input.cameraName);
    }

    public double getBaseFocalLength() { return baseFocalLength; }
    public void setBaseFocalLength(double v) { this.baseFocalLength = v; }

    public Double getApertureDiameter() { return apertureDiameter; }
    public void setApertureDiameter(Double v) { this.apertureDiameter = v; }

    public double getReducerFactor() { return reducerFactor; }
    public void setReducerFactor(double v) { this.reducerFactor = v; }

    public double getBarlowFactor() { return barlowFactor; }
    public void setBarlowFactor(double v) { this.barlowFactor = v; }

    public double getPixelSize() { return pixelSize; }
    public void setPixelSize(double v) { this.pixelSize = v; }

    public int getSensorWidthPx() { return sensorWidthPx; }
    public void setSensorWidthPx(int v) { this.sensorWidthPx = v; }

    public int getSensorHeightPx() { return sensorHeightPx; }
    public void setSensorHeightPx(int v) { this.sensorHeightPx = v; }

    public int getBinning() { return binning; }
    public void setBinning(int v) { this.binning = v; }

    public double getSeeing() { return seeing; }
    public void setSeeing(double v) { this.seeing = v; }
}
