package com.sampling.model;

/** Cámara: el nombre del preset se usa como nombre de cámara. */
public class CameraPreset extends Preset {

    private double pixelSize;
    private int sensorWidthPx;
    private int sensorHeightPx;
    private int binning = 1;

    public static CameraPreset fromInput(CalculatorInput input, String name) {
        CameraPreset p = new CameraPreset();
        p.setName(name);
        p.pixelSize = input.pixelSize;
        p.sensorWidthPx = input.sensorWidthPx;
        p.sensorHeightPx = input.sensorHeightPx;
        p.binning = input.binning;
        return p;
    }

    @Override
    public PresetType getType() { return PresetType.CAMERA; }

    @Override
    public CalculatorInput applyTo(CalculatorInput input) {
        return input.withPixelSize(pixelSize)
                .withSensorSize(sensorWidthPx, sensorHeightPx)
                .withBinning(binning)
                .withCameraName(getName());
    }

    public double getPixelSize() { return pixelSize; }
    public void setPixelSize(double v) { this.pixelSize = v; }

    public int getSensorWidthPx() { return sensorWidthPx; }
    public void setSensorWidthPx(int v) { this.sensorWidthPx = v; }

    public int getSensorHeightPx() { return sensorHeightPx; }
    public void setSensorHeightPx(int v) { this.sensorHeightPx = v; }

    public int getBinning() { return binning; }
    public void setBinning(int v) { this.binning = v; }
}
