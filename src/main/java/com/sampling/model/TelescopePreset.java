package com.sampling.model;

public class TelescopePreset extends Preset {

    private double baseFocalLength;
    private Double apertureDiameter;
    private double reducerFactor = 1.0;
    private double barlowFactor = 1.0;

    public static TelescopePreset fromInput(CalculatorInput input, String name) {
        TelescopePreset p = new TelescopePreset();
        p.setName(name);
        p.baseFocalLength = input.baseFocalLength;
        p.apertureDiameter = input.hasAperture() ? input.apertureDiameter().getAsDouble() : null;
        p.reducerFactor = input.reducerFactor;
        p.barlowFactor = input.barlowFactor;
        return p;
    }

    @Override
    public PresetType getType() { return PresetType.TELESCOPE; }

    @Override
    public CalculatorInput applyTo(CalculatorInput input) {
        return input.withBaseFocalLength(baseFocalLength)
                .withApertureDiameter(apertureDiameter)
                .withReducerFactor(reducerFactor)
                .withBarlowFactor(barlowFactor);
    }

    public double getBaseFocalLength() { return baseFocalLength; }
    public void setBaseFocalLength(double v) { this.baseFocalLength = v; }

    public Double getApertureDiameter() { return apertureDiameter; }
    public void setApertureDiameter(Double v) { this.apertureDiameter = v; }

    public double getReducerFactor() { return reducerFactor; }
    public void setReducerFactor(double v) { this.reducerFactor = v; }

    public double getBarlowFactor() { return barlowFactor; }
    public void setBarlowFactor(double v) { this.barlowFactor = v; }
}
