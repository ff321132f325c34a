package org.example.imagegen.model;

public record LoraSelection(String name, Double strengthModel, Double strengthClip) {

    public static final double DEFAULT_STRENGTH = 1.0;

    public double effectiveStrengthModel() {
        return strengthModel == null ? DEFAULT_STRENGTH : strengthModel;
    }

    public double effectiveStrengthClip() {
        return strengthClip == null ? effectiveStrengthModel() : strengthClip;
    }
}
