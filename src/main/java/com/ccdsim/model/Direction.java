package com.ccdsim.model;

/**
 * Which way a {@link Converter} is meant to travel through the electronics model.
 */
public enum Direction {
    ELECTRON_FLUX(PixelUnits.ELECTRONS),
    RAW(PixelUnits.ADU);

    private final PixelUnits initialUnits;

    Direction(PixelUnits initialUnits) {
        this.initialUnits = initialUnits;
    }

    public PixelUnits initialUnits() {
        return initialUnits;
    }
}
