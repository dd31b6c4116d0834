package com.ccdsim.model;

public enum PixelUnits {
    ELECTRONS("electrons"),
    ADU("ADU");

    private final String label;

    PixelUnits(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
