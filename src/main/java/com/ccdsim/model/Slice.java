package com.ccdsim.model;

import java.util.Arrays;

/**
 * One readout channel's strip of a CCD frame. Immutable: transformations build new slices.
 */
public final class Slice {

    private final int index;
    private final PixelUnits units;
    private final double[][] pixels;

    public Slice(int index, PixelUnits units, double[][] pixels) {
        this(deepCopy(checkRectangular(pixels)), index, units);
    }

    // adopts the array without copying
    private Slice(double[][] pixels, int index, PixelUnits units) {
        if (units == null) throw new IllegalArgumentException("units must not be null");
        this.index = index;
        this.units = units;
        this.pixels = pixels;
    }

    public int getIndex() {
        return index;
    }

    public PixelUnits getUnits() {
        return units;
    }

    public int rows() {
        return pixels.length;
    }

    public int columns() {
        return pixels[0].length;
    }

    public double get(int row, int column) {
        return pixels[row][column];
    }

    public double[] copyRow(int row) {
        return pixels[row].clone();
    }

    public double[][] copyPixels() {
        return deepCopy(pixels);
    }

    /**
     * Returns a slice with the same index and units holding {@code newPixels}.
     * The array is adopted, not copied: callers must not keep writing to it.
     */
    public Slice withPixels(double[][] newPixels) {
        return withUnitsAndPixels(units, newPixels);
    }

    public Slice withUnitsAndPixels(PixelUnits newUnits, double[][] newPixels) {
        checkRectangular(newPixels);
        if (newPixels.length != rows() || newPixels[0].length != columns()) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "Slice " + index + " is " + rows() + "x" + columns()
                    + " but the transformed pixels are " + newPixels.length + "x" + newPixels[0].length);
        }
        return new Slice(newPixels, index, newUnits);
    }

    public void requireUnits(PixelUnits expected, String operation) {
        if (units != expected) {
            throw new CcdSimException(Fault.UNIT_MISMATCH,
                    operation + " expects slice " + index + " in " + expected + " but it is in " + units);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Slice)) return false;
        Slice other = (Slice) o;
        return index == other.index && units == other.units && Arrays.deepEquals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * index + units.hashCode()) + Arrays.deepHashCode(pixels);
    }

    @Override
    public String toString() {
        return "Slice{index=" + index + ", units=" + units + ", shape=" + rows() + "x" + columns() + "}";
    }

    private static double[][] checkRectangular(double[][] pixels) {
        if (pixels == null || pixels.length == 0 || pixels[0] == null || pixels[0].length == 0) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "Slice pixels must be a non-empty matrix");
        }
        for (double[] row : pixels) {
            if (row == null || row.length != pixels[0].length) {
                throw new CcdSimException(Fault.SHAPE_MISMATCH, "Slice pixels must be rectangular");
            }
        }
        return pixels;
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int r = 0; r < source.length; r++) copy[r] = source[r].clone();
        return copy;
    }
}
