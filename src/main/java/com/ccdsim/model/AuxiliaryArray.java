package com.ccdsim.model;

import java.util.Arrays;

/**
 * Dense n-dimensional array of doubles loaded from an auxiliary resource, in C (row-major) order.
 */
public final class AuxiliaryArray {

    private final int[] shape;
    private final double[] data;

    public AuxiliaryArray(int[] shape, double[] data) {
        long size = 1;
        for (int d : shape) size *= d;
        if (size != data.length) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH,
                    "Array of shape " + Arrays.toString(shape) + " cannot hold " + data.length + " values");
        }
        this.shape = shape.clone();
        this.data = data;
    }

    public int[] shape() {
        return shape.clone();
    }

    /** Extent of the leading axis, i.e. the number of per-slice entries. */
    public int length() {
        return shape.length == 0 ? 0 : shape[0];
    }

    public double[] row(int i) {
        requireDimensions(2);
        int width = shape[1];
        return Arrays.copyOfRange(data, i * width, (i + 1) * width);
    }

    public double[][] matrix(int i) {
        requireDimensions(3);
        int rows = shape[1];
        int cols = shape[2];
        double[][] m = new double[rows][];
        int base = i * rows * cols;
        for (int r = 0; r < rows; r++) {
            m[r] = Arrays.copyOfRange(data, base + r * cols, base + (r + 1) * cols);
        }
        return m;
    }

    public void requireDimensions(int expected) {
        if (shape.length != expected) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH,
                    "Expected a " + expected + "-dimensional array but got shape " + Arrays.toString(shape));
        }
    }

    @Override
    public String toString() {
        return "AuxiliaryArray" + Arrays.toString(shape);
    }
}
