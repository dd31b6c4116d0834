package com.ccdsim.service;

import com.ccdsim.model.CcdSimException;
import com.ccdsim.model.Fault;
import com.ccdsim.model.PixelUnits;
import com.ccdsim.model.Slice;
import com.ccdsim.model.SliceGeometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits whole frames into slices and puts them back together.
 * <p>
 * A raw frame is laid out as {@code [early dark blocks][slice strips][late dark blocks]}, each
 * group in slice order. Odd-indexed strips are read out right to left and so are stored mirrored;
 * the dark blocks are not. Frames are indexed {@code [row][column]}.
 */
public final class FrameLayout {

    private FrameLayout() {
    }

    /**
     * Cuts an electron flux image into equal column strips and pads each with zero smear rows,
     * final dark rows and dark columns.
     */
    public static List<Slice> splitElectronFlux(double[][] frame, int numberOfSlices, SliceGeometry geometry) {
        int rows = frame.length;
        int width = stripWidth(frame[0].length, numberOfSlices, "electron flux image");
        int sliceRows = rows + geometry.getSmearRows() + geometry.getFinalDarkRows();
        int sliceColumns = geometry.getEarlyDarkColumns() + width + geometry.getLateDarkColumns();

        List<Slice> slices = new ArrayList<>(numberOfSlices);
        for (int i = 0; i < numberOfSlices; i++) {
            double[][] pixels = new double[sliceRows][sliceColumns];
            for (int r = 0; r < rows; r++) {
                System.arraycopy(frame[r], i * width, pixels[r], geometry.getEarlyDarkColumns(), width);
            }
            slices.add(new Slice(i, PixelUnits.ELECTRONS, pixels));
        }
        return slices;
    }

    /** Rebuilds the slices of a raw frame, undoing the mirroring of odd strips. */
    public static List<Slice> splitRaw(double[][] frame, int numberOfSlices, SliceGeometry geometry) {
        int early = geometry.getEarlyDarkColumns();
        int late = geometry.getLateDarkColumns();
        int darkColumns = numberOfSlices * (early + late);
        if (frame[0].length <= darkColumns) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "Raw frame is " + frame[0].length
                    + " columns wide, not enough for " + darkColumns + " dark columns plus image data");
        }
        int width = stripWidth(frame[0].length - darkColumns, numberOfSlices, "raw image area");
        int stripStart = numberOfSlices * early;
        int lateStart = stripStart + numberOfSlices * width;

        List<Slice> slices = new ArrayList<>(numberOfSlices);
        for (int i = 0; i < numberOfSlices; i++) {
            boolean mirrored = i % 2 == 1;
            double[][] pixels = new double[frame.length][early + width + late];
            for (int r = 0; r < frame.length; r++) {
                double[] in = frame[r];
                double[] out = pixels[r];
                System.arraycopy(in, i * early, out, 0, early);
                for (int c = 0; c < width; c++) {
                    int source = stripStart + i * width + (mirrored ? width - 1 - c : c);
                    out[early + c] = in[source];
                }
                System.arraycopy(in, lateStart + i * late, out, early + width, late);
            }
            slices.add(new Slice(i, PixelUnits.ADU, pixels));
        }
        return slices;
    }

    public static double[][] assembleRaw(List<Slice> slices, SliceGeometry geometry) {
        int n = slices.size();
        int early = geometry.getEarlyDarkColumns();
        int late = geometry.getLateDarkColumns();
        Slice first = slices.get(0);
        int width = first.columns() - early - late;
        requireUniform(slices);
        int stripStart = n * early;
        int lateStart = stripStart + n * width;

        double[][] frame = new double[first.rows()][n * first.columns()];
        for (int i = 0; i < n; i++) {
            Slice slice = slices.get(i);
            boolean mirrored = i % 2 == 1;
            for (int r = 0; r < slice.rows(); r++) {
                double[] in = slice.copyRow(r);
                double[] out = frame[r];
                System.arraycopy(in, 0, out, i * early, early);
                for (int c = 0; c < width; c++) {
                    int target = stripStart + i * width + (mirrored ? width - 1 - c : c);
                    out[target] = in[early + c];
                }
                System.arraycopy(in, early + width, out, lateStart + i * late, late);
            }
        }
        return frame;
    }

    /** Illuminated block of every slice side by side, in slice order, without mirroring. */
    public static double[][] assembleCalibrated(List<Slice> slices, SliceGeometry geometry) {
        requireUniform(slices);
        Slice first = slices.get(0);
        geometry.requireFits(first);
        int rows = geometry.imageRowEnd(first);
        int width = geometry.illuminatedColumns(first);
        int c0 = geometry.illuminatedColumnStart();

        double[][] frame = new double[rows][slices.size() * width];
        for (int i = 0; i < slices.size(); i++) {
            Slice slice = slices.get(i);
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < width; c++) frame[r][i * width + c] = slice.get(r, c0 + c);
            }
        }
        return frame;
    }

    private static int stripWidth(int columns, int numberOfSlices, String what) {
        if (columns % numberOfSlices != 0) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH,
                    "The " + what + " (" + columns + " columns) does not divide into " + numberOfSlices + " slices");
        }
        return columns / numberOfSlices;
    }

    private static void requireUniform(List<Slice> slices) {
        Slice first = slices.get(0);
        for (Slice s : slices) {
            if (s.rows() != first.rows() || s.columns() != first.columns()) {
                throw new CcdSimException(Fault.SHAPE_MISMATCH, "Slices must all have the same shape to form a frame");
            }
        }
    }
}
