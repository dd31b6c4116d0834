package com.ccdsim.service;

import com.ccdsim.model.CcdSimException;
import com.ccdsim.model.Fault;
import com.ccdsim.model.PixelUnits;
import com.ccdsim.model.Slice;
import com.ccdsim.model.SliceGeometry;

import java.util.Random;

/**
 * Physical effects of the CCD electronics, one slice at a time.
 * <p>
 * Every function checks the slice units on entry and returns a new slice of the same
 * shape. The forward (electron flux to raw) functions add an effect; the {@code remove}
 * functions estimate it from the dark and smear regions and take it back out.
 */
public final class SliceTransforms {

    private static final double[] BLOOMING_KERNEL = {0.3, 0.4, 0.3};

    private SliceTransforms() {
    }

    // ---------------------------------------------------------------- smear

    /**
     * Fills the empty smear rows and adds smear to every illuminated pixel.
     * <p>
     * The smear row is the column-wise sum of the illuminated block times {@code smearRatio}:
     * while being clocked out a pixel sees each point of its column for one parallel clock period.
     * Dark columns are left alone.
     */
    public static Slice introduceSmearRows(Slice slice, double smearRatio, SliceGeometry geometry) {
        slice.requireUnits(PixelUnits.ELECTRONS, "introduce_smear_rows");
        geometry.requireFits(slice);
        int imageEnd = geometry.imageRowEnd(slice);
        int smearEnd = geometry.smearRowEnd(slice);
        int c0 = geometry.illuminatedColumnStart();
        int c1 = geometry.illuminatedColumnEnd(slice);

        for (int r = imageEnd; r < smearEnd; r++) {
            for (int c = c0; c < c1; c++) {
                if (slice.get(r, c) != 0.0) {
                    throw new CcdSimException(Fault.FLAG_PRECONDITION, "Smear rows of slice " + slice.getIndex()
                            + " are already introduced (they should be all zero)");
                }
            }
        }

        double[] estimatedSmear = new double[c1 - c0];
        for (int r = 0; r < imageEnd; r++) {
            for (int c = c0; c < c1; c++) estimatedSmear[c - c0] += slice.get(r, c);
        }
        for (int i = 0; i < estimatedSmear.length; i++) estimatedSmear[i] *= smearRatio;

        double[][] out = slice.copyPixels();
        for (int r = 0; r < smearEnd; r++) {
            boolean smearRow = r >= imageEnd;
            for (int c = c0; c < c1; c++) {
                out[r][c] = smearRow ? estimatedSmear[c - c0] : out[r][c] + estimatedSmear[c - c0];
            }
        }
        return slice.withPixels(out);
    }

    /**
     * Averages the smear rows column by column and subtracts the result from every row.
     * This also takes out start of line ringing and the video baseline.
     */
    public static Slice removeSmear(Slice slice, SliceGeometry geometry) {
        slice.requireUnits(PixelUnits.ELECTRONS, "remove_smear");
        geometry.requireFits(slice);
        if (geometry.getSmearRows() == 0) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "Cannot estimate smear without smear rows");
        }
        int imageEnd = geometry.imageRowEnd(slice);
        int smearEnd = geometry.smearRowEnd(slice);

        boolean anySmear = false;
        for (int r = imageEnd; r < smearEnd && !anySmear; r++) {
            for (int c = geometry.illuminatedColumnStart(); c < geometry.illuminatedColumnEnd(slice); c++) {
                if (slice.get(r, c) != 0.0) {
                    anySmear = true;
                    break;
                }
            }
        }
        if (!anySmear) {
            throw new CcdSimException(Fault.FLAG_PRECONDITION,
                    "Smear rows of slice " + slice.getIndex() + " are empty, there is no smear to remove");
        }
        return subtractRowVector(slice, averageRows(slice, imageEnd, smearEnd));
    }

    // ---------------------------------------------------------------- noise

    /**
     * Replaces every pixel {@code p} with a Gaussian draw of mean {@code p} and standard deviation
     * {@code sqrt(p)}, approximating photon counting statistics. Negative pixels get no noise.
     */
    public static Slice addShotNoise(Slice slice, Random random) {
        slice.requireUnits(PixelUnits.ELECTRONS, "add_shot_noise");
        double[][] out = slice.copyPixels();
        for (double[] row : out) {
            for (int c = 0; c < row.length; c++) {
                row[c] += Math.sqrt(Math.max(row[c], 0.0)) * random.nextGaussian();
            }
        }
        return slice.withPixels(out);
    }

    /**
     * Adds zero-mean Gaussian noise of standard deviation
     * {@code readoutNoiseParameter * sqrt(numberOfExposures)} to every pixel.
     */
    public static Slice addReadoutNoise(Slice slice, double readoutNoiseParameter, int numberOfExposures,
                                        Random random) {
        slice.requireUnits(PixelUnits.ELECTRONS, "add_readout_noise");
        if (numberOfExposures <= 0) {
            throw new CcdSimException(Fault.INVALID_VALUE, "number of exposures must be positive");
        }
        if (readoutNoiseParameter < 0) {
            throw new CcdSimException(Fault.INVALID_VALUE, "readout noise parameter must be non-negative");
        }
        if (readoutNoiseParameter == 0.0) {
            return slice;
        }
        double sigma = readoutNoiseParameter * Math.sqrt(numberOfExposures);
        double[][] out = slice.copyPixels();
        for (double[] row : out) {
            for (int c = 0; c < row.length; c++) row[c] += sigma * random.nextGaussian();
        }
        return slice.withPixels(out);
    }

    // ---------------------------------------------------------------- blooming

    /**
     * Diffuses charge along each column of the illuminated block.
     * <p>
     * One diffusion step holds every pixel at {@code exposures * bloomingThreshold} and spreads the
     * excess over the pixel and its vertical neighbours with the kernel {@code [0.3, 0.4, 0.3]};
     * charge pushed past the top or bottom of the column is lost. The step always runs once and
     * then repeats until no pixel in the column exceeds {@code exposures * fullWell}. No inverse.
     */
    public static Slice simulateBlooming(Slice slice, double fullWell, double bloomingThreshold,
                                         int numberOfExposures, SliceGeometry geometry) {
        slice.requireUnits(PixelUnits.ELECTRONS, "simulate_blooming");
        geometry.requireFits(slice);
        if (bloomingThreshold > fullWell) {
            throw new CcdSimException(Fault.INVALID_VALUE, "blooming threshold " + bloomingThreshold
                    + " exceeds full well " + fullWell + ", diffusion would never settle");
        }
        double ceiling = numberOfExposures * bloomingThreshold;
        double limit = numberOfExposures * fullWell;
        int imageEnd = geometry.imageRowEnd(slice);
        int c0 = geometry.illuminatedColumnStart();
        int c1 = geometry.illuminatedColumnEnd(slice);

        double[][] out = slice.copyPixels();
        if (imageEnd == 0) {
            return slice.withPixels(out);
        }
        double[] column = new double[imageEnd];
        for (int c = c0; c < c1; c++) {
            for (int r = 0; r < imageEnd; r++) column[r] = out[r][c];
            column = bloomColumn(column, ceiling, limit);
            for (int r = 0; r < imageEnd; r++) out[r][c] = column[r];
        }
        return slice.withPixels(out);
    }

    static double[] bloomColumn(double[] column, double ceiling, double limit) {
        double[] current = diffusionStep(column, ceiling);
        while (max(current) > limit) {
            current = diffusionStep(current, ceiling);
        }
        return current;
    }

    static double[] diffusionStep(double[] column, double ceiling) {
        int n = column.length;
        double[] proof = new double[n];
        double[] excess = new double[n];
        for (int i = 0; i < n; i++) {
            proof[i] = Math.min(Math.max(column[i], 0.0), ceiling);
            excess[i] = column[i] - proof[i];
        }
        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            double diffused = BLOOMING_KERNEL[1] * excess[i];
            if (i > 0) diffused += BLOOMING_KERNEL[0] * excess[i - 1];
            if (i < n - 1) diffused += BLOOMING_KERNEL[2] * excess[i + 1];
            result[i] = proof[i] + diffused;
        }
        return result;
    }

    // ---------------------------------------------------------------- undershoot

    /**
     * Convolves every row with {@code [1, -undershootParameter]}: a pixel after a bright pixel reads dimmer.
     * Non-cyclic, the row is zero-padded at its start.
     */
    public static Slice simulateUndershoot(Slice slice, double undershootParameter) {
        slice.requireUnits(PixelUnits.ELECTRONS, "simulate_undershoot");
        return convolveRows(slice, -undershootParameter);
    }

    /** Approximate inverse of {@link #simulateUndershoot}: convolves with {@code [1, +undershootParameter]}. */
    public static Slice removeUndershoot(Slice slice, double undershootParameter) {
        slice.requireUnits(PixelUnits.ELECTRONS, "remove_undershoot");
        return convolveRows(slice, undershootParameter);
    }

    private static Slice convolveRows(Slice slice, double previousPixelWeight) {
        double[][] out = new double[slice.rows()][];
        for (int r = 0; r < slice.rows(); r++) {
            double[] row = slice.copyRow(r);
            double[] convolved = new double[row.length];
            convolved[0] = row[0];
            for (int c = 1; c < row.length; c++) {
                convolved[c] = row[c] + previousPixelWeight * row[c - 1];
            }
            out[r] = convolved;
        }
        return slice.withPixels(out);
    }

    // ---------------------------------------------------------------- start of line ringing

    public static Slice addStartOfLineRinging(Slice slice, double[] ringing) {
        slice.requireUnits(PixelUnits.ELECTRONS, "simulate_start_of_line_ringing");
        if (ringing.length != slice.columns()) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "Start of line ringing has " + ringing.length
                    + " values but slice " + slice.getIndex() + " has " + slice.columns() + " columns");
        }
        double[][] out = slice.copyPixels();
        for (double[] row : out) {
            for (int c = 0; c < row.length; c++) row[c] += ringing[c];
        }
        return slice.withPixels(out);
    }

    /**
     * Averages the final dark rows column by column and subtracts the result from every row.
     * The estimate also carries the video baseline, which is removed along with the ringing.
     */
    public static Slice removeStartOfLineRinging(Slice slice, SliceGeometry geometry) {
        slice.requireUnits(PixelUnits.ELECTRONS, "remove_start_of_line_ringing");
        geometry.requireFits(slice);
        if (geometry.getFinalDarkRows() == 0) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH,
                    "Cannot estimate start of line ringing without final dark rows");
        }
        return subtractRowVector(slice, averageRows(slice, geometry.smearRowEnd(slice), slice.rows()));
    }

    // ---------------------------------------------------------------- pattern noise

    public static Slice addPatternNoise(Slice slice, double[][] patternNoise) {
        slice.requireUnits(PixelUnits.ELECTRONS, "add_pattern_noise");
        return addMatrix(slice, patternNoise, 1.0);
    }

    public static Slice removePatternNoise(Slice slice, double[][] patternNoise) {
        slice.requireUnits(PixelUnits.ELECTRONS, "remove_pattern_noise");
        return addMatrix(slice, patternNoise, -1.0);
    }

    private static Slice addMatrix(Slice slice, double[][] matrix, double sign) {
        if (matrix.length != slice.rows() || matrix[0].length != slice.columns()) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "Pattern noise is " + matrix.length + "x"
                    + matrix[0].length + " but slice " + slice.getIndex() + " is "
                    + slice.rows() + "x" + slice.columns());
        }
        double[][] out = slice.copyPixels();
        for (int r = 0; r < out.length; r++) {
            for (int c = 0; c < out[r].length; c++) out[r][c] += sign * matrix[r][c];
        }
        return slice.withPixels(out);
    }

    // ---------------------------------------------------------------- baseline

    /**
     * Adds the video bias, a scalar drawn once per slice from a Gaussian with mean
     * {@code baselineAdu * exposures * videoScale} electrons and standard deviation
     * {@code driftTerm * videoScale}; exactly the mean when the drift term is zero.
     */
    public static Slice addBaseline(Slice slice, double singleFrameBaselineAdu, double driftTerm,
                                    int numberOfExposures, double videoScale, Random random) {
        slice.requireUnits(PixelUnits.ELECTRONS, "add_baseline");
        if (driftTerm < 0) {
            throw new CcdSimException(Fault.INVALID_VALUE, "baseline drift term must be non-negative");
        }
        double baselineElectrons = singleFrameBaselineAdu * numberOfExposures * videoScale;
        double bias = driftTerm == 0.0
                ? baselineElectrons
                : baselineElectrons + driftTerm * videoScale * random.nextGaussian();
        return addScalar(slice, bias);
    }

    /** Estimates the bias as the mean of all early and late dark columns and subtracts it everywhere. */
    public static Slice removeBaseline(Slice slice, SliceGeometry geometry) {
        slice.requireUnits(PixelUnits.ELECTRONS, "remove_baseline");
        geometry.requireFits(slice);
        if (geometry.getEarlyDarkColumns() + geometry.getLateDarkColumns() == 0) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "Cannot estimate the baseline without dark columns");
        }
        double sum = 0;
        long count = 0;
        int lateStart = geometry.illuminatedColumnEnd(slice);
        for (int r = 0; r < slice.rows(); r++) {
            for (int c = 0; c < slice.columns(); c++) {
                if (c < geometry.getEarlyDarkColumns() || c >= lateStart) {
                    sum += slice.get(r, c);
                    count++;
                }
            }
        }
        return addScalar(slice, -sum / count);
    }

    // ---------------------------------------------------------------- units

    public static Slice convertElectronsToAdu(Slice slice, ConversionModel model) {
        slice.requireUnits(PixelUnits.ELECTRONS, "convert_electrons_to_adu");
        double[][] out = slice.copyPixels();
        for (double[] row : out) {
            for (int c = 0; c < row.length; c++) row[c] = model.electronToAdu(row[c]);
        }
        return slice.withUnitsAndPixels(PixelUnits.ADU, out);
    }

    /** Exact inverse of {@link #convertElectronsToAdu} below the clip level. Result is in electrons. */
    public static Slice convertAduToElectrons(Slice slice, ConversionModel model) {
        slice.requireUnits(PixelUnits.ADU, "convert_adu_to_electrons");
        double[][] out = slice.copyPixels();
        for (double[] row : out) {
            for (int c = 0; c < row.length; c++) row[c] = model.aduToElectron(row[c]);
        }
        return slice.withUnitsAndPixels(PixelUnits.ELECTRONS, out);
    }

    // ---------------------------------------------------------------- helpers

    private static double[] averageRows(Slice slice, int fromRow, int toRow) {
        double[] mean = new double[slice.columns()];
        for (int r = fromRow; r < toRow; r++) {
            for (int c = 0; c < mean.length; c++) mean[c] += slice.get(r, c);
        }
        for (int c = 0; c < mean.length; c++) mean[c] /= (toRow - fromRow);
        return mean;
    }

    private static Slice subtractRowVector(Slice slice, double[] vector) {
        double[][] out = slice.copyPixels();
        for (double[] row : out) {
            for (int c = 0; c < row.length; c++) row[c] -= vector[c];
        }
        return slice.withPixels(out);
    }

    private static Slice addScalar(Slice slice, double value) {
        double[][] out = slice.copyPixels();
        for (double[] row : out) {
            for (int c = 0; c < row.length; c++) row[c] += value;
        }
        return slice.withPixels(out);
    }

    private static double max(double[] values) {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : values) m = Math.max(m, v);
        return m;
    }
}
