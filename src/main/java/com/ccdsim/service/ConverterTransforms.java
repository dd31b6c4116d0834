package com.ccdsim.service;

import com.ccdsim.model.AuxiliaryArray;
import com.ccdsim.model.CcdSimException;
import com.ccdsim.model.Converter;
import com.ccdsim.model.Effect;
import com.ccdsim.model.Fault;
import com.ccdsim.model.Flags;
import com.ccdsim.model.Parameters;
import com.ccdsim.model.Slice;
import com.ccdsim.model.SliceGeometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifts the {@link SliceTransforms} to whole converters.
 * <p>
 * Each step checks its flag precondition, maps the slice function over every slice with that
 * slice's coefficients and flips exactly one flag. Forward steps need the effect absent and mark
 * it present; reverse steps need it present and mark it absent. Nothing is returned on failure,
 * so the input converter is always left as it was.
 */
public final class ConverterTransforms {

    private ConverterTransforms() {
    }

    @FunctionalInterface
    interface SliceStep {
        Slice apply(int position, Slice slice);
    }

    // ---------------------------------------------------------------- electron flux to raw

    public static Converter introduceSmearRows(Converter converter, TransformContext context) {
        Parameters p = converter.getParameters();
        SliceGeometry geometry = p.geometry();
        return mapSlices(converter, Effect.SMEAR_ROWS, true, "introduce_smear_rows",
                (i, s) -> SliceTransforms.introduceSmearRows(s, p.getSmearRatio(), geometry));
    }

    public static Converter addShotNoise(Converter converter, TransformContext context) {
        return mapSlices(converter, Effect.SHOT_NOISE, true, "add_shot_noise",
                (i, s) -> SliceTransforms.addShotNoise(s, context.getRandom()));
    }

    public static Converter simulateBlooming(Converter converter, TransformContext context) {
        Parameters p = converter.getParameters();
        SliceGeometry geometry = p.geometry();
        return mapSlices(converter, Effect.BLOOMING, true, "simulate_blooming",
                (i, s) -> SliceTransforms.simulateBlooming(s, p.getFullWell(), p.getBloomingThreshold(),
                        p.getNumberOfExposures(), geometry));
    }

    public static Converter addReadoutNoise(Converter converter, TransformContext context) {
        Parameters p = converter.getParameters();
        List<Double> noise = perSlice(converter, p.getReadoutNoiseParameters(), "readout_noise_parameters");
        return mapSlices(converter, Effect.READOUT_NOISE, true, "add_readout_noise",
                (i, s) -> SliceTransforms.addReadoutNoise(s, noise.get(i), p.getNumberOfExposures(),
                        context.getRandom()));
    }

    public static Converter simulateUndershoot(Converter converter, TransformContext context) {
        double u = converter.getParameters().getUndershootParameter();
        return mapSlices(converter, Effect.UNDERSHOOT, true, "simulate_undershoot",
                (i, s) -> SliceTransforms.simulateUndershoot(s, u));
    }

    public static Converter simulateStartOfLineRinging(Converter converter, TransformContext context) {
        // load before touching any slice so a bad resource leaves nothing half done
        converter.getFlags().require(Effect.START_OF_LINE_RINGING, false, "simulate_start_of_line_ringing");
        AuxiliaryArray ringing = context.getResources().load(converter.getParameters().getStartOfLineRinging());
        ringing.requireDimensions(2);
        requireEntries(converter, ringing, "start of line ringing");
        return mapSlices(converter, Effect.START_OF_LINE_RINGING, true, "simulate_start_of_line_ringing",
                (i, s) -> SliceTransforms.addStartOfLineRinging(s, ringing.row(i)));
    }

    public static Converter addPatternNoise(Converter converter, TransformContext context) {
        converter.getFlags().require(Effect.PATTERN_NOISE, false, "add_pattern_noise");
        AuxiliaryArray pattern = loadPatternNoise(converter, context);
        return mapSlices(converter, Effect.PATTERN_NOISE, true, "add_pattern_noise",
                (i, s) -> SliceTransforms.addPatternNoise(s, pattern.matrix(i)));
    }

    public static Converter addBaseline(Converter converter, TransformContext context) {
        Parameters p = converter.getParameters();
        List<Double> baselines = perSlice(converter, p.getSingleFrameBaselineAdus(), "single_frame_baseline_adus");
        List<Double> scales = perSlice(converter, p.getVideoScales(), "video_scales");
        return mapSlices(converter, Effect.BASELINE, true, "add_baseline",
                (i, s) -> SliceTransforms.addBaseline(s, baselines.get(i), p.getSingleFrameBaselineAduDriftTerm(),
                        p.getNumberOfExposures(), scales.get(i), context.getRandom()));
    }

    public static Converter convertToAdu(Converter converter, TransformContext context) {
        Parameters p = converter.getParameters();
        List<Double> scales = perSlice(converter, p.getVideoScales(), "video_scales");
        return mapSlices(converter, Effect.IN_ADU, true, "convert_to_adu",
                (i, s) -> SliceTransforms.convertElectronsToAdu(s, conversionModel(p, scales.get(i))));
    }

    // ---------------------------------------------------------------- raw to calibrated

    public static Converter convertToElectrons(Converter converter, TransformContext context) {
        Parameters p = converter.getParameters();
        List<Double> scales = perSlice(converter, p.getVideoScales(), "video_scales");
        return mapSlices(converter, Effect.IN_ADU, false, "convert_to_electrons",
                (i, s) -> SliceTransforms.convertAduToElectrons(s, conversionModel(p, scales.get(i))));
    }

    public static Converter removeBaseline(Converter converter, TransformContext context) {
        SliceGeometry geometry = converter.getParameters().geometry();
        return mapSlices(converter, Effect.BASELINE, false, "remove_baseline",
                (i, s) -> SliceTransforms.removeBaseline(s, geometry));
    }

    public static Converter removePatternNoise(Converter converter, TransformContext context) {
        converter.getFlags().require(Effect.PATTERN_NOISE, true, "remove_pattern_noise");
        AuxiliaryArray pattern = loadPatternNoise(converter, context);
        return mapSlices(converter, Effect.PATTERN_NOISE, false, "remove_pattern_noise",
                (i, s) -> SliceTransforms.removePatternNoise(s, pattern.matrix(i)));
    }

    public static Converter removeStartOfLineRinging(Converter converter, TransformContext context) {
        SliceGeometry geometry = converter.getParameters().geometry();
        return mapSlices(converter, Effect.START_OF_LINE_RINGING, false, "remove_start_of_line_ringing",
                (i, s) -> SliceTransforms.removeStartOfLineRinging(s, geometry));
    }

    public static Converter removeUndershoot(Converter converter, TransformContext context) {
        double u = converter.getParameters().getUndershootParameter();
        return mapSlices(converter, Effect.UNDERSHOOT, false, "remove_undershoot",
                (i, s) -> SliceTransforms.removeUndershoot(s, u));
    }

    public static Converter removeSmear(Converter converter, TransformContext context) {
        SliceGeometry geometry = converter.getParameters().geometry();
        return mapSlices(converter, Effect.SMEAR_ROWS, false, "remove_smear",
                (i, s) -> SliceTransforms.removeSmear(s, geometry));
    }

    // ---------------------------------------------------------------- helpers

    static Converter mapSlices(Converter converter, Effect effect, boolean presentAfter, String step,
                               SliceStep function) {
        Flags flags = converter.getFlags();
        flags.require(effect, !presentAfter, step);
        List<Slice> slices = converter.getSlices();
        List<Slice> transformed = new ArrayList<>(slices.size());
        for (int i = 0; i < slices.size(); i++) {
            transformed.add(function.apply(i, slices.get(i)));
        }
        return converter.withSlicesAndFlags(transformed, flags.with(effect, presentAfter));
    }

    private static ConversionModel conversionModel(Parameters p, double videoScale) {
        return new ConversionModel(p.getGainLoss(), p.getNumberOfExposures(), videoScale, p.getClipLevelAdu());
    }

    /**
     * @throws CcdSimException with {@link Fault#SHAPE_MISMATCH} if there are fewer entries than slices
     */
    static List<Double> perSlice(Converter converter, List<Double> values, String key) {
        if (values.size() < converter.sliceCount()) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, key + " has " + values.size()
                    + " entries but the frame has " + converter.sliceCount() + " slices");
        }
        return values;
    }

    private static AuxiliaryArray loadPatternNoise(Converter converter, TransformContext context) {
        AuxiliaryArray pattern = context.getResources().load(converter.getParameters().getPatternNoise());
        pattern.requireDimensions(3);
        requireEntries(converter, pattern, "pattern noise");
        return pattern;
    }

    private static void requireEntries(Converter converter, AuxiliaryArray array, String what) {
        if (array.length() < converter.sliceCount()) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, what + " holds " + array.length()
                    + " entries but the frame has " + converter.sliceCount() + " slices");
        }
    }
}
