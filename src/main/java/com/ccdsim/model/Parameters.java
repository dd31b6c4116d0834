package com.ccdsim.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;

/**
 * Immutable per-CCD configuration consumed by the transformations.
 * <p>
 * Values are held against their {@link ParameterKey} so loaders and writers can
 * walk the registry; the typed getters are what the transformations use.
 * Create with {@link #builder()} and replace wholesale with {@link #toBuilder()}.
 */
public final class Parameters {

    private final EnumMap<ParameterKey, Object> values;
    private final EnumMap<ParameterKey, List<Double>> lists;

    private Parameters(EnumMap<ParameterKey, Object> values, EnumMap<ParameterKey, List<Double>> lists) {
        this.values = values;
        this.lists = lists;
    }

    public static Parameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.values.putAll(values);
        return b;
    }

    public Object get(ParameterKey key) {
        return values.get(key);
    }

    public int getNumberOfSlices() { return (Integer) values.get(ParameterKey.NUMBER_OF_SLICES); }
    public int getCameraNumber() { return (Integer) values.get(ParameterKey.CAMERA_NUMBER); }
    public int getCcdNumber() { return (Integer) values.get(ParameterKey.CCD_NUMBER); }
    public int getNumberOfExposures() { return (Integer) values.get(ParameterKey.NUMBER_OF_EXPOSURES); }
    public List<Double> getVideoScales() { return doubles(ParameterKey.VIDEO_SCALES); }
    public List<Double> getReadoutNoiseParameters() { return doubles(ParameterKey.READOUT_NOISE_PARAMETERS); }
    public int getEarlyDarkPixelColumns() { return (Integer) values.get(ParameterKey.EARLY_DARK_PIXEL_COLUMNS); }
    public int getLateDarkPixelColumns() { return (Integer) values.get(ParameterKey.LATE_DARK_PIXEL_COLUMNS); }
    public int getFinalDarkPixelRows() { return (Integer) values.get(ParameterKey.FINAL_DARK_PIXEL_ROWS); }
    public int getSmearRows() { return (Integer) values.get(ParameterKey.SMEAR_ROWS); }
    public long getRandomSeed() { return (Long) values.get(ParameterKey.RANDOM_SEED); }
    public double getFullWell() { return (Double) values.get(ParameterKey.FULL_WELL); }
    public double getBloomingThreshold() { return (Double) values.get(ParameterKey.BLOOMING_THRESHOLD); }
    public double getGainLoss() { return (Double) values.get(ParameterKey.GAIN_LOSS); }
    public double getUndershootParameter() { return (Double) values.get(ParameterKey.UNDERSHOOT_PARAMETER); }
    public List<Double> getSingleFrameBaselineAdus() { return doubles(ParameterKey.SINGLE_FRAME_BASELINE_ADUS); }
    public double getSingleFrameBaselineAduDriftTerm() {
        return (Double) values.get(ParameterKey.SINGLE_FRAME_BASELINE_ADU_DRIFT_TERM);
    }
    public double getSmearRatio() { return (Double) values.get(ParameterKey.SMEAR_RATIO); }
    public int getClipLevelAdu() { return (Integer) values.get(ParameterKey.CLIP_LEVEL_ADU); }
    public String getStartOfLineRinging() { return (String) values.get(ParameterKey.START_OF_LINE_RINGING); }
    public String getPatternNoise() { return (String) values.get(ParameterKey.PATTERN_NOISE); }

    public SliceGeometry geometry() {
        return new SliceGeometry(getEarlyDarkPixelColumns(), getLateDarkPixelColumns(),
                getFinalDarkPixelRows(), getSmearRows());
    }

    private List<Double> doubles(ParameterKey key) {
        return lists.get(key);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Parameters && values.equals(((Parameters) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Parameters" + values;
    }

    public static final class Builder {

        private final EnumMap<ParameterKey, Object> values = new EnumMap<>(ParameterKey.class);

        private Builder() {
            for (ParameterKey key : ParameterKey.values()) {
                values.put(key, key.defaultValue());
            }
        }

        /** Sets a value after coercing it to the key's type; {@code null} keeps the current value. */
        public Builder set(ParameterKey key, Object value) {
            if (value != null) values.put(key, key.valueType().coerce(key.key(), value));
            return this;
        }

        public Builder numberOfSlices(int v) { return set(ParameterKey.NUMBER_OF_SLICES, v); }
        public Builder numberOfExposures(int v) { return set(ParameterKey.NUMBER_OF_EXPOSURES, v); }
        public Builder videoScales(Double... v) { return set(ParameterKey.VIDEO_SCALES, Arrays.asList(v)); }
        public Builder readoutNoiseParameters(Double... v) {
            return set(ParameterKey.READOUT_NOISE_PARAMETERS, Arrays.asList(v));
        }
        public Builder earlyDarkPixelColumns(int v) { return set(ParameterKey.EARLY_DARK_PIXEL_COLUMNS, v); }
        public Builder lateDarkPixelColumns(int v) { return set(ParameterKey.LATE_DARK_PIXEL_COLUMNS, v); }
        public Builder finalDarkPixelRows(int v) { return set(ParameterKey.FINAL_DARK_PIXEL_ROWS, v); }
        public Builder smearRows(int v) { return set(ParameterKey.SMEAR_ROWS, v); }
        public Builder randomSeed(long v) { return set(ParameterKey.RANDOM_SEED, v); }
        public Builder fullWell(double v) { return set(ParameterKey.FULL_WELL, v); }
        public Builder bloomingThreshold(double v) { return set(ParameterKey.BLOOMING_THRESHOLD, v); }
        public Builder gainLoss(double v) { return set(ParameterKey.GAIN_LOSS, v); }
        public Builder undershootParameter(double v) { return set(ParameterKey.UNDERSHOOT_PARAMETER, v); }
        public Builder singleFrameBaselineAdus(Double... v) {
            return set(ParameterKey.SINGLE_FRAME_BASELINE_ADUS, Arrays.asList(v));
        }
        public Builder singleFrameBaselineAduDriftTerm(double v) {
            return set(ParameterKey.SINGLE_FRAME_BASELINE_ADU_DRIFT_TERM, v);
        }
        public Builder smearRatio(double v) { return set(ParameterKey.SMEAR_RATIO, v); }
        public Builder clipLevelAdu(int v) { return set(ParameterKey.CLIP_LEVEL_ADU, v); }
        public Builder startOfLineRinging(String v) { return set(ParameterKey.START_OF_LINE_RINGING, v); }
        public Builder patternNoise(String v) { return set(ParameterKey.PATTERN_NOISE, v); }

        public Parameters build() {
            positive(ParameterKey.NUMBER_OF_SLICES);
            positive(ParameterKey.NUMBER_OF_EXPOSURES);
            nonNegative(ParameterKey.EARLY_DARK_PIXEL_COLUMNS);
            nonNegative(ParameterKey.LATE_DARK_PIXEL_COLUMNS);
            nonNegative(ParameterKey.FINAL_DARK_PIXEL_ROWS);
            nonNegative(ParameterKey.SMEAR_ROWS);
            nonNegative(ParameterKey.SINGLE_FRAME_BASELINE_ADU_DRIFT_TERM);
            EnumMap<ParameterKey, List<Double>> lists = new EnumMap<>(ParameterKey.class);
            for (ParameterKey key : ParameterKey.values()) {
                if (key.valueType() == ValueType.DOUBLE_LIST) lists.put(key, doubleList(key));
            }
            for (double scale : lists.get(ParameterKey.VIDEO_SCALES)) {
                if (scale <= 0) invalid(ParameterKey.VIDEO_SCALES, "entries must be positive");
            }
            for (double noise : lists.get(ParameterKey.READOUT_NOISE_PARAMETERS)) {
                if (noise < 0) invalid(ParameterKey.READOUT_NOISE_PARAMETERS, "entries must be non-negative");
            }
            return new Parameters(new EnumMap<>(values), lists);
        }

        private List<Double> doubleList(ParameterKey key) {
            List<Double> typed = new ArrayList<>();
            for (Object entry : (List<?>) values.get(key)) {
                typed.add(((Number) entry).doubleValue());
            }
            return Collections.unmodifiableList(typed);
        }

        private void positive(ParameterKey key) {
            if (((Number) values.get(key)).doubleValue() <= 0) invalid(key, "must be positive");
        }

        private void nonNegative(ParameterKey key) {
            if (((Number) values.get(key)).doubleValue() < 0) invalid(key, "must be non-negative");
        }

        private static void invalid(ParameterKey key, String reason) {
            throw new CcdSimException(Fault.INVALID_VALUE, key.key() + " " + reason);
        }
    }
}
