package com.ccdsim.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Registry of every CCD parameter, in the order they are listed and written to FITS headers.
 */
public enum ParameterKey implements SettingDescriptor {
    NUMBER_OF_SLICES(ValueType.INTEGER, 4, "NUMSLICE", null,
            "The number of slices to use in the transformation, either 1 or 4"),
    CAMERA_NUMBER(ValueType.INTEGER, 1, "CAMNUM", "CAMERA",
            "The camera number"),
    CCD_NUMBER(ValueType.INTEGER, 1, "CCDNUM", "CCD",
            "The CCD number"),
    NUMBER_OF_EXPOSURES(ValueType.INTEGER, 1, "NREADS", "NUMEXP",
            "The number of stacked exposures the image comprises"),
    VIDEO_SCALES(ValueType.DOUBLE_LIST, perSlice(5.5), "VSCALE", null,
            "Video scaling constants for converting between ADU and electron counts, one per slice. "
                    + "Units: electrons per ADU"),
    READOUT_NOISE_PARAMETERS(ValueType.DOUBLE_LIST, perSlice(9.5), "RDNOISE", null,
            "Video readout noise standard deviation in electrons, one per slice"),
    EARLY_DARK_PIXEL_COLUMNS(ValueType.INTEGER, 11, "EDARKCOL", null,
            "The number of dark pixel columns read out before the illuminated pixels of a row"),
    LATE_DARK_PIXEL_COLUMNS(ValueType.INTEGER, 11, "LDARKCOL", null,
            "The number of dark pixel columns read out after the illuminated pixels of a row"),
    FINAL_DARK_PIXEL_ROWS(ValueType.INTEGER, 10, "FDARKROW", null,
            "The number of dark pixel rows read out last"),
    SMEAR_ROWS(ValueType.INTEGER, 10, "SMEARROW", null,
            "The number of smear rows read out between the illuminated rows and the final dark rows"),
    RANDOM_SEED(ValueType.LONG, -1L, "RNGSEED", null,
            "Seed for the random number generator, -1 to seed from system entropy"),
    FULL_WELL(ValueType.DOUBLE, 200000.0, "FULLWELL", null,
            "The maximum number of electrons a pixel can hold"),
    BLOOMING_THRESHOLD(ValueType.DOUBLE, 150000.0, "BLMTHRSH", null,
            "The number of electrons in a pixel that drives significant diffusion to its neighbours"),
    GAIN_LOSS(ValueType.DOUBLE, 0.01, "GAINLOSS", null,
            "The relative decrease in video gain over the total ADC range"),
    UNDERSHOOT_PARAMETER(ValueType.DOUBLE, 0.001, "UNDRSHT", null,
            "Fraction of the previous pixel's signal subtracted by the video chain, dimensionless"),
    SINGLE_FRAME_BASELINE_ADUS(ValueType.DOUBLE_LIST, perSlice(6000.0), "BASELIN", null,
            "Expected video bias in ADU for a single frame, one per slice"),
    SINGLE_FRAME_BASELINE_ADU_DRIFT_TERM(ValueType.DOUBLE, 10.0, "BASEDRFT", null,
            "Standard deviation in ADU of the video bias"),
    SMEAR_RATIO(ValueType.DOUBLE, 9.79541e-06, "SMRATIO", null,
            "Ratio of the parallel clock period to the nominal exposure time of a single frame"),
    CLIP_LEVEL_ADU(ValueType.INTEGER, 60000, "CLIPADU", null,
            "Maximum analog to digital converter output for a single frame. Units: ADU"),
    START_OF_LINE_RINGING(ValueType.STRING, "built-in start_of_line_ringing.npz", "SOLRING", null,
            "Archive holding one start of line ringing row per slice. Units: electrons"),
    PATTERN_NOISE(ValueType.STRING, "built-in pattern_noise.npz", "PATNOISE", null,
            "Archive holding one fixed pattern noise matrix per slice. Units: electrons");

    private final ValueType valueType;
    private final Object defaultValue;
    private final String primaryKeyword;
    private final String alternateKeyword;
    private final String documentation;

    ParameterKey(ValueType valueType, Object defaultValue, String primaryKeyword, String alternateKeyword,
                 String documentation) {
        this.valueType = valueType;
        this.defaultValue = defaultValue;
        this.primaryKeyword = primaryKeyword;
        this.alternateKeyword = alternateKeyword;
        this.documentation = documentation;
    }

    @Override
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public ValueType valueType() {
        return valueType;
    }

    @Override
    public Object defaultValue(Direction direction) {
        return defaultValue;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    @Override
    public String primaryKeyword() {
        return primaryKeyword;
    }

    @Override
    public String alternateKeyword() {
        return alternateKeyword;
    }

    @Override
    public boolean isRequired(Direction direction) {
        // Raw frames are meaningless without knowing how many reads were co-added
        return this == NUMBER_OF_EXPOSURES && direction == Direction.RAW;
    }

    @Override
    public List<String> forbiddenKeywords() {
        if (this == VIDEO_SCALES) {
            // vendor GAIN cards are ambiguous (ADU per electron on some cameras)
            return Collections.singletonList("GAIN");
        }
        return Collections.emptyList();
    }

    @Override
    public String documentation() {
        return documentation;
    }

    /** Looks up a parameter by its snake_case name; returns {@code null} when unknown. */
    public static ParameterKey fromKey(String key) {
        for (ParameterKey p : values()) {
            if (p.key().equals(key)) return p;
        }
        return null;
    }

    private static List<Double> perSlice(double value) {
        return Collections.unmodifiableList(Arrays.asList(value, value, value, value));
    }
}
