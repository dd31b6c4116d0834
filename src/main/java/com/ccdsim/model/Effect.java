package com.ccdsim.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One physical effect whose presence in a frame's pixel data is tracked by {@link Flags}.
 */
public enum Effect implements SettingDescriptor {
    SMEAR_ROWS("smear_rows_present", "SMEARPRS", "Indicates whether there is data in the smear rows"),
    SHOT_NOISE("shot_noise_present", "SHOTPRS", "Indicates whether shot noise is present"),
    BLOOMING("blooming_present", "BLOOMPRS", "Indicates whether blooming is present"),
    READOUT_NOISE("readout_noise_present", "RDNOIPRS", "Indicates whether readout noise is present"),
    UNDERSHOOT("undershoot_present", "UNDRSPRS", "Indicates whether undershoot is present"),
    START_OF_LINE_RINGING("start_of_line_ringing_present", "SOLRPRS",
            "Indicates whether start of line ringing is present"),
    PATTERN_NOISE("pattern_noise_present", "PATNPRS", "Indicates whether pattern noise is present"),
    BASELINE("baseline_present", "BASEPRS", "Indicates whether a video baseline is present"),
    IN_ADU("in_adu", "INADU", "Indicates whether pixel values are in ADU rather than electrons");

    private final String key;
    private final String keyword;
    private final String documentation;

    Effect(String key, String keyword, String documentation) {
        this.key = key;
        this.keyword = keyword;
        this.documentation = documentation;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public ValueType valueType() {
        return ValueType.BOOLEAN;
    }

    /** Electron flux frames start clean; raw frames carry every effect. */
    @Override
    public Object defaultValue(Direction direction) {
        return Boolean.valueOf(direction == Direction.RAW);
    }

    @Override
    public String primaryKeyword() {
        return keyword;
    }

    @Override
    public String alternateKeyword() {
        return null;
    }

    @Override
    public boolean isRequired(Direction direction) {
        return false;
    }

    @Override
    public List<String> forbiddenKeywords() {
        return Collections.emptyList();
    }

    @Override
    public String documentation() {
        return documentation;
    }

    public static Effect fromKey(String key) {
        String normalized = key.toLowerCase(Locale.ROOT);
        for (Effect e : values()) {
            if (e.key.equals(normalized)) return e;
        }
        return null;
    }
}
