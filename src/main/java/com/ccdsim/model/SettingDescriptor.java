package com.ccdsim.model;

import java.util.List;

/**
 * Describes one resolvable setting: its name, type, default and where it lives in a FITS header.
 */
public interface SettingDescriptor {

    String key();

    ValueType valueType();

    Object defaultValue(Direction direction);

    /** Primary FITS keyword; for list values the prefix of the indexed keywords. */
    String primaryKeyword();

    String alternateKeyword();

    boolean isRequired(Direction direction);

    List<String> forbiddenKeywords();

    String documentation();
}
