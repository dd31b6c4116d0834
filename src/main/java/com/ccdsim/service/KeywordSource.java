package com.ccdsim.service;

import com.ccdsim.model.ValueType;

import java.util.Collections;

/**
 * Keyword-indexed metadata a frame's settings can be read from, typically a FITS header.
 */
public interface KeywordSource {

    boolean contains(String keyword);

    /**
     * Reads a scalar keyword.
     *
     * @param type the expected type, never {@link ValueType#DOUBLE_LIST}
     * @return the raw value, or {@code null} when the keyword is absent
     */
    Object read(String keyword, ValueType type);

    static KeywordSource empty() {
        return new MapKeywordSource(Collections.<String, Object>emptyMap());
    }
}
