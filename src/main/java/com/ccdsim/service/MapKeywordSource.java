package com.ccdsim.service;

import com.ccdsim.model.ValueType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword source backed by a map. Keywords are matched case-insensitively, as FITS keywords are.
 */
public class MapKeywordSource implements KeywordSource {

    private final Map<String, Object> values = new HashMap<>();

    public MapKeywordSource(Map<String, ?> values) {
        for (Map.Entry<String, ?> e : values.entrySet()) {
            this.values.put(e.getKey().toUpperCase(Locale.ROOT), e.getValue());
        }
    }

    @Override
    public boolean contains(String keyword) {
        return values.containsKey(keyword.toUpperCase(Locale.ROOT));
    }

    @Override
    public Object read(String keyword, ValueType type) {
        return values.get(keyword.toUpperCase(Locale.ROOT));
    }
}
