package com.ccdsim.service;

import com.ccdsim.model.Direction;
import com.ccdsim.model.Effect;
import com.ccdsim.model.Flags;
import com.ccdsim.model.HeaderIssue;
import com.ccdsim.model.ParameterKey;
import com.ccdsim.model.Parameters;
import com.ccdsim.model.SettingDescriptor;
import com.ccdsim.model.ValueType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/**
 * Resolves each setting from an explicit override, else the primary keyword, else the alternate
 * keyword, else the typed default. Required and forbidden keywords are reported, never fatal.
 */
public final class SettingResolver {

    private SettingResolver() {
    }

    /**
     * @return the typed value of {@code descriptor}
     * @throws com.ccdsim.model.CcdSimException with {@link com.ccdsim.model.Fault#INVALID_VALUE}
     *         if the winning value does not fit the setting's type
     */
    public static Object resolve(SettingDescriptor descriptor, Direction direction, Object override,
                                 KeywordSource source) {
        ValueType type = descriptor.valueType();
        if (override != null) {
            return type.coerce(descriptor.key(), override);
        }
        Object raw = lookup(source, descriptor.primaryKeyword(), type);
        if (raw == null && descriptor.alternateKeyword() != null) {
            raw = lookup(source, descriptor.alternateKeyword(), type);
        }
        if (raw == null) {
            return descriptor.defaultValue(direction);
        }
        return type.coerce(descriptor.key(), raw);
    }

    public static List<HeaderIssue> inspect(SettingDescriptor descriptor, Direction direction, Object override,
                                            KeywordSource source) {
        List<HeaderIssue> issues = new ArrayList<>();
        if (override == null && descriptor.isRequired(direction)
                && lookup(source, descriptor.primaryKeyword(), descriptor.valueType()) == null
                && (descriptor.alternateKeyword() == null
                    || lookup(source, descriptor.alternateKeyword(), descriptor.valueType()) == null)) {
            issues.add(new HeaderIssue(HeaderIssue.Kind.MISSING_REQUIRED, descriptor.key(),
                    descriptor.primaryKeyword()));
        }
        for (String forbidden : descriptor.forbiddenKeywords()) {
            if (source.contains(forbidden)) {
                issues.add(new HeaderIssue(HeaderIssue.Kind.FORBIDDEN_PRESENT, descriptor.key(), forbidden));
            }
        }
        return issues;
    }

    public static ResolvedSettings resolveAll(Direction direction, SettingsOverrides overrides,
                                              KeywordSource source) {
        List<HeaderIssue> issues = new ArrayList<>();

        Parameters.Builder parameters = Parameters.builder();
        for (ParameterKey key : ParameterKey.values()) {
            Object override = overrides.parameter(key);
            parameters.set(key, resolve(key, direction, override, source));
            issues.addAll(inspect(key, direction, override, source));
        }

        EnumMap<Effect, Boolean> flags = new EnumMap<>(Effect.class);
        for (Effect effect : Effect.values()) {
            Boolean override = overrides.flag(effect);
            flags.put(effect, (Boolean) resolve(effect, direction, override, source));
            issues.addAll(inspect(effect, direction, override, source));
        }
        return new ResolvedSettings(parameters.build(), Flags.of(direction, flags), issues);
    }

    /**
     * List values live under indexed keywords ({@code VSCALE1}, {@code VSCALE2}, ...);
     * a bare prefix keyword holding the whole list is accepted too.
     */
    static Object lookup(KeywordSource source, String keyword, ValueType type) {
        if (type != ValueType.DOUBLE_LIST) {
            return source.contains(keyword) ? source.read(keyword, type) : null;
        }
        List<Object> values = new ArrayList<>();
        for (int i = 1; source.contains(keyword + i); i++) {
            values.add(source.read(keyword + i, ValueType.DOUBLE));
        }
        if (!values.isEmpty()) {
            return values;
        }
        return source.contains(keyword) ? source.read(keyword, ValueType.STRING) : null;
    }
}
