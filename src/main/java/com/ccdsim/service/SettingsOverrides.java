package com.ccdsim.service;

import com.ccdsim.model.CcdSimException;
import com.ccdsim.model.Effect;
import com.ccdsim.model.Fault;
import com.ccdsim.model.ParameterKey;
import com.ccdsim.model.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * User-supplied settings: one optional value per parameter, flag and pipeline step.
 * <p>
 * Built from the flat key map that config files and {@code --set} produce. Every key must name
 * a parameter, a flag or a step of either pipeline; anything else fails at parse time.
 */
public final class SettingsOverrides {

    private final EnumMap<ParameterKey, Object> parameters;
    private final EnumMap<Effect, Boolean> flags;
    private final Map<String, Boolean> steps;

    private SettingsOverrides(EnumMap<ParameterKey, Object> parameters, EnumMap<Effect, Boolean> flags,
                              Map<String, Boolean> steps) {
        this.parameters = parameters;
        this.flags = flags;
        this.steps = steps;
    }

    public static SettingsOverrides none() {
        return new SettingsOverrides(new EnumMap<>(ParameterKey.class), new EnumMap<>(Effect.class),
                new LinkedHashMap<>());
    }

    /**
     * Routes and coerces every entry. {@code null} values are treated as unset.
     *
     * @throws CcdSimException with {@link Fault#UNKNOWN_KEY} listing every valid key, or
     *         {@link Fault#INVALID_VALUE} when a value does not fit its setting's type
     */
    public static SettingsOverrides parse(Map<String, ?> entries) {
        EnumMap<ParameterKey, Object> parameters = new EnumMap<>(ParameterKey.class);
        EnumMap<Effect, Boolean> flags = new EnumMap<>(Effect.class);
        Map<String, Boolean> steps = new LinkedHashMap<>();

        for (Map.Entry<String, ?> entry : entries.entrySet()) {
            String key = normalize(entry.getKey());
            Object value = entry.getValue();

            ParameterKey parameter = ParameterKey.fromKey(key);
            Effect effect = Effect.fromKey(key);
            boolean isStep = StepSettings.find(ElectronFluxStep.class, key) != null
                    || StepSettings.find(RawStep.class, key) != null;

            if (parameter == null && effect == null && !isStep) {
                throw new CcdSimException(Fault.UNKNOWN_KEY,
                        "Unknown setting \"" + entry.getKey() + "\". Valid settings:\n" + describeValidKeys());
            }
            if (value == null) {
                continue;
            }
            if (parameter != null) {
                parameters.put(parameter, parameter.valueType().coerce(key, value));
            } else if (effect != null) {
                flags.put(effect, (Boolean) ValueType.BOOLEAN.coerce(key, value));
            } else {
                steps.put(key, (Boolean) ValueType.BOOLEAN.coerce(key, value));
            }
        }
        return new SettingsOverrides(parameters, flags, steps);
    }

    public Object parameter(ParameterKey key) {
        return parameters.get(key);
    }

    public Boolean flag(Effect effect) {
        return flags.get(effect);
    }

    public Map<ParameterKey, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /** Step choices that belong to {@code registry}; steps of the other pipeline are ignored. */
    public <S extends Enum<S> & PipelineStep> StepSettings<S> stepSettings(Class<S> registry) {
        Map<String, Boolean> own = new LinkedHashMap<>();
        for (Map.Entry<String, Boolean> e : steps.entrySet()) {
            if (StepSettings.find(registry, e.getKey()) != null) own.put(e.getKey(), e.getValue());
        }
        return StepSettings.fromNames(registry, own);
    }

    public boolean isEmpty() {
        return parameters.isEmpty() && flags.isEmpty() && steps.isEmpty();
    }

    static String normalize(String key) {
        return key.trim().replace('-', '_').toLowerCase(Locale.ROOT);
    }

    /** One line per valid key with its default, parameters first. */
    public static String describeValidKeys() {
        List<String> lines = new ArrayList<>();
        for (ParameterKey p : ParameterKey.values()) {
            lines.add("  " + p.key() + " (default " + p.valueType().format(p.defaultValue()) + ")");
        }
        for (Effect e : Effect.values()) {
            lines.add("  " + e.key() + " (default false for electron flux, true for raw)");
        }
        for (ElectronFluxStep s : ElectronFluxStep.values()) {
            lines.add("  " + s.key() + " (default " + s.isEnabledByDefault() + ")");
        }
        for (RawStep s : RawStep.values()) {
            lines.add("  " + s.key() + " (default " + s.isEnabledByDefault() + ")");
        }
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return "SettingsOverrides{parameters=" + parameters + ", flags=" + flags + ", steps=" + steps + "}";
    }
}
