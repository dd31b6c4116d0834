package com.ccdsim.service;

import com.ccdsim.model.CcdSimException;
import com.ccdsim.model.Fault;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One optional on/off choice per step of a registry. Unset steps take their default.
 *
 * @param <S> the step registry, {@link ElectronFluxStep} or {@link RawStep}
 */
public final class StepSettings<S extends Enum<S> & PipelineStep> {

    private final Class<S> registry;
    private final EnumMap<S, Boolean> choices;

    private StepSettings(Class<S> registry, EnumMap<S, Boolean> choices) {
        this.registry = registry;
        this.choices = choices;
    }

    public static <S extends Enum<S> & PipelineStep> StepSettings<S> defaults(Class<S> registry) {
        return new StepSettings<>(registry, new EnumMap<>(registry));
    }

    /**
     * Builds settings from step names; {@code null} values stay unset.
     *
     * @throws CcdSimException with {@link Fault#UNKNOWN_KEY} naming every valid step
     */
    public static <S extends Enum<S> & PipelineStep> StepSettings<S> fromNames(Class<S> registry,
                                                                              Map<String, Boolean> names) {
        EnumMap<S, Boolean> choices = new EnumMap<>(registry);
        for (Map.Entry<String, Boolean> entry : names.entrySet()) {
            S step = find(registry, entry.getKey());
            if (step == null) {
                throw new CcdSimException(Fault.UNKNOWN_KEY,
                        "Unknown step \"" + entry.getKey() + "\". Valid steps: " + describe(registry));
            }
            if (entry.getValue() != null) choices.put(step, entry.getValue());
        }
        return new StepSettings<>(registry, choices);
    }

    public StepSettings<S> with(S step, boolean enabled) {
        EnumMap<S, Boolean> copy = new EnumMap<>(choices);
        copy.put(step, enabled);
        return new StepSettings<>(registry, copy);
    }

    public boolean isEnabled(S step) {
        Boolean choice = choices.get(step);
        return choice == null ? step.isEnabledByDefault() : choice;
    }

    public List<S> enabledSteps() {
        List<S> enabled = new ArrayList<>();
        for (S step : EnumSet.allOf(registry)) {
            if (isEnabled(step)) enabled.add(step);
        }
        return enabled;
    }

    public static <S extends Enum<S> & PipelineStep> S find(Class<S> registry, String name) {
        String normalized = name.trim().replace('-', '_').toLowerCase(Locale.ROOT);
        for (S step : registry.getEnumConstants()) {
            if (step.key().equals(normalized)) return step;
        }
        return null;
    }

    static <S extends Enum<S> & PipelineStep> String describe(Class<S> registry) {
        List<String> parts = new ArrayList<>();
        for (S step : registry.getEnumConstants()) {
            parts.add(step.key() + " (default " + step.isEnabledByDefault() + ")");
        }
        return String.join(", ", parts);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof StepSettings)) return false;
        StepSettings<?> other = (StepSettings<?>) o;
        return registry == other.registry && choices.equals(other.choices);
    }

    @Override
    public int hashCode() {
        return registry.hashCode() * 31 + choices.hashCode();
    }

    @Override
    public String toString() {
        return registry.getSimpleName() + choices;
    }
}
