package com.ccdsim.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable record of which physical effects are currently present in a frame.
 * <p>
 * Doubles as the state machine guarding the pipeline: every step checks its
 * precondition with {@link #require(Effect, boolean, String)} and moves to the
 * next state with {@link #with(Effect, boolean)}, one effect at a time.
 */
public final class Flags {

    private final EnumMap<Effect, Boolean> present;

    private Flags(EnumMap<Effect, Boolean> present) {
        this.present = present;
    }

    public static Flags defaults(Direction direction) {
        EnumMap<Effect, Boolean> map = new EnumMap<>(Effect.class);
        for (Effect e : Effect.values()) {
            map.put(e, (Boolean) e.defaultValue(direction));
        }
        return new Flags(map);
    }

    /** Builds flags from explicit values; effects missing from the map take the direction's default. */
    public static Flags of(Direction direction, Map<Effect, Boolean> values) {
        EnumMap<Effect, Boolean> map = new EnumMap<>(defaults(direction).present);
        for (Map.Entry<Effect, Boolean> entry : values.entrySet()) {
            if (entry.getValue() != null) map.put(entry.getKey(), entry.getValue());
        }
        return new Flags(map);
    }

    public boolean isPresent(Effect effect) {
        return present.get(effect);
    }

    public Flags with(Effect effect, boolean value) {
        EnumMap<Effect, Boolean> copy = new EnumMap<>(present);
        copy.put(effect, value);
        return new Flags(copy);
    }

    public void require(Effect effect, boolean expected, String step) {
        if (isPresent(effect) != expected) {
            throw new CcdSimException(Fault.FLAG_PRECONDITION,
                    "Step " + step + " requires " + effect.key() + " to be " + expected
                            + " but it is " + isPresent(effect));
        }
    }

    public boolean isSmearRowsPresent() { return isPresent(Effect.SMEAR_ROWS); }
    public boolean isShotNoisePresent() { return isPresent(Effect.SHOT_NOISE); }
    public boolean isBloomingPresent() { return isPresent(Effect.BLOOMING); }
    public boolean isReadoutNoisePresent() { return isPresent(Effect.READOUT_NOISE); }
    public boolean isUndershootPresent() { return isPresent(Effect.UNDERSHOOT); }
    public boolean isStartOfLineRingingPresent() { return isPresent(Effect.START_OF_LINE_RINGING); }
    public boolean isPatternNoisePresent() { return isPresent(Effect.PATTERN_NOISE); }
    public boolean isBaselinePresent() { return isPresent(Effect.BASELINE); }
    public boolean isInAdu() { return isPresent(Effect.IN_ADU); }

    @Override
    public boolean equals(Object o) {
        return o instanceof Flags && present.equals(((Flags) o).present);
    }

    @Override
    public int hashCode() {
        return present.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Flags{");
        for (Effect e : Effect.values()) {
            if (sb.length() > 6) sb.append(", ");
            sb.append(e.key()).append('=').append(present.get(e));
        }
        return sb.append('}').toString();
    }
}
