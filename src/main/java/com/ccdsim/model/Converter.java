package com.ccdsim.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The unit of work: the slices of one CCD frame with their metadata, parameters and flags.
 * <p>
 * Immutable. Every pipeline step returns a new converter; the one passed in is never altered.
 */
public final class Converter {

    private final Direction direction;
    private final List<Slice> slices;
    private final FrameMetadata metadata;
    private final Parameters parameters;
    private final Flags flags;

    public Converter(Direction direction, List<Slice> slices, FrameMetadata metadata,
                     Parameters parameters, Flags flags) {
        if (slices.isEmpty()) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "A converter needs at least one slice");
        }
        this.direction = direction;
        this.slices = Collections.unmodifiableList(new ArrayList<>(slices));
        this.metadata = metadata;
        this.parameters = parameters;
        this.flags = flags;
    }

    public Direction getDirection() {
        return direction;
    }

    public List<Slice> getSlices() {
        return slices;
    }

    public int sliceCount() {
        return slices.size();
    }

    public FrameMetadata getMetadata() {
        return metadata;
    }

    public Parameters getParameters() {
        return parameters;
    }

    public Flags getFlags() {
        return flags;
    }

    public Converter withSlicesAndFlags(List<Slice> newSlices, Flags newFlags) {
        return new Converter(direction, newSlices, metadata, parameters, newFlags);
    }

    @Override
    public String toString() {
        return "Converter{" + direction + ", slices=" + slices.size() + ", origin="
                + metadata.getOriginFileName() + ", " + flags + "}";
    }
}
