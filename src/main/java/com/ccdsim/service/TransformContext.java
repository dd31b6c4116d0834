package com.ccdsim.service;

import java.util.Random;

/**
 * Explicit inputs a step needs besides the converter: the random stream and the resource loader.
 * The same context is threaded through every step of one pipeline run.
 */
public class TransformContext {

    private final Random random;
    private final AuxiliaryArraySource resources;

    public TransformContext(Random random, AuxiliaryArraySource resources) {
        this.random = random;
        this.resources = resources;
    }

    public Random getRandom() {
        return random;
    }

    public AuxiliaryArraySource getResources() {
        return resources;
    }
}
