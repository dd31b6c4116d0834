package com.ccdsim.service;

import com.ccdsim.model.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * Folds a converter through the enabled steps of a registry, in canonical order, one step at a time.
 */
public class TransformationPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransformationPipeline.class);

    /** Random seed value meaning "seed from system entropy". */
    public static final long ENTROPY_SEED = -1L;

    private final AuxiliaryArraySource resources;

    public TransformationPipeline(AuxiliaryArraySource resources) {
        this.resources = resources;
    }

    /**
     * Electron flux to simulated raw. The random stream is seeded once from {@code random_seed}
     * so a run with a fixed seed is reproducible.
     */
    public Converter simulateRaw(Converter converter, StepSettings<ElectronFluxStep> settings) {
        long seed = converter.getParameters().getRandomSeed();
        Random random = seed == ENTROPY_SEED ? new Random() : new Random(seed);
        if (seed == ENTROPY_SEED) {
            log.info("Simulating raw frame with an entropy-seeded random stream");
        } else {
            log.info("Simulating raw frame with random seed {}", seed);
        }
        return run(converter, settings.enabledSteps(), new TransformContext(random, resources));
    }

    public Converter calibrate(Converter converter, StepSettings<RawStep> settings) {
        log.info("Calibrating raw frame");
        return run(converter, settings.enabledSteps(), new TransformContext(new Random(0L), resources));
    }

    <S extends PipelineStep> Converter run(Converter converter, List<S> steps, TransformContext context) {
        Converter current = converter;
        for (S step : steps) {
            long start = System.nanoTime();
            current = step.apply(current, context);
            log.debug("{} done in {} ms", step.key(), (System.nanoTime() - start) / 1_000_000);
        }
        log.info("Applied {} step(s): {}", steps.size(), current.getFlags());
        return current;
    }
}
