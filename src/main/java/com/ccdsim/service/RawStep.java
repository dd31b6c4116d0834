package com.ccdsim.service;

import com.ccdsim.model.Converter;

import java.util.Locale;
import java.util.function.BiFunction;

/**
 * Steps calibrating a raw frame back to electrons, in execution order.
 * Blooming, shot noise and readout noise have no inverse.
 */
public enum RawStep implements PipelineStep {
    CONVERT_TO_ELECTRONS(ConverterTransforms::convertToElectrons,
            "Invert the nonlinear gain"),
    REMOVE_BASELINE(ConverterTransforms::removeBaseline,
            "Subtract the mean of the dark columns"),
    REMOVE_PATTERN_NOISE(ConverterTransforms::removePatternNoise,
            "Subtract the fixed pattern noise matrix"),
    REMOVE_START_OF_LINE_RINGING(ConverterTransforms::removeStartOfLineRinging,
            "Subtract the column-wise mean of the final dark rows"),
    REMOVE_UNDERSHOOT(ConverterTransforms::removeUndershoot,
            "Add back a fraction of the previous pixel along each row"),
    REMOVE_SMEAR(ConverterTransforms::removeSmear,
            "Subtract the column-wise mean of the smear rows");

    private final BiFunction<Converter, TransformContext, Converter> transform;
    private final String documentation;

    RawStep(BiFunction<Converter, TransformContext, Converter> transform, String documentation) {
        this.transform = transform;
        this.documentation = documentation;
    }

    @Override
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String documentation() {
        return documentation;
    }

    @Override
    public boolean isEnabledByDefault() {
        return true;
    }

    @Override
    public Converter apply(Converter converter, TransformContext context) {
        return transform.apply(converter, context);
    }
}
