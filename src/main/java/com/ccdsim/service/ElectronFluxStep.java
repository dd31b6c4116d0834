package com.ccdsim.service;

import com.ccdsim.model.Converter;

import java.util.Locale;
import java.util.function.BiFunction;

/**
 * Steps turning an electron flux frame into a simulated raw frame, in execution order.
 */
public enum ElectronFluxStep implements PipelineStep {
    INTRODUCE_SMEAR_ROWS(ConverterTransforms::introduceSmearRows,
            "Fill the smear rows and add smear to the illuminated pixels"),
    ADD_SHOT_NOISE(ConverterTransforms::addShotNoise,
            "Add Gaussian-approximated Poisson noise"),
    SIMULATE_BLOOMING(ConverterTransforms::simulateBlooming,
            "Diffuse charge above the blooming threshold along columns"),
    ADD_READOUT_NOISE(ConverterTransforms::addReadoutNoise,
            "Add Gaussian video readout noise"),
    SIMULATE_UNDERSHOOT(ConverterTransforms::simulateUndershoot,
            "Subtract a fraction of the previous pixel along each row"),
    SIMULATE_START_OF_LINE_RINGING(ConverterTransforms::simulateStartOfLineRinging,
            "Add the fixed start of line ringing row to every row"),
    ADD_PATTERN_NOISE(ConverterTransforms::addPatternNoise,
            "Add the fixed pattern noise matrix"),
    ADD_BASELINE(ConverterTransforms::addBaseline,
            "Add the drifting video bias"),
    CONVERT_TO_ADU(ConverterTransforms::convertToAdu,
            "Apply the nonlinear gain and clip to the ADC range");

    private final BiFunction<Converter, TransformContext, Converter> transform;
    private final String documentation;

    ElectronFluxStep(BiFunction<Converter, TransformContext, Converter> transform, String documentation) {
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
