package com.ccdsim.service;

import com.ccdsim.model.Converter;
import com.ccdsim.model.Direction;
import com.ccdsim.model.Effect;
import com.ccdsim.model.Parameters;
import com.ccdsim.model.PixelUnits;
import com.ccdsim.model.Slice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class TransformationPipelineTest {

    private final TransformationPipeline pipeline = new TransformationPipeline(TestFrames.resources(2));

    @Test
    @DisplayName("The order settings are declared in does not change the steps or the output")
    void settingsOrderDoesNotMatter() {
        Map<String, Boolean> forward = new LinkedHashMap<>();
        forward.put("simulate_blooming", false);
        forward.put("add_pattern_noise", true);
        forward.put("simulate_undershoot", false);
        Map<String, Boolean> backward = new LinkedHashMap<>();
        backward.put("simulate_undershoot", false);
        backward.put("add_pattern_noise", true);
        backward.put("simulate_blooming", false);
        StepSettings<ElectronFluxStep> a = StepSettings.fromNames(ElectronFluxStep.class, forward);
        StepSettings<ElectronFluxStep> b = StepSettings.fromNames(ElectronFluxStep.class, backward);
        Converter input = TestFrames.electronFluxConverter(TestFrames.smallParameters(2).build());

        Converter first = pipeline.simulateRaw(input, a);
        Converter second = pipeline.simulateRaw(input, b);

        assertThat(a.enabledSteps()).isEqualTo(b.enabledSteps());
        assertThat(first.getSlices()).isEqualTo(second.getSlices());
        assertThat(first.getFlags()).isEqualTo(second.getFlags());
    }

    @Test
    void fixedSeedMakesForwardRunsReproducible() {
        Converter input = TestFrames.electronFluxConverter(TestFrames.smallParameters(2).randomSeed(99).build());
        StepSettings<ElectronFluxStep> all = StepSettings.defaults(ElectronFluxStep.class);

        assertThat(pipeline.simulateRaw(input, all).getSlices())
                .isEqualTo(pipeline.simulateRaw(input, all).getSlices());
    }

    @Test
    void fullForwardRunLeavesEveryEffectPresentInAdu() {
        Converter input = TestFrames.electronFluxConverter(TestFrames.smallParameters(2).build());

        Converter raw = pipeline.simulateRaw(input, StepSettings.defaults(ElectronFluxStep.class));

        for (Effect effect : Effect.values()) {
            assertThat(raw.getFlags().isPresent(effect)).as(effect.key()).isTrue();
        }
        for (Slice slice : raw.getSlices()) {
            assertThat(slice.getUnits()).isEqualTo(PixelUnits.ADU);
        }
        assertThat(input.getFlags().isInAdu()).isFalse();
    }

    @Test
    @DisplayName("Calibration recovers the illuminated pixels of a noiseless simulation")
    void calibrationInvertsNoiselessSimulation() {
        Parameters parameters = TestFrames.smallParameters(2)
                .singleFrameBaselineAduDriftTerm(0)
                .undershootParameter(0)
                .smearRatio(0.002)
                .build();
        Converter input = TestFrames.electronFluxConverter(parameters);
        StepSettings<ElectronFluxStep> noiseless = StepSettings.defaults(ElectronFluxStep.class)
                .with(ElectronFluxStep.ADD_SHOT_NOISE, false)
                .with(ElectronFluxStep.SIMULATE_BLOOMING, false)
                .with(ElectronFluxStep.ADD_READOUT_NOISE, false);

        Converter simulated = pipeline.simulateRaw(input, noiseless);
        Converter raw = new Converter(Direction.RAW, simulated.getSlices(), simulated.getMetadata(),
                simulated.getParameters(), simulated.getFlags());
        Converter calibrated = pipeline.calibrate(raw, StepSettings.defaults(RawStep.class));

        for (int s = 0; s < 2; s++) {
            Slice expected = input.getSlices().get(s);
            Slice actual = calibrated.getSlices().get(s);
            assertThat(actual.getUnits()).isEqualTo(PixelUnits.ELECTRONS);
            for (int r = 0; r < TestFrames.IMAGE_ROWS; r++) {
                for (int c = 2; c < TestFrames.COLUMNS - 2; c++) {
                    assertThat(actual.get(r, c)).isCloseTo(expected.get(r, c), within(1e-6));
                }
            }
        }
        assertThat(calibrated.getFlags().isInAdu()).isFalse();
        assertThat(calibrated.getFlags().isBaselinePresent()).isFalse();
        assertThat(calibrated.getFlags().isSmearRowsPresent()).isFalse();
    }

    @Test
    void failingStepAbortsTheRun() {
        Converter input = TestFrames.electronFluxConverter(TestFrames.smallParameters(2).build());
        Converter alreadyInAdu = pipeline.simulateRaw(input, StepSettings.fromNames(ElectronFluxStep.class,
                onlyConversion()));

        assertThatThrownBy(() -> pipeline.simulateRaw(alreadyInAdu, StepSettings.fromNames(ElectronFluxStep.class,
                onlyConversion())))
                .hasMessageContaining("FLAG_PRECONDITION");
    }

    private static Map<String, Boolean> onlyConversion() {
        Map<String, Boolean> names = new LinkedHashMap<>();
        for (ElectronFluxStep step : ElectronFluxStep.values()) {
            names.put(step.key(), step == ElectronFluxStep.CONVERT_TO_ADU);
        }
        return names;
    }
}
