package com.ccdsim.service;

import com.ccdsim.model.CcdSimException;
import com.ccdsim.model.PixelUnits;
import com.ccdsim.model.Slice;
import com.ccdsim.model.SliceGeometry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.ccdsim.service.TestFrames.COLUMNS;
import static com.ccdsim.service.TestFrames.GEOMETRY;
import static com.ccdsim.service.TestFrames.IMAGE_ROWS;
import static com.ccdsim.service.TestFrames.ROWS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class SliceTransformsTest {

    private static final double SMEAR_RATIO = 0.01;

    @Nested
    @DisplayName("Smear")
    class Smear {

        @Test
        @DisplayName("Smear rows hold ratio times the column sum, illuminated rows gain the same vector")
        void introduceFillsSmearRows() {
            Slice slice = TestFrames.electronFluxSlice(0);

            Slice smeared = SliceTransforms.introduceSmearRows(slice, SMEAR_RATIO, GEOMETRY);

            for (int c = 2; c < COLUMNS - 2; c++) {
                double sum = 0;
                for (int r = 0; r < IMAGE_ROWS; r++) sum += slice.get(r, c);
                double expected = SMEAR_RATIO * sum;
                for (int r = IMAGE_ROWS; r < IMAGE_ROWS + 3; r++) {
                    assertThat(smeared.get(r, c)).isCloseTo(expected, within(1e-9));
                }
                for (int r = 0; r < IMAGE_ROWS; r++) {
                    assertThat(smeared.get(r, c)).isCloseTo(slice.get(r, c) + expected, within(1e-9));
                }
                for (int r = IMAGE_ROWS + 3; r < ROWS; r++) {
                    assertThat(smeared.get(r, c)).isEqualTo(0.0);
                }
            }
            for (int r = 0; r < ROWS; r++) {
                assertThat(smeared.get(r, 0)).isEqualTo(0.0);
                assertThat(smeared.get(r, COLUMNS - 1)).isEqualTo(0.0);
            }
        }

        @Test
        void introduceRejectsNonEmptySmearRows() {
            Slice smeared = SliceTransforms.introduceSmearRows(TestFrames.electronFluxSlice(0), SMEAR_RATIO, GEOMETRY);

            assertThatThrownBy(() -> SliceTransforms.introduceSmearRows(smeared, SMEAR_RATIO, GEOMETRY))
                    .isInstanceOf(CcdSimException.class)
                    .hasMessageContaining("already introduced");
        }

        @Test
        void removeUndoesIntroduce() {
            Slice slice = TestFrames.electronFluxSlice(1);

            Slice restored = SliceTransforms.removeSmear(
                    SliceTransforms.introduceSmearRows(slice, SMEAR_RATIO, GEOMETRY), GEOMETRY);

            // final dark rows pick up minus the smear estimate
            for (int r = 0; r < IMAGE_ROWS + 3; r++) {
                for (int c = 0; c < COLUMNS; c++) {
                    assertThat(restored.get(r, c)).isCloseTo(slice.get(r, c), within(1e-9));
                }
            }
        }

        @Test
        void removeRejectsEmptySmearRows() {
            assertThatThrownBy(() -> SliceTransforms.removeSmear(TestFrames.electronFluxSlice(0), GEOMETRY))
                    .isInstanceOf(CcdSimException.class)
                    .hasMessageContaining("FLAG_PRECONDITION");
        }
    }

    @Nested
    @DisplayName("Blooming")
    class Blooming {

        private final SliceGeometry imageOnly = new SliceGeometry(0, 0, 0, 0);

        @Test
        @DisplayName("Columns settle at or below exposures times full well")
        void columnsConverge() {
            double[][] pixels = new double[50][2];
            pixels[20][0] = 900000;
            pixels[21][0] = 400000;
            pixels[5][1] = 250000;
            Slice slice = new Slice(0, PixelUnits.ELECTRONS, pixels);

            Slice bloomed = SliceTransforms.simulateBlooming(slice, 100000, 80000, 2, imageOnly);

            for (int c = 0; c < 2; c++) {
                for (int r = 0; r < 50; r++) assertThat(bloomed.get(r, c)).isLessThanOrEqualTo(200000.0);
            }
            assertThat(bloomed.get(5, 1)).isLessThan(250000.0);
        }

        @Test
        @DisplayName("One diffusion step runs even when nothing is saturated")
        void diffusesAtLeastOnce() {
            double[][] pixels = {{0}, {-10}, {0}};
            Slice slice = new Slice(0, PixelUnits.ELECTRONS, pixels);

            Slice bloomed = SliceTransforms.simulateBlooming(slice, 100, 50, 1, imageOnly);

            assertThat(bloomed.get(0, 0)).isCloseTo(-3.0, within(1e-12));
            assertThat(bloomed.get(1, 0)).isCloseTo(-4.0, within(1e-12));
            assertThat(bloomed.get(2, 0)).isCloseTo(-3.0, within(1e-12));
        }

        @Test
        void chargePushedPastTheEdgeIsLost() {
            double[][] pixels = {{300}, {0}};
            Slice slice = new Slice(0, PixelUnits.ELECTRONS, pixels);

            Slice bloomed = SliceTransforms.simulateBlooming(slice, 200, 100, 1, imageOnly);

            // 200 excess: 0.4 stays, 0.3 to the pixel below, 0.3 off the top
            assertThat(bloomed.get(0, 0)).isCloseTo(180.0, within(1e-9));
            assertThat(bloomed.get(1, 0)).isCloseTo(60.0, within(1e-9));
        }

        @Test
        void onlyIlluminatedBlockIsTouched() {
            Slice slice = TestFrames.electronFluxSlice(0);
            double[][] pixels = slice.copyPixels();
            pixels[14][0] = 1e9;
            Slice withDarkSpike = new Slice(0, PixelUnits.ELECTRONS, pixels);

            Slice bloomed = SliceTransforms.simulateBlooming(withDarkSpike, 2000, 1500, 1, GEOMETRY);

            assertThat(bloomed.get(14, 0)).isEqualTo(1e9);
        }

        @Test
        void thresholdAboveFullWellIsRejected() {
            Slice slice = TestFrames.electronFluxSlice(0);

            assertThatThrownBy(() -> SliceTransforms.simulateBlooming(slice, 100, 200, 1, GEOMETRY))
                    .isInstanceOf(CcdSimException.class)
                    .hasMessageContaining("INVALID_VALUE");
        }
    }

    @Nested
    @DisplayName("Noise")
    class Noise {

        @Test
        void shotNoiseLeavesZeroAndNegativePixelsAlone() {
            Slice slice = new Slice(0, PixelUnits.ELECTRONS, new double[][] {{0, -5, 1e6}});

            Slice noisy = SliceTransforms.addShotNoise(slice, new Random(1));

            assertThat(noisy.get(0, 0)).isEqualTo(0.0);
            assertThat(noisy.get(0, 1)).isEqualTo(-5.0);
            assertThat(noisy.get(0, 2)).isNotEqualTo(1e6).isCloseTo(1e6, within(6000.0));
        }

        @Test
        void shotNoiseIsReproducibleForAFixedSeed() {
            Slice slice = TestFrames.electronFluxSlice(0);

            assertThat(SliceTransforms.addShotNoise(slice, new Random(7)))
                    .isEqualTo(SliceTransforms.addShotNoise(slice, new Random(7)));
        }

        @Test
        void readoutNoiseScalesWithSqrtOfExposures() {
            double[][] zeros = new double[200][200];
            Slice slice = new Slice(0, PixelUnits.ELECTRONS, zeros);

            Slice noisy = SliceTransforms.addReadoutNoise(slice, 3.0, 4, new Random(11));

            double sumSq = 0;
            for (int r = 0; r < 200; r++) for (int c = 0; c < 200; c++) sumSq += noisy.get(r, c) * noisy.get(r, c);
            assertThat(Math.sqrt(sumSq / 40000)).isCloseTo(6.0, within(0.2));
        }

        @Test
        void zeroReadoutNoiseReturnsTheSlice() {
            Slice slice = TestFrames.electronFluxSlice(0);

            assertThat(SliceTransforms.addReadoutNoise(slice, 0.0, 1, new Random())).isSameAs(slice);
        }
    }

    @Test
    void undershootSubtractsFractionOfPreviousPixel() {
        Slice slice = new Slice(0, PixelUnits.ELECTRONS, new double[][] {{100, 0, 50, 0}});

        Slice simulated = SliceTransforms.simulateUndershoot(slice, 0.01);
        Slice removed = SliceTransforms.removeUndershoot(simulated, 0.01);

        assertThat(simulated.copyRow(0)).containsExactly(new double[] {100, -1, 50, -0.5}, within(1e-12));
        assertThat(removed.get(0, 0)).isEqualTo(100.0);
        assertThat(removed.get(0, 1)).isCloseTo(0.0, within(1e-12));
        assertThat(removed.get(0, 2)).isCloseTo(50.0, within(0.011));
    }

    @Test
    void ringingRemovalUsesFinalDarkRows() {
        Slice slice = TestFrames.electronFluxSlice(0);
        double[] ringing = new double[COLUMNS];
        for (int c = 0; c < COLUMNS; c++) ringing[c] = 3 - c * 0.5;

        Slice rung = SliceTransforms.addStartOfLineRinging(slice, ringing);
        Slice restored = SliceTransforms.removeStartOfLineRinging(rung, GEOMETRY);

        assertThat(rung.get(ROWS - 1, 0)).isEqualTo(3.0);
        for (int r = 0; r < ROWS; r++) {
            for (int c = 0; c < COLUMNS; c++) {
                assertThat(restored.get(r, c)).isCloseTo(slice.get(r, c), within(1e-9));
            }
        }
    }

    @Test
    void ringingRowMustMatchSliceWidth() {
        assertThatThrownBy(() -> SliceTransforms.addStartOfLineRinging(TestFrames.electronFluxSlice(0), new double[3]))
                .hasMessageContaining("SHAPE_MISMATCH");
        assertThatThrownBy(() -> SliceTransforms.removeStartOfLineRinging(TestFrames.electronFluxSlice(0),
                new SliceGeometry(2, 2, 0, 3)))
                .hasMessageContaining("final dark rows");
    }

    @Test
    void patternNoiseAddAndRemoveAreExactInverses() {
        Slice slice = TestFrames.electronFluxSlice(0);
        double[][] pattern = new double[ROWS][COLUMNS];
        pattern[3][4] = 7.25;

        Slice added = SliceTransforms.addPatternNoise(slice, pattern);

        assertThat(added.get(3, 4)).isEqualTo(slice.get(3, 4) + 7.25);
        assertThat(SliceTransforms.removePatternNoise(added, pattern)).isEqualTo(slice);
        assertThatThrownBy(() -> SliceTransforms.addPatternNoise(slice, new double[2][2]))
                .hasMessageContaining("SHAPE_MISMATCH");
    }

    @Test
    void baselineWithoutDriftIsDeterministicAndRemovable() {
        Slice slice = TestFrames.electronFluxSlice(0);

        Slice biased = SliceTransforms.addBaseline(slice, 6000, 0, 2, 5.5, new Random());
        Slice restored = SliceTransforms.removeBaseline(biased, GEOMETRY);

        assertThat(biased.get(0, 0)).isEqualTo(66000.0);
        assertThat(restored.get(4, 4)).isCloseTo(slice.get(4, 4), within(1e-9));
        assertThat(restored.get(ROWS - 1, COLUMNS - 1)).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void baselineRemovalNeedsDarkColumns() {
        assertThatThrownBy(() -> SliceTransforms.removeBaseline(TestFrames.electronFluxSlice(0),
                new SliceGeometry(0, 0, 3, 3)))
                .hasMessageContaining("dark columns");
    }

    @Test
    void conversionSwitchesUnits() {
        ConversionModel model = new ConversionModel(0.01, 1, 5.5, 60000);
        Slice slice = TestFrames.electronFluxSlice(0);

        Slice adu = SliceTransforms.convertElectronsToAdu(slice, model);
        Slice electrons = SliceTransforms.convertAduToElectrons(adu, model);

        assertThat(adu.getUnits()).isEqualTo(PixelUnits.ADU);
        assertThat(electrons.getUnits()).isEqualTo(PixelUnits.ELECTRONS);
        assertThat(electrons.get(5, 5)).isCloseTo(slice.get(5, 5), within(1e-9));
    }

    @Test
    void electronStepsRejectAduSlices() {
        Slice adu = new Slice(0, PixelUnits.ADU, new double[ROWS][COLUMNS]);

        assertThatThrownBy(() -> SliceTransforms.addShotNoise(adu, new Random()))
                .hasMessageContaining("UNIT_MISMATCH");
        assertThatThrownBy(() -> SliceTransforms.simulateUndershoot(adu, 0.001))
                .hasMessageContaining("UNIT_MISMATCH");
        assertThatThrownBy(() -> SliceTransforms.convertAduToElectrons(TestFrames.electronFluxSlice(0),
                new ConversionModel(0, 1, 1, 1)))
                .hasMessageContaining("UNIT_MISMATCH");
    }
}
