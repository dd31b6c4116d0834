package com.ccdsim.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ConversionModelTest {

    @Test
    @DisplayName("ADU to electrons inverts electrons to ADU below the clip level")
    void roundTripBelowClipLevel() {
        double[] electrons = {0.5, 1, 100, 12345.6, 1e5, 2.5e5};
        for (double gainLoss : new double[] {0.0, 0.01, 0.1}) {
            for (double videoScale : new double[] {2.0, 5.5}) {
                for (int exposures : new int[] {1, 4}) {
                    ConversionModel model = new ConversionModel(gainLoss, exposures, videoScale, 60000);
                    for (double e : electrons) {
                        double adu = model.electronToAdu(e);
                        if (adu >= model.getExposureClipLevel()) continue;
                        assertThat(model.aduToElectron(adu))
                                .as("g=%s vs=%s n=%s e=%s", gainLoss, videoScale, exposures, e)
                                .isCloseTo(e, within(1e-9 * Math.max(1, e)));
                    }
                }
            }
        }
    }

    @Test
    void zeroElectronsIsZeroAdu() {
        assertThat(new ConversionModel(0.01, 1, 5.5, 60000).electronToAdu(0)).isEqualTo(0.0);
    }

    @Test
    void largeSignalsClipExactlyToExposureClipLevel() {
        ConversionModel model = new ConversionModel(0.01, 3, 5.5, 60000);

        assertThat(model.electronToAdu(1e12)).isEqualTo(180000.0);
        assertThat(model.electronToAdu(-50)).isEqualTo(0.0);
    }

    @Test
    void gainCompressesNearTheTopOfTheRange() {
        ConversionModel linear = new ConversionModel(0.0, 1, 5.5, 60000);
        ConversionModel compressed = new ConversionModel(0.05, 1, 5.5, 60000);

        assertThat(linear.electronToAdu(5.5e4)).isCloseTo(1e4, within(1e-9));
        assertThat(compressed.electronToAdu(5.5e4)).isLessThan(1e4);
    }
}
