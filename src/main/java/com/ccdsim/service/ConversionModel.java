package com.ccdsim.service;

/**
 * Nonlinear video chain model: gain compresses as the signal approaches the top of the ADC range.
 * <p>
 * With {@code g = gainLoss / (exposures * FPE_MAX_ADU) / videoScale}:
 * <pre>
 *   adu      = clip(e / (videoScale * (1 + g * e)), 0, clipLevelAdu * exposures)
 *   electron = videoScale * adu / (1 - g * videoScale * adu)
 * </pre>
 * The two are exact inverses wherever the forward value is not clipped.
 */
public class ConversionModel {

    /** Full scale of the focal plane electronics ADC. */
    public static final double FPE_MAX_ADU = 65535;

    private final double videoScale;
    private final double gainLossPerElectron;
    private final double exposureClipLevel;

    public ConversionModel(double gainLoss, int numberOfExposures, double videoScale, double clipLevelAdu) {
        double gainLossPerAdu = gainLoss / (numberOfExposures * FPE_MAX_ADU);
        this.videoScale = videoScale;
        this.gainLossPerElectron = gainLossPerAdu / videoScale;
        this.exposureClipLevel = clipLevelAdu * numberOfExposures;
    }

    public double electronToAdu(double electron) {
        double adu = electron / (videoScale * (1.0 + gainLossPerElectron * electron));
        return Math.max(0.0, Math.min(adu, exposureClipLevel));
    }

    public double aduToElectron(double adu) {
        return (videoScale * adu) / (1.0 - gainLossPerElectron * videoScale * adu);
    }

    public double getExposureClipLevel() {
        return exposureClipLevel;
    }
}
