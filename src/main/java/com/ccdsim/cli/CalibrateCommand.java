package com.ccdsim.cli;

import com.ccdsim.model.Converter;
import com.ccdsim.service.FitsFrameService;
import com.ccdsim.service.RawStep;
import com.ccdsim.service.SettingsOverrides;
import com.ccdsim.service.TransformationPipeline;
import nom.tam.fits.FitsException;
import picocli.CommandLine.Command;

import java.io.IOException;

@Command(
    name = "calibrate",
    mixinStandardHelpOptions = true,
    description = "Estimate and remove readout effects from a raw frame, giving electrons"
)
public class CalibrateCommand extends ConversionCommand {

    @Override
    protected void convert(SettingsOverrides overrides, TransformationPipeline pipeline, FitsFrameService frames,
                           String command) throws IOException, FitsException {
        Converter raw = frames.readRaw(input, overrides, command);
        Converter calibrated = pipeline.calibrate(raw, overrides.stepSettings(RawStep.class));
        frames.writeCalibrated(calibrated, output, settings.force);
    }
}
