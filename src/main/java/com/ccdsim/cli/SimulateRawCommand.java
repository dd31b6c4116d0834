package com.ccdsim.cli;

import com.ccdsim.model.Converter;
import com.ccdsim.service.ElectronFluxStep;
import com.ccdsim.service.FitsFrameService;
import com.ccdsim.service.SettingsOverrides;
import com.ccdsim.service.TransformationPipeline;
import nom.tam.fits.FitsException;
import picocli.CommandLine.Command;

import java.io.IOException;

@Command(
    name = "simulate-raw",
    mixinStandardHelpOptions = true,
    description = "Turn an electron flux frame into a simulated raw frame in ADU"
)
public class SimulateRawCommand extends ConversionCommand {

    @Override
    protected void convert(SettingsOverrides overrides, TransformationPipeline pipeline, FitsFrameService frames,
                           String command) throws IOException, FitsException {
        Converter electronFlux = frames.readElectronFlux(input, overrides, command);
        Converter raw = pipeline.simulateRaw(electronFlux, overrides.stepSettings(ElectronFluxStep.class));
        frames.writeRaw(raw, output, settings.force);
    }
}
