package com.ccdsim.cli;

import com.ccdsim.model.CcdSimException;
import com.ccdsim.service.ConfigFileService;
import com.ccdsim.service.FitsFrameService;
import com.ccdsim.service.ResourceLoaderService;
import com.ccdsim.service.SettingsOverrides;
import com.ccdsim.service.TransformationPipeline;
import nom.tam.fits.FitsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Shared plumbing of the two conversion commands: settings, error reporting and exit codes.
 */
abstract class ConversionCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConversionCommand.class);

    @Parameters(index = "0", paramLabel = "INPUT", description = "FITS file to read")
    File input;

    @Parameters(index = "1", paramLabel = "OUTPUT", description = "FITS file to write")
    File output;

    @Mixin
    SettingsOptions settings;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            SettingsOverrides overrides = settings.overrides(new ConfigFileService());
            TransformationPipeline pipeline = new TransformationPipeline(new ResourceLoaderService());
            convert(overrides, pipeline, new FitsFrameService(), commandAnnotation());
            return 0;
        } catch (CcdSimException | IOException | FitsException e) {
            log.error("{} failed: {}", spec.name(), e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    protected abstract void convert(SettingsOverrides overrides, TransformationPipeline pipeline,
                                    FitsFrameService frames, String command) throws IOException, FitsException;

    /** The command line as typed, recorded in the output header. */
    String commandAnnotation() {
        StringBuilder sb = new StringBuilder(spec.root().name());
        for (String arg : spec.root().commandLine().getParseResult().originalArgs()) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }
}
