package com.ccdsim.cli;

import com.ccdsim.model.Effect;
import com.ccdsim.model.ParameterKey;
import com.ccdsim.service.ElectronFluxStep;
import com.ccdsim.service.PipelineStep;
import com.ccdsim.service.RawStep;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Lists every setting accepted by {@code --set} and settings files, with defaults and FITS keywords.
 */
@Command(
    name = "settings",
    mixinStandardHelpOptions = true,
    description = "List all parameters, flags and pipeline steps"
)
public class SettingsCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        out.println("Parameters:");
        for (ParameterKey key : ParameterKey.values()) {
            String keywords = key.alternateKeyword() == null
                    ? key.primaryKeyword()
                    : key.primaryKeyword() + "/" + key.alternateKeyword();
            out.printf("  %-38s %-10s default %s%n", key.key(), keywords, key.valueType().format(key.defaultValue()));
            out.printf("      %s%n", key.documentation());
        }

        out.println();
        out.println("Flags (default false for electron flux frames, true for raw frames):");
        for (Effect effect : Effect.values()) {
            out.printf("  %-38s %-10s%n", effect.key(), effect.primaryKeyword());
            out.printf("      %s%n", effect.documentation());
        }

        printSteps(out, "Electron flux to raw steps (simulate-raw):", ElectronFluxStep.values());
        printSteps(out, "Raw to calibrated steps (calibrate):", RawStep.values());
        out.flush();
        return 0;
    }

    private static void printSteps(PrintWriter out, String title, PipelineStep[] steps) {
        out.println();
        out.println(title);
        for (PipelineStep step : steps) {
            out.printf("  %-38s default %s%n", step.key(), step.isEnabledByDefault() ? "on" : "off");
            out.printf("      %s%n", step.documentation());
        }
    }
}
