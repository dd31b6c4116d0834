package com.ccdsim.main;

import com.ccdsim.cli.CalibrateCommand;
import com.ccdsim.cli.SettingsCommand;
import com.ccdsim.cli.SimulateRawCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Entry point: converts electron flux frames to simulated raw frames and raw frames to calibrated ones.
 */
@Command(
    name = "ccd-sim",
    mixinStandardHelpOptions = true,
    version = "ccd-sim 1.0.0",
    description = "Simulate and remove the effects of CCD readout electronics on FITS frames",
    subcommands = {
        SimulateRawCommand.class,
        CalibrateCommand.class,
        SettingsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CcdSimApp implements Callable<Integer> {

    @Override
    public Integer call() {
        // No subcommand given
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /** Same configuration as the entry point; tests use this. */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CcdSimApp());
        commandLine.setCommandName("ccd-sim");
        return commandLine;
    }
}
