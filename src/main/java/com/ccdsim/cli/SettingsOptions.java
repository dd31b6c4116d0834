package com.ccdsim.cli;

import com.ccdsim.service.ConfigFileService;
import com.ccdsim.service.SettingsOverrides;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Options shared by the conversion commands.
 */
public class SettingsOptions {

    @Option(
        names = {"-c", "--config"},
        paramLabel = "FILE",
        description = "Settings file (.conf, .json, .properties, .toml or .tsv)"
    )
    File configFile;

    @Option(
        names = {"-s", "--set"},
        paramLabel = "KEY=VALUE",
        description = "Override one setting; repeatable, wins over the settings file"
    )
    List<String> assignments = new ArrayList<>();

    @Option(
        names = {"--force"},
        description = "Overwrite the output file if it exists"
    )
    boolean force;

    SettingsOverrides overrides(ConfigFileService configFiles) throws IOException {
        Map<String, Object> fromFile = configFile == null
                ? Collections.<String, Object>emptyMap()
                : configFiles.load(configFile);
        return SettingsOverrides.parse(configFiles.withCommandLine(fromFile, assignments));
    }
}
