package com.ccdsim.service;

import com.ccdsim.model.CcdSimException;
import com.ccdsim.model.Fault;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads settings files into the flat key map {@link SettingsOverrides#parse(Map)} consumes.
 * <p>
 * HOCON ({@code .conf}), JSON and Java properties files go through Typesafe Config and TOML
 * files through Jackson; sections only group keys, so nested paths are flattened to their last
 * element. {@code .tsv} files hold one {@code key<TAB>value} pair per line with {@code #} comments.
 */
public class ConfigFileService {

    private static final Logger log = LoggerFactory.getLogger(ConfigFileService.class);

    private static final Pattern TSV_SEPARATOR = Pattern.compile("\\t[\\t ]*| {2,}");
    private static final Pattern LIST_COMMA = Pattern.compile(",\\s*");
    private static final Pattern LIST_OPEN = Pattern.compile("\\[\\s*");
    private static final Pattern LIST_CLOSE = Pattern.compile("\\s*]");

    private static final TypeReference<Map<String, Object>> TABLE = new TypeReference<Map<String, Object>>() {
    };

    private final TomlMapper tomlMapper = new TomlMapper();

    /**
     * @throws IOException if the file cannot be read
     * @throws CcdSimException with {@link Fault#INVALID_VALUE} for an unsupported extension or a malformed file
     */
    public Map<String, Object> load(File file) throws IOException {
        if (!file.isFile()) {
            throw new IOException("Configuration file not found: " + file.getAbsolutePath());
        }
        String name = file.getName().toLowerCase(Locale.ROOT);
        Map<String, Object> entries;
        if (name.endsWith(".tsv")) {
            entries = parseTsv(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
        } else if (name.endsWith(".toml")) {
            entries = parseToml(file);
        } else if (name.endsWith(".conf") || name.endsWith(".json") || name.endsWith(".properties")) {
            entries = parseTypesafe(file);
        } else {
            throw new CcdSimException(Fault.INVALID_VALUE, "Unsupported configuration file type: " + file.getName()
                    + " (expected .conf, .json, .properties, .toml or .tsv)");
        }
        log.info("Loaded {} setting(s) from {}", entries.size(), file.getAbsolutePath());
        return entries;
    }

    Map<String, Object> parseTypesafe(File file) {
        Config config;
        try {
            config = ConfigFactory.parseFile(file, ConfigParseOptions.defaults().setAllowMissing(false)).resolve();
        } catch (ConfigException e) {
            throw new CcdSimException(Fault.INVALID_VALUE,
                    "Failed to parse configuration " + file.getName() + ": " + e.getMessage(), e);
        }
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : config.entrySet()) {
            List<String> path = ConfigUtil.splitPath(entry.getKey());
            putLeaf(flat, path.get(path.size() - 1), entry.getValue().unwrapped(), entry.getKey(), file);
        }
        return flat;
    }

    Map<String, Object> parseToml(File file) throws IOException {
        Map<String, Object> document;
        try {
            document = tomlMapper.readValue(file, TABLE);
        } catch (JacksonException e) {
            throw new CcdSimException(Fault.INVALID_VALUE,
                    "Failed to parse configuration " + file.getName() + ": " + e.getOriginalMessage(), e);
        }
        Map<String, Object> flat = new LinkedHashMap<>();
        flattenTable(document, "", flat, file);
        return flat;
    }

    private static void flattenTable(Map<?, ?> table, String prefix, Map<String, Object> flat, File file) {
        for (Map.Entry<?, ?> entry : table.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String path = prefix.isEmpty() ? key : prefix + "." + key;
            if (entry.getValue() instanceof Map) {
                flattenTable((Map<?, ?>) entry.getValue(), path, flat, file);
            } else {
                putLeaf(flat, key, entry.getValue(), path, file);
            }
        }
    }

    private static void putLeaf(Map<String, Object> flat, String leaf, Object value, String path, File file) {
        Object previous = flat.put(leaf, value);
        if (previous != null) {
            log.warn("Setting {} appears more than once in {}, using {}", leaf, file.getName(), path);
        }
    }

    /** Uses only the first two non-empty columns; quotes are dropped and lists keep their commas. */
    static Map<String, Object> parseTsv(List<String> lines) {
        Map<String, Object> entries = new LinkedHashMap<>();
        for (String line : lines) {
            String clean = line.replace("\"", "");
            int comment = clean.indexOf('#');
            if (comment >= 0) clean = clean.substring(0, comment);
            clean = clean.trim();
            if (clean.isEmpty()) continue;
            clean = LIST_CLOSE.matcher(LIST_OPEN.matcher(LIST_COMMA.matcher(clean).replaceAll(","))
                    .replaceAll("[")).replaceAll("]");

            String[] columns = TSV_SEPARATOR.split(clean);
            if (columns.length < 2 || columns[1].trim().isEmpty()) {
                throw new CcdSimException(Fault.INVALID_VALUE, "Could not parse TSV line: " + line);
            }
            entries.put(columns[0].trim(), columns[1].trim());
        }
        return entries;
    }

    /**
     * Applies {@code KEY=VALUE} entries on top of {@code fileEntries}; later entries win.
     *
     * @throws CcdSimException with {@link Fault#INVALID_VALUE} for an entry without {@code =}
     */
    public Map<String, Object> withCommandLine(Map<String, Object> fileEntries, List<String> assignments) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : fileEntries.entrySet()) {
            merged.put(SettingsOverrides.normalize(e.getKey()), e.getValue());
        }
        for (String assignment : assignments) {
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                throw new CcdSimException(Fault.INVALID_VALUE, "Expected KEY=VALUE but got \"" + assignment + "\"");
            }
            merged.put(SettingsOverrides.normalize(assignment.substring(0, eq)), assignment.substring(eq + 1).trim());
        }
        return merged;
    }
}
