package com.raditha.luakit.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link LuaKitConfig} from a YAML file ({@code luakit.yml}) with CLI
 * overrides.
 * <p>
 * Configuration priority: CLI arguments > luakit.yml > preset > defaults.
 * All settings live under the {@code luakit} key:
 *
 * <pre>
 * luakit:
 *   preset: readable
 *   indent: 4            # number of spaces, or "tab"
 *   rename_locals: true
 *   aggressive: true
 *   max_inline_depth: 3
 *   rename_vars: false
 *   format_output: true
 *   extra_globals: [MyModule, Signal]
 *   exclude_patterns: ["**&#47;vendor/**"]
 * </pre>
 */
public class LuaKitSettings {
    private static final Logger logger = LoggerFactory.getLogger(LuaKitSettings.class);

    public static final String DEFAULT_FILE_NAME = "luakit.yml";

    private static final String CONFIG_KEY = "luakit";

    private LuaKitSettings() {
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile YAML file, or null to use only presets and defaults
     * @param presetCLI  CLI preset name (null = use YAML/default)
     * @param spacesCLI  CLI indentation width in spaces (0 = use YAML/default)
     * @param depthCLI   CLI inline depth (negative = use YAML/default)
     * @return complete configuration
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file is not valid configuration
     */
    public static LuaKitConfig loadConfig(@Nullable Path configFile, @Nullable String presetCLI,
            int spacesCLI, int depthCLI) throws IOException {
        Map<String, Object> config = readSection(configFile);

        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        LuaKitConfig base = preset != null ? preset(preset) : LuaKitConfig.defaults();

        String indent = spacesCLI > 0 ? " ".repeat(spacesCLI) : getIndent(config, base.indent());
        int maxInlineDepth = depthCLI >= 0 ? depthCLI : getInt(config, "max_inline_depth", base.maxInlineDepth());

        return new LuaKitConfig(
                indent,
                getBoolean(config, "rename_locals", base.renameLocals()),
                getBoolean(config, "aggressive", base.aggressive()),
                maxInlineDepth,
                getBoolean(config, "rename_vars", base.renameVars()),
                getBoolean(config, "format_output", base.formatOutput()),
                getListString(config, "extra_globals"),
                getListString(config, "exclude_patterns"));
    }

    /**
     * The named preset.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static LuaKitConfig preset(String name) {
        return switch (name) {
            case "default", "defaults" -> LuaKitConfig.defaults();
            case "readable" -> LuaKitConfig.readable();
            case "compact" -> LuaKitConfig.compact();
            default -> throw new IllegalArgumentException("Unknown preset: " + name);
        };
    }

    /**
     * The {@code luakit} section of the file, or an empty map when there is
     * no file or no section.
     */
    static Map<String, Object> readSection(@Nullable Path configFile) throws IOException {
        if (configFile == null) {
            return Map.of();
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        Object root;
        try {
            root = new Yaml().load(Files.readString(configFile, StandardCharsets.UTF_8));
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML in " + configFile + ": " + e.getMessage(), e);
        }
        if (root == null) {
            return Map.of();
        }
        if (!(root instanceof Map)) {
            throw new IllegalArgumentException("Expected a mapping at the top of " + configFile);
        }
        Object section = ((Map<?, ?>) root).get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            logger.debug("No '{}' section in {}", CONFIG_KEY, configFile);
            return Map.of();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        logger.info("Loaded configuration from {}", configFile);
        return config;
    }

    private static String getIndent(Map<String, Object> map, String defaultValue) {
        Object value = map.get("indent");
        if (value instanceof Number) {
            int spaces = ((Number) value).intValue();
            if (spaces < 1) {
                throw new IllegalArgumentException("indent must be >= 1, got " + spaces);
            }
            return " ".repeat(spaces);
        }
        if ("tab".equals(value)) {
            return "\t";
        }
        if (value != null) {
            throw new IllegalArgumentException("indent must be a number of spaces or \"tab\", got " + value);
        }
        return defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static @Nullable String getString(Map<String, Object> map, String key, @Nullable String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
