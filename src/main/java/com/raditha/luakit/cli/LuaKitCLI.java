package com.raditha.luakit.cli;

import com.raditha.luakit.analysis.ObfuscationValidator;
import com.raditha.luakit.analysis.ValidationReport;
import com.raditha.luakit.config.LuaKitConfig;
import com.raditha.luakit.config.LuaKitSettings;
import com.raditha.luakit.deobfuscation.Deobfuscator;
import com.raditha.luakit.format.LuaFormatter;
import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.metrics.DiffGenerator;
import com.raditha.luakit.metrics.MetricsExporter;
import com.raditha.luakit.minify.LuaMinifier;
import com.raditha.luakit.minify.MinifyResult;
import com.raditha.luakit.obfuscate.LuaObfuscator;
import com.raditha.luakit.obfuscate.ObfuscationResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Command-line interface for LuaKit.
 * <p>
 * Usage:
 * java -jar luakit.jar [options] (format | minify | deobfuscate | obfuscate | lint) [command options] <file-or-directory>...
 * <p>
 * Each input file is processed on its own; a file that fails is reported and
 * the rest of the batch continues. Results go to
 * {@code beautified_scripts/}, {@code minified_scripts/},
 * {@code deobfuscated_scripts/} or {@code obfuscated_scripts/} below the
 * output directory.
 * <p>
 * Configuration priority: CLI arguments > luakit.yml > defaults
 */
@Command(name = "luakit", mixinStandardHelpOptions = true, version = "LuaKit v1.0.0",
        description = "Lua/Luau formatter, minifier, obfuscator and deobfuscator")
@SuppressWarnings("java:S106")
public class LuaKitCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(LuaKitCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FILE_FAILURES = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_IO_ERROR = 3;

    // Global Options
    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>",
            scope = CommandLine.ScopeType.INHERIT)
    private String configFile;

    @Option(names = "--output", description = "Base output directory (default: current directory)",
            paramLabel = "<path>", scope = CommandLine.ScopeType.INHERIT)
    private String outputPath;

    @Option(names = "--preset", description = "Configuration preset: default, readable or compact",
            paramLabel = "<name>", scope = CommandLine.ScopeType.INHERIT)
    private String preset;

    @Option(names = "--diff", description = "Print a unified diff of every change",
            scope = CommandLine.ScopeType.INHERIT)
    private boolean showDiff = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>",
            converter = ExportFormatConverter.class, scope = CommandLine.ScopeType.INHERIT)
    private ExportFormat exportFormat;

    /**
     * Picocli call method, reached when no subcommand is given.
     *
     * @return exit code for invalid usage
     */
    @Override
    public Integer call() {
        CommandLine.usage(this, System.err);
        return EXIT_CONFIG_ERROR;
    }

    @Command(name = "format", description = "Re-indent and space Lua files")
    int format(
            @Option(names = "--spaces", description = "Indent with <n> spaces instead of a tab",
                    paramLabel = "<n>", defaultValue = "0") int spaces,
            @Parameters(paramLabel = "<file>", arity = "1..*", description = "Files or directories") List<Path> inputs)
            throws IOException {
        validateConfiguration(spaces, -1);
        LuaKitConfig config = loadConfig(spaces, -1);
        LuaFormatter formatter = new LuaFormatter(new LuaLexer(config.vocabulary()));

        return processFiles("format", inputs, config, "beautified_scripts", ".beaut.lua",
                source -> formatter.format(source, config.indent()));
    }

    @Command(name = "minify", description = "Shrink Lua files")
    int minify(
            @Option(names = "--no-rename", description = "Keep local variable names") boolean noRename,
            @Option(names = "--basic", description = "Only strip comments and layout") boolean basic,
            @Option(names = "--stats", description = "Print size statistics per file") boolean stats,
            @Parameters(paramLabel = "<file>", arity = "1..*", description = "Files or directories") List<Path> inputs)
            throws IOException {
        validateConfiguration(0, -1);
        LuaKitConfig config = loadConfig(0, -1);
        LuaMinifier minifier = new LuaMinifier(config.vocabulary());
        boolean rename = !noRename && config.renameLocals();
        boolean aggressive = !basic && config.aggressive();

        return processFiles("minify", inputs, config, "minified_scripts", ".min.lua", source -> {
            MinifyResult result = minifier.minifyWithStats(source, rename, aggressive);
            if (stats) {
                System.out.printf(Locale.ROOT, "  %d -> %d bytes, %d -> %d lines, %.1f%% smaller, %d locals renamed%n",
                        result.originalBytes(), result.minifiedBytes(),
                        result.originalLines(), result.minifiedLines(),
                        result.reductionPercent(), result.renamedLocals());
            }
            return result.output();
        });
    }

    @Command(name = "deobfuscate", description = "Decode, fold and inline obfuscated Lua files")
    int deobfuscate(
            @Option(names = "--rename", description = "Rename machine-generated locals") boolean rename,
            @Option(names = "--spaces", description = "Indent with <n> spaces instead of a tab",
                    paramLabel = "<n>", defaultValue = "0") int spaces,
            @Option(names = "--no-format", description = "Leave the result unformatted") boolean noFormat,
            @Option(names = "--max-depth", description = "Nested load() payloads to inline (default: 3)",
                    paramLabel = "<n>", defaultValue = "-1") int maxDepth,
            @Parameters(paramLabel = "<file>", arity = "1..*", description = "Files or directories") List<Path> inputs)
            throws IOException {
        validateConfiguration(spaces, maxDepth);
        LuaKitConfig config = loadConfig(spaces, maxDepth);
        Deobfuscator deobfuscator = new Deobfuscator(config.vocabulary());
        LuaFormatter formatter = new LuaFormatter(new LuaLexer(config.vocabulary()));
        boolean renameVars = rename || config.renameVars();
        boolean formatOutput = !noFormat && config.formatOutput();

        return processFiles("deobfuscate", inputs, config, "deobfuscated_scripts", ".deob.lua", source -> {
            String result = deobfuscator.deobfuscate(source, config.maxInlineDepth(), renameVars);
            return formatOutput ? formatter.format(result, config.indent()) : result;
        });
    }

    @Command(name = "obfuscate", description = "Rename locals, encode strings and minify Lua files")
    int obfuscate(@Parameters(paramLabel = "<file>", arity = "1..*", description = "Files or directories")
            List<Path> inputs) throws IOException {
        validateConfiguration(0, -1);
        LuaKitConfig config = loadConfig(0, -1);
        LuaObfuscator obfuscator = new LuaObfuscator(config.vocabulary());

        return processFiles("obfuscate", inputs, config, "obfuscated_scripts", ".ob.lua", source -> {
            ObfuscationResult result = obfuscator.obfuscate(source);
            result.warnings().forEach(w -> System.out.println("  WARN  " + w));
            return result.output();
        });
    }

    @Command(name = "lint", description = "Report code that obfuscation may break")
    int lint(@Parameters(paramLabel = "<file>", arity = "1..*", description = "Files or directories") List<Path> inputs)
            throws IOException {
        validateConfiguration(0, -1);
        LuaKitConfig config = loadConfig(0, -1);
        ObfuscationValidator validator = new ObfuscationValidator(config.vocabulary());

        int failures = 0;
        for (Path file : collectFiles(inputs, config)) {
            try {
                ValidationReport report = validator.validate(Files.readString(file, StandardCharsets.UTF_8));
                System.out.println(file + ": " + report.errors().size() + " error(s), "
                        + report.warnings().size() + " warning(s)");
                report.errors().forEach(e -> System.out.println("  ERROR " + e));
                report.warnings().forEach(w -> System.out.println("  WARN  " + w));
                if (report.hasErrors()) {
                    failures++;
                }
            } catch (IOException e) {
                logger.warn("Could not read {}: {}", file, e.getMessage());
                System.err.println("✗ " + file + ": " + e.getMessage());
                failures++;
            }
        }
        if (exportFormat != null) {
            logger.info("Metrics export is not available for lint");
        }
        return failures > 0 ? EXIT_FILE_FAILURES : EXIT_OK;
    }

    /**
     * Apply a transformation to every input file and write the results.
     *
     * @return exit code: 0 when every file succeeded, 1 otherwise
     * @throws IOException if the output directory cannot be created or
     *                     metrics cannot be written
     */
    private int processFiles(String command, List<Path> inputs, LuaKitConfig config, String directoryName,
            String suffix, UnaryOperator<String> transformation) throws IOException {
        Path outputDir = baseOutputDir().resolve(directoryName);
        Files.createDirectories(outputDir);

        DiffGenerator diffGenerator = new DiffGenerator();
        List<MetricsExporter.FileMetrics> metrics = new ArrayList<>();
        int failures = 0;

        for (Path file : collectFiles(inputs, config)) {
            String fileName = String.valueOf(file.getFileName());
            try {
                String source = Files.readString(file, StandardCharsets.UTF_8);
                String result = transformation.apply(source);
                Path target = outputDir.resolve(baseName(fileName) + suffix);
                Files.writeString(target, result, StandardCharsets.UTF_8);

                System.out.println("✓ " + file + " -> " + target);
                if (showDiff) {
                    String diff = diffGenerator.generateUnifiedDiff(fileName, source, result, 3);
                    System.out.println(diff.isEmpty() ? "  (no changes)" : diff);
                }
                metrics.add(new MetricsExporter.FileMetrics(fileName,
                        source.getBytes(StandardCharsets.UTF_8).length,
                        result.getBytes(StandardCharsets.UTF_8).length,
                        (int) source.lines().count(),
                        (int) result.lines().count(),
                        null));
            } catch (IOException | RuntimeException e) {
                logger.warn("Failed to {} {}: {}", command, file, e.getMessage());
                logger.debug("Failure details", e);
                System.err.println("✗ " + file + ": " + e.getMessage());
                metrics.add(MetricsExporter.FileMetrics.failed(fileName, String.valueOf(e.getMessage())));
                failures++;
            }
        }

        if (exportFormat != null) {
            exportMetrics(metrics, command);
        }
        logger.info("{}: {} file(s) processed, {} failed", command, metrics.size(), failures);
        return failures > 0 ? EXIT_FILE_FAILURES : EXIT_OK;
    }

    /**
     * Expand directories into the Lua files below them, minus excluded paths.
     */
    static List<Path> collectFiles(List<Path> inputs, LuaKitConfig config) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (!Files.isDirectory(input)) {
                files.add(input);
                continue;
            }
            try (Stream<Path> walk = Files.walk(input)) {
                walk.filter(Files::isRegularFile)
                        .filter(p -> isLuaFile(p.getFileName().toString()))
                        .filter(p -> !config.shouldExclude(p.toString()))
                        .sorted()
                        .forEach(files::add);
            }
        }
        return files;
    }

    private static boolean isLuaFile(String name) {
        return name.endsWith(".lua") || name.endsWith(".luau");
    }

    /**
     * File name without a {@code .lua} or {@code .luau} extension.
     */
    static String baseName(String fileName) {
        if (fileName.endsWith(".luau")) {
            return fileName.substring(0, fileName.length() - 5);
        }
        if (fileName.endsWith(".lua")) {
            return fileName.substring(0, fileName.length() - 4);
        }
        return fileName;
    }

    private Path baseOutputDir() {
        return outputPath != null ? Paths.get(outputPath) : Paths.get(".");
    }

    private LuaKitConfig loadConfig(int spaces, int maxDepth) throws IOException {
        Path file = configFile != null ? Paths.get(configFile) : defaultConfigFile();
        return LuaKitSettings.loadConfig(file, preset, spaces, maxDepth);
    }

    private static @Nullable Path defaultConfigFile() {
        Path file = Paths.get(LuaKitSettings.DEFAULT_FILE_NAME);
        return Files.isRegularFile(file) ? file : null;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration(int spaces, int maxDepth) {
        if (spaces < 0) {
            throw new IllegalArgumentException("Spaces must not be negative, got: " + spaces);
        }
        if (maxDepth < -1) {
            throw new IllegalArgumentException("Max-depth must not be negative, got: " + maxDepth);
        }

        // Validate config file exists if specified
        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        // Validate output path is a directory if it exists
        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(List<MetricsExporter.FileMetrics> files, String command) throws IOException {
        MetricsExporter exporter = new MetricsExporter();
        MetricsExporter.RunMetrics metrics = exporter.buildMetrics(files, command);
        Path outputDir = baseOutputDir();

        if (exportFormat.includesCsv()) {
            Path csvPath = outputDir.resolve(command + "-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            System.out.println("\n✓ Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if (exportFormat.includesJson()) {
            Path jsonPath = outputDir.resolve(command + "-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            System.out.println("✓ Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }

    /**
     * Command line with the exit-code mapping used by {@link #main}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new LuaKitCLI());

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG_ERROR;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO_ERROR;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_FILE_FAILURES;
            }
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return EXIT_CONFIG_ERROR;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Custom converter for ExportFormat enum to handle CLI string values.
     */
    public static class ExportFormatConverter implements ITypeConverter<ExportFormat> {
        @Override
        public ExportFormat convert(String value) throws Exception {
            return ExportFormat.fromString(value);
        }
    }
}
