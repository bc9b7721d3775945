package com.raditha.luakit.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Exports per-file transformation statistics to CSV and JSON for dashboard
 * integration and historical tracking.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Run-level metrics aggregated from all processed files.
     */
    public record RunMetrics(
            String command,
            LocalDateTime timestamp,
            int totalFiles,
            int failedFiles,
            long totalInputBytes,
            long totalOutputBytes,
            double averageChangePercent,
            List<FileMetrics> files) {
    }

    /**
     * Metrics for one input file. {@code error} is null for files that were
     * processed.
     */
    public record FileMetrics(
            String fileName,
            long inputBytes,
            long outputBytes,
            int inputLines,
            int outputLines,
            @Nullable String error) {

        public static FileMetrics failed(String fileName, String error) {
            return new FileMetrics(fileName, 0, 0, 0, 0, error);
        }

        public boolean succeeded() {
            return error == null;
        }

        /**
         * Size change in percent of the input, negative when the output is
         * larger.
         */
        public double changePercent() {
            if (inputBytes == 0) {
                return 0.0;
            }
            return (inputBytes - outputBytes) * 100.0 / inputBytes;
        }
    }

    /**
     * Build aggregated metrics for one command run.
     */
    public RunMetrics buildMetrics(List<FileMetrics> files, String command) {
        List<FileMetrics> processed = files.stream().filter(FileMetrics::succeeded).toList();

        long totalInput = processed.stream().mapToLong(FileMetrics::inputBytes).sum();
        long totalOutput = processed.stream().mapToLong(FileMetrics::outputBytes).sum();
        double averageChange = processed.stream()
                .mapToDouble(FileMetrics::changePercent)
                .average()
                .orElse(0.0);

        return new RunMetrics(
                command,
                LocalDateTime.now(),
                files.size(),
                files.size() - processed.size(),
                totalInput,
                totalOutput,
                averageChange,
                List.copyOf(files));
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(RunMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Run Summary\n");
        csv.append("timestamp,command,total_files,failed_files,input_bytes,output_bytes,avg_change_percent\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%d,%.2f\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.command(),
                metrics.totalFiles(),
                metrics.failedFiles(),
                metrics.totalInputBytes(),
                metrics.totalOutputBytes(),
                metrics.averageChangePercent()));

        csv.append("\n");

        csv.append("# Per-File Metrics\n");
        csv.append("file,input_bytes,output_bytes,input_lines,output_lines,change_percent,status\n");

        for (FileMetrics file : metrics.files()) {
            csv.append(String.format(Locale.ROOT, "%s,%d,%d,%d,%d,%.2f,%s\n",
                    csvField(file.fileName()),
                    file.inputBytes(),
                    file.outputBytes(),
                    file.inputLines(),
                    file.outputLines(),
                    file.changePercent(),
                    file.succeeded() ? "OK" : csvField("FAILED: " + file.error())));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(RunMetrics metrics, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), metrics);
    }

    private static String csvField(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
