package com.raditha.luakit.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.luakit.metrics.MetricsExporter.FileMetrics;
import com.raditha.luakit.metrics.MetricsExporter.RunMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MetricsExporter - CSV and JSON export functionality.
 */
class MetricsExporterTest {

    @TempDir
    Path tempDir;

    private MetricsExporter exporter;
    private List<FileMetrics> files;

    @BeforeEach
    void setUp() {
        exporter = new MetricsExporter();
        files = List.of(
                new FileMetrics("a.lua", 200, 100, 10, 1, null),
                new FileMetrics("b.lua", 100, 100, 5, 5, null),
                FileMetrics.failed("broken.lua", "Permission denied"));
    }

    @Test
    void testBuildMetrics() {
        RunMetrics metrics = exporter.buildMetrics(files, "minify");

        assertEquals("minify", metrics.command());
        assertNotNull(metrics.timestamp());
        assertEquals(3, metrics.totalFiles());
        assertEquals(1, metrics.failedFiles());
        assertEquals(300, metrics.totalInputBytes());
        assertEquals(200, metrics.totalOutputBytes());
        assertEquals(25.0, metrics.averageChangePercent(), 0.001);
    }

    @Test
    void testChangePercent() {
        assertEquals(50.0, files.get(0).changePercent(), 0.001);
        assertEquals(-50.0, new FileMetrics("x.lua", 10, 15, 1, 2, null).changePercent(), 0.001);
        assertEquals(0.0, new FileMetrics("empty.lua", 0, 1, 0, 1, null).changePercent(), 0.001);
        assertFalse(files.get(2).succeeded());
    }

    @Test
    void testBuildMetrics_NoFiles() {
        RunMetrics metrics = exporter.buildMetrics(List.of(), "format");

        assertEquals(0, metrics.totalFiles());
        assertEquals(0.0, metrics.averageChangePercent());
    }

    @Test
    void testCsvExport() throws IOException {
        RunMetrics metrics = exporter.buildMetrics(files, "minify");

        Path csvPath = tempDir.resolve("metrics.csv");
        exporter.exportToCsv(metrics, csvPath);

        assertTrue(Files.exists(csvPath), "CSV file should be created");

        String csv = Files.readString(csvPath);
        assertTrue(csv.contains("# Run Summary"), "Should have summary section");
        assertTrue(csv.contains("# Per-File Metrics"), "Should have per-file section");
        assertTrue(csv.contains("timestamp,command,total_files,failed_files"), "Should have summary header");
        assertTrue(csv.contains(",minify,3,1,300,200,25.00"), "Should have run totals");
        assertTrue(csv.contains("a.lua,200,100,10,1,50.00,OK"), "Should include per-file row");
        assertTrue(csv.contains("broken.lua,0,0,0,0,0.00,FAILED: Permission denied"), "Should mark failures");
    }

    @Test
    void testCsvExport_QuotesFieldsWithCommas() throws IOException {
        RunMetrics metrics = exporter.buildMetrics(List.of(FileMetrics.failed("x.lua", "bad, worse")), "lint");

        Path csvPath = tempDir.resolve("metrics.csv");
        exporter.exportToCsv(metrics, csvPath);

        assertTrue(Files.readString(csvPath).contains("\"FAILED: bad, worse\""));
    }

    @Test
    void testJsonExport() throws IOException {
        RunMetrics metrics = exporter.buildMetrics(files, "deobfuscate");

        Path jsonPath = tempDir.resolve("metrics.json");
        exporter.exportToJson(metrics, jsonPath);

        assertTrue(Files.exists(jsonPath), "JSON file should be created");

        JsonNode root = new ObjectMapper().readTree(jsonPath.toFile());
        assertEquals("deobfuscate", root.get("command").asText());
        assertEquals(3, root.get("totalFiles").asInt());
        assertTrue(root.get("timestamp").isTextual(), "Timestamp should be written as text");
        assertEquals(3, root.get("files").size());
        assertEquals("a.lua", root.get("files").get(0).get("fileName").asText());
        assertEquals("Permission denied", root.get("files").get(2).get("error").asText());
    }
}
