package com.raditha.luakit.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ExportFormatTest {

    @Test
    void testFromString_ValidValues() {
        assertEquals(ExportFormat.CSV, ExportFormat.fromString("csv"));
        assertEquals(ExportFormat.JSON, ExportFormat.fromString("JSON"));
        assertEquals(ExportFormat.BOTH, ExportFormat.fromString("Both"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"xml", "", "csv,json"})
    void testFromString_InvalidValues(String invalidValue) {
        IllegalArgumentException exception = assertThrows(
                IllegalArgumentException.class,
                () -> ExportFormat.fromString(invalidValue));
        assertTrue(exception.getMessage().contains("must be 'csv', 'json', or 'both'"));
    }

    @Test
    void testFromString_NullValue() {
        IllegalArgumentException exception = assertThrows(
                IllegalArgumentException.class,
                () -> ExportFormat.fromString(null));
        assertEquals("Export format cannot be null", exception.getMessage());
    }

    @Test
    void testIncludes() {
        assertTrue(ExportFormat.CSV.includesCsv());
        assertFalse(ExportFormat.CSV.includesJson());
        assertTrue(ExportFormat.JSON.includesJson());
        assertTrue(ExportFormat.BOTH.includesCsv());
        assertTrue(ExportFormat.BOTH.includesJson());
    }
}
