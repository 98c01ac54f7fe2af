package io.quarkus.qe.ci.insights.report.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvInsightsExporterTest {

    private final CsvInsightsExporter exporter = new CsvInsightsExporter();

    @Test
    void testTables() {
        String[] lines = exporter.export(SampleInsights.twoTypes(), false).split(System.lineSeparator());

        assertEquals(9, lines.length);
        assertEquals(CsvInsightsExporter.PIPELINE_TYPE_HEADER, lines[0]);
        assertEquals("\"Development\",72.7,8,87.5,330.0,370.0,380.0,61.0,68.0,68.0", lines[1]);
        assertEquals("\"Production\",27.3,3,100.0,600.0,600.0,600.0,90.0,90.0,90.0", lines[2]);
        assertEquals("", lines[3]);
        assertEquals(CsvInsightsExporter.JOB_HEADER, lines[4]);
        assertEquals("\"unit-test\",\"Development\",120.0,130.0,140.0,180.0,190.0,200.0,12.5,12.5,8", lines[5]);
    }

    @Test
    void testQuotesAreEscaped() {
        String csv = exporter.export(SampleInsights.twoTypes(), false);

        assertTrue(csv.contains("\"deploy \"\"prod\"\"\",\"Production\",90.0"), csv);
    }

    @Test
    void testEmptyInsightsKeepHeaders() {
        String[] lines = exporter.export(SampleInsights.empty(), false).split(System.lineSeparator());

        assertEquals(CsvInsightsExporter.PIPELINE_TYPE_HEADER, lines[0]);
        assertEquals(CsvInsightsExporter.JOB_HEADER, lines[2]);
    }
}
