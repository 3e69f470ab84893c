package com.channelmerge.curator;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class CsvServiceTest {
    @TempDir
    Path dir;

    @Test
    public void testWriteProbeReport() throws IOException, CsvException {
        List<ProbeReportRow> rows = List.of(
            new ProbeReportRow("News", "primary", "http://a/1", ProbeResult.reachable()),
            new ProbeReportRow("News", "overflow", "http://b/2", ProbeResult.httpStatus(503)),
            new ProbeReportRow("Sports\nHD", "primary", "http://c/3", ProbeResult.transientError("boom\r\nagain"))
        );
        CsvService csvService = new CsvService(dir);
        csvService.writeProbeReport(rows, "probe report.csv");

        Path file = dir.resolve("probe_report.csv");
        Assertions.assertTrue(Files.exists(file));
        try (CSVReader reader = new CSVReader(new FileReader(file.toFile(), StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();
            Assertions.assertEquals(4, lines.size());
            Assertions.assertArrayEquals(CsvService.HEADER, lines.get(0));
            Assertions.assertArrayEquals(new String[]{"News", "primary", "http://a/1", "REACHABLE", "NONE", ""}, lines.get(1));
            Assertions.assertArrayEquals(new String[]{"News", "overflow", "http://b/2", "UNREACHABLE", "HTTP_STATUS", "HTTP 503"}, lines.get(2));
            Assertions.assertArrayEquals(new String[]{"Sports HD", "primary", "http://c/3", "TRANSIENT_ERROR", "UNEXPECTED", "boom again"}, lines.get(3));
        }
    }

    @Test
    public void testInvalidInputIsRejected() {
        CsvService csvService = new CsvService(dir);
        Assertions.assertThrows(IllegalArgumentException.class, () -> csvService.writeProbeReport(null, "x.csv"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> csvService.writeProbeReport(List.of(), " "));
    }
}
