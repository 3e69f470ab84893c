package com.channelmerge.curator;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Service for exporting probe diagnostics to CSV files using OpenCSV.
 * <p>
 * One row per probed endpoint. The Status column separates {@code UNREACHABLE} (confirmed dead) from
 * {@code TRANSIENT_ERROR} (indeterminate), which operators read differently.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] HEADER = {"ChannelName", "Role", "Endpoint", "Status", "Reason", "Detail"};

    private final Path outDir;

    public CsvService(Path outDir) {
        this.outDir = outDir;
    }

    /**
     * Writes probe outcomes to a CSV file.
     * @param rows probe outcomes to export
     * @param filename Output CSV filename
     * @throws IOException if file writing fails
     */
    public void writeProbeReport(List<ProbeReportRow> rows, String filename) throws IOException {
        if (rows == null) {
            logger.warn("Attempted to write null probe report to CSV: {}", filename);
            throw new IllegalArgumentException("Report rows cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            logger.warn("Attempted to write CSV with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        if (!Files.exists(outDir)) Files.createDirectories(outDir);
        Path target = outDir.resolve(Utils.sanitizeFilename(filename));
        try (CSVWriter writer = new CSVWriter(new FileWriter(target.toFile(), StandardCharsets.UTF_8))) {
            writer.writeNext(HEADER);
            for (ProbeReportRow row : rows) {
                ProbeResult r = row.result();
                writer.writeNext(new String[]{
                    safe(row.channelName()),
                    safe(row.role()),
                    safe(row.endpoint()),
                    r.status().name(),
                    r.reason().name(),
                    safe(r.detail())
                });
            }
        }
        logger.info("Wrote {} probe results to CSV file: {}", rows.size(), target);
    }

    /**
     * Collapses CR/LF characters into a single space so every record stays on one line.
     * @param s Input string
     * @return Sanitized string
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
