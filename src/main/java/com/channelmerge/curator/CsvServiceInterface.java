package com.channelmerge.curator;

import java.io.IOException;
import java.util.List;

/**
 * Interface for CSV export of probe diagnostics.
 */
public interface CsvServiceInterface {
    /**
     * Writes probe outcomes to a CSV file with a header row.
     * @param rows probe outcomes to export
     * @param filename name of the output CSV file, resolved against the data directory
     * @throws IOException if file writing fails
     */
    void writeProbeReport(List<ProbeReportRow> rows, String filename) throws IOException;
}
