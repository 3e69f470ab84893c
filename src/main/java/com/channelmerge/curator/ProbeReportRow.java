package com.channelmerge.curator;

/**
 * One probe outcome as shown in the diagnostics report.
 *
 * @param channelName channel the endpoint belongs to
 * @param role {@code primary}, {@code overflow} or {@code entry}
 * @param endpoint probed URL
 * @param result classified outcome
 */
public record ProbeReportRow(String channelName, String role, String endpoint, ProbeResult result) {}
