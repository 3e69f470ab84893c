package com.channelmerge.curator;

/**
 * Classified outcome of one reachability probe.
 * <p>
 * {@code TRANSIENT_ERROR} counts as unreachable for every grouping decision, but stays distinct so reports can
 * separate confirmed-dead endpoints from indeterminate ones.
 *
 * @param status overall classification
 * @param reason why an endpoint was not reachable ({@code NONE} when reachable)
 * @param httpStatus received status code, or -1 when no response arrived
 * @param detail free-text diagnostic, empty when reachable
 */
public record ProbeResult(Status status, Reason reason, int httpStatus, String detail) {

    public enum Status { REACHABLE, UNREACHABLE, TRANSIENT_ERROR }

    public enum Reason { NONE, HTTP_STATUS, TIMEOUT, NETWORK_ERROR, UNEXPECTED }

    public ProbeResult {
        detail = detail == null ? "" : detail;
    }

    public static ProbeResult reachable() {
        return new ProbeResult(Status.REACHABLE, Reason.NONE, 200, "");
    }

    public static ProbeResult httpStatus(int status) {
        return new ProbeResult(Status.UNREACHABLE, Reason.HTTP_STATUS, status, "HTTP " + status);
    }

    public static ProbeResult timeout(String detail) {
        return new ProbeResult(Status.UNREACHABLE, Reason.TIMEOUT, -1, detail);
    }

    public static ProbeResult networkError(String detail) {
        return new ProbeResult(Status.UNREACHABLE, Reason.NETWORK_ERROR, -1, detail);
    }

    public static ProbeResult transientError(String detail) {
        return new ProbeResult(Status.TRANSIENT_ERROR, Reason.UNEXPECTED, -1, detail);
    }

    public boolean isReachable() {
        return status == Status.REACHABLE;
    }

    public boolean isTransient() {
        return status == Status.TRANSIENT_ERROR;
    }
}
