package com.channelmerge.curator;

import java.time.Duration;

/**
 * Interface for endpoint reachability checks.
 * <p>
 * Implementations must be stateless and safe to call concurrently, and must never retry on their own:
 * retry policy belongs to the caller. Tests substitute a fake so no network access is needed.
 */
public interface ProbeServiceInterface {
    /**
     * Performs a lightweight existence check against an endpoint.
     * @param endpoint stream URL to check
     * @param timeout upper bound for the whole request
     * @return classified outcome; never null and never thrown
     */
    ProbeResult probe(String endpoint, Duration timeout);
}
