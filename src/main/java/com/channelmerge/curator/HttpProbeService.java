package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Reachability prober backed by {@link HttpClient}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Sends a {@code HEAD} request (no payload transfer) and follows redirects.</li>
 *   <li>Status 200 after redirects is reachable; any other received status is unreachable with that status.</li>
 *   <li>Request or connect timeouts are unreachable with reason {@code TIMEOUT}.</li>
 *   <li>DNS, refused and reset connections surface as {@link IOException} and are unreachable with reason {@code NETWORK_ERROR}.</li>
 *   <li>Anything else (malformed URL, interruption, runtime failures) is a transient error.</li>
 * </ul>
 * The client is shared across calls and is thread-safe, so one instance serves the whole worker pool.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class HttpProbeService implements ProbeServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(HttpProbeService.class);
    private static final String USER_AGENT = "ChannelMerge/1.0 (stream availability check)";

    private final HttpClient client;

    public HttpProbeService() {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.ALWAYS)
            .build());
    }

    public HttpProbeService(HttpClient client) {
        if (client == null) throw new IllegalArgumentException("HttpClient cannot be null");
        this.client = client;
    }

    @Override
    public ProbeResult probe(String endpoint, Duration timeout) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            if (status == 200) {
                logger.debug("Reachable: {}", endpoint);
                return ProbeResult.reachable();
            }
            logger.debug("Unreachable (HTTP {}): {}", status, endpoint);
            return ProbeResult.httpStatus(status);
        } catch (HttpTimeoutException e) {
            logger.debug("Timed out after {} ms: {}", timeout.toMillis(), endpoint);
            return ProbeResult.timeout("timed out after " + timeout.toMillis() + " ms");
        } catch (IOException e) {
            logger.debug("Network error for {}: {}", endpoint, e.toString());
            return ProbeResult.networkError(e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Probe interrupted: {}", endpoint);
            return ProbeResult.transientError("interrupted");
        } catch (RuntimeException e) {
            logger.warn("Unexpected probe failure for {}: {}", endpoint, e.toString());
            return ProbeResult.transientError(e.toString());
        }
    }
}
