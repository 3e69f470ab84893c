package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Downloads manifests with a plain GET over {@link HttpClient}.
 * Any status outside 2xx is reported as an {@link IOException}.
 */
public class HttpManifestFetcher implements ManifestFetcherInterface {
    private static final Logger logger = LoggerFactory.getLogger(HttpManifestFetcher.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;

    public HttpManifestFetcher() {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build());
    }

    public HttpManifestFetcher(HttpClient client) {
        this.client = client;
    }

    @Override
    public String fetch(String manifestUrl) throws IOException {
        logger.info("Downloading manifest: {}", manifestUrl);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(URI.create(manifestUrl))
                .timeout(TIMEOUT)
                .header("User-Agent", "ChannelMerge/1.0")
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid manifest URL: " + manifestUrl, e);
        }
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new IOException("HTTP " + status + " while downloading " + manifestUrl);
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while downloading " + manifestUrl, e);
        }
    }
}
