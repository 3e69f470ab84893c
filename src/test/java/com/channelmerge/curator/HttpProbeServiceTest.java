package com.channelmerge.curator;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Probes a local HTTP server to check how responses and failures are classified.
 */
class HttpProbeServiceTest {
    private HttpServer server;
    private ExecutorService handlers;
    private String base;
    private final HttpProbeService prober = new HttpProbeService();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.createContext("/missing", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().add("Location", base + "/ok");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        handlers = Executors.newCachedThreadPool();
        server.setExecutor(handlers);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        handlers.shutdownNow();
    }

    @Test
    void status200IsReachable() {
        ProbeResult r = prober.probe(base + "/ok", Duration.ofSeconds(2));
        assertTrue(r.isReachable());
        assertEquals(ProbeResult.Reason.NONE, r.reason());
    }

    @Test
    void otherStatusIsUnreachableWithCode() {
        ProbeResult r = prober.probe(base + "/missing", Duration.ofSeconds(2));
        assertEquals(ProbeResult.Status.UNREACHABLE, r.status());
        assertEquals(ProbeResult.Reason.HTTP_STATUS, r.reason());
        assertEquals(404, r.httpStatus());
    }

    @Test
    void redirectsAreFollowed() {
        assertTrue(prober.probe(base + "/moved", Duration.ofSeconds(2)).isReachable());
    }

    @Test
    void slowEndpointTimesOut() {
        ProbeResult r = prober.probe(base + "/slow", Duration.ofMillis(300));
        assertEquals(ProbeResult.Status.UNREACHABLE, r.status());
        assertEquals(ProbeResult.Reason.TIMEOUT, r.reason());
    }

    @Test
    void refusedConnectionIsNetworkError() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        ProbeResult r = prober.probe("http://127.0.0.1:" + port + "/live", Duration.ofSeconds(2));
        assertEquals(ProbeResult.Status.UNREACHABLE, r.status());
        assertEquals(ProbeResult.Reason.NETWORK_ERROR, r.reason());
    }

    @Test
    void malformedUrlIsTransient() {
        ProbeResult r = prober.probe("http://bad host/with spaces", Duration.ofSeconds(1));
        assertTrue(r.isTransient());
        assertFalse(r.isReachable());
    }
}
