package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs probes on a bounded worker pool.
 * <p>
 * Workflow:
 * <ul>
 *   <li>At most {@code poolSize} probes are in flight; with {@code perHostLimit > 0} at most that many per host.</li>
 *   <li>{@link #probeAll} blocks until every probe it scheduled has a result, which is the barrier decision logic waits on.</li>
 *   <li>Once the optional run deadline passes, nothing new is probed and every pending probe is cancelled;
 *       all of them are reported as timeouts and {@link #deadlineExceeded()} turns true.</li>
 * </ul>
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class ProbeExecutor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProbeExecutor.class);
    static final String DEADLINE_DETAIL = "run deadline exceeded";

    private final ProbeServiceInterface prober;
    private final Duration probeTimeout;
    private final int perHostLimit;
    private final Instant deadline;
    private final ExecutorService pool;
    private final Map<String, Semaphore> hostPermits = new ConcurrentHashMap<>();
    private final AtomicBoolean deadlineExceeded = new AtomicBoolean(false);

    public ProbeExecutor(ProbeServiceInterface prober, Duration probeTimeout, int poolSize, int perHostLimit, Instant deadline) {
        if (prober == null) throw new IllegalArgumentException("Prober cannot be null");
        if (poolSize < 1) throw new IllegalArgumentException("Pool size must be at least 1");
        this.prober = prober;
        this.probeTimeout = probeTimeout;
        this.perHostLimit = perHostLimit;
        this.deadline = deadline;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "probe-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates an executor from configuration, starting the run deadline clock now.
     */
    public static ProbeExecutor fromConfig(ProbeServiceInterface prober, CuratorConfig config) {
        Instant deadline = config.runDeadline() == null ? null : Instant.now().plus(config.runDeadline());
        return new ProbeExecutor(prober, config.probeTimeout(), config.poolSize(), config.perHostLimit(), deadline);
    }

    /**
     * Probes every distinct endpoint and waits for all results.
     * @param endpoints endpoints to check; duplicates share one probe
     * @return result per endpoint, in first-seen order
     */
    public Map<String, ProbeResult> probeAll(Collection<String> endpoints) {
        Map<String, Future<ProbeResult>> futures = new LinkedHashMap<>();
        Map<String, ProbeResult> results = new LinkedHashMap<>();
        for (String endpoint : new LinkedHashSet<>(endpoints)) {
            if (isPastDeadline()) {
                markDeadlineExceeded();
                results.put(endpoint, ProbeResult.timeout(DEADLINE_DETAIL));
                continue;
            }
            futures.put(endpoint, pool.submit(() -> runProbe(endpoint)));
        }

        for (Map.Entry<String, Future<ProbeResult>> e : futures.entrySet()) {
            results.put(e.getKey(), await(e.getKey(), e.getValue()));
        }
        Map<String, ProbeResult> ordered = new LinkedHashMap<>();
        for (String endpoint : new LinkedHashSet<>(endpoints)) ordered.put(endpoint, results.get(endpoint));
        return ordered;
    }

    private ProbeResult runProbe(String endpoint) throws InterruptedException {
        if (isPastDeadline()) {
            markDeadlineExceeded();
            return ProbeResult.timeout(DEADLINE_DETAIL);
        }
        Semaphore permit = null;
        if (perHostLimit > 0) {
            permit = hostPermits.computeIfAbsent(Utils.hostOf(endpoint), h -> new Semaphore(perHostLimit));
            permit.acquire();
        }
        try {
            ProbeResult result = prober.probe(endpoint, probeTimeout);
            if (result == null) return ProbeResult.transientError("prober returned no result");
            if (result.isTransient()) logger.warn("Indeterminate probe result for {}: {}", endpoint, result.detail());
            return result;
        } catch (RuntimeException e) {
            logger.warn("Prober threw for {}: {}", endpoint, e.toString());
            return ProbeResult.transientError(e.toString());
        } finally {
            if (permit != null) permit.release();
        }
    }

    private ProbeResult await(String endpoint, Future<ProbeResult> future) {
        try {
            if (deadline == null) return future.get();
            long remaining = Duration.between(Instant.now(), deadline).toMillis();
            return future.get(Math.max(0, remaining), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            markDeadlineExceeded();
            return ProbeResult.timeout(DEADLINE_DETAIL);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.warn("Probe task failed for {}: {}", endpoint, cause.toString());
            return ProbeResult.transientError(cause.toString());
        } catch (CancellationException e) {
            return ProbeResult.timeout(DEADLINE_DETAIL);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ProbeResult.transientError("interrupted");
        }
    }

    private boolean isPastDeadline() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    private void markDeadlineExceeded() {
        if (deadlineExceeded.compareAndSet(false, true)) {
            logger.warn("Run deadline {} passed; remaining probes are treated as timeouts", deadline);
        }
    }

    public boolean deadlineExceeded() {
        return deadlineExceeded.get();
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
