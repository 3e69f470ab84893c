package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single writer in front of a {@link ChannelSinkInterface}.
 * <p>
 * Flushes are serialized under one lock, so no two threads write the sink concurrently. A failed write is
 * retried with exponential backoff; once the attempts are exhausted a {@link SinkWriteException} is thrown
 * and the caller halts the run.
 */
public class SinkWriter {
    private static final Logger logger = LoggerFactory.getLogger(SinkWriter.class);

    private final ChannelSinkInterface sink;
    private final int maxAttempts;
    private final long initialBackoffMillis;
    private final ReentrantLock lock = new ReentrantLock();

    public SinkWriter(ChannelSinkInterface sink, int maxAttempts, long initialBackoffMillis) {
        if (sink == null) throw new IllegalArgumentException("Sink cannot be null");
        this.sink = sink;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMillis = Math.max(0, initialBackoffMillis);
    }

    /**
     * Writes a copy of the snapshot, retrying on failure.
     * @param groups snapshot keyed by channel name
     * @throws SinkWriteException when every attempt failed or the backoff was interrupted
     */
    public void flush(SortedMap<String, ChannelGroup> groups) throws SinkWriteException {
        SortedMap<String, ChannelGroup> snapshot = new TreeMap<>(groups);
        lock.lock();
        try {
            Utils.retry(() -> {
                sink.writeBatch(snapshot);
                return null;
            }, maxAttempts, initialBackoffMillis, "write to " + sink.describe());
            logger.debug("Flushed {} channel groups to {}", snapshot.size(), sink.describe());
        } catch (SinkWriteException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkWriteException("Interrupted while retrying " + sink.describe(), e);
        } catch (Exception e) {
            throw new SinkWriteException("Unexpected failure writing to " + sink.describe(), e);
        } finally {
            lock.unlock();
        }
    }
}
