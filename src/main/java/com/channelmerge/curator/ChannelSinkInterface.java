package com.channelmerge.curator;

import java.util.SortedMap;

/**
 * Interface for durable storage of grouped channels.
 * <p>
 * Delivery is at-least-once: the same snapshot may arrive more than once, so implementations must upsert.
 * Callers never rely on transactions beyond "persisted, or reported as failed".
 */
public interface ChannelSinkInterface {
    /**
     * Persists a snapshot of groups keyed and sorted by channel name.
     * @param groups groups to store
     * @throws SinkWriteException if the snapshot could not be stored
     */
    void writeBatch(SortedMap<String, ChannelGroup> groups) throws SinkWriteException;

    /**
     * Short label used in log messages.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
