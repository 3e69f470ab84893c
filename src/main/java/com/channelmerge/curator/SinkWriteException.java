package com.channelmerge.curator;

/**
 * Thrown when a checkpoint or final write could not be persisted.
 * Once {@link SinkWriter} has exhausted its retries this halts the run, so data is never lost silently.
 */
public class SinkWriteException extends Exception {
    public SinkWriteException(String message) {
        super(message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
