package com.channelmerge.curator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.SortedMap;

/**
 * Checkpoint sink that overwrites one grouped JSON document with the latest snapshot.
 */
public class JsonCheckpointSink implements ChannelSinkInterface {
    private final ChannelJsonService jsonService;
    private final Path file;

    public JsonCheckpointSink(ChannelJsonService jsonService, Path file) {
        this.jsonService = jsonService;
        this.file = file;
    }

    @Override
    public void writeBatch(SortedMap<String, ChannelGroup> groups) throws SinkWriteException {
        try {
            jsonService.writeGroups(groups, file);
        } catch (IOException e) {
            throw new SinkWriteException("Failed to write checkpoint " + file, e);
        }
    }

    @Override
    public String describe() {
        return "checkpoint " + file;
    }

    public Path getFile() {
        return file;
    }
}
