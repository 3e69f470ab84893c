package com.channelmerge.curator;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A member of a {@link ChannelGroup}: where the endpoint came from, the endpoint itself and its attributes.
 * Serialized as an element of the {@code childlist} array in the grouped document.
 */
public record ChannelRecord(
    @JsonProperty("source_url") String sourceManifest,
    @JsonProperty("stream_url") String endpoint,
    @JsonProperty("attributes") Map<String, String> attributes
) {
    public ChannelRecord {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
