package com.channelmerge.curator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record for one parsed manifest entry: a metadata line paired with the endpoint line that followed it.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>Created by {@link ManifestParser}, numbered by parse order within its manifest.</li>
 *   <li>Accumulated in {@link EntryStore} under {@link #key()}.</li>
 *   <li>Read by {@link ChannelGrouper}, which copies source, endpoint and attributes into a {@link ChannelRecord}.</li>
 * </ul>
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public record ChannelEntry(
    String sourceManifest,
    int ordinal,
    String channelName,
    String endpoint,
    Map<String, String> attributes
) {
    public ChannelEntry {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public EntryKey key() {
        return new EntryKey(sourceManifest, ordinal);
    }

    /**
     * Copies this entry into the member form used inside a group.
     */
    public ChannelRecord toRecord() {
        return new ChannelRecord(sourceManifest, endpoint, attributes);
    }
}
