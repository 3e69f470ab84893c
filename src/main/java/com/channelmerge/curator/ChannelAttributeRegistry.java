package com.channelmerge.curator;

import java.util.*;

/**
 * Central registry for the closed set of channel attributes.
 * Parser, playlist export and database sink all read the same list, so adding a key here reaches every consumer.
 */
public final class ChannelAttributeRegistry {
    private ChannelAttributeRegistry() {}

    private static final List<ChannelAttribute> ATTRIBUTES = List.of(
        new ChannelAttribute("tvg-id", "tvg_id"),
        new ChannelAttribute("tvg-name", "tvg_name"),
        new ChannelAttribute("tvg-logo", "tvg_logo"),
        new ChannelAttribute("group-title", "group_title")
    );

    /**
     * Returns the list of all recognized attributes, in manifest order.
     */
    public static List<ChannelAttribute> getAttributes() {
        return ATTRIBUTES;
    }

    /**
     * Extracts every recognized attribute present on a metadata line.
     * Keys that do not appear are omitted rather than stored as empty strings.
     * @param metadataLine the full {@code #EXTINF} line
     * @return insertion-ordered map of key to value
     */
    public static Map<String, String> extractAll(String metadataLine) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (ChannelAttribute a : ATTRIBUTES) {
            String value = a.extract(metadataLine);
            if (value != null) attributes.put(a.key, value);
        }
        return attributes;
    }
}
