package com.channelmerge.curator;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable record representing every known endpoint for one channel name.
 * <p>
 * Invariants:
 * <ul>
 *   <li>All members share {@code channelName} exactly; names are never normalized.</li>
 *   <li>{@code primary} is the preferred endpoint and is never repeated inside {@code overflow}.</li>
 *   <li>{@code overflow} keeps the order it was built in; only repair promotion changes it.</li>
 * </ul>
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public record ChannelGroup(String channelName, ChannelRecord primary, List<ChannelRecord> overflow) {
    public ChannelGroup {
        if (channelName == null) throw new IllegalArgumentException("Channel name cannot be null");
        if (primary == null) throw new IllegalArgumentException("Primary record cannot be null for channel " + channelName);
        overflow = overflow == null ? List.of() : List.copyOf(overflow);
    }

    /**
     * Returns the primary followed by the overflow, in order.
     */
    public List<ChannelRecord> members() {
        List<ChannelRecord> all = new ArrayList<>(overflow.size() + 1);
        all.add(primary);
        all.addAll(overflow);
        return all;
    }
}
