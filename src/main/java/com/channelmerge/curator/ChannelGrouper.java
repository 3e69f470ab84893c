package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Groups reachable entries by channel name and picks a primary endpoint per group.
 * <p>
 * Priority classes, best first:
 * <ol>
 *   <li>{@code https://} with a non-bracketed host</li>
 *   <li>{@code http://} with a non-bracketed host</li>
 *   <li>{@code https://} with a bracketed (IPv6 literal) host</li>
 *   <li>{@code http://} with a bracketed host</li>
 * </ol>
 * The primary is the member with the lowest class; ties go to the earliest member. If no member has a
 * recognized scheme the first member is primary. Everything else becomes overflow in original order, so
 * building twice from the same input gives the same groups.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class ChannelGrouper {
    private static final Logger logger = LoggerFactory.getLogger(ChannelGrouper.class);

    public static final int UNRANKED = Integer.MAX_VALUE;

    /**
     * Builds groups from entries that already passed the reachability check.
     * @param entries reachable entries in store order
     * @return groups keyed by channel name, in first-seen order
     */
    public LinkedHashMap<String, ChannelGroup> build(List<ChannelEntry> entries) {
        Map<String, List<ChannelRecord>> partitions = new LinkedHashMap<>();
        int skipped = 0;
        for (ChannelEntry entry : entries) {
            if (entry.endpoint() == null || entry.endpoint().isBlank()) {
                skipped++;
                continue;
            }
            partitions.computeIfAbsent(entry.channelName(), k -> new ArrayList<>()).add(entry.toRecord());
        }
        if (skipped > 0) logger.warn("Skipped {} entries without an endpoint", skipped);

        LinkedHashMap<String, ChannelGroup> groups = new LinkedHashMap<>();
        for (Map.Entry<String, List<ChannelRecord>> partition : partitions.entrySet()) {
            groups.put(partition.getKey(), prioritize(partition.getKey(), partition.getValue()));
        }
        logger.info("Grouped {} entries into {} channels", entries.size() - skipped, groups.size());
        return groups;
    }

    /**
     * Selects the primary among members and returns the group.
     * @param channelName shared channel name
     * @param members non-empty member list in original order
     * @return group with the best-ranked member as primary
     */
    public static ChannelGroup prioritize(String channelName, List<ChannelRecord> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Channel " + channelName + " has no members");
        }
        int best = 0;
        int bestClass = classOf(members.get(0).endpoint());
        for (int i = 1; i < members.size(); i++) {
            int c = classOf(members.get(i).endpoint());
            if (c < bestClass) {
                best = i;
                bestClass = c;
            }
        }
        List<ChannelRecord> overflow = new ArrayList<>(members);
        ChannelRecord primary = overflow.remove(best);
        return new ChannelGroup(channelName, primary, overflow);
    }

    /**
     * Ranks an endpoint by transport security and address family.
     * @param endpoint stream URL
     * @return 1 to 4, or {@link #UNRANKED} when the scheme is neither http nor https
     */
    public static int classOf(String endpoint) {
        if (endpoint == null) return UNRANKED;
        String lower = endpoint.toLowerCase(Locale.ROOT);
        boolean secure;
        if (lower.startsWith("https://")) secure = true;
        else if (lower.startsWith("http://")) secure = false;
        else return UNRANKED;
        boolean bracketed = Utils.hostOf(endpoint).startsWith("[");
        if (!bracketed) return secure ? 1 : 2;
        return secure ? 3 : 4;
    }
}
