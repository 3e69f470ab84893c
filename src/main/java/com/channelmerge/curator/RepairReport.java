package com.channelmerge.curator;

import java.util.List;
import java.util.SortedMap;

/**
 * Outcome of one repair run.
 *
 * @param channels surviving groups keyed and sorted by channel name
 * @param groupsIn number of groups the run started with
 * @param kept groups whose primary was still reachable
 * @param promoted groups whose primary was replaced by a reachable overflow member
 * @param removed groups with no reachable member left
 * @param transientErrors probes that ended in an indeterminate error
 * @param deadlineExceeded whether the run deadline cut probing short
 * @param probes every probe outcome, for diagnostics
 */
public record RepairReport(
    SortedMap<String, ChannelGroup> channels,
    int groupsIn,
    int kept,
    int promoted,
    int removed,
    int transientErrors,
    boolean deadlineExceeded,
    List<ProbeReportRow> probes
) {}
