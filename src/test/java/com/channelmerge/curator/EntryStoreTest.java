package com.channelmerge.curator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class EntryStoreTest {

    private static List<ChannelEntry> entries(String source, int count, String suffix) {
        List<ChannelEntry> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(new ChannelEntry(source, i, "Channel " + i, "http://" + suffix + "/" + i, null));
        }
        return out;
    }

    @Test
    void remergeOfSameManifestOverwritesInPlace() {
        EntryStore store = new EntryStore();
        store.merge("m1", entries("m1", 3, "old"));
        store.merge("m1", entries("m1", 3, "new"));

        assertEquals(3, store.size());
        assertEquals("http://new/1", store.get(new EntryKey("m1", 1)).orElseThrow().endpoint());
    }

    @Test
    void replaceModeDropsEntriesOfShrunkManifest() {
        EntryStore store = new EntryStore(MergeMode.REPLACE_MANIFEST);
        store.merge("m1", entries("m1", 3, "old"));
        store.merge("m1", entries("m1", 1, "new"));

        assertEquals(1, store.size());
        assertTrue(store.get(new EntryKey("m1", 2)).isEmpty());
    }

    @Test
    void ordinalModeKeepsOrphansFromLongerParse() {
        EntryStore store = new EntryStore(MergeMode.MERGE_BY_ORDINAL);
        store.merge("m1", entries("m1", 3, "old"));
        store.merge("m1", entries("m1", 1, "new"));

        assertEquals(3, store.size());
        assertEquals("http://new/0", store.get(new EntryKey("m1", 0)).orElseThrow().endpoint());
        assertEquals("http://old/2", store.get(new EntryKey("m1", 2)).orElseThrow().endpoint());
    }

    @Test
    void allListsManifestsInIngestOrderThenOrdinal() {
        EntryStore store = new EntryStore();
        store.merge("b", entries("b", 2, "b"));
        store.merge("a", entries("a", 2, "a"));

        List<ChannelEntry> all = store.all();
        assertEquals(List.of("b", "b", "a", "a"), all.stream().map(ChannelEntry::sourceManifest).toList());
        assertEquals(List.of("b", "a"), store.manifests());
    }

    @Test
    void rejectsEntriesFromAnotherManifest() {
        EntryStore store = new EntryStore();
        store.merge("m1", entries("m1", 2, "x"));
        assertThrows(IllegalArgumentException.class, () -> store.merge("m1", entries("m2", 1, "y")));
        assertEquals(2, store.size());
    }

    @Test
    void concurrentMergesKeepEveryManifest() throws Exception {
        EntryStore store = new EntryStore();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int m = 0; m < 20; m++) {
                String source = "m" + m;
                tasks.add(pool.submit(() -> store.merge(source, entries(source, 50, source))));
            }
            for (Future<?> t : tasks) t.get();
        } finally {
            pool.shutdownNow();
        }
        assertEquals(20 * 50, store.size());
        assertEquals(20, store.manifests().size());
    }

    @Test
    void entryKeyStringFormRoundTrips() {
        EntryKey key = new EntryKey("http://lists.example/a_b.m3u", 12);
        assertEquals("http://lists.example/a_b.m3u_12", key.toString());
        assertEquals(key, EntryKey.parse(key.toString()));
        assertThrows(IllegalArgumentException.class, () -> EntryKey.parse("no-ordinal"));
        assertThrows(IllegalArgumentException.class, () -> EntryKey.parse("source_x"));
    }

    @Test
    void storeReloadsFromEntryDocument(@TempDir Path dir) throws Exception {
        EntryStore store = new EntryStore();
        store.merge("b", entries("b", 2, "b"));
        store.merge("a", entries("a", 3, "a"));
        ChannelJsonService json = new ChannelJsonService();
        Path file = dir.resolve("channels.json");
        json.writeEntries(store.all(), file);

        EntryStore loaded = EntryStore.loadFrom(json, file, MergeMode.MERGE_BY_ORDINAL);

        assertEquals(store.all(), loaded.all());
        assertEquals(List.of("b", "a"), loaded.manifests());
        assertEquals(MergeMode.MERGE_BY_ORDINAL, loaded.getMergeMode());
        loaded.merge("a", entries("a", 1, "new"));
        assertEquals(5, loaded.size());
    }
}
