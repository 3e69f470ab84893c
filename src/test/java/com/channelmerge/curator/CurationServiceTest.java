package com.channelmerge.curator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full workflow runs against an in-memory fetcher and prober, writing into a temporary data directory.
 */
class CurationServiceTest {
    private static final String MANIFEST_A = "#EXTM3U\n"
        + "#EXTINF:-1 tvg-id=\"news\",News\nhttp://dead/news\n"
        + "#EXTINF:-1 tvg-id=\"news\",News\nhttps://live/news\n"
        + "#EXTINF:-1 group-title=\"Film\",Movies\nhttp://live/movies\n";
    private static final String MANIFEST_B = "#EXTM3U\n"
        + "#EXTINF:-1,News\nhttp://live/news2\n"
        + "#EXTINF:-1,Gone\nhttp://dead/gone\n";

    @TempDir
    Path dir;

    private final FakeProbeService prober = new FakeProbeService(Set.of("https://live/news", "http://live/movies", "http://live/news2"));

    /** Serves manifests from a map; unknown URLs fail like a broken download. */
    private static ManifestFetcherInterface fetcher(Map<String, String> manifests) {
        return url -> {
            String text = manifests.get(url);
            if (text == null) throw new IOException("HTTP 404 while downloading " + url);
            return text;
        };
    }

    static class RecordingSink implements ChannelSinkInterface {
        final List<SortedMap<String, ChannelGroup>> snapshots = new ArrayList<>();

        @Override
        public void writeBatch(SortedMap<String, ChannelGroup> groups) {
            snapshots.add(groups);
        }
    }

    private CuratorConfig config() {
        return new CuratorConfig(Duration.ofSeconds(1), 4, 0, 2, null, 1, 0L, MergeMode.REPLACE_MANIFEST,
            dir, dir.resolve("sources.json"), "", "postgres", "postgres", 5432, dir.resolve("pg").toString());
    }

    private static Map<String, String> sources() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a", "http://lists/a.m3u");
        sources.put("b", "http://lists/b.m3u");
        sources.put("bad", "http://lists/bad.m3u");
        sources.put("down", "http://lists/down.m3u");
        return sources;
    }

    @Test
    void fullRunProducesEveryDocumentAndFeedsTheSink() throws Exception {
        var sink = new RecordingSink();
        var service = new CurationService(config(),
            fetcher(Map.of("http://lists/a.m3u", MANIFEST_A, "http://lists/b.m3u", MANIFEST_B, "http://lists/bad.m3u", "not a playlist")),
            prober, sink, new CsvService(dir));

        RepairReport report = service.run(sources());

        assertEquals(5, service.getStore().size());
        assertEquals(2, service.getStore().manifests().size());
        assertEquals(List.of("Movies", "News"), new ArrayList<>(report.channels().keySet()));

        ChannelGroup news = report.channels().get("News");
        assertEquals("https://live/news", news.primary().endpoint());
        assertEquals(Map.of("tvg-id", "news"), news.primary().attributes());
        assertEquals(List.of("http://live/news2"), news.overflow().stream().map(ChannelRecord::endpoint).toList());
        assertEquals(2, report.kept());

        for (String f : List.of(CurationService.ENTRIES_FILE, CurationService.PLAYABLE_FILE, CurationService.ARRANGED_FILE,
                CurationService.FINAL_FILE, CurationService.REPORT_FILE, CurationService.PLAYLIST_FILE)) {
            assertTrue(Files.exists(dir.resolve(f)), f);
        }
        ChannelJsonService json = new ChannelJsonService();
        assertEquals(3, json.readEntries(dir.resolve(CurationService.PLAYABLE_FILE)).size());
        assertEquals(report.channels(), new TreeMap<>(json.readGroups(dir.resolve(CurationService.FINAL_FILE))));
        assertEquals(report.channels(), sink.snapshots.get(sink.snapshots.size() - 1));
    }

    @Test
    void recheckPromotesAndFallsBackToFinalDocument() throws Exception {
        ChannelJsonService json = new ChannelJsonService();
        Map<String, ChannelGroup> arranged = Map.of("News", new ChannelGroup("News",
            new ChannelRecord("m", "http://dead/news", Map.of()),
            List.of(new ChannelRecord("m", "http://dead/other", Map.of()), new ChannelRecord("m", "https://live/news", Map.of()))));
        json.writeGroups(arranged, dir.resolve(CurationService.ARRANGED_FILE));
        var service = new CurationService(config(), fetcher(Map.of()), prober, null, new CsvService(dir));

        RepairReport first = service.recheck();

        assertEquals(1, first.promoted());
        assertEquals("https://live/news", first.channels().get("News").primary().endpoint());
        assertTrue(first.channels().get("News").overflow().isEmpty());

        Files.delete(dir.resolve(CurationService.ARRANGED_FILE));
        RepairReport second = service.recheck();
        assertEquals(1, second.kept());
        assertEquals(first.channels(), second.channels());
    }

    @Test
    void recheckAfterInterruptedRepairKeepsUnfinishedGroups() throws Exception {
        ChannelJsonService json = new ChannelJsonService();
        Map<String, ChannelGroup> arranged = new LinkedHashMap<>();
        for (String name : List.of("a", "b", "c")) {
            arranged.put(name, new ChannelGroup(name, new ChannelRecord("m", "http://live/" + name, Map.of()), List.of()));
        }
        json.writeGroups(arranged, dir.resolve(CurationService.ARRANGED_FILE));
        json.writeGroups(Map.of("a", arranged.get("a")), dir.resolve(CurationService.FINAL_FILE));
        var live = new FakeProbeService(Set.of("http://live/a", "http://live/b", "http://live/c"));
        var service = new CurationService(config(), fetcher(Map.of()), live, null, new CsvService(dir));

        RepairReport report = service.recheck();

        assertEquals(List.of("a", "b", "c"), new ArrayList<>(report.channels().keySet()));
        assertEquals(3, json.readGroups(dir.resolve(CurationService.FINAL_FILE)).size());
    }

    @Test
    void ingestOrderFollowsSourceDeclarationNotDownloadSpeed() throws Exception {
        Map<String, String> manifests = Map.of(
            "http://lists/a.m3u", "#EXTM3U\n#EXTINF:-1,News\nhttps://a.example/news\n",
            "http://lists/b.m3u", "#EXTM3U\n#EXTINF:-1,News\nhttps://b.example/news\n");
        ManifestFetcherInterface slowFirst = url -> {
            if (url.equals("http://lists/a.m3u")) {
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
            return manifests.get(url);
        };
        var live = new FakeProbeService(Set.of("https://a.example/news", "https://b.example/news"));
        var service = new CurationService(config(), slowFirst, live, null, new CsvService(dir));
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a", "http://lists/a.m3u");
        sources.put("b", "http://lists/b.m3u");

        RepairReport report = service.run(sources);

        assertEquals(List.of("http://lists/a.m3u", "http://lists/b.m3u"), service.getStore().manifests());
        ChannelGroup news = report.channels().get("News");
        assertEquals("https://a.example/news", news.primary().endpoint());
        assertEquals(List.of("https://b.example/news"), news.overflow().stream().map(ChannelRecord::endpoint).toList());
    }

    @Test
    void splitWritesOnePlaylistPerFinalChannel() throws Exception {
        var service = new CurationService(config(),
            fetcher(Map.of("http://lists/a.m3u", MANIFEST_A)), prober, null, new CsvService(dir));
        service.run(Map.of("a", "http://lists/a.m3u"));

        List<Path> written = service.split();

        assertEquals(List.of("001_Movies.m3u", "002_News.m3u"), written.stream().map(p -> p.getFileName().toString()).toList());
        assertTrue(Files.exists(dir.resolve(CurationService.SPLIT_DIR).resolve("summary.txt")));
    }

    @Test
    void recheckWithoutAnyDocumentFails() {
        var service = new CurationService(config(), fetcher(Map.of()), prober, null, new CsvService(dir));
        assertThrows(IOException.class, service::recheck);
        assertThrows(IOException.class, service::split);
    }

    @Test
    void failingFinalSinkHaltsRun() {
        ChannelSinkInterface failing = groups -> {
            throw new SinkWriteException("database down");
        };
        var service = new CurationService(config(), fetcher(Map.of("http://lists/a.m3u", MANIFEST_A)), prober, failing, new CsvService(dir));
        assertThrows(SinkWriteException.class, () -> service.run(Map.of("a", "http://lists/a.m3u")));
    }

    @Test
    void emptySourceListStillWritesEmptyDocuments() throws Exception {
        var service = new CurationService(config(), fetcher(Map.of()), prober, null, new CsvService(dir));

        RepairReport report = service.run(Map.of());

        assertTrue(report.channels().isEmpty());
        assertTrue(Files.exists(dir.resolve(CurationService.FINAL_FILE)));
        assertTrue(new ChannelJsonService().readGroups(dir.resolve(CurationService.FINAL_FILE)).isEmpty());
    }

    @Test
    void sourceListKeepsDeclarationOrder() throws Exception {
        Path file = dir.resolve("sources.json");
        Files.writeString(file, "{\"zeta\": \"http://z/list.m3u\", \"alpha\": \"http://a/list.m3u\"}");

        assertEquals(List.of("zeta", "alpha"), new ArrayList<>(CurationService.readSources(file).keySet()));
    }
}
