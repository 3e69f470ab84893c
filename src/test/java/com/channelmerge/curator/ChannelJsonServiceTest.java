package com.channelmerge.curator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ChannelJsonServiceTest {
    private final ChannelJsonService json = new ChannelJsonService();

    @TempDir
    Path dir;

    @Test
    void groupsSurviveWriteAndRead() throws IOException {
        Map<String, ChannelGroup> groups = new LinkedHashMap<>();
        groups.put("News", new ChannelGroup("News",
            new ChannelRecord("m1", "https://a/1", Map.of("tvg-id", "n1")),
            List.of(new ChannelRecord("m2", "http://b/2", Map.of()))));
        groups.put("Sports", new ChannelGroup("Sports", new ChannelRecord("m1", "http://c/3", Map.of()), List.of()));
        Path file = dir.resolve("groups.json");

        json.writeGroups(groups, file);

        assertEquals(groups, json.readGroups(file));
        assertFalse(Files.exists(dir.resolve("groups.json.tmp")));
    }

    @Test
    void groupDocumentUsesLegacyFieldNames() throws IOException {
        Map<String, ChannelGroup> groups = Map.of("X", new ChannelGroup("X",
            new ChannelRecord("m", "http://x/1", Map.of()), List.of(new ChannelRecord("m", "http://x/2", Map.of()))));
        Path file = dir.resolve("final.json");
        json.writeGroups(groups, file);

        String text = Files.readString(file);
        for (String field : List.of("\"source_url\"", "\"channel_name\"", "\"stream_url\"", "\"attributes\"", "\"childlist\"")) {
            assertTrue(text.contains(field), field);
        }
    }

    @Test
    void readsLegacyDocumentAndSkipsGroupsWithoutStream() throws IOException {
        Path file = dir.resolve("legacy.json");
        Files.writeString(file, "{\n"
            + "  \"A\": {\"source_url\": \"s\", \"channel_name\": \"A\", \"stream_url\": \"http://a\", \"attributes\": {\"tvg-logo\": \"l\"},"
            + "         \"childlist\": [{\"source_url\": \"s\", \"stream_url\": \"http://a2\", \"attributes\": {}}]},\n"
            + "  \"B\": {\"source_url\": \"s\", \"channel_name\": \"B\", \"attributes\": {}}\n"
            + "}");

        LinkedHashMap<String, ChannelGroup> groups = json.readGroups(file);

        assertEquals(List.of("A"), new ArrayList<>(groups.keySet()));
        assertEquals("l", groups.get("A").primary().attributes().get("tvg-logo"));
        assertEquals("http://a2", groups.get("A").overflow().get(0).endpoint());
    }

    @Test
    void entriesRoundTripWithOrdinalsFromKeys() throws IOException {
        List<ChannelEntry> entries = List.of(
            new ChannelEntry("http://lists/a_b.m3u", 0, "One", "http://h/1", Map.of("group-title", "G")),
            new ChannelEntry("http://lists/a_b.m3u", 7, "Two", "http://h/2", Map.of()));
        Path file = dir.resolve("channels.json");

        json.writeEntries(entries, file);

        assertTrue(Files.readString(file).contains("\"http://lists/a_b.m3u_7\""));
        assertEquals(entries, json.readEntries(file));
    }

    @Test
    void malformedEntryKeyIsRejected() throws IOException {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"nokey\": {\"source_url\": \"s\", \"channel_name\": \"c\", \"stream_url\": \"http://x\", \"attributes\": {}}}");
        assertThrows(IOException.class, () -> json.readEntries(file));
    }
}
