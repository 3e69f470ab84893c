package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes grouped channels back out as M3U playlists.
 * <p>
 * Each member becomes one {@code #EXTINF} line carrying its own attributes and the group's name, followed by
 * its endpoint; the primary comes first. Parsing the output with {@link ManifestParser} yields the same members
 * per channel name.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class PlaylistWriter {
    private static final Logger logger = LoggerFactory.getLogger(PlaylistWriter.class);

    /**
     * Writes every group, sorted by channel name, into one playlist.
     * @param groups groups keyed by channel name
     * @param file target playlist
     * @throws IOException if the file could not be written
     */
    public void writePlaylist(Map<String, ChannelGroup> groups, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
        int lines = 0;
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            w.write(ManifestParser.HEADER);
            w.newLine();
            for (ChannelGroup group : new TreeMap<>(groups).values()) {
                for (ChannelRecord r : group.members()) {
                    writeMember(w, group.channelName(), r);
                    lines++;
                }
            }
        }
        logger.info("Wrote {} endpoints for {} channels to {}", lines, groups.size(), file);
    }

    /**
     * Writes one playlist per channel plus a summary file listing them.
     * @param groups groups keyed by channel name
     * @param dir output directory, created if missing
     * @return paths of the playlists written, in channel-name order
     * @throws IOException if a file could not be written
     */
    public List<Path> writePerChannel(Map<String, ChannelGroup> groups, Path dir) throws IOException {
        if (!Files.exists(dir)) Files.createDirectories(dir);
        List<Path> written = new ArrayList<>();
        List<String> summary = new ArrayList<>();
        summary.add("Channels: " + groups.size());
        int index = 1;
        for (ChannelGroup group : new TreeMap<>(groups).values()) {
            String filename = String.format("%03d_%s.m3u", index++, Utils.sanitizeFilename(group.channelName()));
            Path file = dir.resolve(filename);
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                w.write(ManifestParser.HEADER);
                w.newLine();
                for (ChannelRecord r : group.members()) writeMember(w, group.channelName(), r);
            }
            written.add(file);
            summary.add(filename + " - " + group.channelName() + " (" + group.members().size() + " endpoints)");
        }
        Files.write(dir.resolve("summary.txt"), summary, StandardCharsets.UTF_8);
        logger.info("Wrote {} per-channel playlists to {}", written.size(), dir);
        return written;
    }

    static String metadataLine(String channelName, ChannelRecord record) {
        StringBuilder sb = new StringBuilder(ManifestParser.METADATA_PREFIX).append(":-1");
        for (ChannelAttribute a : ChannelAttributeRegistry.getAttributes()) {
            String value = record.attributes().get(a.key);
            if (value != null) sb.append(' ').append(a.key).append("=\"").append(value).append('"');
        }
        return sb.append(',').append(channelName).toString();
    }

    private static void writeMember(BufferedWriter w, String channelName, ChannelRecord record) throws IOException {
        w.write(metadataLine(channelName, record));
        w.newLine();
        w.write(record.endpoint());
        w.newLine();
    }
}
