package com.channelmerge.curator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * Reads and writes the two persisted JSON documents with Jackson.
 * <p>
 * Entry document: {@code { "<source>_<ordinal>": {source_url, channel_name, stream_url, attributes} }}.
 * Grouped document: {@code { "<channel name>": {source_url, channel_name, stream_url, attributes, childlist: [...]} }}.
 * Field names match the legacy files, so documents written by earlier runs load unchanged.
 * Writes go to a temporary file that is then moved over the target, so a crash never leaves half a document.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class ChannelJsonService {
    private static final Logger logger = LoggerFactory.getLogger(ChannelJsonService.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    record EntryDocument(
        @JsonProperty("source_url") String sourceUrl,
        @JsonProperty("channel_name") String channelName,
        @JsonProperty("stream_url") String streamUrl,
        @JsonProperty("attributes") Map<String, String> attributes
    ) {}

    record GroupDocument(
        @JsonProperty("source_url") String sourceUrl,
        @JsonProperty("channel_name") String channelName,
        @JsonProperty("stream_url") String streamUrl,
        @JsonProperty("attributes") Map<String, String> attributes,
        @JsonProperty("childlist") List<ChannelRecord> childlist
    ) {}

    public void writeEntries(List<ChannelEntry> entries, Path file) throws IOException {
        Map<String, EntryDocument> doc = new LinkedHashMap<>();
        for (ChannelEntry e : entries) {
            doc.put(e.key().toString(), new EntryDocument(e.sourceManifest(), e.channelName(), e.endpoint(), e.attributes()));
        }
        writeAtomically(doc, file);
        logger.info("Wrote {} entries to {}", entries.size(), file);
    }

    /**
     * Loads an entry document.
     * Records without a stream URL are skipped, and a record whose key has no ordinal suffix is an error.
     */
    public List<ChannelEntry> readEntries(Path file) throws IOException {
        Map<String, EntryDocument> doc = mapper.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, EntryDocument>>() {});
        List<ChannelEntry> entries = new ArrayList<>();
        for (Map.Entry<String, EntryDocument> e : doc.entrySet()) {
            EntryDocument d = e.getValue();
            if (d == null || d.streamUrl() == null || d.streamUrl().isBlank()) {
                logger.debug("Skipping entry {} without stream URL", e.getKey());
                continue;
            }
            EntryKey key;
            try {
                key = EntryKey.parse(e.getKey());
            } catch (IllegalArgumentException ex) {
                throw new IOException("Malformed entry key in " + file + ": " + e.getKey(), ex);
            }
            String source = d.sourceUrl() != null ? d.sourceUrl() : key.sourceManifest();
            String name = d.channelName() != null ? d.channelName() : ManifestParser.UNKNOWN_CHANNEL;
            entries.add(new ChannelEntry(source, key.ordinal(), name, d.streamUrl(), d.attributes()));
        }
        return entries;
    }

    public void writeGroups(Map<String, ChannelGroup> groups, Path file) throws IOException {
        Map<String, GroupDocument> doc = new LinkedHashMap<>();
        for (ChannelGroup g : groups.values()) {
            ChannelRecord p = g.primary();
            doc.put(g.channelName(), new GroupDocument(p.sourceManifest(), g.channelName(), p.endpoint(), p.attributes(), g.overflow()));
        }
        writeAtomically(doc, file);
        logger.info("Wrote {} channel groups to {}", groups.size(), file);
    }

    /**
     * Loads a grouped document, keeping the document's key order.
     * Groups without a primary stream URL are skipped.
     */
    public LinkedHashMap<String, ChannelGroup> readGroups(Path file) throws IOException {
        Map<String, GroupDocument> doc = mapper.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, GroupDocument>>() {});
        LinkedHashMap<String, ChannelGroup> groups = new LinkedHashMap<>();
        for (Map.Entry<String, GroupDocument> e : doc.entrySet()) {
            GroupDocument d = e.getValue();
            if (d == null || d.streamUrl() == null || d.streamUrl().isBlank()) {
                logger.warn("Skipping channel group '{}' without a primary stream URL", e.getKey());
                continue;
            }
            String name = d.channelName() != null ? d.channelName() : e.getKey();
            List<ChannelRecord> overflow = new ArrayList<>();
            if (d.childlist() != null) {
                for (ChannelRecord r : d.childlist()) {
                    if (r != null && r.endpoint() != null && !r.endpoint().isBlank()) overflow.add(r);
                }
            }
            groups.put(e.getKey(), new ChannelGroup(name, new ChannelRecord(d.sourceUrl(), d.streamUrl(), d.attributes()), overflow));
        }
        return groups;
    }

    private void writeAtomically(Object doc, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), doc);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
