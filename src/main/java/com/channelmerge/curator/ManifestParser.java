package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw M3U playlist text into an ordered list of {@link ChannelEntry}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Rejects input whose first line is not the {@code #EXTM3U} header; nothing is produced in that case.</li>
 *   <li>Trims every line and skips blank ones.</li>
 *   <li>An {@code #EXTINF} line opens a pending entry, replacing (and dropping) any pending entry before it.</li>
 *   <li>A line starting with {@code http} completes the pending entry; without one it is ignored.</li>
 *   <li>Any other line is ignored.</li>
 * </ul>
 * Ordinals count materialized entries only, so dropped metadata lines never leave gaps.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class ManifestParser {
    private static final Logger logger = LoggerFactory.getLogger(ManifestParser.class);

    public static final String HEADER = "#EXTM3U";
    public static final String METADATA_PREFIX = "#EXTINF";
    public static final String ENDPOINT_PREFIX = "http";
    public static final String UNKNOWN_CHANNEL = "Unknown";
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private static final Pattern CHANNEL_NAME_PATTERN = Pattern.compile(",([^,]*)$");

    /**
     * Parses a manifest.
     * @param rawText full playlist text
     * @param sourceManifestId identifier (usually the URL) of the manifest
     * @return entries in parse order, ordinals starting at 0
     * @throws ManifestFormatException if the header line is missing
     */
    public List<ChannelEntry> parse(String rawText, String sourceManifestId) throws ManifestFormatException {
        if (sourceManifestId == null || sourceManifestId.isBlank()) {
            logger.warn("Attempted to parse a manifest without a source id.");
            throw new IllegalArgumentException("Source manifest id cannot be null or empty");
        }
        String[] lines = rawText == null ? new String[0] : rawText.split("\\R", -1);
        if (lines.length > 0 && lines[0].startsWith(BYTE_ORDER_MARK)) lines[0] = lines[0].substring(1);
        if (lines.length == 0 || !lines[0].trim().startsWith(HEADER)) {
            throw new ManifestFormatException(sourceManifestId, "Manifest does not start with " + HEADER + ": " + sourceManifestId);
        }

        List<ChannelEntry> entries = new ArrayList<>();
        String pendingName = null;
        Map<String, String> pendingAttributes = null;
        int droppedMetadata = 0;
        int orphanEndpoints = 0;

        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty()) continue;

            if (line.startsWith(METADATA_PREFIX)) {
                if (pendingName != null) droppedMetadata++;
                pendingName = extractChannelName(line);
                pendingAttributes = ChannelAttributeRegistry.extractAll(line);
            } else if (line.startsWith(ENDPOINT_PREFIX)) {
                if (pendingName == null) {
                    orphanEndpoints++;
                    continue;
                }
                entries.add(new ChannelEntry(sourceManifestId, entries.size(), pendingName, line, pendingAttributes));
                pendingName = null;
                pendingAttributes = null;
            }
        }
        if (pendingName != null) droppedMetadata++;

        if (droppedMetadata > 0 || orphanEndpoints > 0) {
            logger.debug("Manifest {}: dropped {} metadata lines without endpoint, ignored {} endpoint lines without metadata",
                sourceManifestId, droppedMetadata, orphanEndpoints);
        }
        logger.info("Parsed {} entries from {}", entries.size(), sourceManifestId);
        return entries;
    }

    /**
     * Extracts the display name: the text after the last comma, trimmed.
     * @param metadataLine {@code #EXTINF} line
     * @return channel name, or {@value #UNKNOWN_CHANNEL} if there is no comma or nothing after it
     */
    public static String extractChannelName(String metadataLine) {
        Matcher m = CHANNEL_NAME_PATTERN.matcher(metadataLine);
        if (m.find()) {
            String name = m.group(1).trim();
            if (!name.isEmpty()) return name;
        }
        return UNKNOWN_CHANNEL;
    }
}
