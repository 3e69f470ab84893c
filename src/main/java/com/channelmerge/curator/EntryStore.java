package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Mapping from {@link EntryKey} to {@link ChannelEntry}, merged incrementally from many manifests.
 * <p>
 * Merges are serialized on the store's monitor so manifests can be ingested from several threads;
 * the last writer for a key wins. Iteration order is manifest first-ingest order, then ordinal.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class EntryStore {
    private static final Logger logger = LoggerFactory.getLogger(EntryStore.class);

    private final MergeMode mergeMode;
    private final Map<String, SortedMap<Integer, ChannelEntry>> byManifest = new LinkedHashMap<>();

    public EntryStore() {
        this(MergeMode.REPLACE_MANIFEST);
    }

    public EntryStore(MergeMode mergeMode) {
        this.mergeMode = mergeMode == null ? MergeMode.REPLACE_MANIFEST : mergeMode;
    }

    /**
     * Upserts the entries of one manifest.
     * @param sourceManifestId manifest the entries were parsed from
     * @param newEntries parsed entries; each must carry the same source id
     */
    public synchronized void merge(String sourceManifestId, List<ChannelEntry> newEntries) {
        if (sourceManifestId == null || newEntries == null) {
            logger.warn("Invalid merge into entry store: source={}, entries={}", sourceManifestId, newEntries == null ? null : newEntries.size());
            throw new IllegalArgumentException("Source id and entries cannot be null");
        }
        for (ChannelEntry entry : newEntries) {
            if (!sourceManifestId.equals(entry.sourceManifest())) {
                throw new IllegalArgumentException("Entry " + entry.key() + " does not belong to manifest " + sourceManifestId);
            }
        }
        SortedMap<Integer, ChannelEntry> slot = byManifest.computeIfAbsent(sourceManifestId, k -> new TreeMap<>());
        int previous = slot.size();
        if (mergeMode == MergeMode.REPLACE_MANIFEST) slot.clear();
        for (ChannelEntry entry : newEntries) slot.put(entry.ordinal(), entry);
        if (mergeMode == MergeMode.MERGE_BY_ORDINAL && slot.size() > newEntries.size()) {
            logger.debug("Manifest {} kept {} orphaned entries from an earlier parse", sourceManifestId, slot.size() - newEntries.size());
        }
        logger.info("Merged {} entries from {} ({} before, {} now)", newEntries.size(), sourceManifestId, previous, slot.size());
    }

    /**
     * Rebuilds a store from an entry document written by {@link ChannelJsonService#writeEntries}.
     * Manifests keep the order of their first appearance in the document.
     * @param jsonService reader for the document
     * @param file entry document
     * @param mergeMode merge semantics for later merges
     * @return the loaded store
     * @throws IOException if the document could not be read
     */
    public static EntryStore loadFrom(ChannelJsonService jsonService, Path file, MergeMode mergeMode) throws IOException {
        EntryStore store = new EntryStore(mergeMode);
        for (ChannelEntry entry : jsonService.readEntries(file)) store.put(entry);
        logger.info("Loaded {} entries from {} manifests in {}", store.size(), store.manifests().size(), file);
        return store;
    }

    /**
     * Inserts a single entry, used when reloading a persisted store.
     */
    public synchronized void put(ChannelEntry entry) {
        byManifest.computeIfAbsent(entry.sourceManifest(), k -> new TreeMap<>()).put(entry.ordinal(), entry);
    }

    /**
     * Returns a snapshot of every entry.
     */
    public synchronized List<ChannelEntry> all() {
        List<ChannelEntry> out = new ArrayList<>();
        for (SortedMap<Integer, ChannelEntry> slot : byManifest.values()) out.addAll(slot.values());
        return out;
    }

    public synchronized Optional<ChannelEntry> get(EntryKey key) {
        SortedMap<Integer, ChannelEntry> slot = byManifest.get(key.sourceManifest());
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.get(key.ordinal()));
    }

    public synchronized int size() {
        int n = 0;
        for (SortedMap<Integer, ChannelEntry> slot : byManifest.values()) n += slot.size();
        return n;
    }

    public synchronized List<String> manifests() {
        return new ArrayList<>(byManifest.keySet());
    }

    public MergeMode getMergeMode() {
        return mergeMode;
    }
}
