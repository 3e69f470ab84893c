package com.channelmerge.curator;

/**
 * Stable identifier of a parsed entry: the manifest it came from and its 0-based parse ordinal.
 * The string form {@code <sourceManifest>_<ordinal>} is the key used in the persisted entry document.
 */
public record EntryKey(String sourceManifest, int ordinal) {

    /**
     * Parses the persisted string form. The ordinal is the suffix after the last underscore.
     * @param key persisted key
     * @return EntryKey
     * @throws IllegalArgumentException if the key has no numeric ordinal suffix
     */
    public static EntryKey parse(String key) {
        int idx = key == null ? -1 : key.lastIndexOf('_');
        if (idx <= 0 || idx == key.length() - 1) {
            throw new IllegalArgumentException("Entry key has no ordinal suffix: " + key);
        }
        try {
            return new EntryKey(key.substring(0, idx), Integer.parseInt(key.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Entry key has a non-numeric ordinal: " + key, e);
        }
    }

    @Override
    public String toString() {
        return sourceManifest + "_" + ordinal;
    }
}
