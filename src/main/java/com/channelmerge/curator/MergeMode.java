package com.channelmerge.curator;

/**
 * How {@link EntryStore#merge} treats entries left over from an earlier parse of the same manifest.
 */
public enum MergeMode {
    /** Drop every earlier entry of the manifest before inserting the new parse. */
    REPLACE_MANIFEST,
    /** Overwrite by ordinal only; ordinals beyond the new parse survive from the old one. */
    MERGE_BY_ORDINAL;

    /**
     * Resolves a configuration value ({@code replace} or {@code ordinal}).
     * @param value configured value, case-insensitive
     * @return matching mode, or {@link #REPLACE_MANIFEST} for anything unrecognized
     */
    public static MergeMode fromConfig(String value) {
        if (value == null) return REPLACE_MANIFEST;
        return switch (value.trim().toLowerCase()) {
            case "ordinal", "merge", "merge_by_ordinal" -> MERGE_BY_ORDINAL;
            default -> REPLACE_MANIFEST;
        };
    }
}
