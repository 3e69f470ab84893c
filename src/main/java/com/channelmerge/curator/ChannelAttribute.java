package com.channelmerge.curator;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Represents one recognized {@code #EXTINF} attribute.
 * Holds the manifest key, the pattern that extracts its quoted value and the column it maps to in the database.
 */
public class ChannelAttribute {
    public final String key;
    public final String columnName;
    private final Pattern pattern;

    public ChannelAttribute(String key, String columnName) {
        this.key = key;
        this.columnName = columnName;
        this.pattern = Pattern.compile(Pattern.quote(key) + "=\"([^\"]*)\"");
    }

    /**
     * Finds the first {@code key="value"} token on a metadata line.
     * @param metadataLine the full {@code #EXTINF} line
     * @return the unquoted value, or null if the key is absent
     */
    public String extract(String metadataLine) {
        if (metadataLine == null) return null;
        Matcher m = pattern.matcher(metadataLine);
        return m.find() ? m.group(1) : null;
    }
}
