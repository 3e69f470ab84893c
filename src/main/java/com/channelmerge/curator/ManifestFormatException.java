package com.channelmerge.curator;

/**
 * Thrown when a manifest does not start with the {@code #EXTM3U} header.
 * Fatal for that manifest only; callers skip it and continue with the others.
 */
public class ManifestFormatException extends Exception {
    private final String sourceManifest;

    public ManifestFormatException(String sourceManifest, String message) {
        super(message);
        this.sourceManifest = sourceManifest;
    }

    public String getSourceManifest() {
        return sourceManifest;
    }
}
