package com.channelmerge.curator;

import java.io.IOException;

/**
 * Interface for retrieving raw manifest text.
 */
public interface ManifestFetcherInterface {
    /**
     * Downloads a manifest.
     * @param manifestUrl URL of the playlist
     * @return playlist text
     * @throws IOException if the manifest could not be retrieved
     */
    String fetch(String manifestUrl) throws IOException;
}
