package ca.purps.offlinestorage.downloader;

import java.io.IOException;

/**
 * Network primitive used for single images. One call is one attempt; retrying is up to the caller.
 */
public interface PageFetcher {

    FetchedImage fetch(String url, long timeoutMs) throws IOException;

}
