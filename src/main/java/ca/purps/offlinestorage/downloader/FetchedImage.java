package ca.purps.offlinestorage.downloader;

import lombok.NonNull;
import lombok.Value;

@Value
public class FetchedImage {
    @NonNull
    private final byte[] data;
    @NonNull
    private final String mimeType;
}
