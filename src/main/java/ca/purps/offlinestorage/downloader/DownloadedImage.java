package ca.purps.offlinestorage.downloader;

import java.nio.file.Path;

import lombok.Value;

@Value
public class DownloadedImage {
    private final Path path;
    private final String filename;
    private final long sizeBytes;
    private final String mimeType;
}
