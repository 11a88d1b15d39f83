package ca.purps.offlinestorage.archive;

import java.nio.file.Path;

import lombok.Value;

@Value
public class ArchiveResult {
    private final boolean success;
    private final Path outputPath;
    private final long sizeBytes;
    private final String error;

    public static ArchiveResult success(Path outputPath, long sizeBytes) {
        return new ArchiveResult(true, outputPath, sizeBytes, null);
    }

    public static ArchiveResult failure(Path outputPath, String error) {
        return new ArchiveResult(false, outputPath, 0, error);
    }
}
