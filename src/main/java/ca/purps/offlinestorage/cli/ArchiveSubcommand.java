package ca.purps.offlinestorage.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import ca.purps.offlinestorage.archive.ArchiveItem;
import ca.purps.offlinestorage.archive.ArchiveOptions;
import ca.purps.offlinestorage.archive.ArchiveResult;
import ca.purps.offlinestorage.archive.MangaArchiver;
import ca.purps.offlinestorage.repository.MetadataStore;
import ca.purps.offlinestorage.utility.FileSystemUtils;
import ca.purps.offlinestorage.utility.OfflinePaths;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Slf4j
@Command(name = "archive", mixinStandardHelpOptions = true, description = "Export downloaded manga to ZIP archives")
public class ArchiveSubcommand implements Callable<Integer> {

    @Option(names = { "--data-dir" }, required = true, description = "Data directory holding the offline library")
    private Path dataDir;

    @Option(names = { "--out" }, required = true, description = "Directory the ZIP files are written to")
    private Path outputDir;

    @Option(names = { "--extension" }, description = "Only export manga of this extension")
    private String extensionId;

    @Option(names = { "--level" }, defaultValue = "6", description = "Compression level, 0 (store) to 9 (best)")
    private int level;

    @Option(names = { "--no-metadata" }, description = "Leave metadata.json files out of the archives")
    private boolean noMetadata;

    @Override
    public Integer call() throws IOException {
        if (level < 0 || level > 9) {
            throw new IllegalArgumentException("Compression level must be between 0 and 9: " + level);
        }

        List<ArchiveItem> items = findManga();
        if (items.isEmpty()) {
            ArchiveSubcommand.log.warn("No downloaded manga found in {}", dataDir);
            return 0;
        }

        ArchiveOptions options = ArchiveOptions.builder()
                .compressionLevel(level)
                .includeMetadata(!noMetadata)
                .progressListener((current, total) -> System.err.printf("\rArchiving... %d%%", current))
                .build();

        List<ArchiveResult> results = new MangaArchiver(dataDir).archiveBulk(items, outputDir, options);
        System.err.println();

        int failed = 0;
        for (ArchiveResult result : results) {
            if (result.isSuccess()) {
                System.out.printf("OK     %s (%d bytes)%n", result.getOutputPath(), result.getSizeBytes());
            } else {
                failed++;
                System.out.printf("FAILED %s: %s%n", result.getOutputPath(), result.getError());
            }
        }
        return failed == 0 ? 0 : 1;
    }

    private List<ArchiveItem> findManga() throws IOException {
        MetadataStore store = new MetadataStore(dataDir);
        Path root = OfflinePaths.offlineRoot(dataDir);

        List<String> extensions = extensionId != null ? List.of(extensionId) : FileSystemUtils.listDirs(root);
        List<ArchiveItem> items = new ArrayList<>();
        for (String extension : extensions) {
            for (String slug : FileSystemUtils.listDirs(root.resolve(extension))) {
                store.readManga(extension, slug)
                        .ifPresentOrElse(
                                metadata -> items.add(new ArchiveItem(extension, metadata)),
                                () -> ArchiveSubcommand.log.warn("Skipping {}/{}: no readable metadata", extension, slug));
            }
        }
        return items;
    }

}
