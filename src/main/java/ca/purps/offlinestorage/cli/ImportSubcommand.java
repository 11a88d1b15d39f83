package ca.purps.offlinestorage.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import ca.purps.offlinestorage.archive.ConflictResolution;
import ca.purps.offlinestorage.archive.ImportOptions;
import ca.purps.offlinestorage.archive.ImportResult;
import ca.purps.offlinestorage.archive.MangaImporter;
import ca.purps.offlinestorage.repository.JsonOfflineRepository;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Writes to the library directly, so the download worker must not be running at the same time.
 */
@Slf4j
@Command(name = "import", mixinStandardHelpOptions = true, description = "Import manga ZIP archives into the offline library")
public class ImportSubcommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "ARCHIVE", description = "ZIP files created by the archive command")
    private List<Path> archives;

    @Option(names = { "--data-dir" }, required = true, description = "Data directory holding the offline library")
    private Path dataDir;

    @Option(names = { "--db" }, required = true, description = "Offline database file the worker uses")
    private Path dbPath;

    @Option(names = { "--conflict" }, defaultValue = "skip",
            description = "What to do when a manga is already in the library: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ConflictResolution conflict;

    @Option(names = { "--no-validate" }, description = "Import without checking the archive layout first")
    private boolean noValidate;

    @Override
    public Integer call() {
        MangaImporter importer = new MangaImporter(dataDir, new JsonOfflineRepository(dbPath));

        int failed = 0;
        for (Path archive : archives) {
            ImportOptions options = ImportOptions.builder()
                    .conflictResolution(conflict)
                    .validate(!noValidate)
                    .progressListener((current, total, message) -> System.err.printf("\r%s: %d%% %s", archive.getFileName(), current, message))
                    .build();

            ImportResult result = importer.importArchive(archive, options);
            System.err.println();

            if (!result.isSuccess()) {
                failed++;
                System.out.printf("FAILED  %s: %s%n", archive, result.getError());
            } else if (result.isSkipped()) {
                System.out.printf("SKIPPED %s: %s/%s already in the library%n", archive, result.getExtensionId(), result.getMangaSlug());
            } else {
                System.out.printf("OK      %s -> %s/%s (%d chapters)%n", archive, result.getExtensionId(), result.getMangaSlug(),
                        result.getChaptersImported());
            }
        }

        ImportSubcommand.log.info("Imported {} archive(s), {} failed", archives.size() - failed, failed);
        return failed == 0 ? 0 : 1;
    }

}
