package ca.purps.offlinestorage.utility;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UtilityClass
public class FileSystemUtils {

    public Path ensureDir(Path dir) throws IOException {
        return Files.createDirectories(dir);
    }

    /**
     * Recursively deletes {@code dir}; a missing directory is not an error.
     */
    public void deleteDir(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }

        Files.walkFileTree(dir, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path directory, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(directory);
                return FileVisitResult.CONTINUE;
            }
        });
        FileSystemUtils.log.debug("Deleted directory: {}", dir);
    }

    /**
     * Total size of the regular files below {@code path}; 0 if it does not exist.
     */
    public long dirSize(Path path) throws IOException {
        if (!Files.exists(path)) {
            return 0;
        }

        AtomicLong total = new AtomicLong();
        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    total.addAndGet(attrs.size());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }
        });
        return total.get();
    }

    public long fileSize(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0;
        }
    }

    /**
     * Sorted names of the regular files directly inside {@code dir}.
     */
    public List<String> listFiles(Path dir) throws IOException {
        return list(dir, false);
    }

    /**
     * Sorted names of the directories directly inside {@code dir}.
     */
    public List<String> listDirs(Path dir) throws IOException {
        return list(dir, true);
    }

    private List<String> list(Path dir, boolean directories) throws IOException {
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }

        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                if (directories ? Files.isDirectory(entry) : Files.isRegularFile(entry)) {
                    names.add(entry.getFileName().toString());
                }
            }
        }
        Collections.sort(names);
        return names;
    }

}
