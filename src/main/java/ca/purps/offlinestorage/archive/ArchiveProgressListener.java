package ca.purps.offlinestorage.archive;

@FunctionalInterface
public interface ArchiveProgressListener {

    ArchiveProgressListener NONE = (current, total) -> {
    };

    void onProgress(int current, int total);

}
