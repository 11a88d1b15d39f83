package ca.purps.offlinestorage.archive;

@FunctionalInterface
public interface ImportProgressListener {

    ImportProgressListener NONE = (current, total, message) -> {
    };

    void onProgress(int current, int total, String message);

}
