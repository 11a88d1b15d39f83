package ca.purps.offlinestorage.archive;

/**
 * What an import does when the manga is already in the library.
 */
public enum ConflictResolution {
    /** Leave the library untouched and report the import as skipped. */
    SKIP,
    /** Delete the existing manga first. */
    OVERWRITE,
    /** Import next to the existing manga under a suffixed slug and id. */
    RENAME
}
