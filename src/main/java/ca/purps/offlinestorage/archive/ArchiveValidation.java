package ca.purps.offlinestorage.archive;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of checking an extracted archive. Errors make it unusable; warnings name chapters an
 * import would leave out.
 */
@Value
@Builder
public class ArchiveValidation {
    private final boolean valid;
    @Singular
    private final List<String> errors;
    @Singular
    private final List<String> warnings;
    private final String title;
    private final String extensionId;
    private final int chapterCount;
}
