package ca.purps.offlinestorage.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import ca.purps.offlinestorage.config.DownloadOptions;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Sent once, right after the worker process is spawned.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkerInitConfig {
    @NonNull
    private final String dataDir;
    /** JSON document holding queue, history and offline rows. */
    @NonNull
    private final String dbPath;
    /** Jar or directory with a catalog source provider; the worker classpath when absent. */
    private final String extensionPath;
    private final String extensionId;
    @Builder.Default
    private final DownloadOptions workerOptions = DownloadOptions.defaults();
}
