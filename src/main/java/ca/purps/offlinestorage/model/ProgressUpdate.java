package ca.purps.offlinestorage.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProgressUpdate {
    private final long queueId;
    private final String mangaId;
    private final String chapterId;
    private final int progressCurrent;
    private final int progressTotal;

    public boolean isComplete() {
        return progressTotal > 0 && progressCurrent >= progressTotal;
    }
}
