package ca.purps.offlinestorage.exception;

import lombok.Getter;

@Getter
public class QueueItemNotFoundException extends OfflineStorageException {

    private final long queueId;

    public QueueItemNotFoundException(long queueId) {
        super(String.format("Queue item %d not found", queueId));
        this.queueId = queueId;
    }

}
