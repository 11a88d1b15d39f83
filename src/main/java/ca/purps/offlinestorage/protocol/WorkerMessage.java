package ca.purps.offlinestorage.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import ca.purps.offlinestorage.event.OfflineStorageEvent;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Messages written by the worker to its standard output, one JSON object per line, told apart by
 * their {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WorkerMessage.Ready.class, name = "ready"),
        @JsonSubTypes.Type(value = WorkerMessage.Started.class, name = "started"),
        @JsonSubTypes.Type(value = WorkerMessage.Stopped.class, name = "stopped"),
        @JsonSubTypes.Type(value = WorkerMessage.Result.class, name = "result"),
        @JsonSubTypes.Type(value = WorkerMessage.Error.class, name = "error"),
        @JsonSubTypes.Type(value = WorkerMessage.FatalError.class, name = "fatal-error"),
        @JsonSubTypes.Type(value = WorkerMessage.Event.class, name = "event")
})
public sealed interface WorkerMessage {

    /** Init config received and the worker is able to take commands. */
    @Value
    final class Ready implements WorkerMessage {
    }

    /** The download queue is being processed. */
    @Value
    final class Started implements WorkerMessage {
    }

    @Value
    final class Stopped implements WorkerMessage {
    }

    @Value
    @Jacksonized
    @Builder
    final class Result implements WorkerMessage {
        private final long requestId;
        /** Null for commands without a result. */
        private final JsonNode result;
    }

    /**
     * Failure of one command, or of the worker in general when {@code requestId} is absent.
     */
    @Value
    @Jacksonized
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    final class Error implements WorkerMessage {
        private final Long requestId;
        @NonNull
        private final String error;
        private final String stack;
    }

    /** The worker cannot continue, typically because initialization failed. */
    @Value
    @Jacksonized
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    final class FatalError implements WorkerMessage {
        @NonNull
        private final String error;
        private final String stack;
    }

    @Value
    @Jacksonized
    @Builder
    final class Event implements WorkerMessage {
        @NonNull
        private final OfflineStorageEvent event;
    }
}
