package ca.purps.offlinestorage.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.NonNull;
import lombok.Value;

@Value
public class InitMessage implements HostMessage {

    public static final String TYPE = "init";

    @NonNull
    private final WorkerInitConfig config;

    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }
}
