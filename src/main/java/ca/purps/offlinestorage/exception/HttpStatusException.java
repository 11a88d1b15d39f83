package ca.purps.offlinestorage.exception;

import java.io.IOException;

import lombok.Getter;

@Getter
public class HttpStatusException extends IOException {

    private final int statusCode;
    private final String url;

    public HttpStatusException(int statusCode, String url) {
        super(String.format("HTTP %d: %s", statusCode, url));
        this.statusCode = statusCode;
        this.url = url;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

}
