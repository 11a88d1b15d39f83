package ca.purps.offlinestorage.downloader;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import ca.purps.offlinestorage.config.DownloadOptions;
import ca.purps.offlinestorage.exception.HttpStatusException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

@Slf4j
public class OkHttpPageFetcher implements PageFetcher {

    private final OkHttpClient httpClient;
    private final String userAgent;

    public OkHttpPageFetcher(DownloadOptions options) {
        this(new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .build(), options.getUserAgent());
    }

    public OkHttpPageFetcher(OkHttpClient httpClient, String userAgent) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
    }

    /**
     * @throws HttpStatusException for non-2xx responses
     * @throws java.io.InterruptedIOException when the call outlives {@code timeoutMs}
     */
    @Override
    public FetchedImage fetch(String url, long timeoutMs) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent)
                .header("Accept", "image/avif,image/webp,image/*,*/*;q=0.8")
                .build();

        Call call = httpClient.newCall(request);
        call.timeout().timeout(timeoutMs, TimeUnit.MILLISECONDS);

        try (Response response = call.execute()) {
            if (!response.isSuccessful()) {
                throw new HttpStatusException(response.code(), url);
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty response body: " + url);
            }

            MediaType contentType = body.contentType();
            byte[] data = body.bytes();
            OkHttpPageFetcher.log.debug("Fetched {} bytes from {}", data.length, url);
            return new FetchedImage(data, contentType != null ? contentType.toString() : "image/jpeg");
        }
    }

}
