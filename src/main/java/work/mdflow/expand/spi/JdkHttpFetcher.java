package work.mdflow.expand.spi;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpFetcher} backed by {@code java.net.http.HttpClient}, following redirects.
 */
public final class JdkHttpFetcher implements HttpFetcher {
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    private final Duration requestTimeout;

    public JdkHttpFetcher() {
        this(DEFAULT_TIMEOUT);
    }

    public JdkHttpFetcher(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(requestTimeout)
            .build();
    }

    @Override
    public FetchResponse fetch(URI uri, Map<String, String> headers) throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri).GET().timeout(requestTimeout);
        headers.forEach(request::header);
        HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new FetchResponse(response.statusCode(), response.headers().map(), response.body());
    }
}
