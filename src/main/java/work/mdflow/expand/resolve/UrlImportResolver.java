package work.mdflow.expand.resolve;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdflow.expand.directive.ImportAction.UrlImport;
import work.mdflow.expand.runtime.ImportException;
import work.mdflow.expand.runtime.ImportFailure;
import work.mdflow.expand.runtime.ResolutionContext;
import work.mdflow.expand.spi.CacheLookup;
import work.mdflow.expand.spi.FetchResponse;
import work.mdflow.expand.spi.HttpFetcher;
import work.mdflow.expand.spi.RemoteCache;

/**
 * Fetches {@code @https://...} imports, revalidating expired cache entries when a cache is set.
 */
public final class UrlImportResolver {
    static final Map<String, String> REQUEST_HEADERS = Map.of(
        "Accept", "text/markdown, application/json, text/plain, */*",
        "User-Agent", "mdflow/1.0"
    );

    private static final Logger log = LoggerFactory.getLogger(UrlImportResolver.class);

    private final HttpFetcher fetcher;
    private final Optional<RemoteCache> cache;

    public UrlImportResolver(HttpFetcher fetcher, Optional<RemoteCache> cache) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public String resolve(UrlImport action, ResolutionContext context) {
        String url = action.url();
        log.info("Fetching: {}", url);

        CacheLookup cached = cache.map(c -> c.lookup(url)).orElse(CacheLookup.miss());
        if (cached.hit() && cached.content().isPresent()) {
            log.debug("Cache hit: {}", url);
            context.recordResolved(url);
            return cached.content().get();
        }

        Map<String, String> headers = new LinkedHashMap<>(REQUEST_HEADERS);
        if (cached.canRevalidate()) {
            cached.etag().ifPresent(etag -> headers.put("If-None-Match", etag));
            cached.lastModified().ifPresent(lastModified -> headers.put("If-Modified-Since", lastModified));
        }

        FetchResponse response = fetch(url, headers);
        if (response.isNotModified() && cached.content().isPresent()) {
            log.debug("Not modified, reusing cached copy: {}", url);
            String content = cached.content().get();
            store(url, content, cached.etag().orElse(null), cached.lastModified().orElse(null));
            context.recordResolved(url);
            return content;
        }
        if (!response.isSuccess()) {
            throw new ImportException(
                ImportFailure.URL_FETCH_FAILED,
                "Failed to fetch URL: " + url + " - HTTP " + response.status(),
                ImportException.details("url", url, "status", response.status())
            );
        }

        String contentType = response.header("Content-Type").orElse(null);
        String body = response.body();
        if (!ContentTypes.isAllowed(contentType) && ContentTypes.infer(body, url) == ContentTypes.Inferred.UNKNOWN) {
            throw new ImportException(
                ImportFailure.UNSUPPORTED_CONTENT_TYPE,
                "URL returned unsupported content type: " + (contentType == null ? "unknown" : contentType)
                    + ". Only markdown and JSON are allowed. URL: " + url,
                ImportException.details("url", url, "contentType", contentType)
            );
        }

        String content = body.trim();
        store(url, content, response.header("ETag").orElse(null), response.header("Last-Modified").orElse(null));
        context.recordResolved(url);
        return content;
    }

    private FetchResponse fetch(String url, Map<String, String> headers) {
        try {
            return fetcher.fetch(URI.create(url), headers);
        } catch (IllegalArgumentException | IOException ex) {
            throw new ImportException(
                ImportFailure.URL_FETCH_FAILED,
                "Failed to fetch URL: " + url + " - " + ex.getMessage(),
                ImportException.details("url", url),
                ex
            );
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching " + url, ex);
        }
    }

    private void store(String url, String content, String etag, String lastModified) {
        if (cache.isEmpty()) {
            return;
        }
        try {
            cache.get().store(url, content, etag, lastModified);
        } catch (UncheckedIOException ex) {
            log.warn("Could not cache {}: {}", url, ex.getMessage());
        }
    }
}
