package work.mdflow.expand.spi;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a {@link RemoteCache} lookup. Expired entries may still carry their content and the
 * validators needed for a conditional request.
 */
public record CacheLookup(
    boolean hit,
    boolean expired,
    Optional<String> content,
    Optional<String> etag,
    Optional<String> lastModified
) {
    public CacheLookup {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(etag, "etag");
        Objects.requireNonNull(lastModified, "lastModified");
    }

    public static CacheLookup miss() {
        return new CacheLookup(false, false, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static CacheLookup fresh(String content, String etag, String lastModified) {
        return new CacheLookup(true, false, Optional.of(content), Optional.ofNullable(etag), Optional.ofNullable(lastModified));
    }

    public static CacheLookup expired(String content, String etag, String lastModified) {
        return new CacheLookup(false, true, Optional.ofNullable(content), Optional.ofNullable(etag), Optional.ofNullable(lastModified));
    }

    public boolean canRevalidate() {
        return expired && content.isPresent() && (etag.isPresent() || lastModified.isPresent());
    }
}
