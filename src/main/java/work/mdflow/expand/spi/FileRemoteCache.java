package work.mdflow.expand.spi;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory-backed {@link RemoteCache}: {@code <sha256(url)>.content} holds the body and
 * {@code <sha256(url)>.meta.json} its fetch time, TTL and validators.
 */
public final class FileRemoteCache implements RemoteCache {
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private static final Logger log = LoggerFactory.getLogger(FileRemoteCache.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();

    private final Path directory;
    private final Duration ttl;
    private final Clock clock;

    public FileRemoteCache(Path directory) {
        this(directory, DEFAULT_TTL, Clock.systemUTC());
    }

    public FileRemoteCache(Path directory, Duration ttl, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static Path defaultDirectory() {
        return Path.of(System.getProperty("user.home"), ".mdflow", "cache");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public CacheLookup lookup(String url) {
        String hash = hashUrl(url);
        Path metaPath = directory.resolve(hash + ".meta.json");
        Path contentPath = directory.resolve(hash + ".content");
        Entry entry;
        try {
            entry = JSON.readValue(metaPath.toFile(), Entry.class);
        } catch (IOException ex) {
            if (!(ex instanceof NoSuchFileException) && Files.exists(metaPath)) {
                log.debug("Ignoring unreadable cache metadata {}: {}", metaPath, ex.getMessage());
            }
            return CacheLookup.miss();
        }
        String content = readContent(contentPath);
        long age = clock.millis() - entry.fetchedAt();
        long effectiveTtl = entry.ttlMs() > 0 ? entry.ttlMs() : ttl.toMillis();
        if (age > effectiveTtl) {
            return CacheLookup.expired(content, entry.etag(), entry.lastModified());
        }
        if (content == null) {
            return CacheLookup.miss();
        }
        return CacheLookup.fresh(content, entry.etag(), entry.lastModified());
    }

    @Override
    public void store(String url, String content, String etag, String lastModified) {
        String hash = hashUrl(url);
        Entry entry = new Entry(url, clock.millis(), ttl.toMillis(), etag, lastModified);
        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(hash + ".content"), content, StandardCharsets.UTF_8);
            JSON_WRITER.writeValue(directory.resolve(hash + ".meta.json").toFile(), entry);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write cache entry for " + url, ex);
        }
    }

    static String hashUrl(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(url.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    private static String readContent(Path contentPath) {
        if (!Files.isRegularFile(contentPath)) {
            return null;
        }
        try {
            return Files.readString(contentPath, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            log.debug("Ignoring unreadable cache content {}: {}", contentPath, ex.getMessage());
            return null;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Entry(String url, long fetchedAt, long ttlMs, String etag, String lastModified) {}
}
