package work.mdflow.expand.spi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileRemoteCacheTest {
    private static final String URL = "https://example.com/a.md";
    private static final Clock START = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    void missWhenNothingStored() {
        var lookup = new FileRemoteCache(dir).lookup(URL);

        assertFalse(lookup.hit());
        assertFalse(lookup.expired());
        assertTrue(lookup.content().isEmpty());
    }

    @Test
    void freshEntryWithinTtl() {
        new FileRemoteCache(dir, Duration.ofMinutes(10), START).store(URL, "body", "\"e1\"", "Wed, 01 May 2024 11:00:00 GMT");
        var later = new FileRemoteCache(dir, Duration.ofMinutes(10), Clock.offset(START, Duration.ofMinutes(9)));

        var lookup = later.lookup(URL);

        assertTrue(lookup.hit());
        assertEquals(Optional.of("body"), lookup.content());
        assertEquals(Optional.of("\"e1\""), lookup.etag());
        assertEquals(Optional.of("Wed, 01 May 2024 11:00:00 GMT"), lookup.lastModified());
    }

    @Test
    void expiredEntryKeepsContentForRevalidation() {
        new FileRemoteCache(dir, Duration.ofMinutes(10), START).store(URL, "body", null, "yesterday");
        var later = new FileRemoteCache(dir, Duration.ofMinutes(10), Clock.offset(START, Duration.ofMinutes(11)));

        var lookup = later.lookup(URL);

        assertFalse(lookup.hit());
        assertTrue(lookup.expired());
        assertTrue(lookup.canRevalidate());
        assertEquals(Optional.of("body"), lookup.content());
    }

    @Test
    void expiredEntryWithoutValidatorsCannotRevalidate() {
        new FileRemoteCache(dir, Duration.ofMinutes(1), START).store(URL, "body", null, null);
        var later = new FileRemoteCache(dir, Duration.ofMinutes(1), Clock.offset(START, Duration.ofHours(2)));

        assertFalse(later.lookup(URL).canRevalidate());
    }

    @Test
    void storesHashedFiles() throws Exception {
        var cache = new FileRemoteCache(dir.resolve("nested/cache"));
        cache.store(URL, "body", null, null);
        var hash = FileRemoteCache.hashUrl(URL);

        assertEquals(64, hash.length());
        assertEquals("body", Files.readString(cache.directory().resolve(hash + ".content")));
        var meta = Files.readString(cache.directory().resolve(hash + ".meta.json"));
        assertTrue(meta.contains("\"url\" : \"" + URL + "\""));
        assertFalse(meta.contains("etag"));
    }

    @Test
    void missingContentFileIsAMiss() throws Exception {
        var cache = new FileRemoteCache(dir);
        cache.store(URL, "body", null, null);
        Files.delete(dir.resolve(FileRemoteCache.hashUrl(URL) + ".content"));

        assertFalse(cache.lookup(URL).hit());
    }

    @Test
    void corruptMetadataIsAMiss() throws Exception {
        var cache = new FileRemoteCache(dir);
        cache.store(URL, "body", null, null);
        Files.writeString(dir.resolve(FileRemoteCache.hashUrl(URL) + ".meta.json"), "{not json");

        assertFalse(cache.lookup(URL).hit());
    }
}
