package work.mdflow.expand.spi;

/**
 * Cache of fetched URL bodies. The storage format belongs to the implementation.
 */
public interface RemoteCache {
    CacheLookup lookup(String url);

    void store(String url, String content, String etag, String lastModified);
}
