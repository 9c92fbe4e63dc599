package work.mdflow.expand.spi;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Network access used by URL imports.
 */
@FunctionalInterface
public interface HttpFetcher {
    FetchResponse fetch(URI uri, Map<String, String> headers) throws IOException, InterruptedException;
}
