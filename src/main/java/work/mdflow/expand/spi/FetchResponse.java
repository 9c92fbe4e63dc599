package work.mdflow.expand.spi;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Status, headers and body of one HTTP exchange. Header lookup is case-insensitive.
 */
public record FetchResponse(int status, Map<String, List<String>> headers, String body) {
    public FetchResponse {
        Map<String, List<String>> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> normalized.put(name, values == null ? List.of() : List.copyOf(values)));
        }
        headers = normalized;
        body = body == null ? "" : body;
    }

    public static FetchResponse of(int status, String contentType, String body) {
        return new FetchResponse(
            status,
            contentType == null ? Map.of() : Map.of("Content-Type", List.of(contentType)),
            body
        );
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isNotModified() {
        return status == 304;
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }
}
