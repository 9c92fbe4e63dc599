package work.mdflow.expand.resolve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a fetched body may be imported: markdown, plain text or JSON only.
 */
final class ContentTypes {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Set<String> ALLOWED = Set.of(
        "text/markdown",
        "text/x-markdown",
        "text/plain",
        "application/json",
        "application/x-json",
        "text/json"
    );

    enum Inferred {
        MARKDOWN,
        JSON,
        UNKNOWN
    }

    private ContentTypes() {}

    static boolean isAllowed(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        int semicolon = contentType.indexOf(';');
        String base = (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType).trim().toLowerCase(Locale.ROOT);
        return ALLOWED.contains(base);
    }

    /**
     * Guess used when the header is missing or generic: the body, then the URL extension.
     */
    static Inferred infer(String body, String url) {
        String trimmed = body.trim();
        if ((trimmed.startsWith("{") && trimmed.endsWith("}")) || (trimmed.startsWith("[") && trimmed.endsWith("]"))) {
            if (isValidJson(trimmed)) {
                return Inferred.JSON;
            }
        }
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        if (lowerUrl.endsWith(".md") || lowerUrl.endsWith(".markdown")) {
            return Inferred.MARKDOWN;
        }
        if (lowerUrl.endsWith(".json")) {
            return Inferred.JSON;
        }
        if (trimmed.startsWith("#")
            || trimmed.contains("\n#")
            || trimmed.contains("\n- ")
            || trimmed.contains("\n* ")
            || trimmed.contains("```")) {
            return Inferred.MARKDOWN;
        }
        return Inferred.UNKNOWN;
    }

    private static boolean isValidJson(String text) {
        try {
            JSON.readTree(text);
            return true;
        } catch (JsonProcessingException ex) {
            return false;
        }
    }
}
