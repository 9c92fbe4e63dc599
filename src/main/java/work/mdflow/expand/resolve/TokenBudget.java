package work.mdflow.expand.resolve;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Token counting for glob imports. The estimate is four characters per token; the exact
 * {@code cl100k_base} count is only computed near the context window.
 */
final class TokenBudget {
    static final double PRECISE_THRESHOLD = 0.7;
    static final double WARN_THRESHOLD = 0.5;

    private TokenBudget() {}

    static int estimate(String text) {
        return (int) Math.ceil(text.length() / 4.0);
    }

    static boolean needsPreciseCount(int estimate, int contextWindow) {
        return estimate > contextWindow * PRECISE_THRESHOLD;
    }

    static int count(String text) {
        return Tokenizer.ENCODING.countTokens(text);
    }

    static int warnThreshold(int contextWindow) {
        return (int) Math.floor(contextWindow * WARN_THRESHOLD);
    }

    private static final class Tokenizer {
        static final Encoding ENCODING = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
    }
}
