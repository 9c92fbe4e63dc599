package work.mdflow.expand.spi;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal Liquid-compatible substitution: {@code {{ name }}} renders the variable (unknown names
 * render empty, filters after {@code |} are ignored), a quoted string literal such as
 * {@code {{ "text" }}} renders its text, and {@code {% raw %}...{% endraw %}} renders its body
 * verbatim.
 */
public final class LiquidVariableSubstitution implements TemplateSubstitution {
    private static final Pattern TOKEN = Pattern.compile(
        "\\{%-?\\s*raw\\s*-?%}([\\s\\S]*?)\\{%-?\\s*endraw\\s*-?%}"
            + "|\\{\\{-?\\s*(?:([A-Za-z_][\\w.-]*)|\"([^\"]*)\"|'([^']*)')\\s*(?:\\|[^}]*)?-?}}"
    );

    @Override
    public String substitute(String text, Map<String, String> variables) {
        Matcher matcher = TOKEN.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String replacement;
            if (matcher.group(1) != null) {
                replacement = matcher.group(1);
            } else if (matcher.group(3) != null) {
                replacement = matcher.group(3);
            } else if (matcher.group(4) != null) {
                replacement = matcher.group(4);
            } else {
                String value = variables.get(matcher.group(2));
                replacement = value == null ? "" : value;
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
