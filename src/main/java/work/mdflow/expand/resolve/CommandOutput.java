package work.mdflow.expand.resolve;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text post-processing shared by command inlines and executable code fences.
 */
public final class CommandOutput {
    public static final String RAW_OPEN = "{% raw %}";
    public static final String RAW_CLOSE = "{% endraw %}";

    static final int BINARY_CHECK_SIZE = 1024;

    private static final Pattern ANSI = Pattern.compile(
        "[\\u001b\\u009b][\\[()#;?]*(?:[0-9]{1,4}(?:;[0-9]{0,4})*)?[0-9A-ORZcf-nqry=><]"
    );
    private static final Pattern RAW_END = Pattern.compile("\\{%-?\\s*endraw\\s*-?%}");
    private static final Pattern MARKDOWN_COMMAND = Pattern.compile("^(~?\\.?\\.?/)?[^\\s]+\\.md(\\s|$)");

    private CommandOutput() {}

    public static String stripAnsi(String text) {
        return ANSI.matcher(text).replaceAll("");
    }

    /**
     * True when the command starts with a markdown file path, e.g. {@code ./review.md --fast}.
     */
    public static boolean isMarkdownFileCommand(String command) {
        return MARKDOWN_COMMAND.matcher(command.trim()).find();
    }

    public static String truncate(String output, int maxChars) {
        if (output.length() <= maxChars) {
            return output;
        }
        int removed = output.length() - maxChars;
        return output.substring(0, maxChars)
            + "\n... [Output truncated: " + String.format(Locale.ROOT, "%,d", removed) + " characters removed]";
    }

    /**
     * Wraps program output so a later template pass renders it verbatim.
     *
     * <p>An {@code endraw} tag inside the output would end the block early, so its leading
     * {@code {%} is moved out of the block as a string literal, e.g.
     * <code>{% endraw %}{{ "{%" }}{% raw %} endraw %}</code>.</p>
     */
    public static String wrapRaw(String output) {
        String escaped = RAW_END.matcher(output).replaceAll(match -> Matcher.quoteReplacement(
            RAW_CLOSE + "{{ \"{%\" }}" + RAW_OPEN + match.group().substring(2)
        ));
        return RAW_OPEN + "\n" + escaped + "\n" + RAW_CLOSE;
    }

    static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * stderr first, then stdout; whichever is present when only one is.
     */
    static String combine(String stderr, String stdout) {
        if (!stderr.isEmpty() && !stdout.isEmpty()) {
            return stderr + "\n" + stdout;
        }
        return stdout.isEmpty() ? stderr : stdout;
    }
}
