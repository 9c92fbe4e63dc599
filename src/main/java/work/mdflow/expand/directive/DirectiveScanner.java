package work.mdflow.expand.directive;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Single forward pass over a document that separates prose from code.
 *
 * <p>Fences open on a run of three or more backticks or tildes and close on a run of the same
 * character, at least as long, at the start of a line. Inline code opens on a single backtick and
 * ends at the next backtick or at the end of the line. An unterminated fence keeps the rest of the
 * document unsafe. The scanner is stateless and never throws.</p>
 */
public final class DirectiveScanner {
    private DirectiveScanner() {}

    public static ScanResult scan(String content) {
        List<SafeRange> ranges = safeRanges(content);
        return new ScanResult(ranges, unsafeStarts(content, ranges));
    }

    public static List<SafeRange> safeRanges(String content) {
        List<SafeRange> ranges = new ArrayList<>();
        ScanContext context = ScanContext.NORMAL;
        int rangeStart = 0;
        int i = 0;
        char fenceChar = 0;
        int fenceLen = 0;
        int length = content.length();

        while (i < length) {
            char c = content.charAt(i);
            if (context == ScanContext.NORMAL) {
                if (c == '`' || c == '~') {
                    int run = runLength(content, i, c);
                    if (run >= 3) {
                        if (i > rangeStart) {
                            ranges.add(new SafeRange(rangeStart, i));
                        }
                        context = ScanContext.FENCED_CODE;
                        fenceChar = c;
                        fenceLen = run;
                        i += run;
                        // info string
                        while (i < length && content.charAt(i) != '\n') {
                            i++;
                        }
                        continue;
                    }
                }
                if (c == '`' && (i + 1 >= length || content.charAt(i + 1) != '`')) {
                    if (i > rangeStart) {
                        ranges.add(new SafeRange(rangeStart, i));
                    }
                    context = ScanContext.INLINE_CODE;
                    i++;
                    continue;
                }
                i++;
            } else if (context == ScanContext.FENCED_CODE) {
                boolean atLineStart = i == 0 || content.charAt(i - 1) == '\n';
                if (atLineStart && c == fenceChar) {
                    int run = runLength(content, i, fenceChar);
                    if (run >= fenceLen) {
                        i += run;
                        while (i < length && content.charAt(i) != '\n') {
                            i++;
                        }
                        if (i < length) {
                            i++;
                        }
                        context = ScanContext.NORMAL;
                        rangeStart = i;
                        continue;
                    }
                }
                i++;
            } else {
                if (c == '`') {
                    i++;
                    context = ScanContext.NORMAL;
                    rangeStart = i;
                    continue;
                }
                if (c == '\n') {
                    context = ScanContext.NORMAL;
                    rangeStart = i;
                }
                i++;
            }
        }

        if (context == ScanContext.NORMAL && rangeStart < length) {
            ranges.add(new SafeRange(rangeStart, length));
        }
        return ranges;
    }

    /**
     * Offsets where an unsafe gap between safe ranges begins. Executable fences are only honoured
     * when they start exactly at one of these offsets.
     */
    static Set<Integer> unsafeStarts(String content, List<SafeRange> ranges) {
        Set<Integer> starts = new HashSet<>();
        if (!ranges.isEmpty()) {
            if (ranges.get(0).start() > 0) {
                starts.add(0);
            }
            for (SafeRange range : ranges) {
                if (range.end() < content.length()) {
                    starts.add(range.end());
                }
            }
        } else if (!content.isEmpty()) {
            starts.add(0);
        }
        return starts;
    }

    private static int runLength(String content, int from, char c) {
        int j = from;
        while (j < content.length() && content.charAt(j) == c) {
            j++;
        }
        return j - from;
    }
}
