package work.mdflow.expand.resolve;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import work.mdflow.expand.runtime.ImportException;
import work.mdflow.expand.runtime.ImportFailure;

/**
 * Partial file imports: inclusive 1-based line ranges and named declarations.
 */
public final class SourceExtracts {
    private SourceExtracts() {}

    /**
     * Lines {@code start..end}, clamped to the file rather than rejected when out of bounds.
     */
    public static String extractLines(String content, int start, int end) {
        String[] lines = content.split("\n", -1);
        int from = Math.max(0, start - 1);
        int to = Math.min(lines.length, end);
        if (from >= to) {
            return "";
        }
        return String.join("\n", Arrays.copyOfRange(lines, from, to));
    }

    /**
     * Text of the first {@code interface|type|function|class|const|let|var|enum} declaration of
     * {@code symbol}, up to the line where braces and parentheses balance outside string literals.
     *
     * @throws ImportException with {@link ImportFailure#SYMBOL_NOT_FOUND} when no declaration matches
     */
    public static String extractSymbol(String content, String symbol) {
        String[] lines = content.split("\n", -1);
        List<Pattern> declarations = declarationPatterns(symbol);

        int startLine = -1;
        int braceDepth = 0;
        int parenDepth = 0;
        boolean inString = false;
        char stringChar = 0;

        for (int i = 0; i < lines.length; i++) {
            String current = lines[i];
            if (current.isEmpty()) {
                continue;
            }
            if (startLine == -1) {
                String trimmed = current.trim();
                for (Pattern declaration : declarations) {
                    if (declaration.matcher(trimmed).find()) {
                        startLine = i;
                        break;
                    }
                }
                if (startLine == -1) {
                    continue;
                }
            }

            for (int j = 0; j < current.length(); j++) {
                char c = current.charAt(j);
                char prev = j > 0 ? current.charAt(j - 1) : 0;
                if (!inString && (c == '"' || c == '\'' || c == '`')) {
                    inString = true;
                    stringChar = c;
                } else if (inString && c == stringChar && prev != '\\') {
                    inString = false;
                }
                if (!inString) {
                    switch (c) {
                        case '{' -> braceDepth++;
                        case '}' -> braceDepth--;
                        case '(' -> parenDepth++;
                        case ')' -> parenDepth--;
                        default -> {
                        }
                    }
                }
            }

            if (braceDepth == 0 && parenDepth == 0 && closesDeclaration(lines, i)) {
                return String.join("\n", Arrays.copyOfRange(lines, startLine, i + 1));
            }
        }

        if (startLine != -1) {
            return String.join("\n", Arrays.copyOfRange(lines, startLine, lines.length));
        }
        throw new ImportException(
            ImportFailure.SYMBOL_NOT_FOUND,
            "Symbol \"" + symbol + "\" not found in file",
            ImportException.details("symbol", symbol)
        );
    }

    private static boolean closesDeclaration(String[] lines, int index) {
        String trimmed = lines[index].trim();
        if (trimmed.endsWith(";") || trimmed.endsWith("}")) {
            return true;
        }
        // A following line starting with "." continues a chained expression.
        return index + 1 < lines.length
            && !lines[index + 1].isEmpty()
            && !lines[index + 1].trim().startsWith(".");
    }

    private static List<Pattern> declarationPatterns(String symbol) {
        String name = Pattern.quote(symbol);
        return List.of(
            Pattern.compile("^(export\\s+)?interface\\s+" + name + "\\s*(extends\\s+[^{]+)?\\{"),
            Pattern.compile("^(export\\s+)?type\\s+" + name + "\\s*(<[^>]+>)?\\s*="),
            Pattern.compile("^(export\\s+)?(async\\s+)?function\\s+" + name + "\\s*(<[^>]+>)?\\s*\\("),
            Pattern.compile("^(export\\s+)?(abstract\\s+)?class\\s+" + name
                + "\\s*(extends\\s+[^{]+)?(implements\\s+[^{]+)?\\{"),
            Pattern.compile("^(export\\s+)?(const|let|var)\\s+" + name + "\\s*(:[^=]+)?\\s*="),
            Pattern.compile("^(export\\s+)?enum\\s+" + name + "\\s*\\{")
        );
    }
}
