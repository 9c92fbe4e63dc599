package work.mdflow.expand.directive;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds directives inside the safe ranges of a document and classifies them.
 *
 * <p>Pure and reentrant: every call builds fresh matchers, no I/O is performed and unrecognised
 * text is simply skipped.</p>
 */
public final class ActionParser {
    // @./rel, @../rel, @~/home, @/abs, up to whitespace
    private static final Pattern FILE_IMPORT = Pattern.compile("@(~?[./][^\\s]+)");
    private static final Pattern URL_IMPORT = Pattern.compile("@(https?://[^\\s]+)");
    // delimiter is the whole opening backtick run; the same run closes the command
    private static final Pattern COMMAND_INLINE = Pattern.compile("!(`+)([\\s\\S]+?)\\1");
    private static final Pattern EXECUTABLE_FENCE = Pattern.compile("(`{3,})(.*?)\\n(#![^\\n]+)\\n([\\s\\S]*?)\\1");
    private static final Pattern LINE_RANGE = Pattern.compile("^(.+):(\\d+)-(\\d+)$");
    private static final Pattern SYMBOL = Pattern.compile("^(.+)#([a-zA-Z_$][a-zA-Z0-9_$]*)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ActionParser() {}

    public static List<ImportAction> parse(String content) {
        return parse(content, DirectiveScanner.scan(content));
    }

    public static List<ImportAction> parse(String content, ScanResult scan) {
        List<ImportAction> actions = new ArrayList<>();
        List<int[]> commandSpans = new ArrayList<>();

        Matcher commands = COMMAND_INLINE.matcher(content);
        while (commands.find()) {
            String command = commands.group(2);
            if (scan.isSafe(commands.start()) && !command.isEmpty()) {
                actions.add(new ImportAction.CommandImport(command, commands.group(), commands.start()));
                commandSpans.add(new int[] {commands.start(), commands.end()});
            }
        }

        // a command may span lines, and text after its first line is not inline code to the scanner
        Matcher files = FILE_IMPORT.matcher(content);
        while (files.find()) {
            if (scan.isSafe(files.start()) && !insideAny(commandSpans, files.start())) {
                actions.add(classifyPath(files.group(1), files.group(), files.start()));
            }
        }

        Matcher urls = URL_IMPORT.matcher(content);
        while (urls.find()) {
            if (scan.isSafe(urls.start()) && !insideAny(commandSpans, urls.start())) {
                actions.add(new ImportAction.UrlImport(urls.group(1), urls.group(), urls.start()));
            }
        }

        Matcher fences = EXECUTABLE_FENCE.matcher(content);
        while (fences.find()) {
            if (!scan.isUnsafeStart(fences.start())) {
                continue;
            }
            String info = fences.group(2).trim();
            String language = info.isEmpty() ? "txt" : WHITESPACE.split(info)[0];
            actions.add(new ImportAction.CodeFenceImport(
                fences.group(3),
                language,
                fences.group(4).trim(),
                fences.group(),
                fences.start()
            ));
        }

        actions.sort(Comparator.comparingInt(ImportAction::sourceIndex));
        return List.copyOf(actions);
    }

    private static boolean insideAny(List<int[]> spans, int index) {
        for (int[] span : spans) {
            if (index >= span[0] && index < span[1]) {
                return true;
            }
        }
        return false;
    }

    public static boolean isGlobPattern(String path) {
        return path.indexOf('*') >= 0 || path.indexOf('?') >= 0 || path.indexOf('[') >= 0;
    }

    static ImportAction classifyPath(String path, String originalText, int index) {
        if (isGlobPattern(path)) {
            return new ImportAction.GlobImport(path, originalText, index);
        }
        Matcher symbol = SYMBOL.matcher(path);
        if (symbol.matches()) {
            return new ImportAction.FileImport(
                symbol.group(1),
                Optional.empty(),
                Optional.of(symbol.group(2)),
                originalText,
                index
            );
        }
        Matcher range = LINE_RANGE.matcher(path);
        if (range.matches()) {
            Optional<LineRange> lines = parseRange(range.group(2), range.group(3));
            if (lines.isPresent()) {
                return new ImportAction.FileImport(range.group(1), lines, Optional.empty(), originalText, index);
            }
        }
        return ImportAction.FileImport.plain(path, originalText, index);
    }

    private static Optional<LineRange> parseRange(String start, String end) {
        try {
            return Optional.of(new LineRange(Integer.parseInt(start), Integer.parseInt(end)));
        } catch (NumberFormatException ex) {
            // digits beyond int range: treat the suffix as part of the file name
            return Optional.empty();
        }
    }
}
