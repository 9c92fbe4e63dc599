package work.mdflow.expand.directive;

import java.util.Objects;
import java.util.Optional;

/**
 * A directive found in a document, tagged with the exact text it was matched from and the offset
 * of that text. Those two fields are all the {@code Injector} needs to splice results back in.
 */
public sealed interface ImportAction
    permits ImportAction.FileImport,
        ImportAction.GlobImport,
        ImportAction.UrlImport,
        ImportAction.CommandImport,
        ImportAction.CodeFenceImport {

    String originalText();

    int sourceIndex();

    /**
     * Commands and executable fences run after template substitution; every other action is content.
     */
    boolean isCommand();

    /**
     * {@code @path}, {@code @path:start-end} or {@code @path#Symbol}. At most one of
     * {@code lineRange} and {@code symbol} is present.
     */
    record FileImport(
        String path,
        Optional<LineRange> lineRange,
        Optional<String> symbol,
        String originalText,
        int sourceIndex
    ) implements ImportAction {
        public FileImport {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(lineRange, "lineRange");
            Objects.requireNonNull(symbol, "symbol");
            Objects.requireNonNull(originalText, "originalText");
            if (lineRange.isPresent() && symbol.isPresent()) {
                throw new IllegalArgumentException("A file import cannot carry both a line range and a symbol");
            }
        }

        public static FileImport plain(String path, String originalText, int sourceIndex) {
            return new FileImport(path, Optional.empty(), Optional.empty(), originalText, sourceIndex);
        }

        /**
         * Path as written, with its line-range or symbol suffix.
         */
        public String reference() {
            if (lineRange.isPresent()) {
                return path + ":" + lineRange.get();
            }
            return symbol.map(name -> path + "#" + name).orElse(path);
        }

        @Override
        public boolean isCommand() {
            return false;
        }
    }

    record GlobImport(String pattern, String originalText, int sourceIndex) implements ImportAction {
        public GlobImport {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(originalText, "originalText");
        }

        @Override
        public boolean isCommand() {
            return false;
        }
    }

    record UrlImport(String url, String originalText, int sourceIndex) implements ImportAction {
        public UrlImport {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(originalText, "originalText");
        }

        @Override
        public boolean isCommand() {
            return false;
        }
    }

    record CommandImport(String command, String originalText, int sourceIndex) implements ImportAction {
        public CommandImport {
            Objects.requireNonNull(command, "command");
            Objects.requireNonNull(originalText, "originalText");
        }

        @Override
        public boolean isCommand() {
            return true;
        }
    }

    /**
     * Fenced block whose first interior line is a shebang. {@code code} excludes the shebang line.
     */
    record CodeFenceImport(
        String shebang,
        String language,
        String code,
        String originalText,
        int sourceIndex
    ) implements ImportAction {
        public CodeFenceImport {
            Objects.requireNonNull(shebang, "shebang");
            Objects.requireNonNull(language, "language");
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(originalText, "originalText");
        }

        @Override
        public boolean isCommand() {
            return true;
        }
    }
}
