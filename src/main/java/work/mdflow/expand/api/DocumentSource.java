package work.mdflow.expand.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * The document to expand: a file on disk, or text (stdin) with an explicit base directory for
 * relative imports.
 */
public record DocumentSource(Optional<Path> file, Optional<String> text, Path baseDirectory) {
    public DocumentSource {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        if (file.isEmpty() == text.isEmpty()) {
            throw new IllegalArgumentException("Exactly one of file or text must be present.");
        }
    }

    public static DocumentSource forFile(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path parent = absolute.getParent() == null ? absolute : absolute.getParent();
        return new DocumentSource(Optional.of(absolute), Optional.empty(), parent);
    }

    public static DocumentSource forText(String text, Path baseDirectory) {
        return new DocumentSource(Optional.empty(), Optional.of(text), baseDirectory.toAbsolutePath().normalize());
    }

    public String read() throws IOException {
        if (text.isPresent()) {
            return text.get();
        }
        return Files.readString(file.get(), StandardCharsets.UTF_8);
    }

    public String display() {
        return file.map(Path::toString).orElse("<stdin>");
    }
}
