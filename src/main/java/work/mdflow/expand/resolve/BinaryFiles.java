package work.mdflow.expand.resolve;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Binary detection for imported files: a known extension, the {@code .DS_Store} basename, or a
 * NUL byte in the first 8 KiB.
 */
final class BinaryFiles {
    static final int CHECK_SIZE = 8192;

    private static final Set<String> EXTENSIONS = Set.of(
        ".png", ".jpg", ".jpeg", ".gif", ".ico", ".webp", ".bmp", ".svg", ".tiff", ".tif",
        ".exe", ".dll", ".so", ".dylib", ".bin",
        ".zip", ".tar", ".gz", ".7z", ".rar", ".bz2", ".xz",
        ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx",
        ".sqlite", ".db", ".sqlite3",
        ".dat", ".data",
        ".ds_store",
        ".wasm", ".pyc", ".class", ".o", ".a", ".lib"
    );

    private BinaryFiles() {}

    static boolean hasBinaryName(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        if (name.equals(".DS_Store")) {
            return true;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    static boolean isBinary(Path path) throws IOException {
        if (hasBinaryName(path)) {
            return true;
        }
        byte[] head;
        try (InputStream in = Files.newInputStream(path)) {
            head = in.readNBytes(CHECK_SIZE);
        }
        return containsNul(head, head.length);
    }

    static boolean containsNul(byte[] bytes, int limit) {
        int end = Math.min(bytes.length, limit);
        for (int i = 0; i < end; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }
}
