package work.mdflow.expand.resolve;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.directive.ImportAction.FileImport;
import work.mdflow.expand.directive.LineRange;
import work.mdflow.expand.runtime.ImportException;
import work.mdflow.expand.runtime.ImportFailure;
import work.mdflow.expand.runtime.ImportStack;
import work.mdflow.expand.runtime.NestedExpander;
import work.mdflow.expand.runtime.ResolutionContext;
import work.mdflow.expand.shared.ByteSizes;

/**
 * Resolves {@code @path}, {@code @path:a-b} and {@code @path#Symbol}. Whole-file imports are
 * expanded recursively with the file's canonical path pushed on the stack.
 */
public final class FileImportResolver {
    private static final Logger log = LoggerFactory.getLogger(FileImportResolver.class);

    private final ExpansionLimits limits;

    public FileImportResolver(ExpansionLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public String resolve(
        FileImport action,
        Path currentDirectory,
        ImportStack stack,
        ResolutionContext context,
        NestedExpander nested
    ) {
        Path resolved = resolvePath(action.path(), currentDirectory);
        if (!Files.exists(resolved)) {
            throw new ImportException(
                ImportFailure.IMPORT_NOT_FOUND,
                "Import not found: " + action.path() + " (resolved to " + resolved + ")",
                ImportException.details("path", action.path(), "resolvedPath", resolved.toString())
            );
        }
        if (!Files.isRegularFile(resolved)) {
            throw new ImportException(
                ImportFailure.IMPORT_NOT_FOUND,
                "Import is not a file: " + action.path() + " (resolved to " + resolved + ")",
                ImportException.details(
                    "path", action.path(),
                    "resolvedPath", resolved.toString(),
                    "directory", Files.isDirectory(resolved)
                )
            );
        }

        if (action.symbol().isPresent() || action.lineRange().isPresent()) {
            String content = readChecked(action.path(), resolved);
            context.recordResolved(action.reference());
            if (action.symbol().isPresent()) {
                log.debug("Extracting symbol \"{}\" from: {}", action.symbol().get(), action.path());
                return SourceExtracts.extractSymbol(content, action.symbol().get());
            }
            LineRange range = action.lineRange().get();
            log.debug("Loading lines {} from: {}", range, action.path());
            return SourceExtracts.extractLines(content, range.start(), range.end());
        }

        Path canonical = canonicalize(resolved);
        if (stack.contains(canonical)) {
            String chain = stack.chainTo(canonical);
            throw new ImportException(
                ImportFailure.CIRCULAR_IMPORT,
                "Circular import detected: " + chain,
                ImportException.details("path", action.path(), "cycle", chain)
            );
        }
        String content = readChecked(action.path(), resolved);
        log.info("Loading: {}", action.path());
        context.recordResolved(action.path());

        Path parent = resolved.getParent() == null ? currentDirectory : resolved.getParent();
        return nested.expand(content, parent, stack.push(canonical), context);
    }

    /**
     * Expands a leading {@code ~}; relative paths resolve against {@code currentDirectory}.
     */
    static Path resolvePath(String importPath, Path currentDirectory) {
        Path expanded = expandHome(importPath);
        if (expanded.isAbsolute()) {
            return expanded.normalize();
        }
        return currentDirectory.resolve(expanded).toAbsolutePath().normalize();
    }

    static Path expandHome(String importPath) {
        String home = System.getProperty("user.home");
        if (importPath.equals("~")) {
            return Path.of(home);
        }
        if (importPath.startsWith("~/")) {
            return Path.of(home, importPath.substring(2));
        }
        return Path.of(importPath);
    }

    static Path canonicalize(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            log.debug("Using {} as-is, could not resolve its real path: {}", path, ex.getMessage());
            return path.toAbsolutePath().normalize();
        }
    }

    private String readChecked(String importPath, Path resolved) {
        try {
            long size = Files.size(resolved);
            if (size > limits.maxFileBytes()) {
                throw fileTooLarge(resolved, size, limits.maxFileBytes());
            }
            if (BinaryFiles.isBinary(resolved)) {
                throw new ImportException(
                    ImportFailure.BINARY_IMPORT_REJECTED,
                    "Cannot import binary file: " + importPath + " (resolved to " + resolved + ")",
                    ImportException.details("path", importPath, "resolvedPath", resolved.toString())
                );
            }
            return Files.readString(resolved, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read import " + resolved, ex);
        }
    }

    static ImportException fileTooLarge(Path file, long size, long limit) {
        return new ImportException(
            ImportFailure.FILE_TOO_LARGE,
            "File \"" + file + "\" exceeds " + ByteSizes.format(limit) + " limit (" + ByteSizes.format(size) + "). "
                + "Consider using line ranges (@./file.ts:1-100) or symbol extraction (@./file.ts#FunctionName) "
                + "to import only the relevant portion.",
            ImportException.details("path", file.toString(), "sizeBytes", size, "limitBytes", limit)
        );
    }
}
