package work.mdflow.expand.support;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.runtime.ResolutionContext;

/**
 * Shared fixtures for expansion tests.
 */
public final class ExpansionTestSupport {
    private ExpansionTestSupport() {}

    public static Path write(Path root, String relative, String content) throws IOException {
        var target = root.resolve(relative);
        var parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return target;
    }

    public static ExpansionLimits limits() {
        return ExpansionLimits.builder()
            .commandTimeout(Duration.ofSeconds(10))
            .build();
    }

    public static ResolutionContext trackingContext() {
        return ResolutionContext.builder().trackResolvedImports(true).build();
    }

    public static ResolutionContext trackingContext(Path invocationDirectory) {
        return ResolutionContext.builder()
            .trackResolvedImports(true)
            .invocationDirectory(invocationDirectory)
            .build();
    }
}
