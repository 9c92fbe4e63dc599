package work.mdflow.expand.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.directive.ActionParser;
import work.mdflow.expand.directive.ImportAction;
import work.mdflow.expand.resolve.ImportResolver;

/**
 * Expands import directives in a document: parse, resolve every action of one level
 * concurrently, then splice the results back at their recorded offsets.
 *
 * <p>Three entry points support running a template stage in between:
 * {@link #expandContent} resolves files, globs and URLs only, and {@link #expandCommands} runs
 * commands and executable code fences only. {@link #expand} does both at once.</p>
 *
 * <p>At each level at most {@link ExpansionLimits#concurrency()} actions resolve at the same
 * time. The caller thread takes a permit before handing an action to the pool, so a level never
 * occupies more workers than that. The first failure stops further submissions, cancels the
 * remaining siblings and is rethrown.</p>
 */
public final class ImportExpander implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ImportExpander.class);

    private static final Predicate<ImportAction> ALL = action -> true;
    private static final Predicate<ImportAction> CONTENT = action -> !action.isCommand();
    private static final Predicate<ImportAction> COMMANDS = ImportAction::isCommand;

    private final ExpansionLimits limits;
    private final ImportResolver resolver;
    private final ExecutorService pool;
    private final NestedExpander nested = this::expandNested;

    public ImportExpander(ExpansionLimits limits) {
        this(limits, ImportResolver.standard(limits));
    }

    public ImportExpander(ExpansionLimits limits, ImportResolver resolver) {
        this(limits, resolver, ExpanderThreads.newPool("mdflow-import"));
    }

    ImportExpander(ExpansionLimits limits, ImportResolver resolver, ExecutorService pool) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    public ExpansionLimits limits() {
        return limits;
    }

    public String expand(String content, Path currentDirectory, ResolutionContext context) {
        return expand(content, currentDirectory, ImportStack.empty(), context);
    }

    public String expand(String content, Path currentDirectory, ImportStack stack, ResolutionContext context) {
        return run(content, currentDirectory, stack, context, ALL);
    }

    public String expandContent(String content, Path currentDirectory, ResolutionContext context) {
        return expandContent(content, currentDirectory, ImportStack.empty(), context);
    }

    /**
     * Resolves file, glob and URL imports, recursively in content-only mode, and leaves command
     * and code fence directives in place.
     */
    public String expandContent(String content, Path currentDirectory, ImportStack stack, ResolutionContext context) {
        return run(content, currentDirectory, stack, context.asContentOnly(), CONTENT);
    }

    /**
     * Runs command inlines and executable code fences only, using the context's variables.
     */
    public String expandCommands(String content, Path currentDirectory, ResolutionContext context) {
        return run(content, currentDirectory, ImportStack.empty(), context, COMMANDS);
    }

    public static boolean hasImports(String content) {
        return !ActionParser.parse(content).isEmpty();
    }

    public static boolean hasContentImports(String content) {
        return ActionParser.parse(content).stream().anyMatch(CONTENT);
    }

    public static boolean hasCommandImports(String content) {
        return ActionParser.parse(content).stream().anyMatch(COMMANDS);
    }

    private String expandNested(String content, Path currentDirectory, ImportStack stack, ResolutionContext context) {
        if (context.contentOnly()) {
            return expandContent(content, currentDirectory, stack, context);
        }
        return expand(content, currentDirectory, stack, context);
    }

    private String run(
        String content,
        Path currentDirectory,
        ImportStack stack,
        ResolutionContext context,
        Predicate<ImportAction> filter
    ) {
        List<ImportAction> actions = new ArrayList<>();
        for (ImportAction action : ActionParser.parse(content)) {
            if (filter.test(action)) {
                actions.add(action);
            }
        }
        if (actions.isEmpty()) {
            return content;
        }
        log.debug("Resolving {} import(s) in {} (depth {})", actions.size(), currentDirectory, stack.depth());
        return Injector.inject(content, resolveAll(actions, currentDirectory, stack, context));
    }

    private List<ResolvedImport> resolveAll(
        List<ImportAction> actions,
        Path currentDirectory,
        ImportStack stack,
        ResolutionContext context
    ) {
        Semaphore permits = new Semaphore(limits.concurrency());
        AtomicBoolean failed = new AtomicBoolean();
        CompletionService<ResolvedImport> completion = new ExecutorCompletionService<>(pool);
        List<Future<ResolvedImport>> futures = new ArrayList<>(actions.size());
        List<ResolvedImport> resolved = new ArrayList<>(actions.size());
        try {
            for (ImportAction action : actions) {
                permits.acquire();
                if (failed.get()) {
                    permits.release();
                    break;
                }
                futures.add(submit(completion, permits, failed, action, currentDirectory, stack, context));
            }
            for (int i = 0; i < futures.size(); i++) {
                resolved.add(completion.take().get());
            }
            return resolved;
        } catch (ExecutionException ex) {
            cancelAll(futures);
            throw rethrow(ex.getCause());
        } catch (InterruptedException ex) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while resolving imports in " + currentDirectory, ex);
        } catch (CancellationException ex) {
            cancelAll(futures);
            throw new IllegalStateException("Import resolution was cancelled in " + currentDirectory, ex);
        }
    }

    private Future<ResolvedImport> submit(
        CompletionService<ResolvedImport> completion,
        Semaphore permits,
        AtomicBoolean failed,
        ImportAction action,
        Path currentDirectory,
        ImportStack stack,
        ResolutionContext context
    ) {
        try {
            return completion.submit(() -> {
                try {
                    return new ResolvedImport(action, resolver.resolve(action, currentDirectory, stack, context, nested));
                } catch (RuntimeException | Error ex) {
                    failed.set(true);
                    throw ex;
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException ex) {
            permits.release();
            throw new IllegalStateException("Import expander is closed", ex);
        }
    }

    private static void cancelAll(List<Future<ResolvedImport>> futures) {
        for (Future<ResolvedImport> future : futures) {
            future.cancel(true);
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Import resolution failed: " + cause.getMessage(), cause);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
