package com.jreinhal.docguard.service;

import com.jreinhal.docguard.connectors.DocumentResolver;
import com.jreinhal.docguard.connectors.ResolvedDocument;
import com.jreinhal.docguard.model.ParsedDocument;
import com.jreinhal.docguard.model.SensitivityLevel;
import com.jreinhal.docguard.util.FrontmatterParser;
import com.jreinhal.docguard.util.LogSanitizer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stitches a primary document together with the context documents it declares,
 * admitting only context at or below the primary's sensitivity.
 *
 * <p>Context documents are resolved concurrently on the supplied executor, but every
 * decision is made in declared order, so the result never depends on completion order.
 * The visited-path set used for circular-reference detection lives only for the
 * duration of one {@link #assemble} call.</p>
 */
public class ContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);
    static final String REASON_CIRCULAR = "circular reference";
    static final String REASON_NOT_FOUND = "not found";

    private final DocumentResolver documentResolver;
    private final FrontmatterParser frontmatterParser;
    private final SecurityEventService securityEventService;
    private final Executor resolverExecutor;
    private final ContextAssemblerSettings settings;

    public ContextAssembler(DocumentResolver documentResolver, FrontmatterParser frontmatterParser,
                            SecurityEventService securityEventService, Executor resolverExecutor,
                            ContextAssemblerSettings settings) {
        this.documentResolver = documentResolver;
        this.frontmatterParser = frontmatterParser;
        this.securityEventService = securityEventService;
        this.resolverExecutor = resolverExecutor;
        this.settings = settings;
    }

    /**
     * @throws DocumentNotFoundException   when the primary document cannot be resolved or read
     * @throws DocumentValidationException when the primary metadata is invalid and
     *                                     {@code failOnValidationError} is set
     */
    public ContextAssemblyResult assemble(String primaryPath, ContextAssemblyOptions options) {
        ContextAssemblyOptions opts = options == null ? ContextAssemblyOptions.defaults() : options;
        String safePrimary = LogSanitizer.sanitize(primaryPath);
        log.info("Assembling context for {} (requestedBy={})", safePrimary, LogSanitizer.sanitize(opts.requestedBy()));

        List<String> warnings = new ArrayList<>();
        List<ContextAssemblyResult.RejectedContext> rejected = new ArrayList<>();

        ParsedDocument primary = this.loadPrimary(primaryPath);
        if (!primary.isValid()) {
            String error = "Primary document has invalid frontmatter: " + String.join(", ", primary.validationErrors());
            log.error("{} (path={})", error, safePrimary);
            if (opts.failOnValidationError()) {
                throw new DocumentValidationException(primaryPath, error, primary.validationErrors());
            }
            warnings.add(error);
        }

        List<String> declared = primary.metadata().contextDocuments();
        if (declared.isEmpty()) {
            log.info("No context documents declared for {}", safePrimary);
            this.securityEventService.contextAssembled(opts.requestedBy(), primaryPath, 0, 0);
            return new ContextAssemblyResult(primary, List.of(), warnings, rejected);
        }

        int cap = opts.maxContextDocuments() != null ? opts.maxContextDocuments() : this.settings.maxContextDocuments();
        List<String> contextPaths = declared;
        if (declared.size() > cap) {
            String warning = "Context documents limited to " + cap + " (" + declared.size() + " specified)";
            log.warn("{} for {}", warning, safePrimary);
            warnings.add(warning);
            contextPaths = declared.subList(0, cap);
        }

        List<PendingContext> pending = this.resolveAll(primaryPath, contextPaths, opts);
        long deadlineMs = System.currentTimeMillis() + this.settings.resolveTimeoutMs();

        SensitivityLevel primaryLevel = primary.effectiveLevelAsPrimary();
        List<ParsedDocument> admitted = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(primaryPath);

        for (PendingContext entry : pending) {
            String contextPath = entry.path();
            String safeContext = LogSanitizer.sanitize(contextPath);

            if (visited.contains(contextPath) && !opts.allowCircularReferences()) {
                String warning = "Circular reference detected: " + contextPath;
                log.warn("{} (primary={})", LogSanitizer.sanitize(warning), safePrimary);
                warnings.add(warning);
                rejected.add(new ContextAssemblyResult.RejectedContext(contextPath, REASON_CIRCULAR));
                if (entry.future() != null) {
                    entry.future().cancel(true);
                }
                continue;
            }

            Optional<ParsedDocument> loaded = this.await(entry, deadlineMs);
            if (loaded.isEmpty()) {
                String warning = "Context document not found: " + contextPath;
                log.warn("{} (primary={})", LogSanitizer.sanitize(warning), safePrimary);
                warnings.add(warning);
                rejected.add(new ContextAssemblyResult.RejectedContext(contextPath, REASON_NOT_FOUND));
                continue;
            }
            ParsedDocument context = loaded.get();

            if (!context.isValid()) {
                String errors = String.join(", ", context.validationErrors());
                String warning = "Context document has invalid frontmatter: " + contextPath + " - " + errors;
                log.warn("{} (primary={})", LogSanitizer.sanitize(warning), safePrimary);
                warnings.add(warning);
                if (opts.failOnValidationError()) {
                    rejected.add(new ContextAssemblyResult.RejectedContext(contextPath, "Invalid frontmatter: " + errors));
                    continue;
                }
            }

            SensitivityLevel contextLevel = context.effectiveLevelAsContext();
            if (!primaryLevel.canInclude(contextLevel)) {
                String reason = "Sensitivity violation: primary document (" + primaryLevel.label()
                        + ") cannot include context document (" + contextLevel.label() + ")";
                log.error("Context access denied: primary={} primarySensitivity={} context={} contextSensitivity={} requestedBy={}",
                        safePrimary, primaryLevel, safeContext, contextLevel, LogSanitizer.sanitize(opts.requestedBy()));
                this.securityEventService.contextAccessDenied(opts.requestedBy(), primaryPath, primaryLevel, contextPath, contextLevel);
                warnings.add("SECURITY: " + reason + " for " + contextPath);
                rejected.add(new ContextAssemblyResult.RejectedContext(contextPath, reason));
                continue;
            }

            admitted.add(context);
            visited.add(contextPath);
            log.debug("Context document included: primary={} context={} sensitivity={}", safePrimary, safeContext, contextLevel);
        }

        this.securityEventService.contextAssembled(opts.requestedBy(), primaryPath, admitted.size(), rejected.size());
        log.info("Context assembly complete for {}: {} admitted, {} rejected, {} warning(s)",
                safePrimary, admitted.size(), rejected.size(), warnings.size());
        return new ContextAssemblyResult(primary, admitted, warnings, rejected);
    }

    private ParsedDocument loadPrimary(String primaryPath) {
        ResolvedDocument resolved = this.documentResolver.resolve(primaryPath);
        if (!resolved.exists()) {
            String error = "Primary document not found or invalid: " + primaryPath;
            log.error("{} ({})", LogSanitizer.sanitize(error), LogSanitizer.sanitize(resolved.error()));
            throw new DocumentNotFoundException(primaryPath, error, null);
        }
        try {
            return this.parse(primaryPath, this.documentResolver.read(resolved));
        }
        catch (IOException e) {
            String error = "Primary document not found or invalid: " + primaryPath;
            log.error("{} ({})", LogSanitizer.sanitize(error), LogSanitizer.sanitize(e.getMessage()));
            throw new DocumentNotFoundException(primaryPath, error, e);
        }
    }

    private List<PendingContext> resolveAll(String primaryPath, List<String> contextPaths, ContextAssemblyOptions opts) {
        List<PendingContext> pending = new ArrayList<>(contextPaths.size());
        for (String contextPath : contextPaths) {
            if (contextPath.equals(primaryPath) && !opts.allowCircularReferences()) {
                pending.add(new PendingContext(contextPath, null));
                continue;
            }
            CompletableFuture<Optional<ParsedDocument>> future;
            try {
                future = CompletableFuture.supplyAsync(() -> this.loadContext(contextPath), this.resolverExecutor);
            }
            catch (RejectedExecutionException e) {
                log.debug("Resolver pool saturated; resolving {} on the calling thread", LogSanitizer.sanitize(contextPath));
                future = CompletableFuture.completedFuture(this.loadContext(contextPath));
            }
            pending.add(new PendingContext(contextPath, future));
        }
        return pending;
    }

    private Optional<ParsedDocument> await(PendingContext entry, long deadlineMs) {
        String safeContext = LogSanitizer.sanitize(entry.path());
        long remainingMs = deadlineMs - System.currentTimeMillis();
        if (remainingMs <= 0L && !entry.future().isDone()) {
            log.warn("Context resolution budget ({}ms) exhausted before {}", this.settings.resolveTimeoutMs(), safeContext);
            entry.future().cancel(true);
            return Optional.empty();
        }
        try {
            return entry.future().get(Math.max(remainingMs, 0L), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Context resolution interrupted for {}", safeContext);
            entry.future().cancel(true);
            return Optional.empty();
        }
        catch (TimeoutException e) {
            log.warn("Context resolution timed out for {} (remaining {}ms)", safeContext, remainingMs);
            entry.future().cancel(true);
            return Optional.empty();
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Context resolution failed for {}: {}", safeContext, LogSanitizer.sanitize(cause.getMessage()));
            return Optional.empty();
        }
    }

    private Optional<ParsedDocument> loadContext(String contextPath) {
        ResolvedDocument resolved = this.documentResolver.resolve(contextPath);
        if (!resolved.exists()) {
            log.debug("Context document does not resolve: {} ({})", LogSanitizer.sanitize(contextPath), LogSanitizer.sanitize(resolved.error()));
            return Optional.empty();
        }
        try {
            return Optional.of(this.parse(contextPath, this.documentResolver.read(resolved)));
        }
        catch (IOException e) {
            log.warn("Failed to read context document {}: {}", LogSanitizer.sanitize(contextPath), LogSanitizer.sanitize(e.getMessage()));
            return Optional.empty();
        }
    }

    private ParsedDocument parse(String path, String content) {
        FrontmatterParser.ParsedFrontmatter parsed = this.frontmatterParser.parse(content);
        return new ParsedDocument(path, parsed.metadata(), parsed.body(), content, parsed.errors());
    }

    private record PendingContext(String path, CompletableFuture<Optional<ParsedDocument>> future) {
    }
}
