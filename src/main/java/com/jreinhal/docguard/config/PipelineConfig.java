package com.jreinhal.docguard.config;

import com.jreinhal.docguard.connectors.DocumentResolver;
import com.jreinhal.docguard.connectors.FileSystemDocumentResolver;
import com.jreinhal.docguard.security.InputSanitizer;
import com.jreinhal.docguard.security.KeywordPolicy;
import com.jreinhal.docguard.security.SecretPatternRegistry;
import com.jreinhal.docguard.security.SecretScanner;
import com.jreinhal.docguard.security.SecretScannerSettings;
import com.jreinhal.docguard.service.ContextAssembler;
import com.jreinhal.docguard.service.ContextAssemblerSettings;
import com.jreinhal.docguard.service.ManualReviewQueue;
import com.jreinhal.docguard.service.PreDistributionValidator;
import com.jreinhal.docguard.service.SecurityEventService;
import com.jreinhal.docguard.util.FrontmatterParser;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the pipeline stages from {@code docguard.*} properties.
 *
 * <p>Pattern and keyword tables are built once here and shared by every component.
 * Components receive their tunables as constructor arguments and never read
 * configuration afterwards.</p>
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public SecretPatternRegistry secretPatternRegistry() {
        SecretPatternRegistry registry = SecretPatternRegistry.defaults();
        log.info("Secret pattern registry loaded: {} patterns {}", registry.size(), registry.countBySeverity());
        return registry;
    }

    @Bean
    public KeywordPolicy keywordPolicy() {
        return KeywordPolicy.defaults();
    }

    @Bean
    public SecretScannerSettings secretScannerSettings(
            @Value("${docguard.scanner.entropy-threshold:3.0}") double entropyThreshold,
            @Value("${docguard.scanner.url-lookbehind-chars:100}") int urlLookbehindChars,
            @Value("${docguard.scanner.placeholder-window-chars:100}") int placeholderWindowChars,
            @Value("${docguard.scanner.placeholder-markers:example,placeholder,test,dummy,fake}") List<String> placeholderMarkers,
            @Value("${docguard.scanner.excerpt-chars:50}") int excerptChars) {
        return new SecretScannerSettings(entropyThreshold, urlLookbehindChars, placeholderWindowChars, placeholderMarkers, excerptChars);
    }

    @Bean
    public SecretScanner secretScanner(SecretPatternRegistry registry, SecretScannerSettings settings) {
        return new SecretScanner(registry, settings);
    }

    @Bean
    public InputSanitizer inputSanitizer(
            @Value("${docguard.sanitizer.instruction-density-threshold:0.10}") double densityThreshold,
            @Value("${docguard.sanitizer.instruction-density-min-words:10}") int densityMinWords,
            @Value("${docguard.sanitizer.max-removal-ratio:0.90}") double maxRemovalRatio) {
        return new InputSanitizer(densityThreshold, densityMinWords, maxRemovalRatio);
    }

    @Bean
    public FrontmatterParser frontmatterParser(
            @Value("${docguard.context.require-explicit-sensitivity:false}") boolean requireExplicitSensitivity) {
        if (!requireExplicitSensitivity) {
            log.info("Documents without a sensitivity declaration default to 'internal'");
        }
        return new FrontmatterParser(requireExplicitSensitivity);
    }

    @Bean
    public DocumentResolver documentResolver(@Value("${docguard.documents.base-dirs:docs}") List<String> baseDirs) {
        List<Path> paths = baseDirs.stream().map(String::trim).filter(s -> !s.isEmpty()).map(Path::of).toList();
        return new FileSystemDocumentResolver(paths);
    }

    @Bean(name = {"contextResolverExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor contextResolverExecutor(
            @Value("${docguard.context.executor.core-threads:4}") int coreThreads,
            @Value("${docguard.context.executor.max-threads:8}") int maxThreads,
            @Value("${docguard.context.executor.queue-capacity:100}") int queueCapacity) {
        return this.buildExecutor("context-resolve-", coreThreads, maxThreads, queueCapacity);
    }

    @Bean
    public ContextAssembler contextAssembler(DocumentResolver documentResolver, FrontmatterParser frontmatterParser,
                                             SecurityEventService securityEventService,
                                             @Qualifier("contextResolverExecutor") ThreadPoolExecutor contextResolverExecutor,
                                             @Value("${docguard.context.max-documents:10}") int maxDocuments,
                                             @Value("${docguard.context.resolve-timeout-ms:5000}") long resolveTimeoutMs) {
        return new ContextAssembler(documentResolver, frontmatterParser, securityEventService, contextResolverExecutor,
                new ContextAssemblerSettings(maxDocuments, resolveTimeoutMs));
    }

    @Bean
    public PreDistributionValidator preDistributionValidator(SecretScanner secretScanner, KeywordPolicy keywordPolicy,
                                                             SecurityEventService securityEventService,
                                                             ManualReviewQueue manualReviewQueue) {
        return new PreDistributionValidator(secretScanner, keywordPolicy, securityEventService, manualReviewQueue);
    }

    private ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadFactory threadFactory = new NamedThreadFactory(prefix);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), threadFactory, new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    /**
     * Logs overload and throws {@link RejectedExecutionException}. The context assembler
     * catches it and resolves the document on the calling thread.
     */
    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}', queue full. active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
