package com.jreinhal.docguard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import com.jreinhal.docguard.connectors.DocumentResolver;
import com.jreinhal.docguard.connectors.FileSystemDocumentResolver;
import com.jreinhal.docguard.security.SecretScannerSettings;
import com.jreinhal.docguard.service.ContextAssembler;
import com.jreinhal.docguard.service.ContextAssemblyOptions;
import com.jreinhal.docguard.service.ContextAssemblyResult;
import com.jreinhal.docguard.service.SecurityEventService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelineConfigTest {

    private final PipelineConfig config = new PipelineConfig();
    private ThreadPoolExecutor executor;

    @TempDir
    Path docs;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldCreateResolverExecutorWithConfiguredValues() {
        executor = config.contextResolverExecutor(4, 8, 200);

        assertEquals(4, executor.getCorePoolSize());
        assertEquals(8, executor.getMaximumPoolSize());
        assertTrue(executor.allowsCoreThreadTimeOut());
        assertInstanceOf(PipelineConfig.MonitoredRejectionHandler.class, executor.getRejectedExecutionHandler());
    }

    @Test
    void shouldEnforceMinimumPoolValues() {
        executor = config.contextResolverExecutor(0, -1, 1);

        assertEquals(1, executor.getCorePoolSize());
        assertEquals(1, executor.getMaximumPoolSize());
        assertEquals(10, executor.getQueue().remainingCapacity());
    }

    @Test
    void shouldCountRejections() throws InterruptedException {
        PipelineConfig.MonitoredRejectionHandler handler = new PipelineConfig.MonitoredRejectionHandler("test-pool");
        executor = new ThreadPoolExecutor(1, 1, 30L, TimeUnit.SECONDS, new SynchronousQueue<>(), handler);
        CountDownLatch block = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                block.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> { }));
        assertEquals(1, handler.getRejectionCount());
        block.countDown();
    }

    @Test
    void saturatedPoolFallsBackToCallingThread() throws IOException {
        Files.writeString(docs.resolve("brief.md"), "---\nsensitivity: internal\ncontext_documents: [a.md, b.md]\n---\nBrief", StandardCharsets.UTF_8);
        Files.writeString(docs.resolve("a.md"), "---\nsensitivity: public\n---\nA", StandardCharsets.UTF_8);
        Files.writeString(docs.resolve("b.md"), "---\nsensitivity: internal\n---\nB", StandardCharsets.UTF_8);
        executor = new ThreadPoolExecutor(1, 1, 30L, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new PipelineConfig.MonitoredRejectionHandler("saturated"));
        CountDownLatch block = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                block.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        DocumentResolver resolver = config.documentResolver(List.of(docs.toString()));
        ContextAssembler assembler = config.contextAssembler(resolver, config.frontmatterParser(false),
                mock(SecurityEventService.class), executor, 10, 1000L);

        try {
            ContextAssemblyResult result = assembler.assemble("brief.md", ContextAssemblyOptions.defaults());

            assertEquals(List.of("a.md", "b.md"), result.admittedPaths());
        } finally {
            block.countDown();
        }
    }

    @Test
    void shouldTrimBaseDirectories() {
        DocumentResolver resolver = config.documentResolver(List.of(" " + docs + " ", ""));

        FileSystemDocumentResolver fs = assertInstanceOf(FileSystemDocumentResolver.class, resolver);
        assertEquals(List.of(docs.toAbsolutePath().normalize()), fs.getBaseDirectories());
    }

    @Test
    void scannerSettingsCarryConfiguredMarkers() {
        SecretScannerSettings settings = config.secretScannerSettings(3.5, 100, 100, List.of("sample"), 50);

        assertEquals(3.5, settings.entropyThreshold());
        assertEquals(List.of("sample"), settings.placeholderMarkers());
    }
}
