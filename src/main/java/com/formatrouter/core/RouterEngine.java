package com.formatrouter.core;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.formatrouter.api.DecisionGraph;
import com.formatrouter.api.FormatRouter;
import com.formatrouter.api.error.FormatterError;
import com.formatrouter.api.error.Severity;
import com.formatrouter.api.error.UnexpectedTreeException;
import com.formatrouter.config.FormatStyle;
import com.formatrouter.config.FormatterConfig;
import com.formatrouter.model.FormatToken;
import com.formatrouter.model.FormatTokens;
import com.formatrouter.model.Token;
import com.formatrouter.router.DecisionCache;
import com.formatrouter.router.FormatOps;
import com.formatrouter.router.Router;
import com.formatrouter.split.Split;
import com.formatrouter.util.LoggerUtil;

/**
 * Thread-safe entry point that routes whole files.
 * Every file gets its own router and decision cache, so files routed in
 * parallel share nothing but the immutable style.
 */
public class RouterEngine implements FormatRouter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(RouterEngine.class);

    private final FormatStyle style;
    private final int threadCount;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);
    private final AtomicInteger unmatchedPairCount = new AtomicInteger(0);

    public RouterEngine(FormatStyle style) {
        this(style, Runtime.getRuntime().availableProcessors());
    }

    public RouterEngine(FormatStyle style, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threadCount);
        }
        this.style = style;
        this.threadCount = threadCount;
        logger.info("Router engine initialized with editions " + style.getEditionGates());
    }

    public RouterEngine(FormatterConfig config) {
        this(FormatStyle.fromConfig(config));
    }

    public FormatStyle getStyle() {
        return style;
    }

    /**
     * Routes every token pair of one file.
     */
    @Override
    public DecisionGraph routeFile(Path filePath, FormatTokens tokens) {
        processedFileCount.incrementAndGet();
        DecisionGraph.Builder builder = DecisionGraph.builder().formatTokens(tokens);
        try {
            Router router = new Router(new FormatOps(tokens, style));
            DecisionCache cache = new DecisionCache(router);
            for (FormatToken ft : tokens.getPairs()) {
                List<Split> splits = cache.getOrCompute(ft);
                builder.addSplits(splits);
                if (splits.isEmpty()) {
                    unmatchedPairCount.incrementAndGet();
                    Token right = ft.getRight();
                    builder.addError(FormatterError.at(
                            Severity.WARNING,
                            "No rule matches " + ft.getLeft().getKind() + " followed by " + right.getKind()
                                    + "; the code around it is left as is",
                            right, null));
                }
            }
            successCount.incrementAndGet();
            logger.fine("Routed " + tokens.size() + " pairs of " + filePath
                    + " (" + router.getUnmatchedPairs().size() + " unmatched)");
            return builder.successful(true).build();
        } catch (UnexpectedTreeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected syntax tree in " + filePath, e);
            return failed(tokens, FormatterError.at(
                    Severity.FATAL,
                    e.getMessage(),
                    e.getFormatToken().getRight(),
                    "Check that the parser attached the token to the right node"));
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error routing " + filePath, e);
            return failed(tokens, new FormatterError(Severity.FATAL, "Unexpected error: " + e.getMessage(), 1, 1));
        }
    }

    private static DecisionGraph failed(FormatTokens tokens, FormatterError error) {
        return DecisionGraph.builder()
                .successful(false)
                .formatTokens(tokens)
                .addError(error)
                .build();
    }

    /**
     * Routes several files on a fixed thread pool. A file whose tree is
     * inconsistent fails alone; the others are unaffected.
     */
    @Override
    public Map<Path, DecisionGraph> routeFiles(Map<Path, FormatTokens> files) {
        ConcurrentHashMap<Path, DecisionGraph> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return results;
        }
        logger.info("Routing " + files.size() + " files on " + threadCount + " threads");

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadCount, files.size()));
        try {
            for (Map.Entry<Path, FormatTokens> entry : files.entrySet()) {
                executor.submit(() -> results.put(entry.getKey(), routeFile(entry.getKey(), entry.getValue())));
            }
        } finally {
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for routing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Routing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.info("Routed " + results.size() + " files");
        // keep the caller's iteration order
        Map<Path, DecisionGraph> ordered = new LinkedHashMap<>();
        for (Path path : files.keySet()) {
            DecisionGraph graph = results.get(path);
            if (graph != null) {
                ordered.put(path, graph);
            }
        }
        return ordered;
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    /**
     * Pairs left without candidates, over all files routed so far.
     */
    public int getUnmatchedPairCount() {
        return unmatchedPairCount.get();
    }

    @Override
    public void close() {
        logger.info("Closing router engine: processed=" + processedFileCount.get()
                + ", success=" + successCount.get() + ", errors=" + errorCount.get()
                + ", unmatched pairs=" + unmatchedPairCount.get());
    }
}
