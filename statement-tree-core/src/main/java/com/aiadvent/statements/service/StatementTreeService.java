package com.aiadvent.statements.service;

import com.aiadvent.statements.ast.CstParser;
import com.aiadvent.statements.ast.TreeSitterLanguage;
import com.aiadvent.statements.config.StatementTreeProperties;
import com.aiadvent.statements.grammar.GrammarRegistry;
import com.aiadvent.statements.grammar.LanguageGrammar;
import com.aiadvent.statements.grammar.UnsupportedLanguageException;
import com.aiadvent.statements.tree.StatementTree;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;

/**
 * Entry point for building statement trees. Checks language support up front, runs builds on a
 * bounded pool and records build metrics.
 */
public class StatementTreeService implements DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(StatementTreeService.class);

  private final CstParser parser;
  private final Set<String> enabledLanguages;
  private final Set<String> trimmedByDefault;
  private final ExecutorService buildExecutor;
  private final MeterRegistry meterRegistry;
  private final Counter opaqueFallbackCounter;
  private final StatementTree.BuildListener buildListener = new MetricsListener();

  public StatementTreeService(
      StatementTreeProperties properties, CstParser parser, @Nullable MeterRegistry meterRegistry) {
    Objects.requireNonNull(properties, "properties");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.enabledLanguages = properties.enabledLanguageIds();
    this.trimmedByDefault = properties.trimmedByDefaultIds();
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.meterRegistry = registry;
    this.opaqueFallbackCounter = this.meterRegistry.counter("statement_tree_opaque_fallback_total");
    AtomicInteger threadIndex = new AtomicInteger();
    this.buildExecutor =
        Executors.newFixedThreadPool(
            properties.getMaxConcurrency(),
            runnable -> {
              Thread thread =
                  new Thread(runnable, "statement-tree-" + threadIndex.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
    log.info(
        "Statement trees enabled for {} (max concurrency {})",
        enabledLanguages,
        properties.getMaxConcurrency());
  }

  public boolean isSupported(String languageId) {
    return languageId != null
        && GrammarRegistry.isSupported(languageId)
        && enabledLanguages.contains(TreeSitterLanguage.normalize(languageId));
  }

  /** Whether completions in this language are trimmed at statement boundaries by default. */
  public boolean isTrimmedByDefault(String languageId) {
    return isSupported(languageId) && trimmedByDefault.contains(TreeSitterLanguage.normalize(languageId));
  }

  /**
   * Creates an unbuilt tree for {@code [startOffset, endOffset)} of {@code text}.
   *
   * @throws UnsupportedLanguageException if the language is unknown or disabled
   */
  public StatementTree create(String languageId, String text, int startOffset, int endOffset) {
    if (!isSupported(languageId)) {
      throw new UnsupportedLanguageException(languageId);
    }
    LanguageGrammar grammar = GrammarRegistry.require(languageId);
    return new StatementTree(
        grammar,
        TreeSitterLanguage.normalize(languageId),
        text,
        startOffset,
        endOffset,
        parser,
        buildExecutor,
        buildListener);
  }

  public CompletableFuture<StatementTree> build(
      String languageId, String text, int startOffset, int endOffset) {
    return create(languageId, text, startOffset, endOffset).build();
  }

  /**
   * Builds a tree, substituting a single opaque statement over the range when parsing fails.
   * Unsupported languages still fail fast.
   */
  public CompletableFuture<StatementTree> buildOrOpaque(
      String languageId, String text, int startOffset, int endOffset) {
    StatementTree tree = create(languageId, text, startOffset, endOffset);
    return tree.build()
        .exceptionally(
            error -> {
              Throwable cause =
                  error instanceof CompletionException && error.getCause() != null
                      ? error.getCause()
                      : error;
              log.warn(
                  "Falling back to an opaque statement for {}: {}",
                  tree.languageId(),
                  cause.getMessage());
              opaqueFallbackCounter.increment();
              tree.close();
              return StatementTree.opaque(
                  GrammarRegistry.require(languageId), tree.languageId(), text, startOffset, endOffset);
            });
  }

  @Override
  public void destroy() {
    buildExecutor.shutdownNow();
    try {
      if (!buildExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
        log.debug("Statement tree builds still running at shutdown");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private final class MetricsListener implements StatementTree.BuildListener {

    @Override
    public void onBuilt(StatementTree tree, long elapsedNanos) {
      meterRegistry
          .timer("statement_tree_build_duration", "language", tree.languageId())
          .record(elapsedNanos, TimeUnit.NANOSECONDS);
      if (log.isDebugEnabled()) {
        log.debug(
            "Built {} statement tree for range {} with {} top-level statements in {} ms",
            tree.languageId(),
            tree.queryRange(),
            tree.isClosed() ? 0 : tree.statements().size(),
            TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
      }
    }

    @Override
    public void onFailed(StatementTree tree, Throwable error, long elapsedNanos) {
      meterRegistry
          .counter("statement_tree_build_failure_total", "language", tree.languageId())
          .increment();
      log.warn("Statement tree build failed for {}: {}", tree.languageId(), error.getMessage());
    }
  }
}
