package com.aiadvent.statements.tree;

import com.aiadvent.statements.ast.CstParser;
import com.aiadvent.statements.ast.CstTree;
import com.aiadvent.statements.ast.SourceOffsetIndex;
import com.aiadvent.statements.grammar.GrammarRegistry;
import com.aiadvent.statements.grammar.LanguageGrammar;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Statements of a document that intersect a query range, in document order.
 *
 * <p>A tree is single use: construct it, {@link #build()} it once, query it, then {@link
 * #close()} it. Statements enclosing the range are included with their full span, so a point
 * query inside a function body still yields the function as the outer statement.
 */
public final class StatementTree implements AutoCloseable {

  static final String OPAQUE_KIND = "opaque";

  private final LanguageGrammar grammar;
  private final String languageId;
  private final String sourceText;
  private final TextRange queryRange;
  private final CstParser parser;
  private final Executor executor;
  private final BuildListener listener;
  private final SourceOffsetIndex offsets;

  private CompletableFuture<StatementTree> buildFuture;
  private volatile List<StatementNode> nodes = List.of();
  private volatile List<StatementNode> statements = List.of();
  private volatile CstTree syntaxTree;
  private volatile boolean built;
  private volatile boolean closed;

  public StatementTree(
      LanguageGrammar grammar,
      String languageId,
      String sourceText,
      int startOffset,
      int endOffset,
      CstParser parser,
      Executor executor,
      BuildListener listener) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
    this.languageId = Objects.requireNonNull(languageId, "languageId");
    this.sourceText = Objects.requireNonNull(sourceText, "sourceText");
    if (startOffset < 0 || endOffset < startOffset || endOffset > sourceText.length()) {
      throw new IllegalArgumentException(
          "Range ["
              + startOffset
              + ", "
              + endOffset
              + ") is outside the source text of length "
              + sourceText.length());
    }
    this.queryRange = new TextRange(startOffset, endOffset);
    this.parser = Objects.requireNonNull(parser, "parser");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.listener = listener != null ? listener : BuildListener.NOOP;
    this.offsets = SourceOffsetIndex.of(sourceText);
  }

  /**
   * A built tree holding one simple statement over the whole query range, for callers that fall
   * back to treating the range as unsplittable.
   */
  public static StatementTree opaque(
      LanguageGrammar grammar, String languageId, String sourceText, int startOffset, int endOffset) {
    StatementTree tree =
        new StatementTree(
            grammar,
            languageId,
            sourceText,
            startOffset,
            endOffset,
            (id, text) -> {
              throw new IllegalStateException("Opaque trees are never parsed");
            },
            Runnable::run,
            BuildListener.NOOP);
    StatementArena arena = new StatementArena();
    if (endOffset > startOffset) {
      arena.add(OPAQUE_KIND, startOffset, endOffset, false, StatementArena.NO_PARENT);
    }
    tree.install(null, arena);
    tree.buildFuture = CompletableFuture.completedFuture(tree);
    return tree;
  }

  public static boolean isSupported(String languageId) {
    return GrammarRegistry.isSupported(languageId);
  }

  /**
   * Parses the source and builds the statements on the tree's executor. Repeated calls return the
   * same future. A parse failure completes the future exceptionally and leaves the tree empty.
   */
  public synchronized CompletableFuture<StatementTree> build() {
    ensureOpen();
    if (buildFuture == null) {
      buildFuture = CompletableFuture.supplyAsync(this::buildNow, executor);
    }
    return buildFuture;
  }

  private StatementTree buildNow() {
    long started = System.nanoTime();
    try {
      CstTree parsed = parser.parse(languageId, sourceText);
      StatementArena arena = new StatementTreeBuilder(grammar, queryRange).build(parsed.root());
      install(parsed, arena);
      listener.onBuilt(this, System.nanoTime() - started);
      return this;
    } catch (RuntimeException ex) {
      listener.onFailed(this, ex, System.nanoTime() - started);
      throw ex;
    } catch (StackOverflowError ex) {
      IllegalStateException failure =
          new IllegalStateException(
              "Syntax tree of " + languageId + " source is nested too deeply", ex);
      listener.onFailed(this, failure, System.nanoTime() - started);
      throw failure;
    }
  }

  private synchronized void install(CstTree parsed, StatementArena arena) {
    if (closed) {
      if (parsed != null) {
        parsed.close();
      }
      return;
    }
    List<StatementNode> created = new ArrayList<>(arena.size());
    for (int i = 0; i < arena.size(); i++) {
      StatementArena.Slot slot = arena.slot(i);
      created.add(
          new StatementNode(
              this,
              i,
              slot.kind,
              new TextRange(slot.start, slot.end),
              slot.compound,
              slot.parent,
              slot.children.stream().mapToInt(Integer::intValue).toArray(),
              slot.nextSibling));
    }
    List<StatementNode> roots = new ArrayList<>(arena.roots().size());
    for (int root : arena.roots()) {
      roots.add(created.get(root));
    }
    this.nodes = Collections.unmodifiableList(created);
    this.statements = Collections.unmodifiableList(roots);
    this.syntaxTree = parsed;
    this.built = true;
  }

  /** Top-level statements; empty until the build completes. */
  public List<StatementNode> statements() {
    ensureOpen();
    return statements;
  }

  /**
   * Innermost statement whose range contains {@code offset}. Ranges are half-open, so an offset
   * on the boundary between two siblings belongs to the later one.
   */
  public Optional<StatementNode> statementAt(int offset) {
    for (StatementNode statement : statements()) {
      Optional<StatementNode> match = statement.statementAt(offset);
      if (match.isPresent()) {
        return match;
      }
    }
    return Optional.empty();
  }

  public String dump() {
    return dump("");
  }

  /** Renders every top-level statement with its index, e.g. {@code " [0] if_statement ..."}. */
  public String dump(String prefix) {
    List<String> lines = new ArrayList<>();
    List<StatementNode> roots = statements();
    for (int i = 0; i < roots.size(); i++) {
      String index = "[" + i + "]";
      lines.add(
          roots
              .get(i)
              .dump(prefix + " " + index + " ", prefix + " " + " ".repeat(index.length()) + " "));
    }
    return String.join("\n", lines);
  }

  public String languageId() {
    return languageId;
  }

  public String sourceText() {
    return sourceText;
  }

  public TextRange queryRange() {
    return queryRange;
  }

  public boolean isBuilt() {
    return built;
  }

  public boolean isClosed() {
    return closed;
  }

  /** Releases the syntax tree. Queries on a closed tree fail. */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    CstTree parsed = syntaxTree;
    syntaxTree = null;
    nodes = List.of();
    statements = List.of();
    if (parsed != null) {
      parsed.close();
    }
  }

  StatementNode node(int index) {
    return nodes.get(index);
  }

  SourcePosition position(int offset) {
    return new SourcePosition(offsets.row(offset), offsets.column(offset));
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Statement tree has been closed");
    }
  }

  /** Callback for build outcomes, used for metrics and logging. */
  public interface BuildListener {

    BuildListener NOOP =
        new BuildListener() {
          @Override
          public void onBuilt(StatementTree tree, long elapsedNanos) {}

          @Override
          public void onFailed(StatementTree tree, Throwable error, long elapsedNanos) {}
        };

    void onBuilt(StatementTree tree, long elapsedNanos);

    void onFailed(StatementTree tree, Throwable error, long elapsedNanos);
  }
}
