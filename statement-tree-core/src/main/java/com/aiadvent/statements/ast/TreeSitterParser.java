package com.aiadvent.statements.ast;

import com.aiadvent.statements.config.StatementTreeProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Parses documents with the native Tree-sitter runtime and exposes the result through the
 * {@link CstNode} view. A fresh {@link TSParser} is used per call so parses never share state.
 */
public class TreeSitterParser implements CstParser {

  private static final Logger log = LoggerFactory.getLogger(TreeSitterParser.class);

  private final LanguageRegistry languageRegistry;
  private final Duration parseTimeout;

  public TreeSitterParser(LanguageRegistry languageRegistry, StatementTreeProperties properties) {
    this(languageRegistry, properties.getParseTimeout());
  }

  /** Convenience constructor for tests. */
  public TreeSitterParser(LanguageRegistry languageRegistry, Duration parseTimeout) {
    this.languageRegistry = Objects.requireNonNull(languageRegistry, "languageRegistry");
    this.parseTimeout = parseTimeout != null ? parseTimeout : Duration.ZERO;
  }

  @Override
  public CstTree parse(String languageId, String text) {
    Objects.requireNonNull(text, "text");
    TSLanguage language =
        languageRegistry
            .language(languageId)
            .orElseThrow(
                () ->
                    new CstParseException(
                        languageId, "No Tree-sitter grammar available for " + languageId));
    TSTree tree;
    try {
      TSParser parser = new TSParser();
      if (!parser.setLanguage(language)) {
        throw new CstParseException(
            languageId, "Tree-sitter rejected the grammar for " + languageId);
      }
      if (!parseTimeout.isZero()) {
        parser.setTimeoutMicros(parseTimeout.toNanos() / 1_000L);
      }
      tree = parser.parseString(null, text);
    } catch (CstParseException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new CstParseException(languageId, "Tree-sitter failed to parse " + languageId, ex);
    }
    if (tree == null || tree.getRootNode() == null || tree.getRootNode().isNull()) {
      throw new CstParseException(
          languageId, "Tree-sitter returned no tree for " + languageId + " (timeout " + parseTimeout + ")");
    }
    log.trace("Parsed {} chars of {}", text.length(), languageId);
    return new TreeSitterCstTree(tree, text);
  }

  static final class TreeSitterCstTree implements CstTree {

    private final String sourceText;
    private final SourceOffsetIndex offsets;
    private TSTree tree;
    private TreeSitterCstNode root;

    TreeSitterCstTree(TSTree tree, String sourceText) {
      this.tree = tree;
      this.sourceText = sourceText;
      this.offsets = SourceOffsetIndex.of(sourceText);
    }

    @Override
    public synchronized CstNode root() {
      if (tree == null) {
        throw new IllegalStateException("Syntax tree has been released");
      }
      if (root == null) {
        root = new TreeSitterCstNode(this, tree.getRootNode(), null, null);
      }
      return root;
    }

    @Override
    public String sourceText() {
      return sourceText;
    }

    @Override
    public synchronized void close() {
      // the native tree is freed by the binding's cleaner once unreachable
      tree = null;
      root = null;
    }
  }

  static final class TreeSitterCstNode implements CstNode {

    private final TreeSitterCstTree owner;
    private final TSNode node;
    private final TreeSitterCstNode parent;
    private final String fieldName;
    private final String kind;
    private final int startOffset;
    private final int endOffset;
    private List<CstNode> children;
    private List<CstNode> namedChildren;

    TreeSitterCstNode(
        TreeSitterCstTree owner, TSNode node, TreeSitterCstNode parent, String fieldName) {
      this.owner = owner;
      this.node = node;
      this.parent = parent;
      this.fieldName = fieldName;
      this.kind = node.getType();
      this.startOffset = owner.offsets.charOffset(node.getStartByte());
      this.endOffset = Math.max(startOffset, owner.offsets.charOffset(node.getEndByte()));
    }

    @Override
    public String kind() {
      return kind;
    }

    @Override
    public int startOffset() {
      return startOffset;
    }

    @Override
    public int endOffset() {
      return endOffset;
    }

    @Override
    public int startRow() {
      return owner.offsets.row(startOffset);
    }

    @Override
    public int startColumn() {
      return owner.offsets.column(startOffset);
    }

    @Override
    public int endRow() {
      return owner.offsets.row(endOffset);
    }

    @Override
    public int endColumn() {
      return owner.offsets.column(endOffset);
    }

    @Override
    public boolean isNamed() {
      return node.isNamed();
    }

    @Override
    public boolean isMissing() {
      return node.isMissing();
    }

    @Override
    public Optional<String> fieldName() {
      return Optional.ofNullable(fieldName);
    }

    @Override
    public synchronized List<CstNode> children() {
      if (children == null) {
        int count = node.getChildCount();
        List<CstNode> all = new ArrayList<>(count);
        List<CstNode> named = new ArrayList<>();
        for (int i = 0; i < count; i++) {
          TSNode child = node.getChild(i);
          if (child == null || child.isNull()) {
            continue;
          }
          TreeSitterCstNode wrapped =
              new TreeSitterCstNode(owner, child, this, node.getFieldNameForChild(i));
          all.add(wrapped);
          if (child.isNamed()) {
            named.add(wrapped);
          }
        }
        children = Collections.unmodifiableList(all);
        namedChildren = Collections.unmodifiableList(named);
      }
      return children;
    }

    @Override
    public synchronized List<CstNode> namedChildren() {
      children();
      return namedChildren;
    }

    @Override
    public Optional<CstNode> parent() {
      return Optional.ofNullable(parent);
    }

    @Override
    public String toString() {
      return kind + "[" + startOffset + ", " + endOffset + ")";
    }
  }
}
