package com.aiadvent.statements.tree;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.statements.ast.FakeCstNode;
import com.aiadvent.statements.ast.FakeSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class StatementTreeBuilderTest {

  @Test
  void emitsSimpleStatementsInDocumentOrder() {
    StatementMarkup.Parsed parsed = StatementMarkup.parse("⟦x = 1;⟧\n⟦y = 2;⟧");
    FakeSource src = new FakeSource(parsed.text());
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node("expression_statement", "x = 1;", src.node("assignment_expression", "x = 1")),
            src.node("expression_statement", "y = 2;", src.node("assignment_expression", "y = 2")));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(StatementMarkup.outline(tree)).containsExactlyElementsOf(parsed.expected());
    assertThat(tree.statements())
        .extracting(StatementNode::isCompoundStatementType)
        .containsExactly(false, false);
  }

  @Test
  void controlStatementWithInlinedBodyCollapses() {
    FakeSource src = new FakeSource("if (x) y = 1;");
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node(
                "if_statement",
                "if (x) y = 1;",
                src.token("if", 0),
                src.node("parenthesized_expression", "(x)").as("condition"),
                src.node("expression_statement", "y = 1;").as("consequence")));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(tree.statements()).hasSize(1);
    StatementNode statement = tree.statements().get(0);
    assertThat(statement.kind()).isEqualTo("if_statement");
    assertThat(statement.isCompoundStatementType()).isFalse();
    assertThat(statement.children()).isEmpty();
  }

  @Test
  void controlStatementWithBlockBodyIsCompound() {
    FakeSource src = new FakeSource("if (x) { y = 1; }");
    StatementTree tree = StatementTrees.build("c", src.tree(ifWithBlock(src)));

    StatementNode statement = tree.statements().get(0);
    assertThat(statement.isCompoundStatementType()).isTrue();
    assertThat(statement.children()).hasSize(1);
    StatementNode child = statement.children().get(0);
    assertThat(child.text()).isEqualTo("y = 1;");
    assertThat(child.range()).isEqualTo(new TextRange(9, 15));
    assertThat(child.parent()).contains(statement);
  }

  @Test
  void blockInElseBranchMakesWholeStatementCompound() {
    StatementMarkup.Parsed parsed =
        StatementMarkup.parse("⟦if (x) ⟦a();⟧ else { ⟦b();⟧ }⟧");
    FakeSource src = new FakeSource(parsed.text());
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node(
                "if_statement",
                parsed.text(),
                src.token("if", 0),
                src.node("parenthesized_expression", "(x)").as("condition"),
                src.node("expression_statement", "a();").as("consequence"),
                src.node(
                        "else_clause",
                        "else { b(); }",
                        src.token("else", 0),
                        src.node(
                            "compound_statement",
                            "{ b(); }",
                            src.token("{", 0),
                            src.node("expression_statement", "b();"),
                            src.token("}", 0)))
                    .as("alternative")));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(StatementMarkup.outline(tree)).containsExactlyElementsOf(parsed.expected());
  }

  @Test
  void emptyBlockStillYieldsCompoundStatement() {
    FakeSource src = new FakeSource("if (x) {}");
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node(
                "if_statement",
                "if (x) {}",
                src.token("if", 0),
                src.node("parenthesized_expression", "(x)").as("condition"),
                src.node("compound_statement", "{}", src.token("{", 0), src.token("}", 0))
                    .as("consequence")));

    StatementNode statement = StatementTrees.build("c", src.tree(root)).statements().get(0);

    assertThat(statement.isCompoundStatementType()).isTrue();
    assertThat(statement.children()).isEmpty();
  }

  @Test
  void pointQueryKeepsOnlyEnclosingStatements() {
    StatementMarkup.Parsed parsed =
        StatementMarkup.parse("int a = 1;\n⟦void f() {\n  g();\n  ⟦‸h();⟧\n}⟧\nint b = 2;");
    FakeSource src = new FakeSource(parsed.text());
    FakeCstNode root = functionBetweenDeclarations(src);

    StatementTree tree =
        StatementTrees.build("c", src.tree(root), parsed.queryStart(), parsed.queryEnd());

    assertThat(StatementMarkup.outline(tree)).containsExactlyElementsOf(parsed.expected());
  }

  @Test
  void rangeQueryIncludesEveryIntersectingStatement() {
    FakeSource src =
        new FakeSource("int a = 1;\nvoid f() {\n  g();\n  h();\n}\nint b = 2;");
    FakeCstNode root = functionBetweenDeclarations(src);
    int start = src.offset("1;", 0);
    int end = src.offset("g", 0) + 1;

    StatementTree tree = StatementTrees.build("c", src.tree(root), start, end);

    assertThat(tree.statements())
        .extracting(StatementNode::kind)
        .containsExactly("declaration", "function_definition");
    assertThat(tree.statements().get(1).children())
        .extracting(StatementNode::text)
        .containsExactly("g();");
  }

  @Test
  void commentsDoNotChangeTheTree() {
    StatementMarkup.Parsed parsed = StatementMarkup.parse("⟦x = 1;⟧\n/* note */\n⟦y = 2;⟧");
    FakeSource src = new FakeSource(parsed.text());
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node("expression_statement", "x = 1;"),
            src.node("comment", "/* note */"),
            src.node("expression_statement", "y = 2;"));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(StatementMarkup.outline(tree)).containsExactlyElementsOf(parsed.expected());
  }

  @Test
  void labelIsFusedIntoSimpleTarget() {
    FakeSource src = new FakeSource("done: x = 1;");
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node(
                "labeled_statement",
                "done: x = 1;",
                src.node("statement_identifier", "done").as("label"),
                src.token(":", 0),
                src.node("expression_statement", "x = 1;")));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(tree.statements()).hasSize(1);
    StatementNode statement = tree.statements().get(0);
    assertThat(statement.kind()).isEqualTo("labeled_statement");
    assertThat(statement.text()).isEqualTo("done: x = 1;");
    assertThat(statement.isCompoundStatementType()).isFalse();
  }

  @Test
  void labelOnBlockTakesTheBodyAsChildren() {
    StatementMarkup.Parsed parsed = StatementMarkup.parse("⟦loop: { ⟦x();⟧ }⟧");
    FakeSource src = new FakeSource(parsed.text());
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node(
                "labeled_statement",
                parsed.text(),
                src.node("statement_identifier", "loop").as("label"),
                src.token(":", 0),
                src.node(
                    "compound_statement",
                    "{ x(); }",
                    src.token("{", 0),
                    src.node("expression_statement", "x();"),
                    src.token("}", 0))));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(StatementMarkup.outline(tree)).containsExactlyElementsOf(parsed.expected());
    assertThat(tree.statements().get(0).isCompoundStatementType()).isTrue();
  }

  @Test
  void errorWithoutStatementsBecomesSingleStatement() {
    FakeSource src = new FakeSource("x = 1;\n@@ ;");
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node("expression_statement", "x = 1;"),
            src.node("ERROR", "@@"));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(tree.statements()).extracting(StatementNode::kind).containsExactly("expression_statement", "ERROR");
    assertThat(tree.statements().get(1).isCompoundStatementType()).isFalse();
  }

  @Test
  void errorContainingStatementsIsTransparent() {
    FakeSource src = new FakeSource("( y = 1;");
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node("ERROR", "( y = 1;", src.token("(", 0), src.node("expression_statement", "y = 1;")));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(tree.statements()).extracting(StatementNode::text).containsExactly("y = 1;");
  }

  @Test
  void missingAndZeroWidthNodesAreSkipped() {
    FakeSource src = new FakeSource("x = 1;");
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node("expression_statement", "x = 1;"),
            FakeCstNode.named("expression_statement", 6, 6).markMissing());

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(tree.statements()).extracting(StatementNode::text).containsExactly("x = 1;");
  }

  @Test
  void nestedBlockIsItsOwnCompoundStatement() {
    StatementMarkup.Parsed parsed = StatementMarkup.parse("⟦void f() { ⟦{ ⟦a();⟧ }⟧ }⟧");
    FakeSource src = new FakeSource(parsed.text());
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node(
                "function_definition",
                parsed.text(),
                src.node("primitive_type", "void").as("type"),
                src.node("function_declarator", "f()").as("declarator"),
                src.node(
                        "compound_statement",
                        "{ { a(); } }",
                        src.token("{", 0),
                        src.node(
                            "compound_statement",
                            "{ a(); }",
                            src.token("{", 1),
                            src.node("expression_statement", "a();"),
                            src.token("}", 0)),
                        src.token("}", 1))
                    .as("body")));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(StatementMarkup.outline(tree)).containsExactlyElementsOf(parsed.expected());
  }

  @Test
  void oldStyleFunctionIsSplitIntoHeaderDeclarationsAndBody() {
    FakeSource src = new FakeSource("int f(a)\nint a;\n{ return a; }");
    FakeCstNode root =
        src.root(
            "translation_unit",
            src.node(
                "function_definition",
                src.text(),
                src.node("primitive_type", "int", 0).as("type"),
                src.node("function_declarator", "f(a)").as("declarator"),
                src.node("declaration", "int a;", src.node("primitive_type", "int", 1).as("type")),
                src.node(
                        "compound_statement",
                        "{ return a; }",
                        src.token("{", 0),
                        src.node("return_statement", "return a;"),
                        src.token("}", 0))
                    .as("body")));

    StatementTree tree = StatementTrees.build("c", src.tree(root));

    assertThat(StatementMarkup.outline(tree))
        .containsExactly("int f(a)", "int a;", "{ return a; }", "  return a;");
  }

  @Test
  void pythonSuiteOnHeaderRowCollapses() {
    FakeSource src = new FakeSource("if x: y = 1");
    StatementTree tree = StatementTrees.build("python", src.tree(pythonIf(src, "y = 1")));

    assertThat(tree.statements().get(0).isCompoundStatementType()).isFalse();
    assertThat(tree.statements().get(0).children()).isEmpty();
  }

  @Test
  void pythonIndentedSuiteIsCompound() {
    FakeSource src = new FakeSource("if x:\n    y = 1");
    StatementTree tree = StatementTrees.build("python", src.tree(pythonIf(src, "y = 1")));

    StatementNode statement = tree.statements().get(0);
    assertThat(statement.isCompoundStatementType()).isTrue();
    assertThat(statement.children()).extracting(StatementNode::text).containsExactly("y = 1");
  }

  @Test
  void rubyExpressionsInStatementListsAreStatements() {
    FakeSource src = new FakeSource("x = 1\nputs x");
    FakeCstNode root =
        src.root(
            "program",
            src.node("assignment", "x = 1", src.node("identifier", "x", 0).as("left")),
            src.node(
                "call",
                "puts x",
                src.node("identifier", "puts").as("method"),
                src.node("argument_list", "x", 1, src.node("identifier", "x", 1))));

    StatementTree tree = StatementTrees.build("ruby", src.tree(root));

    assertThat(tree.statements()).extracting(StatementNode::text).containsExactly("x = 1", "puts x");
  }

  @Test
  void decoratorIsFusedIntoFollowingMember() {
    StatementMarkup.Parsed parsed = StatementMarkup.parse("⟦class A {\n  ⟦@dec\n  m() {}⟧\n}⟧");
    FakeSource src = new FakeSource(parsed.text());
    FakeCstNode root =
        src.root(
            "program",
            src.node(
                "class_declaration",
                parsed.text(),
                src.token("class", 0),
                src.node("type_identifier", "A").as("name"),
                src.node(
                        "class_body",
                        "{\n  @dec\n  m() {}\n}",
                        src.token("{", 0),
                        src.node("decorator", "@dec"),
                        src.node(
                            "method_definition",
                            "m() {}",
                            src.node("property_identifier", "m").as("name"),
                            src.node("formal_parameters", "()").as("parameters"),
                            src.node("statement_block", "{}", src.token("{", 1), src.token("}", 0))
                                .as("body")),
                        src.token("}", 1))
                    .as("body")));

    StatementTree tree = StatementTrees.build("typescript", src.tree(root));

    assertThat(StatementMarkup.outline(tree)).containsExactlyElementsOf(parsed.expected());
    StatementNode member = tree.statements().get(0).children().get(0);
    assertThat(member.kind()).isEqualTo("method_definition");
    assertThat(member.isCompoundStatementType()).isTrue();
  }

  @Test
  void buildingTwiceGivesTheSameOutline() {
    FakeSource src = new FakeSource("if (x) { y = 1; }");
    List<String> first = StatementMarkup.outline(StatementTrees.build("c", src.tree(ifWithBlock(src))));
    List<String> second = StatementMarkup.outline(StatementTrees.build("c", src.tree(ifWithBlock(src))));

    assertThat(second).isEqualTo(first);
  }

  static FakeCstNode ifWithBlock(FakeSource src) {
    return src.root(
        "translation_unit",
        src.node(
            "if_statement",
            "if (x) { y = 1; }",
            src.token("if", 0),
            src.node("parenthesized_expression", "(x)").as("condition"),
            src.node(
                    "compound_statement",
                    "{ y = 1; }",
                    src.token("{", 0),
                    src.node("expression_statement", "y = 1;"),
                    src.token("}", 0))
                .as("consequence")));
  }

  private static FakeCstNode functionBetweenDeclarations(FakeSource src) {
    return src.root(
        "translation_unit",
        src.node("declaration", "int a = 1;", src.node("primitive_type", "int", 0).as("type")),
        src.node(
            "function_definition",
            "void f() {\n  g();\n  h();\n}",
            src.node("primitive_type", "void").as("type"),
            src.node("function_declarator", "f()").as("declarator"),
            src.node(
                    "compound_statement",
                    "{\n  g();\n  h();\n}",
                    src.token("{", 0),
                    src.node("expression_statement", "g();"),
                    src.node("expression_statement", "h();"),
                    src.token("}", 0))
                .as("body")),
        src.node("declaration", "int b = 2;", src.node("primitive_type", "int", 1).as("type")));
  }

  @Test
  void javaEmptyStatementTokenIsSimpleStatement() {
    StatementMarkup.Parsed parsed = StatementMarkup.parse("⟦void f() { ⟦;⟧ ⟦x();⟧ }⟧");
    FakeSource src = new FakeSource(parsed.text());
    FakeCstNode root =
        src.root(
            "program",
            src.node(
                "method_declaration",
                parsed.text(),
                src.node("identifier", "f").as("name"),
                src.node(
                        "block",
                        "{ ; x(); }",
                        src.token("{", 0),
                        src.token(";", 0),
                        src.node("expression_statement", "x();"),
                        src.token("}", 0))
                    .as("body")));

    StatementTree tree = StatementTrees.build("java", src.tree(root));

    assertThat(StatementMarkup.outline(tree)).containsExactlyElementsOf(parsed.expected());
    assertThat(tree.statements().get(0).children().get(0).kind()).isEqualTo(";");
  }

  @Test
  void wideTreeLinksEverySiblingInOrder() {
    int count = 20_000;
    String line = "x = 1;\n";
    FakeCstNode[] statements = new FakeCstNode[count];
    for (int i = 0; i < count; i++) {
      int start = i * line.length();
      statements[i] = FakeCstNode.named("expression_statement", start, start + line.length() - 1);
    }
    String text = line.repeat(count);
    FakeCstNode root = FakeCstNode.named("translation_unit", 0, text.length(), statements);

    StatementTree tree = StatementTrees.build("c", FakeCstNode.tree(text, root));

    List<StatementNode> built = tree.statements();
    assertThat(built).hasSize(count);
    for (int i = 0; i < count - 1; i++) {
      assertThat(built.get(i).nextSibling()).containsSame(built.get(i + 1));
    }
    assertThat(built.get(count - 1).nextSibling()).isEmpty();
  }

  @Test
  void longElseIfChainNestsEveryBranch() {
    int branches = 5_000;
    String branch = "if (a) { b(); }";
    String separator = " else ";
    String text = String.join(separator, Collections.nCopies(branches, branch));
    int stride = branch.length() + separator.length();
    FakeCstNode chain = null;
    for (int i = branches - 1; i >= 0; i--) {
      int start = i * stride;
      List<FakeCstNode> parts = new ArrayList<>();
      parts.add(FakeCstNode.named("parenthesized_expression", start + 3, start + 6).as("condition"));
      parts.add(
          FakeCstNode.named(
                  "compound_statement",
                  start + 7,
                  start + 15,
                  FakeCstNode.named("expression_statement", start + 9, start + 13))
              .as("consequence"));
      if (chain != null) {
        parts.add(
            FakeCstNode.named("else_clause", start + 16, text.length(), chain).as("alternative"));
      }
      chain =
          FakeCstNode.named("if_statement", start, text.length(), parts.toArray(FakeCstNode[]::new));
    }
    FakeCstNode root = FakeCstNode.named("translation_unit", 0, text.length(), chain);

    StatementTree tree = StatementTrees.build("c", FakeCstNode.tree(text, root));

    assertThat(tree.statements()).hasSize(1);
    assertThat(tree.statements().get(0).isCompoundStatementType()).isTrue();
    StatementNode innermost = tree.statementAt((branches - 1) * stride + 9).orElseThrow();
    assertThat(innermost.text()).isEqualTo("b();");
    assertThat(innermost.depth()).isEqualTo(branches);
    StatementNode lastIf = innermost.parent().orElseThrow();
    assertThat(lastIf.text()).isEqualTo(branch);
    assertThat(lastIf.children()).hasSize(1);
  }

  private static FakeCstNode pythonIf(FakeSource src, String body) {
    return src.root(
        "module",
        src.node(
            "if_statement",
            src.text(),
            src.token("if", 0),
            src.node("identifier", "x").as("condition"),
            src.token(":", 0),
            src.node("block", body, src.node("expression_statement", body)).as("consequence")));
  }
}
