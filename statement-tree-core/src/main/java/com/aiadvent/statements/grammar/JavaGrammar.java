package com.aiadvent.statements.grammar;

import static com.aiadvent.statements.grammar.BodySelector.fields;
import static com.aiadvent.statements.grammar.BodySelector.kinds;
import static com.aiadvent.statements.grammar.BodySelector.namedChildren;
import static com.aiadvent.statements.grammar.BodySelector.namedChildrenAndTokens;

import com.aiadvent.statements.ast.TreeSitterLanguage;

final class JavaGrammar {

  // the grammar has no node kind for an empty statement, only the bare token
  private static final String EMPTY_STATEMENT = ";";

  private static final BodySelector CASE_BODY =
      node ->
          node.namedChildren().stream()
              .filter(child -> !"switch_label".equals(child.kind()))
              .toList();

  private JavaGrammar() {}

  static LanguageGrammar create() {
    return LanguageGrammar.builder(TreeSitterLanguage.JAVA)
        .statements(
            "package_declaration",
            "import_declaration",
            "module_declaration",
            "expression_statement",
            "local_variable_declaration",
            "field_declaration",
            "constant_declaration",
            "annotation_type_element_declaration",
            "explicit_constructor_invocation",
            "return_statement",
            "break_statement",
            "continue_statement",
            "throw_statement",
            "yield_statement",
            "assert_statement",
            EMPTY_STATEMENT)
        .wrappers("labeled_statement")
        .compound("class_declaration", fields("body"))
        .compound("interface_declaration", fields("body"))
        .compound("enum_declaration", fields("body"))
        .compound("record_declaration", fields("body"))
        .compound("annotation_type_declaration", fields("body"))
        .compound("method_declaration", fields("body"))
        .compound("constructor_declaration", fields("body"))
        .compound("compact_constructor_declaration", fields("body"))
        .compound("static_initializer", kinds("block"))
        .compound("synchronized_statement", fields("body").and(kinds("block")))
        .compound("try_statement", fields("body").and(kinds("catch_clause", "finally_clause")))
        .compound(
            "try_with_resources_statement",
            fields("body").and(kinds("catch_clause", "finally_clause")))
        .compound("switch_expression", fields("body"))
        .collapsible("if_statement", fields("consequence", "alternative"))
        .collapsible("for_statement", fields("body"))
        .collapsible("enhanced_for_statement", fields("body"))
        .collapsible("while_statement", fields("body"))
        .collapsible("do_statement", fields("body"))
        .alwaysCompound("switch_block_statement_group", CASE_BODY)
        .alwaysCompound("switch_rule", CASE_BODY)
        .block("block", namedChildrenAndTokens(EMPTY_STATEMENT))
        .block("constructor_body", namedChildrenAndTokens(EMPTY_STATEMENT))
        .blocks("class_body", "interface_body", "enum_body", "annotation_type_body")
        .clause("enum_body_declarations", namedChildren())
        .clause("switch_block", namedChildren())
        .clause("catch_clause", fields("body"))
        .clause("finally_clause", kinds("block"))
        .skip("line_comment", "block_comment")
        .build();
  }
}
