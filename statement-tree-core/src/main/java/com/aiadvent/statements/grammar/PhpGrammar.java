package com.aiadvent.statements.grammar;

import static com.aiadvent.statements.grammar.BodySelector.fields;
import static com.aiadvent.statements.grammar.BodySelector.kinds;
import static com.aiadvent.statements.grammar.BodySelector.namedChildren;
import static com.aiadvent.statements.grammar.BodySelector.namedChildrenExceptFields;

import com.aiadvent.statements.ast.TreeSitterLanguage;

final class PhpGrammar {

  private PhpGrammar() {}

  static LanguageGrammar create() {
    return LanguageGrammar.builder(TreeSitterLanguage.PHP)
        .statements(
            "expression_statement",
            "echo_statement",
            "return_statement",
            "break_statement",
            "continue_statement",
            "global_declaration",
            "function_static_declaration",
            "unset_statement",
            "const_declaration",
            "use_declaration",
            "namespace_use_declaration",
            "property_declaration",
            "enum_case",
            "empty_statement",
            "goto_statement",
            "named_label_statement",
            "exit_statement")
        .compound("namespace_definition", fields("body"))
        .compound("function_definition", fields("body"))
        .compound("method_declaration", fields("body"))
        .compound("class_declaration", fields("body"))
        .compound("interface_declaration", fields("body"))
        .compound("trait_declaration", fields("body"))
        .compound("enum_declaration", fields("body"))
        .compound("declare_statement", kinds("compound_statement", "colon_block"))
        .compound("switch_statement", fields("body"))
        .compound("try_statement", fields("body").and(kinds("catch_clause", "finally_clause")))
        .collapsible("if_statement", fields("body", "alternative"))
        .collapsible("for_statement", fields("body"))
        .collapsible("foreach_statement", fields("body"))
        .collapsible("while_statement", fields("body"))
        .collapsible("do_statement", fields("body"))
        .alwaysCompound("case_statement", namedChildrenExceptFields("value"))
        .alwaysCompound("default_statement", namedChildren())
        .blocks("compound_statement", "declaration_list", "enum_declaration_list", "colon_block")
        .clause("else_if_clause", fields("body"))
        .clause("else_clause", fields("body"))
        .clause("catch_clause", fields("body"))
        .clause("finally_clause", fields("body"))
        .clause("switch_block", namedChildren())
        .skip("comment", "php_tag", "text_interpolation", "text")
        .build();
  }
}
