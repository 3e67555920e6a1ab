package com.aiadvent.statements.grammar;

import static com.aiadvent.statements.grammar.BodySelector.fields;
import static com.aiadvent.statements.grammar.BodySelector.kinds;
import static com.aiadvent.statements.grammar.BodySelector.namedChildrenExceptFields;

import com.aiadvent.statements.ast.TreeSitterLanguage;

final class GoGrammar {

  private GoGrammar() {}

  static LanguageGrammar create() {
    return LanguageGrammar.builder(TreeSitterLanguage.GO)
        .statements(
            "package_clause",
            "import_declaration",
            "const_declaration",
            "var_declaration",
            "type_declaration",
            "expression_statement",
            "send_statement",
            "inc_statement",
            "dec_statement",
            "assignment_statement",
            "short_var_declaration",
            "return_statement",
            "go_statement",
            "defer_statement",
            "break_statement",
            "continue_statement",
            "goto_statement",
            "fallthrough_statement",
            "empty_statement")
        .wrappers("labeled_statement")
        .compound("function_declaration", fields("body"))
        .compound("method_declaration", fields("body"))
        // bodies are always braced, so nothing here collapses
        .compound("if_statement", fields("consequence", "alternative"))
        .compound("for_statement", fields("body"))
        .compound("expression_switch_statement", kinds("expression_case", "default_case"))
        .compound("type_switch_statement", kinds("type_case", "default_case"))
        .compound("select_statement", kinds("communication_case", "default_case"))
        .alwaysCompound("expression_case", namedChildrenExceptFields("value"))
        .alwaysCompound("type_case", namedChildrenExceptFields("type"))
        .alwaysCompound("communication_case", namedChildrenExceptFields("communication"))
        .alwaysCompound("default_case", namedChildrenExceptFields())
        .blocks("block")
        .transparent("statement_list")
        .skip("comment")
        .build();
  }
}
