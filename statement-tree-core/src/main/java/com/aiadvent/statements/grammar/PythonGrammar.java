package com.aiadvent.statements.grammar;

import static com.aiadvent.statements.grammar.BodySelector.fields;
import static com.aiadvent.statements.grammar.BodySelector.kinds;

import com.aiadvent.statements.ast.TreeSitterLanguage;

final class PythonGrammar {

  private PythonGrammar() {}

  static LanguageGrammar create() {
    return LanguageGrammar.builder(TreeSitterLanguage.PYTHON)
        .statements(
            "future_import_statement",
            "import_statement",
            "import_from_statement",
            "print_statement",
            "assert_statement",
            "expression_statement",
            "return_statement",
            "delete_statement",
            "raise_statement",
            "pass_statement",
            "break_statement",
            "continue_statement",
            "global_statement",
            "nonlocal_statement",
            "exec_statement",
            "type_alias_statement")
        .collapsible("if_statement", fields("consequence", "alternative"))
        .collapsible("for_statement", fields("body", "alternative"))
        .collapsible("while_statement", fields("body", "alternative"))
        .collapsible("with_statement", fields("body"))
        .compound(
            "try_statement",
            fields("body")
                .and(kinds("except_clause", "except_group_clause", "else_clause", "finally_clause")))
        .compound("function_definition", fields("body"))
        .compound("class_definition", fields("body"))
        .compound("match_statement", fields("body"))
        .alwaysCompound("case_clause", fields("consequence"))
        .wrappers("decorated_definition")
        .blocks("block")
        .clause("elif_clause", fields("consequence"))
        .clause("else_clause", fields("body"))
        .clause("except_clause", kinds("block"))
        .clause("except_group_clause", kinds("block"))
        .clause("finally_clause", kinds("block"))
        .skip("comment")
        .inlineBlocksOnHeaderRow()
        .build();
  }
}
