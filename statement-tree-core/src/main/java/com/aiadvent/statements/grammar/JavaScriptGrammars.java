package com.aiadvent.statements.grammar;

import static com.aiadvent.statements.grammar.BodySelector.fields;
import static com.aiadvent.statements.grammar.BodySelector.namedChildren;

import com.aiadvent.statements.ast.TreeSitterLanguage;

/** JavaScript and TypeScript tables; TypeScript extends the JavaScript one. */
final class JavaScriptGrammars {

  private JavaScriptGrammars() {}

  static LanguageGrammar javascript() {
    return base(TreeSitterLanguage.JAVASCRIPT).statements("field_definition").build();
  }

  static LanguageGrammar typescript() {
    return base(TreeSitterLanguage.TYPESCRIPT)
        .statements(
            "public_field_definition",
            "type_alias_declaration",
            "function_signature",
            "abstract_method_signature",
            "method_signature",
            "property_signature",
            "call_signature",
            "construct_signature",
            "index_signature",
            "import_alias")
        .compound("abstract_class_declaration", fields("body"))
        .compound("interface_declaration", fields("body"))
        .compound("enum_declaration", fields("body"))
        .compound("internal_module", fields("body"))
        .compound("module", fields("body"))
        .blocks("interface_body", "object_type", "enum_body")
        .attachments("decorator")
        // `namespace N {}` parses as an expression statement around internal_module
        .wrappers("expression_statement", "ambient_declaration")
        .build();
  }

  private static LanguageGrammar.Builder base(TreeSitterLanguage language) {
    return LanguageGrammar.builder(language)
        .statements(
            "expression_statement",
            "import_statement",
            "debugger_statement",
            "lexical_declaration",
            "variable_declaration",
            "break_statement",
            "continue_statement",
            "return_statement",
            "throw_statement",
            "empty_statement")
        .wrappers("export_statement", "labeled_statement")
        .compound("function_declaration", fields("body"))
        .compound("generator_function_declaration", fields("body"))
        .compound("class_declaration", fields("body"))
        .compound("method_definition", fields("body"))
        .compound("class_static_block", fields("body"))
        .compound("switch_statement", fields("body"))
        .compound("try_statement", fields("body", "handler", "finalizer"))
        .collapsible("if_statement", fields("consequence", "alternative"))
        .collapsible("for_statement", fields("body"))
        .collapsible("for_in_statement", fields("body"))
        .collapsible("while_statement", fields("body"))
        .collapsible("do_statement", fields("body"))
        .collapsible("with_statement", fields("body"))
        .alwaysCompound("switch_case", fields("body"))
        .alwaysCompound("switch_default", fields("body"))
        .blocks("statement_block", "class_body")
        .clause("else_clause", namedChildren())
        .clause("switch_body", namedChildren())
        .clause("catch_clause", fields("body"))
        .clause("finally_clause", fields("body"))
        .skip("comment", "hash_bang_line", "html_comment");
  }
}
