package com.aiadvent.statements.grammar;

import static com.aiadvent.statements.grammar.BodySelector.fields;
import static com.aiadvent.statements.grammar.BodySelector.kinds;
import static com.aiadvent.statements.grammar.BodySelector.namedChildren;
import static com.aiadvent.statements.grammar.BodySelector.namedChildrenExceptFields;
import static com.aiadvent.statements.grammar.BodySelector.nested;

import com.aiadvent.statements.ast.TreeSitterLanguage;

/**
 * C and C++ tables. Declarations whose type specifier carries a body ({@code typedef struct {..}
 * Name;}) are compound with the members as children; every other declaration is simple.
 */
final class CFamilyGrammars {

  private static final BodySelector TYPE_BODY = nested("type", fields("body"));

  private CFamilyGrammars() {}

  static LanguageGrammar c() {
    return LanguageGrammar.builder(TreeSitterLanguage.C)
        .statements(
            "expression_statement",
            "return_statement",
            "break_statement",
            "continue_statement",
            "goto_statement",
            "preproc_include",
            "preproc_def",
            "preproc_function_def",
            "preproc_call")
        .wrappers("labeled_statement", "attributed_statement")
        .compound("declaration", TYPE_BODY)
        .compound("type_definition", TYPE_BODY)
        .compound("field_declaration", TYPE_BODY)
        .compound("struct_specifier", fields("body"))
        .compound("union_specifier", fields("body"))
        .compound("enum_specifier", fields("body"))
        .compound("function_definition", fields("body"))
        .compound("switch_statement", fields("body"))
        .collapsible("if_statement", fields("consequence", "alternative"))
        .collapsible("while_statement", fields("body"))
        .collapsible("for_statement", fields("body"))
        .collapsible("do_statement", fields("body"))
        .alwaysCompound("case_statement", namedChildrenExceptFields("value"))
        .alwaysCompound("preproc_if", namedChildrenExceptFields("condition"))
        .alwaysCompound("preproc_ifdef", namedChildrenExceptFields("name"))
        .blocks("compound_statement", "field_declaration_list", "enumerator_list")
        .clause("else_clause", namedChildren())
        .skip("comment")
        .splitOldStyleFunctions()
        .build();
  }

  static LanguageGrammar cpp() {
    return LanguageGrammar.builder(TreeSitterLanguage.CPP)
        .extend(c())
        .statements(
            "concept_definition",
            "using_declaration",
            "alias_declaration",
            "static_assert_declaration",
            "namespace_alias_definition",
            "friend_declaration",
            "template_instantiation",
            "throw_statement",
            "co_return_statement",
            "co_yield_statement")
        .wrappers("template_declaration")
        .compound("class_specifier", fields("body"))
        .compound("namespace_definition", fields("body"))
        .compound("linkage_specification", fields("body"))
        .compound("try_statement", fields("body").and(kinds("catch_clause")))
        .collapsible("for_range_loop", fields("body"))
        .blocks("declaration_list")
        .clause("catch_clause", fields("body"))
        .skip("access_specifier")
        .build();
  }
}
