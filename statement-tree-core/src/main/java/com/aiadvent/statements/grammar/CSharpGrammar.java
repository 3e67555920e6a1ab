package com.aiadvent.statements.grammar;

import static com.aiadvent.statements.grammar.BodySelector.fields;
import static com.aiadvent.statements.grammar.BodySelector.kinds;
import static com.aiadvent.statements.grammar.BodySelector.lastNamedChild;
import static com.aiadvent.statements.grammar.BodySelector.namedChildren;
import static com.aiadvent.statements.grammar.BodySelector.namedChildrenExceptFields;

import com.aiadvent.statements.ast.TreeSitterLanguage;

final class CSharpGrammar {

  private static final BodySelector BLOCK_BODY = kinds("block");

  private static final BodySelector SECTION_BODY =
      node ->
          node.namedChildren().stream()
              .filter(child -> !child.kind().endsWith("switch_label"))
              .filter(child -> child.fieldName().isEmpty())
              .toList();

  private CSharpGrammar() {}

  static LanguageGrammar create() {
    return LanguageGrammar.builder(TreeSitterLanguage.CSHARP)
        .statements(
            "extern_alias_directive",
            "using_directive",
            "global_attribute",
            "file_scoped_namespace_declaration",
            "field_declaration",
            "event_field_declaration",
            "delegate_declaration",
            "expression_statement",
            "local_declaration_statement",
            "return_statement",
            "break_statement",
            "continue_statement",
            "throw_statement",
            "yield_statement",
            "goto_statement",
            "empty_statement")
        .wrappers("labeled_statement")
        .transparent("global_statement")
        .compound("namespace_declaration", fields("body"))
        .compound("class_declaration", fields("body"))
        .compound("struct_declaration", fields("body"))
        .compound("interface_declaration", fields("body"))
        .compound("record_declaration", fields("body"))
        .compound("enum_declaration", fields("body"))
        .compound("method_declaration", BLOCK_BODY)
        .compound("local_function_statement", BLOCK_BODY)
        .compound("constructor_declaration", BLOCK_BODY)
        .compound("destructor_declaration", BLOCK_BODY)
        .compound("operator_declaration", BLOCK_BODY)
        .compound("conversion_operator_declaration", BLOCK_BODY)
        .compound("accessor_declaration", BLOCK_BODY)
        .compound("property_declaration", fields("accessors"))
        .compound("indexer_declaration", fields("accessors"))
        .compound("event_declaration", fields("accessors"))
        .compound("checked_statement", BLOCK_BODY)
        .compound("unsafe_statement", BLOCK_BODY)
        .compound("switch_statement", fields("body"))
        .compound("try_statement", fields("body").and(kinds("catch_clause", "finally_clause")))
        .alwaysCompound("preproc_if", namedChildrenExceptFields("condition"))
        .collapsible("if_statement", fields("consequence", "alternative"))
        .collapsible("for_statement", fields("body"))
        .collapsible("foreach_statement", fields("body"))
        .collapsible("while_statement", fields("body"))
        .collapsible("do_statement", fields("body"))
        .collapsible("lock_statement", lastNamedChild())
        .collapsible("using_statement", lastNamedChild())
        .collapsible("fixed_statement", lastNamedChild())
        .alwaysCompound("switch_section", SECTION_BODY)
        .blocks(
            "block", "declaration_list", "accessor_list", "enum_member_declaration_list")
        .clause("switch_body", namedChildren())
        .clause("catch_clause", fields("body"))
        .clause("finally_clause", BLOCK_BODY)
        .skip(
            "comment",
            "preproc_region",
            "preproc_endregion",
            "preproc_pragma",
            "preproc_nullable",
            "preproc_define",
            "preproc_undef",
            "preproc_line",
            "preproc_error",
            "preproc_warning")
        .build();
  }
}
