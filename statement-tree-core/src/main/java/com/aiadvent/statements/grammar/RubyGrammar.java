package com.aiadvent.statements.grammar;

import static com.aiadvent.statements.grammar.BodySelector.fields;
import static com.aiadvent.statements.grammar.BodySelector.kinds;
import static com.aiadvent.statements.grammar.BodySelector.namedChildren;

import com.aiadvent.statements.ast.TreeSitterLanguage;

/**
 * Ruby has no statement node kinds: any expression standing in a statement list is a statement.
 * Modifier forms ({@code x if y}) and block calls stay simple.
 */
final class RubyGrammar {

  private static final BodySelector DEFINITION_BODY = fields("body").and(kinds("body_statement"));

  private RubyGrammar() {}

  static LanguageGrammar create() {
    return LanguageGrammar.builder(TreeSitterLanguage.RUBY)
        .statementContainers(
            "program", "body_statement", "then", "else", "do", "begin", "ensure", "block_body")
        .alwaysCompound("method", DEFINITION_BODY)
        .alwaysCompound("singleton_method", DEFINITION_BODY)
        .alwaysCompound("class", DEFINITION_BODY)
        .alwaysCompound("singleton_class", DEFINITION_BODY)
        .alwaysCompound("module", DEFINITION_BODY)
        .alwaysCompound("if", fields("consequence", "alternative"))
        .alwaysCompound("unless", fields("consequence", "alternative"))
        .alwaysCompound("while", fields("body"))
        .alwaysCompound("until", fields("body"))
        .alwaysCompound("for", fields("body"))
        .alwaysCompound("case", kinds("when", "else"))
        .alwaysCompound("case_match", kinds("in_clause", "else"))
        .alwaysCompound("when", fields("body"))
        .alwaysCompound("in_clause", fields("body"))
        .alwaysCompound("begin", namedChildren())
        .blocks("body_statement", "then", "else", "do", "ensure")
        .clause("elsif", fields("consequence", "alternative"))
        .clause("rescue", fields("body"))
        .skip("comment", "heredoc_body", "uninterpreted", "empty_statement")
        .build();
  }
}
