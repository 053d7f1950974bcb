package io.formulaflow.core.compile;

/**
 * A lexical token with its offset in the decoded formula text.
 *
 * @param type     the token kind
 * @param lexeme   the source text of the token
 * @param literal  the parsed literal ({@code Double} or {@code String}), or {@code null}
 * @param position zero-based offset of the first character
 */
record Token(TokenType type, String lexeme, Object literal, int position) {}
