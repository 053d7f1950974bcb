package io.formulaflow.core.compile;

/** Token kinds produced by {@link Lexer}. */
enum TokenType {
    // Single-character tokens.
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    DOT,

    // One or two character tokens.
    DOUBLE_STAR,
    EQUAL,
    EQUAL_EQUAL,
    BANG_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,

    // Literals.
    IDENTIFIER,
    NUMBER,
    STRING,

    // Literal keywords.
    TRUE,
    FALSE,
    NONE,

    // Recognised but outside the formula grammar; the parser rejects them with a precise message.
    UNSUPPORTED_OPERATOR,
    UNSUPPORTED_KEYWORD,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    LEFT_BRACE,
    RIGHT_BRACE,

    EOF
}
