package io.formulaflow.core.compile;

import io.formulaflow.core.error.FormulaSyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits decoded formula text into tokens. Not thread-safe; create one per formula.
 */
final class Lexer {

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("True", TokenType.TRUE);
        map.put("False", TokenType.FALSE);
        map.put("None", TokenType.NONE);
        for (String keyword : List.of("and", "or", "not", "if", "else", "lambda", "in", "is", "for")) {
            map.put(keyword, TokenType.UNSUPPORTED_KEYWORD);
        }
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    Lexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, source.length()));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case ',' -> addToken(TokenType.COMMA);
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> addToken(TokenType.MINUS);
            case '[' -> addToken(TokenType.LEFT_BRACKET);
            case ']' -> addToken(TokenType.RIGHT_BRACKET);
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case '*' -> addToken(match('*') ? TokenType.DOUBLE_STAR : TokenType.STAR);
            case '/' -> addToken(match('/') ? TokenType.UNSUPPORTED_OPERATOR : TokenType.SLASH);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '!' -> {
                if (!match('=')) {
                    throw error("unexpected character '!'");
                }
                addToken(TokenType.BANG_EQUAL);
            }
            case '<' -> {
                if (match('<')) {
                    addToken(TokenType.UNSUPPORTED_OPERATOR);
                } else {
                    addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
                }
            }
            case '>' -> {
                if (match('>')) {
                    addToken(TokenType.UNSUPPORTED_OPERATOR);
                } else {
                    addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
                }
            }
            case '%', '&', '|', '^', '~', '@', ':', ';' -> addToken(TokenType.UNSUPPORTED_OPERATOR);
            case ' ', '\t', '\r', '\n' -> {
                // whitespace
            }
            case '"', '\'' -> string(c);
            case '.' -> {
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    throw error("unexpected character '" + c + "'");
                }
            }
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.') {
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (!isDigit(peek())) {
                current = mark;
                throw error("malformed exponent in number literal");
            }
            while (isDigit(peek())) advance();
        }
        if (isIdentifierStart(peek())) {
            throw error("invalid number literal '" + source.substring(start, current + 1) + "'");
        }
        String text = source.substring(start, current);
        addToken(TokenType.NUMBER, Double.parseDouble(text));
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case '\\', '\'', '"' -> value.append(escaped);
                    default -> value.append('\\').append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) {
            throw error("unterminated string literal");
        }
        advance(); // closing quote
        addToken(TokenType.STRING, value.toString());
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(start, current), literal, start));
    }

    private FormulaSyntaxException error(String message) {
        return new FormulaSyntaxException(
                String.format("Invalid formula syntax at position %d: %s in formula '%s'", start, message, source),
                source,
                start);
    }
}
