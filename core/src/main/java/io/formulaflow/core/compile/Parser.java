package io.formulaflow.core.compile;

import io.formulaflow.core.error.FormulaCompileException;
import io.formulaflow.core.error.FormulaSyntaxException;
import io.formulaflow.core.error.InvalidCallTargetException;
import io.formulaflow.core.error.UnsupportedExpressionException;
import io.formulaflow.core.model.BinaryOperator;
import io.formulaflow.core.model.ComparisonOperator;
import io.formulaflow.core.model.Expr;
import io.formulaflow.core.model.Value;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the formula grammar. Precedence, lowest first:
 *
 * <pre>
 * expression     := comparison
 * comparison     := additive ( ( "==" | "!=" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=" ) additive )*
 * additive       := multiplicative ( ( "+" | "-" ) multiplicative )*
 * multiplicative := unary ( ( "*" | "/" ) unary )*
 * unary          := "-" unary | power
 * power          := call ( "**" unary )?
 * call           := NAME "(" ( expression ( "," expression )* ","? )? ")" | primary
 * primary        := NUMBER | STRING | True | False | None | NAME | "(" expression ")"
 * </pre>
 *
 * {@code **} is right-associative and binds tighter than a unary minus on its left, so
 * {@code -2**2} is {@code -4} and {@code 2**-1} is {@code 0.5}.
 *
 * <p>
 * Not thread-safe; create one per formula.
 */
final class Parser {

    private final String source;
    private final List<Token> tokens;
    private int current = 0;

    Parser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /** Parses exactly one expression spanning all tokens. */
    Expr parse() {
        if (check(TokenType.EOF)) {
            throw syntaxError(peek(), "empty formula");
        }
        Expr expr = expression();
        if (!check(TokenType.EOF)) {
            throw unexpected(peek());
        }
        return expr;
    }

    private Expr expression() {
        return comparison();
    }

    private Expr comparison() {
        Expr first = additive();
        List<ComparisonOperator> operators = new ArrayList<>();
        List<Expr> operands = new ArrayList<>();
        while (true) {
            ComparisonOperator op = comparisonOperator(peek().type());
            if (op == null) {
                break;
            }
            advance();
            operators.add(op);
            operands.add(additive());
        }
        if (operators.isEmpty()) {
            return first;
        }
        return new Expr.Comparison(first, operators, operands);
    }

    private Expr additive() {
        Expr expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOperator op = previous().type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            expr = new Expr.Binary(op, expr, multiplicative());
        }
        return expr;
    }

    private Expr multiplicative() {
        Expr expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            BinaryOperator op =
                    previous().type() == TokenType.STAR ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
            expr = new Expr.Binary(op, expr, unary());
        }
        return expr;
    }

    private Expr unary() {
        if (match(TokenType.MINUS)) {
            return new Expr.Negate(unary());
        }
        if (check(TokenType.PLUS)) {
            throw unsupported(peek(), "unary '+'");
        }
        return power();
    }

    private Expr power() {
        Expr base = call();
        if (match(TokenType.DOUBLE_STAR)) {
            return new Expr.Binary(BinaryOperator.POWER, base, unary());
        }
        return base;
    }

    private Expr call() {
        Token start = peek();
        Expr expr;
        if (check(TokenType.IDENTIFIER) && peekNext().type() == TokenType.LEFT_PAREN) {
            advance();
            advance();
            expr = new Expr.Call(start.lexeme(), arguments());
        } else {
            expr = primary();
        }
        // Anything trailing that would make this a call, subscript or attribute is rejected.
        if (check(TokenType.LEFT_PAREN)) {
            throw new InvalidCallTargetException(
                    String.format(
                            "Only simple function calls are allowed: call target at position %d is not a bare"
                                    + " function name in formula '%s'",
                            peek().position(), source),
                    source,
                    peek().position());
        }
        if (check(TokenType.DOT)) {
            Token dot = peek();
            if (peekNext().type() == TokenType.IDENTIFIER
                    && peekAt(current + 2).type() == TokenType.LEFT_PAREN) {
                throw new InvalidCallTargetException(
                        String.format(
                                "Only simple function calls are allowed: method call '.%s(...)' at position %d in"
                                        + " formula '%s'",
                                peekNext().lexeme(), dot.position(), source),
                        source,
                        dot.position());
            }
            throw unsupported(dot, "attribute access");
        }
        if (check(TokenType.LEFT_BRACKET)) {
            throw unsupported(peek(), "subscript");
        }
        return expr;
    }

    private List<Expr> arguments() {
        List<Expr> args = new ArrayList<>();
        if (match(TokenType.RIGHT_PAREN)) {
            return args;
        }
        do {
            if (check(TokenType.RIGHT_PAREN)) {
                break; // trailing comma
            }
            if (check(TokenType.STAR) || check(TokenType.DOUBLE_STAR)) {
                throw unsupported(peek(), "starred argument");
            }
            if (check(TokenType.IDENTIFIER) && peekNext().type() == TokenType.EQUAL) {
                throw unsupported(peek(), "keyword argument '" + peek().lexeme() + "='");
            }
            args.add(expression());
        } while (match(TokenType.COMMA));
        consume(TokenType.RIGHT_PAREN, "expected ')' after function arguments");
        return args;
    }

    private Expr primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new Expr.Constant(Value.num((Double) token.literal()));
            }
            case STRING -> {
                advance();
                return new Expr.Constant(Value.str((String) token.literal()));
            }
            case TRUE -> {
                advance();
                return new Expr.Constant(Value.TRUE);
            }
            case FALSE -> {
                advance();
                return new Expr.Constant(Value.FALSE);
            }
            case NONE -> {
                advance();
                return new Expr.Constant(Value.NULL);
            }
            case IDENTIFIER -> {
                advance();
                return new Expr.Variable(token.lexeme());
            }
            case LEFT_PAREN -> {
                advance();
                if (check(TokenType.RIGHT_PAREN)) {
                    throw unsupported(token, "tuple literal");
                }
                Expr inner = expression();
                if (check(TokenType.COMMA)) {
                    throw unsupported(peek(), "tuple literal");
                }
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                return inner;
            }
            default -> throw unexpected(token);
        }
    }

    private static ComparisonOperator comparisonOperator(TokenType type) {
        return switch (type) {
            case EQUAL_EQUAL -> ComparisonOperator.EQ;
            case BANG_EQUAL -> ComparisonOperator.NE;
            case LESS -> ComparisonOperator.LT;
            case LESS_EQUAL -> ComparisonOperator.LE;
            case GREATER -> ComparisonOperator.GT;
            case GREATER_EQUAL -> ComparisonOperator.GE;
            default -> null;
        };
    }

    // --- Token helpers ---

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        Token token = peek();
        if (isUnsupported(token)) {
            throw unsupported(token, describeUnsupported(token));
        }
        throw syntaxError(token, message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) {
            current++;
        }
        return previous();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return peekAt(current + 1);
    }

    private Token peekAt(int index) {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    // --- Errors ---

    private FormulaCompileException unexpected(Token token) {
        if (isUnsupported(token)) {
            return unsupported(token, describeUnsupported(token));
        }
        if (token.type() == TokenType.EOF) {
            return syntaxError(token, "unexpected end of formula");
        }
        if (token.type() == TokenType.EQUAL) {
            return syntaxError(token, "assignment is not allowed (use '==' to compare)");
        }
        return syntaxError(token, "unexpected token '" + token.lexeme() + "'");
    }

    private static boolean isUnsupported(Token token) {
        return switch (token.type()) {
            case UNSUPPORTED_OPERATOR, UNSUPPORTED_KEYWORD, LEFT_BRACKET, LEFT_BRACE -> true;
            default -> false;
        };
    }

    private static String describeUnsupported(Token token) {
        return switch (token.type()) {
            case UNSUPPORTED_OPERATOR -> "operator '" + token.lexeme() + "'";
            case UNSUPPORTED_KEYWORD -> "keyword '" + token.lexeme() + "'";
            case LEFT_BRACKET -> "list literal";
            case LEFT_BRACE -> "dict or set literal";
            default -> "token '" + token.lexeme() + "'";
        };
    }

    private UnsupportedExpressionException unsupported(Token token, String construct) {
        return new UnsupportedExpressionException(construct, source, token.position());
    }

    private FormulaSyntaxException syntaxError(Token token, String message) {
        return new FormulaSyntaxException(
                String.format(
                        "Invalid formula syntax at position %d: %s in formula '%s'",
                        token.position(), message, source),
                source,
                token.position());
    }
}
