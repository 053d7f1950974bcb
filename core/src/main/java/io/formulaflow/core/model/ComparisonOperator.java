package io.formulaflow.core.model;

/** Relational operators usable in a comparison chain such as {@code a < b <= c}. */
public enum ComparisonOperator {
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /** The operator as written in formula text. */
    public String symbol() {
        return symbol;
    }

    /** {@code true} for {@code ==} and {@code !=}, which are defined across all value kinds. */
    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    /** Interprets a {@link Comparable#compareTo}-style result under this operator. */
    public boolean test(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
        };
    }
}
