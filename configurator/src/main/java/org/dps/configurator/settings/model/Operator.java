package org.dps.configurator.settings.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public enum Operator {
    EQ("=="),
    NE("!="),
    LE("<="),
    GE(">="),
    LT("<"),
    GT(">");

    // two-character symbols first so "<=" never parses as "<"
    private static final List<Operator> BY_SYMBOL_LENGTH = Arrays.stream(values())
            .sorted(Comparator.comparingInt((Operator op) -> op.symbol.length()).reversed())
            .toList();

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case LE -> comparison <= 0;
            case GE -> comparison >= 0;
            case LT -> comparison < 0;
            case GT -> comparison > 0;
        };
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        return BY_SYMBOL_LENGTH.stream()
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
    }
}
