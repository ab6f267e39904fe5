package com.eainde.nlg.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Single constraint of a template rule: {@code lhs op value}.
 *
 * <p>A plain string on the right of {@code =} or {@code !=} is a regular expression that must match
 * the whole string form of the left side. Values taken from another fact through an
 * {@link LhsExpr} are compared by equality. Numbers compare numerically whatever their boxed type.
 * Values that cannot be ordered never satisfy an ordering operator.</p>
 */
public final class Matcher implements Serializable {

    public enum Operator {
        EQ("="),
        NE("!="),
        GT(">"),
        LT("<"),
        GE(">="),
        LE("<="),
        IN("in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            return Arrays.stream(values())
                    .filter(op -> op.symbol.equals(symbol))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Invalid matcher operator '" + symbol
                            + "'. Must be one of: " + Arrays.stream(values()).map(Operator::symbol)
                            .collect(Collectors.joining(", "))));
        }
    }

    private static final int INCOMPARABLE = Integer.MIN_VALUE;

    private final LhsExpr lhs;
    private final Operator operator;
    private final Object value;
    private final Pattern pattern;

    public Matcher(LhsExpr lhs, String operator, Object value) {
        this(lhs, Operator.fromSymbol(operator), value);
    }

    public Matcher(LhsExpr lhs, Operator operator, Object value) {
        this.lhs = Objects.requireNonNull(lhs, "lhs");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = value;
        this.pattern = value instanceof String regex && (operator == Operator.EQ || operator == Operator.NE)
                ? Pattern.compile(regex)
                : null;
        if (operator == Operator.IN && !(value instanceof Collection<?>) && !(value instanceof String)
                && !(value instanceof LhsExpr)) {
            throw new IllegalArgumentException("Operator 'in' needs a collection or string, got " + value);
        }
    }

    public LhsExpr getLhs() {
        return lhs;
    }

    public Operator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    public boolean test(Fact fact, List<Fact> usedFacts) {
        Object left = lhs.evaluate(fact, usedFacts);
        if (pattern != null) {
            boolean matches = pattern.matcher(String.valueOf(left)).matches();
            return operator == Operator.EQ ? matches : !matches;
        }
        Object right = value instanceof LhsExpr expr ? expr.evaluate(fact, usedFacts) : value;
        return switch (operator) {
            case EQ -> sameValue(left, right);
            case NE -> !sameValue(left, right);
            case IN -> contains(right, left);
            default -> ordered(operator, compare(left, right));
        };
    }

    private static boolean ordered(Operator operator, int comparison) {
        if (comparison == INCOMPARABLE) {
            return false;
        }
        return switch (operator) {
            case GT -> comparison > 0;
            case LT -> comparison < 0;
            case GE -> comparison >= 0;
            case LE -> comparison <= 0;
            default -> throw new IllegalStateException("Not an ordering operator: " + operator);
        };
    }

    static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }

    private static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof String x && b instanceof String y) {
            return Integer.signum(x.compareTo(y));
        }
        return INCOMPARABLE;
    }

    private static boolean contains(Object container, Object element) {
        if (container instanceof Collection<?> collection) {
            return collection.stream().anyMatch(candidate -> sameValue(candidate, element));
        }
        if (container instanceof String text && element != null) {
            return text.contains(String.valueOf(element));
        }
        return false;
    }

    @Override
    public String toString() {
        return lhs + " " + operator.symbol() + " " + value;
    }
}
