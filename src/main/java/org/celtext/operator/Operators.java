package org.celtext.operator;

import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * Operator names and the precedence/associativity policy of the expression grammar.
 */
public final class Operators {
    public static final String CONDITIONAL = "_?_:_";
    public static final String LOGICAL_AND = "_&&_";
    public static final String LOGICAL_OR = "_||_";
    public static final String LOGICAL_NOT = "!_";
    public static final String EQUALS = "_==_";
    public static final String NOT_EQUALS = "_!=_";
    public static final String LESS = "_<_";
    public static final String LESS_EQUALS = "_<=_";
    public static final String GREATER = "_>_";
    public static final String GREATER_EQUALS = "_>=_";
    public static final String ADD = "_+_";
    public static final String SUBTRACT = "_-_";
    public static final String MULTIPLY = "_*_";
    public static final String DIVIDE = "_/_";
    public static final String MODULO = "_%_";
    public static final String NEGATE = "-_";
    public static final String INDEX = "_[_]";
    public static final String IN = "@in";
    public static final String OLD_IN = "_in_";

    // Precedence ranks, loosest first.
    private static final int CONDITIONAL_RANK = 1;
    private static final int OR_RANK = 2;
    private static final int AND_RANK = 3;
    private static final int RELATION_RANK = 4;
    private static final int ADDITION_RANK = 5;
    private static final int MULTIPLICATION_RANK = 6;
    private static final int UNARY_RANK = 7;
    private static final int INDEX_RANK = 8;

    private static final ImmutableMap<String, OperatorMetadata> OPERATORS =
        ImmutableMap.<String, OperatorMetadata>builder()
            .put(CONDITIONAL, mixfix(CONDITIONAL, CONDITIONAL_RANK))
            .put(LOGICAL_OR, flat(LOGICAL_OR, "||", OR_RANK))
            .put(LOGICAL_AND, flat(LOGICAL_AND, "&&", AND_RANK))
            .put(EQUALS, binary(EQUALS, "==", RELATION_RANK))
            .put(NOT_EQUALS, binary(NOT_EQUALS, "!=", RELATION_RANK))
            .put(LESS, binary(LESS, "<", RELATION_RANK))
            .put(LESS_EQUALS, binary(LESS_EQUALS, "<=", RELATION_RANK))
            .put(GREATER, binary(GREATER, ">", RELATION_RANK))
            .put(GREATER_EQUALS, binary(GREATER_EQUALS, ">=", RELATION_RANK))
            .put(IN, binary(IN, "in", RELATION_RANK))
            .put(OLD_IN, binary(OLD_IN, "in", RELATION_RANK))
            .put(ADD, binary(ADD, "+", ADDITION_RANK))
            .put(SUBTRACT, binary(SUBTRACT, "-", ADDITION_RANK))
            .put(MULTIPLY, binary(MULTIPLY, "*", MULTIPLICATION_RANK))
            .put(DIVIDE, binary(DIVIDE, "/", MULTIPLICATION_RANK))
            .put(MODULO, binary(MODULO, "%", MULTIPLICATION_RANK))
            .put(LOGICAL_NOT, unary(LOGICAL_NOT, "!"))
            .put(NEGATE, unary(NEGATE, "-"))
            .put(INDEX, mixfix(INDEX, INDEX_RANK))
            .build();

    // Binary symbols only: "-" and "!" also spell unary operators. "in" resolves to the current name.
    private static final ImmutableMap<String, String> BINARY_BY_SYMBOL =
        ImmutableMap.<String, String>builder()
            .put("||", LOGICAL_OR)
            .put("&&", LOGICAL_AND)
            .put("==", EQUALS)
            .put("!=", NOT_EQUALS)
            .put("<", LESS)
            .put("<=", LESS_EQUALS)
            .put(">", GREATER)
            .put(">=", GREATER_EQUALS)
            .put("in", IN)
            .put("+", ADD)
            .put("-", SUBTRACT)
            .put("*", MULTIPLY)
            .put("/", DIVIDE)
            .put("%", MODULO)
            .build();

    private Operators() {}

    /**
     * Full metadata entry for an operator name.
     */
    public static Optional<OperatorMetadata> lookup(String op) {
        return Optional.ofNullable(OPERATORS.get(op));
    }

    public static boolean isOperator(String op) {
        return OPERATORS.containsKey(op);
    }

    /**
     * Precedence rank of the operator, lower binds looser. Names outside the table yield 0.
     */
    public static int precedence(String op) {
        return lookup(op).map(OperatorMetadata::precedence)
                         .orElse(0);
    }

    /**
     * Whether the parser resolves the operator left-recursively. All binary operators except
     * logical and/or are; those two form flat chains.
     */
    public static boolean isLeftRecursive(String op) {
        return lookup(op).map(OperatorMetadata::leftRecursive)
                         .orElse(true);
    }

    /**
     * Source symbol of the operator. Empty when the name denotes a regular function call.
     */
    public static Optional<String> displaySymbol(String op) {
        return lookup(op).flatMap(OperatorMetadata::symbol);
    }

    /**
     * Canonical name of the binary operator spelled by {@code symbol}.
     */
    public static Optional<String> find(String symbol) {
        return Optional.ofNullable(BINARY_BY_SYMBOL.get(symbol));
    }

    private static OperatorMetadata binary(String name, String symbol, int precedence) {
        return new OperatorMetadata(name, Optional.of(symbol), precedence, true);
    }

    private static OperatorMetadata flat(String name, String symbol, int precedence) {
        return new OperatorMetadata(name, Optional.of(symbol), precedence, false);
    }

    private static OperatorMetadata unary(String name, String symbol) {
        return new OperatorMetadata(name, Optional.of(symbol), UNARY_RANK, true);
    }

    private static OperatorMetadata mixfix(String name, int precedence) {
        return new OperatorMetadata(name, Optional.empty(), precedence, true);
    }
}
