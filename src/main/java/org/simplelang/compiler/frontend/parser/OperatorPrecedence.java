package org.simplelang.compiler.frontend.parser;

import org.simplelang.compiler.frontend.lexer.TokenType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Binding strength of the binary operators, loosest first. Every level is left-associative.
 * The conditional operator {@code ?:} sits below all of these and is handled separately.
 */
public final class OperatorPrecedence {

    /** Returned for tokens that are not binary operators. */
    public static final int NONE = 0;

    public static final int LOGICAL_OR = 1;
    public static final int LOGICAL_AND = 2;
    public static final int EQUALITY = 3;
    public static final int RELATIONAL = 4;
    public static final int ADDITIVE = 5;
    public static final int MULTIPLICATIVE = 6;

    private static final Map<TokenType, Integer> BINARY = new EnumMap<>(TokenType.class);

    static {
        BINARY.put(TokenType.OR_OR, LOGICAL_OR);
        BINARY.put(TokenType.AND_AND, LOGICAL_AND);
        BINARY.put(TokenType.EQUAL_EQUAL, EQUALITY);
        BINARY.put(TokenType.BANG_EQUAL, EQUALITY);
        BINARY.put(TokenType.LESS, RELATIONAL);
        BINARY.put(TokenType.LESS_EQUAL, RELATIONAL);
        BINARY.put(TokenType.GREATER, RELATIONAL);
        BINARY.put(TokenType.GREATER_EQUAL, RELATIONAL);
        BINARY.put(TokenType.PLUS, ADDITIVE);
        BINARY.put(TokenType.MINUS, ADDITIVE);
        BINARY.put(TokenType.STAR, MULTIPLICATIVE);
        BINARY.put(TokenType.SLASH, MULTIPLICATIVE);
        BINARY.put(TokenType.PERCENT, MULTIPLICATIVE);
    }

    private OperatorPrecedence() {}

    /**
     * @param type A token type.
     * @return The binary precedence of {@code type}, or {@link #NONE}.
     */
    public static int binary(TokenType type) {
        return BINARY.getOrDefault(type, NONE);
    }
}
