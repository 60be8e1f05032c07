package org.simplelang.compiler.frontend.lexer;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The static, read-only spelling tables of SimpleLang: reserved words and operator spellings
 * mapped to their token types. The maps are built once and are safe to share across threads.
 */
public final class Lexicon {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("agr", TokenType.AGR),
            Map.entry("varna", TokenType.VARNA),
            Map.entry("jabtak", TokenType.JABTAK),
            Map.entry("tabtak", TokenType.TABTAK),
            Map.entry("do", TokenType.DO),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("dikhao", TokenType.DIKHAO),
            Map.entry("likho", TokenType.LIKHO),
            Map.entry("int", TokenType.INT),
            Map.entry("float", TokenType.FLOAT),
            Map.entry("bool", TokenType.BOOL),
            Map.entry("string", TokenType.STRING),
            Map.entry("char", TokenType.CHAR),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE)
    );

    private static final Map<String, TokenType> TWO_CHAR_OPERATORS = Map.ofEntries(
            Map.entry("+=", TokenType.PLUS_ASSIGN),
            Map.entry("-=", TokenType.MINUS_ASSIGN),
            Map.entry("*=", TokenType.STAR_ASSIGN),
            Map.entry("/=", TokenType.SLASH_ASSIGN),
            Map.entry("++", TokenType.INCREMENT),
            Map.entry("--", TokenType.DECREMENT),
            Map.entry("&&", TokenType.AND_AND),
            Map.entry("||", TokenType.OR_OR),
            Map.entry("==", TokenType.EQUAL_EQUAL),
            Map.entry("!=", TokenType.BANG_EQUAL),
            Map.entry("<=", TokenType.LESS_EQUAL),
            Map.entry(">=", TokenType.GREATER_EQUAL)
    );

    private static final Map<Character, TokenType> SINGLE_CHAR_TOKENS = Map.ofEntries(
            Map.entry('+', TokenType.PLUS),
            Map.entry('-', TokenType.MINUS),
            Map.entry('*', TokenType.STAR),
            Map.entry('/', TokenType.SLASH),
            Map.entry('%', TokenType.PERCENT),
            Map.entry('=', TokenType.ASSIGN),
            Map.entry('<', TokenType.LESS),
            Map.entry('>', TokenType.GREATER),
            Map.entry('!', TokenType.BANG),
            Map.entry('?', TokenType.QUESTION),
            Map.entry(':', TokenType.COLON),
            Map.entry('(', TokenType.LEFT_PAREN),
            Map.entry(')', TokenType.RIGHT_PAREN),
            Map.entry('{', TokenType.LEFT_BRACE),
            Map.entry('}', TokenType.RIGHT_BRACE),
            Map.entry('[', TokenType.LEFT_BRACKET),
            Map.entry(']', TokenType.RIGHT_BRACKET),
            Map.entry(';', TokenType.SEMICOLON),
            Map.entry(',', TokenType.COMMA)
    );

    /** Characters that end the skipped run after an unknown character. */
    private static final Set<Character> DELIMITERS = Set.of(';', ',', '(', ')', '{', '}', '[', ']');

    private Lexicon() {}

    /**
     * Looks up a reserved word. Matching is exact and case-sensitive.
     * @param text The identifier-shaped lexeme.
     * @return The keyword's token type, or empty if {@code text} is an ordinary identifier.
     */
    public static Optional<TokenType> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    /**
     * Looks up a two-character operator.
     * @param text A two-character lexeme candidate.
     * @return The operator's token type, or empty if there is no such operator.
     */
    public static Optional<TokenType> twoCharOperator(String text) {
        return Optional.ofNullable(TWO_CHAR_OPERATORS.get(text));
    }

    /**
     * Looks up a single-character operator or punctuation mark.
     * @param c The character.
     * @return The token type, or empty if {@code c} cannot start an operator token.
     */
    public static Optional<TokenType> singleCharToken(char c) {
        return Optional.ofNullable(SINGLE_CHAR_TOKENS.get(c));
    }

    public static boolean isDelimiter(char c) {
        return DELIMITERS.contains(c);
    }

    /**
     * Returns the source spelling of a fixed-spelling token type, for messages.
     * @param type The token type.
     * @return The spelling, e.g. {@code ";"} or {@code "agr"}, or a readable name for
     *         types without a fixed spelling (identifiers, literals, end of input).
     */
    public static String spelling(TokenType type) {
        for (Map.Entry<String, TokenType> e : KEYWORDS.entrySet()) {
            if (e.getValue() == type) return e.getKey();
        }
        for (Map.Entry<String, TokenType> e : TWO_CHAR_OPERATORS.entrySet()) {
            if (e.getValue() == type) return e.getKey();
        }
        for (Map.Entry<Character, TokenType> e : SINGLE_CHAR_TOKENS.entrySet()) {
            if (e.getValue() == type) return String.valueOf(e.getKey());
        }
        return switch (type) {
            case IDENTIFIER -> "identifier";
            case INTEGER_LITERAL -> "integer literal";
            case FLOAT_LITERAL -> "float literal";
            case STRING_LITERAL -> "string literal";
            case CHAR_LITERAL -> "character literal";
            case END_OF_FILE -> "end of input";
            default -> type.name().toLowerCase();
        };
    }
}
