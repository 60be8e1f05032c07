package org.simplelang.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * The keyword spellings behind these types are listed in the {@link Lexicon}.
 */
public enum TokenType {
    // Keywords.
    /** {@code agr}, starts a conditional statement. */
    AGR,
    /** {@code varna}, the else-branch of an {@code agr}. */
    VARNA,
    /** {@code jabtak}, starts a while loop (and closes a do-while loop). */
    JABTAK,
    /** {@code tabtak}, starts a for loop. */
    TABTAK,
    DO,
    BREAK,
    CONTINUE,
    RETURN,
    /** {@code dikhao}, the print statement. */
    DIKHAO,
    /** {@code likho}, the input statement. */
    LIKHO,

    // Type keywords.
    INT,
    FLOAT,
    BOOL,
    STRING,
    CHAR,

    // Literals.
    /** An integer literal; the token value is a {@link Long}. */
    INTEGER_LITERAL,
    /** A floating-point literal; the token value is a {@link Double}. */
    FLOAT_LITERAL,
    /** A string literal; the token value is the decoded content without quotes. */
    STRING_LITERAL,
    /** A character literal; the token value is a {@link Character}. */
    CHAR_LITERAL,
    TRUE,
    FALSE,
    /** An identifier, such as a variable name. */
    IDENTIFIER,

    // Operators.
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    ASSIGN,
    PLUS_ASSIGN,
    MINUS_ASSIGN,
    STAR_ASSIGN,
    SLASH_ASSIGN,
    INCREMENT,
    DECREMENT,
    EQUAL_EQUAL,
    BANG_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    AND_AND,
    OR_OR,
    BANG,
    QUESTION,
    COLON,

    // Punctuation.
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    SEMICOLON,
    COMMA,

    // Miscellaneous.
    /** Represents the end of the source text. */
    END_OF_FILE,
    /** Represents a malformed lexeme that has already been reported as a lexical error. */
    INVALID;

    /**
     * Checks whether this type names one of the declarable types ({@code int}, {@code float},
     * {@code bool}, {@code string}, {@code char}).
     * @return true for type keywords.
     */
    public boolean isTypeKeyword() {
        return this == INT || this == FLOAT || this == BOOL || this == STRING || this == CHAR;
    }

    /**
     * Checks whether this type is an assignment operator ({@code =} or a compound assignment).
     * @return true for {@code = += -= *= /=}.
     */
    public boolean isAssignmentOperator() {
        return this == ASSIGN || this == PLUS_ASSIGN || this == MINUS_ASSIGN
                || this == STAR_ASSIGN || this == SLASH_ASSIGN;
    }
}
