package org.simplelang.compiler.frontend.lexer;

import org.simplelang.compiler.api.SourcePosition;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., keyword, identifier, operator).
 * @param text The exact text of the token from the source code.
 * @param value The decoded value of a literal token (e.g., the {@link Long} of an integer
 *              literal, the unescaped content of a string), or null for all other tokens.
 * @param line The line number where the token was found (1-based).
 * @param column The column number where the token begins (1-based).
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {

    /**
     * Returns the position of the first character of this token.
     * @return The source position.
     */
    public SourcePosition position() {
        return new SourcePosition(line, column);
    }

    @Override
    public String toString() {
        return String.format("%s '%s' %d:%d", type, text, line, column);
    }
}
