package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.frontend.lexer.TokenType;

/**
 * The declared type of a variable: a type keyword plus the number of {@code []} suffixes.
 *
 * @param keyword One of {@code INT, FLOAT, BOOL, STRING, CHAR}.
 * @param arrayDepth The number of array dimensions, 0 for a scalar.
 */
public record TypeSpec(TokenType keyword, int arrayDepth) {

    public TypeSpec {
        if (!keyword.isTypeKeyword()) {
            throw new IllegalArgumentException("Not a type keyword: " + keyword);
        }
        if (arrayDepth < 0) {
            throw new IllegalArgumentException("Negative array depth: " + arrayDepth);
        }
    }

    @Override
    public String toString() {
        return keyword.name().toLowerCase() + "[]".repeat(arrayDepth);
    }
}
