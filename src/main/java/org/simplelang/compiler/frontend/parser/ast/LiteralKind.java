package org.simplelang.compiler.frontend.parser.ast;

/**
 * The kind of value a {@link LiteralNode} holds.
 */
public enum LiteralKind {
    /** Value is a {@link Long}. */
    INTEGER,
    /** Value is a {@link Double}. */
    FLOAT,
    /** Value is a {@link Boolean}. */
    BOOLEAN,
    /** Value is a {@link String}. */
    STRING,
    /** Value is a {@link Character}. */
    CHAR
}
