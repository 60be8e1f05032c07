package org.simplelang.compiler.diagnostics;

/**
 * The fixed set of error kinds the frontend reports. Each kind belongs to exactly one
 * {@link Family}.
 */
public enum ErrorKind {
    /** A string literal that runs into a newline or the end of input. */
    UNTERMINATED_STRING(Family.LEXICAL),
    /** A character literal that is empty, holds more than one character or is not closed. */
    UNTERMINATED_CHAR(Family.LEXICAL),
    /** An escape sequence that is not one of {@code \\ \" \n \t \r \0 \'} or {@code \xHH}. */
    INVALID_ESCAPE_SEQUENCE(Family.LEXICAL),
    /** A number-like run that is not a valid integer or float literal. */
    INVALID_NUMBER_FORMAT(Family.LEXICAL),
    /** A character that cannot start any token. */
    UNKNOWN_CHARACTER(Family.LEXICAL),

    /** A token that cannot continue the current production. */
    UNEXPECTED_TOKEN(Family.SYNTAX),
    /** A single required token (e.g. {@code ;} or {@code )}) is absent. */
    MISSING_TOKEN(Family.SYNTAX),
    /** The input ended inside an unfinished construct. */
    UNEXPECTED_EOF(Family.SYNTAX),
    /** The source nests deeper than the configured maximum depth. */
    NESTING_TOO_DEEP(Family.SYNTAX);

    /**
     * The two top-level error families.
     */
    public enum Family {
        LEXICAL,
        SYNTAX
    }

    private final Family family;

    ErrorKind(Family family) {
        this.family = family;
    }

    public Family family() {
        return family;
    }
}
