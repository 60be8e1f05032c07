package org.simplelang.compiler.frontend.lexer;

import org.simplelang.compiler.diagnostics.DiagnosticsEngine;
import org.simplelang.compiler.diagnostics.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Lexical faults do not stop the scan: each one is reported once to the
 * {@link DiagnosticsEngine} and replaced by a single {@link TokenType#INVALID} token, after which
 * scanning resumes. The returned list always ends with exactly one
 * {@link TokenType#END_OF_FILE} token. A Lexer instance scans its source once.
 */
public class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    /** Number of columns a tab character advances. */
    public static final int TAB_WIDTH = 1;

    private static final Pattern INTEGER = Pattern.compile("0|[1-9][0-9]*");
    private static final Pattern FLOAT = Pattern.compile(
            "(?:(?:0|[1-9][0-9]*)?\\.[0-9]+(?:[eE][+-]?[0-9]+)?)|(?:(?:0|[1-9][0-9]*)[eE][+-]?[0-9]+)");

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd() && !diagnostics.shouldHalt()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column));
        log.debug("Lexed {} tokens from {}", tokens.size(), diagnostics.getFileName());
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // Ignore whitespace
            case ' ', '\r', '\t', '\n':
                break;
            case '"': string(); break;
            case '\'': character(); break;
            case '/':
                if (peek() == '/') {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    operator(c);
                }
                break;
            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    unknownCharacter(c);
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    operator(c);
                }
                break;
        }
    }

    private void operator(char c) {
        if (!isAtEnd()) {
            Optional<TokenType> twoChar = Lexicon.twoCharOperator("" + c + peek());
            if (twoChar.isPresent()) {
                advance();
                addToken(twoChar.get());
                return;
            }
        }
        Optional<TokenType> single = Lexicon.singleCharToken(c);
        if (single.isPresent()) {
            addToken(single.get());
        } else {
            unknownCharacter(c);
        }
    }

    private void unknownCharacter(char c) {
        diagnostics.reportError(ErrorKind.UNKNOWN_CHARACTER, "Unknown character '" + c + "'", startLine, startColumn);
        while (!isAtEnd() && !isWhitespace(peek()) && !Lexicon.isDelimiter(peek())) advance();
        addToken(TokenType.INVALID);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = Lexicon.keyword(text).orElse(TokenType.IDENTIFIER);
        if (type == TokenType.TRUE || type == TokenType.FALSE) {
            addToken(type, type == TokenType.TRUE);
        } else {
            addToken(type);
        }
    }

    private void number() {
        // Consume the whole number-like run so a malformed literal is reported once, not truncated.
        while (true) {
            char p = peek();
            if (isAlphaNumeric(p) || p == '.') {
                advance();
            } else if ((p == '+' || p == '-') && isExponentMarker(previous())) {
                advance();
            } else {
                break;
            }
        }

        String numberString = source.substring(start, current);
        if (INTEGER.matcher(numberString).matches()) {
            try {
                addToken(TokenType.INTEGER_LITERAL, Long.parseLong(numberString));
            } catch (NumberFormatException e) {
                invalidNumber("Integer literal out of range: " + numberString);
            }
        } else if (FLOAT.matcher(numberString).matches()) {
            double value = Double.parseDouble(numberString);
            if (Double.isInfinite(value)) {
                invalidNumber("Float literal out of range: " + numberString);
            } else {
                addToken(TokenType.FLOAT_LITERAL, value);
            }
        } else {
            invalidNumber("Invalid number format: " + numberString);
        }
    }

    private void invalidNumber(String message) {
        diagnostics.reportError(ErrorKind.INVALID_NUMBER_FORMAT, message, startLine, startColumn);
        addToken(TokenType.INVALID);
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        boolean malformed = false;
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                if (!malformed) {
                    diagnostics.reportError(ErrorKind.UNTERMINATED_STRING, "Unterminated string literal", startLine, startColumn);
                }
                addToken(TokenType.INVALID);
                return;
            }
            int escapeLine = line;
            int escapeColumn = column;
            char c = advance();
            if (c == '"') {
                break;
            }
            if (c == '\\' && !isAtEnd() && peek() != '\n') {
                Character decoded = escape();
                if (decoded == null) {
                    if (!malformed) {
                        reportInvalidEscape(escapeLine, escapeColumn);
                    }
                    malformed = true;
                } else {
                    value.append(decoded.charValue());
                }
            } else {
                value.append(c);
            }
        }

        if (malformed) {
            addToken(TokenType.INVALID);
        } else {
            // The text of the token is the string *with* quotes, the value is the content.
            addToken(TokenType.STRING_LITERAL, value.toString());
        }
    }

    private void character() {
        StringBuilder value = new StringBuilder();
        boolean malformed = false;
        while (!isAtEnd() && peek() != '\'' && peek() != '\n') {
            int escapeLine = line;
            int escapeColumn = column;
            char c = advance();
            if (c == '\\' && !isAtEnd() && peek() != '\n') {
                Character decoded = escape();
                if (decoded == null) {
                    if (!malformed) {
                        reportInvalidEscape(escapeLine, escapeColumn);
                    }
                    malformed = true;
                } else {
                    value.append(decoded.charValue());
                }
            } else {
                value.append(c);
            }
        }

        if (isAtEnd() || peek() == '\n') {
            if (!malformed) {
                diagnostics.reportError(ErrorKind.UNTERMINATED_CHAR, "Unterminated character literal", startLine, startColumn);
            }
            addToken(TokenType.INVALID);
            return;
        }

        // The closing '
        advance();
        if (value.length() == 0 && !malformed && peek() == '\'') {
            // Three quotes form a single malformed literal.
            advance();
        }

        if (malformed) {
            addToken(TokenType.INVALID);
        } else if (value.length() != 1) {
            diagnostics.reportError(ErrorKind.UNTERMINATED_CHAR,
                    "Character literal must contain exactly one character", startLine, startColumn);
            addToken(TokenType.INVALID);
        } else {
            addToken(TokenType.CHAR_LITERAL, value.charAt(0));
        }
    }

    /**
     * Decodes the escape sequence after a backslash that has already been consumed.
     * @return The decoded character, or null if the sequence is not a valid escape.
     */
    private Character escape() {
        char e = advance();
        switch (e) {
            case '\\': return '\\';
            case '"': return '"';
            case '\'': return '\'';
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            case 'x':
                if (isHexDigit(peek()) && isHexDigit(peekNext())) {
                    String hex = "" + advance() + advance();
                    return (char) Integer.parseInt(hex, 16);
                }
                return null;
            default:
                return null;
        }
    }

    private void reportInvalidEscape(int escapeLine, int escapeColumn) {
        int end = Math.min(source.length(), current);
        String sequence = source.substring(Math.max(start, end - 2), end);
        diagnostics.reportError(ErrorKind.INVALID_ESCAPE_SEQUENCE,
                "Invalid escape sequence '" + sequence + "'", escapeLine, escapeColumn);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else if (c == '\t') {
            column += TAB_WIDTH;
        } else {
            column++;
        }
        return c;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isExponentMarker(char c) {
        return c == 'e' || c == 'E';
    }

    private boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }
}
