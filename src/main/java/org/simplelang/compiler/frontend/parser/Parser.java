package org.simplelang.compiler.frontend.parser;

import org.simplelang.compiler.diagnostics.DiagnosticsEngine;
import org.simplelang.compiler.diagnostics.ErrorKind;
import org.simplelang.compiler.frontend.lexer.Lexicon;
import org.simplelang.compiler.frontend.lexer.Token;
import org.simplelang.compiler.frontend.lexer.TokenType;
import org.simplelang.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.simplelang.compiler.frontend.parser.ast.AssignmentNode;
import org.simplelang.compiler.frontend.parser.ast.BinaryNode;
import org.simplelang.compiler.frontend.parser.ast.BlockNode;
import org.simplelang.compiler.frontend.parser.ast.BreakNode;
import org.simplelang.compiler.frontend.parser.ast.ConditionalNode;
import org.simplelang.compiler.frontend.parser.ast.ContinueNode;
import org.simplelang.compiler.frontend.parser.ast.DeclarationNode;
import org.simplelang.compiler.frontend.parser.ast.DoWhileNode;
import org.simplelang.compiler.frontend.parser.ast.ExpressionNode;
import org.simplelang.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.simplelang.compiler.frontend.parser.ast.ForNode;
import org.simplelang.compiler.frontend.parser.ast.IdentifierNode;
import org.simplelang.compiler.frontend.parser.ast.IfNode;
import org.simplelang.compiler.frontend.parser.ast.InputNode;
import org.simplelang.compiler.frontend.parser.ast.LiteralKind;
import org.simplelang.compiler.frontend.parser.ast.LiteralNode;
import org.simplelang.compiler.frontend.parser.ast.PostfixNode;
import org.simplelang.compiler.frontend.parser.ast.PostfixOperation;
import org.simplelang.compiler.frontend.parser.ast.PrintNode;
import org.simplelang.compiler.frontend.parser.ast.ProgramNode;
import org.simplelang.compiler.frontend.parser.ast.ReturnNode;
import org.simplelang.compiler.frontend.parser.ast.StatementNode;
import org.simplelang.compiler.frontend.parser.ast.TypeSpec;
import org.simplelang.compiler.frontend.parser.ast.UnaryNode;
import org.simplelang.compiler.frontend.parser.ast.WhileNode;
import org.simplelang.compiler.api.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The recursive-descent parser for SimpleLang. It consumes a list of tokens
 * from the {@link org.simplelang.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax
 * Tree (AST). Binary expressions are parsed by precedence climbing over
 * {@link OperatorPrecedence}.
 * <p>
 * Syntax errors are not thrown. A parse method that cannot complete its production reports one
 * diagnostic, returns {@code null}, and the enclosing statement discards tokens up to the next
 * synchronization point (a consumed {@code ;}, a brace, end of input or a statement keyword)
 * before parsing resumes. Tokens of type {@link TokenType#INVALID} were already
 * reported by the lexer and only trigger recovery.
 * <p>
 * A Parser instance parses its token list once and is not thread-safe.
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    /** Maximum recursion depth used when none is configured. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private static final Set<TokenType> STATEMENT_KEYWORDS = EnumSet.of(
            TokenType.INT, TokenType.FLOAT, TokenType.BOOL, TokenType.STRING, TokenType.CHAR,
            TokenType.AGR, TokenType.JABTAK, TokenType.TABTAK, TokenType.DO, TokenType.BREAK,
            TokenType.CONTINUE, TokenType.RETURN, TokenType.DIKHAO, TokenType.LIKHO);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final int maxNestingDepth;
    private int current = 0;
    private int depth = 0;
    private boolean abandoned = false;
    private boolean needsSync = false;

    /**
     * Constructs a new Parser with the default nesting limit.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     * @param maxNestingDepth The deepest statement/expression nesting accepted before the parse
     *                        is abandoned with a {@link ErrorKind#NESTING_TOO_DEEP} error.
     * @throws IllegalStateException if the token list is not terminated by end of input.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, int maxNestingDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalStateException("Token list must end with END_OF_FILE");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses the entire token stream.
     * @return The program together with all diagnostics collected so far.
     */
    public ParseResult parse() {
        SourcePosition start = peek().position();
        List<StatementNode> statements = new ArrayList<>();
        statementList(statements, false);
        if (abandoned) {
            current = tokens.size() - 1;
        }
        ProgramNode program = new ProgramNode(statements, start);
        log.debug("Parsed {} top-level statements from {} ({} diagnostics)",
                statements.size(), diagnostics.getFileName(), diagnostics.getDiagnostics().size());
        return new ParseResult(program, diagnostics.getDiagnostics());
    }

    private void statementList(List<StatementNode> out, boolean inBlock) {
        while (!isAtEnd() && !stopped() && !(inBlock && check(TokenType.RIGHT_BRACE))) {
            int before = current;
            StatementNode statement = statement();
            if (statement != null) {
                out.add(statement);
            } else if (current == before && !isAtEnd() && !stopped()) {
                // Every failed statement consumes at least one token.
                advance();
            }
        }
    }

    // --- Statements ---

    private StatementNode statement() {
        depth++;
        try {
            if (tooDeep()) return null;
            StatementNode result = null;
            if (check(TokenType.VARNA)) {
                reportUnexpected(peek(), "statement ('varna' without a matching 'agr')");
            } else {
                result = statementByKeyword();
            }
            if (result == null && needsSync && !stopped()) {
                synchronize();
            }
            return result;
        } finally {
            depth--;
        }
    }

    private StatementNode statementByKeyword() {
        Token token = peek();
        return switch (token.type()) {
            case INT, FLOAT, BOOL, STRING, CHAR -> declaration();
            case AGR -> ifStatement();
            case JABTAK -> whileStatement();
            case DO -> doWhileStatement();
            case TABTAK -> forStatement();
            case BREAK -> breakStatement();
            case CONTINUE -> continueStatement();
            case RETURN -> returnStatement();
            case DIKHAO -> printStatement();
            case LIKHO -> inputStatement();
            case LEFT_BRACE -> block();
            case IDENTIFIER -> peekNext().type().isAssignmentOperator()
                    ? assignmentStatement()
                    : expressionStatement();
            default -> expressionStatement();
        };
    }

    private StatementNode declaration() {
        Token typeToken = advance();
        int arrayDepth = 0;
        while (match(TokenType.LEFT_BRACKET)) {
            if (!consume(TokenType.RIGHT_BRACKET, "in array type")) return null;
            arrayDepth++;
        }
        Token name = identifier("variable name");
        if (name == null) return null;

        ExpressionNode initializer = null;
        if (match(TokenType.ASSIGN)) {
            initializer = expression();
            if (initializer == null) return null;
        }
        if (!consumeOrAssume(TokenType.SEMICOLON, "after declaration")) return null;
        return new DeclarationNode(new TypeSpec(typeToken.type(), arrayDepth), name.text(), initializer, typeToken.position());
    }

    private StatementNode assignmentStatement() {
        StatementNode assignment = assignmentExpression();
        if (assignment == null) return null;
        if (!consumeOrAssume(TokenType.SEMICOLON, "after assignment")) return null;
        return assignment;
    }

    /**
     * Parses the restricted assignment form allowed in statement position and in for-loop
     * clauses: {@code x op= e}, {@code x++}, {@code x--}, {@code ++x} or {@code --x}.
     */
    private StatementNode assignmentExpression() {
        if (check(TokenType.IDENTIFIER) && peekNext().type().isAssignmentOperator()) {
            Token name = advance();
            Token operator = advance();
            ExpressionNode value = expression();
            if (value == null) return null;
            IdentifierNode target = new IdentifierNode(name.text(), name.position());
            return new AssignmentNode(target, operator.type(), value, name.position());
        }
        if (check(TokenType.IDENTIFIER)
                && (peekNext().type() == TokenType.INCREMENT || peekNext().type() == TokenType.DECREMENT)) {
            Token name = advance();
            Token operator = advance();
            PostfixOperation operation = operator.type() == TokenType.INCREMENT
                    ? new PostfixOperation.Increment()
                    : new PostfixOperation.Decrement();
            IdentifierNode target = new IdentifierNode(name.text(), name.position());
            return new ExpressionStatementNode(new PostfixNode(target, operation, name.position()), name.position());
        }
        if ((check(TokenType.INCREMENT) || check(TokenType.DECREMENT)) && peekNext().type() == TokenType.IDENTIFIER) {
            Token operator = advance();
            Token name = advance();
            IdentifierNode target = new IdentifierNode(name.text(), name.position());
            return new ExpressionStatementNode(
                    new UnaryNode(operator.type(), target, true, operator.position()), operator.position());
        }
        reportUnexpected(peek(), "assignment, increment or decrement");
        return null;
    }

    private StatementNode ifStatement() {
        Token keyword = advance();
        if (!consume(TokenType.LEFT_PAREN, "after 'agr'")) return null;
        ExpressionNode condition = expression();
        if (condition == null) return null;
        if (!consumeOrAssume(TokenType.RIGHT_PAREN, "after condition")) return null;

        StatementNode thenBranch = statement();
        if (thenBranch == null && stopped()) return null;

        // A 'varna' binds to the nearest 'agr' that has no 'varna' yet.
        StatementNode elseBranch = null;
        boolean hasElse = match(TokenType.VARNA);
        if (hasElse) {
            elseBranch = statement();
        }
        if (thenBranch == null || (hasElse && elseBranch == null)) return null;
        return new IfNode(condition, thenBranch, elseBranch, keyword.position());
    }

    private StatementNode whileStatement() {
        Token keyword = advance();
        if (!consume(TokenType.LEFT_PAREN, "after 'jabtak'")) return null;
        ExpressionNode condition = expression();
        if (condition == null) return null;
        if (!consumeOrAssume(TokenType.RIGHT_PAREN, "after condition")) return null;
        StatementNode body = statement();
        if (body == null) return null;
        return new WhileNode(condition, body, keyword.position());
    }

    private StatementNode doWhileStatement() {
        Token keyword = advance();
        StatementNode body = statement();
        if (body == null && (stopped() || !check(TokenType.JABTAK))) return null;
        if (!consume(TokenType.JABTAK, "after 'do' body")) return null;
        if (!consume(TokenType.LEFT_PAREN, "after 'jabtak'")) return null;
        ExpressionNode condition = expression();
        if (condition == null) return null;
        if (!consumeOrAssume(TokenType.RIGHT_PAREN, "after condition")) return null;
        if (!consumeOrAssume(TokenType.SEMICOLON, "after 'do' loop")) return null;
        if (body == null) return null;
        return new DoWhileNode(body, condition, keyword.position());
    }

    private StatementNode forStatement() {
        Token keyword = advance();
        if (!consume(TokenType.LEFT_PAREN, "after 'tabtak'")) return null;
        ForHeader header = forHeader();
        if (header == null) {
            if (stopped()) return null;
            boolean closed = skipForHeader();
            needsSync = false;
            if (closed) {
                // The body is still checked; the loop itself is dropped.
                statement();
            }
            return null;
        }
        StatementNode body = statement();
        if (body == null) return null;
        return new ForNode(header.init(), header.condition(), header.update(), body, keyword.position());
    }

    private record ForHeader(StatementNode init, ExpressionNode condition, List<StatementNode> update) {
    }

    private ForHeader forHeader() {
        StatementNode init = null;
        if (!match(TokenType.SEMICOLON)) {
            if (peek().type().isTypeKeyword()) {
                init = declaration();
                if (init == null) return null;
            } else {
                init = assignmentExpression();
                if (init == null) return null;
                if (!consume(TokenType.SEMICOLON, "after loop initializer")) return null;
            }
        }

        ExpressionNode condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = expression();
            if (condition == null) return null;
        }
        if (!consume(TokenType.SEMICOLON, "after loop condition")) return null;

        List<StatementNode> update = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                StatementNode clause = assignmentExpression();
                if (clause == null) return null;
                update.add(clause);
            } while (match(TokenType.COMMA));
        }
        if (!consumeOrAssume(TokenType.RIGHT_PAREN, "after loop header")) return null;
        return new ForHeader(init, condition, update);
    }

    /**
     * Discards the rest of a broken for-loop header up to and including its closing parenthesis,
     * so the semicolons inside the header are not taken as statement ends.
     */
    /**
     * Skips the rest of a broken for-loop header up to its closing parenthesis.
     * @return {@code true} if the closing parenthesis was consumed.
     */
    private boolean skipForHeader() {
        int open = 1;
        while (!isAtEnd() && open > 0) {
            TokenType type = peek().type();
            if (type == TokenType.LEFT_BRACE || type == TokenType.RIGHT_BRACE || STATEMENT_KEYWORDS.contains(type)) {
                return false;
            }
            if (type == TokenType.LEFT_PAREN) open++;
            if (type == TokenType.RIGHT_PAREN) open--;
            advance();
        }
        return open == 0;
    }

    private StatementNode breakStatement() {
        Token keyword = advance();
        if (!consumeOrAssume(TokenType.SEMICOLON, "after 'break'")) return null;
        return new BreakNode(keyword.position());
    }

    private StatementNode continueStatement() {
        Token keyword = advance();
        if (!consumeOrAssume(TokenType.SEMICOLON, "after 'continue'")) return null;
        return new ContinueNode(keyword.position());
    }

    private StatementNode returnStatement() {
        Token keyword = advance();
        ExpressionNode value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
            if (value == null) return null;
        }
        if (!consumeOrAssume(TokenType.SEMICOLON, "after 'return'")) return null;
        return new ReturnNode(value, keyword.position());
    }

    private StatementNode printStatement() {
        Token keyword = advance();
        if (!consume(TokenType.LEFT_PAREN, "after 'dikhao'")) return null;
        List<ExpressionNode> arguments = new ArrayList<>();
        do {
            ExpressionNode argument = expression();
            if (argument == null) return null;
            arguments.add(argument);
        } while (match(TokenType.COMMA));
        if (!consumeOrAssume(TokenType.RIGHT_PAREN, "after 'dikhao' arguments")) return null;
        if (!consumeOrAssume(TokenType.SEMICOLON, "after 'dikhao' statement")) return null;
        return new PrintNode(arguments, keyword.position());
    }

    private StatementNode inputStatement() {
        Token keyword = advance();
        if (!consume(TokenType.LEFT_PAREN, "after 'likho'")) return null;
        Token name = identifier("variable name");
        if (name == null) return null;
        if (!consumeOrAssume(TokenType.RIGHT_PAREN, "after 'likho' target")) return null;
        if (!consumeOrAssume(TokenType.SEMICOLON, "after 'likho' statement")) return null;
        return new InputNode(new IdentifierNode(name.text(), name.position()), keyword.position());
    }

    private StatementNode block() {
        Token brace = advance();
        List<StatementNode> statements = new ArrayList<>();
        statementList(statements, true);
        if (stopped()) return null;
        if (!check(TokenType.RIGHT_BRACE)) {
            reportUnexpected(peek(), "'}' to close the block opened at " + brace.position());
            return null;
        }
        advance();
        return new BlockNode(statements, brace.position());
    }

    private StatementNode expressionStatement() {
        ExpressionNode expression = expression();
        if (expression == null) return null;
        if (!consumeOrAssume(TokenType.SEMICOLON, "after expression")) return null;
        return new ExpressionStatementNode(expression, expression.position());
    }

    // --- Expressions ---

    private ExpressionNode expression() {
        return conditional();
    }

    private ExpressionNode conditional() {
        depth++;
        try {
            if (tooDeep()) return null;
            ExpressionNode condition = binary(OperatorPrecedence.LOGICAL_OR);
            if (condition == null) return null;
            if (!match(TokenType.QUESTION)) return condition;

            ExpressionNode thenValue = expression();
            if (thenValue == null) return null;
            if (!consume(TokenType.COLON, "in conditional expression")) return null;
            // Right-associative: a ? b : c ? d : e is a ? b : (c ? d : e).
            ExpressionNode elseValue = conditional();
            if (elseValue == null) return null;
            return new ConditionalNode(condition, thenValue, elseValue, condition.position());
        } finally {
            depth--;
        }
    }

    /**
     * Precedence climbing: folds operators of at least {@code minPrecedence} to the left, parsing
     * each right operand at the next higher level.
     */
    private ExpressionNode binary(int minPrecedence) {
        ExpressionNode left = unary();
        if (left == null) return null;
        while (true) {
            int precedence = OperatorPrecedence.binary(peek().type());
            if (precedence == OperatorPrecedence.NONE || precedence < minPrecedence) {
                return left;
            }
            Token operator = advance();
            ExpressionNode right = binary(precedence + 1);
            if (right == null) return null;
            left = new BinaryNode(operator.type(), left, right, left.position());
        }
    }

    private ExpressionNode unary() {
        depth++;
        try {
            if (tooDeep()) return null;
            if (match(TokenType.BANG, TokenType.MINUS, TokenType.PLUS, TokenType.INCREMENT, TokenType.DECREMENT)) {
                Token operator = previous();
                ExpressionNode operand = unary();
                if (operand == null) return null;
                return new UnaryNode(operator.type(), operand, true, operator.position());
            }
            return postfix();
        } finally {
            depth--;
        }
    }

    private ExpressionNode postfix() {
        ExpressionNode expression = primary();
        if (expression == null) return null;
        while (true) {
            PostfixOperation operation;
            if (match(TokenType.LEFT_BRACKET)) {
                ExpressionNode index = expression();
                if (index == null) return null;
                if (!consumeOrAssume(TokenType.RIGHT_BRACKET, "after index")) return null;
                operation = new PostfixOperation.Index(index);
            } else if (match(TokenType.LEFT_PAREN)) {
                List<ExpressionNode> arguments = arguments();
                if (arguments == null) return null;
                operation = new PostfixOperation.Call(arguments);
            } else if (match(TokenType.INCREMENT)) {
                operation = new PostfixOperation.Increment();
            } else if (match(TokenType.DECREMENT)) {
                operation = new PostfixOperation.Decrement();
            } else {
                return expression;
            }
            expression = new PostfixNode(expression, operation, expression.position());
        }
    }

    private List<ExpressionNode> arguments() {
        List<ExpressionNode> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                ExpressionNode argument = expression();
                if (argument == null) return null;
                arguments.add(argument);
            } while (match(TokenType.COMMA));
        }
        if (!consumeOrAssume(TokenType.RIGHT_PAREN, "after call arguments")) return null;
        return arguments;
    }

    private ExpressionNode primary() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER_LITERAL -> {
                advance();
                return new LiteralNode(LiteralKind.INTEGER, token.value(), token.position());
            }
            case FLOAT_LITERAL -> {
                advance();
                return new LiteralNode(LiteralKind.FLOAT, token.value(), token.position());
            }
            case TRUE, FALSE -> {
                advance();
                return new LiteralNode(LiteralKind.BOOLEAN, token.type() == TokenType.TRUE, token.position());
            }
            case STRING_LITERAL -> {
                advance();
                return new LiteralNode(LiteralKind.STRING, token.value(), token.position());
            }
            case CHAR_LITERAL -> {
                advance();
                return new LiteralNode(LiteralKind.CHAR, token.value(), token.position());
            }
            case IDENTIFIER -> {
                advance();
                return new IdentifierNode(token.text(), token.position());
            }
            case LEFT_PAREN -> {
                advance();
                ExpressionNode inner = expression();
                if (inner == null) return null;
                if (!consumeOrAssume(TokenType.RIGHT_PAREN, "after parenthesized expression")) return null;
                return inner;
            }
            case LEFT_BRACKET -> {
                advance();
                List<ExpressionNode> elements = new ArrayList<>();
                if (!check(TokenType.RIGHT_BRACKET)) {
                    do {
                        ExpressionNode element = expression();
                        if (element == null) return null;
                        elements.add(element);
                    } while (match(TokenType.COMMA));
                }
                if (!consumeOrAssume(TokenType.RIGHT_BRACKET, "after array elements")) return null;
                return new ArrayLiteralNode(elements, token.position());
            }
            default -> {
                reportUnexpected(token, "expression");
                return null;
            }
        }
    }

    // --- Error reporting and recovery ---

    private boolean stopped() {
        return abandoned || diagnostics.shouldHalt();
    }

    private boolean tooDeep() {
        if (depth <= maxNestingDepth) return false;
        if (!abandoned) {
            Token at = peek();
            diagnostics.reportError(ErrorKind.NESTING_TOO_DEEP,
                    "Nesting exceeds the maximum depth of " + maxNestingDepth + "; the rest of the input is skipped",
                    at.line(), at.column());
            abandoned = true;
            log.debug("Abandoned parse of {} at {}: nesting deeper than {}",
                    diagnostics.getFileName(), at.position(), maxNestingDepth);
        }
        return true;
    }

    /**
     * Discards tokens until a synchronization point. A {@code ;} is consumed; braces, statement
     * keywords and end of input are left for the caller.
     */
    private void synchronize() {
        needsSync = false;
        while (!isAtEnd()) {
            if (match(TokenType.SEMICOLON)) return;
            TokenType type = peek().type();
            if (type == TokenType.LEFT_BRACE || type == TokenType.RIGHT_BRACE || STATEMENT_KEYWORDS.contains(type)) {
                return;
            }
            advance();
        }
    }

    private boolean isSynchronizationPoint(TokenType type) {
        return type == TokenType.SEMICOLON || type == TokenType.LEFT_BRACE || type == TokenType.RIGHT_BRACE
                || type == TokenType.END_OF_FILE || STATEMENT_KEYWORDS.contains(type);
    }

    private void reportUnexpected(Token found, String expected) {
        needsSync = true;
        if (found.type() == TokenType.INVALID) {
            // Already reported by the lexer.
            return;
        }
        if (found.type() == TokenType.END_OF_FILE) {
            diagnostics.reportError(ErrorKind.UNEXPECTED_EOF,
                    "Unexpected end of input, expected " + expected, found.line(), found.column());
            return;
        }
        diagnostics.reportError(ErrorKind.UNEXPECTED_TOKEN,
                "Unexpected token '" + found.text() + "', expected " + expected, found.line(), found.column());
    }

    /**
     * Consumes a required token. A missing token is an error and the production is abandoned.
     * @return {@code true} if the token was present.
     */
    private boolean consume(TokenType type, String context) {
        if (check(type)) {
            advance();
            return true;
        }
        if (reportMissing(type, context)) {
            needsSync = true;
        }
        return false;
    }

    /**
     * Consumes a required closing token. If it is missing but the token found instead is a
     * synchronization point, one {@link ErrorKind#MISSING_TOKEN} error is reported and parsing
     * continues as if the token had been present.
     * @return {@code true} if parsing of the current production may continue.
     */
    private boolean consumeOrAssume(TokenType type, String context) {
        if (check(type)) {
            advance();
            return true;
        }
        return reportMissing(type, context);
    }

    private boolean reportMissing(TokenType type, String context) {
        Token found = peek();
        String expected = "'" + Lexicon.spelling(type) + "' " + context;
        if (found.type() == TokenType.INVALID || found.type() == TokenType.END_OF_FILE
                || !isSynchronizationPoint(found.type())) {
            reportUnexpected(found, expected);
            return false;
        }
        // Report right after the previous token, where the missing one belongs.
        Token before = current > 0 ? previous() : found;
        int column = before == found ? found.column() : before.column() + before.text().length();
        diagnostics.reportError(ErrorKind.MISSING_TOKEN, "Missing " + expected, before.line(), column);
        return true;
    }

    private Token identifier(String what) {
        if (check(TokenType.IDENTIFIER)) {
            return advance();
        }
        reportUnexpected(peek(), what);
        return null;
    }

    // --- Token cursor ---

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        if (current + 1 >= tokens.size()) return peek();
        return tokens.get(current + 1);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
