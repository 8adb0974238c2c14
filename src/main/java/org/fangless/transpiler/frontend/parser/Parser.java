package org.fangless.transpiler.frontend.parser;

import org.fangless.transpiler.api.SourceInfo;
import org.fangless.transpiler.api.TranspilerErrorCode;
import org.fangless.transpiler.diagnostics.DiagnosticsEngine;
import org.fangless.transpiler.frontend.lexer.Token;
import org.fangless.transpiler.frontend.lexer.TokenType;
import org.fangless.transpiler.frontend.parser.ast.*;
import org.fangless.transpiler.frontend.parser.ast.Module;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The statement parser. It consumes the list of tokens produced by the
 * {@link org.fangless.transpiler.frontend.lexer.Lexer} and builds a {@link Module}.
 * Expressions are delegated to an {@link ExpressionParser} sharing this parser's cursor.
 * <p>
 * Parsing stops at the first error: it is reported to the {@link DiagnosticsEngine}
 * and a {@link ParseException} is thrown.
 */
public class Parser implements ParsingContext {

    private static final Map<TokenType, AssignOperator> AUGMENTED_OPERATORS = Map.of(
            TokenType.PLUS_EQUAL, AssignOperator.ADD,
            TokenType.MINUS_EQUAL, AssignOperator.SUB,
            TokenType.STAR_EQUAL, AssignOperator.MUL,
            TokenType.SLASH_EQUAL, AssignOperator.DIV,
            TokenType.DOUBLE_SLASH_EQUAL, AssignOperator.FLOOR_DIV,
            TokenType.PERCENT_EQUAL, AssignOperator.MOD,
            TokenType.DOUBLE_STAR_EQUAL, AssignOperator.POW);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final ExpressionParser expressions;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.expressions = new ExpressionParser(this);
    }

    /**
     * Parses the entire token stream.
     * @return The module containing every top-level statement in source order.
     * @throws ParseException at the first syntax error.
     */
    public Module parse() {
        SourceInfo start = peek().sourceInfo();
        List<Stmt> body = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            body.addAll(statement());
        }
        return new Module(body, start);
    }

    /**
     * Parses one statement. A simple-statement line may yield several statements
     * ({@code a = 1; b = 2} or a chained assignment).
     * @return The parsed statements.
     */
    List<Stmt> statement() {
        if (match(TokenType.DEF)) return List.of(functionDef());
        if (match(TokenType.IF)) return List.of(ifStatement());
        if (match(TokenType.WHILE)) return List.of(whileStatement());
        if (match(TokenType.FOR)) return List.of(forStatement());
        if (check(TokenType.INDENT)) {
            throw error(peek(), "Unexpected indent.", TranspilerErrorCode.SYNTAX_ERROR);
        }
        return simpleStatementLine();
    }

    private List<Stmt> simpleStatementLine() {
        List<Stmt> statements = new ArrayList<>(simpleStatement());
        while (match(TokenType.SEMICOLON)) {
            if (check(TokenType.NEWLINE) || isAtEnd()) {
                break;
            }
            statements.addAll(simpleStatement());
        }
        if (!isAtEnd()) {
            consume(TokenType.NEWLINE, "Expected end of line after statement.");
        }
        return statements;
    }

    private List<Stmt> simpleStatement() {
        Token token = peek();
        switch (token.type()) {
            case PASS:
                advance();
                return List.of(new Pass(token.sourceInfo()));
            case BREAK:
                advance();
                return List.of(new Break(token.sourceInfo()));
            case CONTINUE:
                advance();
                return List.of(new Continue(token.sourceInfo()));
            case RETURN:
                advance();
                Expr value = ExpressionParser.startsExpression(peek().type()) ? expressions.expressionList() : null;
                return List.of(new Return(value, token.sourceInfo()));
            case IMPORT:
                advance();
                return importStatement(token);
            case FROM:
                advance();
                return List.of(fromImportStatement(token));
            case UNSUPPORTED_KEYWORD:
                throw error(token, "'" + token.text() + "' is not supported.", TranspilerErrorCode.UNSUPPORTED_SYNTAX);
            default:
                return expressionOrAssignment();
        }
    }

    private List<Stmt> expressionOrAssignment() {
        Token start = peek();
        Expr first = expressions.expressionList();

        AssignOperator augmented = AUGMENTED_OPERATORS.get(peek().type());
        if (augmented != null) {
            Token operator = advance();
            if (!(first instanceof Identifier) && !(first instanceof Subscript) && !(first instanceof Attribute)) {
                throw error(operator, "Invalid target for augmented assignment.", TranspilerErrorCode.INVALID_ASSIGNMENT_TARGET);
            }
            Expr value = expressions.expressionList();
            if (AUGMENTED_OPERATORS.containsKey(peek().type()) || check(TokenType.EQUAL)) {
                throw error(peek(), "Augmented assignment cannot be chained.", TranspilerErrorCode.SYNTAX_ERROR);
            }
            return List.of(new Assign(first, augmented, value, start.sourceInfo()));
        }

        if (!check(TokenType.EQUAL)) {
            if (hasNoEffect(first)) {
                diagnostics.reportWarning("Statement has no effect.", start.sourceInfo());
            }
            return List.of(new ExprStmt(first, start.sourceInfo()));
        }

        List<Expr> targets = new ArrayList<>();
        List<Token> targetTokens = new ArrayList<>();
        targets.add(first);
        targetTokens.add(start);
        Expr value = null;
        while (match(TokenType.EQUAL)) {
            Token next = peek();
            value = expressions.expressionList();
            if (check(TokenType.EQUAL)) {
                targets.add(value);
                targetTokens.add(next);
            }
        }
        if (AUGMENTED_OPERATORS.containsKey(peek().type())) {
            throw error(peek(), "Augmented assignment cannot be chained.", TranspilerErrorCode.SYNTAX_ERROR);
        }
        for (int i = 0; i < targets.size(); i++) {
            validateTarget(targets.get(i), targetTokens.get(i));
        }

        // a = b = v becomes b = v; a = b
        List<Stmt> assignments = new ArrayList<>();
        Expr source = value;
        for (int i = targets.size() - 1; i >= 0; i--) {
            Expr target = targets.get(i);
            assignments.add(new Assign(target, AssignOperator.ASSIGN, source, targetTokens.get(i).sourceInfo()));
            source = target;
        }
        return assignments;
    }

    // String literals are docstrings.
    private static boolean hasNoEffect(Expr expr) {
        if (expr instanceof LiteralExpr literal) {
            return literal.kind() != LiteralExpr.Kind.STRING;
        }
        return expr instanceof Identifier;
    }

    private void validateTarget(Expr target, Token at) {
        if (target instanceof Identifier || target instanceof Subscript || target instanceof Attribute) {
            return;
        }
        if (target instanceof TupleExpr tuple && !tuple.elements().isEmpty()) {
            tuple.elements().forEach(element -> validateTarget(element, at));
            return;
        }
        if (target instanceof ListExpr list && !list.elements().isEmpty()) {
            list.elements().forEach(element -> validateTarget(element, at));
            return;
        }
        throw error(at, "Cannot assign to this expression.", TranspilerErrorCode.INVALID_ASSIGNMENT_TARGET);
    }

    private List<Stmt> importStatement(Token keyword) {
        List<Stmt> imports = new ArrayList<>();
        do {
            String module = dottedName();
            if (match(TokenType.AS)) {
                consume(TokenType.IDENTIFIER, "Expected alias name after 'as'.");
            }
            imports.add(new Import(module, List.of(), keyword.sourceInfo()));
        } while (match(TokenType.COMMA));
        return imports;
    }

    private Stmt fromImportStatement(Token keyword) {
        String module = dottedName();
        consume(TokenType.IMPORT, "Expected 'import' after module name.");
        List<String> names = new ArrayList<>();
        if (match(TokenType.STAR)) {
            names.add("*");
            return new Import(module, names, keyword.sourceInfo());
        }
        boolean parenthesized = match(TokenType.LEFT_PAREN);
        do {
            if (parenthesized && check(TokenType.RIGHT_PAREN)) {
                break;
            }
            names.add(consume(TokenType.IDENTIFIER, "Expected name to import.").text());
            if (match(TokenType.AS)) {
                consume(TokenType.IDENTIFIER, "Expected alias name after 'as'.");
            }
        } while (match(TokenType.COMMA));
        if (parenthesized) {
            consume(TokenType.RIGHT_PAREN, "Expected ')' after imported names.");
        }
        return new Import(module, names, keyword.sourceInfo());
    }

    private String dottedName() {
        StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, "Expected module name.").text());
        while (match(TokenType.DOT)) {
            name.append('.').append(consume(TokenType.IDENTIFIER, "Expected name after '.'.").text());
        }
        return name.toString();
    }

    private FunctionDef functionDef() {
        Token keyword = previous();
        Token name = consume(TokenType.IDENTIFIER, "Expected function name after 'def'.");
        consume(TokenType.LEFT_PAREN, "Expected '(' after function name.");
        List<Identifier> params = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            Token param = consume(TokenType.IDENTIFIER, "Expected parameter name.");
            if (check(TokenType.EQUAL)) {
                throw error(peek(), "Default parameter values are not supported.", TranspilerErrorCode.UNSUPPORTED_SYNTAX);
            }
            params.add(new Identifier(param.text(), param.sourceInfo()));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters.");
        Block body = suite();
        return new FunctionDef(name.text(), params, body.statements(), keyword.sourceInfo());
    }

    private If ifStatement() {
        Token keyword = previous();
        Expr condition = expressions.expression();
        Block body = suite();
        List<ElifClause> elifs = new ArrayList<>();
        while (match(TokenType.ELIF)) {
            Expr elifCondition = expressions.expression();
            elifs.add(new ElifClause(elifCondition, suite()));
        }
        Block orelse = match(TokenType.ELSE) ? suite() : null;
        return new If(condition, body, elifs, orelse, keyword.sourceInfo());
    }

    private While whileStatement() {
        Token keyword = previous();
        Expr condition = expressions.expression();
        Block body = suite();
        Block orelse = match(TokenType.ELSE) ? suite() : null;
        return new While(condition, body, orelse, keyword.sourceInfo());
    }

    private For forStatement() {
        Token keyword = previous();
        Token targetStart = peek();
        Expr target = expressions.targetList();
        validateTarget(target, targetStart);
        consume(TokenType.IN, "Expected 'in' after loop target.");
        Expr iterable = expressions.expressionList();
        Block body = suite();
        Block orelse = match(TokenType.ELSE) ? suite() : null;
        return new For(target, iterable, body, orelse, keyword.sourceInfo());
    }

    /**
     * Parses {@code ':' NEWLINE INDENT statement+ DEDENT}, or {@code ':'} followed by simple statements on the same line.
     */
    private Block suite() {
        consume(TokenType.COLON, "Expected ':' before block.");
        SourceInfo start = peek().sourceInfo();
        List<Stmt> statements = new ArrayList<>();
        if (!match(TokenType.NEWLINE)) {
            statements.addAll(simpleStatementLine());
            return new Block(statements, start);
        }
        consume(TokenType.INDENT, "Expected an indented block.");
        start = peek().sourceInfo();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            statements.addAll(statement());
        }
        if (!isAtEnd()) {
            consume(TokenType.DEDENT, "Expected dedent after block.");
        }
        return new Block(statements, start);
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        Token unexpected = peek();
        throw error(unexpected, errorMessage + " Found '" + ExpressionParser.describe(unexpected) + "'.",
                TranspilerErrorCode.SYNTAX_ERROR);
    }

    @Override
    public ParseException error(Token token, String message, TranspilerErrorCode code) {
        diagnostics.reportError(message, token.sourceInfo());
        return new ParseException(message, code, token.sourceInfo());
    }
}
