package org.fangless.transpiler.frontend.parser;

import org.fangless.transpiler.api.SourceInfo;
import org.fangless.transpiler.api.TranspilerErrorCode;
import org.fangless.transpiler.frontend.lexer.Token;
import org.fangless.transpiler.frontend.lexer.TokenType;
import org.fangless.transpiler.frontend.parser.ast.Attribute;
import org.fangless.transpiler.frontend.parser.ast.BinaryExpr;
import org.fangless.transpiler.frontend.parser.ast.BinaryOperator;
import org.fangless.transpiler.frontend.parser.ast.CallExpr;
import org.fangless.transpiler.frontend.parser.ast.ComparisonExpr;
import org.fangless.transpiler.frontend.parser.ast.ComparisonOperator;
import org.fangless.transpiler.frontend.parser.ast.DictEntry;
import org.fangless.transpiler.frontend.parser.ast.DictExpr;
import org.fangless.transpiler.frontend.parser.ast.Expr;
import org.fangless.transpiler.frontend.parser.ast.Identifier;
import org.fangless.transpiler.frontend.parser.ast.ListExpr;
import org.fangless.transpiler.frontend.parser.ast.LiteralExpr;
import org.fangless.transpiler.frontend.parser.ast.SetExpr;
import org.fangless.transpiler.frontend.parser.ast.SliceExpr;
import org.fangless.transpiler.frontend.parser.ast.Subscript;
import org.fangless.transpiler.frontend.parser.ast.TupleExpr;
import org.fangless.transpiler.frontend.parser.ast.UnaryExpr;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parses expressions by recursive descent over the precedence chain, from loosest to tightest:
 * {@code or}, {@code and}, comparison, additive, multiplicative, power, unary, postfix, atom.
 * <p>
 * Unary operators bind tighter than {@code **}, so {@code -2 ** 2} is {@code (-2) ** 2}.
 * Power is right-associative. Comparisons are strictly binary; a chain such as
 * {@code a < b < c} is rejected.
 */
public class ExpressionParser {

    private static final Set<TokenType> EXPRESSION_STARTS = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.INTEGER, TokenType.FLOAT, TokenType.STRING,
            TokenType.TRUE, TokenType.FALSE, TokenType.NONE,
            TokenType.LEFT_PAREN, TokenType.LEFT_BRACKET, TokenType.LEFT_BRACE,
            TokenType.MINUS, TokenType.PLUS, TokenType.NOT);

    private final ParsingContext context;

    /**
     * Creates an expression parser that reads from the given context's cursor.
     * @param context The shared parsing context.
     */
    public ExpressionParser(ParsingContext context) {
        this.context = context;
    }

    /**
     * Parses one expression, or a bare comma-separated list of them which becomes a {@link TupleExpr}.
     * A trailing comma is allowed.
     * @return The parsed expression.
     */
    public Expr expressionList() {
        Token start = context.peek();
        Expr first = expression();
        if (!context.check(TokenType.COMMA)) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (context.match(TokenType.COMMA)) {
            if (!startsExpression(context.peek().type())) {
                break;
            }
            elements.add(expression());
        }
        return new TupleExpr(elements, start.sourceInfo());
    }

    /**
     * Parses the target list of a {@code for} loop: one or more postfix expressions separated by commas.
     * Stops before the {@code in} keyword so it is not taken for a membership test.
     * @return A single target, or a {@link TupleExpr} of targets.
     */
    public Expr targetList() {
        Token start = context.peek();
        Expr first = postfix();
        if (!context.check(TokenType.COMMA)) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (context.match(TokenType.COMMA)) {
            if (context.check(TokenType.IN)) {
                break;
            }
            elements.add(postfix());
        }
        return new TupleExpr(elements, start.sourceInfo());
    }

    /**
     * Parses a single expression without top-level commas.
     * @return The parsed expression.
     */
    public Expr expression() {
        return or();
    }

    /**
     * @param type A token type.
     * @return {@code true} if a token of this type can begin an expression.
     */
    public static boolean startsExpression(TokenType type) {
        return EXPRESSION_STARTS.contains(type);
    }

    private Expr or() {
        Expr expr = and();
        while (context.match(TokenType.OR)) {
            SourceInfo info = context.previous().sourceInfo();
            expr = new BinaryExpr(expr, BinaryOperator.OR, and(), info);
        }
        return expr;
    }

    private Expr and() {
        Expr expr = comparison();
        while (context.match(TokenType.AND)) {
            SourceInfo info = context.previous().sourceInfo();
            expr = new BinaryExpr(expr, BinaryOperator.AND, comparison(), info);
        }
        return expr;
    }

    private Expr comparison() {
        Expr left = additive();
        Token operatorToken = context.peek();
        ComparisonOperator op = matchComparisonOperator();
        if (op == null) {
            return left;
        }
        Expr right = additive();
        Token chained = context.peek();
        if (matchComparisonOperator() != null) {
            throw context.error(chained,
                    "Chained comparisons are not supported; combine the comparisons with 'and'.",
                    TranspilerErrorCode.CHAINED_COMPARISON);
        }
        return new ComparisonExpr(left, op, right, operatorToken.sourceInfo());
    }

    private ComparisonOperator matchComparisonOperator() {
        if (context.match(TokenType.EQUAL_EQUAL)) return ComparisonOperator.EQ;
        if (context.match(TokenType.BANG_EQUAL)) return ComparisonOperator.NE;
        if (context.match(TokenType.LESS)) return ComparisonOperator.LT;
        if (context.match(TokenType.LESS_EQUAL)) return ComparisonOperator.LE;
        if (context.match(TokenType.GREATER)) return ComparisonOperator.GT;
        if (context.match(TokenType.GREATER_EQUAL)) return ComparisonOperator.GE;
        if (context.match(TokenType.IN)) return ComparisonOperator.IN;
        if (context.check(TokenType.NOT) && context.checkNext(TokenType.IN)) {
            context.advance();
            context.advance();
            return ComparisonOperator.NOT_IN;
        }
        if (context.match(TokenType.IS)) {
            return context.match(TokenType.NOT) ? ComparisonOperator.IS_NOT : ComparisonOperator.IS;
        }
        return null;
    }

    private Expr additive() {
        Expr expr = multiplicative();
        while (context.match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = context.previous();
            BinaryOperator op = operator.type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            expr = new BinaryExpr(expr, op, multiplicative(), operator.sourceInfo());
        }
        return expr;
    }

    private Expr multiplicative() {
        Expr expr = power();
        while (context.match(TokenType.STAR, TokenType.SLASH, TokenType.DOUBLE_SLASH, TokenType.PERCENT)) {
            Token operator = context.previous();
            BinaryOperator op = switch (operator.type()) {
                case STAR -> BinaryOperator.MUL;
                case SLASH -> BinaryOperator.DIV;
                case DOUBLE_SLASH -> BinaryOperator.FLOOR_DIV;
                default -> BinaryOperator.MOD;
            };
            expr = new BinaryExpr(expr, op, power(), operator.sourceInfo());
        }
        return expr;
    }

    private Expr power() {
        Expr base = unary();
        if (context.match(TokenType.DOUBLE_STAR)) {
            SourceInfo info = context.previous().sourceInfo();
            return new BinaryExpr(base, BinaryOperator.POW, power(), info);
        }
        return base;
    }

    private Expr unary() {
        if (context.match(TokenType.MINUS)) {
            SourceInfo info = context.previous().sourceInfo();
            return new UnaryExpr(UnaryExpr.Op.NEG, unary(), info);
        }
        if (context.match(TokenType.NOT)) {
            SourceInfo info = context.previous().sourceInfo();
            return new UnaryExpr(UnaryExpr.Op.NOT, unary(), info);
        }
        if (context.match(TokenType.PLUS)) {
            return unary();
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = atom();
        while (true) {
            if (context.match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr, context.previous());
            } else if (context.match(TokenType.LEFT_BRACKET)) {
                Token bracket = context.previous();
                Expr index = subscriptIndex();
                context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after subscript.");
                expr = new Subscript(expr, index, bracket.sourceInfo());
            } else if (context.match(TokenType.DOT)) {
                Token name = context.consume(TokenType.IDENTIFIER, "Expected attribute name after '.'.");
                expr = new Attribute(expr, name.text(), name.sourceInfo());
            } else {
                return expr;
            }
        }
    }

    private Expr finishCall(Expr callee, Token paren) {
        List<Expr> args = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_PAREN)) {
            if (context.check(TokenType.IDENTIFIER) && context.checkNext(TokenType.EQUAL)) {
                throw context.error(context.peek(), "Keyword arguments are not supported.",
                        TranspilerErrorCode.UNSUPPORTED_SYNTAX);
            }
            args.add(expression());
            if (!context.match(TokenType.COMMA)) {
                break;
            }
        }
        context.consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments.");
        return new CallExpr(callee, args, paren.sourceInfo());
    }

    private Expr subscriptIndex() {
        Token start = context.peek();
        Expr lower = context.check(TokenType.COLON) ? null : expression();
        if (!context.match(TokenType.COLON)) {
            return lower;
        }
        Expr upper = null;
        if (!context.check(TokenType.COLON) && !context.check(TokenType.RIGHT_BRACKET)) {
            upper = expression();
        }
        Expr step = null;
        if (context.match(TokenType.COLON) && !context.check(TokenType.RIGHT_BRACKET)) {
            step = expression();
        }
        return new SliceExpr(lower, upper, step, start.sourceInfo());
    }

    private Expr atom() {
        Token token = context.peek();
        switch (token.type()) {
            case INTEGER:
            case FLOAT:
                context.advance();
                return new LiteralExpr(token.value(), token.sourceInfo());
            case STRING:
                return stringLiteral();
            case TRUE:
                context.advance();
                return new LiteralExpr(Boolean.TRUE, token.sourceInfo());
            case FALSE:
                context.advance();
                return new LiteralExpr(Boolean.FALSE, token.sourceInfo());
            case NONE:
                context.advance();
                return new LiteralExpr(null, token.sourceInfo());
            case IDENTIFIER:
                context.advance();
                return new Identifier(token.text(), token.sourceInfo());
            case LEFT_PAREN:
                context.advance();
                return parenthesized(token);
            case LEFT_BRACKET:
                context.advance();
                return new ListExpr(elements(TokenType.RIGHT_BRACKET, "Expected ']' after list elements."),
                        token.sourceInfo());
            case LEFT_BRACE:
                context.advance();
                return braced(token);
            case UNSUPPORTED_KEYWORD:
                throw context.error(token, "'" + token.text() + "' is not supported.",
                        TranspilerErrorCode.UNSUPPORTED_SYNTAX);
            default:
                throw context.error(token, "Expected expression but found '" + describe(token) + "'.",
                        TranspilerErrorCode.SYNTAX_ERROR);
        }
    }

    private Expr stringLiteral() {
        Token first = context.advance();
        StringBuilder value = new StringBuilder((String) first.value());
        while (context.match(TokenType.STRING)) {
            value.append((String) context.previous().value());
        }
        return new LiteralExpr(value.toString(), first.sourceInfo());
    }

    private Expr parenthesized(Token paren) {
        if (context.match(TokenType.RIGHT_PAREN)) {
            return new TupleExpr(List.of(), paren.sourceInfo());
        }
        Expr first = expression();
        if (context.match(TokenType.RIGHT_PAREN)) {
            return first;
        }
        context.consume(TokenType.COMMA, "Expected ')' after expression.");
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        elements.addAll(elements(TokenType.RIGHT_PAREN, "Expected ')' after tuple elements."));
        return new TupleExpr(elements, paren.sourceInfo());
    }

    private Expr braced(Token brace) {
        if (context.match(TokenType.RIGHT_BRACE)) {
            return new DictExpr(List.of(), brace.sourceInfo());
        }
        Expr first = expression();
        if (!context.match(TokenType.COLON)) {
            List<Expr> elements = new ArrayList<>();
            elements.add(first);
            if (context.match(TokenType.COMMA)) {
                elements.addAll(elements(TokenType.RIGHT_BRACE, "Expected '}' after set elements."));
            } else {
                context.consume(TokenType.RIGHT_BRACE, "Expected '}' after set elements.");
            }
            return new SetExpr(elements, brace.sourceInfo());
        }
        List<DictEntry> pairs = new ArrayList<>();
        pairs.add(new DictEntry(first, expression()));
        while (context.match(TokenType.COMMA)) {
            if (context.check(TokenType.RIGHT_BRACE)) {
                break;
            }
            Expr key = expression();
            context.consume(TokenType.COLON, "Expected ':' after dict key.");
            pairs.add(new DictEntry(key, expression()));
        }
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' after dict entries.");
        return new DictExpr(pairs, brace.sourceInfo());
    }

    /**
     * Parses comma-separated expressions up to and including the closing token. A trailing comma is allowed.
     */
    private List<Expr> elements(TokenType closing, String errorMessage) {
        List<Expr> elements = new ArrayList<>();
        while (!context.check(closing)) {
            elements.add(expression());
            if (!context.match(TokenType.COMMA)) {
                break;
            }
        }
        context.consume(closing, errorMessage);
        return elements;
    }

    static String describe(Token token) {
        return switch (token.type()) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case END_OF_FILE -> "end of file";
            default -> token.text();
        };
    }
}
