package org.fangless.transpiler.frontend.lexer;

import org.fangless.transpiler.api.SourceInfo;
import org.fangless.transpiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Block structure is expressed through indentation, so the lexer keeps a stack of
 * indentation widths and emits {@link TokenType#INDENT} and {@link TokenType#DEDENT}
 * tokens whenever a logical line starts deeper or shallower than the previous one.
 * Line breaks inside brackets and after a backslash do not end the logical line.
 */
public class Lexer {

    private static final int TAB_WIDTH = 8;

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int bracketDepth = 0;
    private boolean atLineStart = true;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.indentStack.push(0);
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (atLineStart && bracketDepth == 0) {
                atLineStart = false;
                readIndentation();
                continue;
            }
            start = current;
            scanToken();
        }

        start = current;
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
            addToken(TokenType.NEWLINE, null, "");
        }
        while (indentStack.size() > 1) {
            indentStack.pop();
            addToken(TokenType.DEDENT, null, "");
        }
        addToken(TokenType.END_OF_FILE, null, "");
        return tokens;
    }

    private void readIndentation() {
        while (true) {
            int width = 0;
            boolean tabs = false;
            boolean spaces = false;
            while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) {
                char c = advance();
                if (c == '\t') {
                    tabs = true;
                    width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
                } else if (c == ' ') {
                    spaces = true;
                    width++;
                }
            }
            if (isAtEnd()) {
                return;
            }
            char c = peek();
            if (c == '#') {
                while (peek() != '\n' && !isAtEnd()) advance();
                continue;
            }
            if (c == '\r') {
                advance();
                continue;
            }
            if (c == '\n') {
                advance();
                newLine();
                continue;
            }
            start = current;
            atLineStart = false;
            if (tabs && spaces) {
                diagnostics.reportWarning("Indentation mixes tabs and spaces; a tab advances to the next multiple of "
                        + TAB_WIDTH + " columns.", new SourceInfo(logicalFileName, line, 1));
            }
            applyIndentation(width);
            return;
        }
    }

    private void applyIndentation(int width) {
        int top = indentStack.peek();
        if (width > top) {
            indentStack.push(width);
            addToken(TokenType.INDENT, null, "");
            return;
        }
        while (width < indentStack.peek()) {
            indentStack.pop();
            addToken(TokenType.DEDENT, null, "");
        }
        if (width != indentStack.peek()) {
            reportError("Unindent does not match any outer indentation level.");
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\f':
                break;
            case '#':
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '\\':
                match('\r');
                if (match('\n')) {
                    newLine();
                    atLineStart = false;
                } else {
                    reportError("Unexpected character after line continuation: " + peek());
                }
                break;
            case '\n':
                if (bracketDepth == 0) {
                    addToken(TokenType.NEWLINE, null, "\\n");
                    newLine();
                } else {
                    newLine();
                    atLineStart = false;
                }
                break;
            case '(': bracketDepth++; addToken(TokenType.LEFT_PAREN); break;
            case ')': closeBracket(); addToken(TokenType.RIGHT_PAREN); break;
            case '[': bracketDepth++; addToken(TokenType.LEFT_BRACKET); break;
            case ']': closeBracket(); addToken(TokenType.RIGHT_BRACKET); break;
            case '{': bracketDepth++; addToken(TokenType.LEFT_BRACE); break;
            case '}': closeBracket(); addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;
            case '+': addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS); break;
            case '-': addToken(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS); break;
            case '%': addToken(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT); break;
            case '*':
                if (match('*')) {
                    addToken(match('=') ? TokenType.DOUBLE_STAR_EQUAL : TokenType.DOUBLE_STAR);
                } else {
                    addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR);
                }
                break;
            case '/':
                if (match('/')) {
                    addToken(match('=') ? TokenType.DOUBLE_SLASH_EQUAL : TokenType.DOUBLE_SLASH);
                } else {
                    addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                }
                break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '!':
                if (match('=')) {
                    addToken(TokenType.BANG_EQUAL);
                } else {
                    reportError("Unexpected character: " + c);
                }
                break;
            case '"', '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    reportError("Unexpected character: " + c);
                }
                break;
        }
    }

    private void closeBracket() {
        if (bracketDepth > 0) {
            bracketDepth--;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(TokenType.keywordOrIdentifier(text));
    }

    private void number() {
        boolean isFloat = false;
        int radix = 10;
        if (previous() == '0' && isRadixPrefix(peek())) {
            char prefix = Character.toLowerCase(advance());
            radix = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
            while (isAlphaNumeric(peek())) advance();
        } else {
            if (previous() == '.') {
                isFloat = true;
            }
            while (isDigit(peek()) || peek() == '_') advance();
            if (!isFloat && peek() == '.' && !isAlpha(peekNext())) {
                isFloat = true;
                advance();
                while (isDigit(peek()) || peek() == '_') advance();
            }
            if (peek() == 'e' || peek() == 'E') {
                int save = current;
                advance();
                if (peek() == '+' || peek() == '-') advance();
                if (isDigit(peek())) {
                    isFloat = true;
                    while (isDigit(peek())) advance();
                } else {
                    current = save;
                }
            }
        }

        String text = source.substring(start, current);
        String digits = text.replace("_", "");
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT, Double.parseDouble(digits));
            } else if (radix == 10) {
                addToken(TokenType.INTEGER, Long.parseLong(digits));
            } else {
                addToken(TokenType.INTEGER, Long.parseLong(digits.substring(2), radix));
            }
        } catch (NumberFormatException e) {
            reportError("Invalid number literal: " + text);
        }
    }

    private boolean isRadixPrefix(char c) {
        return c == 'x' || c == 'X' || c == 'o' || c == 'O' || c == 'b' || c == 'B';
    }

    private void string(char quote) {
        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
        }
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                reportError("Unterminated string.");
                return;
            }
            char c = peek();
            if (c == quote) {
                if (!triple) {
                    advance();
                    break;
                }
                if (peekNext() == quote && peekAt(2) == quote) {
                    advance();
                    advance();
                    advance();
                    break;
                }
            }
            if (c == '\n') {
                if (!triple) {
                    reportError("Unterminated string.");
                    return;
                }
                advance();
                value.append('\n');
                newLine();
                atLineStart = false;
                continue;
            }
            advance();
            if (c == '\\' && !isAtEnd()) {
                appendEscape(value);
            } else {
                value.append(c);
            }
        }
        addToken(TokenType.STRING, value.toString());
    }

    private void appendEscape(StringBuilder value) {
        char escaped = advance();
        switch (escaped) {
            case 'n': value.append('\n'); break;
            case 't': value.append('\t'); break;
            case 'r': value.append('\r'); break;
            case '0': value.append('\0'); break;
            case '\\': value.append('\\'); break;
            case '\'': value.append('\''); break;
            case '"': value.append('"'); break;
            case '\n': newLine(); atLineStart = false; break;
            default:
                value.append('\\').append(escaped);
                break;
        }
    }

    private void newLine() {
        line++;
        lineStart = current;
        atLineStart = true;
    }

    private void reportError(String message) {
        diagnostics.reportError(message, new SourceInfo(logicalFileName, line, Math.max(1, start - lineStart + 1)));
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        addToken(type, literal, source.substring(start, current));
    }

    private void addToken(TokenType type, Object literal, String text) {
        int column = Math.max(1, start - lineStart + 1);
        tokens.add(new Token(type, text, literal, line, column, logicalFileName));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
