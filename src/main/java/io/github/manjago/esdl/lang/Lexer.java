package io.github.manjago.esdl.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts pipeline source text into tokens.
 *
 * <h2>Lexical rules:</h2>
 * <pre>
 * # comment            ; also // comment, both to end of line
 * name.with.dots       ; identifiers may contain '.', keywords are case-insensitive
 * 12  0.5  1e-3        ; integer or real numbers
 * "text"  'text'       ; strings, with \" \' \\ \n \t escapes
 * \                    ; at end of line: continue the statement on the next line
 * </pre>
 * Newlines and semicolons are kept as tokens because they terminate statements.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    public Lexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenize the whole source.
     *
     * @return tokens, always ending with {@link TokenType#END_OF_FILE}
     * @throws SyntaxException on the first character that cannot start a token
     */
    public List<Token> scanTokens() throws SyntaxException {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1));
        return tokens;
    }

    private void scanToken() throws SyntaxException {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case ',' -> addToken(TokenType.COMMA);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> addToken(TokenType.MINUS);
            case '*' -> addToken(TokenType.STAR);
            case '%' -> addToken(TokenType.PERCENT);
            case '^' -> addToken(TokenType.CARET);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '!' -> {
                if (!match('=')) {
                    throw error("Unexpected character", "!");
                }
                addToken(TokenType.BANG_EQUAL);
            }
            case '/' -> {
                if (match('/')) {
                    skipComment();
                } else {
                    addToken(TokenType.SLASH);
                }
            }
            case '#' -> skipComment();
            case '\\' -> continuation();
            case '"', '\'' -> string(c);
            case ' ', '\t', '\r', '\f' -> {
                // whitespace
            }
            case '\n' -> {
                addToken(TokenType.NEWLINE);
                newLine();
            }
            case '.' -> {
                if (isDigit(peek())) {
                    number();
                } else {
                    throw error("Unexpected character", ".");
                }
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character", String.valueOf(c));
                }
            }
        }
    }

    private void skipComment() {
        while (peek() != '\n' && !isAtEnd()) advance();
    }

    /**
     * A backslash joins the next line; only whitespace or a comment may follow it.
     */
    private void continuation() throws SyntaxException {
        while (peek() == ' ' || peek() == '\t' || peek() == '\r') advance();
        if (peek() == '#') {
            skipComment();
        }
        if (isAtEnd()) {
            return;
        }
        if (peek() != '\n') {
            throw error("Line continuation must end the line", "\\");
        }
        advance();
        newLine();
    }

    private void identifier() {
        while (isAlphaNumeric(peek()) || (peek() == '.' && isAlpha(peekNext()))) advance();
        String text = source.substring(start, current);
        addToken(TokenType.keywordOrIdentifier(text));
    }

    private void number() throws SyntaxException {
        boolean real = source.charAt(start) == '.';
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            real = true;
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (!isDigit(peek())) {
                current = mark;
            } else {
                real = true;
                while (isDigit(peek())) advance();
            }
        }
        if (isAlpha(peek())) {
            throw error("Invalid number", source.substring(start, current + 1));
        }

        String text = source.substring(start, current);
        try {
            Object value = real ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            addToken(TokenType.NUMBER, value, text);
        } catch (NumberFormatException e) {
            throw error("Invalid number", text);
        }
    }

    private void string(char quote) throws SyntaxException {
        StringBuilder value = new StringBuilder();
        while (peek() != quote) {
            if (isAtEnd() || peek() == '\n') {
                throw error("Unterminated string", source.substring(start, current));
            }
            char c = advance();
            if (c == '\\') {
                if (isAtEnd()) {
                    throw error("Unterminated string", source.substring(start, current));
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case '\\', '"', '\'' -> value.append(escaped);
                    default -> throw error("Invalid escape sequence", "\\" + escaped);
                }
            } else {
                value.append(c);
            }
        }
        advance(); // closing quote
        addToken(TokenType.STRING, value.toString(), source.substring(start, current));
    }

    // ========== Helpers ==========

    private SyntaxException error(String message, String text) {
        return new SyntaxException(message, new SourceLocation(startLine, startColumn), text);
    }

    private void addToken(TokenType type) {
        addToken(type, null, source.substring(start, current));
    }

    private void addToken(TokenType type, Object literal, String text) {
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
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

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
