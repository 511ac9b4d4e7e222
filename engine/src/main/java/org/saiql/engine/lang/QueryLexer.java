package org.saiql.engine.lang;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Single-pass tokenizer for both surface syntaxes.
 *
 * <p>Operators come from the surface's {@link OperatorTable}, keywords from
 * the surface's keyword set. String literals are fully unescaped here;
 * unterminated literals and unknown escapes are errors, never truncations.
 */
public final class QueryLexer {

    private final String text;
    private final Surface surface;
    private final OperatorTable operators;

    private int pos;
    private int line = 1;
    private int column = 1;

    public QueryLexer(String text, Surface surface) {
        this.text = Objects.requireNonNull(text, "Query text cannot be null");
        this.surface = Objects.requireNonNull(surface, "Surface cannot be null");
        this.operators = surface.operators();
    }

    /**
     * Tokenizes the whole input. The last token is always {@link TokenType#EOF}.
     *
     * @throws LexException on the first character that cannot start a token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos, line, column));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    /**
     * Normalized query text: tokens joined by single spaces, keywords
     * upper-cased and literals re-quoted. Comments and layout vanish.
     */
    public static String normalize(List<Token> tokens) {
        return tokens.stream()
                .filter(t -> t.type() != TokenType.EOF)
                .map(Token::canonicalText)
                .collect(Collectors.joining(" "));
    }

    private Token nextToken() {
        char c = text.charAt(pos);

        if (isIdentifierStart(c)) {
            return scanIdentifier();
        }
        if (isDigit(c)) {
            return scanNumber();
        }
        if (c == '\'') {
            return scanString('\'', TokenType.STRING);
        }
        if (c == '"') {
            return surface == Surface.SQL_SUBSET
                    ? scanString('"', TokenType.QUOTED_IDENTIFIER)
                    : scanString('"', TokenType.STRING);
        }

        OperatorTable.Entry op = operators.match(text, pos);
        if (op == null) {
            throw new LexException("Unexpected character '" + printable(c) + "'", byteOffset(pos), line, column, c);
        }
        Token token = new Token(op.type(), op.spelling(), pos, line, column);
        advance(op.spelling().length());
        return token;
    }

    private Token scanIdentifier() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        long h = TokenType.FNV_OFFSET;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            char c = text.charAt(pos);
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + 32);
            }
            h ^= c;
            h *= TokenType.FNV_PRIME;
            advance(1);
        }
        String word = text.substring(start, pos);
        TokenType keyword = surface.keyword(h);
        return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, word, start, startLine, startColumn);
    }

    private Token scanNumber() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        while (pos < text.length() && isDigit(text.charAt(pos))) {
            advance(1);
        }
        TokenType type = TokenType.INTEGER;
        if (pos + 1 < text.length() && text.charAt(pos) == '.' && isDigit(text.charAt(pos + 1))) {
            type = TokenType.DECIMAL;
            advance(1);
            while (pos < text.length() && isDigit(text.charAt(pos))) {
                advance(1);
            }
        }
        if (pos < text.length() && isIdentifierStart(text.charAt(pos))) {
            char c = text.charAt(pos);
            throw new LexException("Malformed number '" + text.substring(start, pos + 1) + "'",
                    byteOffset(pos), line, column, c);
        }
        return new Token(type, text.substring(start, pos), start, startLine, startColumn);
    }

    private Token scanString(char quote, TokenType type) {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        advance(1); // opening quote
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= text.length()) {
                throw new LexException("Unterminated " + describe(type), byteOffset(start), startLine, startColumn, quote);
            }
            char c = text.charAt(pos);
            if (c == quote) {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == quote) {
                    value.append(quote);
                    advance(2);
                    continue;
                }
                advance(1);
                return new Token(type, value.toString(), start, startLine, startColumn);
            }
            if (c == '\\' && surface == Surface.SYMBOLIC) {
                value.append(scanEscape());
                continue;
            }
            value.append(c);
            advance(1);
        }
    }

    private char scanEscape() {
        int escapeLine = line;
        int escapeColumn = column;
        int escapePos = pos;
        if (pos + 1 >= text.length()) {
            throw new LexException("Unterminated escape sequence", byteOffset(escapePos), escapeLine, escapeColumn, '\\');
        }
        char next = text.charAt(pos + 1);
        char resolved = switch (next) {
            case '\\' -> '\\';
            case '\'' -> '\'';
            case '"' -> '"';
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> throw new LexException("Unknown escape sequence '\\" + printable(next) + "'",
                    byteOffset(escapePos), escapeLine, escapeColumn, next);
        };
        advance(2);
        return resolved;
    }

    private int byteOffset(int charIndex) {
        return text.substring(0, charIndex).getBytes(StandardCharsets.UTF_8).length;
    }

    private void skipWhitespaceAndComments() {
        String comment = surface.lineComment();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance(1);
            } else if (text.startsWith(comment, pos)) {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    advance(1);
                }
            } else {
                return;
            }
        }
    }

    private void advance(int count) {
        for (int i = 0; i < count; i++) {
            if (text.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    private static String describe(TokenType type) {
        return type == TokenType.QUOTED_IDENTIFIER ? "quoted identifier" : "string literal";
    }

    private static String printable(char c) {
        return Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
