package org.saiql.engine.lang;

import org.saiql.engine.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link QueryLexer}: both surfaces, literals, positions and
 * normalization.
 */
@DisplayName("Query Lexer Tests")
class QueryLexerTest {

    private static List<TokenType> types(String text, Surface surface) {
        return new QueryLexer(text, surface).tokenize().stream().map(Token::type).toList();
    }

    private static List<Token> tokens(String text, Surface surface) {
        return new QueryLexer(text, surface).tokenize();
    }

    @Nested
    @DisplayName("Symbolic surface")
    class Symbolic {

        @Test
        @DisplayName("Canonical example tokenizes into structure, identifiers and a string")
        void testCanonicalQuery() {
            // GIVEN: The headline symbolic query
            String query = "*5[users]::name,email|status='active'>>oQ";

            // WHEN: We tokenize it
            List<TokenType> types = types(query, Surface.SYMBOLIC);

            // THEN: Every structural operator is recognized
            assertEquals(List.of(
                    TokenType.STAR, TokenType.INTEGER, TokenType.LBRACKET, TokenType.IDENTIFIER, TokenType.RBRACKET,
                    TokenType.DOUBLE_COLON, TokenType.IDENTIFIER, TokenType.COMMA, TokenType.IDENTIFIER,
                    TokenType.PIPE, TokenType.IDENTIFIER, TokenType.EQ, TokenType.STRING,
                    TokenType.PIPELINE, TokenType.IDENTIFIER, TokenType.EOF), types);
        }

        @Test
        @DisplayName("Join markers are only recognized directly before '['")
        void testJoinMarkerNeedsBracket() {
            // GIVEN: A join marker and an equality whose right side starts with J
            List<TokenType> marker = types("*=J[users+orders]>>oQ", Surface.SYMBOLIC);
            List<TokenType> equality = types("name=Jane", Surface.SYMBOLIC);

            // THEN: '=J[' is a join marker, '=Jane' is an equality
            assertEquals(TokenType.JOIN_INNER, marker.get(1));
            assertEquals(TokenType.PLUS, marker.get(4));
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EQ, TokenType.IDENTIFIER, TokenType.EOF), equality);
        }

        @Test
        @DisplayName("Every join marker maps to its join token")
        void testAllJoinMarkers() {
            assertEquals(TokenType.JOIN_LEFT, types("=L[", Surface.SYMBOLIC).get(0));
            assertEquals(TokenType.JOIN_RIGHT, types("=R[", Surface.SYMBOLIC).get(0));
            assertEquals(TokenType.JOIN_FULL, types("=F[", Surface.SYMBOLIC).get(0));
            assertEquals(TokenType.JOIN_CROSS, types("=C[", Surface.SYMBOLIC).get(0));
        }

        @Test
        @DisplayName("Longest operator wins")
        void testLongestMatch() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.GE, TokenType.INTEGER, TokenType.PIPELINE,
                            TokenType.IDENTIFIER, TokenType.EOF),
                    types("age>=30>>oQ", Surface.SYMBOLIC));
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.PIPE_PIPE, TokenType.BANG, TokenType.IDENTIFIER,
                            TokenType.AMP_AMP, TokenType.IDENTIFIER, TokenType.EOF),
                    types("a||!b&&c", Surface.SYMBOLIC));
        }

        @Test
        @DisplayName("Double quotes delimit strings and backslash escapes are resolved")
        void testEscapes() {
            // GIVEN: Strings with escapes in both quote styles
            List<Token> tokens = tokens("'it\\'s' \"tab\\there\" 'a\\\\b'", Surface.SYMBOLIC);

            // THEN: Values are unescaped
            assertEquals(TokenType.STRING, tokens.get(0).type());
            assertEquals("it's", tokens.get(0).text());
            assertEquals(TokenType.STRING, tokens.get(1).type());
            assertEquals("tab\there", tokens.get(1).text());
            assertEquals("a\\b", tokens.get(2).text());
        }

        @Test
        @DisplayName("Doubled quote inside a string is a literal quote")
        void testDoubledQuote() {
            List<Token> tokens = tokens("'O''Brien'", Surface.SYMBOLIC);
            assertEquals("O'Brien", tokens.get(0).text());
        }

        @Test
        @DisplayName("Keywords are recognized case-insensitively; ORDER stays a word")
        void testSymbolicKeywords() {
            List<TokenType> types = types("and Or NOT in is null like ilike true FALSE asc desc order group",
                    Surface.SYMBOLIC);
            assertEquals(List.of(TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.IN, TokenType.IS,
                    TokenType.NULL, TokenType.LIKE, TokenType.ILIKE, TokenType.TRUE, TokenType.FALSE,
                    TokenType.ASC, TokenType.DESC, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), types);
        }

        @Test
        @DisplayName("'//' starts a comment to end of line")
        void testComment() {
            List<TokenType> types = types("*[users] // all users\n>>oQ", Surface.SYMBOLIC);
            assertEquals(List.of(TokenType.STAR, TokenType.LBRACKET, TokenType.IDENTIFIER, TokenType.RBRACKET,
                    TokenType.PIPELINE, TokenType.IDENTIFIER, TokenType.EOF), types);
        }

        @Test
        @DisplayName("Decimal and integer literals")
        void testNumbers() {
            List<Token> tokens = tokens("12 3.75 4.", Surface.SYMBOLIC);
            assertEquals(TokenType.INTEGER, tokens.get(0).type());
            assertEquals(TokenType.DECIMAL, tokens.get(1).type());
            assertEquals("3.75", tokens.get(1).text());
            // A trailing dot is not part of the number
            assertEquals(TokenType.INTEGER, tokens.get(2).type());
            assertEquals(TokenType.DOT, tokens.get(3).type());
        }
    }

    @Nested
    @DisplayName("SQL surface")
    class Sql {

        @Test
        @DisplayName("SQL keywords and quoted identifiers")
        void testSqlTokens() {
            // GIVEN: A SELECT with a quoted identifier
            List<Token> tokens = tokens("select \"user name\" from users where id = 1;", Surface.SQL_SUBSET);

            // THEN: Keywords, quoted identifier and semicolon are recognized
            assertEquals(TokenType.SELECT, tokens.get(0).type());
            assertEquals(TokenType.QUOTED_IDENTIFIER, tokens.get(1).type());
            assertEquals("user name", tokens.get(1).text());
            assertEquals(TokenType.FROM, tokens.get(2).type());
            assertEquals(TokenType.WHERE, tokens.get(4).type());
            assertEquals(TokenType.SEMICOLON, tokens.get(8).type());
        }

        @Test
        @DisplayName("Backslash is an ordinary character in SQL strings")
        void testNoBackslashEscapes() {
            List<Token> tokens = tokens("'C:\\temp'", Surface.SQL_SUBSET);
            assertEquals("C:\\temp", tokens.get(0).text());
        }

        @Test
        @DisplayName("'--' starts a comment; '//' does not")
        void testSqlComment() {
            assertEquals(List.of(TokenType.SELECT, TokenType.STAR, TokenType.EOF),
                    types("SELECT * -- everything", Surface.SQL_SUBSET));
            assertThrows(LexException.class, () -> types("SELECT // nope", Surface.SQL_SUBSET));
        }

        @Test
        @DisplayName("Symbolic operators are not SQL operators")
        void testSymbolicOperatorsRejected() {
            LexException e = assertThrows(LexException.class, () -> types("a && b", Surface.SQL_SUBSET));
            assertEquals(ErrorCode.LEX_ERROR, e.errorCode());
        }
    }

    @Nested
    @DisplayName("Errors and positions")
    class Errors {

        @Test
        @DisplayName("Unknown character reports line, column and offset")
        void testUnexpectedCharacter() {
            // GIVEN: A '#' on the second line
            String query = "*[users]\n  #";

            // WHEN: We tokenize
            LexException e = assertThrows(LexException.class, () -> tokens(query, Surface.SYMBOLIC));

            // THEN: Position points at the '#'
            assertEquals(2, e.line());
            assertEquals(3, e.column());
            assertEquals(11, e.offset());
            assertEquals('#', e.character());
            assertEquals(ErrorCode.LEX_ERROR, e.errorCode());
        }

        @Test
        @DisplayName("Offset counts UTF-8 bytes while column counts characters")
        void testByteOffsetAfterMultibyteCharacter() {
            // GIVEN: A two-byte 'é' before the offending '#'
            String query = "*[users]|name='é' #";

            // WHEN: We tokenize
            LexException e = assertThrows(LexException.class, () -> tokens(query, Surface.SYMBOLIC));

            // THEN: The byte offset runs one ahead of the character index
            assertEquals('#', e.character());
            assertEquals(19, e.column());
            assertEquals(19, e.offset());
            assertTrue(e.getMessage().contains("(offset 19)"), e.getMessage());
        }

        @Test
        @DisplayName("Unterminated string is an error, not a truncation")
        void testUnterminatedString() {
            LexException e = assertThrows(LexException.class,
                    () -> tokens("*[users]|name='Alice>>oQ", Surface.SYMBOLIC));
            assertTrue(e.getMessage().contains("Unterminated string literal"), e.getMessage());
            assertEquals(15, e.column());
        }

        @Test
        @DisplayName("Unknown escape sequence is an error")
        void testUnknownEscape() {
            LexException e = assertThrows(LexException.class, () -> tokens("'bad\\q'", Surface.SYMBOLIC));
            assertEquals('q', e.character());
            assertTrue(e.getMessage().contains("Unknown escape sequence"));
        }

        @Test
        @DisplayName("Number running into letters is malformed")
        void testMalformedNumber() {
            LexException e = assertThrows(LexException.class, () -> tokens("*5x[users]", Surface.SYMBOLIC));
            assertTrue(e.getMessage().contains("Malformed number '5x'"), e.getMessage());
        }

        @Test
        @DisplayName("Token positions are 1-based line and column")
        void testTokenPositions() {
            List<Token> tokens = tokens("*[users]\n|age > 3", Surface.SYMBOLIC);
            Token age = tokens.get(5);
            assertEquals("age", age.text());
            assertEquals(2, age.line());
            assertEquals(2, age.column());
            assertEquals(10, age.offset());
        }
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Layout, comments and keyword case vanish; literals are re-quoted")
        void testNormalize() {
            // GIVEN: Two spellings of the same query
            String a = "*5[users]::name|status = 'active' and age>30>>oQ";
            String b = "*5 [ users ] :: name // names\n | status='active' AND age > 30 >> oQ";

            // WHEN: We normalize both
            String na = QueryLexer.normalize(tokens(a, Surface.SYMBOLIC));
            String nb = QueryLexer.normalize(tokens(b, Surface.SYMBOLIC));

            // THEN: They are identical
            assertEquals(na, nb);
            assertEquals("* 5 [ users ] :: name | status = 'active' AND age > 30 >> oQ", na);
        }

        @Test
        @DisplayName("Quotes inside string literals are doubled")
        void testNormalizeQuotes() {
            String normalized = QueryLexer.normalize(tokens("name=\"O'Brien\"", Surface.SYMBOLIC));
            assertEquals("name = 'O''Brien'", normalized);
        }
    }
}
