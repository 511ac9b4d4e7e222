package org.saiql.engine.lang;

/**
 * Token kinds with pre-computed FNV-1a hashes for keyword lookup.
 *
 * <p>Which keywords are reserved depends on the {@link Surface}; a word that
 * is not a keyword of the active surface lexes as an identifier.
 */
public enum TokenType {
    // Literals
    EOF(Category.END),
    IDENTIFIER(Category.IDENTIFIER),
    QUOTED_IDENTIFIER(Category.IDENTIFIER),  // "identifier" (SQL)
    STRING(Category.LITERAL),                // 'string'
    INTEGER(Category.LITERAL),               // 123
    DECIMAL(Category.LITERAL),               // 45.67

    // Keywords
    SELECT, DISTINCT, ALL, AS,
    FROM, JOIN, INNER, LEFT, RIGHT, FULL, OUTER, CROSS, ON,
    WHERE, AND, OR, NOT, IN, LIKE, ILIKE, IS, NULL, TRUE, FALSE,
    GROUP, BY, ORDER, ASC, DESC,
    LIMIT, OFFSET,
    INSERT, INTO, VALUES, UPDATE, SET, DELETE,

    // Comparison
    EQ(Category.OPERATOR),          // = or ==
    NE(Category.OPERATOR),          // <> or !=
    LT(Category.OPERATOR),          // <
    LE(Category.OPERATOR),          // <=
    GT(Category.OPERATOR),          // >
    GE(Category.OPERATOR),          // >=

    // Logical (symbolic surface)
    BANG(Category.OPERATOR),        // !
    AMP_AMP(Category.OPERATOR),     // &&
    PIPE_PIPE(Category.OPERATOR),   // ||

    // Structure
    STAR(Category.OPERATOR),        // *
    PLUS(Category.OPERATOR),        // +
    MINUS(Category.OPERATOR),       // -
    DOT(Category.OPERATOR),         // .
    COMMA(Category.OPERATOR),       // ,
    SEMICOLON(Category.OPERATOR),   // ;
    DOUBLE_COLON(Category.OPERATOR),// ::
    PIPE(Category.OPERATOR),        // |
    PIPELINE(Category.OPERATOR),    // >>
    LPAREN(Category.OPERATOR),      // (
    RPAREN(Category.OPERATOR),      // )
    LBRACKET(Category.OPERATOR),    // [
    RBRACKET(Category.OPERATOR),    // ]

    // Join markers, only recognized directly before '['
    JOIN_INNER(Category.OPERATOR),  // =J
    JOIN_LEFT(Category.OPERATOR),   // =L
    JOIN_RIGHT(Category.OPERATOR),  // =R
    JOIN_FULL(Category.OPERATOR),   // =F
    JOIN_CROSS(Category.OPERATOR);  // =C

    /**
     * Broad token classes: literal, identifier, operator, keyword, end of input.
     */
    public enum Category {
        LITERAL, IDENTIFIER, OPERATOR, KEYWORD, END
    }

    public static final long FNV_PRIME = 0x100000001b3L;
    public static final long FNV_OFFSET = 0xcbf29ce484222325L;

    private final Category category;
    private final long hash;

    TokenType() {
        this(Category.KEYWORD);
    }

    TokenType(Category category) {
        this.category = category;
        this.hash = fnv1a64(name());
    }

    public Category category() {
        return category;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
    }

    public boolean isJoinMarker() {
        return this == JOIN_INNER || this == JOIN_LEFT || this == JOIN_RIGHT
                || this == JOIN_FULL || this == JOIN_CROSS;
    }

    /**
     * FNV-1a 64-bit hash, case-insensitive.
     */
    public static long fnv1a64(String s) {
        long h = FNV_OFFSET;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + 32);
            }
            h ^= c;
            h *= FNV_PRIME;
        }
        return h;
    }

    /**
     * Keyword with the given hash, or null. Surface filtering happens in
     * {@link Surface#keyword(long)}.
     */
    static TokenType keyword(long hash) {
        for (TokenType t : values()) {
            if (t.category == Category.KEYWORD && t.hash == hash) {
                return t;
            }
        }
        return null;
    }
}
