package org.saiql.engine.lang;

import java.util.EnumSet;
import java.util.Set;

/**
 * The two surface syntaxes accepted by the compiler.
 *
 * <p>Both normalize into the same AST; they differ only in their keyword
 * and operator tables.
 */
public enum Surface {
    /** Terse symbolic form, e.g. {@code *5[users]::name,email|status='active'>>oQ}. */
    SYMBOLIC(EnumSet.of(
            TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.IN, TokenType.IS,
            TokenType.NULL, TokenType.LIKE, TokenType.ILIKE, TokenType.TRUE, TokenType.FALSE,
            TokenType.ASC, TokenType.DESC)),

    /** SELECT / INSERT / UPDATE / DELETE subset of SQL. */
    SQL_SUBSET(EnumSet.of(
            TokenType.SELECT, TokenType.DISTINCT, TokenType.ALL, TokenType.AS,
            TokenType.FROM, TokenType.JOIN, TokenType.INNER, TokenType.LEFT, TokenType.RIGHT,
            TokenType.FULL, TokenType.OUTER, TokenType.CROSS, TokenType.ON,
            TokenType.WHERE, TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.IN,
            TokenType.LIKE, TokenType.ILIKE, TokenType.IS, TokenType.NULL,
            TokenType.TRUE, TokenType.FALSE,
            TokenType.GROUP, TokenType.BY, TokenType.ORDER, TokenType.ASC, TokenType.DESC,
            TokenType.LIMIT, TokenType.OFFSET,
            TokenType.INSERT, TokenType.INTO, TokenType.VALUES,
            TokenType.UPDATE, TokenType.SET, TokenType.DELETE));

    private final Set<TokenType> keywords;

    Surface(Set<TokenType> keywords) {
        this.keywords = keywords;
    }

    public boolean isKeyword(TokenType type) {
        return keywords.contains(type);
    }

    /**
     * Resolves an identifier to a keyword of this surface, or null.
     */
    public TokenType keyword(long hash) {
        TokenType type = TokenType.keyword(hash);
        return type != null && keywords.contains(type) ? type : null;
    }

    public OperatorTable operators() {
        return this == SYMBOLIC ? OperatorTable.SYMBOLIC : OperatorTable.SQL;
    }

    /**
     * Prefix that starts a line comment on this surface.
     */
    public String lineComment() {
        return this == SYMBOLIC ? "//" : "--";
    }
}
