package org.saiql.engine.lang;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data-driven operator table: spelling to token type, matched longest first.
 */
public final class OperatorTable {

    /**
     * One operator spelling.
     *
     * @param spelling        source characters
     * @param type            token produced
     * @param requiresBracket true when the operator only counts if the next
     *                        character is {@code [} (join markers)
     */
    public record Entry(String spelling, TokenType type, boolean requiresBracket) {
    }

    public static final OperatorTable SYMBOLIC = builder()
            .add("::", TokenType.DOUBLE_COLON)
            .add(">>", TokenType.PIPELINE)
            .add("==", TokenType.EQ)
            .add("!=", TokenType.NE)
            .add("<>", TokenType.NE)
            .add("<=", TokenType.LE)
            .add(">=", TokenType.GE)
            .add("&&", TokenType.AMP_AMP)
            .add("||", TokenType.PIPE_PIPE)
            .joinMarker("=J", TokenType.JOIN_INNER)
            .joinMarker("=L", TokenType.JOIN_LEFT)
            .joinMarker("=R", TokenType.JOIN_RIGHT)
            .joinMarker("=F", TokenType.JOIN_FULL)
            .joinMarker("=C", TokenType.JOIN_CROSS)
            .add("=", TokenType.EQ)
            .add("<", TokenType.LT)
            .add(">", TokenType.GT)
            .add("!", TokenType.BANG)
            .add("|", TokenType.PIPE)
            .add("*", TokenType.STAR)
            .add("+", TokenType.PLUS)
            .add("-", TokenType.MINUS)
            .add(".", TokenType.DOT)
            .add(",", TokenType.COMMA)
            .add("(", TokenType.LPAREN)
            .add(")", TokenType.RPAREN)
            .add("[", TokenType.LBRACKET)
            .add("]", TokenType.RBRACKET)
            .build();

    public static final OperatorTable SQL = builder()
            .add("!=", TokenType.NE)
            .add("<>", TokenType.NE)
            .add("<=", TokenType.LE)
            .add(">=", TokenType.GE)
            .add("=", TokenType.EQ)
            .add("<", TokenType.LT)
            .add(">", TokenType.GT)
            .add("*", TokenType.STAR)
            .add("-", TokenType.MINUS)
            .add(".", TokenType.DOT)
            .add(",", TokenType.COMMA)
            .add(";", TokenType.SEMICOLON)
            .add("(", TokenType.LPAREN)
            .add(")", TokenType.RPAREN)
            .build();

    private final List<Entry> entries;

    private OperatorTable(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * Finds the longest operator starting at {@code pos}, or null.
     */
    public Entry match(String text, int pos) {
        for (Entry entry : entries) {
            if (text.startsWith(entry.spelling(), pos)) {
                if (entry.requiresBracket()) {
                    int after = pos + entry.spelling().length();
                    if (after >= text.length() || text.charAt(after) != '[') {
                        continue;
                    }
                }
                return entry;
            }
        }
        return null;
    }

    public List<Entry> entries() {
        return entries;
    }

    private static Builder builder() {
        return new Builder();
    }

    private static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        Builder add(String spelling, TokenType type) {
            entries.put(spelling, new Entry(spelling, type, false));
            return this;
        }

        Builder joinMarker(String spelling, TokenType type) {
            entries.put(spelling, new Entry(spelling, type, true));
            return this;
        }

        OperatorTable build() {
            List<Entry> sorted = new ArrayList<>(entries.values());
            // Stable sort keeps declaration order among equal lengths
            sorted.sort(Comparator.comparingInt((Entry e) -> e.spelling().length()).reversed());
            return new OperatorTable(sorted);
        }
    }
}
