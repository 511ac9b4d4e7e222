package org.saiql.engine.lang;

import org.saiql.engine.lang.ast.Aggregate;
import org.saiql.engine.lang.ast.AggregateCall;
import org.saiql.engine.lang.ast.AggregateFunction;
import org.saiql.engine.lang.ast.BinaryOp;
import org.saiql.engine.lang.ast.ColumnList;
import org.saiql.engine.lang.ast.ColumnRef;
import org.saiql.engine.lang.ast.Delete;
import org.saiql.engine.lang.ast.ExprAst;
import org.saiql.engine.lang.ast.Filter;
import org.saiql.engine.lang.ast.FunctionCall;
import org.saiql.engine.lang.ast.InList;
import org.saiql.engine.lang.ast.Insert;
import org.saiql.engine.lang.ast.IsNull;
import org.saiql.engine.lang.ast.Join;
import org.saiql.engine.lang.ast.JoinKind;
import org.saiql.engine.lang.ast.Limit;
import org.saiql.engine.lang.ast.Literal;
import org.saiql.engine.lang.ast.Not;
import org.saiql.engine.lang.ast.OrderItem;
import org.saiql.engine.lang.ast.Pipeline;
import org.saiql.engine.lang.ast.QueryAst;
import org.saiql.engine.lang.ast.RelationAst;
import org.saiql.engine.lang.ast.Select;
import org.saiql.engine.lang.ast.SelectItem;
import org.saiql.engine.lang.ast.SinkFormat;
import org.saiql.engine.lang.ast.TableRef;
import org.saiql.engine.lang.ast.Update;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import static org.saiql.engine.lang.TokenType.*;

/**
 * Recursive descent parser for both surface syntaxes.
 *
 * <p>Fails fast: the first violation raises a {@link SyntaxException}
 * carrying the position and the set of tokens that would have been
 * accepted there. There is no error recovery.
 *
 * <p>Symbolic precedence, tightest first: table group {@code []}, column
 * list {@code ::}, filter {@code |}, pipeline {@code >>}. Inside
 * conditions: comparison, NOT, AND, OR.
 */
public final class QueryParser {

    private static final Set<String> SYMBOLIC_PREFIXES = Set.of(
            "ALL", "FIRST", "LAST", "RANDOM", "DISTINCT", "COUNT", "SUM", "AVG", "MIN", "MAX");

    private final List<Token> tokens;
    private final Surface surface;
    private final Map<TokenType, String> spellings;
    private final Set<String> expected = new LinkedHashSet<>();
    private int index;

    public QueryParser(List<Token> tokens, Surface surface) {
        this.tokens = List.copyOf(tokens);
        this.surface = Objects.requireNonNull(surface, "Surface cannot be null");
        if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).type() != EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.spellings = spellingsOf(surface.operators());
    }

    /**
     * Lexes and parses a query in one step.
     */
    public static QueryAst parse(String text, Surface surface) {
        return new QueryParser(new QueryLexer(text, surface).tokenize(), surface).parse();
    }

    public QueryAst parse() {
        QueryAst query = surface == Surface.SYMBOLIC ? parseSymbolic() : parseSql();
        expect(EOF);
        return query;
    }

    // ==================== Token Helpers ====================

    private Token current() {
        return tokens.get(index);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private boolean check(TokenType type) {
        expected.add(describe(type));
        return current().type() == type;
    }

    private void advance() {
        if (current().type() != EOF) {
            index++;
        }
        expected.clear();
    }

    private boolean consumeIf(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        if (!check(type)) {
            throw error("Unexpected " + found());
        }
        Token token = current();
        advance();
        return token;
    }

    private boolean checkIdentifier() {
        expected.add("identifier");
        return current().type() == IDENTIFIER || current().type() == QUOTED_IDENTIFIER;
    }

    private String expectIdentifier() {
        if (!checkIdentifier()) {
            throw error("Unexpected " + found());
        }
        String name = current().text();
        advance();
        return name;
    }

    /**
     * True when the current token is an unquoted identifier spelled
     * {@code word}, ignoring case.
     */
    private boolean checkWord(String word) {
        expected.add(word);
        return current().type() == IDENTIFIER && current().text().equalsIgnoreCase(word);
    }

    private SyntaxException error(String message) {
        return new SyntaxException(message, current(), expected);
    }

    private String found() {
        Token token = current();
        return token.type() == EOF ? "end of input" : "'" + token.text() + "'";
    }

    private <T> List<T> parseList(Supplier<T> parser, TokenType separator) {
        List<T> items = new ArrayList<>();
        do {
            items.add(parser.get());
        } while (consumeIf(separator));
        return items;
    }

    private String describe(TokenType type) {
        String spelling = spellings.get(type);
        if (spelling != null) {
            return "'" + spelling + "'";
        }
        return switch (type) {
            case EOF -> "end of input";
            case IDENTIFIER, QUOTED_IDENTIFIER -> "identifier";
            case STRING -> "string";
            case INTEGER -> "integer";
            case DECIMAL -> "decimal";
            default -> type.name();
        };
    }

    private static Map<TokenType, String> spellingsOf(OperatorTable table) {
        Map<TokenType, String> map = new EnumMap<>(TokenType.class);
        // Entries are longest first, so the shortest spelling wins
        for (OperatorTable.Entry entry : table.entries()) {
            map.put(entry.type(), entry.spelling());
        }
        return map;
    }

    // ==================== Symbolic Surface ====================

    private QueryAst parseSymbolic() {
        Limit limit = Limit.all();
        AggregateFunction aggregate = null;
        boolean distinct = false;
        JoinKind joinKind;

        if (consumeIf(STAR)) {
            if (check(INTEGER)) {
                limit = Limit.rows(parseCount());
            } else if (current().type() == IDENTIFIER
                    && SYMBOLIC_PREFIXES.contains(current().text().toUpperCase(Locale.ROOT))) {
                String word = current().text().toUpperCase(Locale.ROOT);
                advance();
                switch (word) {
                    case "ALL" -> limit = Limit.all();
                    case "FIRST" -> limit = Limit.of(Limit.Kind.FIRST);
                    case "LAST" -> limit = Limit.of(Limit.Kind.LAST);
                    case "RANDOM" -> limit = Limit.of(Limit.Kind.RANDOM);
                    case "DISTINCT" -> distinct = true;
                    default -> aggregate = AggregateFunction.valueOf(word);
                }
            } else if (current().type() == IDENTIFIER) {
                expected.addAll(SYMBOLIC_PREFIXES);
                throw error("Unknown query prefix '" + current().text() + "'");
            }
            joinKind = parseOptionalJoinMarker();
        } else {
            expected.add(describe(STAR));
            joinKind = parseOptionalJoinMarker();
            if (joinKind == null) {
                throw error("Query must start with '*' or a join marker, found " + found());
            }
        }

        Token groupStart = current();
        expect(LBRACKET);
        List<String> tables = parseList(this::expectIdentifier, PLUS);
        expect(RBRACKET);
        if (tables.size() > 1 && joinKind == null) {
            throw new SyntaxException("Table group with " + tables.size() + " tables requires a join marker",
                    groupStart, Set.of("'=J'", "'=L'", "'=R'", "'=F'", "'=C'"));
        }
        if (joinKind != null && tables.size() < 2) {
            throw new SyntaxException("Join marker requires at least two tables", groupStart, Set.of("'+'"));
        }

        ExprAst joinCondition = null;
        if (joinKind != null && joinKind != JoinKind.CROSS && consumeIf(LPAREN)) {
            joinCondition = parseCondition();
            expect(RPAREN);
        }

        RelationAst from = TableRef.of(tables.get(0));
        for (int i = 1; i < tables.size(); i++) {
            ExprAst condition = i == tables.size() - 1 ? joinCondition : null;
            from = new Join(joinKind, from, TableRef.of(tables.get(i)), condition);
        }

        ColumnList columns = consumeIf(DOUBLE_COLON) ? parseSymbolicColumns() : ColumnList.wildcard();
        ExprAst filter = consumeIf(PIPE) ? parseCondition() : null;

        List<OrderItem> orderBy = List.of();
        List<ColumnRef> groupBy = List.of();
        SinkFormat sink = null;
        while (sink == null) {
            expect(PIPELINE);
            if (checkWord("ORDER")) {
                if (!orderBy.isEmpty()) {
                    throw error("Duplicate ORDER stage");
                }
                advance();
                expect(LPAREN);
                orderBy = parseList(this::parseOrderItem, COMMA);
                expect(RPAREN);
            } else if (checkWord("GROUP")) {
                if (aggregate == null) {
                    throw error("GROUP stage requires an aggregation prefix");
                }
                if (!groupBy.isEmpty()) {
                    throw error("Duplicate GROUP stage");
                }
                advance();
                expect(LPAREN);
                groupBy = parseList(this::parseColumn, COMMA);
                expect(RPAREN);
            } else {
                sink = parseSink();
            }
        }

        RelationAst projection;
        if (aggregate != null) {
            // Grouping keys lead, then one call per listed column
            List<SelectItem> items = new ArrayList<>();
            groupBy.forEach(key -> items.add(new ColumnList.Item(key, null)));
            for (ColumnList.Item item : columns.items()) {
                ColumnRef argument = item.column().isWildcard() ? null : item.column();
                items.add(new AggregateCall(aggregate, argument, item.alias()));
            }
            projection = new Aggregate(items, groupBy, from);
        } else {
            projection = new Select(columns, distinct, from);
        }
        RelationAst source = filter == null ? projection : new Filter(filter, projection);
        return new Pipeline(source, orderBy, limit, sink);
    }

    private JoinKind parseOptionalJoinMarker() {
        if (consumeIf(JOIN_INNER)) return JoinKind.INNER;
        if (consumeIf(JOIN_LEFT)) return JoinKind.LEFT;
        if (consumeIf(JOIN_RIGHT)) return JoinKind.RIGHT;
        if (consumeIf(JOIN_FULL)) return JoinKind.FULL;
        if (consumeIf(JOIN_CROSS)) return JoinKind.CROSS;
        return null;
    }

    private ColumnList parseSymbolicColumns() {
        if (consumeIf(STAR)) {
            return ColumnList.wildcard();
        }
        return ColumnList.of(parseList(this::parseColumnOrQualifiedWildcard, COMMA));
    }

    private SinkFormat parseSink() {
        for (SinkFormat format : SinkFormat.values()) {
            expected.add(format.code());
        }
        expected.add("ORDER");
        expected.add("GROUP");
        if (current().type() == IDENTIFIER) {
            SinkFormat format = SinkFormat.fromCode(current().text()).orElse(null);
            if (format != null) {
                advance();
                return format;
            }
        }
        throw error("Unknown pipeline stage " + found());
    }

    // ==================== SQL Surface ====================

    private QueryAst parseSql() {
        QueryAst query;
        if (check(SELECT)) {
            query = parseSelect();
        } else if (check(INSERT)) {
            query = parseInsert();
        } else if (check(UPDATE)) {
            query = parseUpdate();
        } else if (check(DELETE)) {
            query = parseDelete();
        } else {
            throw error("Unexpected " + found());
        }
        consumeIf(SEMICOLON);
        return query;
    }

    private Pipeline parseSelect() {
        expect(SELECT);
        boolean distinct = consumeIf(DISTINCT);
        if (!distinct) {
            consumeIf(ALL);
        }

        List<SelectItem> items = parseList(this::parseSelectItem, COMMA);

        expect(FROM);
        RelationAst from = parseFromClause();
        ExprAst where = consumeIf(WHERE) ? parseCondition() : null;

        List<ColumnRef> groupBy = List.of();
        if (consumeIf(GROUP)) {
            expect(BY);
            groupBy = parseList(this::parseColumn, COMMA);
        }

        List<OrderItem> orderBy = List.of();
        if (consumeIf(ORDER)) {
            expect(BY);
            orderBy = parseList(this::parseOrderItem, COMMA);
        }

        Limit limit = Limit.all();
        if (consumeIf(LIMIT)) {
            limit = Limit.rows(parseCount());
        }
        if (consumeIf(OFFSET)) {
            limit = limit.withOffset(parseCount());
        }

        RelationAst projection;
        if (items.stream().anyMatch(AggregateCall.class::isInstance)) {
            if (distinct) {
                throw error("DISTINCT cannot be combined with aggregates");
            }
            for (SelectItem item : items) {
                if (item instanceof ColumnList.Item column && column.column().isWildcard()) {
                    throw error("'*' cannot be combined with aggregates");
                }
            }
            projection = new Aggregate(items, groupBy, from);
        } else {
            if (!groupBy.isEmpty()) {
                throw error("GROUP BY requires an aggregate in the select list");
            }
            List<ColumnList.Item> columns = items.stream().map(ColumnList.Item.class::cast).toList();
            projection = new Select(new ColumnList(columns), distinct, from);
        }
        // WHERE reads the FROM rows; it sits above the projection
        RelationAst source = where == null ? projection : new Filter(where, projection);
        return new Pipeline(source, orderBy, limit, SinkFormat.ROWS);
    }

    private SelectItem parseSelectItem() {
        if (consumeIf(STAR)) {
            return new ColumnList.Item(ColumnRef.wildcard(null), null);
        }
        if (current().type() == IDENTIFIER && peek(1).type() == LPAREN) {
            AggregateFunction function = AggregateFunction.fromName(current().text()).orElse(null);
            if (function != null) {
                advance();
                expect(LPAREN);
                ColumnRef argument = consumeIf(STAR) ? null : parseColumn();
                expect(RPAREN);
                return new AggregateCall(function, argument, parseOptionalAlias());
            }
            throw error("Only columns and aggregates are allowed in the select list, found function "
                    + found());
        }
        ColumnRef column = parseColumnOrQualifiedWildcard();
        String alias = column.isWildcard() ? null : parseOptionalAlias();
        return new ColumnList.Item(column, alias);
    }

    private String parseOptionalAlias() {
        if (consumeIf(AS)) {
            return expectIdentifier();
        }
        if (checkIdentifier()) {
            return expectIdentifier();
        }
        return null;
    }

    private RelationAst parseFromClause() {
        RelationAst left = parseTableRef();
        while (true) {
            JoinKind kind;
            if (consumeIf(COMMA)) {
                left = new Join(JoinKind.CROSS, left, parseTableRef(), null);
                continue;
            }
            kind = parseJoinKind();
            if (kind == null) {
                return left;
            }
            RelationAst right = parseTableRef();
            ExprAst condition = null;
            if (kind != JoinKind.CROSS && consumeIf(ON)) {
                condition = parseCondition();
            }
            left = new Join(kind, left, right, condition);
        }
    }

    private JoinKind parseJoinKind() {
        JoinKind kind;
        if (consumeIf(JOIN)) {
            return JoinKind.INNER;
        } else if (consumeIf(INNER)) {
            kind = JoinKind.INNER;
        } else if (consumeIf(LEFT)) {
            kind = JoinKind.LEFT;
            consumeIf(OUTER);
        } else if (consumeIf(RIGHT)) {
            kind = JoinKind.RIGHT;
            consumeIf(OUTER);
        } else if (consumeIf(FULL)) {
            kind = JoinKind.FULL;
            consumeIf(OUTER);
        } else if (consumeIf(CROSS)) {
            kind = JoinKind.CROSS;
        } else {
            return null;
        }
        expect(JOIN);
        return kind;
    }

    private TableRef parseTableRef() {
        String name = expectIdentifier();
        return new TableRef(name, parseOptionalAlias());
    }

    private Insert parseInsert() {
        expect(INSERT);
        expect(INTO);
        String table = expectIdentifier();
        List<String> columns = List.of();
        if (consumeIf(LPAREN)) {
            columns = parseList(this::expectIdentifier, COMMA);
            expect(RPAREN);
        }
        expect(VALUES);
        List<List<ExprAst>> rows = parseList(() -> {
            expect(LPAREN);
            List<ExprAst> values = parseList(this::parseLiteral, COMMA);
            expect(RPAREN);
            return values;
        }, COMMA);
        return new Insert(table, columns, rows);
    }

    private Update parseUpdate() {
        expect(UPDATE);
        String table = expectIdentifier();
        expect(SET);
        List<Update.Assignment> assignments = parseList(() -> {
            String column = expectIdentifier();
            expect(EQ);
            return new Update.Assignment(column, parseLiteral());
        }, COMMA);
        ExprAst where = consumeIf(WHERE) ? parseCondition() : null;
        return new Update(table, assignments, where);
    }

    private Delete parseDelete() {
        expect(DELETE);
        expect(FROM);
        String table = expectIdentifier();
        ExprAst where = consumeIf(WHERE) ? parseCondition() : null;
        return new Delete(table, where);
    }

    // ==================== Shared: Columns ====================

    private ColumnRef parseColumn() {
        String first = expectIdentifier();
        if (consumeIf(DOT)) {
            return new ColumnRef(first, expectIdentifier());
        }
        return ColumnRef.of(first);
    }

    private ColumnRef parseColumnOrQualifiedWildcard() {
        String first = expectIdentifier();
        if (consumeIf(DOT)) {
            if (consumeIf(STAR)) {
                return ColumnRef.wildcard(first);
            }
            return new ColumnRef(first, expectIdentifier());
        }
        return ColumnRef.of(first);
    }

    private OrderItem parseOrderItem() {
        ColumnRef column = parseColumn();
        boolean descending = false;
        if (consumeIf(DESC)) {
            descending = true;
        } else {
            consumeIf(ASC);
        }
        return new OrderItem(column, descending);
    }

    private long parseCount() {
        Token token = expect(INTEGER);
        try {
            return Long.parseLong(token.text());
        } catch (NumberFormatException e) {
            throw new SyntaxException("Count out of range '" + token.text() + "'", token, Set.of("integer"));
        }
    }

    // ==================== Shared: Conditions ====================

    private ExprAst parseCondition() {
        return parseOr();
    }

    private ExprAst parseOr() {
        ExprAst left = parseAnd();
        while (consumeIf(OR) || (surface == Surface.SYMBOLIC && consumeIf(PIPE_PIPE))) {
            left = new BinaryOp(BinaryOp.Operator.OR, left, parseAnd());
        }
        return left;
    }

    private ExprAst parseAnd() {
        ExprAst left = parseNot();
        while (consumeIf(AND) || (surface == Surface.SYMBOLIC && consumeIf(AMP_AMP))) {
            left = new BinaryOp(BinaryOp.Operator.AND, left, parseNot());
        }
        return left;
    }

    private ExprAst parseNot() {
        if (consumeIf(NOT) || (surface == Surface.SYMBOLIC && consumeIf(BANG))) {
            return new Not(parseNot());
        }
        return parseComparison();
    }

    private ExprAst parseComparison() {
        ExprAst left = parseOperand();

        if (consumeIf(IS)) {
            boolean negated = consumeIf(NOT);
            expect(NULL);
            return new IsNull(left, negated);
        }

        boolean negated = false;
        if (check(NOT) && (peek(1).type() == IN || peek(1).type() == LIKE || peek(1).type() == ILIKE)) {
            advance();
            negated = true;
        }

        if (consumeIf(IN)) {
            expect(LPAREN);
            List<Literal> values = parseList(this::parseLiteral, COMMA);
            expect(RPAREN);
            return new InList(left, values, negated);
        }
        if (check(LIKE) || check(ILIKE)) {
            BinaryOp.Operator op = current().type() == LIKE ? BinaryOp.Operator.LIKE : BinaryOp.Operator.ILIKE;
            advance();
            ExprAst like = new BinaryOp(op, left, parseOperand());
            return negated ? new Not(like) : like;
        }
        if (negated) {
            throw error("Unexpected " + found());
        }

        if (current().type().isComparison()) {
            BinaryOp.Operator op = switch (current().type()) {
                case EQ -> BinaryOp.Operator.EQ;
                case NE -> BinaryOp.Operator.NE;
                case LT -> BinaryOp.Operator.LT;
                case LE -> BinaryOp.Operator.LE;
                case GT -> BinaryOp.Operator.GT;
                case GE -> BinaryOp.Operator.GE;
                default -> throw error("Unexpected comparison operator");
            };
            advance();
            return new BinaryOp(op, left, parseOperand());
        }
        for (TokenType type : List.of(EQ, NE, LT, LE, GT, GE)) {
            expected.add(describe(type));
        }
        return left;
    }

    private ExprAst parseOperand() {
        if (consumeIf(LPAREN)) {
            ExprAst inner = parseCondition();
            expect(RPAREN);
            return inner;
        }
        if (checkIdentifier()) {
            if (current().type() == IDENTIFIER && peek(1).type() == LPAREN) {
                String name = current().text();
                advance();
                expect(LPAREN);
                List<ExprAst> arguments = check(RPAREN) ? List.of() : parseList(this::parseOperand, COMMA);
                expect(RPAREN);
                return new FunctionCall(name, arguments);
            }
            return parseColumn();
        }
        return parseLiteral();
    }

    private Literal parseLiteral() {
        Token token = current();
        if (consumeIf(STRING)) {
            return Literal.string(token.text());
        }
        if (consumeIf(INTEGER)) {
            return new Literal(Literal.Kind.INTEGER, token.text());
        }
        if (consumeIf(DECIMAL)) {
            return new Literal(Literal.Kind.DECIMAL, token.text());
        }
        if (consumeIf(TRUE) || consumeIf(FALSE)) {
            return new Literal(Literal.Kind.BOOLEAN, token.type() == TRUE ? "true" : "false");
        }
        if (consumeIf(NULL)) {
            return Literal.nullValue();
        }
        if (check(MINUS) && (peek(1).type() == INTEGER || peek(1).type() == DECIMAL)) {
            advance();
            Token number = current();
            advance();
            Literal.Kind kind = number.type() == INTEGER ? Literal.Kind.INTEGER : Literal.Kind.DECIMAL;
            return new Literal(kind, "-" + number.text());
        }
        check(INTEGER);
        check(DECIMAL);
        check(TRUE);
        check(FALSE);
        check(NULL);
        throw error("Unexpected " + found());
    }
}
