package org.saiql.engine.plan;

import org.saiql.engine.ErrorCode;
import org.saiql.engine.FirewallVerdict;
import org.saiql.engine.QueryFirewall;
import org.saiql.engine.lang.ast.Aggregate;
import org.saiql.engine.lang.ast.AggregateFunction;
import org.saiql.engine.lang.ast.BinaryOp;
import org.saiql.engine.lang.ast.ColumnList;
import org.saiql.engine.lang.ast.ColumnRef;
import org.saiql.engine.lang.ast.Delete;
import org.saiql.engine.lang.ast.ExprAst;
import org.saiql.engine.lang.ast.Filter;
import org.saiql.engine.lang.ast.Insert;
import org.saiql.engine.lang.ast.Join;
import org.saiql.engine.lang.ast.JoinKind;
import org.saiql.engine.lang.ast.Limit;
import org.saiql.engine.lang.ast.OrderItem;
import org.saiql.engine.lang.ast.Pipeline;
import org.saiql.engine.lang.ast.QueryAst;
import org.saiql.engine.lang.ast.QueryAstVisitor;
import org.saiql.engine.lang.ast.RelationAst;
import org.saiql.engine.lang.ast.Select;
import org.saiql.engine.lang.ast.SelectItem;
import org.saiql.engine.lang.ast.TableRef;
import org.saiql.engine.lang.ast.Update;
import org.saiql.engine.plan.JoinNode.JoinType;
import org.saiql.engine.plan.SortNode.SortItem;
import org.saiql.engine.store.Column;
import org.saiql.engine.store.ForeignKey;
import org.saiql.engine.store.SchemaCatalog;
import org.saiql.engine.store.Table;
import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Validates a parsed query against the schema and lowers it into the IR.
 *
 * <p>Read queries always come out in the shape
 * {@code Sink(Limit?(Sort?(Project|Aggregate(Filter?(from)))))}, where every
 * filter applies to the rows of the FROM tree. Either a complete plan is
 * returned or a {@link SemanticException} is thrown.
 */
public final class PlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);

    private final SchemaCatalog catalog;
    private final QueryFirewall firewall;

    public PlanBuilder(SchemaCatalog catalog, QueryFirewall firewall) {
        this.catalog = Objects.requireNonNull(catalog, "Schema catalog cannot be null");
        this.firewall = Objects.requireNonNull(firewall, "Query firewall cannot be null");
    }

    /**
     * Runs the firewall hook, then validates and lowers the query.
     *
     * @param query           parsed query
     * @param normalizedQuery normalized query text handed to the firewall
     * @return the IR
     * @throws SemanticException on any schema or semantic violation
     */
    public PlanNode build(QueryAst query, String normalizedQuery) {
        FirewallVerdict verdict = Objects.requireNonNull(firewall.inspect(normalizedQuery),
                "Firewall returned no verdict");
        if (verdict instanceof FirewallVerdict.Block block) {
            log.debug("Firewall rejected query: {}", block.reason());
            throw new SemanticException(ErrorCode.FIREWALL_REJECTED, "Query rejected: " + block.reason());
        }
        PlanNode plan = query.accept(new QueryLowering());
        log.debug("Built plan {}", plan);
        return plan;
    }

    private Table table(String name) {
        return catalog.findTable(name)
                .orElseThrow(() -> new SemanticException(ErrorCode.UNKNOWN_TABLE, "Unknown table '" + name + "'"));
    }

    private final class QueryLowering implements QueryAstVisitor<PlanNode> {

        @Override
        public PlanNode visit(Pipeline pipeline) {
            return new PipelineLowering().lower(pipeline);
        }

        @Override
        public PlanNode visit(Insert insert) {
            Table table = table(insert.table());
            List<Column> columns = new ArrayList<>();
            if (insert.columns().isEmpty()) {
                columns.addAll(table.columns());
            } else {
                Set<String> seen = new HashSet<>();
                for (String name : insert.columns()) {
                    Column column = column(table, name);
                    if (!seen.add(column.name().toLowerCase(Locale.ROOT))) {
                        throw new SemanticException(ErrorCode.DUPLICATE_ALIAS,
                                "Column '" + column.name() + "' is listed twice");
                    }
                    columns.add(column);
                }
            }

            List<List<Literal>> rows = new ArrayList<>();
            for (int r = 0; r < insert.rows().size(); r++) {
                List<ExprAst> values = insert.rows().get(r);
                if (values.size() != columns.size()) {
                    throw new SemanticException(ErrorCode.COLUMN_COUNT_MISMATCH, "Row " + (r + 1) + " has "
                            + values.size() + " values for " + columns.size() + " columns of " + table.name());
                }
                List<Literal> row = new ArrayList<>();
                for (int c = 0; c < values.size(); c++) {
                    row.add(assignment(values.get(c), columns.get(c), table));
                }
                rows.add(row);
            }
            return new InsertNode(table, columns, rows);
        }

        @Override
        public PlanNode visit(Update update) {
            Table table = table(update.table());
            List<UpdateNode.Assignment> assignments = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (Update.Assignment assignment : update.assignments()) {
                Column column = column(table, assignment.column());
                if (!seen.add(column.name().toLowerCase(Locale.ROOT))) {
                    throw new SemanticException(ErrorCode.DUPLICATE_ALIAS,
                            "Column '" + column.name() + "' is assigned twice");
                }
                assignments.add(new UpdateNode.Assignment(column, assignment(assignment.value(), column, table)));
            }
            return new UpdateNode(table, assignments, where(table, update.where()));
        }

        @Override
        public PlanNode visit(Delete delete) {
            Table table = table(delete.table());
            return new DeleteNode(table, where(table, delete.where()));
        }

        private Column column(Table table, String name) {
            return table.findColumn(name).orElseThrow(() -> new SemanticException(ErrorCode.UNKNOWN_COLUMN,
                    "Unknown column '" + name + "' in table " + table.name()));
        }

        private Literal assignment(ExprAst value, Column column, Table table) {
            if (!(value instanceof org.saiql.engine.lang.ast.Literal literal)) {
                throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                        "Only literal values can be assigned to " + table.name() + "." + column.name());
            }
            return LiteralBinder.forAssignment(literal, column, table.name());
        }

        private Expression where(Table table, ExprAst condition) {
            if (condition == null) {
                return null;
            }
            Scope scope = new Scope();
            scope.add(table.name(), table);
            return new ExpressionLowering(scope).condition(condition);
        }
    }

    /**
     * Lowers one read pipeline. Holds the scope of its FROM tree.
     */
    private final class PipelineLowering {
        private final Scope scope = new Scope();
        private final ExpressionLowering expressions = new ExpressionLowering(scope);
        private List<Scope.Entry> entries;
        private int cursor;

        RelationNode lower(Pipeline pipeline) {
            List<ExprAst> filters = new ArrayList<>();
            RelationAst projection = null;
            RelationAst node = pipeline.source();
            while (!(node instanceof TableRef) && !(node instanceof Join)) {
                if (node instanceof Filter filter) {
                    filters.add(filter.condition());
                    node = filter.source();
                } else if (projection != null) {
                    throw new SemanticException(ErrorCode.UNSUPPORTED_QUERY_SHAPE, "Nested projections are not supported");
                } else if (node instanceof Select select) {
                    projection = select;
                    node = select.source();
                } else {
                    Aggregate aggregate = (Aggregate) node;
                    projection = aggregate;
                    node = aggregate.source();
                }
            }
            // Innermost filter first
            Collections.reverse(filters);

            register(node);
            entries = scope.entries();
            RelationNode current = lowerFrom(node, List.of());

            List<Expression> conditions = new ArrayList<>();
            for (ExprAst filter : filters) {
                conditions.add(expressions.condition(filter));
            }
            Expression where = Expressions.and(conditions);
            if (where != null) {
                current = new FilterNode(current, where);
            }

            List<Projection> outputs;
            List<ColumnReference> groupKeys = null;
            boolean distinct = false;
            if (projection instanceof Aggregate aggregate) {
                AggregateNode lowered = aggregate(aggregate, current);
                outputs = lowered.groupColumns();
                groupKeys = lowered.groupBy();
                current = lowered;
            } else {
                Select select = projection == null
                        ? new Select(ColumnList.wildcard(), false, node)
                        : (Select) projection;
                outputs = project(select.columns());
                distinct = select.distinct();
                current = new ProjectNode(current, outputs, distinct);
            }

            List<SortItem> sort = new ArrayList<>();
            for (OrderItem item : pipeline.orderBy()) {
                sort.add(new SortItem(orderKey(item.column(), outputs), item.descending()));
            }

            Limit limit = pipeline.limit();
            Long rows = switch (limit.kind()) {
                case ROWS -> limit.rows();
                case ALL -> null;
                case FIRST -> 1L;
                case LAST -> {
                    sort = sort.isEmpty() ? primaryKeyOrder() : reversed(sort);
                    yield 1L;
                }
                case RANDOM -> {
                    if (!sort.isEmpty()) {
                        log.debug("RANDOM limit replaces the explicit ordering");
                    }
                    sort = List.of(new SortItem(SqlFunctionCall.random(), false));
                    yield 1L;
                }
            };

            checkSortKeys(sort, outputs, groupKeys, distinct);
            if (!sort.isEmpty()) {
                current = new SortNode(current, sort);
            }
            long offset = limit.offset() == null ? 0 : limit.offset();
            if (rows != null || offset > 0) {
                current = new LimitNode(current, rows, offset);
            }
            return new SinkNode(current, pipeline.sink());
        }

        private void register(RelationAst node) {
            if (node instanceof TableRef ref) {
                Table table = table(ref.name());
                scope.add(ref.alias() != null ? ref.alias() : table.name(), table);
            } else if (node instanceof Join join) {
                register(join.left());
                register(join.right());
            } else {
                throw new SemanticException(ErrorCode.UNSUPPORTED_QUERY_SHAPE, "Subqueries are not supported");
            }
        }

        private static int tableCount(RelationAst node) {
            return node instanceof Join join ? tableCount(join.left()) + tableCount(join.right()) : 1;
        }

        /**
         * Lowers the FROM tree. Conditions of a join whose left input is an
         * unconditioned join are handed down when they only read that input.
         */
        private RelationNode lowerFrom(RelationAst node, List<ExprAst> inherited) {
            if (node instanceof TableRef) {
                Scope.Entry entry = entries.get(cursor++);
                return ScanNode.of(entry.table(), entry.alias());
            }
            Join join = (Join) node;
            List<ExprAst> conjuncts = new ArrayList<>(inherited);
            if (join.condition() != null) {
                conjuncts.addAll(splitAnd(join.condition()));
            }

            List<ExprAst> down = new ArrayList<>();
            List<ExprAst> here = new ArrayList<>();
            if (join.left() instanceof Join leftJoin && leftJoin.condition() == null && leftJoin.kind() != JoinKind.CROSS) {
                Set<String> leftAliases = new HashSet<>();
                for (Scope.Entry entry : entries.subList(cursor, cursor + tableCount(join.left()))) {
                    leftAliases.add(entry.alias());
                }
                for (ExprAst conjunct : conjuncts) {
                    Set<String> used = Expressions.aliases(expressions.condition(conjunct));
                    if (!used.isEmpty() && leftAliases.containsAll(used)) {
                        down.add(conjunct);
                    } else {
                        here.add(conjunct);
                    }
                }
            } else {
                here.addAll(conjuncts);
            }

            RelationNode left = lowerFrom(join.left(), down);
            RelationNode right = lowerFrom(join.right(), List.of());

            List<Expression> lowered = new ArrayList<>();
            for (ExprAst conjunct : here) {
                lowered.add(expressions.condition(conjunct));
            }
            Expression condition = Expressions.and(lowered);
            JoinType type = joinType(join.kind());
            if (type == JoinType.CROSS) {
                return condition == null ? JoinNode.cross(left, right) : JoinNode.inner(left, right, condition);
            }
            if (condition == null) {
                condition = foreignKeyCondition(left, right);
            }
            return new JoinNode(left, right, condition, type);
        }

        private Expression foreignKeyCondition(RelationNode left, RelationNode right) {
            List<ScanNode> leftScans = PlanNodes.scans(left);
            List<ScanNode> rightScans = PlanNodes.scans(right);
            for (ScanNode r : rightScans) {
                for (ScanNode l : leftScans) {
                    Expression condition = foreignKeyCondition(l, r, r.table(), l.table(), false);
                    if (condition == null) {
                        condition = foreignKeyCondition(l, r, l.table(), r.table(), true);
                    }
                    if (condition != null) {
                        log.debug("Derived join condition {} from foreign key", condition);
                        return condition;
                    }
                }
            }
            throw new SemanticException(ErrorCode.MISSING_JOIN_CONDITION, "No join condition between "
                    + String.join(", ", PlanNodes.aliases(left)) + " and " + String.join(", ", PlanNodes.aliases(right))
                    + ", and no foreign key relates them");
        }

        /**
         * Equality over the first foreign key of {@code owner} that references
         * {@code referenced}, written left input first.
         */
        private Expression foreignKeyCondition(ScanNode left, ScanNode right, Table owner, Table referenced,
                                               boolean ownerOnLeft) {
            for (ForeignKey key : owner.foreignKeys()) {
                if (!key.referencedTable().equalsIgnoreCase(referenced.name())) {
                    continue;
                }
                ScanNode ownerScan = ownerOnLeft ? left : right;
                ScanNode referencedScan = ownerOnLeft ? right : left;
                List<Expression> equalities = new ArrayList<>();
                for (int i = 0; i < key.columns().size(); i++) {
                    ColumnReference from = reference(ownerScan, key.columns().get(i));
                    ColumnReference to = reference(referencedScan, key.referencedColumns().get(i));
                    equalities.add(ownerOnLeft
                            ? ComparisonExpression.equalTo(from, to)
                            : ComparisonExpression.equalTo(to, from));
                }
                return Expressions.and(equalities);
            }
            return null;
        }

        private ColumnReference reference(ScanNode scan, String columnName) {
            Column column = scan.table().findColumn(columnName).orElseThrow(() -> new SemanticException(
                    ErrorCode.UNKNOWN_COLUMN, "Foreign key column '" + columnName + "' not in " + scan.table().name()));
            return new ColumnReference(scan.alias(), column.name(), column.type());
        }

        private List<Projection> project(ColumnList columns) {
            OutputNames names = new OutputNames();
            List<Projection> projections = new ArrayList<>();
            for (ColumnList.Item item : columns.items()) {
                if (item.column().isWildcard()) {
                    for (ColumnReference ref : scope.expand(item.column())) {
                        projections.add(new Projection(ref, names.claim(ref, null)));
                    }
                } else {
                    ColumnReference ref = scope.resolve(item.column());
                    projections.add(new Projection(ref, names.claim(ref, item.alias())));
                }
            }
            return projections;
        }

        private AggregateNode aggregate(Aggregate aggregate, RelationNode source) {
            List<ColumnReference> groupBy = new ArrayList<>();
            for (ColumnRef key : aggregate.groupBy()) {
                groupBy.add(scope.resolve(key));
            }

            OutputNames names = new OutputNames();
            List<AggregateOutput> outputs = new ArrayList<>();
            for (SelectItem item : aggregate.items()) {
                if (item instanceof ColumnList.Item column) {
                    ColumnReference ref = scope.resolve(column.column());
                    if (!groupBy.contains(ref)) {
                        throw new SemanticException(ErrorCode.INVALID_AGGREGATE,
                                "Column " + ref + " must appear in GROUP BY or inside an aggregate");
                    }
                    outputs.add(new Projection(ref, names.claim(ref, column.alias())));
                } else {
                    outputs.add(call((org.saiql.engine.lang.ast.AggregateCall) item, names));
                }
            }
            return new AggregateNode(source, outputs, groupBy);
        }

        private AggregateCall call(org.saiql.engine.lang.ast.AggregateCall call, OutputNames names) {
            AggregateFunction function = call.function();
            ColumnReference argument = null;
            if (call.argument() != null && !call.argument().isWildcard()) {
                argument = scope.resolve(call.argument());
            } else if (function != AggregateFunction.COUNT) {
                throw new SemanticException(ErrorCode.INVALID_AGGREGATE, function + " requires a column, not *");
            }
            String alias = call.alias() != null ? call.alias() : defaultAlias(function, argument);
            return new AggregateCall(function, argument, names.claimAlias(alias), resultType(function, argument));
        }

        private ColumnReference orderKey(ColumnRef column, List<Projection> outputs) {
            if (column.qualifier() == null) {
                for (Projection output : outputs) {
                    if (output.alias().equalsIgnoreCase(column.name())
                            && !output.alias().equalsIgnoreCase(output.expression().columnName())) {
                        return output.expression();
                    }
                }
            }
            return scope.resolve(column);
        }

        private List<SortItem> primaryKeyOrder() {
            Scope.Entry first = scope.first();
            Table table = first.table();
            if (table.primaryKey().isEmpty()) {
                throw new SemanticException(ErrorCode.MISSING_ORDER_KEY,
                        "LAST needs an ORDER stage or a primary key on " + table.name());
            }
            List<SortItem> items = new ArrayList<>();
            for (String key : table.primaryKey()) {
                items.add(new SortItem(first.reference(table.getColumn(key)), true));
            }
            return items;
        }

        private void checkSortKeys(List<SortItem> sort, List<Projection> outputs, List<ColumnReference> groupKeys,
                                   boolean distinct) {
            for (SortItem item : sort) {
                if (!(item.key() instanceof ColumnReference key)) {
                    continue;
                }
                if (groupKeys != null && !groupKeys.contains(key)) {
                    throw new SemanticException(ErrorCode.INVALID_AGGREGATE,
                            "Ordering column " + key + " must be a GROUP BY column");
                }
                if (distinct && outputs.stream().noneMatch(p -> p.expression().equals(key))) {
                    throw new SemanticException(ErrorCode.UNSUPPORTED_QUERY_SHAPE,
                            "Ordering column " + key + " must be selected when DISTINCT is used");
                }
            }
        }
    }

    /**
     * Hands out unique output column names, case-insensitively.
     */
    private static final class OutputNames {
        private final Set<String> used = new HashSet<>();

        String claim(ColumnReference ref, String alias) {
            if (alias != null) {
                return claimAlias(alias);
            }
            String name = ref.columnName();
            if (!used.add(name.toLowerCase(Locale.ROOT))) {
                name = ref.tableAlias() + "_" + ref.columnName();
                return claimAlias(name);
            }
            return name;
        }

        String claimAlias(String alias) {
            if (!used.add(alias.toLowerCase(Locale.ROOT))) {
                throw new SemanticException(ErrorCode.DUPLICATE_ALIAS, "Duplicate output column '" + alias + "'");
            }
            return alias;
        }
    }

    private static List<ExprAst> splitAnd(ExprAst condition) {
        List<ExprAst> result = new ArrayList<>();
        if (condition instanceof BinaryOp op && op.operator() == BinaryOp.Operator.AND) {
            result.addAll(splitAnd(op.left()));
            result.addAll(splitAnd(op.right()));
        } else {
            result.add(condition);
        }
        return result;
    }

    private static List<SortItem> reversed(List<SortItem> items) {
        return items.stream().map(i -> new SortItem(i.key(), !i.descending())).toList();
    }

    private static JoinType joinType(JoinKind kind) {
        return switch (kind) {
            case INNER -> JoinType.INNER;
            case LEFT -> JoinType.LEFT_OUTER;
            case RIGHT -> JoinType.RIGHT_OUTER;
            case FULL -> JoinType.FULL_OUTER;
            case CROSS -> JoinType.CROSS;
        };
    }

    private static String defaultAlias(AggregateFunction function, ColumnReference argument) {
        String name = function.name().toLowerCase(Locale.ROOT);
        return argument == null ? name : name + "_" + argument.columnName();
    }

    private static CanonicalType resultType(AggregateFunction function, ColumnReference argument) {
        if (function == AggregateFunction.COUNT) {
            return CanonicalType.of(TypeKind.INTEGER64).notNull();
        }
        CanonicalType type = argument.type();
        TypeKind kind = type.kind();
        switch (function) {
            case SUM, AVG -> {
                if (kind.family() != TypeKind.Family.NUMERIC) {
                    throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                            function + " needs a numeric column, got " + argument + " (" + type.signature() + ")");
                }
                if (function == AggregateFunction.SUM && kind.isInteger()) {
                    return CanonicalType.of(TypeKind.INTEGER64);
                }
                if (kind == TypeKind.DECIMAL) {
                    return CanonicalType.of(TypeKind.DECIMAL);
                }
                return CanonicalType.of(TypeKind.FLOAT64);
            }
            default -> {
                if (kind.family() == TypeKind.Family.BINARY || kind.family() == TypeKind.Family.JSON) {
                    throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                            function + " cannot order values of " + argument + " (" + type.signature() + ")");
                }
                return type.withNullable(true);
            }
        }
    }
}
