package org.saiql.engine.transpiler;

import org.saiql.engine.CompileWarning;
import org.saiql.engine.WarningCode;
import org.saiql.engine.lang.ast.SinkFormat;
import org.saiql.engine.plan.AggregateCall;
import org.saiql.engine.plan.AggregateNode;
import org.saiql.engine.plan.AggregateOutput;
import org.saiql.engine.plan.ColumnReference;
import org.saiql.engine.plan.ComparisonExpression;
import org.saiql.engine.plan.ComparisonExpression.ComparisonOperator;
import org.saiql.engine.plan.DeleteNode;
import org.saiql.engine.plan.Expression;
import org.saiql.engine.plan.ExpressionVisitor;
import org.saiql.engine.plan.Expressions;
import org.saiql.engine.plan.FilterNode;
import org.saiql.engine.plan.InExpression;
import org.saiql.engine.plan.InsertNode;
import org.saiql.engine.plan.IsNullExpression;
import org.saiql.engine.plan.JoinNode;
import org.saiql.engine.plan.JoinNode.JoinType;
import org.saiql.engine.plan.LimitNode;
import org.saiql.engine.plan.Literal;
import org.saiql.engine.plan.LogicalExpression;
import org.saiql.engine.plan.LogicalExpression.LogicalOperator;
import org.saiql.engine.plan.MutationNode;
import org.saiql.engine.plan.MutationNodeVisitor;
import org.saiql.engine.plan.PlanNode;
import org.saiql.engine.plan.ProjectNode;
import org.saiql.engine.plan.Projection;
import org.saiql.engine.plan.RelationNode;
import org.saiql.engine.plan.ResultColumn;
import org.saiql.engine.plan.ScanNode;
import org.saiql.engine.plan.SinkNode;
import org.saiql.engine.plan.SortNode;
import org.saiql.engine.plan.SqlFunctionCall;
import org.saiql.engine.plan.UpdateNode;
import org.saiql.engine.store.Column;
import org.saiql.engine.transpiler.json.JsonSqlDialect;
import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;
import org.saiql.engine.types.TypeMapping;
import org.saiql.engine.types.TypeMappingException;
import org.saiql.engine.types.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Transpiles an optimized plan into one parameterized SQL statement.
 *
 * <p>Clauses are emitted in statement order, so placeholders are numbered in
 * the order they appear in the text. Every literal becomes a bound parameter;
 * only validated LIMIT/OFFSET counts are written inline.
 *
 * <p>Instances are immutable; each {@link #generate} call keeps its own state.
 */
public final class SQLGenerator {

    private static final Logger log = LoggerFactory.getLogger(SQLGenerator.class);

    private static final String JSON_RESULT_COLUMN = "result";
    private static final String JSON_SUBQUERY_ALIAS = "q";

    private final SQLDialect dialect;
    private final TypeRegistry typeRegistry;
    private final Set<FeatureId> overrides;
    private final boolean deferUnsupported;

    public SQLGenerator(SQLDialect dialect, TypeRegistry typeRegistry, Set<FeatureId> overrides,
                        boolean deferUnsupported) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "Type registry cannot be null");
        this.overrides = overrides.isEmpty() ? EnumSet.noneOf(FeatureId.class) : EnumSet.copyOf(overrides);
        this.deferUnsupported = deferUnsupported;
    }

    public SQLGenerator(SQLDialect dialect) {
        this(dialect, TypeRegistry.standard(), Set.of(), false);
    }

    /**
     * Generates SQL for a read plan or a mutation.
     *
     * @throws CodegenException when the dialect cannot express the plan and no
     *                          override or deferral applies
     */
    public GeneratedSql generate(PlanNode plan) {
        Objects.requireNonNull(plan, "Plan cannot be null");
        Generation generation = new Generation();
        String sql;
        List<ResultColumn> resultColumns;
        if (plan instanceof SinkNode sink) {
            sql = generation.read(sink);
            resultColumns = generation.resultColumns;
        } else if (plan instanceof MutationNode mutation) {
            sql = mutation.accept(generation.mutations());
            resultColumns = List.of();
        } else {
            throw new IllegalArgumentException("Read plans must be topped by a sink: " + plan);
        }
        log.debug("Generated {} SQL: {}", dialect.name(), sql);
        return new GeneratedSql(sql, generation.parameters, resultColumns,
                new ArrayList<>(generation.warnings), generation.requiresOverride);
    }

    /**
     * State of one generate call.
     */
    private final class Generation implements ExpressionVisitor<String> {
        private final List<BoundParameter> parameters = new ArrayList<>();
        private final Set<CompileWarning> warnings = new LinkedHashSet<>();
        private List<ResultColumn> resultColumns = List.of();
        private boolean requiresOverride;
        private boolean qualifyColumns = true;

        // ==================== Reads ====================

        String read(SinkNode sink) {
            RelationNode node = sink.source();
            LimitNode limit = null;
            SortNode sort = null;
            if (node instanceof LimitNode l) {
                limit = l;
                node = l.source();
            }
            if (node instanceof SortNode s) {
                sort = s;
                node = s.source();
            }
            Long rows = limit == null ? null : limit.limit();
            long offset = limit == null ? 0 : limit.offset();

            StringBuilder sql = new StringBuilder("SELECT ");
            RelationNode from;
            List<String> outputNames = new ArrayList<>();
            List<ColumnReference> groupBy = List.of();
            if (node instanceof AggregateNode aggregate) {
                sql.append(dialect.selectPrefix(rows, offset));
                sql.append(aggregateList(aggregate, outputNames));
                groupBy = aggregate.groupBy();
                from = aggregate.source();
            } else if (node instanceof ProjectNode project) {
                if (project.distinct()) {
                    sql.append("DISTINCT ");
                }
                sql.append(dialect.selectPrefix(rows, offset));
                sql.append(projectionList(project, outputNames));
                from = project.source();
            } else {
                throw new IllegalStateException("Expected a projection or aggregate below the sink, found " + node);
            }

            List<Expression> where = new ArrayList<>();
            sql.append(" FROM ").append(from(from, where));
            if (!where.isEmpty()) {
                sql.append(" WHERE ").append(condition(Expressions.and(where)));
            }
            if (!groupBy.isEmpty()) {
                sql.append(" GROUP BY ").append(groupBy.stream().map(this::render).collect(Collectors.joining(", ")));
            }
            if (sort != null) {
                sql.append(" ORDER BY ").append(sort.items().stream()
                        .map(item -> render(item.key()) + (item.descending() ? " DESC" : " ASC"))
                        .collect(Collectors.joining(", ")));
            }
            sql.append(dialect.limitClause(rows, offset, sort != null));

            if (sink.format() == SinkFormat.JSON) {
                return json(sql.toString(), outputNames);
            }
            return sql.toString();
        }

        private String projectionList(ProjectNode project, List<String> outputNames) {
            List<String> items = new ArrayList<>();
            List<ResultColumn> columns = new ArrayList<>();
            for (Projection projection : project.projections()) {
                items.add(projection(projection));
                outputNames.add(projection.alias());
                columns.add(new ResultColumn(projection.alias(), projection.expression().type()));
                checkType(projection.expression().toString(), projection.expression().type());
            }
            resultColumns = columns;
            return String.join(", ", items);
        }

        private String aggregateList(AggregateNode aggregate, List<String> outputNames) {
            List<String> items = new ArrayList<>();
            List<ResultColumn> columns = new ArrayList<>();
            for (AggregateOutput output : aggregate.outputs()) {
                if (output instanceof Projection projection) {
                    items.add(projection(projection));
                    checkType(projection.expression().toString(), projection.type());
                } else {
                    AggregateCall call = (AggregateCall) output;
                    String argument = call.isCountStar() ? "*" : render(call.argument());
                    items.add(dialect.aggregate(call.function(), argument) + " AS "
                            + dialect.quoteIdentifier(call.alias()));
                }
                outputNames.add(output.alias());
                columns.add(new ResultColumn(output.alias(), output.type()));
            }
            resultColumns = columns;
            return String.join(", ", items);
        }

        private String projection(Projection projection) {
            String column = render(projection.expression());
            return projection.alias().equals(projection.expression().columnName())
                    ? column
                    : column + " AS " + dialect.quoteIdentifier(projection.alias());
        }

        private String from(RelationNode node, List<Expression> where) {
            return from(node, where, false);
        }

        /**
         * Renders a FROM tree. Filters found inside it go to {@code where},
         * except below the unpreserved side of an outer join, where they
         * become part of that join's ON condition. A scan feeding a join reads
         * only the columns left after projection pruning.
         */
        private String from(RelationNode node, List<Expression> where, boolean joinInput) {
            if (node instanceof ScanNode scan) {
                return joinInput ? prunedTable(scan) : table(scan);
            }
            if (node instanceof FilterNode filter) {
                where.addAll(Expressions.conjuncts(filter.condition()));
                return from(filter.source(), where, joinInput);
            }
            if (node instanceof JoinNode join) {
                return join(join, where);
            }
            throw new IllegalStateException("Unexpected node in FROM clause: " + node);
        }

        private String join(JoinNode join, List<Expression> where) {
            RelationNode left = join.left();
            RelationNode right = join.right();
            JoinType type = join.joinType();
            if (type == JoinType.RIGHT_OUTER && !dialect.supports(FeatureId.RIGHT_OUTER_JOIN)) {
                left = join.right();
                right = join.left();
                type = JoinType.LEFT_OUTER;
            }
            if (type == JoinType.FULL_OUTER && !dialect.supports(FeatureId.FULL_OUTER_JOIN)) {
                unsupported(FeatureId.FULL_OUTER_JOIN, dialect.name() + " has no FULL OUTER JOIN",
                        "rendered as LEFT OUTER JOIN, rows found only on the right are dropped");
                type = JoinType.LEFT_OUTER;
            }

            List<Expression> on = new ArrayList<>();
            String leftSql = joinInput(left, type, type.preservesRight() ? on : where);
            String rightSql = joinInput(right, type, type.preservesLeft() ? on : where);
            if (containsJoin(right)) {
                rightSql = "(" + rightSql + ")";
            }
            if (join.condition() != null) {
                on.addAll(0, Expressions.conjuncts(join.condition()));
            }

            if (on.isEmpty()) {
                return leftSql + " CROSS JOIN " + rightSql;
            }
            String joinSql = type == JoinType.CROSS ? JoinType.INNER.toSql() : type.toSql();
            return leftSql + " " + joinSql + " " + rightSql + " ON " + condition(Expressions.and(on));
        }

        /**
         * Both sides of a FULL OUTER JOIN are preserved, so neither ON nor
         * WHERE can hold a filter on one of its inputs; the filter is applied
         * inside a derived table instead.
         */
        private String joinInput(RelationNode input, JoinType type, List<Expression> filters) {
            if (type == JoinType.FULL_OUTER && input instanceof FilterNode filter) {
                if (!(filter.source() instanceof ScanNode scan)) {
                    throw new IllegalStateException("A filtered FULL OUTER JOIN input must be a table scan: " + input);
                }
                String inner = "SELECT " + scanColumns(scan) + " FROM " + table(scan)
                        + " WHERE " + condition(filter.condition());
                return dialect.aliasTable("(" + inner + ")", dialect.quoteIdentifier(scan.alias()));
            }
            return from(input, filters, true);
        }

        /**
         * A scan narrowed by pruning becomes a derived table of its kept
         * columns; an unpruned or column-less scan stays a plain table.
         */
        private String prunedTable(ScanNode scan) {
            int kept = scan.columns().size();
            if (kept == 0 || kept == scan.table().columns().size()) {
                return table(scan);
            }
            String inner = "SELECT " + scanColumns(scan) + " FROM " + dialect.quoteIdentifier(scan.table().name());
            return dialect.aliasTable("(" + inner + ")", dialect.quoteIdentifier(scan.alias()));
        }

        private String scanColumns(ScanNode scan) {
            List<Column> columns = scan.columns().isEmpty() ? scan.table().columns() : scan.columns();
            return columns.stream().map(c -> dialect.quoteIdentifier(c.name())).collect(Collectors.joining(", "));
        }

        private boolean containsJoin(RelationNode node) {
            if (node instanceof FilterNode filter) {
                return containsJoin(filter.source());
            }
            return node instanceof JoinNode;
        }

        private String table(ScanNode scan) {
            String table = dialect.quoteIdentifier(scan.table().name());
            return scan.alias().equals(scan.table().name())
                    ? table
                    : dialect.aliasTable(table, dialect.quoteIdentifier(scan.alias()));
        }

        private String json(String inner, List<String> outputNames) {
            JsonSqlDialect json = dialect.getJsonDialect();
            if (json == null || !dialect.supports(FeatureId.JSON_OUTPUT)) {
                unsupported(FeatureId.JSON_OUTPUT, dialect.name() + " cannot build JSON output",
                        "plain rows are returned");
                return inner;
            }
            String alias = dialect.quoteIdentifier(JSON_SUBQUERY_ALIAS);
            List<String> values = outputNames.stream()
                    .map(name -> alias + "." + dialect.quoteIdentifier(name))
                    .toList();
            resultColumns = List.of(new ResultColumn(JSON_RESULT_COLUMN, CanonicalType.of(TypeKind.JSON)));
            return "SELECT " + json.jsonArrayAgg(json.jsonObject(outputNames, values))
                    + " AS " + dialect.quoteIdentifier(JSON_RESULT_COLUMN)
                    + " FROM " + dialect.aliasTable("(" + inner + ")", alias);
        }

        // ==================== Mutations ====================

        MutationNodeVisitor<String> mutations() {
            qualifyColumns = false;
            return new MutationNodeVisitor<>() {
                @Override
                public String visit(InsertNode insert) {
                    String table = dialect.quoteIdentifier(insert.table().name());
                    insert.columns().forEach(c -> checkType(insert.table().name() + "." + c.name(), c.type()));
                    String columns = insert.columns().stream()
                            .map(c -> dialect.quoteIdentifier(c.name()))
                            .collect(Collectors.joining(", "));
                    List<String> rows = new ArrayList<>();
                    for (List<Literal> row : insert.rows()) {
                        rows.add(row.stream().map(Generation.this::render).collect(Collectors.joining(", ", "(", ")")));
                    }
                    return "INSERT INTO " + table + " (" + columns + ") VALUES " + String.join(", ", rows);
                }

                @Override
                public String visit(UpdateNode update) {
                    StringBuilder sql = new StringBuilder("UPDATE ")
                            .append(dialect.quoteIdentifier(update.table().name())).append(" SET ");
                    List<String> assignments = new ArrayList<>();
                    for (UpdateNode.Assignment assignment : update.assignments()) {
                        Column column = assignment.column();
                        checkType(update.table().name() + "." + column.name(), column.type());
                        assignments.add(dialect.quoteIdentifier(column.name()) + " = " + render(assignment.value()));
                    }
                    sql.append(String.join(", ", assignments));
                    if (update.whereClause() != null) {
                        sql.append(" WHERE ").append(condition(update.whereClause()));
                    }
                    return sql.toString();
                }

                @Override
                public String visit(DeleteNode delete) {
                    String sql = "DELETE FROM " + dialect.quoteIdentifier(delete.table().name());
                    return delete.whereClause() == null ? sql : sql + " WHERE " + condition(delete.whereClause());
                }
            };
        }

        // ==================== Expressions ====================

        private String render(Expression expression) {
            return expression.accept(this);
        }

        /**
         * An expression in a position that needs a predicate.
         */
        private String condition(Expression expression) {
            if (expression instanceof ColumnReference || expression instanceof Literal) {
                return dialect.booleanCondition(render(expression));
            }
            return render(expression);
        }

        @Override
        public String visitColumnReference(ColumnReference columnRef) {
            String column = dialect.quoteIdentifier(columnRef.columnName());
            return qualifyColumns ? dialect.quoteIdentifier(columnRef.tableAlias()) + "." + column : column;
        }

        @Override
        public String visitLiteral(Literal literal) {
            int index = parameters.size() + 1;
            parameters.add(new BoundParameter(index, literal.value(), literal.type()));
            return dialect.placeholder(index);
        }

        @Override
        public String visitComparison(ComparisonExpression comparison) {
            String left = render(comparison.left());
            String right = render(comparison.right());
            if (comparison.operator() == ComparisonOperator.ILIKE) {
                return dialect.caseInsensitiveLike(left, right);
            }
            return left + " " + comparison.operator().toSql() + " " + right;
        }

        @Override
        public String visitLogical(LogicalExpression logical) {
            if (logical.operator() == LogicalOperator.NOT) {
                return "NOT (" + condition(logical.operands().get(0)) + ")";
            }
            String separator = " " + logical.operator().name() + " ";
            List<String> operands = new ArrayList<>();
            for (Expression operand : logical.operands()) {
                String sql = condition(operand);
                if (operand instanceof LogicalExpression nested
                        && nested.operator() != LogicalOperator.NOT
                        && nested.operator() != logical.operator()) {
                    sql = "(" + sql + ")";
                }
                operands.add(sql);
            }
            return String.join(separator, operands);
        }

        @Override
        public String visitIsNull(IsNullExpression isNull) {
            return render(isNull.operand()) + (isNull.negated() ? " IS NOT NULL" : " IS NULL");
        }

        @Override
        public String visitIn(InExpression in) {
            String operand = render(in.operand());
            String values = in.values().stream().map(this::render).collect(Collectors.joining(", ", "(", ")"));
            return operand + (in.negated() ? " NOT IN " : " IN ") + values;
        }

        @Override
        public String visitFunctionCall(SqlFunctionCall functionCall) {
            List<String> arguments = functionCall.arguments().stream().map(this::render).toList();
            return dialect.function(functionCall.function(), arguments);
        }

        // ==================== Diagnostics ====================

        private void checkType(String label, CanonicalType type) {
            try {
                TypeMapping mapping = typeRegistry.toTarget(type, dialect.id());
                if (mapping.lossy()) {
                    warnings.add(new CompileWarning(WarningCode.LOSSY_MAPPING,
                            label + " as " + mapping.targetSignature() + ": " + mapping.reason()));
                }
            } catch (TypeMappingException e) {
                unsupported(FeatureId.UNMAPPED_TYPE, label + ": " + e.getMessage(),
                        "values are exchanged as text");
            }
        }

        private void unsupported(FeatureId feature, String message, String fallback) {
            if (overrides.contains(feature)) {
                log.debug("Override for {}: {}", feature, message);
                warnings.add(new CompileWarning(WarningCode.OVERRIDE_USED, message + "; " + fallback));
            } else if (deferUnsupported) {
                warnings.add(new CompileWarning(WarningCode.UNSUPPORTED_FEATURE, feature + ": " + message));
                requiresOverride = true;
            } else {
                throw new CodegenException(feature, message + " (allow an override for " + feature + " to accept: "
                        + fallback + ")");
            }
        }
    }
}
