package org.saiql.engine.optimizer;

import org.saiql.engine.plan.AggregateCall;
import org.saiql.engine.plan.AggregateNode;
import org.saiql.engine.plan.ColumnReference;
import org.saiql.engine.plan.Expressions;
import org.saiql.engine.plan.FilterNode;
import org.saiql.engine.plan.JoinNode;
import org.saiql.engine.plan.LimitNode;
import org.saiql.engine.plan.ProjectNode;
import org.saiql.engine.plan.Projection;
import org.saiql.engine.plan.RelationNode;
import org.saiql.engine.plan.RelationNodeVisitor;
import org.saiql.engine.plan.ScanNode;
import org.saiql.engine.plan.SinkNode;
import org.saiql.engine.plan.SortNode;
import org.saiql.engine.store.Column;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shrinks every scan to the columns something above it reads.
 */
public final class ProjectionPruningRule implements OptimizationRule {

    @Override
    public RelationNode apply(RelationNode plan, OptimizerContext context) {
        Set<String> required = new HashSet<>();
        plan.accept(new RequiredColumns(required));
        return new PlanRewriter() {
            @Override
            public RelationNode visit(ScanNode scan) {
                List<Column> kept = scan.table().columns().stream()
                        .filter(c -> required.contains(key(scan.alias(), c.name())))
                        .toList();
                return scan.withColumns(kept);
            }
        }.rewrite(plan);
    }

    private static String key(String alias, String column) {
        return alias + "\u0000" + column;
    }

    /**
     * Collects every column read above the scans. Aliases are unique within
     * a plan, so alias and column name identify a scan column.
     */
    private static final class RequiredColumns implements RelationNodeVisitor<Void> {
        private final Set<String> into;

        RequiredColumns(Set<String> into) {
            this.into = into;
        }

        private void add(ColumnReference column) {
            into.add(key(column.tableAlias(), column.columnName()));
        }

        @Override
        public Void visit(ScanNode scan) {
            return null;
        }

        @Override
        public Void visit(FilterNode filter) {
            Expressions.columns(filter.condition()).forEach(this::add);
            return filter.source().accept(this);
        }

        @Override
        public Void visit(ProjectNode project) {
            for (Projection projection : project.projections()) {
                add(projection.expression());
            }
            return project.source().accept(this);
        }

        @Override
        public Void visit(JoinNode join) {
            if (join.condition() != null) {
                Expressions.columns(join.condition()).forEach(this::add);
            }
            join.left().accept(this);
            return join.right().accept(this);
        }

        @Override
        public Void visit(AggregateNode aggregate) {
            aggregate.groupBy().forEach(this::add);
            aggregate.groupColumns().forEach(p -> add(p.expression()));
            for (AggregateCall call : aggregate.calls()) {
                if (call.argument() != null) {
                    add(call.argument());
                }
            }
            return aggregate.source().accept(this);
        }

        @Override
        public Void visit(SortNode sort) {
            for (SortNode.SortItem item : sort.items()) {
                Expressions.columns(item.key()).forEach(this::add);
            }
            return sort.source().accept(this);
        }

        @Override
        public Void visit(LimitNode limit) {
            return limit.source().accept(this);
        }

        @Override
        public Void visit(SinkNode sink) {
            return sink.source().accept(this);
        }
    }
}
