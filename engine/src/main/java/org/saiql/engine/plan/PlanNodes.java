package org.saiql.engine.plan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural queries over relation trees.
 */
public final class PlanNodes {

    private PlanNodes() {
    }

    /**
     * Scans below a node, left to right.
     */
    public static List<ScanNode> scans(RelationNode node) {
        List<ScanNode> result = new ArrayList<>();
        node.accept(new ScanCollector(result));
        return result;
    }

    /**
     * Aliases of the scans below a node, left to right.
     */
    public static Set<String> aliases(RelationNode node) {
        Set<String> result = new LinkedHashSet<>();
        for (ScanNode scan : scans(node)) {
            result.add(scan.alias());
        }
        return result;
    }

    private static final class ScanCollector implements RelationNodeVisitor<Void> {
        private final List<ScanNode> into;

        ScanCollector(List<ScanNode> into) {
            this.into = into;
        }

        @Override
        public Void visit(ScanNode scan) {
            into.add(scan);
            return null;
        }

        @Override
        public Void visit(FilterNode filter) {
            return filter.source().accept(this);
        }

        @Override
        public Void visit(ProjectNode project) {
            return project.source().accept(this);
        }

        @Override
        public Void visit(JoinNode join) {
            join.left().accept(this);
            return join.right().accept(this);
        }

        @Override
        public Void visit(AggregateNode aggregate) {
            return aggregate.source().accept(this);
        }

        @Override
        public Void visit(SortNode sort) {
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
