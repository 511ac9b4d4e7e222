package org.saiql.engine.plan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers for taking conditions apart and putting them back together.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Splits nested ANDs into their conjuncts, left to right.
     */
    public static List<Expression> conjuncts(Expression condition) {
        List<Expression> result = new ArrayList<>();
        collectConjuncts(condition, result);
        return result;
    }

    private static void collectConjuncts(Expression condition, List<Expression> into) {
        if (condition instanceof LogicalExpression logical
                && logical.operator() == LogicalExpression.LogicalOperator.AND) {
            for (Expression operand : logical.operands()) {
                collectConjuncts(operand, into);
            }
        } else {
            into.add(condition);
        }
    }

    /**
     * ANDs the conjuncts together; a single conjunct is returned as is.
     *
     * @return the combined condition, or null when the list is empty
     */
    public static Expression and(List<Expression> conjuncts) {
        if (conjuncts.isEmpty()) {
            return null;
        }
        if (conjuncts.size() == 1) {
            return conjuncts.get(0);
        }
        return new LogicalExpression(LogicalExpression.LogicalOperator.AND, conjuncts);
    }

    /**
     * Every column reference in the expression, in order of appearance.
     */
    public static List<ColumnReference> columns(Expression expression) {
        List<ColumnReference> result = new ArrayList<>();
        expression.accept(new ColumnCollector(result));
        return result;
    }

    /**
     * Aliases of the scans an expression reads.
     */
    public static Set<String> aliases(Expression expression) {
        Set<String> result = new LinkedHashSet<>();
        for (ColumnReference column : columns(expression)) {
            result.add(column.tableAlias());
        }
        return result;
    }

    private static final class ColumnCollector implements ExpressionVisitor<Void> {
        private final List<ColumnReference> into;

        ColumnCollector(List<ColumnReference> into) {
            this.into = into;
        }

        @Override
        public Void visitColumnReference(ColumnReference columnRef) {
            into.add(columnRef);
            return null;
        }

        @Override
        public Void visitLiteral(Literal literal) {
            return null;
        }

        @Override
        public Void visitComparison(ComparisonExpression comparison) {
            comparison.left().accept(this);
            comparison.right().accept(this);
            return null;
        }

        @Override
        public Void visitLogical(LogicalExpression logical) {
            logical.operands().forEach(operand -> operand.accept(this));
            return null;
        }

        @Override
        public Void visitIsNull(IsNullExpression isNull) {
            isNull.operand().accept(this);
            return null;
        }

        @Override
        public Void visitIn(InExpression in) {
            in.operand().accept(this);
            return null;
        }

        @Override
        public Void visitFunctionCall(SqlFunctionCall functionCall) {
            functionCall.arguments().forEach(argument -> argument.accept(this));
            return null;
        }
    }
}
