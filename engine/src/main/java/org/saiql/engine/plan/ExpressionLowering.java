package org.saiql.engine.plan;

import org.saiql.engine.ErrorCode;
import org.saiql.engine.lang.ast.BinaryOp;
import org.saiql.engine.lang.ast.ColumnRef;
import org.saiql.engine.lang.ast.ExprAst;
import org.saiql.engine.lang.ast.ExprAstVisitor;
import org.saiql.engine.lang.ast.FunctionCall;
import org.saiql.engine.lang.ast.InList;
import org.saiql.engine.lang.ast.IsNull;
import org.saiql.engine.lang.ast.Not;
import org.saiql.engine.plan.ComparisonExpression.ComparisonOperator;
import org.saiql.engine.plan.SqlFunctionCall.ScalarFunction;
import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers condition ASTs into typed IR expressions against a scope.
 */
final class ExpressionLowering implements ExprAstVisitor<Expression> {

    private final Scope scope;

    ExpressionLowering(Scope scope) {
        this.scope = scope;
    }

    /**
     * Lowers a condition and checks that it yields a boolean.
     */
    Expression condition(ExprAst condition) {
        Expression lowered = condition.accept(this);
        requireBoolean(lowered);
        return lowered;
    }

    @Override
    public Expression visit(org.saiql.engine.lang.ast.Literal literal) {
        return LiteralBinder.standalone(literal);
    }

    @Override
    public Expression visit(ColumnRef columnRef) {
        return scope.resolve(columnRef);
    }

    @Override
    public Expression visit(BinaryOp binaryOp) {
        if (binaryOp.operator().isLogical()) {
            Expression left = condition(binaryOp.left());
            Expression right = condition(binaryOp.right());
            LogicalExpression.LogicalOperator operator = binaryOp.operator() == BinaryOp.Operator.AND
                    ? LogicalExpression.LogicalOperator.AND
                    : LogicalExpression.LogicalOperator.OR;
            return new LogicalExpression(operator, List.of(left, right));
        }
        return comparison(toComparison(binaryOp.operator()), binaryOp.left(), binaryOp.right());
    }

    @Override
    public Expression visit(Not not) {
        return LogicalExpression.not(condition(not.operand()));
    }

    @Override
    public Expression visit(FunctionCall functionCall) {
        ScalarFunction function = ScalarFunction.fromName(functionCall.name())
                .orElseThrow(() -> new SemanticException(ErrorCode.UNKNOWN_FUNCTION,
                        "Unknown function '" + functionCall.name() + "'"));
        if (functionCall.arguments().size() != function.arity()) {
            throw new SemanticException(ErrorCode.TYPE_MISMATCH, function + " takes " + function.arity()
                    + " argument(s), got " + functionCall.arguments().size());
        }
        List<Expression> arguments = new ArrayList<>();
        for (ExprAst argument : functionCall.arguments()) {
            Expression lowered = argument.accept(this);
            if (lowered.type().kind().family() != TypeKind.Family.CHARACTER) {
                throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                        function + " expects text, got " + describe(lowered));
            }
            arguments.add(lowered);
        }
        CanonicalType type = function == ScalarFunction.LENGTH
                ? CanonicalType.of(TypeKind.INTEGER64)
                : arguments.get(0).type();
        return new SqlFunctionCall(function, arguments, type);
    }

    @Override
    public Expression visit(IsNull isNull) {
        if (isNull.operand() instanceof org.saiql.engine.lang.ast.Literal) {
            throw new SemanticException(ErrorCode.TYPE_MISMATCH, "IS NULL must test a column or function");
        }
        return new IsNullExpression(isNull.operand().accept(this), isNull.negated());
    }

    @Override
    public Expression visit(InList inList) {
        Expression operand = inList.operand().accept(this);
        List<Literal> values = new ArrayList<>();
        for (org.saiql.engine.lang.ast.Literal value : inList.values()) {
            values.add(LiteralBinder.forComparison(value, operand.type(), operand.toString()));
        }
        return new InExpression(operand, values, inList.negated());
    }

    private Expression comparison(ComparisonOperator operator, ExprAst leftAst, ExprAst rightAst) {
        Expression left;
        Expression right;
        if (leftAst instanceof org.saiql.engine.lang.ast.Literal leftLiteral
                && !(rightAst instanceof org.saiql.engine.lang.ast.Literal)) {
            right = rightAst.accept(this);
            left = LiteralBinder.forComparison(leftLiteral, right.type(), right.toString());
        } else {
            left = leftAst.accept(this);
            right = rightAst instanceof org.saiql.engine.lang.ast.Literal rightLiteral
                    && !(leftAst instanceof org.saiql.engine.lang.ast.Literal)
                    ? LiteralBinder.forComparison(rightLiteral, left.type(), left.toString())
                    : rightAst.accept(this);
        }

        TypeKind.Family leftFamily = left.type().kind().family();
        TypeKind.Family rightFamily = right.type().kind().family();
        if (operator == ComparisonOperator.LIKE || operator == ComparisonOperator.ILIKE) {
            if (leftFamily != TypeKind.Family.CHARACTER || rightFamily != TypeKind.Family.CHARACTER) {
                throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                        operator + " needs text operands, got " + describe(left) + " and " + describe(right));
            }
        } else if (leftFamily != rightFamily) {
            throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                    "Cannot compare " + describe(left) + " with " + describe(right));
        }
        return new ComparisonExpression(left, operator, right);
    }

    private static ComparisonOperator toComparison(BinaryOp.Operator operator) {
        return switch (operator) {
            case EQ -> ComparisonOperator.EQUALS;
            case NE -> ComparisonOperator.NOT_EQUALS;
            case LT -> ComparisonOperator.LESS_THAN;
            case LE -> ComparisonOperator.LESS_THAN_OR_EQUALS;
            case GT -> ComparisonOperator.GREATER_THAN;
            case GE -> ComparisonOperator.GREATER_THAN_OR_EQUALS;
            case LIKE -> ComparisonOperator.LIKE;
            case ILIKE -> ComparisonOperator.ILIKE;
            case AND, OR -> throw new IllegalArgumentException("Not a comparison: " + operator);
        };
    }

    private static void requireBoolean(Expression expression) {
        if (expression.type().kind() != TypeKind.BOOLEAN) {
            throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                    "Condition must be boolean, got " + describe(expression));
        }
    }

    private static String describe(Expression expression) {
        return expression + " (" + expression.type().signature() + ")";
    }
}
