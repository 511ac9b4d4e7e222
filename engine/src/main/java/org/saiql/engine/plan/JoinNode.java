package org.saiql.engine.plan;

import java.util.Objects;

/**
 * Represents a JOIN between two relations.
 *
 * @param left      The left relation
 * @param right     The right relation
 * @param condition The join condition; null only for a cross join
 * @param joinType  The type of join
 */
public record JoinNode(RelationNode left, RelationNode right, Expression condition, JoinType joinType)
        implements RelationNode {

    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT_OUTER("LEFT OUTER JOIN"),
        RIGHT_OUTER("RIGHT OUTER JOIN"),
        FULL_OUTER("FULL OUTER JOIN"),
        CROSS("CROSS JOIN");

        private final String sql;

        JoinType(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }

        /**
         * Whether the left input's rows survive unmatched.
         */
        public boolean preservesLeft() {
            return this == LEFT_OUTER || this == FULL_OUTER;
        }

        /**
         * Whether the right input's rows survive unmatched.
         */
        public boolean preservesRight() {
            return this == RIGHT_OUTER || this == FULL_OUTER;
        }

        /**
         * Inner and cross joins commute and associate freely.
         */
        public boolean isReorderable() {
            return this == INNER || this == CROSS;
        }
    }

    public JoinNode {
        Objects.requireNonNull(left, "Left relation cannot be null");
        Objects.requireNonNull(right, "Right relation cannot be null");
        Objects.requireNonNull(joinType, "Join type cannot be null");
        if (condition == null && joinType != JoinType.CROSS) {
            throw new IllegalArgumentException(joinType + " requires a join condition");
        }
        if (condition != null && joinType == JoinType.CROSS) {
            throw new IllegalArgumentException("CROSS JOIN cannot carry a condition");
        }
    }

    public static JoinNode inner(RelationNode left, RelationNode right, Expression condition) {
        return new JoinNode(left, right, condition, JoinType.INNER);
    }

    public static JoinNode cross(RelationNode left, RelationNode right) {
        return new JoinNode(left, right, null, JoinType.CROSS);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
