package com.challenges.stagedb.predicate;

import com.challenges.stagedb.storage.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Parsed WHERE clause: a binary tree of comparisons joined by AND/OR.
 */
public sealed interface Predicate {

    /**
     * Column names referenced anywhere in the tree, in first-seen order.
     */
    default ImmutableList<String> columns() {
        MutableList<String> columns = Lists.mutable.empty();
        collectColumns(this, columns);
        return columns.distinct().toImmutable();
    }

    private static void collectColumns(Predicate predicate, MutableList<String> into) {
        if (predicate instanceof Leaf leaf) {
            into.add(leaf.column());
        } else if (predicate instanceof Branch branch) {
            collectColumns(branch.left(), into);
            collectColumns(branch.right(), into);
        }
    }

    /**
     * Single comparison. The operand shape follows the operator: {@link Range} for
     * BETWEEN, an immutable list for IN, nothing for the null tests and a scalar otherwise.
     */
    record Leaf(String column, Operator operator, Object operand) implements Predicate {
        public Leaf {
            Objects.requireNonNull(column, "column");
            Objects.requireNonNull(operator, "operator");
            boolean shapeOk = switch (operator) {
                case BETWEEN -> operand instanceof Range;
                case IN -> operand instanceof ImmutableList<?> list && list.notEmpty();
                case IS_NULL, IS_NOT_NULL -> operand == null;
                default -> !(operand instanceof Range) && !(operand instanceof ImmutableList<?>);
            };
            if (!shapeOk) {
                throw new IllegalArgumentException("Operand " + operand + " does not fit operator " + operator.symbol());
            }
        }

        @Override
        public String toString() {
            if (!operator.takesOperand()) {
                return column + " " + operator.symbol();
            }
            if (operand instanceof ImmutableList<?> list) {
                return column + " IN (" + list.collect(Leaf::literal).makeString(", ") + ")";
            }
            return column + " " + operator.symbol() + " " + literal(operand);
        }

        static String literal(Object value) {
            if (value instanceof String s) {
                return "'" + s.replace("'", "''") + "'";
            }
            if (value instanceof Range range) {
                return literal(range.min()) + " AND " + literal(range.max());
            }
            return Values.render(value);
        }
    }

    record Branch(Predicate left, Combinator combinator, Predicate right) implements Predicate {
        public Branch {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(combinator, "combinator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " " + combinator + " " + right + ")";
        }
    }

    record Range(Object min, Object max) {
    }
}
