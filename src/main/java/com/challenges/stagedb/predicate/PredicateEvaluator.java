package com.challenges.stagedb.predicate;

import com.challenges.stagedb.storage.Row;
import com.challenges.stagedb.storage.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.regex.Pattern;

/**
 * Evaluates a {@link Predicate} against a row.
 *
 * <p>A null column value or a null operand makes every comparison false, including
 * IN, LIKE and BETWEEN; only IS NULL / IS NOT NULL look at nulls. Both sides of a
 * branch are always evaluated.
 */
public class PredicateEvaluator {
    private final ValueComparator comparator = ValueComparator.INSTANCE;
    private final MutableMap<String, Pattern> likePatterns = Maps.mutable.empty();

    public boolean evaluate(Predicate predicate, Row row) {
        if (predicate instanceof Predicate.Branch branch) {
            boolean left = evaluate(branch.left(), row);
            boolean right = evaluate(branch.right(), row);
            return branch.combinator() == Combinator.AND ? left && right : left || right;
        }
        Predicate.Leaf leaf = (Predicate.Leaf) predicate;
        return evaluateLeaf(leaf, row.get(leaf.column()));
    }

    private boolean evaluateLeaf(Predicate.Leaf leaf, Object value) {
        Object operand = leaf.operand();

        switch (leaf.operator()) {
            case IS_NULL:
                return value == null;
            case IS_NOT_NULL:
                return value != null;
            default:
                break;
        }
        if (value == null) {
            return false;
        }

        return switch (leaf.operator()) {
            case EQUALS -> operand != null && comparator.equal(value, operand);
            case NOT_EQUALS -> operand != null && !comparator.equal(value, operand);
            case LESS_THAN -> operand != null && comparator.compare(value, operand) < 0;
            case GREATER_THAN -> operand != null && comparator.compare(value, operand) > 0;
            case LESS_EQUAL -> operand != null && comparator.compare(value, operand) <= 0;
            case GREATER_EQUAL -> operand != null && comparator.compare(value, operand) >= 0;
            case IN -> ((ImmutableList<?>) operand).anySatisfy(candidate -> candidate != null && comparator.equal(value, candidate));
            case LIKE -> operand != null && likePattern(Values.render(operand)).matcher(Values.render(value)).matches();
            case BETWEEN -> {
                Predicate.Range range = (Predicate.Range) operand;
                yield range.min() != null && range.max() != null
                    && comparator.compare(value, range.min()) >= 0
                    && comparator.compare(value, range.max()) <= 0;
            }
            case IS_NULL, IS_NOT_NULL -> throw new IllegalStateException("handled above");
        };
    }

    /**
     * Translates a LIKE pattern: {@code %} is any sequence, {@code _} any single character,
     * everything else literal. Anchored and case-insensitive.
     */
    private Pattern likePattern(String like) {
        return likePatterns.getIfAbsentPut(like, () -> {
            StringBuilder regex = new StringBuilder();
            StringBuilder literal = new StringBuilder();
            for (char c : like.toCharArray()) {
                if (c == '%' || c == '_') {
                    if (literal.length() > 0) {
                        regex.append(Pattern.quote(literal.toString()));
                        literal.setLength(0);
                    }
                    regex.append(c == '%' ? ".*" : ".");
                } else {
                    literal.append(c);
                }
            }
            if (literal.length() > 0) {
                regex.append(Pattern.quote(literal.toString()));
            }
            return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
        });
    }
}
