package com.challenges.stagedb.predicate;

import com.challenges.stagedb.storage.Values;

import java.util.Comparator;

/**
 * Ordering of two non-null values: numerically when both are numeric (numbers or
 * numeric-looking text), as text otherwise. Callers decide how nulls behave.
 */
public final class ValueComparator implements Comparator<Object> {
    public static final ValueComparator INSTANCE = new ValueComparator();

    private ValueComparator() {
    }

    @Override
    public int compare(Object left, Object right) {
        if (Values.isNumeric(left) && Values.isNumeric(right)) {
            return Values.toDecimal(left).compareTo(Values.toDecimal(right));
        }
        return left.toString().compareTo(right.toString());
    }

    public boolean equal(Object left, Object right) {
        return compare(left, right) == 0;
    }
}
