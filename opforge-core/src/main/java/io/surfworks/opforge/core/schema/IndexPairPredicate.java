package io.surfworks.opforge.core.schema;

/**
 * Predicate over a pair of ints: (input index, output index) for in-place rules,
 * (input count, output count) for joint cardinality rules.
 */
@FunctionalInterface
public interface IndexPairPredicate {

    boolean test(int first, int second);
}
