package io.surfworks.opforge.core.schema;

import java.util.Collections;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.IntPredicate;

/**
 * Constraint on how many inputs (or outputs) an operator instance may have.
 *
 * <p>A schema holds exactly one active rule per side; setting a new rule
 * replaces the previous one.
 */
public sealed interface CountRule
    permits CountRule.Unbounded, CountRule.Exact, CountRule.Range, CountRule.OneOf, CountRule.Matching {

    /**
     * Returns true if {@code count} satisfies this rule.
     */
    boolean accepts(int count);

    /**
     * Human-readable form, used in verification messages and docs.
     */
    String describe();

    /**
     * The single count this rule accepts, if it accepts exactly one.
     */
    default OptionalInt fixedCount() {
        return OptionalInt.empty();
    }

    static CountRule unbounded() {
        return Unbounded.INSTANCE;
    }

    static CountRule exactly(int count) {
        return new Exact(count);
    }

    static CountRule between(int min, int max) {
        return new Range(min, max);
    }

    static CountRule oneOf(Set<Integer> allowed) {
        return new OneOf(allowed);
    }

    static CountRule matching(IntPredicate predicate) {
        return new Matching(predicate);
    }

    /**
     * Default rule: any count.
     */
    record Unbounded() implements CountRule {
        static final Unbounded INSTANCE = new Unbounded();

        @Override
        public boolean accepts(int count) {
            return true;
        }

        @Override
        public String describe() {
            return "any";
        }
    }

    record Exact(int count) implements CountRule {
        public Exact {
            if (count < 0) {
                throw new IllegalArgumentException("count must be non-negative, got " + count);
            }
        }

        @Override
        public boolean accepts(int n) {
            return n == count;
        }

        @Override
        public String describe() {
            return Integer.toString(count);
        }

        @Override
        public OptionalInt fixedCount() {
            return OptionalInt.of(count);
        }
    }

    /**
     * Inclusive range. {@code Integer.MAX_VALUE} as max means no upper bound.
     */
    record Range(int min, int max) implements CountRule {
        public Range {
            if (min < 0) {
                throw new IllegalArgumentException("min must be non-negative, got " + min);
            }
            if (min > max) {
                throw new IllegalArgumentException("min " + min + " exceeds max " + max);
            }
        }

        @Override
        public boolean accepts(int n) {
            return n >= min && n <= max;
        }

        @Override
        public String describe() {
            if (min == max) {
                return Integer.toString(min);
            }
            return "[" + min + ", " + (max == Integer.MAX_VALUE ? "inf" : Integer.toString(max)) + "]";
        }

        @Override
        public OptionalInt fixedCount() {
            return min == max ? OptionalInt.of(min) : OptionalInt.empty();
        }
    }

    record OneOf(Set<Integer> allowed) implements CountRule {
        public OneOf {
            Objects.requireNonNull(allowed, "allowed cannot be null");
            if (allowed.isEmpty()) {
                throw new IllegalArgumentException("allowed counts cannot be empty");
            }
            allowed = Collections.unmodifiableSortedSet(new TreeSet<>(allowed));
        }

        @Override
        public boolean accepts(int n) {
            return allowed.contains(n);
        }

        @Override
        public String describe() {
            return "one of " + allowed;
        }

        @Override
        public OptionalInt fixedCount() {
            return allowed.size() == 1 ? OptionalInt.of(allowed.iterator().next()) : OptionalInt.empty();
        }
    }

    record Matching(IntPredicate predicate) implements CountRule {
        public Matching {
            Objects.requireNonNull(predicate, "predicate cannot be null");
        }

        @Override
        public boolean accepts(int n) {
            return predicate.test(n);
        }

        @Override
        public String describe() {
            return "custom";
        }
    }
}
