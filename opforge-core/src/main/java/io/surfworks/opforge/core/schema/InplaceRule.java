package io.surfworks.opforge.core.schema;

import java.util.Objects;
import java.util.Set;

/**
 * Relation over (input index, output index) pairs used for the in-place
 * "allowed" and "enforced" rules of a schema.
 */
public sealed interface InplaceRule
    permits InplaceRule.None, InplaceRule.OneToOne, InplaceRule.Pairs, InplaceRule.Matching {

    boolean test(int input, int output);

    String describe();

    static InplaceRule none() {
        return None.INSTANCE;
    }

    static InplaceRule oneToOne() {
        return OneToOne.INSTANCE;
    }

    static InplaceRule pairs(Set<InplacePair> pairs) {
        return new Pairs(pairs);
    }

    static InplaceRule matching(IndexPairPredicate predicate) {
        return new Matching(predicate);
    }

    record None() implements InplaceRule {
        static final None INSTANCE = new None();

        @Override
        public boolean test(int input, int output) {
            return false;
        }

        @Override
        public String describe() {
            return "none";
        }
    }

    /**
     * Input i pairs with output i, for every i.
     */
    record OneToOne() implements InplaceRule {
        static final OneToOne INSTANCE = new OneToOne();

        @Override
        public boolean test(int input, int output) {
            return input == output;
        }

        @Override
        public String describe() {
            return "one-to-one";
        }
    }

    record Pairs(Set<InplacePair> pairs) implements InplaceRule {
        public Pairs {
            pairs = Set.copyOf(Objects.requireNonNull(pairs, "pairs cannot be null"));
        }

        @Override
        public boolean test(int input, int output) {
            return input >= 0 && output >= 0 && pairs.contains(new InplacePair(input, output));
        }

        @Override
        public String describe() {
            return pairs.stream()
                .sorted((a, b) -> a.input() != b.input()
                    ? Integer.compare(a.input(), b.input())
                    : Integer.compare(a.output(), b.output()))
                .map(InplacePair::toString)
                .toList()
                .toString();
        }
    }

    record Matching(IndexPairPredicate predicate) implements InplaceRule {
        public Matching {
            Objects.requireNonNull(predicate, "predicate cannot be null");
        }

        @Override
        public boolean test(int input, int output) {
            return predicate.test(input, output);
        }

        @Override
        public String describe() {
            return "custom";
        }
    }
}
