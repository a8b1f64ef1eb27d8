package io.uvlanalyzer.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Abstract syntax of a propositional formula over feature names. Constraints parse into this
 * form and the encoder builds the whole validity formula from it. Immutable.
 */
public sealed interface Expression
        permits Expression.Literal,
                Expression.Constant,
                Expression.Not,
                Expression.And,
                Expression.Or,
                Expression.Implies,
                Expression.Equivalent {

    /**
     * Evaluates the formula under a total assignment.
     *
     * @param selected returns {@code true} for selected features
     * @return the truth value
     */
    boolean evaluate(Predicate<String> selected);

    /** Adds every feature name the formula references to {@code names}. */
    void collectFeatures(Set<String> names);

    /** A reference to one feature variable. */
    record Literal(String name) implements Expression {
        public Literal {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public boolean evaluate(Predicate<String> selected) {
            return selected.test(name);
        }

        @Override
        public void collectFeatures(Set<String> names) {
            names.add(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** {@code true} or {@code false}. */
    record Constant(boolean value) implements Expression {
        public static final Constant TRUE = new Constant(true);
        public static final Constant FALSE = new Constant(false);

        @Override
        public boolean evaluate(Predicate<String> selected) {
            return value;
        }

        @Override
        public void collectFeatures(Set<String> names) {}

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /** Negation. */
    record Not(Expression operand) implements Expression {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public boolean evaluate(Predicate<String> selected) {
            return !operand.evaluate(selected);
        }

        @Override
        public void collectFeatures(Set<String> names) {
            operand.collectFeatures(names);
        }

        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    /** N-ary conjunction; empty means {@code true}. */
    record And(List<Expression> operands) implements Expression {
        public And {
            operands = List.copyOf(operands);
        }

        public And(Expression... operands) {
            this(List.of(operands));
        }

        @Override
        public boolean evaluate(Predicate<String> selected) {
            for (Expression operand : operands) {
                if (!operand.evaluate(selected)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public void collectFeatures(Set<String> names) {
            operands.forEach(operand -> operand.collectFeatures(names));
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" & ", "(", ")"));
        }
    }

    /** N-ary disjunction; empty means {@code false}. */
    record Or(List<Expression> operands) implements Expression {
        public Or {
            operands = List.copyOf(operands);
        }

        public Or(Expression... operands) {
            this(List.of(operands));
        }

        @Override
        public boolean evaluate(Predicate<String> selected) {
            for (Expression operand : operands) {
                if (operand.evaluate(selected)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public void collectFeatures(Set<String> names) {
            operands.forEach(operand -> operand.collectFeatures(names));
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" | ", "(", ")"));
        }
    }

    /** Implication {@code left => right}. */
    record Implies(Expression left, Expression right) implements Expression {
        public Implies {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public boolean evaluate(Predicate<String> selected) {
            return !left.evaluate(selected) || right.evaluate(selected);
        }

        @Override
        public void collectFeatures(Set<String> names) {
            left.collectFeatures(names);
            right.collectFeatures(names);
        }

        @Override
        public String toString() {
            return "(" + left + " => " + right + ")";
        }
    }

    /** Equivalence {@code left <=> right}. */
    record Equivalent(Expression left, Expression right) implements Expression {
        public Equivalent {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public boolean evaluate(Predicate<String> selected) {
            return left.evaluate(selected) == right.evaluate(selected);
        }

        @Override
        public void collectFeatures(Set<String> names) {
            left.collectFeatures(names);
            right.collectFeatures(names);
        }

        @Override
        public String toString() {
            return "(" + left + " <=> " + right + ")";
        }
    }
}
