package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One arm of a {@link ParameterCondition}, or one entry of a list that may hold either plain
 * values or conditions choosing between values: either a terminal value or a nested condition.
 *
 * @param <T> The terminal type, e.g. an output template or a meta field
 */
public abstract class Branch<T> {
    private Branch() {}

    public static <T> Branch<T> terminal(@Nonnull final T value) {
        return new Terminal<>(value);
    }

    public static <T> Branch<T> condition(@Nonnull final ParameterCondition<T> condition) {
        return new Nested<>(condition);
    }

    public abstract boolean isTerminal();

    /**
     * @return The terminal value, or null if this branch is a nested condition.
     */
    @Nullable
    public abstract T terminal();

    /**
     * @return The nested condition, or null if this branch is terminal.
     */
    @Nullable
    public abstract ParameterCondition<T> condition();

    /**
     * Resolve this branch against submitted parameters.
     *
     * @return The terminal value reached, or empty if a condition on the way did not match and had no alternative
     */
    public abstract Optional<T> evaluate(Map<String, ?> parameters);

    /**
     * @return Every terminal value reachable through this branch, depth first.
     */
    public List<T> allPossibilities() {
        final List<T> possibilities = new ArrayList<>();
        collect(possibilities);
        return possibilities;
    }

    abstract void collect(List<T> possibilities);

    /**
     * @return How many conditions deep this branch goes. Terminal branches have depth 0.
     */
    public abstract int depth();

    /**
     * @return A branch of the same shape with every terminal value replaced.
     */
    public abstract <R> Branch<R> map(Function<? super T, ? extends R> function);

    @JsonValue
    public abstract Object jsonValue();

    static final class Terminal<T> extends Branch<T> {
        private final T value;

        private Terminal(final T value) {
            this.value = Objects.requireNonNull(value, "Terminal branch value");
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public T terminal() {
            return value;
        }

        @Override
        public ParameterCondition<T> condition() {
            return null;
        }

        @Override
        public Optional<T> evaluate(final Map<String, ?> parameters) {
            return Optional.of(value);
        }

        @Override
        void collect(final List<T> possibilities) {
            possibilities.add(value);
        }

        @Override
        public int depth() {
            return 0;
        }

        @Override
        public <R> Branch<R> map(final Function<? super T, ? extends R> function) {
            return Branch.terminal(function.apply(value));
        }

        @Override
        public Object jsonValue() {
            return value;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return Objects.equals(value, ((Terminal<?>) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value);
        }

        @Override
        public String toString() {
            return "Terminal{" + value + "}";
        }
    }

    static final class Nested<T> extends Branch<T> {
        private final ParameterCondition<T> condition;

        private Nested(final ParameterCondition<T> condition) {
            this.condition = Objects.requireNonNull(condition, "Nested branch condition");
        }

        @Override
        public boolean isTerminal() {
            return false;
        }

        @Override
        public T terminal() {
            return null;
        }

        @Override
        public ParameterCondition<T> condition() {
            return condition;
        }

        @Override
        public Optional<T> evaluate(final Map<String, ?> parameters) {
            return condition.evaluate(parameters);
        }

        @Override
        void collect(final List<T> possibilities) {
            possibilities.addAll(condition.allPossibilities());
        }

        @Override
        public int depth() {
            return condition.depth();
        }

        @Override
        public <R> Branch<R> map(final Function<? super T, ? extends R> function) {
            return Branch.condition(condition.map(function));
        }

        @Override
        public Object jsonValue() {
            return condition;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return Objects.equals(condition, ((Nested<?>) o).condition);
        }

        @Override
        public int hashCode() {
            return Objects.hash(condition);
        }

        @Override
        public String toString() {
            return "Nested{" + condition + "}";
        }
    }
}
