package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Chooses between alternatives based on submitted parameters.
 * <p>
 * The conditions are combined with AND, or with OR if {@link #disjunction()} is set. If they hold,
 * the condition resolves to {@link #then()}; if not, to {@link #otherwise()}, or to nothing at all
 * when there is no alternative. Either arm may itself be another condition.
 *
 * @param <T> What the condition chooses between
 */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"conditions", "disjunction", "then", "otherwise"})
public abstract class ParameterCondition<T> {
    /**
     * Conditions may not be nested deeper than this.
     */
    public static final int MAX_DEPTH = 32;

    @JsonProperty("conditions") public abstract ImmutableList<Condition> conditions();
    @JsonProperty("disjunction") public abstract boolean disjunction();
    @JsonProperty("then") public abstract Branch<T> then();
    @Nullable @JsonProperty("otherwise") public abstract Branch<T> otherwise();

    public static <T> Builder<T> builder() {
        return new AutoValue_ParameterCondition.Builder<T>()
                .disjunction(false);
    }

    /**
     * @return true if the submitted parameters satisfy the conditions. A parameter that was not
     * submitted is compared as null.
     */
    public boolean match(final Map<String, ?> parameters) {
        for (final Condition condition : conditions()) {
            if (condition.test(parameters)) {
                if (disjunction()) {
                    return true;
                }
            } else if (!disjunction()) {
                return false;
            }
        }
        return !disjunction();
    }

    /**
     * @return The terminal value chosen by the parameters, or empty if nothing was chosen.
     */
    @Nonnull
    public Optional<T> evaluate(final Map<String, ?> parameters) {
        if (match(parameters)) {
            return then().evaluate(parameters);
        }
        if (otherwise() != null) {
            return otherwise().evaluate(parameters);
        }
        return Optional.empty();
    }

    /**
     * @return Every terminal value this condition could resolve to, depth first, "then" before "otherwise".
     */
    @Nonnull
    public List<T> allPossibilities() {
        final List<T> possibilities = new ArrayList<>(then().allPossibilities());
        if (otherwise() != null) {
            possibilities.addAll(otherwise().allPossibilities());
        }
        return possibilities;
    }

    @JsonIgnore
    public int depth() {
        final int otherwiseDepth = otherwise() == null ? 0 : otherwise().depth();
        return 1 + Math.max(then().depth(), otherwiseDepth);
    }

    public <R> ParameterCondition<R> map(final Function<? super T, ? extends R> function) {
        return ParameterCondition.<R>builder()
                .conditions(conditions())
                .disjunction(disjunction())
                .then(then().map(function))
                .otherwise(otherwise() == null ? null : otherwise().map(function))
                .build();
    }

    @AutoValue.Builder
    public abstract static class Builder<T> {
        public abstract Builder<T> conditions(List<Condition> conditions);
        abstract ImmutableList.Builder<Condition> conditionsBuilder();
        public Builder<T> when(final Condition condition) {
            conditionsBuilder().add(condition);
            return this;
        }
        public Builder<T> when(final String key, final ConditionOperator operator, final Object value) {
            return when(Condition.create(key, value, operator));
        }

        public abstract Builder<T> disjunction(boolean disjunction);

        public abstract Builder<T> then(Branch<T> then);
        public Builder<T> then(final T terminal) {
            return then(Branch.terminal(terminal));
        }
        public Builder<T> then(final ParameterCondition<T> nested) {
            return then(Branch.condition(nested));
        }

        public abstract Builder<T> otherwise(Branch<T> otherwise);
        public Builder<T> otherwise(final T terminal) {
            return otherwise(Branch.terminal(terminal));
        }
        public Builder<T> otherwise(final ParameterCondition<T> nested) {
            return otherwise(Branch.condition(nested));
        }

        abstract ParameterCondition<T> autoBuild();

        /**
         * @throws IllegalStateException if no "then" branch was set
         * @throws IllegalArgumentException if the conditions are nested too deeply
         */
        public ParameterCondition<T> build() {
            final ParameterCondition<T> condition = autoBuild();
            if (condition.depth() > MAX_DEPTH) {
                throw new IllegalArgumentException("Parameter conditions are nested " + condition.depth() +
                        " levels deep; at most " + MAX_DEPTH + " are allowed.");
            }
            return condition;
        }
    }
}
