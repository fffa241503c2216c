package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.nrg.profiles.utils.ValueUtils;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Map;

/**
 * One comparison of a submitted parameter against a value. The value is a single value, except
 * for {@link ConditionOperator#CONTAINS}, which also takes a collection of accepted options.
 */
@AutoValue
public abstract class Condition {
    @JsonProperty("parameter") public abstract String key();
    @Nullable @JsonProperty("value") public abstract Object value();
    @JsonProperty("operator") public abstract ConditionOperator operator();

    @JsonCreator
    public static Condition create(@JsonProperty("parameter") final String key,
                                   @JsonProperty("value") final Object value,
                                   @JsonProperty("operator") final ConditionOperator operator) {
        final ConditionOperator conditionOperator = operator == null ? ConditionOperator.EQUALS : operator;
        if (conditionOperator == ConditionOperator.CONTAINS && value instanceof Collection) {
            return new AutoValue_Condition(key, ImmutableList.copyOf((Collection<?>) value), conditionOperator);
        }
        ValueUtils.checkScalar(key, value);
        return new AutoValue_Condition(key, value, conditionOperator);
    }

    public static Condition is(final String key, final Object value) {
        return create(key, value, ConditionOperator.EQUALS);
    }

    public boolean test(final Map<String, ?> parameters) {
        final Object actual = parameters == null ? null : parameters.get(key());
        return operator().test(actual, value());
    }
}
