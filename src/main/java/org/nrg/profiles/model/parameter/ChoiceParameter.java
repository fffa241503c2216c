package org.nrg.profiles.model.parameter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import java.util.List;

@JsonTypeName(ChoiceParameter.TYPE)
public class ChoiceParameter extends Parameter {
    public static final String TYPE = "choice";

    @JsonProperty("choices") private final ImmutableList<String> choices;

    public ChoiceParameter(final String id, final String name, final List<String> choices) {
        super(id, name);
        this.choices = ImmutableList.copyOf(choices);
    }

    private ChoiceParameter(final ChoiceParameter other) {
        super(other);
        this.choices = other.choices;
    }

    public List<String> getChoices() {
        return choices;
    }

    @Override
    public ChoiceParameter copy() {
        return new ChoiceParameter(this);
    }

    @Override
    protected Object coerce(@Nonnull final Object raw) {
        final String value = String.valueOf(raw);
        if (!choices.contains(value)) {
            throw new IllegalArgumentException("Value \"" + value + "\" is not one of the choices: " +
                    StringUtils.join(choices, ", ") + ".");
        }
        return value;
    }
}
