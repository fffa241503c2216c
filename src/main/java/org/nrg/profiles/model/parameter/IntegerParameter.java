package org.nrg.profiles.model.parameter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import javax.annotation.Nonnull;

@JsonTypeName(IntegerParameter.TYPE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntegerParameter extends Parameter {
    public static final String TYPE = "integer";

    @JsonProperty("minimum") private final Long minimum;
    @JsonProperty("maximum") private final Long maximum;

    public IntegerParameter(final String id, final String name) {
        this(id, name, null, null);
    }

    public IntegerParameter(final String id, final String name, final Long minimum, final Long maximum) {
        super(id, name);
        this.minimum = minimum;
        this.maximum = maximum;
    }

    private IntegerParameter(final IntegerParameter other) {
        super(other);
        this.minimum = other.minimum;
        this.maximum = other.maximum;
    }

    @Override
    public IntegerParameter copy() {
        return new IntegerParameter(this);
    }

    @Override
    protected Object coerce(@Nonnull final Object raw) {
        final long value;
        if (raw instanceof Number) {
            value = ((Number) raw).longValue();
        } else {
            try {
                value = Long.parseLong(String.valueOf(raw).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Value \"" + raw + "\" is not a whole number.");
            }
        }
        if (minimum != null && value < minimum) {
            throw new IllegalArgumentException("Value " + value + " is smaller than the minimum " + minimum + ".");
        }
        if (maximum != null && value > maximum) {
            throw new IllegalArgumentException("Value " + value + " is larger than the maximum " + maximum + ".");
        }
        return value;
    }
}
