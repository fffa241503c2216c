package org.nrg.profiles.model.parameter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import javax.annotation.Nonnull;

@JsonTypeName(FloatParameter.TYPE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FloatParameter extends Parameter {
    public static final String TYPE = "float";

    @JsonProperty("minimum") private final Double minimum;
    @JsonProperty("maximum") private final Double maximum;

    public FloatParameter(final String id, final String name) {
        this(id, name, null, null);
    }

    public FloatParameter(final String id, final String name, final Double minimum, final Double maximum) {
        super(id, name);
        this.minimum = minimum;
        this.maximum = maximum;
    }

    private FloatParameter(final FloatParameter other) {
        super(other);
        this.minimum = other.minimum;
        this.maximum = other.maximum;
    }

    @Override
    public FloatParameter copy() {
        return new FloatParameter(this);
    }

    @Override
    protected Object coerce(@Nonnull final Object raw) {
        final double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else {
            try {
                value = Double.parseDouble(String.valueOf(raw).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Value \"" + raw + "\" is not a number.");
            }
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Value \"" + raw + "\" is not a finite number.");
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
