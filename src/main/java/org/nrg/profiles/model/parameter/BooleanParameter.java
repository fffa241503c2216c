package org.nrg.profiles.model.parameter;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Set;

@JsonTypeName(BooleanParameter.TYPE)
public class BooleanParameter extends Parameter {
    public static final String TYPE = "boolean";

    private static final Set<String> TRUE_VALUES = ImmutableSet.of("true", "yes", "1", "on");
    private static final Set<String> FALSE_VALUES = ImmutableSet.of("false", "no", "0", "off");

    public BooleanParameter(final String id, final String name) {
        super(id, name);
    }

    private BooleanParameter(final BooleanParameter other) {
        super(other);
    }

    @Override
    public BooleanParameter copy() {
        return new BooleanParameter(this);
    }

    @Override
    protected Object coerce(@Nonnull final Object raw) {
        if (raw instanceof Boolean) {
            return raw;
        }
        final String value = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(value)) {
            return true;
        }
        if (FALSE_VALUES.contains(value)) {
            return false;
        }
        throw new IllegalArgumentException("Value \"" + raw + "\" is not a yes/no value.");
    }
}
