package org.nrg.profiles.model.parameter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import javax.annotation.Nonnull;
import java.util.regex.Pattern;

@JsonTypeName(StringParameter.TYPE)
public class StringParameter extends Parameter {
    public static final String TYPE = "string";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("pattern") private final String pattern;
    @JsonIgnore private final Pattern compiledPattern;

    public StringParameter(final String id, final String name) {
        this(id, name, null);
    }

    /**
     * @param pattern If set, values must match it completely.
     */
    public StringParameter(final String id, final String name, final String pattern) {
        super(id, name);
        this.pattern = pattern;
        this.compiledPattern = pattern == null ? null : Pattern.compile(pattern);
    }

    private StringParameter(final StringParameter other) {
        super(other);
        this.pattern = other.pattern;
        this.compiledPattern = other.compiledPattern;
    }

    @Override
    public StringParameter copy() {
        return new StringParameter(this);
    }

    @Override
    protected Object coerce(@Nonnull final Object raw) {
        final String value = String.valueOf(raw);
        if (compiledPattern != null && !compiledPattern.matcher(value).matches()) {
            throw new IllegalArgumentException("Value \"" + value + "\" does not match the pattern " + pattern + ".");
        }
        return value;
    }
}
