package org.nrg.profiles.model.parameter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A user-settable option of a template.
 * <p>
 * The configuration (id, constraints, default) is set up once when the template is declared.
 * The value and error are per-request state, so templates hand out {@link #copy() copies}
 * and never set values on their own instances.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"type", "id", "name", "description", "required", "default", "forbid", "require", "value", "error"})
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StringParameter.class, name = StringParameter.TYPE),
        @JsonSubTypes.Type(value = IntegerParameter.class, name = IntegerParameter.TYPE),
        @JsonSubTypes.Type(value = FloatParameter.class, name = FloatParameter.TYPE),
        @JsonSubTypes.Type(value = BooleanParameter.class, name = BooleanParameter.TYPE),
        @JsonSubTypes.Type(value = ChoiceParameter.class, name = ChoiceParameter.TYPE)
})
public abstract class Parameter {
    @JsonProperty("id") private final String id;
    @JsonProperty("name") private final String name;
    @JsonProperty("description") private String description;
    @JsonProperty("required") private boolean required;
    @JsonProperty("default") private Object defaultValue;
    @JsonProperty("forbid") private final Set<String> forbid = new LinkedHashSet<>();
    @JsonProperty("require") private final Set<String> require = new LinkedHashSet<>();
    @JsonIgnore private final Set<String> allowedUsers = new LinkedHashSet<>();

    @JsonProperty("value") private Object value;
    @JsonProperty("error") private String error;

    protected Parameter(final String id, final String name) {
        this.id = id;
        this.name = StringUtils.defaultIfBlank(name, id);
    }

    protected Parameter(final Parameter other) {
        this.id = other.id;
        this.name = other.name;
        this.description = other.description;
        this.required = other.required;
        this.defaultValue = other.defaultValue;
        this.forbid.addAll(other.forbid);
        this.require.addAll(other.require);
        this.allowedUsers.addAll(other.allowedUsers);
        this.value = other.value;
        this.error = other.error;
    }

    /**
     * @return An independent instance with the same configuration, value and error.
     */
    public abstract Parameter copy();

    /**
     * Convert a submitted value to this parameter's type.
     *
     * @throws IllegalArgumentException with a message fit for the user if the value is not acceptable
     */
    protected abstract Object coerce(@Nonnull Object raw);

    public Parameter withDescription(final String description) {
        this.description = description;
        return this;
    }

    public Parameter withRequired(final boolean required) {
        this.required = required;
        return this;
    }

    public Parameter withDefault(final Object defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    /**
     * This parameter may not be set together with any of the given parameters.
     */
    public Parameter withForbid(final String... parameterIds) {
        forbid.addAll(Arrays.asList(parameterIds));
        return this;
    }

    /**
     * This parameter may only be set if all of the given parameters are set too.
     */
    public Parameter withRequire(final String... parameterIds) {
        require.addAll(Arrays.asList(parameterIds));
        return this;
    }

    /**
     * Restrict who may set this parameter. Without restrictions everyone may.
     */
    public Parameter withAllowedUsers(final String... users) {
        allowedUsers.addAll(Arrays.asList(users));
        return this;
    }

    public Set<String> getForbid() {
        return Collections.unmodifiableSet(forbid);
    }

    public Set<String> getRequire() {
        return Collections.unmodifiableSet(require);
    }

    public boolean access(@Nullable final String user) {
        return allowedUsers.isEmpty() || allowedUsers.contains(user);
    }

    /**
     * Set the value, coercing it to this parameter's type.
     *
     * @return false, with {@link #getError()} describing the problem, if the value is not acceptable
     */
    public boolean set(@Nullable final Object raw) {
        error = null;
        if (raw == null) {
            value = null;
            return true;
        }
        try {
            value = coerce(raw);
            return true;
        } catch (IllegalArgumentException e) {
            value = null;
            error = e.getMessage();
            return false;
        }
    }

    public void setError(final String error) {
        this.error = error;
    }

    @JsonIgnore
    public boolean hasValue() {
        return value != null;
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }

    /**
     * @return The values of all parameters that have one, by parameter id, in order.
     */
    public static Map<String, Object> valuesOf(final Collection<? extends Parameter> parameters) {
        final Map<String, Object> values = new LinkedHashMap<>();
        for (final Parameter parameter : parameters) {
            if (parameter.hasValue()) {
                values.put(parameter.getId(), parameter.getValue());
            }
        }
        return values;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "id=" + id +
                (value == null ? "" : ", value=" + value) +
                (error == null ? "" : ", error=" + error) +
                "}";
    }
}
