package org.nrg.profiles.model.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.nrg.profiles.utils.ValueUtils;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * What a {@link MetadataFormat} allows for a single attribute.
 */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public abstract class AttributeRule {
    public enum Kind {
        REQUIRED("required"),
        OPTIONAL("optional"),
        ENUMERATED("enumerated"),
        FIXED("fixed");

        private final String name;

        Kind(final String name) {
            this.name = name;
        }

        @JsonValue
        public String getName() {
            return name;
        }

        @JsonCreator
        @Nullable
        public static Kind fromName(final String name) {
            return Arrays.stream(values())
                    .filter(kind -> kind.name.equalsIgnoreCase(name))
                    .findFirst()
                    .orElse(null);
        }
    }

    @JsonProperty("kind") public abstract Kind kind();
    @JsonProperty("values") public abstract ImmutableList<Object> values();
    @JsonProperty("allow-absent") public abstract boolean allowAbsent();

    @JsonCreator
    static AttributeRule create(@JsonProperty("kind") final Kind kind,
                                @JsonProperty("values") final List<Object> values,
                                @JsonProperty("allow-absent") final Boolean allowAbsent) {
        final List<Object> valuesCopy = values == null ? Collections.emptyList() : values;
        for (final Object value : valuesCopy) {
            ValueUtils.checkScalar(kind.getName(), value);
        }
        if (kind == Kind.FIXED && valuesCopy.size() != 1) {
            throw new IllegalArgumentException("A fixed attribute must have exactly one value.");
        }
        return new AutoValue_AttributeRule(kind, ImmutableList.copyOf(valuesCopy), allowAbsent != null && allowAbsent);
    }

    public static AttributeRule required() {
        return create(Kind.REQUIRED, null, false);
    }

    public static AttributeRule optional() {
        return create(Kind.OPTIONAL, null, true);
    }

    /**
     * The attribute must be present and hold one of the given values.
     */
    public static AttributeRule oneOf(final Object... values) {
        return create(Kind.ENUMERATED, Arrays.asList(values), false);
    }

    /**
     * The attribute may be left out, but if it is set it must hold one of the given values.
     */
    public static AttributeRule optionalOneOf(final Object... values) {
        return create(Kind.ENUMERATED, Arrays.asList(values), true);
    }

    public static AttributeRule fixed(final Object value) {
        return create(Kind.FIXED, Collections.singletonList(value), false);
    }

    /**
     * @return true if a record without this attribute is incomplete. Fixed attributes are never
     * missing since they are always forced onto the record.
     */
    @JsonIgnore
    public boolean isRequired() {
        switch (kind()) {
            case REQUIRED:
                return true;
            case ENUMERATED:
                return !allowAbsent();
            default:
                return false;
        }
    }

    @JsonIgnore
    public boolean isFixed() {
        return kind() == Kind.FIXED;
    }

    @JsonIgnore
    @Nullable
    public Object fixedValue() {
        return isFixed() ? values().get(0) : null;
    }

    public boolean permits(@Nullable final Object value) {
        if (kind() != Kind.ENUMERATED) {
            return true;
        }
        return values().stream().anyMatch(allowed -> ValueUtils.sameValue(allowed, value));
    }
}
