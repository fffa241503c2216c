package org.nrg.profiles.model.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;
import org.nrg.profiles.exceptions.InvalidValueException;
import org.nrg.profiles.exceptions.MetadataException;
import org.nrg.profiles.exceptions.SchemaViolationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A file format and the attribute schema its metadata must follow.
 * <p>
 * A format without attributes accepts any attribute with any value. A format with attributes
 * only accepts the declared ones, unless {@link #allowCustomAttributes()} is set.
 */
@AutoValue
public abstract class MetadataFormat {
    @JsonProperty("name") public abstract String name();
    @Nullable @JsonProperty("mimetype") public abstract String mimetype();
    @Nullable @JsonProperty("schema") public abstract String schema();
    @Nullable @JsonProperty("attributes") public abstract ImmutableMap<String, AttributeRule> attributes();
    @JsonProperty("allow-custom-attributes") public abstract boolean allowCustomAttributes();

    @JsonCreator
    static MetadataFormat create(@JsonProperty("name") final String name,
                                 @JsonProperty("mimetype") final String mimetype,
                                 @JsonProperty("schema") final String schema,
                                 @JsonProperty("attributes") final Map<String, AttributeRule> attributes,
                                 @JsonProperty("allow-custom-attributes") final Boolean allowCustomAttributes) {
        return builder(name)
                .mimetype(mimetype)
                .schema(schema)
                .attributes(attributes)
                .allowCustomAttributes(allowCustomAttributes != null && allowCustomAttributes)
                .build();
    }

    public static Builder builder(final String name) {
        return new AutoValue_MetadataFormat.Builder()
                .name(name)
                .allowCustomAttributes(false);
    }

    public abstract Builder toBuilder();

    @JsonIgnore
    @Nonnull
    public Map<String, AttributeRule> attributeRules() {
        final ImmutableMap<String, AttributeRule> attributes = attributes();
        return attributes == null ? Collections.emptyMap() : attributes;
    }

    @Nullable
    public AttributeRule rule(final String key) {
        return attributeRules().get(key);
    }

    /**
     * Check that a single attribute may be set to the given value.
     *
     * @throws SchemaViolationException if the schema does not declare the key and custom attributes are not allowed
     * @throws InvalidValueException if the key is enumerated and the value is not one of the options
     */
    public void validate(final String key, final Object value) throws MetadataException {
        if (attributes() == null) {
            return;
        }
        final AttributeRule rule = rule(key);
        if (rule == null) {
            if (!allowCustomAttributes()) {
                throw new SchemaViolationException("Format " + name() + " has no attribute \"" + key + "\".", key);
            }
            return;
        }
        if (!rule.permits(value)) {
            throw new InvalidValueException("Value \"" + value + "\" is not allowed for attribute \"" + key +
                    "\" of format " + name() + ". Allowed values: " + StringUtils.join(rule.values(), ", "), key);
        }
    }

    /**
     * @return The names of required attributes that are missing from the data.
     */
    @Nonnull
    public List<String> missingAttributes(final Map<String, ?> data) {
        final List<String> missing = new ArrayList<>();
        for (final Map.Entry<String, AttributeRule> entry : attributeRules().entrySet()) {
            if (entry.getValue().isRequired() && !data.containsKey(entry.getKey())) {
                missing.add(entry.getKey());
            }
        }
        return missing;
    }

    public MetadataRecord create(final Map<String, ?> data) throws MetadataException {
        return new MetadataRecord(this, data, null, null);
    }

    public MetadataRecord create(final Map<String, ?> data,
                                 @Nullable final String inputTemplateId,
                                 @Nullable final Provenance provenance) throws MetadataException {
        return new MetadataRecord(this, data, inputTemplateId, provenance);
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder name(String name);
        public abstract Builder mimetype(String mimetype);
        public abstract Builder schema(String schema);
        public abstract Builder attributes(@Nullable Map<String, AttributeRule> attributes);
        public abstract Builder allowCustomAttributes(boolean allowCustomAttributes);

        public abstract MetadataFormat build();
    }
}
