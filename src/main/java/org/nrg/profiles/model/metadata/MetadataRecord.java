package org.nrg.profiles.model.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.nrg.profiles.exceptions.IncompleteMetadataException;
import org.nrg.profiles.exceptions.MetadataException;
import org.nrg.profiles.utils.ValueUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The metadata of one file. Records are created through {@link MetadataFormat#create(Map)} and
 * validated against the format's attributes on creation and on every later write.
 */
@Slf4j
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"format", "mimetype", "schema", "inputtemplate", "attributes", "provenance"})
public class MetadataRecord {
    private final MetadataFormat format;
    private final Map<String, Object> data = new LinkedHashMap<>();
    private final String inputTemplateId;
    private final Provenance provenance;

    MetadataRecord(final MetadataFormat format,
                   final Map<String, ?> attributes,
                   @Nullable final String inputTemplateId,
                   @Nullable final Provenance provenance) throws MetadataException {
        this.format = format;
        this.inputTemplateId = inputTemplateId;
        this.provenance = provenance;

        if (attributes != null) {
            for (final Map.Entry<String, ?> entry : attributes.entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                final AttributeRule rule = format.rule(entry.getKey());
                if (rule != null && rule.isFixed()) {
                    continue;
                }
                ValueUtils.checkScalar(entry.getKey(), entry.getValue());
                format.validate(entry.getKey(), entry.getValue());
                data.put(entry.getKey(), entry.getValue());
            }
        }
        for (final Map.Entry<String, AttributeRule> entry : format.attributeRules().entrySet()) {
            if (entry.getValue().isFixed()) {
                data.put(entry.getKey(), entry.getValue().fixedValue());
            }
        }

        final List<String> missing = format.missingAttributes(data);
        if (!missing.isEmpty()) {
            throw new IncompleteMetadataException("Required attribute(s) " + StringUtils.join(missing, ", ") +
                    " not specified for format " + format.name() + ".", missing.get(0));
        }
    }

    @JsonIgnore
    public MetadataFormat getMetadataFormat() {
        return format;
    }

    @JsonProperty("format")
    public String getFormatName() {
        return format.name();
    }

    @Nullable
    @JsonProperty("mimetype")
    public String getMimetype() {
        return format.mimetype();
    }

    @Nullable
    @JsonProperty("schema")
    public String getSchema() {
        return format.schema();
    }

    @Nullable
    @JsonProperty("inputtemplate")
    public String getInputTemplateId() {
        return inputTemplateId;
    }

    @Nullable
    @JsonProperty("provenance")
    public Provenance getProvenance() {
        return provenance;
    }

    @Nonnull
    @JsonProperty("attributes")
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(data);
    }

    @Nullable
    public Object get(final String key) {
        return data.get(key);
    }

    public boolean contains(final String key) {
        return data.containsKey(key);
    }

    @JsonIgnore
    public Set<String> keys() {
        return Collections.unmodifiableSet(data.keySet());
    }

    /**
     * Set an attribute, checking it against the format first. Writes to a fixed attribute are ignored.
     *
     * @throws IllegalArgumentException if the value is a collection, map or array
     */
    public void put(final String key, final Object value) throws MetadataException {
        ValueUtils.checkScalar(key, value);
        final AttributeRule rule = format.rule(key);
        if (rule != null && rule.isFixed()) {
            log.debug("Attribute \"{}\" of format {} is fixed. Ignoring value \"{}\".", key, format.name(), value);
            return;
        }
        format.validate(key, value);
        data.put(key, value);
    }

    /**
     * Remove an attribute. Required and fixed attributes can not be removed.
     */
    public void remove(final String key) throws MetadataException {
        final AttributeRule rule = format.rule(key);
        if (rule != null && (rule.isRequired() || rule.isFixed())) {
            throw new IncompleteMetadataException("Attribute \"" + key + "\" of format " + format.name() +
                    " can not be removed.", key);
        }
        data.remove(key);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final MetadataRecord that = (MetadataRecord) o;
        return Objects.equals(format, that.format) &&
                Objects.equals(data, that.data) &&
                Objects.equals(inputTemplateId, that.inputTemplateId) &&
                Objects.equals(provenance, that.provenance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, data, inputTemplateId, provenance);
    }

    @Override
    public String toString() {
        return "MetadataRecord{" +
                "format=" + format.name() +
                ", attributes=" + data +
                (inputTemplateId == null ? "" : ", inputTemplate=" + inputTemplateId) +
                "}";
    }
}
