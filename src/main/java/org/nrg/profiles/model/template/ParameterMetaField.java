package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.auto.value.AutoValue;
import org.nrg.profiles.exceptions.InvalidParameterValueException;
import org.nrg.profiles.model.file.InputFile;
import org.nrg.profiles.utils.ValueUtils;

import java.util.List;
import java.util.Map;

/**
 * Takes an attribute's value from a submitted parameter. Attributes hold single values, so a
 * parameter submitted as a list or map can not be taken over.
 */
@AutoValue
@JsonTypeName(ParameterMetaField.OPERATOR)
public abstract class ParameterMetaField implements MetaField {
    public static final String OPERATOR = "parameter";

    @Override
    @JsonProperty("id") public abstract String key();
    @JsonProperty("parameter") public abstract String parameterId();

    @Override
    @JsonProperty("operator")
    public String operator() {
        return OPERATOR;
    }

    @JsonCreator
    public static ParameterMetaField create(@JsonProperty("id") final String key,
                                            @JsonProperty("parameter") final String parameterId) {
        return new AutoValue_ParameterMetaField(key, parameterId);
    }

    @Override
    public boolean resolve(final Map<String, Object> draft,
                           final Map<String, ?> parameters,
                           final InputFile parentFile,
                           final List<InputFile> relevantInputFiles) throws InvalidParameterValueException {
        final Object value = parameters == null ? null : parameters.get(parameterId());
        if (value == null) {
            return false;
        }
        if (!ValueUtils.isScalar(value)) {
            throw new InvalidParameterValueException("Meta field \"" + key() + "\" takes its value from parameter \"" +
                    parameterId() + "\", but that parameter holds more than a single value.", parameterId());
        }
        draft.put(key(), value);
        return true;
    }
}
