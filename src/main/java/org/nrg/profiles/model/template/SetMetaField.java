package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.auto.value.AutoValue;
import org.nrg.profiles.model.file.InputFile;
import org.nrg.profiles.utils.ValueUtils;

import java.util.List;
import java.util.Map;

@AutoValue
@JsonTypeName(SetMetaField.OPERATOR)
public abstract class SetMetaField implements MetaField {
    public static final String OPERATOR = "set";

    @Override
    @JsonProperty("id") public abstract String key();
    @JsonProperty("value") public abstract Object value();

    @Override
    @JsonProperty("operator")
    public String operator() {
        return OPERATOR;
    }

    /**
     * @throws IllegalArgumentException if the value is missing or not a single value
     */
    @JsonCreator
    public static SetMetaField create(@JsonProperty("id") final String key,
                                      @JsonProperty("value") final Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Meta field \"" + key + "\" sets no value. Use an \"" +
                    UnsetMetaField.OPERATOR + "\" meta field to remove an attribute.");
        }
        ValueUtils.checkScalar(key, value);
        return new AutoValue_SetMetaField(key, value);
    }

    @Override
    public boolean resolve(final Map<String, Object> draft,
                           final Map<String, ?> parameters,
                           final InputFile parentFile,
                           final List<InputFile> relevantInputFiles) {
        draft.put(key(), value());
        return true;
    }
}
