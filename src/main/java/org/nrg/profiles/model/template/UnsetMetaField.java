package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.auto.value.AutoValue;
import org.nrg.profiles.model.file.InputFile;
import org.nrg.profiles.utils.ValueUtils;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Removes an attribute, or removes it only if it holds a particular value.
 */
@AutoValue
@JsonTypeName(UnsetMetaField.OPERATOR)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class UnsetMetaField implements MetaField {
    public static final String OPERATOR = "unset";

    @Override
    @JsonProperty("id") public abstract String key();
    @Nullable @JsonProperty("value") public abstract Object value();

    @Override
    @JsonProperty("operator")
    public String operator() {
        return OPERATOR;
    }

    @JsonCreator
    public static UnsetMetaField create(@JsonProperty("id") final String key,
                                        @JsonProperty("value") final Object value) {
        return new AutoValue_UnsetMetaField(key, value);
    }

    public static UnsetMetaField create(final String key) {
        return create(key, null);
    }

    @Override
    public boolean resolve(final Map<String, Object> draft,
                           final Map<String, ?> parameters,
                           final InputFile parentFile,
                           final List<InputFile> relevantInputFiles) {
        if (!draft.containsKey(key())) {
            return false;
        }
        if (value() != null && !ValueUtils.sameValue(draft.get(key()), value())) {
            return false;
        }
        draft.remove(key());
        return true;
    }
}
