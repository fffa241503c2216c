package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.nrg.profiles.exceptions.ProfileResolutionException;
import org.nrg.profiles.model.file.InputFile;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * A rule contributing one attribute to the metadata of a generated output.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "operator")
@JsonPropertyOrder({"operator", "id"})
@JsonSubTypes({
        // Add new meta field classes here as they are created
        @JsonSubTypes.Type(value = SetMetaField.class, name = SetMetaField.OPERATOR),
        @JsonSubTypes.Type(value = UnsetMetaField.class, name = UnsetMetaField.OPERATOR),
        @JsonSubTypes.Type(value = CopyMetaField.class, name = CopyMetaField.OPERATOR),
        @JsonSubTypes.Type(value = ParameterMetaField.class, name = ParameterMetaField.OPERATOR)
})
public interface MetaField {
    @JsonProperty("operator") String operator();
    @JsonProperty("id") String key();

    /**
     * Apply this rule to a metadata draft.
     *
     * @param draft The attributes collected so far; modified in place
     * @param parameters The submitted parameter values
     * @param parentFile The input file the output is derived from, if any
     * @param relevantInputFiles The input files that share the output's sequence number, or apply to all
     * @return true if the draft was changed
     */
    boolean resolve(Map<String, Object> draft,
                    Map<String, ?> parameters,
                    @Nullable InputFile parentFile,
                    List<InputFile> relevantInputFiles) throws ProfileResolutionException;
}
