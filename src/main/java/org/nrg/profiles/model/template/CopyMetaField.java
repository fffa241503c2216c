package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.auto.value.AutoValue;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.nrg.profiles.exceptions.AmbiguousCopySourceException;
import org.nrg.profiles.model.file.InputFile;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Copies an attribute from the metadata of a relevant input file.
 * <p>
 * The source is either an input template id, to copy the attribute of the same name, or
 * {@code templateId.attribute} to copy a differently named one.
 */
@Slf4j
@AutoValue
@JsonTypeName(CopyMetaField.OPERATOR)
public abstract class CopyMetaField implements MetaField {
    public static final String OPERATOR = "copy";

    @Override
    @JsonProperty("id") public abstract String key();
    @JsonProperty("source") public abstract String source();
    @JsonProperty("policy") public abstract CopyPolicy policy();

    @Override
    @JsonProperty("operator")
    public String operator() {
        return OPERATOR;
    }

    @JsonCreator
    public static CopyMetaField create(@JsonProperty("id") final String key,
                                       @JsonProperty("source") final String source,
                                       @JsonProperty("policy") final CopyPolicy policy) {
        return new AutoValue_CopyMetaField(key, source, policy == null ? CopyPolicy.LAST_WINS : policy);
    }

    public static CopyMetaField create(final String key, final String source) {
        return create(key, source, CopyPolicy.LAST_WINS);
    }

    @JsonIgnore
    public String sourceTemplateId() {
        return source().contains(".") ? StringUtils.substringBefore(source(), ".") : source();
    }

    @JsonIgnore
    public String sourceKey() {
        return source().contains(".") ? StringUtils.substringAfter(source(), ".") : key();
    }

    @Override
    public boolean resolve(final Map<String, Object> draft,
                           final Map<String, ?> parameters,
                           final InputFile parentFile,
                           final List<InputFile> relevantInputFiles) throws AmbiguousCopySourceException {
        final String sourceKey = sourceKey();
        final List<InputFile> candidates = relevantInputFiles.stream()
                .filter(inputFile -> sourceTemplateId().equals(inputFile.templateId()))
                .filter(inputFile -> inputFile.metadata() != null && inputFile.metadata().contains(sourceKey))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            log.debug("Nothing to copy into \"{}\". No relevant input file of template \"{}\" has attribute \"{}\".",
                    key(), sourceTemplateId(), sourceKey);
            return false;
        }

        final InputFile chosen;
        switch (policy()) {
            case FIRST_WINS:
                chosen = candidates.get(0);
                break;
            case ERROR_ON_AMBIGUITY:
                if (candidates.size() > 1) {
                    throw new AmbiguousCopySourceException("Attribute \"" + key() + "\" could be copied from " +
                            candidates.size() + " files of input template \"" + sourceTemplateId() + "\": " +
                            candidates.stream().map(InputFile::filename).collect(Collectors.joining(", ")));
                }
                chosen = candidates.get(0);
                break;
            case LAST_WINS:
            default:
                chosen = candidates.get(candidates.size() - 1);
        }

        draft.put(key(), chosen.metadata().get(sourceKey));
        return true;
    }
}
