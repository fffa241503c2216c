package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.nrg.profiles.exceptions.MetadataException;
import org.nrg.profiles.exceptions.ParameterValidationException;
import org.nrg.profiles.model.file.InputFile;
import org.nrg.profiles.model.file.ProjectFiles;
import org.nrg.profiles.model.metadata.MetadataFormat;
import org.nrg.profiles.model.metadata.MetadataRecord;
import org.nrg.profiles.model.parameter.Parameter;
import org.nrg.profiles.utils.TemplateFilenames;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A class of input file a profile accepts.
 * <p>
 * A unique template takes exactly one file. Otherwise it takes any number of files, numbered by
 * sequence; its filename, if given, must then contain the {@code #} placeholder for that number.
 */
@Slf4j
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "label", "format", "mimetype", "schema", "unique", "filename", "extension", "parameters"})
public abstract class InputTemplate {
    @JsonProperty("id") public abstract String id();
    public abstract MetadataFormat format();
    @JsonProperty("label") public abstract String label();
    @JsonProperty("unique") public abstract boolean unique();
    @Nullable @JsonProperty("filename") public abstract String filename();
    @Nullable @JsonProperty("extension") public abstract String extension();
    @JsonProperty("parameters") public abstract ImmutableList<Parameter> parameters();

    public static Builder builder(final String id, final MetadataFormat format, final String label) {
        return new AutoValue_InputTemplate.Builder()
                .id(id)
                .format(format)
                .label(label)
                .unique(true);
    }

    @JsonProperty("format")
    public String formatName() {
        return format().name();
    }

    @Nullable
    @JsonProperty("mimetype")
    public String mimetype() {
        return format().mimetype();
    }

    @Nullable
    @JsonProperty("schema")
    public String schema() {
        return format().schema();
    }

    @Nonnull
    public List<String> validate() {
        final List<String> errors = new ArrayList<>();
        if (!TemplateFilenames.isValidId(id())) {
            errors.add("Input template id \"" + id() + "\" must not be blank or contain path separators.");
        }
        final String templateName = "Input template \"" + id() + "\" - ";
        if (StringUtils.isBlank(label())) {
            errors.add(templateName + "label cannot be blank.");
        }
        if (!unique() && filename() != null && !TemplateFilenames.hasPlaceholder(filename())) {
            errors.add(templateName + "accepts multiple files, so filename \"" + filename() + "\" must contain the " +
                    TemplateFilenames.SEQUENCE_PLACEHOLDER + " placeholder.");
        }

        final Set<String> parameterIds = new HashSet<>();
        for (final Parameter parameter : parameters()) {
            if (StringUtils.isBlank(parameter.getId())) {
                errors.add(templateName + "parameter id cannot be blank.");
            } else if (!parameterIds.add(parameter.getId())) {
                errors.add(templateName + "parameter id \"" + parameter.getId() + "\" is not unique.");
            }
        }
        for (final Parameter parameter : parameters()) {
            for (final String other : parameter.getForbid()) {
                if (!parameterIds.contains(other)) {
                    errors.add(templateName + "parameter \"" + parameter.getId() + "\" forbids unknown parameter \"" + other + "\".");
                }
            }
            for (final String other : parameter.getRequire()) {
                if (!parameterIds.contains(other)) {
                    errors.add(templateName + "parameter \"" + parameter.getId() + "\" requires unknown parameter \"" + other + "\".");
                }
            }
        }
        return errors;
    }

    /**
     * @return The files registered for this template, by ascending sequence number. A unique
     * template with anything but exactly one file has no usable match, so the list is empty.
     */
    @Nonnull
    public List<InputFile> matchingFiles(final ProjectFiles projectFiles) {
        final List<InputFile> files = projectFiles.lookupFilesForTemplate(id()).stream()
                .sorted(Comparator.comparingInt(InputFile::sequenceNumber))
                .collect(Collectors.toList());
        if (unique() && files.size() != 1) {
            if (files.size() > 1) {
                log.debug("Input template \"{}\" is unique but has {} files. Treating it as unmatched.", id(), files.size());
            }
            return Collections.emptyList();
        }
        return files;
    }

    /**
     * Check submitted values against this template's parameters. The template's own parameters
     * are not touched; the result holds copies with values and errors set.
     *
     * @param submission Submitted values by parameter id
     * @param user The submitting user, for parameters restricted to certain users
     */
    @Nonnull
    public ParameterValidation validate(final Map<String, ?> submission, @Nullable final String user) {
        final List<Parameter> parameters = parameters().stream()
                .map(Parameter::copy)
                .collect(Collectors.toList());

        boolean errors = false;
        for (final Parameter parameter : parameters) {
            if (!parameter.access(user)) {
                log.debug("User {} may not set parameter \"{}\" of input template \"{}\".", user, parameter.getId(), id());
                continue;
            }
            final Object submitted = submission == null ? null : submission.get(parameter.getId());
            if (submitted != null && !(submitted instanceof String && StringUtils.isBlank((String) submitted))) {
                if (!parameter.set(submitted)) {
                    errors = true;
                }
            } else if (parameter.getDefaultValue() != null) {
                if (!parameter.set(parameter.getDefaultValue())) {
                    errors = true;
                }
            } else if (parameter.isRequired()) {
                parameter.setError("This parameter is required.");
                errors = true;
            }
        }

        for (final Parameter parameter : parameters) {
            if (!parameter.hasValue()) {
                continue;
            }
            for (final Parameter other : parameters) {
                if (other == parameter) {
                    continue;
                }
                if (parameter.getForbid().contains(other.getId()) && other.hasValue()) {
                    final String message = "Setting parameter \"" + parameter.getName() + "\" together with \"" +
                            other.getName() + "\" is forbidden.";
                    parameter.setError(message);
                    other.setError(message);
                    errors = true;
                }
                if (parameter.getRequire().contains(other.getId()) && !other.hasValue()) {
                    parameter.setError("Parameter \"" + parameter.getName() + "\" requires \"" + other.getName() + "\" to be set.");
                    errors = true;
                }
            }
        }

        return ParameterValidation.create(id(), errors, parameters);
    }

    /**
     * Validate the submission and build the metadata of the submitted file from it.
     */
    @Nonnull
    public MetadataRecord generate(final Map<String, ?> submission, @Nullable final String user)
            throws ParameterValidationException, MetadataException {
        return generate(validate(submission, user));
    }

    /**
     * Build the metadata of a submitted file from an earlier validation.
     *
     * @throws ParameterValidationException if the validation found errors
     */
    @Nonnull
    public MetadataRecord generate(final ParameterValidation validation)
            throws ParameterValidationException, MetadataException {
        if (validation.hasErrors()) {
            throw new ParameterValidationException("Parameters of input template \"" + id() + "\" are not valid.",
                    validation.invalidParameters());
        }
        return format().create(validation.values(), id(), null);
    }

    /**
     * The name under which a submitted file is registered. The template's own filename wins over the
     * submitted one; the extension is added if the name does not end with it already.
     */
    @Nonnull
    public String targetFilename(final String submittedFilename, final int sequenceNumber) {
        String filename = StringUtils.defaultIfBlank(filename(), submittedFilename);
        if (!unique()) {
            filename = TemplateFilenames.substituteSequenceNumber(filename, sequenceNumber);
        }
        return TemplateFilenames.appendExtension(filename, extension());
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder id(String id);
        public abstract Builder format(MetadataFormat format);
        public abstract Builder label(String label);
        public abstract Builder unique(boolean unique);
        public abstract Builder filename(String filename);
        public abstract Builder extension(String extension);

        public abstract Builder parameters(List<Parameter> parameters);
        abstract ImmutableList.Builder<Parameter> parametersBuilder();
        public Builder addParameter(final @Nonnull Parameter parameter) {
            parametersBuilder().add(parameter);
            return this;
        }

        public Builder multi() {
            return unique(false);
        }

        public abstract InputTemplate build();
    }
}
