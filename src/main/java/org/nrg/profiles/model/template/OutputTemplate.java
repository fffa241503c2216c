package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.nrg.profiles.exceptions.DanglingParentException;
import org.nrg.profiles.exceptions.MetadataException;
import org.nrg.profiles.exceptions.NoMatchingInputException;
import org.nrg.profiles.exceptions.ProfileResolutionException;
import org.nrg.profiles.exceptions.UnresolvableOutputTemplateException;
import org.nrg.profiles.model.file.InputFile;
import org.nrg.profiles.model.file.ProjectFiles;
import org.nrg.profiles.model.metadata.MetadataFormat;
import org.nrg.profiles.model.metadata.MetadataRecord;
import org.nrg.profiles.model.metadata.Provenance;
import org.nrg.profiles.model.profile.GeneratedOutput;
import org.nrg.profiles.model.profile.Profile;
import org.nrg.profiles.utils.TemplateFilenames;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A class of output file a profile produces.
 * <p>
 * An output is derived from a parent input template: one output per parent file, named after the
 * parent file unless the template has a filename of its own. A unique output with a literal
 * filename needs no parent.
 */
@Slf4j
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "label", "format", "mimetype", "schema", "unique", "filename", "extension",
        "remove-extensions", "parent", "copy-metadata", "metafields"})
public abstract class OutputTemplate {
    @JsonProperty("id") public abstract String id();
    public abstract MetadataFormat format();
    @JsonProperty("label") public abstract String label();
    @JsonProperty("metafields") public abstract ImmutableList<Branch<MetaField>> metafields();
    @JsonProperty("unique") public abstract boolean unique();
    @Nullable @JsonProperty("filename") public abstract String filename();
    @Nullable @JsonProperty("extension") public abstract String extension();
    @JsonProperty("remove-extensions") public abstract ExtensionRemoval removeExtensions();
    @Nullable @JsonProperty("parent") public abstract String parent();
    @JsonProperty("copy-metadata") public abstract boolean copyMetadata();

    public static Builder builder(final String id, final MetadataFormat format, final String label) {
        return new AutoValue_OutputTemplate.Builder()
                .id(id)
                .format(format)
                .label(label)
                .unique(true)
                .removeExtensions(ExtensionRemoval.none())
                .copyMetadata(false);
    }

    public abstract Builder toBuilder();

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

    /**
     * @return true if this template needs no parent: it is unique and names its file itself.
     */
    @JsonIgnore
    public boolean isContextFree() {
        return unique() && StringUtils.isNotBlank(filename());
    }

    @Nonnull
    public List<String> validate() {
        final List<String> errors = new ArrayList<>();
        if (!TemplateFilenames.isValidId(id())) {
            errors.add("Output template id \"" + id() + "\" must not be blank or contain path separators.");
        }
        final String templateName = "Output template \"" + id() + "\" - ";
        if (StringUtils.isBlank(label())) {
            errors.add(templateName + "label cannot be blank.");
        }
        if (!unique() && filename() != null && !TemplateFilenames.hasPlaceholder(filename())) {
            errors.add(templateName + "produces multiple files, so filename \"" + filename() + "\" must contain the " +
                    TemplateFilenames.SEQUENCE_PLACEHOLDER + " placeholder.");
        }
        for (final Branch<MetaField> metafield : metafields()) {
            for (final MetaField field : metafield.allPossibilities()) {
                if (StringUtils.isBlank(field.key())) {
                    errors.add(templateName + "a \"" + field.operator() + "\" meta field has no id.");
                }
            }
        }
        return errors;
    }

    /**
     * Guess a parent: the first input template with the same uniqueness as this one.
     *
     * @return The parent's id, or null if no input template qualifies.
     */
    @Nullable
    public String findParent(final List<InputTemplate> inputTemplates) {
        return inputTemplates.stream()
                .filter(inputTemplate -> inputTemplate.unique() == unique())
                .map(InputTemplate::id)
                .findFirst()
                .orElse(null);
    }

    @Nonnull
    public InputTemplate getParent(final Profile profile) throws DanglingParentException {
        final InputTemplate parent = profile.inputTemplate(parent());
        if (parent == null) {
            throw new DanglingParentException("Output template \"" + id() + "\" has parent \"" + parent() +
                    "\", but the profile has no such input template.", parent());
        }
        return parent;
    }

    /**
     * Work out the files this template produces, and their metadata.
     *
     * @param profile The profile this template belongs to
     * @param parameters The submitted parameter values
     * @param projectFiles The project's input files
     * @return One output per parent file, in sequence order; a single output if this template has no parent
     */
    @Nonnull
    public List<GeneratedOutput> generate(final Profile profile,
                                          final Map<String, ?> parameters,
                                          final ProjectFiles projectFiles)
            throws ProfileResolutionException, MetadataException {
        final Map<String, ?> parameterValues = parameters == null ? Collections.emptyMap() : parameters;

        if (parent() == null) {
            if (isContextFree()) {
                log.debug("Output template \"{}\" has no parent. Generating \"{}\".", id(), filename());
                return Collections.singletonList(
                        createOutput(filename(), null, Collections.emptyList(), parameterValues));
            }
            throw new UnresolvableOutputTemplateException("Output template \"" + id() + "\" has no parent, " +
                    "so it must be unique and have a filename.");
        }

        final InputTemplate parentTemplate = getParent(profile);
        final List<InputFile> parentFiles = parentTemplate.matchingFiles(projectFiles);
        if (parentFiles.isEmpty()) {
            throw new NoMatchingInputException("Output template \"" + id() + "\" has parent \"" + parent() +
                    "\", but no matching input files were found.");
        }
        final List<InputFile> inputFiles = profile.matchingFiles(projectFiles);

        final List<GeneratedOutput> outputs = new ArrayList<>(parentFiles.size());
        for (final InputFile parentFile : parentFiles) {
            final int sequenceNumber = parentFile.sequenceNumber();
            final List<InputFile> relevantInputFiles = inputFiles.stream()
                    .filter(inputFile -> inputFile.sequenceNumber() == 0 || inputFile.sequenceNumber() == sequenceNumber)
                    .collect(Collectors.toList());

            String filename = filename() != null ? filename() : parentFile.filename();
            if (!unique()) {
                filename = TemplateFilenames.substituteSequenceNumber(filename, sequenceNumber);
            }
            filename = removeExtensions().apply(filename);
            if (filename() == null) {
                filename = TemplateFilenames.appendExtension(filename, extension());
            }

            log.debug("Output template \"{}\": generating \"{}\" from \"{}\" (sequence number {}).",
                    id(), filename, parentFile.filename(), sequenceNumber);
            outputs.add(createOutput(filename, parentFile, relevantInputFiles, parameterValues));
        }
        return outputs;
    }

    private GeneratedOutput createOutput(final String filename,
                                         @Nullable final InputFile parentFile,
                                         final List<InputFile> relevantInputFiles,
                                         final Map<String, ?> parameters)
            throws ProfileResolutionException, MetadataException {
        final Map<String, Object> draft = new LinkedHashMap<>();
        if (copyMetadata() && parentFile != null && parentFile.metadata() != null) {
            draft.putAll(parentFile.metadata().getAttributes());
        }

        for (final Branch<MetaField> metafield : metafields()) {
            final Optional<MetaField> field = metafield.evaluate(parameters);
            if (!field.isPresent()) {
                continue;
            }
            final boolean changed = field.get().resolve(draft, parameters, parentFile, relevantInputFiles);
            if (log.isTraceEnabled()) {
                log.trace("Meta field {} \"{}\" on \"{}\": {}", field.get().operator(), field.get().key(), filename,
                        changed ? "changed" : "unchanged");
            }
        }

        final Provenance provenance = Provenance.create(id(), label(),
                relevantInputFiles.stream().map(InputFile::toProvenanceSource).collect(Collectors.toList()),
                parameters);
        final MetadataRecord metadata = format().create(draft, null, provenance);
        return GeneratedOutput.create(filename, metadata, id());
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder id(String id);
        public abstract Builder format(MetadataFormat format);
        public abstract Builder label(String label);

        public abstract Builder metafields(List<Branch<MetaField>> metafields);
        abstract ImmutableList.Builder<Branch<MetaField>> metafieldsBuilder();
        public Builder addMetaField(final @Nonnull MetaField metaField) {
            metafieldsBuilder().add(Branch.terminal(metaField));
            return this;
        }
        public Builder addMetaField(final @Nonnull ParameterCondition<MetaField> condition) {
            metafieldsBuilder().add(Branch.condition(condition));
            return this;
        }

        public abstract Builder unique(boolean unique);
        public Builder multi() {
            return unique(false);
        }

        public abstract Builder filename(String filename);
        public abstract Builder extension(String extension);
        public abstract Builder removeExtensions(ExtensionRemoval removeExtensions);
        public abstract Builder parent(String parent);
        public abstract Builder copyMetadata(boolean copyMetadata);

        public abstract OutputTemplate build();
    }
}
