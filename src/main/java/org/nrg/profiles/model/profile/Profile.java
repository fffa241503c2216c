package org.nrg.profiles.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.nrg.profiles.exceptions.MetadataException;
import org.nrg.profiles.exceptions.ProfileConfigurationException;
import org.nrg.profiles.exceptions.ProfileResolutionException;
import org.nrg.profiles.model.file.InputFile;
import org.nrg.profiles.model.file.ProjectFiles;
import org.nrg.profiles.model.template.Branch;
import org.nrg.profiles.model.template.InputTemplate;
import org.nrg.profiles.model.template.OutputTemplate;
import org.nrg.profiles.model.template.ParameterCondition;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pairs the input files a project must have with the output files that can be made from them.
 * <p>
 * Profiles are checked when they are built: every output template that can be reached through
 * the output conditions must be valid and must have a parent input template, unless it needs none.
 * Output templates without an explicit parent get the first input template of the same uniqueness.
 */
@Slf4j
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "input", "output"})
public abstract class Profile {
    @Nullable @JsonProperty("name") public abstract String name();
    @JsonProperty("input") public abstract ImmutableList<InputTemplate> inputTemplates();
    @JsonProperty("output") public abstract ImmutableList<Branch<OutputTemplate>> outputs();

    public static Builder builder() {
        return new AutoValue_Profile.Builder();
    }

    abstract Builder toBuilder();

    @JsonIgnore
    public String displayName() {
        return StringUtils.defaultIfBlank(name(), "(unnamed profile)");
    }

    @Nullable
    public InputTemplate inputTemplate(final String id) {
        if (id == null) {
            return null;
        }
        return inputTemplates().stream()
                .filter(inputTemplate -> id.equals(inputTemplate.id()))
                .findFirst()
                .orElse(null);
    }

    /**
     * @return Every output template this profile could produce, whatever the parameters.
     */
    @Nonnull
    public List<OutputTemplate> outputTemplates() {
        final List<OutputTemplate> outputTemplates = new ArrayList<>();
        for (final Branch<OutputTemplate> output : outputs()) {
            outputTemplates.addAll(output.allPossibilities());
        }
        return outputTemplates;
    }

    /**
     * @return The files matched by each input template, in input template order.
     */
    @Nonnull
    public List<InputFile> matchingFiles(final ProjectFiles projectFiles) {
        final List<InputFile> matchingFiles = new ArrayList<>();
        for (final InputTemplate inputTemplate : inputTemplates()) {
            matchingFiles.addAll(inputTemplate.matchingFiles(projectFiles));
        }
        return matchingFiles;
    }

    /**
     * Check whether this profile applies: every input template has at least one file, and every
     * top level output condition holds for the parameters.
     */
    public boolean match(final ProjectFiles projectFiles, final Map<String, ?> parameters) {
        for (final InputTemplate inputTemplate : inputTemplates()) {
            if (inputTemplate.matchingFiles(projectFiles).isEmpty()) {
                log.debug("Profile {} does not match. No files for input template \"{}\".", displayName(), inputTemplate.id());
                return false;
            }
        }
        if (outputs().isEmpty()) {
            log.debug("Profile {} does not match. It has no outputs.", displayName());
            return false;
        }
        final Map<String, ?> parameterValues = parameters == null ? Collections.emptyMap() : parameters;
        for (final Branch<OutputTemplate> output : outputs()) {
            if (!output.isTerminal() && !output.condition().match(parameterValues)) {
                log.debug("Profile {} does not match. An output condition does not hold for parameters {}.",
                        displayName(), parameterValues);
                return false;
            }
        }
        log.debug("Profile {} matches.", displayName());
        return true;
    }

    /**
     * Produce the outputs of this profile for the given files and parameters.
     *
     * @return The outputs of every output template chosen by the parameters, or an empty list if the profile does not match.
     */
    @Nonnull
    public List<GeneratedOutput> generate(final ProjectFiles projectFiles, final Map<String, ?> parameters)
            throws ProfileResolutionException, MetadataException {
        if (!match(projectFiles, parameters)) {
            return Collections.emptyList();
        }
        final Map<String, ?> parameterValues = parameters == null ? Collections.emptyMap() : parameters;

        final List<GeneratedOutput> generated = new ArrayList<>();
        for (final Branch<OutputTemplate> output : outputs()) {
            final Optional<OutputTemplate> outputTemplate = output.evaluate(parameterValues);
            if (outputTemplate.isPresent()) {
                generated.addAll(outputTemplate.get().generate(this, parameterValues, projectFiles));
            }
        }
        return generated;
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder name(String name);

        public abstract Builder inputTemplates(List<InputTemplate> inputTemplates);
        abstract ImmutableList.Builder<InputTemplate> inputTemplatesBuilder();
        public Builder addInputTemplate(final @Nonnull InputTemplate inputTemplate) {
            inputTemplatesBuilder().add(inputTemplate);
            return this;
        }

        public abstract Builder outputs(List<Branch<OutputTemplate>> outputs);
        abstract ImmutableList.Builder<Branch<OutputTemplate>> outputsBuilder();
        public Builder addOutputTemplate(final @Nonnull OutputTemplate outputTemplate) {
            outputsBuilder().add(Branch.terminal(outputTemplate));
            return this;
        }
        public Builder addOutputTemplate(final @Nonnull ParameterCondition<OutputTemplate> condition) {
            outputsBuilder().add(Branch.condition(condition));
            return this;
        }

        abstract Profile autoBuild();

        /**
         * Build and check the profile, filling in the parents of output templates that do not name one.
         *
         * @throws ProfileConfigurationException listing every problem found
         */
        public Profile build() throws ProfileConfigurationException {
            final Profile profile = autoBuild();
            final List<String> errors = new ArrayList<>();

            final Set<String> inputIds = new HashSet<>();
            for (final InputTemplate inputTemplate : profile.inputTemplates()) {
                errors.addAll(inputTemplate.validate());
                if (!inputIds.add(inputTemplate.id())) {
                    errors.add("Input template id \"" + inputTemplate.id() + "\" is not unique.");
                }
            }

            final Map<OutputTemplate, OutputTemplate> withParents = new IdentityHashMap<>();
            for (final OutputTemplate outputTemplate : profile.outputTemplates()) {
                errors.addAll(outputTemplate.validate());
                if (outputTemplate.parent() != null) {
                    if (!inputIds.contains(outputTemplate.parent())) {
                        errors.add("Output template \"" + outputTemplate.id() + "\" has parent \"" +
                                outputTemplate.parent() + "\", but there is no such input template.");
                    }
                } else if (!outputTemplate.isContextFree()) {
                    final String parent = outputTemplate.findParent(profile.inputTemplates());
                    if (parent == null) {
                        errors.add("Output template \"" + outputTemplate.id() + "\" has no parent, and no input " +
                                "template could be chosen as one. Declare a parent, or make it unique with a filename.");
                    } else {
                        log.debug("Output template \"{}\" of profile {} gets parent \"{}\".",
                                outputTemplate.id(), profile.displayName(), parent);
                        withParents.put(outputTemplate, outputTemplate.toBuilder().parent(parent).build());
                    }
                }
            }

            if (!errors.isEmpty()) {
                throw new ProfileConfigurationException("Profile " + profile.displayName() + " is not valid.", errors);
            }
            if (withParents.isEmpty()) {
                return profile;
            }

            final List<Branch<OutputTemplate>> outputs = new ArrayList<>();
            for (final Branch<OutputTemplate> output : profile.outputs()) {
                outputs.add(output.map(outputTemplate -> withParents.getOrDefault(outputTemplate, outputTemplate)));
            }
            return profile.toBuilder().outputs(outputs).autoBuild();
        }
    }
}
