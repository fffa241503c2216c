package org.nrg.profiles.services.impl;

import lombok.extern.slf4j.Slf4j;
import org.nrg.profiles.exceptions.MetadataException;
import org.nrg.profiles.exceptions.NotFoundException;
import org.nrg.profiles.exceptions.ParameterValidationException;
import org.nrg.profiles.exceptions.ProfileResolutionException;
import org.nrg.profiles.model.file.ProjectFiles;
import org.nrg.profiles.model.metadata.MetadataRecord;
import org.nrg.profiles.model.profile.GeneratedOutput;
import org.nrg.profiles.model.profile.Profile;
import org.nrg.profiles.model.profile.ProfileResolution;
import org.nrg.profiles.model.template.InputTemplate;
import org.nrg.profiles.model.template.ParameterValidation;
import org.nrg.profiles.services.ProfileRegistry;
import org.nrg.profiles.services.ProfilerPreferences;
import org.nrg.profiles.services.ProfilerPreferences.MatchPolicy;
import org.nrg.profiles.services.ProfilerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ProfilerServiceImpl implements ProfilerService {
    private final ProfileRegistry profileRegistry;
    private final ProfilerPreferences preferences;

    @Autowired
    public ProfilerServiceImpl(final ProfileRegistry profileRegistry,
                               final ProfilerPreferences preferences) {
        this.profileRegistry = profileRegistry;
        this.preferences = preferences;
    }

    @Override
    public List<Profile> matchingProfiles(final ProjectFiles projectFiles, final Map<String, ?> parameters) {
        return profileRegistry.getProfiles().stream()
                .filter(profile -> profile.match(projectFiles, parameters))
                .collect(Collectors.toList());
    }

    @Override
    public List<ProfileResolution> resolve(final ProjectFiles projectFiles, final Map<String, ?> parameters)
            throws MetadataException {
        return resolve(profileRegistry.getProfiles(), projectFiles, parameters, preferences.getMatchPolicy());
    }

    @Override
    public List<ProfileResolution> resolve(final List<Profile> profiles,
                                           final ProjectFiles projectFiles,
                                           final Map<String, ?> parameters) throws MetadataException {
        return resolve(profiles, projectFiles, parameters, MatchPolicy.ALL);
    }

    private List<ProfileResolution> resolve(final List<Profile> profiles,
                                            final ProjectFiles projectFiles,
                                            final Map<String, ?> parameters,
                                            final MatchPolicy matchPolicy) throws MetadataException {
        final List<ProfileResolution> resolutions = new ArrayList<>();
        for (final Profile profile : profiles) {
            if (!profile.match(projectFiles, parameters)) {
                continue;
            }

            try {
                final List<GeneratedOutput> outputs = profile.generate(projectFiles, parameters);
                log.debug("Profile {} resolved to {} output(s).", profile.displayName(), outputs.size());
                resolutions.add(ProfileResolution.Success.create(profile.displayName(), outputs));
            } catch (ProfileResolutionException e) {
                log.error("Could not resolve the outputs of profile {}.", profile.displayName(), e);
                resolutions.add(ProfileResolution.Failure.create(profile.displayName(), e.getMessage()));
                if (preferences.isStopOnFailure()) {
                    log.debug("Not resolving further profiles after a failure.");
                    break;
                }
                continue;
            }

            if (matchPolicy == MatchPolicy.FIRST) {
                break;
            }
        }
        return resolutions;
    }

    @Override
    public ParameterValidation validateInput(final String inputTemplateId,
                                             final Map<String, ?> submission,
                                             final String user) throws NotFoundException {
        return getInputTemplate(inputTemplateId).validate(submission, user);
    }

    @Override
    public MetadataRecord generateInputMetadata(final String inputTemplateId,
                                                final Map<String, ?> submission,
                                                final String user)
            throws NotFoundException, ParameterValidationException, MetadataException {
        return getInputTemplate(inputTemplateId).generate(submission, user);
    }

    private InputTemplate getInputTemplate(final String inputTemplateId) throws NotFoundException {
        final InputTemplate inputTemplate = profileRegistry.findInputTemplate(inputTemplateId);
        if (inputTemplate == null) {
            throw new NotFoundException("No profile has an input template with id \"" + inputTemplateId + "\".");
        }
        return inputTemplate;
    }
}
