package org.nrg.profiles.services;

import org.nrg.profiles.exceptions.MetadataException;
import org.nrg.profiles.exceptions.NotFoundException;
import org.nrg.profiles.exceptions.ParameterValidationException;
import org.nrg.profiles.model.file.ProjectFiles;
import org.nrg.profiles.model.metadata.MetadataRecord;
import org.nrg.profiles.model.profile.Profile;
import org.nrg.profiles.model.profile.ProfileResolution;
import org.nrg.profiles.model.template.ParameterValidation;

import java.util.List;
import java.util.Map;

public interface ProfilerService {
    List<Profile> matchingProfiles(ProjectFiles projectFiles, Map<String, ?> parameters);

    List<ProfileResolution> resolve(List<Profile> profiles, ProjectFiles projectFiles, Map<String, ?> parameters)
            throws MetadataException;
    List<ProfileResolution> resolve(ProjectFiles projectFiles, Map<String, ?> parameters) throws MetadataException;

    ParameterValidation validateInput(String inputTemplateId, Map<String, ?> submission, String user)
            throws NotFoundException;
    MetadataRecord generateInputMetadata(String inputTemplateId, Map<String, ?> submission, String user)
            throws NotFoundException, ParameterValidationException, MetadataException;
}
