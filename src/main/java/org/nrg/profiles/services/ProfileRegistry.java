package org.nrg.profiles.services;

import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.nrg.profiles.exceptions.ProfileConfigurationException;
import org.nrg.profiles.model.profile.Profile;
import org.nrg.profiles.model.template.InputTemplate;
import org.nrg.profiles.model.template.OutputTemplate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The profiles known to the application, in declaration order. Built once at startup.
 */
@Slf4j
public class ProfileRegistry {
    private final ImmutableList<Profile> profiles;

    public ProfileRegistry(final List<Profile> profiles) throws ProfileConfigurationException {
        final List<String> errors = new ArrayList<>();
        final Set<String> names = new HashSet<>();
        for (final Profile profile : profiles) {
            if (StringUtils.isNotBlank(profile.name()) && !names.add(profile.name())) {
                errors.add("Profile name \"" + profile.name() + "\" is not unique.");
            }
        }
        if (!errors.isEmpty()) {
            throw new ProfileConfigurationException("Could not register profiles.", errors);
        }

        this.profiles = ImmutableList.copyOf(profiles);
        log.info("Registered {} profile(s).", this.profiles.size());
        if (log.isDebugEnabled()) {
            for (final Profile profile : this.profiles) {
                log.debug("Profile {}: {} input template(s), {} output template(s).", profile.displayName(),
                        profile.inputTemplates().size(), profile.outputTemplates().size());
            }
        }
    }

    @Nonnull
    public List<Profile> getProfiles() {
        return profiles;
    }

    @Nullable
    public Profile getProfile(final String name) {
        return profiles.stream()
                .filter(profile -> StringUtils.equals(name, profile.name()))
                .findFirst()
                .orElse(null);
    }

    /**
     * @return The first input template with the given id in any profile, or null.
     */
    @Nullable
    public InputTemplate findInputTemplate(final String id) {
        for (final Profile profile : profiles) {
            final InputTemplate inputTemplate = profile.inputTemplate(id);
            if (inputTemplate != null) {
                return inputTemplate;
            }
        }
        return null;
    }

    /**
     * @return The first output template with the given id that any profile could produce, or null.
     */
    @Nullable
    public OutputTemplate findOutputTemplate(final String id) {
        for (final Profile profile : profiles) {
            for (final OutputTemplate outputTemplate : profile.outputTemplates()) {
                if (outputTemplate.id().equals(id)) {
                    return outputTemplate;
                }
            }
        }
        return null;
    }
}
