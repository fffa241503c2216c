package org.nrg.profiles.config;

import lombok.extern.slf4j.Slf4j;
import org.nrg.profiles.exceptions.ProfileConfigurationException;
import org.nrg.profiles.model.profile.Profile;
import org.nrg.profiles.services.ProfileRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.ComponentScan.Filter;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.PropertySource;

import java.util.stream.Collectors;

@Slf4j
@Configuration
@ComponentScan(value = {"org.nrg.profiles.services"},
               excludeFilters = @Filter(type = FilterType.REGEX, pattern = ".*TestConfig.*"))
@PropertySource("classpath:profiles.properties")
@Import({ObjectMapperConfig.class})
public class ProfilesConfig {
    public static final String MATCH_POLICY_PROPERTY    = "profiles.match-policy";
    public static final String MATCH_POLICY_DFLT        = "all";
    public static final String STOP_ON_FAILURE_PROPERTY = "profiles.stop-on-failure";
    public static final String STOP_ON_FAILURE_DFLT     = "false";

    /**
     * Registers every {@link Profile} bean in the context, in bean order.
     */
    @Bean
    public ProfileRegistry profileRegistry(final ObjectProvider<Profile> profiles) throws ProfileConfigurationException {
        return new ProfileRegistry(profiles.orderedStream().collect(Collectors.toList()));
    }
}
