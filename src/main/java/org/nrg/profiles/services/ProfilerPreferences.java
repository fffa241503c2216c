package org.nrg.profiles.services;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.extern.slf4j.Slf4j;
import org.nrg.profiles.config.ProfilesConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ProfilerPreferences {
    private final MatchPolicy matchPolicy;
    private final boolean stopOnFailure;

    @Autowired
    public ProfilerPreferences(@Value("${" + ProfilesConfig.MATCH_POLICY_PROPERTY + ":" + ProfilesConfig.MATCH_POLICY_DFLT + "}") final String matchPolicy,
                               @Value("${" + ProfilesConfig.STOP_ON_FAILURE_PROPERTY + ":" + ProfilesConfig.STOP_ON_FAILURE_DFLT + "}") final boolean stopOnFailure) {
        this.matchPolicy = MatchPolicy.fromName(matchPolicy);
        this.stopOnFailure = stopOnFailure;
        log.debug("Profiler preferences: match policy {}, stop on failure {}.", this.matchPolicy, this.stopOnFailure);
    }

    public MatchPolicy getMatchPolicy() {
        return matchPolicy;
    }

    public boolean isStopOnFailure() {
        return stopOnFailure;
    }

    public enum MatchPolicy {
        ALL("all"),
        FIRST("first");

        private final String name;

        MatchPolicy(final String name) {
            this.name = name;
        }

        @JsonValue
        public String getName() {
            return name;
        }

        /**
         * @throws IllegalArgumentException for anything but "all" or "first", in any case
         */
        public static MatchPolicy fromName(final String name) {
            for (final MatchPolicy policy : values()) {
                if (policy.name.equalsIgnoreCase(name == null ? null : name.trim())) {
                    return policy;
                }
            }
            throw new IllegalArgumentException("Unknown profile match policy \"" + name + "\". Use \"all\" or \"first\".");
        }
    }
}
