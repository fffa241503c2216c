package org.nrg.profiles.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * What came of resolving one matching profile: its outputs, or the reason they could not be worked out.
 */
public abstract class ProfileResolution {
    @JsonProperty("status") public abstract String status();
    @JsonProperty("profile") public abstract String profileName();

    @JsonIgnore
    public abstract boolean isSuccess();

    @AutoValue
    public static abstract class Success extends ProfileResolution {
        private final static String STATUS = "success";
        @JsonProperty("outputs") public abstract ImmutableList<GeneratedOutput> outputs();

        public static Success create(final @Nonnull String profileName, final List<GeneratedOutput> outputs) {
            final ImmutableList<GeneratedOutput> outputsCopy =
                    outputs == null ?
                            ImmutableList.<GeneratedOutput>of() :
                            ImmutableList.copyOf(outputs);
            return new AutoValue_ProfileResolution_Success(STATUS, profileName, outputsCopy);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    @AutoValue
    public static abstract class Failure extends ProfileResolution {
        private final static String STATUS = "failure";
        @JsonProperty("message") public abstract String message();

        public static Failure create(final @Nonnull String profileName, final String message) {
            return new AutoValue_ProfileResolution_Failure(STATUS, profileName, message);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
