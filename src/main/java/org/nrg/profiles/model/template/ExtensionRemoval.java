package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import org.nrg.profiles.utils.TemplateFilenames;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;

/**
 * Which extensions an output template strips from the filename it derives from its parent.
 */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public abstract class ExtensionRemoval {
    private static final ExtensionRemoval NONE = create(false, Collections.emptySet());
    private static final ExtensionRemoval ALL = create(true, Collections.emptySet());

    @JsonProperty("all") public abstract boolean allExtensions();
    @JsonProperty("extensions") public abstract ImmutableSet<String> extensions();

    @JsonCreator
    static ExtensionRemoval create(@JsonProperty("all") final Boolean all,
                                   @JsonProperty("extensions") final Collection<String> extensions) {
        return new AutoValue_ExtensionRemoval(all != null && all,
                extensions == null ? ImmutableSet.of() : ImmutableSet.copyOf(extensions));
    }

    public static ExtensionRemoval none() {
        return NONE;
    }

    /**
     * Strip the last extension, whatever it is.
     */
    public static ExtensionRemoval all() {
        return ALL;
    }

    /**
     * Strip the given extensions if the filename ends with one of them.
     */
    public static ExtensionRemoval of(final String... extensions) {
        return create(false, Arrays.asList(extensions));
    }

    public String apply(final String filename) {
        if (allExtensions()) {
            return TemplateFilenames.removeLastExtension(filename);
        }
        if (!extensions().isEmpty()) {
            return TemplateFilenames.removeExtensions(filename, extensions());
        }
        return filename;
    }
}
