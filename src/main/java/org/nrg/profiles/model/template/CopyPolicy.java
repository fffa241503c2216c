package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * What a {@link CopyMetaField} does when more than one relevant input file could supply the value.
 */
public enum CopyPolicy {
    /** The last matching file in sequence order wins. */
    LAST_WINS("last"),
    /** The first matching file in sequence order wins. */
    FIRST_WINS("first"),
    /** More than one candidate with a value is a resolution error. */
    ERROR_ON_AMBIGUITY("error");

    private final String name;

    CopyPolicy(final String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    @Nullable
    public static CopyPolicy fromName(final String name) {
        return Arrays.stream(values()).filter(policy -> policy.name.equals(name)).findFirst().orElse(null);
    }
}
