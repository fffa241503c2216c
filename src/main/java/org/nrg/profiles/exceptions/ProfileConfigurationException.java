package org.nrg.profiles.exceptions;

import java.util.Collections;
import java.util.List;

/**
 * A profile or template was declared in a way that can never resolve.
 * Thrown while profiles are being built, before any request is processed.
 */
public class ProfileConfigurationException extends Exception {
    private final List<String> errors;

    public ProfileConfigurationException(final String message) {
        this(message, Collections.emptyList());
    }

    public ProfileConfigurationException(final String message, final List<String> errors) {
        super(errors == null || errors.isEmpty() ? message : message + " " + String.join(" ", errors));
        this.errors = errors == null ? Collections.emptyList() : Collections.unmodifiableList(errors);
    }

    public ProfileConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
        this.errors = Collections.emptyList();
    }

    public List<String> getErrors() {
        return errors;
    }
}
