package org.nrg.profiles.exceptions;

public class AmbiguousCopySourceException extends ProfileResolutionException {
    public AmbiguousCopySourceException(final String message) {
        super(message);
    }

    public AmbiguousCopySourceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
