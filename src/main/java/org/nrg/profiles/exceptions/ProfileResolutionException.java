package org.nrg.profiles.exceptions;

public class ProfileResolutionException extends Exception {
    public ProfileResolutionException(final String message) {
        super(message);
    }

    public ProfileResolutionException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ProfileResolutionException(final Throwable cause) {
        super(cause);
    }
}
