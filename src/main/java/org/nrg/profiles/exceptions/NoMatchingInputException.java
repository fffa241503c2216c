package org.nrg.profiles.exceptions;

public class NoMatchingInputException extends ProfileResolutionException {
    public NoMatchingInputException(final String message) {
        super(message);
    }

    public NoMatchingInputException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
