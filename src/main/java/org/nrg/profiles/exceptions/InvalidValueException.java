package org.nrg.profiles.exceptions;

public class InvalidValueException extends MetadataException {
    public InvalidValueException(final String message, final String key) {
        super(message, key);
    }
}
