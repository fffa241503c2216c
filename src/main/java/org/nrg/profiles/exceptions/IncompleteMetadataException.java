package org.nrg.profiles.exceptions;

public class IncompleteMetadataException extends MetadataException {
    public IncompleteMetadataException(final String message, final String key) {
        super(message, key);
    }
}
