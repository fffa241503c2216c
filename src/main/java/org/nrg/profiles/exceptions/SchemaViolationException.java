package org.nrg.profiles.exceptions;

public class SchemaViolationException extends MetadataException {
    public SchemaViolationException(final String message, final String key) {
        super(message, key);
    }
}
