package org.nrg.profiles.exceptions;

public class MetadataException extends Exception {
    private final String key;

    public MetadataException(final String message) {
        this(message, null);
    }

    public MetadataException(final String message, final String key) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
