package org.nrg.profiles.exceptions;

public class NotFoundException extends Exception {
    public NotFoundException(final String message) {
        super(message);
    }
}
