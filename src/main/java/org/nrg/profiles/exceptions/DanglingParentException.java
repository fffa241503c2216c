package org.nrg.profiles.exceptions;

public class DanglingParentException extends ProfileResolutionException {
    final String parent;

    public DanglingParentException(final String message, final String parent) {
        super(message);
        this.parent = parent;
    }

    public String getParent() {
        return parent;
    }
}
