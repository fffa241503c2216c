package org.nrg.profiles.exceptions;

public class InvalidParameterValueException extends ProfileResolutionException {
    final String parameter;

    public InvalidParameterValueException(final String message, final String parameter) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
