package org.nrg.profiles.exceptions;

import org.nrg.profiles.model.parameter.Parameter;

import java.util.Collections;
import java.util.List;

public class ParameterValidationException extends Exception {
    private final List<Parameter> invalidParameters;

    public ParameterValidationException(final String message, final List<Parameter> invalidParameters) {
        super(message);
        this.invalidParameters = invalidParameters == null ?
                Collections.emptyList() :
                Collections.unmodifiableList(invalidParameters);
    }

    public List<Parameter> getInvalidParameters() {
        return invalidParameters;
    }
}
