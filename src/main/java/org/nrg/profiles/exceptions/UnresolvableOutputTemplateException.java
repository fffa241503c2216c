package org.nrg.profiles.exceptions;

public class UnresolvableOutputTemplateException extends ProfileResolutionException {
    public UnresolvableOutputTemplateException(final String message) {
        super(message);
    }

    public UnresolvableOutputTemplateException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
