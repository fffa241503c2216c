package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.nrg.profiles.model.parameter.Parameter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The outcome of checking submitted values against a template's parameters. The parameters are
 * private copies holding the submitted values and any errors.
 */
@AutoValue
public abstract class ParameterValidation {
    @JsonProperty("input-template") public abstract String inputTemplateId();
    @JsonProperty("errors") public abstract boolean hasErrors();
    @JsonProperty("parameters") public abstract ImmutableList<Parameter> parameters();

    public static ParameterValidation create(final String inputTemplateId,
                                             final boolean hasErrors,
                                             final List<Parameter> parameters) {
        return new AutoValue_ParameterValidation(inputTemplateId, hasErrors, ImmutableList.copyOf(parameters));
    }

    @JsonIgnore
    public List<Parameter> invalidParameters() {
        return parameters().stream().filter(Parameter::hasError).collect(Collectors.toList());
    }

    @JsonIgnore
    public Map<String, Object> values() {
        return Parameter.valuesOf(parameters());
    }
}
