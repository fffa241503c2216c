package org.nrg.profiles.model.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where a generated output came from: the output template, the input files it was derived from,
 * and the parameter values in effect.
 */
@AutoValue
public abstract class Provenance {
    @JsonProperty("output-template") public abstract String outputTemplateId();
    @Nullable @JsonProperty("output-template-label") public abstract String outputTemplateLabel();
    @JsonProperty("inputs") public abstract ImmutableList<Source> inputs();
    @JsonProperty("parameters") public abstract ImmutableMap<String, Object> parameters();

    public static Provenance create(final String outputTemplateId,
                                    final String outputTemplateLabel,
                                    final List<Source> inputs,
                                    final Map<String, ?> parameters) {
        final Map<String, Object> parametersCopy = new LinkedHashMap<>();
        if (parameters != null) {
            parameters.forEach((key, value) -> {
                if (value != null) {
                    parametersCopy.put(key, value);
                }
            });
        }
        return new AutoValue_Provenance(outputTemplateId, outputTemplateLabel,
                inputs == null ? ImmutableList.of() : ImmutableList.copyOf(inputs),
                ImmutableMap.copyOf(parametersCopy));
    }

    @AutoValue
    public static abstract class Source {
        @JsonProperty("input-template") public abstract String inputTemplateId();
        @JsonProperty("sequence-number") public abstract int sequenceNumber();
        @JsonProperty("filename") public abstract String filename();

        public static Source create(final String inputTemplateId, final int sequenceNumber, final String filename) {
            return new AutoValue_Provenance_Source(inputTemplateId, sequenceNumber, filename);
        }
    }
}
