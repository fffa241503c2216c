package org.nrg.profiles.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import org.nrg.profiles.model.metadata.MetadataRecord;

/**
 * A file a profile will produce, with its metadata.
 */
@AutoValue
public abstract class GeneratedOutput {
    @JsonProperty("filename") public abstract String filename();
    @JsonProperty("metadata") public abstract MetadataRecord metadata();
    @JsonProperty("output-template") public abstract String outputTemplateId();

    public static GeneratedOutput create(final String filename,
                                         final MetadataRecord metadata,
                                         final String outputTemplateId) {
        return new AutoValue_GeneratedOutput(filename, metadata, outputTemplateId);
    }
}
