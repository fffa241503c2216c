package org.nrg.profiles.model.file;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import org.nrg.profiles.model.metadata.MetadataRecord;
import org.nrg.profiles.model.metadata.Provenance;

import javax.annotation.Nullable;

/**
 * A file registered for an input template. Sequence number 0 marks a file that applies to all
 * sequence numbers of the other inputs.
 */
@AutoValue
public abstract class InputFile {
    @JsonProperty("input-template") public abstract String templateId();
    @JsonProperty("sequence-number") public abstract int sequenceNumber();
    @JsonProperty("filename") public abstract String filename();
    @Nullable @JsonProperty("metadata") public abstract MetadataRecord metadata();

    public static InputFile create(final String templateId,
                                   final int sequenceNumber,
                                   final String filename,
                                   final MetadataRecord metadata) {
        return new AutoValue_InputFile(templateId, sequenceNumber, filename, metadata);
    }

    public static InputFile create(final String templateId, final int sequenceNumber, final String filename) {
        return create(templateId, sequenceNumber, filename, null);
    }

    public Provenance.Source toProvenanceSource() {
        return Provenance.Source.create(templateId(), sequenceNumber(), filename());
    }
}
