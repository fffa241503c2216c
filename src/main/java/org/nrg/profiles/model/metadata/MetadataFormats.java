package org.nrg.profiles.model.metadata;

import com.google.common.collect.ImmutableMap;

/**
 * Formats that most services need.
 */
public final class MetadataFormats {
    /** Any attribute, any value. */
    public static final MetadataFormat UNDEFINED = MetadataFormat.builder("UndefinedFormat").build();

    public static final MetadataFormat PLAIN_TEXT = MetadataFormat.builder("PlainTextFormat")
            .mimetype("text/plain")
            .attributes(ImmutableMap.of(
                    "encoding", AttributeRule.optional(),
                    "language", AttributeRule.optional()))
            .allowCustomAttributes(true)
            .build();

    public static final MetadataFormat CSV = MetadataFormat.builder("CSVFormat")
            .mimetype("text/csv")
            .attributes(ImmutableMap.of(
                    "encoding", AttributeRule.optional(),
                    "delimiter", AttributeRule.optionalOneOf(",", ";", "\t", "|")))
            .allowCustomAttributes(true)
            .build();

    private MetadataFormats() {}
}
