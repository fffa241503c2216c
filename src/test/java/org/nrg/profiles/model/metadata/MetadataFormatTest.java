package org.nrg.profiles.model.metadata;

import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TestRule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.nrg.profiles.exceptions.IncompleteMetadataException;
import org.nrg.profiles.exceptions.InvalidValueException;
import org.nrg.profiles.exceptions.MetadataException;
import org.nrg.profiles.exceptions.SchemaViolationException;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

@Slf4j
public class MetadataFormatTest {
    @Rule
    public TestRule watcher = new TestWatcher() {
        protected void starting(Description description) {
            log.info("BEGINNING TEST " + description.getMethodName());
        }

        protected void finished(Description description) {
            log.info("ENDING TEST " + description.getMethodName());
        }
    };

    @Rule public ExpectedException expectedException = ExpectedException.none();

    private static final MetadataFormat REPORT_FORMAT = MetadataFormat.builder("ReportFormat")
            .mimetype("text/plain")
            .attributes(ImmutableMap.of(
                    "author", AttributeRule.required(),
                    "language", AttributeRule.oneOf("en", "nl"),
                    "encoding", AttributeRule.optional(),
                    "version", AttributeRule.fixed("1.0")))
            .build();

    @Test
    public void testMissingRequiredAttribute() throws Exception {
        try {
            REPORT_FORMAT.create(ImmutableMap.of("language", "en"));
            fail("A record without a required attribute should not be created.");
        } catch (IncompleteMetadataException e) {
            assertThat(e.getKey(), is("author"));
        }
    }

    @Test
    public void testMissingEnumeratedAttribute() throws Exception {
        expectedException.expect(IncompleteMetadataException.class);
        REPORT_FORMAT.create(ImmutableMap.of("author", "proycon"));
    }

    @Test
    public void testEnumeratedValueOutOfRange() throws Exception {
        try {
            REPORT_FORMAT.create(ImmutableMap.of("author", "proycon", "language", "fr"));
            fail("A value outside the enumeration should be rejected.");
        } catch (InvalidValueException e) {
            assertThat(e.getKey(), is("language"));
        }
    }

    @Test
    public void testOptionalEnumeratedMayBeAbsent() throws Exception {
        final MetadataRecord record = MetadataFormats.CSV.create(Collections.emptyMap());
        assertThat(record.contains("delimiter"), is(false));

        expectedException.expect(InvalidValueException.class);
        MetadataFormats.CSV.create(ImmutableMap.of("delimiter", ":"));
    }

    @Test
    public void testEnumeratedNumericValues() throws Exception {
        final MetadataFormat format = MetadataFormat.builder("Numbered")
                .attributes(ImmutableMap.of("channels", AttributeRule.oneOf(1, 2)))
                .build();
        final MetadataRecord record = format.create(ImmutableMap.of("channels", "2"));
        assertThat(record.get("channels"), is((Object) "2"));
    }

    @Test
    public void testFixedAttributeAlwaysPresent() throws Exception {
        final MetadataRecord record = REPORT_FORMAT.create(ImmutableMap.of("author", "proycon", "language", "en"));
        assertThat(record.get("version"), is((Object) "1.0"));

        final MetadataRecord overridden = REPORT_FORMAT.create(
                ImmutableMap.of("author", "proycon", "language", "en", "version", "2.0"));
        assertThat(overridden.get("version"), is((Object) "1.0"));

        overridden.put("version", "3.0");
        assertThat(overridden.get("version"), is((Object) "1.0"));
    }

    @Test
    public void testUndeclaredAttribute() throws Exception {
        try {
            REPORT_FORMAT.create(ImmutableMap.of("author", "proycon", "language", "en", "colour", "blue"));
            fail("An undeclared attribute should be rejected.");
        } catch (SchemaViolationException e) {
            assertThat(e.getKey(), is("colour"));
        }

        final MetadataFormat permissive = REPORT_FORMAT.toBuilder().allowCustomAttributes(true).build();
        final MetadataRecord record = permissive.create(
                ImmutableMap.of("author", "proycon", "language", "en", "colour", "blue"));
        assertThat(record.getAttributes(), hasEntry("colour", (Object) "blue"));
    }

    @Test
    public void testFormatWithoutSchemaAcceptsAnything() throws Exception {
        final MetadataRecord record = MetadataFormats.UNDEFINED.create(
                ImmutableMap.of("anything", 42, "goes", true));
        assertThat(record.keys(), contains("anything", "goes"));
        assertThat(record.getMimetype(), is(nullValue()));
    }

    @Test
    public void testCompositeValuesRejected() throws Exception {
        expectedException.expect(IllegalArgumentException.class);
        MetadataFormats.UNDEFINED.create(ImmutableMap.of("authors", Arrays.asList("a", "b")));
    }

    @Test
    public void testPutRevalidates() throws Exception {
        final MetadataRecord record = REPORT_FORMAT.create(ImmutableMap.of("author", "proycon", "language", "en"));
        record.put("language", "nl");
        assertThat(record.get("language"), is((Object) "nl"));

        try {
            record.put("language", "de");
            fail("Writes must be validated too.");
        } catch (InvalidValueException e) {
            assertThat(record.get("language"), is((Object) "nl"));
        }
    }

    @Test
    public void testRemove() throws Exception {
        final MetadataRecord record = REPORT_FORMAT.create(
                ImmutableMap.of("author", "proycon", "language", "en", "encoding", "utf-8"));
        record.remove("encoding");
        assertThat(record.contains("encoding"), is(false));

        expectedException.expect(IncompleteMetadataException.class);
        record.remove("author");
    }

    @Test
    public void testRecordsWithSameContentAreEqual() throws MetadataException {
        final MetadataRecord first = MetadataFormats.PLAIN_TEXT.create(ImmutableMap.of("encoding", "utf-8"));
        final MetadataRecord second = MetadataFormats.PLAIN_TEXT.create(ImmutableMap.of("encoding", "utf-8"));
        final MetadataRecord other = MetadataFormats.PLAIN_TEXT.create(ImmutableMap.of("encoding", "latin-1"));
        assertThat(first, equalTo(second));
        assertThat(first, not(equalTo(other)));
    }
}
