package org.nrg.profiles.model.profile;

import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestRule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.nrg.profiles.exceptions.ProfileConfigurationException;
import org.nrg.profiles.model.file.InMemoryProjectFiles;
import org.nrg.profiles.model.file.InputFile;
import org.nrg.profiles.model.metadata.MetadataFormats;
import org.nrg.profiles.model.template.ConditionOperator;
import org.nrg.profiles.model.template.CopyMetaField;
import org.nrg.profiles.model.template.InputTemplate;
import org.nrg.profiles.model.template.OutputTemplate;
import org.nrg.profiles.model.template.ParameterCondition;
import org.nrg.profiles.model.template.SetMetaField;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

@Slf4j
public class ProfileTest {
    @Rule
    public TestRule watcher = new TestWatcher() {
        protected void starting(Description description) {
            log.info("BEGINNING TEST " + description.getMethodName());
        }

        protected void finished(Description description) {
            log.info("ENDING TEST " + description.getMethodName());
        }
    };

    private static final InputTemplate TEXT_INPUT = InputTemplate.builder("textinput", MetadataFormats.PLAIN_TEXT, "Text input")
            .multi()
            .extension("txt")
            .build();
    private static final InputTemplate LEXICON = InputTemplate.builder("lexicon", MetadataFormats.PLAIN_TEXT, "Lexicon")
            .build();

    private static final OutputTemplate TOKENIZED = OutputTemplate.builder("tokenized", MetadataFormats.PLAIN_TEXT, "Tokenized text")
            .multi()
            .extension("tok")
            .addMetaField(SetMetaField.create("tokenizer", "ucto"))
            .addMetaField(CopyMetaField.create("language", "lexicon"))
            .build();
    private static final OutputTemplate STATISTICS = OutputTemplate.builder("statistics", MetadataFormats.CSV, "Statistics")
            .filename("statistics.csv")
            .build();
    private static final OutputTemplate SUMMARY = OutputTemplate.builder("summary", MetadataFormats.PLAIN_TEXT, "Summary")
            .build();

    private static final InMemoryProjectFiles PROJECT_FILES = InMemoryProjectFiles.of(
            InputFile.create("lexicon", 0, "lexicon.txt"),
            InputFile.create("textinput", 1, "one.txt"),
            InputFile.create("textinput", 2, "two.txt"));

    private static Profile tokenizerProfile() throws ProfileConfigurationException {
        return Profile.builder()
                .name("tokenizer")
                .addInputTemplate(TEXT_INPUT)
                .addInputTemplate(LEXICON)
                .addOutputTemplate(TOKENIZED)
                .addOutputTemplate(ParameterCondition.<OutputTemplate>builder()
                        .when("statistics", ConditionOperator.EQUALS, true)
                        .then(STATISTICS)
                        .build())
                .build();
    }

    private static List<String> filenames(final List<GeneratedOutput> outputs) {
        return outputs.stream().map(GeneratedOutput::filename).collect(Collectors.toList());
    }

    @Test
    public void testParentsAssignedOnBuild() throws Exception {
        final Profile profile = tokenizerProfile();

        final Map<String, OutputTemplate> byId = profile.outputTemplates().stream()
                .collect(Collectors.toMap(OutputTemplate::id, outputTemplate -> outputTemplate));
        assertThat(byId.get("tokenized").parent(), is("textinput"));
        assertThat(byId.get("statistics").parent(), is(nullValue()));

        final Profile uniqueOnly = Profile.builder()
                .addInputTemplate(TEXT_INPUT)
                .addInputTemplate(LEXICON)
                .addOutputTemplate(SUMMARY)
                .build();
        assertThat(uniqueOnly.outputTemplates().get(0).parent(), is("lexicon"));
    }

    @Test
    public void testOutputWithoutPossibleParent() {
        try {
            Profile.builder()
                    .name("broken")
                    .addInputTemplate(TEXT_INPUT)
                    .addOutputTemplate(SUMMARY)
                    .build();
            fail("A unique output without filename needs a unique input to derive from.");
        } catch (ProfileConfigurationException e) {
            assertThat(e.getErrors(), hasSize(1));
            assertThat(e.getErrors().get(0), containsString("summary"));
        }
    }

    @Test
    public void testOutputsInsideConditionsAreChecked() {
        try {
            Profile.builder()
                    .addInputTemplate(TEXT_INPUT)
                    .addOutputTemplate(ParameterCondition.<OutputTemplate>builder()
                            .when("x", ConditionOperator.EQUALS, 1)
                            .then(TOKENIZED)
                            .otherwise(TOKENIZED.toBuilder().id("other").parent("nonexistent").build())
                            .build())
                    .build();
            fail("An unknown parent should be reported even in the otherwise branch.");
        } catch (ProfileConfigurationException e) {
            assertThat(e.getErrors(), hasItem(containsString("nonexistent")));
        }
    }

    @Test
    public void testDuplicateInputTemplateIds() {
        try {
            Profile.builder()
                    .addInputTemplate(TEXT_INPUT)
                    .addInputTemplate(TEXT_INPUT)
                    .addOutputTemplate(TOKENIZED)
                    .build();
            fail("Input template ids must be unique within a profile.");
        } catch (ProfileConfigurationException e) {
            assertThat(e.getErrors(), hasItem(containsString("not unique")));
        }
    }

    @Test
    public void testMatch() throws Exception {
        final Profile profile = tokenizerProfile();

        assertThat(profile.match(PROJECT_FILES, ImmutableMap.of("statistics", true)), is(true));
        assertThat(profile.match(PROJECT_FILES, Collections.emptyMap()), is(false));
        assertThat(profile.match(InMemoryProjectFiles.of(InputFile.create("textinput", 1, "one.txt")),
                ImmutableMap.of("statistics", true)), is(false));
    }

    @Test
    public void testProfileWithoutOutputsNeverMatches() throws Exception {
        final Profile profile = Profile.builder().addInputTemplate(TEXT_INPUT).build();
        assertThat(profile.match(PROJECT_FILES, Collections.emptyMap()), is(false));
    }

    @Test
    public void testGenerate() throws Exception {
        final Profile profile = tokenizerProfile();

        final List<GeneratedOutput> outputs = profile.generate(PROJECT_FILES, ImmutableMap.of("statistics", true));
        assertThat(filenames(outputs), contains("one.txt.tok", "two.txt.tok", "statistics.csv"));
        assertThat(outputs.get(0).metadata().getAttributes(), hasEntry("tokenizer", (Object) "ucto"));
        assertThat(outputs.get(2).metadata().getFormatName(), is("CSVFormat"));
    }

    @Test
    public void testGenerateWithoutMatchIsEmpty() throws Exception {
        assertThat(tokenizerProfile().generate(PROJECT_FILES, Collections.emptyMap()), is(empty()));
    }

    @Test
    public void testGenerateIsIdempotent() throws Exception {
        final Profile profile = tokenizerProfile();
        final Map<String, Object> parameters = ImmutableMap.of("statistics", true);

        assertThat(profile.generate(PROJECT_FILES, parameters), equalTo(profile.generate(PROJECT_FILES, parameters)));
    }

    @Test
    public void testOnlyResultWithoutInputs() throws Exception {
        final Profile profile = Profile.builder()
                .addOutputTemplate(OutputTemplate.builder("result", MetadataFormats.PLAIN_TEXT, "Result")
                        .filename("result.txt")
                        .build())
                .build();

        final List<GeneratedOutput> outputs = profile.generate(InMemoryProjectFiles.of(), Collections.emptyMap());
        assertThat(filenames(outputs), contains("result.txt"));
        assertThat(profile.displayName(), is("(unnamed profile)"));
    }

    @Test
    public void testLookups() throws Exception {
        final Profile profile = tokenizerProfile();

        assertThat(profile.inputTemplate("lexicon"), is(LEXICON));
        assertThat(profile.inputTemplate("unknown"), is(nullValue()));
        assertThat(profile.matchingFiles(PROJECT_FILES).stream().map(InputFile::filename).collect(Collectors.toList()),
                contains("one.txt", "two.txt", "lexicon.txt"));
    }
}
