package org.nrg.profiles.config;

import org.nrg.profiles.exceptions.ProfileConfigurationException;
import org.nrg.profiles.model.metadata.MetadataFormats;
import org.nrg.profiles.model.parameter.BooleanParameter;
import org.nrg.profiles.model.parameter.StringParameter;
import org.nrg.profiles.model.profile.Profile;
import org.nrg.profiles.model.template.ConditionOperator;
import org.nrg.profiles.model.template.CopyMetaField;
import org.nrg.profiles.model.template.InputTemplate;
import org.nrg.profiles.model.template.OutputTemplate;
import org.nrg.profiles.model.template.ParameterCondition;
import org.nrg.profiles.model.template.ParameterMetaField;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.annotation.Order;

@Configuration
@Import({ProfilesConfig.class})
public class ProfilerTestConfig {
    @Bean
    public InputTemplate textInput() {
        return InputTemplate.builder("textinput", MetadataFormats.PLAIN_TEXT, "Text input")
                .multi()
                .extension("txt")
                .addParameter(new StringParameter("author", "Author").withRequired(true))
                .addParameter(new BooleanParameter("lowercase", "Lowercase"))
                .build();
    }

    @Bean
    @Order(1)
    public Profile tokenizerProfile(final InputTemplate textInput) throws ProfileConfigurationException {
        return Profile.builder()
                .name("tokenizer")
                .addInputTemplate(textInput)
                .addOutputTemplate(OutputTemplate.builder("tokenized", MetadataFormats.PLAIN_TEXT, "Tokenized text")
                        .multi()
                        .extension("tok")
                        .addMetaField(CopyMetaField.create("author", "textinput"))
                        .addMetaField(ParameterMetaField.create("tokenizer", "tokenizer"))
                        .build())
                .build();
    }

    @Bean
    @Order(2)
    public Profile statisticsProfile(final InputTemplate textInput) throws ProfileConfigurationException {
        return Profile.builder()
                .name("statistics")
                .addInputTemplate(textInput)
                .addOutputTemplate(ParameterCondition.<OutputTemplate>builder()
                        .when("statistics", ConditionOperator.EQUALS, true)
                        .then(OutputTemplate.builder("frequencies", MetadataFormats.CSV, "Frequency list")
                                .filename("frequencies.csv")
                                .build())
                        .build())
                .build();
    }
}
