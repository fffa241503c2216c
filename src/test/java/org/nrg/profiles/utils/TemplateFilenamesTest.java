package org.nrg.profiles.utils;

import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class TemplateFilenamesTest {
    @Test
    public void testSequenceNumber() {
        assertThat(TemplateFilenames.hasPlaceholder("out#.txt"), is(true));
        assertThat(TemplateFilenames.hasPlaceholder(null), is(false));
        assertThat(TemplateFilenames.substituteSequenceNumber("out#.txt", 12), is("out12.txt"));
    }

    @Test
    public void testIds() {
        assertThat(TemplateFilenames.isValidId("textinput"), is(true));
        assertThat(TemplateFilenames.isValidId(" "), is(false));
        assertThat(TemplateFilenames.isValidId("text/input"), is(false));
        assertThat(TemplateFilenames.isValidId("text\\input"), is(false));
    }

    @Test
    public void testExtensions() {
        assertThat(TemplateFilenames.appendExtension("doc", ".txt"), is("doc.txt"));
        assertThat(TemplateFilenames.appendExtension("doc.txt", "txt"), is("doc.txt"));
        assertThat(TemplateFilenames.appendExtension("doc", null), is("doc"));

        assertThat(TemplateFilenames.removeLastExtension("doc.tar.gz"), is("doc.tar"));
        assertThat(TemplateFilenames.removeLastExtension(".hidden"), is(".hidden"));
        assertThat(TemplateFilenames.removeLastExtension("dir.d/doc"), is("dir.d/doc"));

        assertThat(TemplateFilenames.removeExtensions("doc.tar.gz", Arrays.asList("zip", "tar.gz")), is("doc"));
        assertThat(TemplateFilenames.removeExtensions(".txt", Arrays.asList("txt")), is(".txt"));
    }
}
