package org.nrg.profiles.model.file;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A fixed snapshot of a project's files, for callers that already hold the file list.
 */
public class InMemoryProjectFiles implements ProjectFiles {
    private final ListMultimap<String, InputFile> filesByTemplate;

    private InMemoryProjectFiles(final ListMultimap<String, InputFile> filesByTemplate) {
        this.filesByTemplate = filesByTemplate;
    }

    public static InMemoryProjectFiles of(final List<InputFile> files) {
        final ImmutableListMultimap.Builder<String, InputFile> builder = ImmutableListMultimap.builder();
        for (final InputFile file : files) {
            builder.put(file.templateId(), file);
        }
        return new InMemoryProjectFiles(builder.build());
    }

    public static InMemoryProjectFiles of(final InputFile... files) {
        return of(ImmutableList.copyOf(files));
    }

    @Override
    @Nonnull
    public List<InputFile> lookupFilesForTemplate(final String templateId) {
        return filesByTemplate.get(templateId);
    }
}
