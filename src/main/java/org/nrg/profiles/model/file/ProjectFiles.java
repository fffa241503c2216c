package org.nrg.profiles.model.file;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * The files of one project, by the input template each was registered for.
 * Implementations own the actual storage; the resolution code only reads.
 */
public interface ProjectFiles {
    /**
     * @param templateId An input template id
     * @return The files registered for that template, in any order. Never null.
     */
    @Nonnull
    List<InputFile> lookupFilesForTemplate(String templateId);
}
