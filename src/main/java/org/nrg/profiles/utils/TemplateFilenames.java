package org.nrg.profiles.utils;

import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Filename handling shared by input and output templates.
 */
public class TemplateFilenames {
    /**
     * Replaced by the sequence number in the filenames of templates that accept multiple files.
     */
    public static final String SEQUENCE_PLACEHOLDER = "#";

    private TemplateFilenames() {}

    public static boolean hasPlaceholder(@Nullable final String filename) {
        return filename != null && filename.contains(SEQUENCE_PLACEHOLDER);
    }

    public static String substituteSequenceNumber(final String filename, final int sequenceNumber) {
        return filename.replace(SEQUENCE_PLACEHOLDER, String.valueOf(sequenceNumber));
    }

    public static boolean isValidId(@Nullable final String id) {
        return StringUtils.isNotBlank(id) && !StringUtils.containsAny(id, '/', '\\');
    }

    /**
     * @return The extension without a leading dot.
     */
    public static String normalizeExtension(final String extension) {
        return StringUtils.removeStart(extension, ".");
    }

    /**
     * Append the extension unless the filename already ends with it.
     */
    public static String appendExtension(final String filename, @Nullable final String extension) {
        if (StringUtils.isBlank(extension)) {
            return filename;
        }
        final String suffix = "." + normalizeExtension(extension);
        return filename.endsWith(suffix) ? filename : filename + suffix;
    }

    /**
     * Strip the last extension, if the filename has one. A leading dot does not start an extension.
     */
    public static String removeLastExtension(final String filename) {
        final int dot = filename.lastIndexOf('.');
        final int separator = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (dot <= separator + 1) {
            return filename;
        }
        return filename.substring(0, dot);
    }

    /**
     * Strip the first of the given extensions the filename ends with.
     */
    public static String removeExtensions(final String filename, final Collection<String> extensions) {
        for (final String extension : extensions) {
            final String suffix = "." + normalizeExtension(extension);
            if (filename.endsWith(suffix) && filename.length() > suffix.length()) {
                return filename.substring(0, filename.length() - suffix.length());
            }
        }
        return filename;
    }
}
