package com.magicfolder.core.model;

import java.util.Locale;

/**
 * Extension handling shared by the extractor and the rule engine.
 */
public final class FileExtensions {

    private FileExtensions() {} // utility class

    /**
     * Returns the lower-cased extension of the last path segment without the dot,
     * or an empty string when there is none. Dotfiles such as {@code .bashrc}
     * have no extension.
     */
    public static String of(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String name = path.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /** Strips a leading dot and lower-cases, so {@code ".MP3"} and {@code "mp3"} compare equal. */
    public static String normalize(String extension) {
        if (extension == null) {
            return "";
        }
        String trimmed = extension.trim();
        if (trimmed.startsWith(".")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
