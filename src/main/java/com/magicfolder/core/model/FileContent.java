package com.magicfolder.core.model;

/**
 * Best-effort text pulled out of a file. {@code content} is never null;
 * {@code extractionError} is set only when reading or OCR failed.
 */
public record FileContent(
    String path,
    String content,
    String extractionError
) {
    public FileContent {
        content = content == null ? "" : content;
    }

    public static FileContent empty(String path) {
        return new FileContent(path, "", null);
    }

    public static FileContent failed(String path, String error) {
        return new FileContent(path, "", error);
    }

    public boolean hasContent() {
        return !content.isBlank();
    }
}
