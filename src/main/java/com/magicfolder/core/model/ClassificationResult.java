package com.magicfolder.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Final label for one requested path. {@code error} is omitted from the wire
 * form when nothing went wrong.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassificationResult(
    String path,
    Category category,
    String error
) {
    public static ClassificationResult of(String path, Category category) {
        return new ClassificationResult(path, category, null);
    }
}
