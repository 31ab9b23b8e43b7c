package com.magicfolder.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Optional;

/**
 * Reply envelope. Exactly one of {@code results} or {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassificationResponse(
    List<ClassificationResult> results,
    String error
) {
    public static ClassificationResponse ofResults(List<ClassificationResult> results) {
        return new ClassificationResponse(List.copyOf(results), null);
    }

    public static ClassificationResponse ofError(String message) {
        return new ClassificationResponse(null, message);
    }

    public boolean hasError() {
        return error != null;
    }

    public Optional<ClassificationResult> resultFor(String path) {
        if (results == null) {
            return Optional.empty();
        }
        return results.stream().filter(r -> r.path().equals(path)).findFirst();
    }
}
