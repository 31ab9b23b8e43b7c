package com.magicfolder.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A batch of paths to classify. Both the batch ({@code files}) and the legacy
 * single-path ({@code path}) wire shapes normalize into this one type.
 * <p>
 * Duplicate paths collapse to their first occurrence, so each distinct path
 * yields exactly one result.
 */
public record ClassificationRequest(List<String> paths) {

    public ClassificationRequest {
        paths = List.copyOf(new LinkedHashSet<>(paths));
    }

    public static ClassificationRequest of(String... paths) {
        return new ClassificationRequest(new ArrayList<>(List.of(paths)));
    }

    public int size() {
        return paths.size();
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }
}
