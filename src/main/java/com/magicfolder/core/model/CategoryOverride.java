package com.magicfolder.core.model;

/**
 * Verdict returned by the batch classifier for one path.
 */
public record CategoryOverride(
    String path,
    Category category,
    double confidence,
    String reason
) {}
