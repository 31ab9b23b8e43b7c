package com.magicfolder.core.model;

/**
 * One uncertain file handed to the batch classifier.
 */
public record EscalationItem(String path, String content) {}
