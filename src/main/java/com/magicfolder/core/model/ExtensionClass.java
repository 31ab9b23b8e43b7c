package com.magicfolder.core.model;

/**
 * Coarse bucket derived from a file's lower-cased extension. Drives which
 * extraction path a file takes.
 */
public enum ExtensionClass {
    TEXT,
    OCR_CANDIDATE,
    AUDIO_VIDEO_ARCHIVE,
    OTHER
}
