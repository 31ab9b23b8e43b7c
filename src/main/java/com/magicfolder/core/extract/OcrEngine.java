package com.magicfolder.core.extract;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Optional OCR collaborator. Callers must check {@link #available()} first;
 * an unavailable engine is a normal degraded mode, not an error.
 */
public interface OcrEngine {

    boolean available();

    /**
     * Extracts text from an image or PDF. Multi-page inputs are capped to a
     * bounded prefix of pages.
     */
    String extract(Path file) throws IOException;
}
