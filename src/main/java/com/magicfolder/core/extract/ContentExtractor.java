package com.magicfolder.core.extract;

import com.magicfolder.core.model.ExtensionClass;
import com.magicfolder.core.model.FileContent;
import com.magicfolder.core.model.FileExtensions;
import com.magicfolder.core.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a path into best-effort text for the keyword rules and the batch
 * classifier.
 * <p>
 * Plain-text extensions are read as UTF-8 with undecodable bytes dropped.
 * Image and PDF extensions go to the {@link OcrEngine} when it is available.
 * Everything else, and any path that does not exist, yields empty text.
 * {@link #extract} never throws: failures are logged and reported through
 * {@link FileContent#extractionError()}.
 */
@Service
public class ContentExtractor {

    private static final Logger log = LoggerFactory.getLogger(ContentExtractor.class);

    private final OcrEngine ocrEngine;
    private final RuleSet ruleSet;
    private final Set<String> textExtensions;
    private final Set<String> ocrExtensions;
    private final int maxTextChars;

    public ContentExtractor(OcrEngine ocrEngine, RuleSet ruleSet, ExtractProperties properties) {
        this.ocrEngine = ocrEngine;
        this.ruleSet = ruleSet;
        this.textExtensions = normalize(properties.getTextExtensions());
        this.ocrExtensions = normalize(properties.getOcrExtensions());
        this.maxTextChars = properties.getMaxTextChars();
    }

    public ExtensionClass extensionClass(String path) {
        String extension = FileExtensions.of(path);
        if (ruleSet.hardRuleFor(extension).isPresent()) {
            return ExtensionClass.AUDIO_VIDEO_ARCHIVE;
        }
        if (textExtensions.contains(extension)) {
            return ExtensionClass.TEXT;
        }
        if (ocrExtensions.contains(extension)) {
            return ExtensionClass.OCR_CANDIDATE;
        }
        return ExtensionClass.OTHER;
    }

    public FileContent extract(String path) {
        ExtensionClass extensionClass = extensionClass(path);
        if (extensionClass == ExtensionClass.AUDIO_VIDEO_ARCHIVE || extensionClass == ExtensionClass.OTHER) {
            return FileContent.empty(path);
        }

        Path file;
        try {
            file = Path.of(path);
        } catch (InvalidPathException e) {
            log.warn("Invalid path {}: {}", path, e.getMessage());
            return FileContent.failed(path, "invalid path: " + e.getMessage());
        }
        if (!Files.isRegularFile(file)) {
            log.debug("Skipping extraction, not a regular file: {}", path);
            return FileContent.empty(path);
        }

        try {
            String text = extensionClass == ExtensionClass.TEXT ? readText(file) : runOcr(file);
            return new FileContent(path, truncate(text), null);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (IOException | RuntimeException | Error e) {
            // native OCR failures arrive as Error (JNA "Invalid memory access", UnsatisfiedLinkError)
            log.warn("Extraction failed for {}: {}", file.getFileName(), e.getMessage());
            return FileContent.failed(path, "extraction failed: " + e.getMessage());
        }
    }

    private String readText(Path file) throws IOException {
        byte[] bytes;
        try (var in = Files.newInputStream(file)) {
            // a UTF-8 char is at most 4 bytes
            bytes = in.readNBytes(Math.multiplyExact(maxTextChars, 4));
        }
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // IGNORE actions make this unreachable for UTF-8
            throw new IOException("Could not decode " + file.getFileName(), e);
        }
    }

    private String runOcr(Path file) throws IOException {
        if (!ocrEngine.available()) {
            log.debug("OCR unavailable, skipping {}", file.getFileName());
            return "";
        }
        long start = System.currentTimeMillis();
        String text = ocrEngine.extract(file);
        log.info("OCR extracted {} chars from {} ({}ms)",
                text == null ? 0 : text.length(), file.getFileName(), System.currentTimeMillis() - start);
        return text;
    }

    private String truncate(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() > maxTextChars) {
            return text.substring(0, maxTextChars);
        }
        return text;
    }

    private static Set<String> normalize(List<String> extensions) {
        return extensions.stream().map(FileExtensions::normalize).collect(Collectors.toUnmodifiableSet());
    }
}
