package com.magicfolder.core.pipeline;

import com.magicfolder.core.escalation.EscalationBatcher;
import com.magicfolder.core.extract.ContentExtractor;
import com.magicfolder.core.logging.MdcContext;
import com.magicfolder.core.metrics.ClassifierMetrics;
import com.magicfolder.core.model.Category;
import com.magicfolder.core.model.CategoryOverride;
import com.magicfolder.core.model.ClassificationRequest;
import com.magicfolder.core.model.ClassificationResponse;
import com.magicfolder.core.model.ClassifiedFile;
import com.magicfolder.core.model.ExtensionClass;
import com.magicfolder.core.model.FileContent;
import com.magicfolder.core.rules.HeuristicClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one request end to end: extraction, heuristics, a single escalation
 * call for the uncertain residue, then assembly.
 * <p>
 * Files are isolated from each other. A failure while handling one path turns
 * that path into Misc with an error note and the rest of the batch carries on.
 * Nothing is kept between calls.
 */
@Service
public class ClassificationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ClassificationPipeline.class);

    private final ContentExtractor extractor;
    private final HeuristicClassifier classifier;
    private final EscalationBatcher escalationBatcher;
    private final ResponseAssembler assembler;
    private final ClassifierMetrics metrics;

    public ClassificationPipeline(ContentExtractor extractor,
                                  HeuristicClassifier classifier,
                                  EscalationBatcher escalationBatcher,
                                  ResponseAssembler assembler,
                                  @Autowired(required = false) ClassifierMetrics metrics) {
        this.extractor = extractor;
        this.classifier = classifier;
        this.escalationBatcher = escalationBatcher;
        this.assembler = assembler;
        this.metrics = metrics;
    }

    public ClassificationResponse process(ClassificationRequest request) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRequest(requestId, request.size());
        long start = System.currentTimeMillis();
        try {
            log.info("Classifying {} file(s)", request.size());
            List<ClassifiedFile> classified = new ArrayList<>(request.size());
            for (String path : request.paths()) {
                classified.add(classifyOne(path));
            }

            Map<String, CategoryOverride> overrides = escalationBatcher.escalate(classified);
            ClassificationResponse response = assembler.assemble(request.paths(), classified, overrides);

            recordOutcomes(classified, overrides, start);
            return response;
        } finally {
            MdcContext.clear();
        }
    }

    ClassifiedFile classifyOne(String path) {
        String content = "";
        String error = null;
        try {
            if (extractor.extensionClass(path) != ExtensionClass.AUDIO_VIDEO_ARCHIVE) {
                FileContent extracted = extractor.extract(path);
                content = extracted.content();
                error = extracted.extractionError();
                if (error != null && metrics != null) {
                    metrics.recordFileError("extraction");
                }
            }
            HeuristicClassifier.Verdict verdict = classifier.evaluate(path, content);
            log.debug("{} -> {} ({})", path, verdict.category(), verdict.source());
            return new ClassifiedFile(path, content, verdict.category(), verdict.isHardRule(), error);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.warn("Classification failed for {}: {}", path, e.getMessage());
            if (metrics != null) {
                metrics.recordFileError("classification");
            }
            return new ClassifiedFile(path, content, Category.MISC, false, "classification failed: " + e.getMessage());
        }
    }

    private void recordOutcomes(List<ClassifiedFile> classified, Map<String, CategoryOverride> overrides, long start) {
        long elapsed = System.currentTimeMillis() - start;
        log.info("Classified {} file(s), {} escalated override(s) ({}ms)", classified.size(), overrides.size(), elapsed);
        if (metrics == null) {
            return;
        }
        for (ClassifiedFile file : classified) {
            CategoryOverride override = overrides.get(file.path());
            if (file.hardRule()) {
                metrics.recordClassification(file.category().label(), "hard_rule");
            } else if (file.category() != Category.MISC) {
                metrics.recordClassification(file.category().label(), "keyword");
            } else if (override != null) {
                metrics.recordClassification(override.category().label(), "escalation");
            } else {
                metrics.recordClassification(Category.MISC.label(), "default");
            }
        }
        metrics.recordRequest(classified.size(), elapsed);
    }
}
