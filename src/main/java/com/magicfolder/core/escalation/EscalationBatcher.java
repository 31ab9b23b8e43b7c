package com.magicfolder.core.escalation;

import com.magicfolder.core.metrics.ClassifierMetrics;
import com.magicfolder.core.model.Category;
import com.magicfolder.core.model.CategoryOverride;
import com.magicfolder.core.model.ClassifiedFile;
import com.magicfolder.core.model.EscalationItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sends every file still at Misc (and carrying text) to the {@link BatchClassifier}
 * in one call, and maps the verdicts back by path.
 * <p>
 * At most one collaborator call per request. An unavailable or failing
 * collaborator yields no overrides. Verdicts for paths that were not escalated
 * are dropped, so entries already resolved by the heuristics are never touched.
 */
@Service
public class EscalationBatcher {

    private static final Logger log = LoggerFactory.getLogger(EscalationBatcher.class);

    private final BatchClassifier batchClassifier;
    private final ClassifierMetrics metrics;

    public EscalationBatcher(BatchClassifier batchClassifier,
                             @Autowired(required = false) ClassifierMetrics metrics) {
        this.batchClassifier = batchClassifier;
        this.metrics = metrics;
    }

    public Map<String, CategoryOverride> escalate(List<ClassifiedFile> classified) {
        List<EscalationItem> candidates = classified.stream()
                .filter(ClassifiedFile::isEscalationCandidate)
                .map(ClassifiedFile::toEscalationItem)
                .toList();
        if (candidates.isEmpty()) {
            return Map.of();
        }
        if (!batchClassifier.available()) {
            log.info("Batch classifier unavailable, {} file(s) stay Misc", candidates.size());
            record("unavailable", 0);
            return Map.of();
        }

        log.info("Escalating {} uncertain file(s)", candidates.size());
        long start = System.currentTimeMillis();
        List<CategoryOverride> verdicts;
        try {
            verdicts = batchClassifier.classify(candidates);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.warn("Batch classification failed, keeping Misc: {}", e.getMessage());
            record("failed", System.currentTimeMillis() - start);
            return Map.of();
        }
        record("success", System.currentTimeMillis() - start);

        Set<String> escalated = new HashSet<>();
        candidates.forEach(item -> escalated.add(item.path()));

        var overrides = new LinkedHashMap<String, CategoryOverride>();
        for (CategoryOverride verdict : verdicts) {
            if (!escalated.contains(verdict.path())) {
                log.debug("Ignoring verdict for unrequested path {}", verdict.path());
                continue;
            }
            if (verdict.category() == Category.MISC) {
                continue;
            }
            overrides.putIfAbsent(verdict.path(), verdict);
        }
        log.info("Escalation resolved {} of {} file(s)", overrides.size(), candidates.size());
        return overrides;
    }

    private void record(String outcome, long ms) {
        if (metrics != null) {
            metrics.recordEscalationCall(outcome, ms);
        }
    }
}
