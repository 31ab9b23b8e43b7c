package com.magicfolder.core.health;

import com.magicfolder.core.escalation.BatchClassifier;
import com.magicfolder.core.extract.OcrEngine;
import com.magicfolder.core.rules.RuleSet;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports which tiers of the pipeline are usable. OCR and the batch classifier
 * are optional, so their absence is DEGRADED rather than DOWN.
 */
@Service
public class HealthCheckService {

    private final RuleSet ruleSet;
    private final OcrEngine ocrEngine;
    private final BatchClassifier batchClassifier;

    public HealthCheckService(RuleSet ruleSet, OcrEngine ocrEngine, BatchClassifier batchClassifier) {
        this.ruleSet = ruleSet;
        this.ocrEngine = ocrEngine;
        this.batchClassifier = batchClassifier;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRules());
        results.add(checkOcr());
        results.add(checkBatchClassifier());
        return results;
    }

    private HealthStatus checkRules() {
        if (ruleSet.keywordRules().isEmpty()) {
            return new HealthStatus("rules", HealthStatus.Status.DEGRADED,
                    "No keyword rules loaded, only extension rules apply", Map.of());
        }
        return new HealthStatus("rules", HealthStatus.Status.UP,
                ruleSet.keywordRules().size() + " keyword rules loaded",
                Map.of("hardRuleExtensions", String.valueOf(ruleSet.hardRuleExtensions().size())));
    }

    private HealthStatus checkOcr() {
        if (ocrEngine.available()) {
            return new HealthStatus("ocr", HealthStatus.Status.UP, "OCR engine available", Map.of());
        }
        return new HealthStatus("ocr", HealthStatus.Status.DEGRADED,
                "OCR unavailable, images and PDFs yield no text", Map.of());
    }

    private HealthStatus checkBatchClassifier() {
        if (batchClassifier.available()) {
            return new HealthStatus("llm", HealthStatus.Status.UP, "Batch classifier available", Map.of());
        }
        return new HealthStatus("llm", HealthStatus.Status.DEGRADED,
                "Batch classifier unavailable (no API key?), uncertain files stay Misc", Map.of());
    }
}
