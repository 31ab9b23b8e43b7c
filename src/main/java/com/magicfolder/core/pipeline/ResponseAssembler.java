package com.magicfolder.core.pipeline;

import com.magicfolder.core.model.Category;
import com.magicfolder.core.model.CategoryOverride;
import com.magicfolder.core.model.ClassificationResponse;
import com.magicfolder.core.model.ClassificationResult;
import com.magicfolder.core.model.ClassifiedFile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges heuristic categories, escalation overrides and error notes into the
 * reply. Exactly one result per requested path, in request order.
 * <p>
 * An override is applied only when the entry is still Misc and did not come
 * from an extension hard rule. A requested path with no classified entry
 * becomes Misc with an error note instead of going missing.
 */
@Component
public class ResponseAssembler {

    public ClassificationResponse assemble(List<String> requestedPaths,
                                           List<ClassifiedFile> classified,
                                           Map<String, CategoryOverride> overrides) {
        Map<String, ClassifiedFile> byPath = new LinkedHashMap<>();
        for (ClassifiedFile file : classified) {
            byPath.putIfAbsent(file.path(), file);
        }

        var results = new ArrayList<ClassificationResult>(requestedPaths.size());
        for (String path : requestedPaths) {
            ClassifiedFile file = byPath.get(path);
            if (file == null) {
                results.add(new ClassificationResult(path, Category.MISC, "not classified"));
                continue;
            }
            Category category = file.category();
            CategoryOverride override = overrides.get(path);
            if (override != null && !file.hardRule() && category == Category.MISC) {
                category = override.category();
            }
            results.add(new ClassificationResult(path, category, file.error()));
        }
        return ClassificationResponse.ofResults(results);
    }
}
