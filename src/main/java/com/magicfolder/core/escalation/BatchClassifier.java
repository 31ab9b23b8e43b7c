package com.magicfolder.core.escalation;

import com.magicfolder.core.model.CategoryOverride;
import com.magicfolder.core.model.EscalationItem;

import java.util.List;

/**
 * Higher-cost second tier that looks at files the heuristics left at Misc.
 * <p>
 * Implementations receive the whole uncertain subset in one call. Callers
 * check {@link #available()} first; missing credentials or dependencies are a
 * normal degraded mode.
 */
public interface BatchClassifier {

    boolean available();

    List<CategoryOverride> classify(List<EscalationItem> items);
}
