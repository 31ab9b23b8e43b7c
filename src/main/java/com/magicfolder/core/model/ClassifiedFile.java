package com.magicfolder.core.model;

/**
 * Per-file state after the heuristic pass and before escalation.
 *
 * @param hardRule true when the category came from an extension hard rule;
 *                 such entries are final and never overridden
 * @param error    extraction or classification failure, if any
 */
public record ClassifiedFile(
    String path,
    String content,
    Category category,
    boolean hardRule,
    String error
) {
    public ClassifiedFile {
        content = content == null ? "" : content;
    }

    /** Still uncertain and carrying enough text for the batch classifier to look at. */
    public boolean isEscalationCandidate() {
        return !hardRule && category == Category.MISC && !content.isBlank();
    }

    public EscalationItem toEscalationItem() {
        return new EscalationItem(path, content);
    }
}
