package com.magicfolder.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of categories a file can be sorted into.
 * <p>
 * {@link #MISC} doubles as the "uncertain" sentinel: a file still at {@code MISC}
 * after the heuristic pass is a candidate for escalation.
 */
public enum Category {
    DOCUMENTS("Documents"),
    IMAGES("Images"),
    AUDIO("Audio"),
    VIDEO("Video"),
    ARCHIVES("Archives"),
    FINANCIALS("Financials"),
    CODE("Code"),
    SCREENSHOTS("Screenshots"),
    INVOICES("Invoices"),
    TRAIN_TICKETS("TrainTickets"),
    ID_PROOFS("IDProofs"),
    MARKSHEETS("Marksheets"),
    CREDENTIALS("Credentials"),
    NOTES("Notes"),
    RESUME("Resume"),
    MISC("Misc");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    /** Wire name, also used as the destination folder name by the organizer. */
    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a label case-insensitively. Accepts both the wire label
     * ({@code "TrainTickets"}) and the constant name ({@code "TRAIN_TICKETS"}).
     */
    public static Optional<Category> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.label.toLowerCase(Locale.ROOT).equals(normalized)
                    || category.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Category fromJson(String value) {
        return fromLabel(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown category: " + value));
    }

    @Override
    public String toString() {
        return label;
    }
}
