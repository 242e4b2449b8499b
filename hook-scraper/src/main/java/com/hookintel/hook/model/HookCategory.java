package com.hookintel.hook.model;

/**
 * Closed hook taxonomy. Declaration order is the order used in dataset statistics.
 */
public enum HookCategory {
    QUESTION("Question"),
    STORY("Story"),
    LIST("List"),
    CHALLENGE("Challenge"),
    EMOTIONAL("Emotional"),
    EDUCATIONAL("Educational"),
    CONTROVERSIAL("Controversial"),
    STATEMENT("Statement");

    private final String label;

    HookCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
