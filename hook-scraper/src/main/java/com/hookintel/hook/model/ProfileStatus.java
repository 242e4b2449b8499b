package com.hookintel.hook.model;

/**
 * Lifecycle of a tracked profile.
 *
 * PENDING → SCRAPING → COMPLETED | FAILED. FAILED goes back to PENDING through a reset.
 * COMPLETED and SKIPPED are terminal until an explicit reset.
 */
public enum ProfileStatus {
    PENDING,
    SCRAPING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED;
    }
}
