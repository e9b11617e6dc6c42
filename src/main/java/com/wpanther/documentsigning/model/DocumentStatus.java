package com.wpanther.documentsigning.model;

/**
 * Lifecycle of a signable document.
 * Transitions only move forward: DRAFT -> SIGNING -> SIGNED, and any
 * state except SIGNED may move to CANCELLED.
 */
public enum DocumentStatus {
    DRAFT,
    SIGNING,
    SIGNED,
    CANCELLED;

    /**
     * Business fields of a locked document must not be edited.
     */
    public boolean isLocked() {
        return this == SIGNING || this == SIGNED;
    }

    public boolean isTerminal() {
        return this == SIGNED || this == CANCELLED;
    }

    public boolean canTransitionTo(DocumentStatus target) {
        switch (this) {
            case DRAFT:
                return target == SIGNING || target == CANCELLED;
            case SIGNING:
                return target == SIGNED || target == CANCELLED;
            default:
                return false;
        }
    }
}
