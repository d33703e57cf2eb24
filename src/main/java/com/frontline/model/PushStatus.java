package com.frontline.model;

/**
 * Lifecycle of a border push. Everything except ACTIVE is terminal.
 */
public enum PushStatus {
    ACTIVE,
    SUCCESSFUL,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
