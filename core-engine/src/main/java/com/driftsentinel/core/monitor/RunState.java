package com.driftsentinel.core.monitor;

/**
 * Lifecycle of a monitoring run.
 *
 * <pre>
 * INITIALIZING → DETECTING → PUBLISHING → COMPLETED
 *       |            |            |
 *       +------------+------------+→ FAILED
 * </pre>
 *
 * @since 1.0.0
 */
public enum RunState {
    INITIALIZING,
    DETECTING,
    PUBLISHING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
