package com.vigil.monitoring.issue;

import java.util.Locale;
import java.util.Set;

/**
 * Issue lifecycle: open → acknowledged → in_progress → resolved | wont_fix. Open and acknowledged
 * issues may also be auto-closed by the system when their trigger disappears.
 */
public enum IssueStatus {
    OPEN,
    ACKNOWLEDGED,
    IN_PROGRESS,
    RESOLVED,
    WONT_FIX,
    AUTO_CLOSED;

    public boolean isTerminal() {
        return this == RESOLVED || this == WONT_FIX || this == AUTO_CLOSED;
    }

    public boolean canTransitionTo(IssueStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<IssueStatus> allowedTargets() {
        return switch (this) {
            case OPEN -> Set.of(ACKNOWLEDGED, IN_PROGRESS, RESOLVED, WONT_FIX, AUTO_CLOSED);
            case ACKNOWLEDGED -> Set.of(IN_PROGRESS, RESOLVED, WONT_FIX, AUTO_CLOSED);
            case IN_PROGRESS -> Set.of(RESOLVED, WONT_FIX);
            case RESOLVED, WONT_FIX, AUTO_CLOSED -> Set.of();
        };
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IssueStatus fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
