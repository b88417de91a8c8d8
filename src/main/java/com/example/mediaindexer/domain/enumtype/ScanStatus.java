package com.example.mediaindexer.domain.enumtype;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum ScanStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ScanStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    private Set<ScanStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING, CANCELLED, FAILED);
            case RUNNING:
                return EnumSet.of(PAUSED, COMPLETED, FAILED, CANCELLED);
            case PAUSED:
                return EnumSet.of(RUNNING, CANCELLED);
            default:
                return Collections.emptySet();
        }
    }
}
