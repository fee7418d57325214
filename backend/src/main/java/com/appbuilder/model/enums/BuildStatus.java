package com.appbuilder.model.enums;

import java.util.EnumSet;
import java.util.Set;

public enum BuildStatus {
    PENDING,
    PREPARING,
    GENERATING,
    BUILDING,
    SUCCESS,
    FAILED,
    CANCELLED;

    public static final Set<BuildStatus> TERMINAL = EnumSet.of(SUCCESS, FAILED, CANCELLED);
    public static final Set<BuildStatus> RUNNING = EnumSet.of(PREPARING, GENERATING, BUILDING);
    public static final Set<BuildStatus> ACTIVE = EnumSet.of(PENDING, PREPARING, GENERATING, BUILDING);
    public static final Set<BuildStatus> RETRYABLE = EnumSet.of(FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isRunning() {
        return RUNNING.contains(this);
    }
}
