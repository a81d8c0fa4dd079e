package com.kekopoly.shared.util;

public enum ErrorCode {
    VALIDATION,
    NOT_FOUND,
    STATE_CONFLICT,
    PERMISSION,
    RESOURCE_EXHAUSTED,
    PERSISTENCE,
    CONNECTION;

    public String wireName() {
        return name().toLowerCase();
    }
}
