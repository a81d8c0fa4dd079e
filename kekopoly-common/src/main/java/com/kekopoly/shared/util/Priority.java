package com.kekopoly.shared.util;

public enum Priority {
    HIGH,
    NORMAL,
    LOW;

    /** Next tier up, or null for HIGH. */
    public Priority escalate() {
        switch (this) {
            case LOW: return NORMAL;
            case NORMAL: return HIGH;
            default: return null;
        }
    }
}
