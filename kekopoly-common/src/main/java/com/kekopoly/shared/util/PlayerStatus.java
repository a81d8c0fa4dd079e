package com.kekopoly.shared.util;

public enum PlayerStatus {
    CONNECTED,
    READY,
    ACTIVE,
    DISCONNECTED,
    BANKRUPT,
    FORFEITED;

    /** Still holds a seat in the turn order: playing, or disconnected inside the grace window. */
    public boolean inPlay() {
        return this == ACTIVE || this == DISCONNECTED;
    }
}
