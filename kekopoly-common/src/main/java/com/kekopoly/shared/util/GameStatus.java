package com.kekopoly.shared.util;

public enum GameStatus {
    LOBBY,
    ACTIVE,
    PAUSED,
    COMPLETED,
    ABANDONED
}
