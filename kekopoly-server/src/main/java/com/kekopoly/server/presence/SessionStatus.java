package com.kekopoly.server.presence;

public enum SessionStatus {
    CONNECTED,
    DISCONNECTED,
    RECONNECTING
}
