package com.kekopoly.server.registry;

import com.kekopoly.shared.util.EventType;

public record GameEvent(EventType type, Object payload) {}
