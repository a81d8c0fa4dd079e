package com.kekopoly.server.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.kekopoly.shared.util.ActionType;

public record GameAction(ActionType type, String gameId, String playerId, String requestId, Map<String, Object> data) {

    public GameAction {
        data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static GameAction of(ActionType type, String gameId, String playerId) {
        return new GameAction(type, gameId, playerId, null, null);
    }
}
