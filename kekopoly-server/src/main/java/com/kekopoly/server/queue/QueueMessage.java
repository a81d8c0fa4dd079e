package com.kekopoly.server.queue;

import java.util.Map;

public record QueueMessage(String type, String gameId, String playerId, Map<String, Object> data, long timestamp, int attempts) {

    public static final String PLAYER_TOKEN_UPDATE = "player_token_update";
    public static final String GAME_STATE_UPDATE = "game_state_update";
    public static final String GAME_START = "game_start";
}
