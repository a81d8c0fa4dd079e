package com.kekopoly.shared.util;

/**
 * Outbound event names with the delivery tier each one gets by default.
 * Turn and game-state events go out on HIGH, presence and status on NORMAL.
 */
public enum EventType {
    ACTIVE_PLAYERS("active_players", Priority.NORMAL),
    HOST_CHANGED("host_changed", Priority.NORMAL),
    HOST_VERIFICATION("host_verification", Priority.NORMAL),
    HOST_SET_CONFIRMED("host_set_confirmed", Priority.NORMAL),
    GAME_STARTED("game_started", Priority.HIGH),
    GAME_TURN("game_turn", Priority.HIGH),
    TURN_CHANGED("turn_changed", Priority.HIGH),
    JAIL_EVENT("jail_event", Priority.HIGH),
    DICE_ROLLED("dice_rolled", Priority.HIGH),
    ACTION_RESULT("action_result", Priority.HIGH),
    GAME_ENDED("game_ended", Priority.HIGH),
    COMPLETE_STATE_SYNC("complete_state_sync", Priority.HIGH),
    GAME_STATE_UPDATE("game_state_update", Priority.NORMAL),
    PLAYER_UPDATED("player_updated", Priority.NORMAL),
    PLAYER_JOINED("player_joined", Priority.NORMAL),
    PLAYER_JOINED_ACK("player_joined_ack", Priority.NORMAL),
    PLAYER_READY("player_ready", Priority.HIGH),
    RECONNECTION_SUCCESSFUL("reconnection_successful", Priority.HIGH),
    PLAYER_RECONNECTED("player_reconnected", Priority.NORMAL),
    PLAYER_DISCONNECTED("player_disconnected", Priority.NORMAL),
    PLAYER_FORFEITED("player_forfeited", Priority.NORMAL),
    PLAYER_BANKRUPT("player_bankrupt", Priority.NORMAL),
    GAME_DELETED("game_deleted", Priority.HIGH),
    LOBBY_UPDATE("lobby_update", Priority.NORMAL),
    ERROR("error", Priority.HIGH);

    private final String wireName;
    private final Priority priority;

    EventType(String wireName, Priority priority) {
        this.wireName = wireName;
        this.priority = priority;
    }

    public String wireName() {
        return wireName;
    }

    public Priority priority() {
        return priority;
    }
}
