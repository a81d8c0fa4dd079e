package com.kekopoly.shared.message;

import java.util.Map;

import com.kekopoly.shared.dto.PlayerInfoDTO;
import com.kekopoly.shared.util.ActionType;

/**
 * Every frame a client may send, decoded from its {@code type} field.
 * Anything the server does not know about arrives as {@link Unrecognized}
 * and keeps the raw frame so it can be relayed untouched.
 */
public interface InboundMessage {

    String type();

    record VerifyHost(String playerId) implements InboundMessage {
        public String type() { return "verify_host"; }
    }

    record StartGame() implements InboundMessage {
        public String type() { return "game:start"; }
    }

    record PlayerJoined(PlayerInfoDTO player) implements InboundMessage {
        public String type() { return "player_joined"; }
    }

    record GetActivePlayers() implements InboundMessage {
        public String type() { return "get_active_players"; }
    }

    record RollDice(String requestId) implements InboundMessage {
        public String type() { return "roll_dice"; }
    }

    record GameAction(ActionType action, String requestId, Map<String, Object> data) implements InboundMessage {
        public String type() { return "game_action"; }
    }

    /** Covers update_player_info, update_player and set_player_token. */
    record UpdatePlayerInfo(String type, PlayerInfoDTO info) implements InboundMessage {}

    record PlayerReady(boolean ready, String messageId) implements InboundMessage {
        public String type() { return "player_ready"; }
    }

    record GetGameState() implements InboundMessage {
        public String type() { return "get_game_state"; }
    }

    record SetHost(String hostId) implements InboundMessage {
        public String type() { return "set_host"; }
    }

    record LeaveGame() implements InboundMessage {
        public String type() { return "leave_game"; }
    }

    record HeartbeatAck(long ts) implements InboundMessage {
        public String type() { return "heartbeat_ack"; }
    }

    record Unrecognized(String type, String rawFrame) implements InboundMessage {}
}
