package com.kekopoly.shared.message;

import java.util.Collections;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kekopoly.shared.dto.Envelope;
import com.kekopoly.shared.dto.PlayerInfoDTO;
import com.kekopoly.shared.util.ActionType;

/**
 * JSON codec for the socket protocol. Outbound frames are always
 * {@code {"type": ..., "payload": {...}}}; inbound frames may carry their
 * fields either inside {@code payload} or flat next to {@code type}.
 */
public class MessageCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this(new ObjectMapper());
    }

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public String encode(String type, Object payload) throws JsonProcessingException {
        return objectMapper.writeValueAsString(new Envelope<>(type, payload));
    }

    public InboundMessage decode(String frame) throws MalformedMessageException {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("Frame must be a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new MalformedMessageException("Frame has no type");
        }
        String type = typeNode.asText();
        JsonNode payload = root.get("payload");
        JsonNode body = (payload != null && payload.isObject()) ? payload : root;

        try {
            switch (type) {
                case "verify_host":
                    return new InboundMessage.VerifyHost(text(body, "playerId"));
                case "game:start":
                    return new InboundMessage.StartGame();
                case "player_joined": {
                    JsonNode player = body.has("player") ? body.get("player") : body;
                    return new InboundMessage.PlayerJoined(readPlayerInfo(player));
                }
                case "get_active_players":
                    return new InboundMessage.GetActivePlayers();
                case "roll_dice":
                    return new InboundMessage.RollDice(text(body, "requestId"));
                case "game_action":
                    return decodeGameAction(body);
                case "update_player_info":
                case "update_player":
                case "set_player_token":
                    return new InboundMessage.UpdatePlayerInfo(type, readPlayerInfo(body));
                case "player_ready": {
                    boolean ready = body.has("isReady") ? body.get("isReady").asBoolean() : body.path("ready").asBoolean(true);
                    return new InboundMessage.PlayerReady(ready, text(body, "messageId"));
                }
                case "get_game_state":
                    return new InboundMessage.GetGameState();
                case "set_host":
                    return new InboundMessage.SetHost(text(body, "hostId"));
                case "leave_game":
                    return new InboundMessage.LeaveGame();
                case "heartbeat_ack":
                    return new InboundMessage.HeartbeatAck(body.path("ts").asLong(0L));
                default:
                    return new InboundMessage.Unrecognized(type, frame);
            }
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Bad " + type + " payload: " + e.getMessage(), e);
        }
    }

    private InboundMessage decodeGameAction(JsonNode body) throws MalformedMessageException {
        String actionName = text(body, "action");
        if (actionName == null) {
            throw new MalformedMessageException("game_action requires an action");
        }
        ActionType action;
        try {
            action = ActionType.valueOf(actionName.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Unknown action " + actionName, e);
        }
        JsonNode data = body.get("data");
        Map<String, Object> values = (data != null && data.isObject())
            ? objectMapper.convertValue(data, MAP_TYPE)
            : Collections.emptyMap();
        return new InboundMessage.GameAction(action, text(body, "requestId"), values);
    }

    private PlayerInfoDTO readPlayerInfo(JsonNode node) {
        String token = text(node, "token");
        if (token == null) token = text(node, "characterToken");
        String id = text(node, "id");
        if (id == null) id = text(node, "playerId");
        return new PlayerInfoDTO(id, text(node, "name"), token, text(node, "emoji"), text(node, "color"),
            node.path("isReady").asBoolean(false), false);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        return value.asText();
    }
}
