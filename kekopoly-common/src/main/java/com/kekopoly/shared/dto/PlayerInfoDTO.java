package com.kekopoly.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Cosmetic player details shown in the lobby and player list.
 * Held by the hub as a presentation cache; never authoritative.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayerInfoDTO(String id, String name, String token, String emoji, String color,
                            boolean ready, boolean host) {

    public static PlayerInfoDTO placeholder(String playerId) {
        String suffix = playerId.length() > 4 ? playerId.substring(0, 4) : playerId;
        return new PlayerInfoDTO(playerId, "Player_" + suffix, null, null, null, false, false);
    }

    public PlayerInfoDTO withHost(boolean isHost) {
        return new PlayerInfoDTO(id, name, token, emoji, color, ready, isHost);
    }

    public PlayerInfoDTO withReady(boolean isReady) {
        return new PlayerInfoDTO(id, name, token, emoji, color, isReady, host);
    }

    /** Overlays the non-null fields of {@code update} onto this record. */
    public PlayerInfoDTO merge(PlayerInfoDTO update) {
        return new PlayerInfoDTO(
            id,
            update.name() != null ? update.name() : name,
            update.token() != null ? update.token() : token,
            update.emoji() != null ? update.emoji() : emoji,
            update.color() != null ? update.color() : color,
            ready,
            host
        );
    }
}
