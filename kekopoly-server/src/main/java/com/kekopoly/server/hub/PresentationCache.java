package com.kekopoly.server.hub;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import com.kekopoly.shared.dto.GameInfoDTO;
import com.kekopoly.shared.dto.PlayerInfoDTO;

/**
 * Read-only snapshots the hub shows to clients: cosmetic player details
 * and the last known game summary. Nothing here is ever written back into
 * game state.
 */
public class PresentationCache {

    private final Map<String, Map<String, PlayerInfoDTO>> players = new ConcurrentHashMap<>();
    private final Map<String, GameInfoDTO> games = new ConcurrentHashMap<>();

    public PlayerInfoDTO player(String gameId, String playerId) {
        PlayerInfoDTO info = byGame(gameId).get(playerId);
        return info != null ? info : PlayerInfoDTO.placeholder(playerId);
    }

    public PlayerInfoDTO update(String gameId, String playerId, UnaryOperator<PlayerInfoDTO> change) {
        return byGame(gameId).compute(playerId,
            (id, current) -> change.apply(current != null ? current : PlayerInfoDTO.placeholder(id)));
    }

    public void ensure(String gameId, String playerId) {
        byGame(gameId).computeIfAbsent(playerId, PlayerInfoDTO::placeholder);
    }

    public void forget(String gameId, String playerId) {
        Map<String, PlayerInfoDTO> m = players.get(gameId);
        if (m != null) m.remove(playerId);
    }

    public GameInfoDTO gameInfo(String gameId) {
        return games.get(gameId);
    }

    public void putGameInfo(GameInfoDTO info) {
        games.put(info.gameId(), info);
    }

    public void evict(String gameId) {
        players.remove(gameId);
        games.remove(gameId);
    }

    /** Drops every game not in {@code live}. */
    public void retain(Set<String> live) {
        players.keySet().retainAll(live);
        games.keySet().retainAll(live);
    }

    public Collection<String> cachedGames() {
        return List.copyOf(games.keySet());
    }

    private Map<String, PlayerInfoDTO> byGame(String gameId) {
        return players.computeIfAbsent(gameId, k -> new ConcurrentHashMap<>());
    }
}
