package com.kekopoly.server.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.kekopoly.server.model.Game;
import com.kekopoly.shared.util.GameStatus;

/** Process-local store; used when Redis is disabled and in tests. */
public class InMemoryGameStore implements GameStore {

    private final Map<String, Game> games = new ConcurrentHashMap<>();

    @Override
    public void save(Game game) {
        games.put(game.getId(), game.copy());
    }

    @Override
    public Optional<Game> findById(String gameId) {
        Game g = games.get(gameId);
        return g == null ? Optional.empty() : Optional.of(g.copy());
    }

    @Override
    public Optional<Game> findByCode(String code) {
        for (Game g : games.values()) {
            if (g.getCode() != null && g.getCode().equalsIgnoreCase(code)) return Optional.of(g.copy());
        }
        return Optional.empty();
    }

    @Override
    public boolean codeExists(String code) {
        return findByCode(code).isPresent();
    }

    @Override
    public List<Game> findByStatus(Set<GameStatus> statuses) {
        List<Game> out = new ArrayList<>();
        for (Game g : games.values()) {
            if (statuses.contains(g.getStatus())) out.add(g.copy());
        }
        return out;
    }

    @Override
    public void updateStatus(String gameId, GameStatus status) {
        games.computeIfPresent(gameId, (id, g) -> {
            g.setStatus(status);
            return g;
        });
    }

    @Override
    public void delete(String gameId) {
        games.remove(gameId);
    }

    @Override
    public boolean ping() {
        return true;
    }
}
