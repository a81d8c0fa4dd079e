package com.kekopoly.server.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.kekopoly.server.error.PersistenceException;
import com.kekopoly.server.model.Game;
import com.kekopoly.shared.util.GameStatus;

/**
 * Durable home of game documents. Every method may throw
 * {@link PersistenceException}; callers holding a session lock log it and
 * carry on with the in-memory state.
 */
public interface GameStore {

    /** Inserts or replaces the document with the game's id. */
    void save(Game game);

    Optional<Game> findById(String gameId);

    Optional<Game> findByCode(String code);

    boolean codeExists(String code);

    List<Game> findByStatus(Set<GameStatus> statuses);

    void updateStatus(String gameId, GameStatus status);

    void delete(String gameId);

    /** Cheap liveness probe used by the health endpoint. */
    boolean ping();

    default void close() {
    }
}
