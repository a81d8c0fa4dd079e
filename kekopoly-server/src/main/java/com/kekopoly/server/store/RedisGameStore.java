package com.kekopoly.server.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kekopoly.server.error.PersistenceException;
import com.kekopoly.server.model.Game;
import com.kekopoly.shared.util.GameStatus;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Games as JSON documents in Redis, with a room-code index and one set per
 * status so startup can find the games it has to rehydrate.
 */
public class RedisGameStore implements GameStore {

    private static final Logger log = LoggerFactory.getLogger(RedisGameStore.class);

    private final JedisPool pool;
    private final ObjectMapper objectMapper;

    public RedisGameStore(JedisPool pool, ObjectMapper objectMapper) {
        this.pool = pool;
        this.objectMapper = objectMapper;
    }

    /* ---------- Keys ---------- */
    static String kGame(String gid) { return "game:" + gid; }
    static String kCode(String code) { return "game:code:" + code.toUpperCase(); }
    static String kStatus(GameStatus status) { return "games:status:" + status.name(); }

    @Override
    public void save(Game game) {
        String json = write(game);
        try (Jedis j = pool.getResource()) {
            Transaction t = j.multi();
            t.set(kGame(game.getId()), json);
            if (game.getCode() != null) {
                t.set(kCode(game.getCode()), game.getId());
            }
            for (GameStatus s : GameStatus.values()) {
                if (s != game.getStatus()) t.srem(kStatus(s), game.getId());
            }
            if (game.getStatus() != null) {
                t.sadd(kStatus(game.getStatus()), game.getId());
            }
            List<Object> res = t.exec();
            if (res == null) {
                throw new PersistenceException("Transaction aborted saving game " + game.getId());
            }
        } catch (JedisException e) {
            throw new PersistenceException("Redis write failed for game " + game.getId(), e);
        }
    }

    @Override
    public Optional<Game> findById(String gameId) {
        try (Jedis j = pool.getResource()) {
            return Optional.ofNullable(read(j.get(kGame(gameId))));
        } catch (JedisException e) {
            throw new PersistenceException("Redis read failed for game " + gameId, e);
        }
    }

    @Override
    public Optional<Game> findByCode(String code) {
        try (Jedis j = pool.getResource()) {
            String gid = j.get(kCode(code));
            if (gid == null) return Optional.empty();
            return Optional.ofNullable(read(j.get(kGame(gid))));
        } catch (JedisException e) {
            throw new PersistenceException("Redis read failed for code " + code, e);
        }
    }

    @Override
    public boolean codeExists(String code) {
        try (Jedis j = pool.getResource()) {
            return j.exists(kCode(code));
        } catch (JedisException e) {
            throw new PersistenceException("Redis read failed for code " + code, e);
        }
    }

    @Override
    public List<Game> findByStatus(Set<GameStatus> statuses) {
        List<Game> out = new ArrayList<>();
        try (Jedis j = pool.getResource()) {
            for (GameStatus s : statuses) {
                for (String gid : j.smembers(kStatus(s))) {
                    Game g = read(j.get(kGame(gid)));
                    if (g != null) {
                        out.add(g);
                    } else {
                        // Dangling index entry.
                        j.srem(kStatus(s), gid);
                    }
                }
            }
            return out;
        } catch (JedisException e) {
            throw new PersistenceException("Redis status query failed for " + statuses, e);
        }
    }

    @Override
    public void updateStatus(String gameId, GameStatus status) {
        Optional<Game> existing = findById(gameId);
        if (existing.isEmpty()) {
            log.warn("[REDIS] status update for unknown game {}", gameId);
            return;
        }
        Game g = existing.get();
        g.setStatus(status);
        g.setUpdatedAt(System.currentTimeMillis());
        save(g);
    }

    @Override
    public void delete(String gameId) {
        try (Jedis j = pool.getResource()) {
            Game g = read(j.get(kGame(gameId)));
            Transaction t = j.multi();
            t.del(kGame(gameId));
            if (g != null && g.getCode() != null) t.del(kCode(g.getCode()));
            for (GameStatus s : GameStatus.values()) t.srem(kStatus(s), gameId);
            t.exec();
        } catch (JedisException e) {
            throw new PersistenceException("Redis delete failed for game " + gameId, e);
        }
    }

    @Override
    public boolean ping() {
        try (Jedis j = pool.getResource()) {
            return "PONG".equalsIgnoreCase(j.ping());
        } catch (JedisException e) {
            log.warn("[REDIS] ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        pool.close();
    }

    private String write(Game game) {
        try {
            return objectMapper.writeValueAsString(game);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize game " + game.getId(), e);
        }
    }

    private Game read(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, Game.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Stored game document is unreadable", e);
        }
    }
}
