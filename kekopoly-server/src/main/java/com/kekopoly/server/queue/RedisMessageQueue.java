package com.kekopoly.server.queue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kekopoly.server.model.Game;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisException;

public class RedisMessageQueue implements GameMessageQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisMessageQueue.class);

    private final JedisPool pool;
    private final ObjectMapper objectMapper;

    public RedisMessageQueue(JedisPool pool, ObjectMapper objectMapper) {
        this.pool = pool;
        this.objectMapper = objectMapper;
    }

    static String kQueue(String gid) { return "game:" + gid + ":queue"; }

    @Override
    public void enqueuePlayerTokenUpdate(String gameId, String playerId, String token) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("token", token);
        push(new QueueMessage(QueueMessage.PLAYER_TOKEN_UPDATE, gameId, playerId, data, System.currentTimeMillis(), 0));
    }

    @Override
    public void enqueueGameStateUpdate(Game game) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", game.getStatus());
        data.put("currentTurn", game.getCurrentTurn());
        data.put("turnOrder", game.getTurnOrder());
        data.put("hostId", game.getHostId());
        push(new QueueMessage(QueueMessage.GAME_STATE_UPDATE, game.getId(), null, data, System.currentTimeMillis(), 0));
    }

    @Override
    public void enqueueGameStart(Game game) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("turnOrder", game.getTurnOrder());
        data.put("currentTurn", game.getCurrentTurn());
        push(new QueueMessage(QueueMessage.GAME_START, game.getId(), game.getHostId(), data, System.currentTimeMillis(), 0));
    }

    private void push(QueueMessage message) {
        try (Jedis j = pool.getResource()) {
            j.rpush(kQueue(message.gameId()), objectMapper.writeValueAsString(message));
        } catch (JedisException | JsonProcessingException e) {
            log.warn("[QUEUE] failed to enqueue {} for game {}: {}", message.type(), message.gameId(), e.getMessage());
        }
    }
}
