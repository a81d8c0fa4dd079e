package com.kekopoly.server.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kekopoly.shared.util.GameStatus;
import com.kekopoly.shared.util.MarketCondition;

/**
 * Stored game document. The registry mutates it only while holding the
 * owning session's lock; everything handed out is a {@link #copy()}.
 * Timestamps are epoch millis.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Game {
    private String id;
    private String code;
    private String name;
    private GameStatus status;
    private String hostId;
    private int maxPlayers;
    private String currentTurn;
    private List<String> turnOrder = new ArrayList<>();
    private List<Player> players = new ArrayList<>();
    private long createdAt;
    private long updatedAt;
    private long lastActivity;
    private MarketCondition marketCondition = MarketCondition.NORMAL;
    private String winnerId;
    // Property and card state owned by the rule book.
    private ObjectNode board = JsonNodeFactory.instance.objectNode();

    public Game() {
    }

    public Game copy() {
        Game g = new Game();
        g.id = id;
        g.code = code;
        g.name = name;
        g.status = status;
        g.hostId = hostId;
        g.maxPlayers = maxPlayers;
        g.currentTurn = currentTurn;
        g.turnOrder = new ArrayList<>(turnOrder);
        g.players = new ArrayList<>(players.size());
        for (Player p : players) g.players.add(p.copy());
        g.createdAt = createdAt;
        g.updatedAt = updatedAt;
        g.lastActivity = lastActivity;
        g.marketCondition = marketCondition;
        g.winnerId = winnerId;
        g.board = board.deepCopy();
        return g;
    }

    public Player player(String playerId) {
        if (playerId == null) return null;
        for (Player p : players) {
            if (playerId.equals(p.getId())) return p;
        }
        return null;
    }

    public int inPlayCount() {
        int n = 0;
        for (Player p : players) {
            if (p.getStatus() != null && p.getStatus().inPlay()) n++;
        }
        return n;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public GameStatus getStatus() { return status; }
    public void setStatus(GameStatus status) { this.status = status; }

    public String getHostId() { return hostId; }
    public void setHostId(String hostId) { this.hostId = hostId; }

    public int getMaxPlayers() { return maxPlayers; }
    public void setMaxPlayers(int maxPlayers) { this.maxPlayers = maxPlayers; }

    public String getCurrentTurn() { return currentTurn; }
    public void setCurrentTurn(String currentTurn) { this.currentTurn = currentTurn; }

    public List<String> getTurnOrder() { return turnOrder; }
    public void setTurnOrder(List<String> turnOrder) {
        this.turnOrder = turnOrder == null ? new ArrayList<>() : new ArrayList<>(turnOrder);
    }

    public List<Player> getPlayers() { return players; }
    public void setPlayers(List<Player> players) {
        this.players = players == null ? new ArrayList<>() : new ArrayList<>(players);
    }

    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }

    public long getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }

    public long getLastActivity() { return lastActivity; }
    public void setLastActivity(long lastActivity) { this.lastActivity = lastActivity; }

    public MarketCondition getMarketCondition() { return marketCondition; }
    public void setMarketCondition(MarketCondition marketCondition) { this.marketCondition = marketCondition; }

    public String getWinnerId() { return winnerId; }
    public void setWinnerId(String winnerId) { this.winnerId = winnerId; }

    public ObjectNode getBoard() { return board; }
    public void setBoard(ObjectNode board) {
        this.board = board == null ? JsonNodeFactory.instance.objectNode() : board;
    }

    @Override
    public String toString() {
        return "Game{ id=" + id + ", code=" + code + ", status=" + status + ", players=" + players.size() + " }";
    }
}
