package com.kekopoly.server.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kekopoly.shared.util.PlayerStatus;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Player {
    private String id;
    private PlayerStatus status;
    private String characterToken;
    private int position;
    private long balance;
    private long netWorth;
    private List<String> properties = new ArrayList<>();
    private boolean inJail;
    private int jailTurns;
    private int consecutiveDoubles;
    private Long disconnectedAt;
    private long joinedAt;

    public Player() {
    }

    public Player(String id, long balance, long joinedAt) {
        this.id = id;
        this.status = PlayerStatus.ACTIVE;
        this.balance = balance;
        this.netWorth = balance;
        this.joinedAt = joinedAt;
    }

    public Player copy() {
        Player p = new Player();
        p.id = id;
        p.status = status;
        p.characterToken = characterToken;
        p.position = position;
        p.balance = balance;
        p.netWorth = netWorth;
        p.properties = new ArrayList<>(properties);
        p.inJail = inJail;
        p.jailTurns = jailTurns;
        p.consecutiveDoubles = consecutiveDoubles;
        p.disconnectedAt = disconnectedAt;
        p.joinedAt = joinedAt;
        return p;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public PlayerStatus getStatus() { return status; }
    public void setStatus(PlayerStatus status) { this.status = status; }

    public String getCharacterToken() { return characterToken; }
    public void setCharacterToken(String characterToken) { this.characterToken = characterToken; }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

    public long getBalance() { return balance; }
    public void setBalance(long balance) { this.balance = balance; }

    public long getNetWorth() { return netWorth; }
    public void setNetWorth(long netWorth) { this.netWorth = netWorth; }

    public List<String> getProperties() { return properties; }
    public void setProperties(List<String> properties) {
        this.properties = properties == null ? new ArrayList<>() : new ArrayList<>(properties);
    }

    public boolean isInJail() { return inJail; }
    public void setInJail(boolean inJail) { this.inJail = inJail; }

    public int getJailTurns() { return jailTurns; }
    public void setJailTurns(int jailTurns) { this.jailTurns = jailTurns; }

    public int getConsecutiveDoubles() { return consecutiveDoubles; }
    public void setConsecutiveDoubles(int consecutiveDoubles) { this.consecutiveDoubles = consecutiveDoubles; }

    public Long getDisconnectedAt() { return disconnectedAt; }
    public void setDisconnectedAt(Long disconnectedAt) { this.disconnectedAt = disconnectedAt; }

    public long getJoinedAt() { return joinedAt; }
    public void setJoinedAt(long joinedAt) { this.joinedAt = joinedAt; }

    public void credit(long amount) {
        balance += amount;
        netWorth += amount;
    }

    public void debit(long amount) {
        balance -= amount;
        netWorth -= amount;
    }

    @Override
    public String toString() {
        return "Player{ id=" + id + ", status=" + status + ", balance=" + balance + " }";
    }
}
