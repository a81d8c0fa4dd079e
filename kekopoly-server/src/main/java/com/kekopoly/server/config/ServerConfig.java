package com.kekopoly.server.config;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Runtime settings. Defaults here match {@code kekopoly.json}; see
 * {@link ConfigLoader} for the override order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfig {

    private Server server = new Server();
    private Redis redis = new Redis();
    private Game game = new Game();
    private Hub hub = new Hub();
    private Reaper reaper = new Reaper();

    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }
    public Redis getRedis() { return redis; }
    public void setRedis(Redis redis) { this.redis = redis; }
    public Game getGame() { return game; }
    public void setGame(Game game) { this.game = game; }
    public Hub getHub() { return hub; }
    public void setHub(Hub hub) { this.hub = hub; }
    public Reaper getReaper() { return reaper; }
    public void setReaper(Reaper reaper) { this.reaper = reaper; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Server {
        private String host = "0.0.0.0";
        private int port = 8080;
        private int healthPortOffset = 1000;
        private int connectionLostTimeoutSeconds = 0;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public int getHealthPortOffset() { return healthPortOffset; }
        public void setHealthPortOffset(int healthPortOffset) { this.healthPortOffset = healthPortOffset; }
        public int getConnectionLostTimeoutSeconds() { return connectionLostTimeoutSeconds; }
        public void setConnectionLostTimeoutSeconds(int seconds) { this.connectionLostTimeoutSeconds = seconds; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Redis {
        private boolean enabled = true;
        private String host = "127.0.0.1";
        private int port = 6379;
        private int timeoutMillis = 2000;
        private boolean queueEnabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public int getTimeoutMillis() { return timeoutMillis; }
        public void setTimeoutMillis(int timeoutMillis) { this.timeoutMillis = timeoutMillis; }
        public boolean isQueueEnabled() { return queueEnabled; }
        public void setQueueEnabled(boolean queueEnabled) { this.queueEnabled = queueEnabled; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Game {
        private int minPlayers = 2;
        private int maxPlayers = 6;
        private long initialBalance = 1500;
        private int disconnectionTimeoutSeconds = 180;
        private int boardSize = 40;
        private int jailPosition = 10;
        private int jailTurns = 3;
        private long passStartReward = 100;
        private int maxConsecutiveDoubles = 3;
        private long rollSettleMillis = 500;
        private int cardDeckSize = 16;
        private int abandonedCleanupDelaySeconds = 30;
        private int completedCleanupDelaySeconds = 60;

        public int getMinPlayers() { return minPlayers; }
        public void setMinPlayers(int minPlayers) { this.minPlayers = minPlayers; }
        public int getMaxPlayers() { return maxPlayers; }
        public void setMaxPlayers(int maxPlayers) { this.maxPlayers = maxPlayers; }
        public long getInitialBalance() { return initialBalance; }
        public void setInitialBalance(long initialBalance) { this.initialBalance = initialBalance; }
        public int getDisconnectionTimeoutSeconds() { return disconnectionTimeoutSeconds; }
        public void setDisconnectionTimeoutSeconds(int seconds) { this.disconnectionTimeoutSeconds = seconds; }
        public int getBoardSize() { return boardSize; }
        public void setBoardSize(int boardSize) { this.boardSize = boardSize; }
        public int getJailPosition() { return jailPosition; }
        public void setJailPosition(int jailPosition) { this.jailPosition = jailPosition; }
        public int getJailTurns() { return jailTurns; }
        public void setJailTurns(int jailTurns) { this.jailTurns = jailTurns; }
        public long getPassStartReward() { return passStartReward; }
        public void setPassStartReward(long passStartReward) { this.passStartReward = passStartReward; }
        public int getMaxConsecutiveDoubles() { return maxConsecutiveDoubles; }
        public void setMaxConsecutiveDoubles(int max) { this.maxConsecutiveDoubles = max; }
        public long getRollSettleMillis() { return rollSettleMillis; }
        public void setRollSettleMillis(long millis) { this.rollSettleMillis = millis; }
        public int getCardDeckSize() { return cardDeckSize; }
        public void setCardDeckSize(int cardDeckSize) { this.cardDeckSize = cardDeckSize; }
        public int getAbandonedCleanupDelaySeconds() { return abandonedCleanupDelaySeconds; }
        public void setAbandonedCleanupDelaySeconds(int seconds) { this.abandonedCleanupDelaySeconds = seconds; }
        public int getCompletedCleanupDelaySeconds() { return completedCleanupDelaySeconds; }
        public void setCompletedCleanupDelaySeconds(int seconds) { this.completedCleanupDelaySeconds = seconds; }

        public Duration disconnectionTimeout() { return Duration.ofSeconds(disconnectionTimeoutSeconds); }
        public Duration abandonedCleanupDelay() { return Duration.ofSeconds(abandonedCleanupDelaySeconds); }
        public Duration completedCleanupDelay() { return Duration.ofSeconds(completedCleanupDelaySeconds); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hub {
        private int highQueueCapacity = 16384;
        private int normalQueueCapacity = 16384;
        private int lowQueueCapacity = 8192;
        private int batchSize = 10;
        private long minSendIntervalMillis = 5;
        private int pingIntervalSeconds = 30;
        private int inactivityThresholdSeconds = 90;
        private int commandQueueCapacity = 128;
        private long registerTimeoutMillis = 5000;
        private boolean relayUnknownMessages = true;

        public int getHighQueueCapacity() { return highQueueCapacity; }
        public void setHighQueueCapacity(int capacity) { this.highQueueCapacity = capacity; }
        public int getNormalQueueCapacity() { return normalQueueCapacity; }
        public void setNormalQueueCapacity(int capacity) { this.normalQueueCapacity = capacity; }
        public int getLowQueueCapacity() { return lowQueueCapacity; }
        public void setLowQueueCapacity(int capacity) { this.lowQueueCapacity = capacity; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public long getMinSendIntervalMillis() { return minSendIntervalMillis; }
        public void setMinSendIntervalMillis(long millis) { this.minSendIntervalMillis = millis; }
        public int getPingIntervalSeconds() { return pingIntervalSeconds; }
        public void setPingIntervalSeconds(int seconds) { this.pingIntervalSeconds = seconds; }
        public int getInactivityThresholdSeconds() { return inactivityThresholdSeconds; }
        public void setInactivityThresholdSeconds(int seconds) { this.inactivityThresholdSeconds = seconds; }
        public int getCommandQueueCapacity() { return commandQueueCapacity; }
        public void setCommandQueueCapacity(int capacity) { this.commandQueueCapacity = capacity; }
        public long getRegisterTimeoutMillis() { return registerTimeoutMillis; }
        public void setRegisterTimeoutMillis(long millis) { this.registerTimeoutMillis = millis; }
        public boolean isRelayUnknownMessages() { return relayUnknownMessages; }
        public void setRelayUnknownMessages(boolean relay) { this.relayUnknownMessages = relay; }

        public Duration inactivityThreshold() { return Duration.ofSeconds(inactivityThresholdSeconds); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Reaper {
        private int inactivitySweepSeconds = 30;
        private int staleSweepSeconds = 180;
        private int cacheRefreshSeconds = 5;
        private int idleGameExpiryHours = 24;
        private int lobbySoloExpiryMinutes = 15;
        private int lobbyStartExpiryMinutes = 30;

        public int getInactivitySweepSeconds() { return inactivitySweepSeconds; }
        public void setInactivitySweepSeconds(int seconds) { this.inactivitySweepSeconds = seconds; }
        public int getStaleSweepSeconds() { return staleSweepSeconds; }
        public void setStaleSweepSeconds(int seconds) { this.staleSweepSeconds = seconds; }
        public int getCacheRefreshSeconds() { return cacheRefreshSeconds; }
        public void setCacheRefreshSeconds(int seconds) { this.cacheRefreshSeconds = seconds; }
        public int getIdleGameExpiryHours() { return idleGameExpiryHours; }
        public void setIdleGameExpiryHours(int hours) { this.idleGameExpiryHours = hours; }
        public int getLobbySoloExpiryMinutes() { return lobbySoloExpiryMinutes; }
        public void setLobbySoloExpiryMinutes(int minutes) { this.lobbySoloExpiryMinutes = minutes; }
        public int getLobbyStartExpiryMinutes() { return lobbyStartExpiryMinutes; }
        public void setLobbyStartExpiryMinutes(int minutes) { this.lobbyStartExpiryMinutes = minutes; }

        public Duration idleGameExpiry() { return Duration.ofHours(idleGameExpiryHours); }
        public Duration lobbySoloExpiry() { return Duration.ofMinutes(lobbySoloExpiryMinutes); }
        public Duration lobbyStartExpiry() { return Duration.ofMinutes(lobbyStartExpiryMinutes); }
    }
}
