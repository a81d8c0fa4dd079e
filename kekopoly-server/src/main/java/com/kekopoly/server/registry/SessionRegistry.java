package com.kekopoly.server.registry;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kekopoly.server.config.ServerConfig;
import com.kekopoly.server.error.NotFoundException;
import com.kekopoly.server.error.PermissionException;
import com.kekopoly.server.error.PersistenceException;
import com.kekopoly.server.error.ResourceExhaustedException;
import com.kekopoly.server.error.StateConflictException;
import com.kekopoly.server.error.ValidationException;
import com.kekopoly.server.model.Game;
import com.kekopoly.server.model.GameAction;
import com.kekopoly.server.model.Player;
import com.kekopoly.server.presence.PresenceTracker;
import com.kekopoly.server.queue.GameMessageQueue;
import com.kekopoly.server.rules.DiceRoller;
import com.kekopoly.server.rules.RuleBook;
import com.kekopoly.server.store.GameStore;
import com.kekopoly.server.util.RoomCodeGenerator;
import com.kekopoly.server.util.TaskScheduler;
import com.kekopoly.shared.dto.GameDeletedDTO;
import com.kekopoly.shared.dto.GameStartedDTO;
import com.kekopoly.shared.dto.GameTurnDTO;
import com.kekopoly.shared.dto.HostChangedDTO;
import com.kekopoly.shared.dto.LobbyGameDTO;
import com.kekopoly.shared.dto.LobbyUpdateDTO;
import com.kekopoly.shared.dto.PlayerPresenceDTO;
import com.kekopoly.shared.util.ActionType;
import com.kekopoly.shared.util.EventType;
import com.kekopoly.shared.util.GameStatus;
import com.kekopoly.shared.util.PlayerStatus;

/**
 * Owns every live game. Lookups go through a concurrent map; each
 * mutation holds the session's own lock for its whole duration, including
 * the store write, so changes to one game are strictly serialized while
 * other games proceed independently.
 *
 * <p>Events produced by a mutation are handed to the publisher before the
 * lock is released, which keeps per-game event order equal to mutation
 * order. Lobby listings are published after the lock is released.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private static final int CODE_ATTEMPTS = 20;
    private static final Set<PlayerStatus> LOBBY_PRESENT = EnumSet.of(PlayerStatus.ACTIVE, PlayerStatus.READY, PlayerStatus.CONNECTED);

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    private final GameStore store;
    private final GameMessageQueue queue;
    private final TaskScheduler scheduler;
    private final PresenceTracker presence;
    private final Clock clock;
    private final ServerConfig.Game settings;
    private final ServerConfig.Reaper sweep;
    private final RuleBook rules;
    private final TurnEngine turns;
    private final RoomCodeGenerator codes = new RoomCodeGenerator();
    private final Random shuffler = new SecureRandom();

    private volatile GameEventPublisher publisher = GameEventPublisher.NONE;

    public SessionRegistry(GameStore store, GameMessageQueue queue, RuleBook rules, DiceRoller dice,
                           TaskScheduler scheduler, PresenceTracker presence, Clock clock, ServerConfig config) {
        this.store = store;
        this.queue = queue;
        this.rules = rules;
        this.scheduler = scheduler;
        this.presence = presence;
        this.clock = clock;
        this.settings = config.getGame();
        this.sweep = config.getReaper();
        this.turns = new TurnEngine(settings, dice, rules, clock);
    }

    public void setEventPublisher(GameEventPublisher publisher) {
        this.publisher = publisher == null ? GameEventPublisher.NONE : publisher;
    }

    /* ---------- Startup ---------- */

    /**
     * Lobbies cannot survive a restart, so stored LOBBY games are closed.
     * Running games come back PAUSED with every player disconnected; the
     * first player to reconnect resumes them.
     *
     * @return number of sessions rehydrated
     */
    public int loadActiveGames() {
        long now = clock.millis();
        try {
            for (Game stale : store.findByStatus(EnumSet.of(GameStatus.LOBBY))) {
                store.updateStatus(stale.getId(), GameStatus.COMPLETED);
                log.info("[STARTUP] closed stale lobby {}", stale.getId());
            }
            int loaded = 0;
            for (Game g : store.findByStatus(EnumSet.of(GameStatus.ACTIVE, GameStatus.PAUSED))) {
                g.setId(g.getId().toLowerCase());
                g.setStatus(GameStatus.PAUSED);
                for (Player p : g.getPlayers()) {
                    if (p.getStatus() == PlayerStatus.ACTIVE) {
                        p.setStatus(PlayerStatus.DISCONNECTED);
                        p.setDisconnectedAt(now);
                    }
                }
                if (sessions.putIfAbsent(g.getId(), new GameSession(g)) == null) {
                    persist(g);
                    loaded++;
                }
            }
            log.info("[STARTUP] rehydrated {} game(s)", loaded);
            return loaded;
        } catch (PersistenceException e) {
            log.error("[STARTUP] could not load games from store", e);
            return 0;
        }
    }

    /* ---------- Lifecycle ---------- */

    public String createGame(String hostId, String name, int maxPlayers) {
        requireId(hostId, "host id");
        String code = allocateCode();
        long now = clock.millis();

        Game g = new Game();
        g.setId(UUID.randomUUID().toString().replace("-", ""));
        g.setCode(code);
        g.setName(name == null || name.isBlank() ? "Game " + code : name.trim());
        g.setStatus(GameStatus.LOBBY);
        g.setHostId(hostId);
        g.setMaxPlayers(clampPlayers(maxPlayers));
        g.setCreatedAt(now);
        g.setUpdatedAt(now);
        g.setLastActivity(now);
        g.getPlayers().add(new Player(hostId, settings.getInitialBalance(), now));
        g.getTurnOrder().add(hostId);
        rules.initBoard(g);

        GameSession s = new GameSession(g);
        s.lock().lock();
        try {
            s.openConnection(hostId, UUID.randomUUID().toString(), now);
            persist(g);
            sessions.put(g.getId(), s);
        } finally {
            s.lock().unlock();
        }
        log.info("[CREATE] game={} code={} host={} maxPlayers={}", g.getId(), code, hostId, g.getMaxPlayers());
        publishLobbyUpdate();
        return g.getId();
    }

    /** Detached copy of the game; looks in the store when it is not live. */
    public Game getGame(String gameIdOrCode) {
        GameSession s = find(gameIdOrCode);
        if (s != null) {
            s.lock().lock();
            try {
                return s.game().copy();
            } finally {
                s.lock().unlock();
            }
        }
        return loadStored(gameIdOrCode)
            .orElseThrow(() -> new NotFoundException("Game " + gameIdOrCode + " not found"));
    }

    /** Canonical id for an id or room code of a live game. */
    public String resolveGameId(String gameIdOrCode) {
        return session(gameIdOrCode).id();
    }

    public boolean isLive(String gameId) {
        return find(gameId) != null;
    }

    public String joinGame(String gameId, String playerId) {
        requireId(playerId, "player id");
        GameSession s = session(gameId);
        String sessionId = UUID.randomUUID().toString();
        s.lock().lock();
        try {
            Game g = s.game();
            if (g.getStatus() != GameStatus.LOBBY) {
                throw new StateConflictException("Game " + g.getId() + " is not accepting players");
            }
            long now = clock.millis();
            Player existing = g.player(playerId);
            if (existing != null) {
                if (existing.getStatus() == PlayerStatus.DISCONNECTED) {
                    existing.setStatus(PlayerStatus.ACTIVE);
                    existing.setDisconnectedAt(null);
                    scheduler.cancel(forfeitKey(g.getId(), playerId));
                }
                s.openConnection(playerId, sessionId, now);
                g.setLastActivity(now);
                persist(g);
                log.info("[JOIN] game={} player={} rejoined session={}", g.getId(), playerId, sessionId);
                return sessionId;
            }
            if (g.getPlayers().size() >= g.getMaxPlayers()) {
                throw new StateConflictException("Game " + g.getId() + " is full");
            }
            g.getPlayers().add(new Player(playerId, settings.getInitialBalance(), now));
            g.getTurnOrder().add(playerId);
            s.openConnection(playerId, sessionId, now);
            g.setLastActivity(now);
            persist(g);
            log.info("[JOIN] game={} player={} session={} players={}", g.getId(), playerId, sessionId, g.getPlayers().size());
        } finally {
            s.lock().unlock();
        }
        publishLobbyUpdate();
        return sessionId;
    }

    public void startGame(String gameId, String requesterId) {
        requireId(requesterId, "requester id");
        GameSession s = session(gameId);
        s.lock().lock();
        try {
            Game g = s.game();
            if (g.getStatus() != GameStatus.LOBBY) {
                throw new StateConflictException("Game " + g.getId() + " has already started");
            }
            List<String> order = new ArrayList<>();
            for (Player p : g.getPlayers()) {
                if (LOBBY_PRESENT.contains(p.getStatus())) order.add(p.getId());
            }
            if (order.size() < settings.getMinPlayers()) {
                throw new StateConflictException("At least " + settings.getMinPlayers() + " players are needed to start");
            }
            if (!requesterId.equals(g.getHostId())) {
                throw new PermissionException("Only the host can start the game");
            }

            Collections.shuffle(order, shuffler);
            for (String pid : order) {
                Player p = g.player(pid);
                p.setStatus(PlayerStatus.ACTIVE);
                p.setConsecutiveDoubles(0);
            }
            long now = clock.millis();
            g.setTurnOrder(order);
            g.setCurrentTurn(order.get(0));
            g.setStatus(GameStatus.ACTIVE);
            g.setLastActivity(now);
            persist(g);
            if (queue != null) {
                queue.enqueueGameStart(g);
                queue.enqueueGameStateUpdate(g);
            }

            publisher.broadcastToGame(g.getId(), EventType.GAME_STARTED, new GameStartedDTO(g.getId(), g.getStatus(),
                g.getCurrentTurn(), List.copyOf(order), Snapshots.playerStates(g), now));
            publisher.broadcastToGame(g.getId(), EventType.GAME_TURN,
                new GameTurnDTO(g.getId(), g.getCurrentTurn(), List.copyOf(order)));
            log.info("[START] game={} order={} first={}", g.getId(), order, g.getCurrentTurn());
        } finally {
            s.lock().unlock();
        }
        publishLobbyUpdate();
    }

    public ActionResult processAction(GameAction action) {
        if (action == null || action.type() == null) {
            throw new ValidationException("Action type is required");
        }
        requireId(action.playerId(), "player id");
        GameSession s = session(action.gameId());
        boolean completed;
        ActionResult result;
        s.lock().lock();
        try {
            Game g = s.game();
            if (g.getStatus() != GameStatus.ACTIVE) {
                throw new StateConflictException("Game " + g.getId() + " is not active");
            }
            Player actor = g.player(action.playerId());
            if (actor == null) {
                throw new NotFoundException("Player " + action.playerId() + " is not in game " + g.getId());
            }
            if (actor.getStatus() != PlayerStatus.ACTIVE) {
                throw new StateConflictException("Player " + actor.getId() + " is not active");
            }
            if (!action.type().turnIndependent() && !actor.getId().equals(g.getCurrentTurn())) {
                throw new StateConflictException("It is not " + actor.getId() + "'s turn");
            }
            if (s.seenRequest(action.requestId())) {
                throw new StateConflictException("Request " + action.requestId() + " was already processed");
            }
            long now = clock.millis();
            if (action.type() == ActionType.ROLL_DICE && s.rollSettling(actor.getId(), now, settings.getRollSettleMillis())) {
                throw new StateConflictException("A roll for " + actor.getId() + " is still being settled");
            }

            List<GameEvent> events = new ArrayList<>();
            TurnEngine.Roll roll = null;
            if (action.type() == ActionType.ROLL_DICE) {
                roll = turns.roll(g, actor, action.requestId());
                s.markRoll(actor.getId(), now);
                events.addAll(roll.events());
            } else if (action.type() == ActionType.END_TURN) {
                events.addAll(turns.endTurn(g, actor));
            } else {
                events.addAll(turns.applyRule(g, actor, action));
            }
            events.addAll(turns.settle(g));
            s.rememberRequest(action.requestId());

            g.setLastActivity(now);
            persist(g);
            if (queue != null) queue.enqueueGameStateUpdate(g);

            publishAll(g.getId(), events);
            completed = g.getStatus() == GameStatus.COMPLETED;
            result = new ActionResult(g.getId(), actor.getId(), action.type(), roll == null ? null : roll.dice(),
                g.getCurrentTurn(), g.getStatus(), List.copyOf(events));
            log.debug("[ACTION] game={} player={} type={} turn={}", g.getId(), actor.getId(), action.type(), g.getCurrentTurn());
        } finally {
            s.lock().unlock();
        }
        if (completed) scheduleCompletedCleanup(result.gameId());
        return result;
    }

    /* ---------- Presence ---------- */

    /**
     * Marks the player disconnected in place. Host status moves to the first
     * player in turn order who is ACTIVE and holds a live connection; with no
     * such player the game is abandoned and its cleanup scheduled.
     */
    public DisconnectOutcome playerDisconnected(String gameId, String playerId) {
        requireId(playerId, "player id");
        GameSession s = session(gameId);
        DisconnectOutcome outcome;
        s.lock().lock();
        try {
            Game g = s.game();
            Player p = g.player(playerId);
            if (p == null) {
                throw new NotFoundException("Player " + playerId + " is not in game " + g.getId());
            }
            long now = clock.millis();
            s.closeConnection(playerId, now);
            if (p.getStatus() == PlayerStatus.DISCONNECTED) {
                return DisconnectOutcome.unchanged(g.getId(), playerId, g.getHostId());
            }
            boolean open = g.getStatus() == GameStatus.LOBBY || g.getStatus() == GameStatus.ACTIVE || g.getStatus() == GameStatus.PAUSED;

            List<GameEvent> events = new ArrayList<>();
            if (LOBBY_PRESENT.contains(p.getStatus())) {
                p.setStatus(PlayerStatus.DISCONNECTED);
                p.setDisconnectedAt(now);
                if (g.getStatus() == GameStatus.ACTIVE && playerId.equals(g.getCurrentTurn())) {
                    events.addAll(turns.advanceTurn(g, "disconnect"));
                }
            }

            String previousHost = g.getHostId();
            String newHost = null;
            boolean abandoned = false;
            if (playerId.equals(previousHost) && open) {
                newHost = findSuccessor(s, playerId);
                if (newHost != null) {
                    g.setHostId(newHost);
                    log.info("[HOST] game={} host {} -> {}", g.getId(), previousHost, newHost);
                } else {
                    g.setStatus(GameStatus.ABANDONED);
                    abandoned = true;
                    log.info("[HOST] game={} lost host {} with no successor; abandoned", g.getId(), previousHost);
                }
            }

            if (abandoned) {
                String gid = g.getId();
                scheduler.schedule(cleanupKey(gid), settings.abandonedCleanupDelay(), () -> cleanupAbandonedGame(gid, false));
            } else if (open && p.getStatus() == PlayerStatus.DISCONNECTED) {
                scheduleForfeit(g.getId(), playerId);
            }
            persist(g);
            publishAll(g.getId(), events);
            outcome = new DisconnectOutcome(g.getId(), playerId, true, previousHost, newHost, abandoned);
            log.info("[DISCONNECT] game={} player={} status={} host={}", g.getId(), playerId, g.getStatus(), g.getHostId());
        } finally {
            s.lock().unlock();
        }
        return outcome;
    }

    /**
     * Records a new socket for the player. A player who was disconnected is
     * restored as if by {@link #playerReconnected}; the resulting events are
     * returned instead of published.
     */
    public ConnectOutcome playerConnected(String gameId, String playerId, String sessionId) {
        requireId(playerId, "player id");
        requireId(sessionId, "session id");
        GameSession s = session(gameId);
        s.lock().lock();
        try {
            Game g = s.game();
            Player p = g.player(playerId);
            if (p == null) {
                throw new NotFoundException("Player " + playerId + " is not in game " + g.getId());
            }
            long now = clock.millis();
            s.openConnection(playerId, sessionId, now);
            if (p.getStatus() != PlayerStatus.DISCONNECTED || g.getStatus() == GameStatus.ABANDONED
                || g.getStatus() == GameStatus.COMPLETED) {
                return new ConnectOutcome(false, false, List.of());
            }
            boolean wasPaused = g.getStatus() == GameStatus.PAUSED;
            List<GameEvent> events = restore(s, p, now);
            persist(g);
            return new ConnectOutcome(true, wasPaused && g.getStatus() == GameStatus.ACTIVE, events);
        } finally {
            s.lock().unlock();
        }
    }

    public void playerReconnected(String gameId, String playerId, String sessionId) {
        requireId(playerId, "player id");
        requireId(sessionId, "session id");
        GameSession s = session(gameId);
        s.lock().lock();
        try {
            Game g = s.game();
            Player p = requirePlayer(g, playerId);
            if (p.getStatus() != PlayerStatus.DISCONNECTED) {
                throw new StateConflictException("Player " + playerId + " is not disconnected");
            }
            if (g.getStatus() == GameStatus.ABANDONED || g.getStatus() == GameStatus.COMPLETED) {
                throw new StateConflictException("Game " + g.getId() + " is " + g.getStatus());
            }
            long now = clock.millis();
            s.openConnection(playerId, sessionId, now);
            List<GameEvent> events = restore(s, p, now);
            persist(g);
            publishAll(g.getId(), events);
        } finally {
            s.lock().unlock();
        }
    }

    public void rejoinGame(String gameId, String playerId, String sessionId) {
        requireId(playerId, "player id");
        requireId(sessionId, "session id");
        GameSession s = session(gameId);
        s.lock().lock();
        try {
            Game g = s.game();
            if (g.getStatus() != GameStatus.ACTIVE) {
                throw new StateConflictException("Game " + g.getId() + " is not active");
            }
            Player p = requirePlayer(g, playerId);
            if (!p.getStatus().inPlay()) {
                throw new StateConflictException("Player " + playerId + " is out of the game");
            }
            long now = clock.millis();
            s.openConnection(playerId, sessionId, now);
            List<GameEvent> events = p.getStatus() == PlayerStatus.DISCONNECTED ? restore(s, p, now) : List.of();
            persist(g);
            publishAll(g.getId(), events);
        } finally {
            s.lock().unlock();
        }
    }

    /* ---------- Host ---------- */

    public void resetGameStatus(String gameId, String requesterId) {
        requireId(requesterId, "requester id");
        GameSession s = find(gameId);
        boolean reloaded = false;
        if (s == null) {
            Game stored = loadStored(gameId)
                .orElseThrow(() -> new NotFoundException("Game " + gameId + " not found"));
            s = new GameSession(stored);
            reloaded = true;
        }
        s.lock().lock();
        try {
            Game g = s.game();
            if (g.getStatus() != GameStatus.ABANDONED) {
                throw new StateConflictException("Game " + g.getId() + " is not abandoned");
            }
            Player requester = g.player(requesterId);
            if (requester == null) {
                throw new PermissionException("Only a player of game " + g.getId() + " can reset it");
            }
            if (!requester.getStatus().inPlay() && !LOBBY_PRESENT.contains(requester.getStatus())) {
                throw new StateConflictException("Player " + requesterId + " has left game " + g.getId());
            }
            long now = clock.millis();
            g.getPlayers().removeIf(p -> !p.getStatus().inPlay() && !LOBBY_PRESENT.contains(p.getStatus()));
            List<String> order = new ArrayList<>();
            for (Player p : g.getPlayers()) order.add(p.getId());
            g.setTurnOrder(order);
            g.setCurrentTurn(null);
            g.setWinnerId(null);
            g.setStatus(GameStatus.LOBBY);
            g.setHostId(requesterId);
            requester.setStatus(PlayerStatus.ACTIVE);
            requester.setDisconnectedAt(null);
            g.setLastActivity(now);
            scheduler.cancel(cleanupKey(g.getId()));
            persist(g);
            if (reloaded) sessions.putIfAbsent(g.getId(), s);
            log.info("[RESET] game={} back to LOBBY with host {}", g.getId(), requesterId);
        } finally {
            s.lock().unlock();
        }
        publishLobbyUpdate();
    }

    public HostChange transferHost(String gameId, String requesterId, String newHostId) {
        requireId(requesterId, "requester id");
        requireId(newHostId, "host id");
        GameSession s = session(gameId);
        s.lock().lock();
        try {
            Game g = s.game();
            if (g.getStatus() == GameStatus.ABANDONED || g.getStatus() == GameStatus.COMPLETED) {
                throw new StateConflictException("Game " + g.getId() + " is " + g.getStatus());
            }
            if (!requesterId.equals(g.getHostId())) {
                throw new PermissionException("Only the host can hand over host status");
            }
            Player target = requirePlayer(g, newHostId);
            if (target.getStatus() != PlayerStatus.ACTIVE) {
                throw new StateConflictException("Player " + newHostId + " is not active");
            }
            String previous = g.getHostId();
            g.setHostId(newHostId);
            persist(g);
            log.info("[HOST] game={} host {} -> {} (transfer)", g.getId(), previous, newHostId);
            return new HostChange(g.getId(), previous, newHostId);
        } finally {
            s.lock().unlock();
        }
    }

    public void updatePlayerToken(String gameId, String playerId, String token) {
        requireId(playerId, "player id");
        if (token == null || token.isBlank()) {
            throw new ValidationException("Token is required");
        }
        GameSession s = session(gameId);
        s.lock().lock();
        try {
            Game g = s.game();
            requirePlayer(g, playerId).setCharacterToken(token);
            g.setLastActivity(clock.millis());
            persist(g);
            if (queue != null) queue.enqueuePlayerTokenUpdate(g.getId(), playerId, token);
        } finally {
            s.lock().unlock();
        }
    }

    /* ---------- Cleanup ---------- */

    /**
     * Removes idle, expired, duplicate and host-less lobby sessions, and
     * hands host status to a connected player where the host has gone but a
     * successor exists.
     *
     * @return ids of the removed games
     */
    public List<String> cleanupStaleGames() {
        long now = clock.millis();
        List<GameSession> all = new ArrayList<>(sessions.values());
        all.sort(Comparator.comparingLong(s -> createdAt(s)));

        Set<GameSession> duplicates = new HashSet<>();
        Map<String, GameSession> byCode = new HashMap<>();
        for (GameSession s : all) {
            String code = code(s);
            if (code == null) continue;
            if (byCode.putIfAbsent(code.toUpperCase(), s) != null) duplicates.add(s);
        }

        List<String> removed = new ArrayList<>();
        for (GameSession s : all) {
            String reason = null;
            s.lock().lock();
            try {
                Game g = s.game();
                if (duplicates.contains(s)) {
                    reason = "duplicate";
                } else if (now - g.getLastActivity() >= sweep.idleGameExpiry().toMillis()) {
                    reason = "inactive";
                } else if (g.getStatus() == GameStatus.LOBBY) {
                    long age = now - g.getCreatedAt();
                    if (g.getPlayers().size() <= 1 && age >= sweep.lobbySoloExpiry().toMillis()) {
                        reason = "lobby_empty";
                    } else if (age >= sweep.lobbyStartExpiry().toMillis()) {
                        reason = "lobby_not_started";
                    } else if (!isLive(s, g.getHostId()) && !migrateHost(s)) {
                        reason = "host_gone";
                    }
                } else if (g.getStatus() == GameStatus.ACTIVE && !isLive(s, g.getHostId())) {
                    migrateHost(s);
                }
                if (reason != null) {
                    sessions.remove(g.getId(), s);
                    scheduler.cancel(cleanupKey(g.getId()));
                    markStored(g.getId(), GameStatus.COMPLETED);
                    publisher.broadcastToGame(g.getId(), EventType.GAME_DELETED,
                        new GameDeletedDTO(g.getId(), reason, "Game has been removed due to inactivity"));
                    removed.add(g.getId());
                    log.info("[CLEANUP] removed game={} reason={}", g.getId(), reason);
                }
            } finally {
                s.lock().unlock();
            }
            if (reason != null && presence != null) presence.clear(s.id());
        }
        if (!removed.isEmpty()) publishLobbyUpdate();
        return removed;
    }

    public void cleanupAbandonedGame(String gameId, boolean deleteFromStore) {
        removeSession(gameId, deleteFromStore, "abandoned", "Game has been removed due to inactivity");
    }

    public List<Game> listAvailableGames() {
        List<Game> out = new ArrayList<>();
        for (GameSession s : sessions.values()) {
            s.lock().lock();
            try {
                if (s.game().getStatus() == GameStatus.LOBBY) out.add(s.game().copy());
            } finally {
                s.lock().unlock();
            }
        }
        out.sort(Comparator.comparingLong(Game::getCreatedAt));
        return out;
    }

    public Collection<String> activeGameIds() {
        return List.copyOf(sessions.keySet());
    }

    public void shutdown() {
        scheduler.shutdown();
        log.info("[SHUTDOWN] registry stopped with {} live game(s)", sessions.size());
    }

    /* ---------- Internals ---------- */

    // Caller holds the lock.
    private List<GameEvent> restore(GameSession s, Player p, long now) {
        Game g = s.game();
        p.setStatus(PlayerStatus.ACTIVE);
        p.setDisconnectedAt(null);
        scheduler.cancel(forfeitKey(g.getId(), p.getId()));
        List<GameEvent> events = new ArrayList<>();
        events.add(new GameEvent(EventType.PLAYER_RECONNECTED, new PlayerPresenceDTO(g.getId(), p.getId(), now)));
        if (g.getStatus() == GameStatus.LOBBY) {
            return events;
        }
        if (!g.getTurnOrder().contains(p.getId())) {
            g.getTurnOrder().add(p.getId());
        }
        if (g.getStatus() == GameStatus.PAUSED) {
            g.setStatus(GameStatus.ACTIVE);
            for (Player other : g.getPlayers()) {
                if (other.getStatus() == PlayerStatus.DISCONNECTED) scheduleForfeit(g.getId(), other.getId());
            }
            log.info("[RESUME] game={} resumed by {}", g.getId(), p.getId());
        }
        Player current = g.player(g.getCurrentTurn());
        if (current == null || current.getStatus() != PlayerStatus.ACTIVE) {
            events.addAll(turns.advanceTurn(g, "resume"));
        }
        g.setLastActivity(now);
        return events;
    }

    private void scheduleForfeit(String gameId, String playerId) {
        scheduler.schedule(forfeitKey(gameId, playerId), settings.disconnectionTimeout(), () -> forfeit(gameId, playerId));
    }

    /** Grace period over: the player loses their seat if they have not come back. */
    void forfeit(String gameId, String playerId) {
        GameSession s = sessions.get(gameId);
        if (s == null) return;
        boolean lobby = false;
        boolean completed = false;
        s.lock().lock();
        try {
            Game g = s.game();
            Player p = g.player(playerId);
            if (p == null || p.getStatus() != PlayerStatus.DISCONNECTED) return;
            List<GameEvent> events = new ArrayList<>();
            long now = clock.millis();
            if (g.getStatus() == GameStatus.LOBBY) {
                g.getPlayers().remove(p);
                g.getTurnOrder().remove(playerId);
                lobby = true;
            } else if (g.getStatus() == GameStatus.ACTIVE || g.getStatus() == GameStatus.PAUSED) {
                p.setStatus(PlayerStatus.FORFEITED);
                turns.redistribute(g, p);
                events.addAll(turns.removeFromTurnOrder(g, playerId, "forfeit"));
                events.addAll(turns.checkCompletion(g, "forfeit"));
                completed = g.getStatus() == GameStatus.COMPLETED;
            } else {
                return;
            }
            events.add(0, new GameEvent(EventType.PLAYER_FORFEITED, new PlayerPresenceDTO(g.getId(), playerId, now)));
            g.setLastActivity(now);
            persist(g);
            publishAll(g.getId(), events);
            log.info("[FORFEIT] game={} player={} lobby={}", g.getId(), playerId, lobby);
        } finally {
            s.lock().unlock();
        }
        if (lobby) publishLobbyUpdate();
        if (completed) scheduleCompletedCleanup(gameId);
    }

    private void scheduleCompletedCleanup(String gameId) {
        scheduler.schedule(cleanupKey(gameId), settings.completedCleanupDelay(),
            () -> removeSession(gameId, false, "completed", "Game has ended"));
    }

    private void removeSession(String gameId, boolean deleteFromStore, String reason, String message) {
        String id = normalize(gameId);
        GameSession s = sessions.remove(id);
        scheduler.cancel(cleanupKey(id));
        if (s == null) {
            log.debug("[CLEANUP] game={} was not live", id);
        }
        if (deleteFromStore) {
            try {
                store.delete(id);
            } catch (PersistenceException e) {
                log.error("[CLEANUP] failed to delete game={} from store", id, e);
            }
        }
        if (presence != null) presence.clear(id);
        publisher.broadcastToGame(id, EventType.GAME_DELETED, new GameDeletedDTO(id, reason, message));
        publishLobbyUpdate();
        log.info("[CLEANUP] game={} removed reason={} deleted={}", id, reason, deleteFromStore);
    }

    // Caller holds the lock.
    private boolean migrateHost(GameSession s) {
        Game g = s.game();
        String previous = g.getHostId();
        String successor = findSuccessor(s, previous);
        if (successor == null) return false;
        g.setHostId(successor);
        persist(g);
        publisher.broadcastToGame(g.getId(), EventType.HOST_CHANGED, new HostChangedDTO(g.getId(), successor, previous));
        log.info("[CLEANUP] game={} host {} -> {}", g.getId(), previous, successor);
        return true;
    }

    // Caller holds the lock.
    private String findSuccessor(GameSession s, String departing) {
        Game g = s.game();
        for (String pid : g.getTurnOrder()) {
            if (pid.equals(departing)) continue;
            Player p = g.player(pid);
            if (p != null && p.getStatus() == PlayerStatus.ACTIVE && isLive(s, pid)) return pid;
        }
        return null;
    }

    // Caller holds the lock. Presence history, where the tracker has any, must agree.
    private boolean isLive(GameSession s, String playerId) {
        if (playerId == null || !s.hasLiveConnection(playerId)) return false;
        if (presence == null || !presence.hasHistory(s.id(), playerId)) return true;
        return presence.getActiveSession(s.id(), playerId) != null;
    }

    private void publishAll(String gameId, List<GameEvent> events) {
        for (GameEvent e : events) {
            publisher.broadcastToGame(gameId, e.type(), e.payload());
        }
    }

    private void publishLobbyUpdate() {
        List<LobbyGameDTO> games = new ArrayList<>();
        for (Game g : listAvailableGames()) games.add(Snapshots.lobbyGame(g));
        publisher.broadcastToLobby(EventType.LOBBY_UPDATE, new LobbyUpdateDTO(games));
    }

    private void persist(Game g) {
        g.setUpdatedAt(clock.millis());
        try {
            store.save(g);
        } catch (PersistenceException e) {
            log.error("[STORE] write failed for game={}; in-memory state kept", g.getId(), e);
        }
    }

    private void markStored(String gameId, GameStatus status) {
        try {
            store.updateStatus(gameId, status);
        } catch (PersistenceException e) {
            log.error("[STORE] status update failed for game={}", gameId, e);
        }
    }

    private String allocateCode() {
        Set<String> live = new HashSet<>();
        for (GameSession s : sessions.values()) {
            String c = code(s);
            if (c != null) live.add(c);
        }
        for (int i = 0; i < CODE_ATTEMPTS; i++) {
            String code = codes.next();
            if (live.contains(code)) continue;
            if (!store.codeExists(code)) return code;
            log.debug("[CREATE] room code {} collided, retrying", code);
        }
        throw new ResourceExhaustedException("Could not allocate a unique room code");
    }

    private int clampPlayers(int requested) {
        return Math.max(settings.getMinPlayers(), Math.min(settings.getMaxPlayers(), requested));
    }

    private GameSession session(String gameIdOrCode) {
        GameSession s = find(gameIdOrCode);
        if (s == null) {
            throw new NotFoundException("Game " + gameIdOrCode + " not found");
        }
        return s;
    }

    private GameSession find(String gameIdOrCode) {
        String id = normalize(gameIdOrCode);
        GameSession s = sessions.get(id);
        if (s != null || !RoomCodeGenerator.looksLikeCode(id)) return s;
        for (GameSession candidate : sessions.values()) {
            if (id.equalsIgnoreCase(code(candidate))) return candidate;
        }
        return null;
    }

    private Optional<Game> loadStored(String gameIdOrCode) {
        String id = normalize(gameIdOrCode);
        try {
            Optional<Game> g = store.findById(id);
            if (g.isEmpty() && RoomCodeGenerator.looksLikeCode(id)) {
                g = store.findByCode(id.toUpperCase());
            }
            return g;
        } catch (PersistenceException e) {
            log.error("[STORE] lookup failed for {}", id, e);
            return Optional.empty();
        }
    }

    // Code and creation time never change after creation, so reading them unlocked is safe.
    private static String code(GameSession s) {
        return s.game().getCode();
    }

    private static long createdAt(GameSession s) {
        return s.game().getCreatedAt();
    }

    private static Player requirePlayer(Game g, String playerId) {
        Player p = g.player(playerId);
        if (p == null) {
            throw new NotFoundException("Player " + playerId + " is not in game " + g.getId());
        }
        return p;
    }

    private static String normalize(String gameId) {
        if (gameId == null || gameId.isBlank()) {
            throw new ValidationException("Game id is required");
        }
        return gameId.trim().toLowerCase();
    }

    private static void requireId(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("A " + what + " is required");
        }
    }

    static String forfeitKey(String gameId, String playerId) {
        return "forfeit:" + gameId + ":" + playerId;
    }

    static String cleanupKey(String gameId) {
        return "cleanup:" + gameId;
    }
}
