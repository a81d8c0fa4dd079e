package com.kekopoly.server.hub;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.kekopoly.server.config.ServerConfig;
import com.kekopoly.server.error.ConnectionException;
import com.kekopoly.server.error.GameException;
import com.kekopoly.server.error.NotFoundException;
import com.kekopoly.server.error.ResourceExhaustedException;
import com.kekopoly.server.model.Game;
import com.kekopoly.server.model.GameAction;
import com.kekopoly.server.presence.PresenceTracker;
import com.kekopoly.server.presence.SessionInfo;
import com.kekopoly.server.presence.SessionStatus;
import com.kekopoly.server.registry.ConnectOutcome;
import com.kekopoly.server.registry.DisconnectOutcome;
import com.kekopoly.server.registry.GameEvent;
import com.kekopoly.server.registry.GameEventPublisher;
import com.kekopoly.server.registry.HostChange;
import com.kekopoly.server.registry.SessionRegistry;
import com.kekopoly.server.registry.Snapshots;
import com.kekopoly.shared.dto.ActivePlayersDTO;
import com.kekopoly.shared.dto.ErrorDTO;
import com.kekopoly.shared.dto.HostChangedDTO;
import com.kekopoly.shared.dto.HostVerificationDTO;
import com.kekopoly.shared.dto.LobbyGameDTO;
import com.kekopoly.shared.dto.LobbyUpdateDTO;
import com.kekopoly.shared.dto.PlayerInfoDTO;
import com.kekopoly.shared.dto.PlayerPresenceDTO;
import com.kekopoly.shared.dto.PlayerReadyDTO;
import com.kekopoly.shared.dto.PlayerUpdatedDTO;
import com.kekopoly.shared.dto.ReconnectionDTO;
import com.kekopoly.shared.message.InboundMessage;
import com.kekopoly.shared.message.MalformedMessageException;
import com.kekopoly.shared.message.MessageCodec;
import com.kekopoly.shared.util.ActionType;
import com.kekopoly.shared.util.ErrorCode;
import com.kekopoly.shared.util.EventType;
import com.kekopoly.shared.util.GameStatus;
import com.kekopoly.shared.util.Priority;

/**
 * Live sockets per (game, player) and everything delivered to them.
 *
 * <p>Membership changes are applied by a single dispatch thread fed from a
 * bounded command queue; fan-out reads the membership map under a shared
 * lock. Game state is never touched here: inbound messages that change the
 * game are handed to the {@link SessionRegistry}, which publishes back
 * through the {@link GameEventPublisher} methods.
 */
public class ConnectionHub implements GameEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHub.class);

    public static final String LOBBY = "lobby";

    static final int CLOSE_REPLACED = 4001;
    static final int CLOSE_TIMEOUT = 4000;
    static final int CLOSE_NORMAL = 1000;
    static final int CLOSE_GOING_AWAY = 1001;

    private static final Set<String> CHAT_TYPES = Set.of("chat_message", "player_typing");

    private final SessionRegistry registry;
    private final PresenceTracker presence;
    private final MessageCodec codec;
    private final ServerConfig.Hub settings;
    private final Clock clock;
    private final PresentationCache cache = new PresentationCache();

    private final ReentrantReadWriteLock membershipLock = new ReentrantReadWriteLock();
    private final Map<String, Map<String, Client>> members = new HashMap<>();

    private final BlockingQueue<HubCommand> commands;
    private final Thread dispatcher;
    private final ExecutorService writers;
    private volatile boolean running = true;

    public ConnectionHub(SessionRegistry registry, PresenceTracker presence, MessageCodec codec,
                         ServerConfig.Hub settings, Clock clock) {
        this.registry = registry;
        this.presence = presence;
        this.codec = codec;
        this.settings = settings;
        this.clock = clock;
        this.commands = new ArrayBlockingQueue<>(Math.max(1, settings.getCommandQueueCapacity()));

        AtomicInteger writerSeq = new AtomicInteger();
        this.writers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "hub-writer-" + writerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = new Thread(this::dispatchLoop, "hub-dispatch");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
        registry.setEventPublisher(this);
    }

    /* ---------- Membership ---------- */

    private interface HubCommand {}

    private record Register(Client client, CompletableFuture<Client> done) implements HubCommand {}

    private record Unregister(Client client, CompletableFuture<Boolean> done) implements HubCommand {}

    private void dispatchLoop() {
        while (running) {
            HubCommand cmd;
            try {
                cmd = commands.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                if (cmd instanceof Register r) {
                    dispatchRegister(r);
                } else if (cmd instanceof Unregister u) {
                    u.done().complete(applyUnregister(u.client()));
                }
            } catch (RuntimeException e) {
                log.error("[HUB] dispatch failed for {}", cmd, e);
                if (cmd instanceof Register r) r.done().completeExceptionally(e);
                if (cmd instanceof Unregister u) u.done().completeExceptionally(e);
            }
        }
        log.info("[HUB] dispatch loop stopped");
    }

    // The waiter cancels its future on timeout; its client must not stay mapped without a writer.
    private void dispatchRegister(Register r) {
        if (r.done().isDone()) {
            log.warn("[HUB] dropping registration of {} whose caller gave up", r.client());
            r.client().outbox().close();
            return;
        }
        Client previous = applyRegister(r.client());
        if (r.done().complete(previous)) return;

        log.warn("[HUB] registration of {} completed after its caller gave up, rolling back", r.client());
        if (previous != null) {
            handleDisconnect(r.client());
        } else {
            applyUnregister(r.client());
        }
    }

    /** @return the client this one superseded, or null */
    private Client applyRegister(Client client) {
        Client previous;
        membershipLock.writeLock().lock();
        try {
            Map<String, Client> game = members.computeIfAbsent(client.gameId(), k -> new HashMap<>());
            previous = game.remove(client.playerId());
            if (previous != null) previous.outbox().close();
            game.put(client.playerId(), client);
        } finally {
            membershipLock.writeLock().unlock();
        }
        if (previous != null && previous != client) {
            log.info("[HUB] {} superseded by session {}", previous, client.sessionId());
            closeQuietly(previous.channel(), CLOSE_REPLACED, "replaced by new connection");
        }
        return previous;
    }

    private boolean applyUnregister(Client client) {
        membershipLock.writeLock().lock();
        try {
            Map<String, Client> game = members.get(client.gameId());
            if (game == null || game.get(client.playerId()) != client) return false;
            game.remove(client.playerId());
            if (game.isEmpty()) members.remove(client.gameId());
            client.outbox().close();
            return true;
        } finally {
            membershipLock.writeLock().unlock();
        }
    }

    private Client register(Client client) {
        CompletableFuture<Client> done = new CompletableFuture<>();
        submit(new Register(client, done));
        Client previous;
        try {
            previous = await(done);
        } catch (ResourceExhaustedException e) {
            if (done.cancel(false)) {
                client.outbox().close();
                throw e;
            }
            previous = await(done);
        }
        writers.execute(new OutboundPump(client, settings, this::onWriteFailure));
        return previous;
    }

    /** @return true if the client was the mapped instance and has been removed */
    private boolean unregister(Client client) {
        if (Thread.currentThread() == dispatcher) {
            return applyUnregister(client);
        }
        CompletableFuture<Boolean> done = new CompletableFuture<>();
        submit(new Unregister(client, done));
        return await(done);
    }

    private void submit(HubCommand cmd) {
        if (!running) {
            throw new ConnectionException("Hub is shutting down");
        }
        if (!commands.offer(cmd)) {
            throw new ResourceExhaustedException("Hub command queue is full");
        }
    }

    private <T> T await(CompletableFuture<T> done) {
        try {
            return done.get(settings.getRegisterTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted waiting for hub dispatch", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GameException ge) throw ge;
            throw new ConnectionException("Hub dispatch failed", cause);
        } catch (TimeoutException e) {
            throw new ResourceExhaustedException("Hub dispatch timed out");
        }
    }

    /* ---------- Connection lifecycle ---------- */

    /**
     * Binds a freshly opened socket to (game, player). A socket whose session
     * id differs from the player's latest recorded one is a reconnection and
     * receives {@code reconnection_successful} and a full state sync before
     * anything its arrival triggers for the other players.
     */
    public Client handleConnection(ClientChannel channel, String gameId, String playerId, String sessionId) {
        if (LOBBY.equalsIgnoreCase(gameId)) {
            Client watcher = new Client(channel, PriorityOutbox.from(settings), LOBBY, playerId, sessionId, clock.millis());
            register(watcher);
            sendTo(watcher, EventType.LOBBY_UPDATE, lobbySnapshot());
            log.info("[HUB] lobby watcher {} connected from {}", playerId, channel.label());
            return watcher;
        }

        String gid = registry.resolveGameId(gameId);
        SessionInfo latest = presence.getLatestSession(gid, playerId);
        boolean reconnection = latest != null && !latest.sessionId().equals(sessionId);
        presence.recordSession(gid, playerId, sessionId, channel.label(),
            reconnection ? SessionStatus.RECONNECTING : SessionStatus.CONNECTED);

        Client client = new Client(channel, PriorityOutbox.from(settings), gid, playerId, sessionId, clock.millis());
        try {
            register(client);
        } catch (GameException e) {
            presence.updateStatus(gid, playerId, sessionId, SessionStatus.DISCONNECTED);
            throw e;
        }

        ConnectOutcome outcome;
        try {
            outcome = connectToGame(gid, playerId, sessionId);
        } catch (GameException e) {
            unregister(client);
            presence.updateStatus(gid, playerId, sessionId, SessionStatus.DISCONNECTED);
            throw e;
        }
        if (reconnection) {
            presence.updateStatus(gid, playerId, sessionId, SessionStatus.CONNECTED);
            long now = clock.millis();
            sendTo(client, EventType.RECONNECTION_SUCCESSFUL,
                new ReconnectionDTO(gid, playerId, sessionId, latest.sessionId(), now));
            sendTo(client, EventType.COMPLETE_STATE_SYNC, Snapshots.completeState(registry.getGame(gid), now));
        }

        boolean peersNotified = false;
        for (GameEvent e : outcome.events()) {
            if (e.type() == EventType.PLAYER_RECONNECTED) {
                broadcastToGameExcept(gid, playerId, e.type(), e.payload());
                peersNotified = true;
            } else {
                broadcastToGame(gid, e.type(), e.payload());
            }
        }
        if (reconnection && !peersNotified) {
            broadcastToGameExcept(gid, playerId, EventType.PLAYER_RECONNECTED,
                new PlayerPresenceDTO(gid, playerId, clock.millis()));
        }

        cache.ensure(gid, playerId);
        refreshGameInfo(gid);
        broadcastActivePlayers(gid);
        log.info("[HUB] {} connected from {} reconnection={} restored={}", client, channel.label(), reconnection, outcome.restored());
        return client;
    }

    // A player opening a socket for a lobby they have not joined yet is seated first.
    private ConnectOutcome connectToGame(String gameId, String playerId, String sessionId) {
        try {
            return registry.playerConnected(gameId, playerId, sessionId);
        } catch (NotFoundException e) {
            Game g = registry.getGame(gameId);
            if (g.getStatus() != GameStatus.LOBBY || g.player(playerId) != null) throw e;
            registry.joinGame(gameId, playerId);
            return registry.playerConnected(gameId, playerId, sessionId);
        }
    }

    /**
     * Teardown for a socket that closed, failed or went silent. Only the
     * currently mapped client for its (game, player) triggers the registry
     * disconnect; a superseded one is ignored.
     */
    public void handleDisconnect(Client client) {
        if (client == null) return;
        boolean removed;
        try {
            removed = unregister(client);
        } catch (GameException e) {
            log.warn("[HUB] could not unregister {}: {}", client, e.getMessage());
            return;
        }
        if (!removed || LOBBY.equals(client.gameId())) return;

        String gid = client.gameId();
        String pid = client.playerId();
        DisconnectOutcome outcome;
        try {
            outcome = registry.playerDisconnected(gid, pid);
        } catch (NotFoundException e) {
            log.debug("[HUB] {} left a game the registry no longer has: {}", client, e.getMessage());
            presence.updateStatus(gid, pid, client.sessionId(), SessionStatus.DISCONNECTED);
            return;
        }
        presence.updateStatus(gid, pid, client.sessionId(), SessionStatus.DISCONNECTED);
        if (outcome.hostChanged()) {
            broadcastToGame(gid, EventType.HOST_CHANGED,
                new HostChangedDTO(gid, outcome.newHostId(), outcome.previousHostId()));
        }
        if (outcome.changed()) {
            broadcastToGame(gid, EventType.PLAYER_DISCONNECTED, new PlayerPresenceDTO(gid, pid, clock.millis()));
        }
        refreshGameInfo(gid);
        broadcastActivePlayers(gid);
        log.info("[HUB] {} disconnected host={} abandoned={}", client, outcome.newHostId(), outcome.abandoned());
    }

    public void markPong(Client client) {
        if (client != null) client.markPong(clock.millis());
    }

    /** @return number of clients torn down */
    public int checkInactiveClients(Duration threshold) {
        long cutoff = clock.millis() - threshold.toMillis();
        List<Client> stale = new ArrayList<>();
        for (Client c : allClients()) {
            if (c.lastPongTime() < cutoff) stale.add(c);
        }
        for (Client c : stale) {
            log.info("[HB] {} silent since {}, disconnecting", c, c.lastPongTime());
            handleDisconnect(c);
            closeQuietly(c.channel(), CLOSE_TIMEOUT, "heartbeat timeout");
        }
        return stale.size();
    }

    /* ---------- Inbound ---------- */

    public void handleMessage(Client client, String frame) {
        InboundMessage msg;
        try {
            msg = codec.decode(frame);
        } catch (MalformedMessageException e) {
            sendError(client, ErrorCode.VALIDATION, e.getMessage(), null);
            return;
        }
        if (!LOBBY.equals(client.gameId())) {
            presence.touch(client.gameId(), client.playerId(), client.sessionId());
        }
        try {
            dispatch(client, msg);
        } catch (GameException e) {
            log.debug("[HUB] {} rejected for {}: {}", msg.type(), client, e.getMessage());
            sendError(client, e.getCode(), e.getMessage(), requestIdOf(msg));
        }
    }

    private void dispatch(Client client, InboundMessage msg) {
        String gid = client.gameId();
        String pid = client.playerId();

        if (msg instanceof InboundMessage.HeartbeatAck) {
            markPong(client);
            return;
        }
        if (LOBBY.equals(gid)) {
            sendError(client, ErrorCode.VALIDATION, "Lobby connections only receive lobby updates", null);
            return;
        }

        if (msg instanceof InboundMessage.VerifyHost v) {
            String claimed = v.playerId() != null ? v.playerId() : pid;
            String hostId = registry.getGame(gid).getHostId();
            boolean ok = claimed.equals(pid) && pid.equals(hostId);
            sendTo(client, EventType.HOST_VERIFICATION,
                new HostVerificationDTO(gid, ok, hostId, ok ? "You are the host" : "You are not the host"));
        } else if (msg instanceof InboundMessage.StartGame) {
            registry.startGame(gid, pid);
            refreshGameInfo(gid);
            broadcastActivePlayers(gid);
        } else if (msg instanceof InboundMessage.PlayerJoined j) {
            PlayerInfoDTO info = cache.update(gid, pid, current -> current.merge(j.player()));
            sendTo(client, EventType.PLAYER_JOINED_ACK, new PlayerUpdatedDTO(gid, info));
            broadcastToGameExcept(gid, pid, EventType.PLAYER_JOINED, new PlayerUpdatedDTO(gid, info));
            broadcastActivePlayers(gid);
        } else if (msg instanceof InboundMessage.GetActivePlayers) {
            sendTo(client, EventType.ACTIVE_PLAYERS, activePlayers(gid));
        } else if (msg instanceof InboundMessage.RollDice r) {
            registry.processAction(new GameAction(ActionType.ROLL_DICE, gid, pid, r.requestId(), null));
        } else if (msg instanceof InboundMessage.GameAction a) {
            registry.processAction(new GameAction(a.action(), gid, pid, a.requestId(), a.data()));
        } else if (msg instanceof InboundMessage.UpdatePlayerInfo u) {
            PlayerInfoDTO info = cache.update(gid, pid, current -> current.merge(u.info()));
            if (u.info().token() != null) {
                registry.updatePlayerToken(gid, pid, u.info().token());
            }
            broadcastToGame(gid, EventType.PLAYER_UPDATED, new PlayerUpdatedDTO(gid, info));
        } else if (msg instanceof InboundMessage.PlayerReady r) {
            cache.update(gid, pid, current -> current.withReady(r.ready()));
            broadcastToGame(gid, EventType.PLAYER_READY, new PlayerReadyDTO(gid, pid, r.ready(), r.messageId()));
        } else if (msg instanceof InboundMessage.GetGameState) {
            sendTo(client, EventType.GAME_STATE_UPDATE, Snapshots.completeState(registry.getGame(gid), clock.millis()));
        } else if (msg instanceof InboundMessage.SetHost s) {
            HostChange change = registry.transferHost(gid, pid, s.hostId());
            HostChangedDTO dto = new HostChangedDTO(gid, change.newHostId(), change.previousHostId());
            broadcastToGame(gid, EventType.HOST_CHANGED, dto);
            sendTo(client, EventType.HOST_SET_CONFIRMED, dto);
            refreshGameInfo(gid);
            broadcastActivePlayers(gid);
        } else if (msg instanceof InboundMessage.LeaveGame) {
            handleDisconnect(client);
            closeQuietly(client.channel(), CLOSE_NORMAL, "left game");
        } else if (msg instanceof InboundMessage.Unrecognized u) {
            if (!settings.isRelayUnknownMessages()) {
                sendError(client, ErrorCode.VALIDATION, "Unknown message type " + u.type(), null);
                return;
            }
            Priority priority = CHAT_TYPES.contains(u.type()) ? Priority.LOW : Priority.NORMAL;
            for (Client peer : clientsOf(gid)) {
                if (peer != client) deliver(peer, u.rawFrame(), priority);
            }
        }
    }

    private static String requestIdOf(InboundMessage msg) {
        if (msg instanceof InboundMessage.RollDice r) return r.requestId();
        if (msg instanceof InboundMessage.GameAction a) return a.requestId();
        if (msg instanceof InboundMessage.PlayerReady r) return r.messageId();
        return null;
    }

    /* ---------- Outbound ---------- */

    @Override
    public void broadcastToGame(String gameId, EventType type, Object payload) {
        String frame = encode(type, payload);
        if (frame == null) return;
        for (Client c : clientsOf(gameId)) {
            deliver(c, frame, type.priority());
        }
    }

    @Override
    public void broadcastToGameExcept(String gameId, String excludedPlayerId, EventType type, Object payload) {
        String frame = encode(type, payload);
        if (frame == null) return;
        for (Client c : clientsOf(gameId)) {
            if (!c.playerId().equals(excludedPlayerId)) deliver(c, frame, type.priority());
        }
    }

    @Override
    public void broadcastToLobby(EventType type, Object payload) {
        broadcastToGame(LOBBY, type, payload);
    }

    @Override
    public boolean sendToPlayerWithPriority(String gameId, String playerId, EventType type, Object payload, Priority priority) {
        Client c = clientOf(gameId, playerId);
        if (c == null) return false;
        String frame = encode(type, payload);
        return frame != null && deliver(c, frame, priority).delivered();
    }

    private void sendTo(Client client, EventType type, Object payload) {
        String frame = encode(type, payload);
        if (frame != null) deliver(client, frame, type.priority());
    }

    private void sendError(Client client, ErrorCode code, String message, String requestId) {
        sendTo(client, EventType.ERROR, new ErrorDTO(code.wireName(), message, requestId));
    }

    private DeliveryOutcome deliver(Client client, String frame, Priority priority) {
        DeliveryOutcome outcome = client.outbox().offer(frame, priority);
        if (outcome == DeliveryOutcome.DROPPED) {
            log.warn("[HUB] outbound queues full for {}, dropped {} frame", client, priority);
        } else if (outcome == DeliveryOutcome.EVICTED_OLDEST || outcome == DeliveryOutcome.ESCALATED) {
            log.debug("[HUB] backpressure on {}: {}", client, outcome);
        }
        return outcome;
    }

    private String encode(EventType type, Object payload) {
        try {
            return codec.encode(type.wireName(), payload);
        } catch (JsonProcessingException e) {
            log.error("[HUB] could not serialize {}", type.wireName(), e);
            return null;
        }
    }

    private void onWriteFailure(Client client, Exception cause) {
        log.info("[HUB] write to {} failed ({}), tearing down", client, cause.getMessage());
        handleDisconnect(client);
    }

    /* ---------- Presentation ---------- */

    public void broadcastActivePlayers(String gameId) {
        ActivePlayersDTO dto;
        try {
            dto = activePlayers(gameId);
        } catch (NotFoundException e) {
            return;
        }
        broadcastToGame(gameId, EventType.ACTIVE_PLAYERS, dto);
    }

    private ActivePlayersDTO activePlayers(String gameId) {
        Game g = registry.getGame(gameId);
        List<PlayerInfoDTO> players = new ArrayList<>();
        for (Client c : clientsOf(gameId)) {
            if (g.player(c.playerId()) == null) continue;
            players.add(cache.player(gameId, c.playerId()).withHost(c.playerId().equals(g.getHostId())));
        }
        return new ActivePlayersDTO(g.getId(), g.getHostId(), g.getMaxPlayers(), g.getStatus(),
            g.getStatus() != GameStatus.LOBBY, players);
    }

    private void refreshGameInfo(String gameId) {
        try {
            cache.putGameInfo(Snapshots.gameInfo(registry.getGame(gameId)));
        } catch (NotFoundException e) {
            cache.evict(gameId);
        }
    }

    /**
     * Re-reads every connected game from the registry and rebroadcasts its
     * player list, which also repairs any dropped presence update.
     */
    public void refreshGameInfoCache() {
        Set<String> live = connectedGames();
        cache.retain(live);
        for (String gid : live) {
            if (LOBBY.equals(gid)) continue;
            if (!registry.isLive(gid)) {
                cache.evict(gid);
                continue;
            }
            refreshGameInfo(gid);
            broadcastActivePlayers(gid);
        }
    }

    PresentationCache cache() {
        return cache;
    }

    private LobbyUpdateDTO lobbySnapshot() {
        List<LobbyGameDTO> games = new ArrayList<>();
        for (Game g : registry.listAvailableGames()) games.add(Snapshots.lobbyGame(g));
        return new LobbyUpdateDTO(games);
    }

    /* ---------- Membership reads ---------- */

    public Client clientOf(String gameId, String playerId) {
        membershipLock.readLock().lock();
        try {
            Map<String, Client> game = members.get(gameId);
            return game == null ? null : game.get(playerId);
        } finally {
            membershipLock.readLock().unlock();
        }
    }

    public List<Client> clientsOf(String gameId) {
        membershipLock.readLock().lock();
        try {
            Map<String, Client> game = members.get(gameId);
            return game == null ? List.of() : List.copyOf(game.values());
        } finally {
            membershipLock.readLock().unlock();
        }
    }

    private List<Client> allClients() {
        membershipLock.readLock().lock();
        try {
            List<Client> all = new ArrayList<>();
            for (Map<String, Client> game : members.values()) all.addAll(game.values());
            return all;
        } finally {
            membershipLock.readLock().unlock();
        }
    }

    private Set<String> connectedGames() {
        membershipLock.readLock().lock();
        try {
            return Set.copyOf(members.keySet());
        } finally {
            membershipLock.readLock().unlock();
        }
    }

    /* ---------- Shutdown ---------- */

    public void shutdown() {
        running = false;
        dispatcher.interrupt();
        List<Client> all = allClients();
        membershipLock.writeLock().lock();
        try {
            members.clear();
        } finally {
            membershipLock.writeLock().unlock();
        }
        for (Client c : all) {
            c.outbox().close();
            closeQuietly(c.channel(), CLOSE_GOING_AWAY, "server shutting down");
        }
        writers.shutdownNow();
        log.info("[HUB] shut down, closed {} client(s)", all.size());
    }

    private static void closeQuietly(ClientChannel channel, int code, String reason) {
        try {
            if (channel.isOpen()) channel.close(code, reason);
        } catch (RuntimeException e) {
            log.debug("[HUB] close of {} failed: {}", channel.label(), e.getMessage());
        }
    }
}
