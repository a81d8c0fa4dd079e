package com.kekopoly.server.hub;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.kekopoly.server.config.ServerConfig;
import com.kekopoly.server.error.NotFoundException;
import com.kekopoly.server.error.ResourceExhaustedException;
import com.kekopoly.server.presence.PresenceTracker;
import com.kekopoly.server.presence.SessionStatus;
import com.kekopoly.server.registry.SessionRegistry;
import com.kekopoly.server.rules.StandardRuleBook;
import com.kekopoly.server.store.InMemoryGameStore;
import com.kekopoly.server.support.ManualTaskScheduler;
import com.kekopoly.server.support.MutableClock;
import com.kekopoly.server.support.RecordingChannel;
import com.kekopoly.server.support.ScriptedDiceRoller;
import com.kekopoly.shared.message.MessageCodec;
import com.kekopoly.shared.util.ErrorCode;
import com.kekopoly.shared.util.EventType;
import com.kekopoly.shared.util.PlayerStatus;
import com.kekopoly.shared.util.Priority;

public class ConnectionHubTest {

    private static final long WAIT = 2000;

    private MutableClock clock;
    private PresenceTracker presence;
    private ServerConfig config;
    private SessionRegistry registry;
    private ConnectionHub hub;

    @BeforeEach
    public void setup() {
        clock = new MutableClock();
        presence = new PresenceTracker(clock);
        config = new ServerConfig();
        config.getHub().setMinSendIntervalMillis(0);
        registry = new SessionRegistry(new InMemoryGameStore(), null, new StandardRuleBook(16), new ScriptedDiceRoller(),
            new ManualTaskScheduler(), presence, clock, config);
        hub = new ConnectionHub(registry, presence, new MessageCodec(), config.getHub(), clock);
    }

    @AfterEach
    public void tearDown() {
        hub.shutdown();
        registry.shutdown();
    }

    private Client connect(RecordingChannel channel, String gameId, String playerId, String sessionId) {
        return hub.handleConnection(channel, gameId, playerId, sessionId);
    }

    /** Channel whose close blocks until released, stalling the dispatcher that closes it. */
    private static class StuckChannel extends RecordingChannel {
        private final CountDownLatch release = new CountDownLatch(1);

        StuckChannel(String label) {
            super(label);
        }

        @Override
        public void close(int code, String reason) {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            super.close(code, reason);
        }
    }

    @Test
    public void testConnectionIsRegisteredAndSeesPlayerList() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel ch = new RecordingChannel("host");

        Client client = connect(ch, gid, "host1", "s1");

        assertSame(client, hub.clientOf(gid, "host1"));
        assertTrue(ch.awaitType("active_players", 1, WAIT));
        JsonNode payload = ch.messagesOfType("active_players").get(0).path("payload");
        assertEquals("host1", payload.path("hostId").asText());
        assertEquals(1, payload.path("players").size());
        assertTrue(payload.path("players").get(0).path("host").asBoolean());
        assertEquals(SessionStatus.CONNECTED, presence.getLatestSession(gid, "host1").status());
    }

    @Test
    public void testConnectingToUnjoinedLobbySeatsThePlayer() {
        String gid = registry.createGame("host1", "Test", 4);

        connect(new RecordingChannel("p2"), gid, "p2", "s2");

        assertNotNull(registry.getGame(gid).player("p2"));
    }

    @Test
    public void testTimedOutRegistrationLeavesNoClientBehind() {
        config.getHub().setRegisterTimeoutMillis(200);
        String gid = registry.createGame("host1", "Test", 4);
        registry.joinGame(gid, "p2");
        StuckChannel stuck = new StuckChannel("stuck");
        connect(stuck, gid, "host1", "s1");

        assertThrows(ResourceExhaustedException.class,
            () -> connect(new RecordingChannel("late-host"), gid, "host1", "s2"));
        assertThrows(ResourceExhaustedException.class,
            () -> connect(new RecordingChannel("late-p2"), gid, "p2", "s3"));
        assertEquals(SessionStatus.DISCONNECTED, presence.getLatestSession(gid, "p2").status());

        stuck.release.countDown();
        config.getHub().setRegisterTimeoutMillis(5000);
        Client p2 = connect(new RecordingChannel("p2"), gid, "p2", "s4");

        assertEquals(ConnectionHub.CLOSE_REPLACED, stuck.closeCode());
        assertNull(hub.clientOf(gid, "host1"));
        assertSame(p2, hub.clientOf(gid, "p2"));
        assertEquals(List.of(p2), hub.clientsOf(gid));
    }

    @Test
    public void testConnectingToUnknownGameFails() {
        RecordingChannel ch = new RecordingChannel("x");

        assertThrows(NotFoundException.class, () -> connect(ch, "nosuchgame", "p1", "s1"));
        assertNull(hub.clientOf("nosuchgame", "p1"));
    }

    @Test
    public void testNewSocketSupersedesOldOne() {
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel first = new RecordingChannel("first");
        RecordingChannel second = new RecordingChannel("second");
        Client old = connect(first, gid, "host1", "s1");

        Client current = connect(second, gid, "host1", "s2");

        assertEquals(ConnectionHub.CLOSE_REPLACED, first.closeCode());
        assertTrue(old.outbox().isClosed());
        assertSame(current, hub.clientOf(gid, "host1"));

        hub.handleDisconnect(old);

        assertSame(current, hub.clientOf(gid, "host1"));
        assertEquals(PlayerStatus.ACTIVE, registry.getGame(gid).player("host1").getStatus());
    }

    @Test
    public void testReconnectionGetsAckAndSyncFirst() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel hostCh = new RecordingChannel("host");
        connect(hostCh, gid, "host1", "h1");
        Client p2 = connect(new RecordingChannel("p2-old"), gid, "p2", "s2");
        registry.startGame(gid, "host1");
        hub.handleDisconnect(p2);
        assertEquals(PlayerStatus.DISCONNECTED, registry.getGame(gid).player("p2").getStatus());

        RecordingChannel fresh = new RecordingChannel("p2-new");
        connect(fresh, gid, "p2", "s3");

        assertTrue(fresh.awaitType("active_players", 1, WAIT));
        List<String> types = fresh.types();
        assertEquals("reconnection_successful", types.get(0));
        assertEquals("complete_state_sync", types.get(1));
        assertEquals("s2", fresh.messagesOfType("reconnection_successful").get(0).path("payload").path("previousSessionId").asText());
        assertFalse(types.contains("player_reconnected"));
        assertTrue(hostCh.awaitType("player_reconnected", 1, WAIT));
        assertEquals(PlayerStatus.ACTIVE, registry.getGame(gid).player("p2").getStatus());
        assertEquals(SessionStatus.CONNECTED, presence.getLatestSession(gid, "p2").status());
    }

    @Test
    public void testHostDisconnectAnnouncesNewHostOnce() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        Client host = connect(new RecordingChannel("host"), gid, "host1", "h1");
        RecordingChannel p2 = new RecordingChannel("p2");
        RecordingChannel p3 = new RecordingChannel("p3");
        connect(p2, gid, "p2", "s2");
        connect(p3, gid, "p3", "s3");
        registry.startGame(gid, "host1");

        hub.handleDisconnect(host);

        assertTrue(p2.awaitType("player_disconnected", 1, WAIT));
        List<JsonNode> changes = p2.messagesOfType("host_changed");
        assertEquals(1, changes.size());
        String newHost = registry.getGame(gid).getHostId();
        assertNotEquals("host1", newHost);
        assertEquals(newHost, changes.get(0).path("payload").path("hostId").asText());
        assertEquals("host1", changes.get(0).path("payload").path("previousHostId").asText());
        assertNull(hub.clientOf(gid, "host1"));
        assertEquals(SessionStatus.DISCONNECTED, presence.getLatestSession(gid, "host1").status());
    }

    @Test
    public void testUnknownMessagesAreRelayedToPeers() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel host = new RecordingChannel("host");
        RecordingChannel p2 = new RecordingChannel("p2");
        Client sender = connect(host, gid, "host1", "h1");
        connect(p2, gid, "p2", "s2");
        String chat = "{\"type\":\"chat_message\",\"payload\":{\"text\":\"gm\"}}";

        hub.handleMessage(sender, chat);

        assertTrue(p2.awaitType("chat_message", 1, WAIT));
        assertTrue(p2.frames().contains(chat));
        assertFalse(host.types().contains("chat_message"));
    }

    @Test
    public void testUnknownMessageIsRejectedWhenRelayIsOff() throws Exception {
        config.getHub().setRelayUnknownMessages(false);
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel host = new RecordingChannel("host");
        Client sender = connect(host, gid, "host1", "h1");

        hub.handleMessage(sender, "{\"type\":\"emote\"}");

        assertTrue(host.awaitType("error", 1, WAIT));
        assertEquals(ErrorCode.VALIDATION.wireName(),
            host.messagesOfType("error").get(0).path("payload").path("code").asText());
    }

    @Test
    public void testMalformedFrameAnswersWithValidationError() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel host = new RecordingChannel("host");
        Client sender = connect(host, gid, "host1", "h1");

        hub.handleMessage(sender, "not json");

        assertTrue(host.awaitType("error", 1, WAIT));
        assertEquals("validation", host.messagesOfType("error").get(0).path("payload").path("code").asText());
    }

    @Test
    public void testRejectedActionCarriesRequestId() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel hostCh = new RecordingChannel("host");
        RecordingChannel p2Ch = new RecordingChannel("p2");
        Client host = connect(hostCh, gid, "host1", "h1");
        Client p2 = connect(p2Ch, gid, "p2", "s2");
        registry.startGame(gid, "host1");
        String waiting = registry.getGame(gid).getCurrentTurn().equals("host1") ? "p2" : "host1";
        Client offTurn = waiting.equals("p2") ? p2 : host;
        RecordingChannel offTurnCh = waiting.equals("p2") ? p2Ch : hostCh;

        hub.handleMessage(offTurn, "{\"type\":\"roll_dice\",\"payload\":{\"requestId\":\"r1\"}}");

        assertTrue(offTurnCh.awaitType("error", 1, WAIT));
        JsonNode error = offTurnCh.messagesOfType("error").get(0).path("payload");
        assertEquals("state_conflict", error.path("code").asText());
        assertEquals("r1", error.path("requestId").asText());
    }

    @Test
    public void testRollIsBroadcastToEveryone() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel hostCh = new RecordingChannel("host");
        RecordingChannel p2Ch = new RecordingChannel("p2");
        Client host = connect(hostCh, gid, "host1", "h1");
        Client p2 = connect(p2Ch, gid, "p2", "s2");
        hub.handleMessage(host, "{\"type\":\"game:start\"}");
        Client current = registry.getGame(gid).getCurrentTurn().equals("host1") ? host : p2;

        hub.handleMessage(current, "{\"type\":\"roll_dice\"}");

        assertTrue(hostCh.awaitType("dice_rolled", 1, WAIT));
        assertTrue(p2Ch.awaitType("dice_rolled", 1, WAIT));
        assertTrue(p2Ch.types().indexOf("game_started") < p2Ch.types().indexOf("dice_rolled"));
    }

    @Test
    public void testVerifyHost() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel hostCh = new RecordingChannel("host");
        RecordingChannel p2Ch = new RecordingChannel("p2");
        Client host = connect(hostCh, gid, "host1", "h1");
        Client p2 = connect(p2Ch, gid, "p2", "s2");

        hub.handleMessage(host, "{\"type\":\"verify_host\"}");
        hub.handleMessage(p2, "{\"type\":\"verify_host\"}");

        assertTrue(hostCh.awaitType("host_verification", 1, WAIT));
        assertTrue(p2Ch.awaitType("host_verification", 1, WAIT));
        assertTrue(hostCh.messagesOfType("host_verification").get(0).path("payload").path("success").asBoolean());
        assertFalse(p2Ch.messagesOfType("host_verification").get(0).path("payload").path("success").asBoolean());
    }

    @Test
    public void testPlayerInfoIsCachedAndBroadcast() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        RecordingChannel hostCh = new RecordingChannel("host");
        Client host = connect(hostCh, gid, "host1", "h1");

        hub.handleMessage(host, "{\"type\":\"update_player_info\",\"payload\":{\"name\":\"Alice\",\"token\":\"pepe\"}}");

        assertTrue(hostCh.awaitType("player_updated", 1, WAIT));
        assertEquals("Alice", hub.cache().player(gid, "host1").name());
        assertEquals("pepe", registry.getGame(gid).player("host1").getCharacterToken());
    }

    @Test
    public void testSilentClientIsDisconnected() {
        String gid = registry.createGame("host1", "Test", 4);
        Client host = connect(new RecordingChannel("host"), gid, "host1", "h1");
        RecordingChannel quiet = new RecordingChannel("p2");
        connect(quiet, gid, "p2", "s2");
        clock.advance(Duration.ofSeconds(100));
        hub.markPong(host);

        int removed = hub.checkInactiveClients(Duration.ofSeconds(90));

        assertEquals(1, removed);
        assertEquals(ConnectionHub.CLOSE_TIMEOUT, quiet.closeCode());
        assertNull(hub.clientOf(gid, "p2"));
        assertSame(host, hub.clientOf(gid, "host1"));
        assertEquals(PlayerStatus.DISCONNECTED, registry.getGame(gid).player("p2").getStatus());
    }

    @Test
    public void testLeaveGameClosesSocket() {
        String gid = registry.createGame("host1", "Test", 4);
        connect(new RecordingChannel("host"), gid, "host1", "h1");
        RecordingChannel p2Ch = new RecordingChannel("p2");
        Client p2 = connect(p2Ch, gid, "p2", "s2");

        hub.handleMessage(p2, "{\"type\":\"leave_game\"}");

        assertEquals(ConnectionHub.CLOSE_NORMAL, p2Ch.closeCode());
        assertNull(hub.clientOf(gid, "p2"));
        assertEquals(PlayerStatus.DISCONNECTED, registry.getGame(gid).player("p2").getStatus());
    }

    @Test
    public void testFailedWriteTearsDownClient() throws Exception {
        String gid = registry.createGame("host1", "Test", 4);
        connect(new RecordingChannel("host"), gid, "host1", "h1");
        RecordingChannel broken = new RecordingChannel("p2");
        connect(broken, gid, "p2", "s2");
        broken.failSends();

        hub.broadcastActivePlayers(gid);

        long deadline = System.currentTimeMillis() + WAIT;
        while (hub.clientOf(gid, "p2") != null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertNull(hub.clientOf(gid, "p2"));
        assertEquals(PlayerStatus.DISCONNECTED, registry.getGame(gid).player("p2").getStatus());
    }

    @Test
    public void testLobbyWatcherFollowsGameListings() throws Exception {
        RecordingChannel watcher = new RecordingChannel("watcher");
        connect(watcher, "lobby", "w1", "ws");
        assertTrue(watcher.awaitType("lobby_update", 1, WAIT));

        registry.createGame("host1", "Test", 4);

        assertTrue(watcher.awaitType("lobby_update", 2, WAIT));
        JsonNode latest = watcher.messagesOfType("lobby_update").get(1).path("payload");
        assertEquals(1, latest.path("games").size());
    }

    @Test
    public void testSendToPlayerRequiresLiveClient() {
        String gid = registry.createGame("host1", "Test", 4);
        connect(new RecordingChannel("host"), gid, "host1", "h1");

        assertTrue(hub.sendToPlayerWithPriority(gid, "host1", EventType.PLAYER_UPDATED,
            null, Priority.LOW));
        assertFalse(hub.sendToPlayerWithPriority(gid, "ghost", EventType.PLAYER_UPDATED,
            null, Priority.LOW));
    }

    @Test
    public void testCacheRefreshDropsGamesWithoutSockets() {
        String gid = registry.createGame("host1", "Test", 4);
        Client host = connect(new RecordingChannel("host"), gid, "host1", "h1");
        assertNotNull(hub.cache().gameInfo(gid));

        hub.handleDisconnect(host);
        hub.refreshGameInfoCache();

        assertNull(hub.cache().gameInfo(gid));
    }
}
