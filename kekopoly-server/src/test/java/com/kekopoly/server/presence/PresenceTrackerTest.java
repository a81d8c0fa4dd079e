package com.kekopoly.server.presence;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.kekopoly.server.support.MutableClock;

public class PresenceTrackerTest {

    private MutableClock clock;
    private PresenceTracker tracker;

    @BeforeEach
    public void setup() {
        clock = new MutableClock();
        tracker = new PresenceTracker(clock);
    }

    @Test
    public void testUnknownPlayerHasNoHistory() {
        assertFalse(tracker.hasHistory("g1", "p1"));
        assertNull(tracker.getLatestSession("g1", "p1"));
        assertNull(tracker.getActiveSession("g1", "p1"));
        assertTrue(tracker.getAllSessions("g1", "p1").isEmpty());
        assertFalse(tracker.updateStatus("g1", "p1", "s1", SessionStatus.DISCONNECTED));
    }

    @Test
    public void testNewSessionClosesPreviousConnectedOne() {
        tracker.recordSession("g1", "p1", "s1", "web", SessionStatus.CONNECTED);
        clock.advance(Duration.ofSeconds(5));

        tracker.recordSession("g1", "p1", "s2", "web", SessionStatus.CONNECTED);

        List<SessionInfo> all = tracker.getAllSessions("g1", "p1");
        assertEquals(2, all.size());
        assertEquals(SessionStatus.DISCONNECTED, all.get(0).status());
        assertNotNull(all.get(0).disconnectedAt());
        assertEquals("s2", tracker.getActiveSession("g1", "p1").sessionId());
        assertEquals("s2", tracker.getLatestSession("g1", "p1").sessionId());
    }

    @Test
    public void testLatestPrefersLaterEntryOnTie() {
        tracker.recordSession("g1", "p1", "s1", "web", SessionStatus.DISCONNECTED);
        tracker.recordSession("g1", "p1", "s2", "web", SessionStatus.RECONNECTING);

        assertEquals("s2", tracker.getLatestSession("g1", "p1").sessionId());
        assertNull(tracker.getActiveSession("g1", "p1"));
    }

    @Test
    public void testUpdateStatusAndTouch() {
        tracker.recordSession("g1", "p1", "s1", "web", SessionStatus.RECONNECTING);
        clock.advance(Duration.ofSeconds(3));

        assertTrue(tracker.updateStatus("g1", "p1", "s1", SessionStatus.CONNECTED));
        clock.advance(Duration.ofSeconds(3));
        tracker.touch("g1", "p1", "s1");

        SessionInfo s = tracker.getActiveSession("g1", "p1");
        assertEquals(SessionStatus.CONNECTED, s.status());
        assertEquals(clock.instant(), s.lastActivity());
        assertNull(s.disconnectedAt());
    }

    @Test
    public void testGameIdsAreCaseInsensitiveAndClearable() {
        tracker.recordSession("ABC", "p1", "s1", "web", SessionStatus.CONNECTED);

        assertTrue(tracker.hasHistory("abc", "p1"));

        tracker.clear("Abc");
        assertFalse(tracker.hasHistory("abc", "p1"));
    }
}
