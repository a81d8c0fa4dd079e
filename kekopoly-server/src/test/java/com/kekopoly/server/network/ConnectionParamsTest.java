package com.kekopoly.server.network;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.kekopoly.server.error.ValidationException;

public class ConnectionParamsTest {

    @Test
    public void testGameIdFromPath() {
        ConnectionParams p = ConnectionParams.parse("/ws/ABC123?playerId=alice&sessionId=s-1");

        assertEquals("abc123", p.gameId());
        assertEquals("alice", p.playerId());
        assertEquals("s-1", p.sessionId());
    }

    @Test
    public void testGameIdFromQuery() {
        ConnectionParams p = ConnectionParams.parse("/ws?gameId=g42&playerId=bob%20smith");

        assertEquals("g42", p.gameId());
        assertEquals("bob smith", p.playerId());
        assertFalse(p.sessionId().isBlank());
    }

    @Test
    public void testLobbyPath() {
        assertEquals("lobby", ConnectionParams.parse("/ws/lobby?playerId=w").gameId());
    }

    @Test
    public void testMissingIdsAreRejected() {
        assertThrows(ValidationException.class, () -> ConnectionParams.parse("/ws?playerId=alice"));
        assertThrows(ValidationException.class, () -> ConnectionParams.parse("/ws/g1"));
        assertThrows(ValidationException.class, () -> ConnectionParams.parse("/ws/g1?playerId=%zz"));
        assertThrows(ValidationException.class, () -> ConnectionParams.parse(null));
    }
}
