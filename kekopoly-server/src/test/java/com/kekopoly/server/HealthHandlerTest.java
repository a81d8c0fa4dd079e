package com.kekopoly.server;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.io.ByteArrayOutputStream;

import org.junit.jupiter.api.Test;

import com.kekopoly.server.error.PersistenceException;
import com.kekopoly.server.store.GameStore;
import com.kekopoly.server.store.InMemoryGameStore;
import com.sun.net.httpserver.HttpExchange;

public class HealthHandlerTest {

    @Test
    public void testHealthyStoreAnswersOk() throws Exception {
        HealthHandler handler = new HealthHandler(new InMemoryGameStore());
        HttpExchange exchange = mock(HttpExchange.class);
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        when(exchange.getResponseBody()).thenReturn(body);
        try {
            handler.handle(exchange);
        } finally {
            handler.shutdown();
        }

        verify(exchange).sendResponseHeaders(200, 3);
        assertEquals("OK\n", body.toString("UTF-8"));
    }

    @Test
    public void testFailingStoreIsUnavailable() throws Exception {
        GameStore store = mock(GameStore.class);
        when(store.ping()).thenThrow(new PersistenceException("down"));
        HealthHandler handler = new HealthHandler(store);
        try {
            assertFalse(handler.storeAnswers());
        } finally {
            handler.shutdown();
        }
    }
}
