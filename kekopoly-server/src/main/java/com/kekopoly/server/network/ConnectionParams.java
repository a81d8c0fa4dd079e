package com.kekopoly.server.network;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.kekopoly.server.error.ValidationException;

/**
 * Identity carried by the upgrade request: {@code /ws/{gameId}?playerId=..&sessionId=..}
 * or {@code /ws?gameId=..&playerId=..}. A missing session id gets a fresh one.
 */
record ConnectionParams(String gameId, String playerId, String sessionId) {

    static ConnectionParams parse(String resource) {
        if (resource == null) {
            throw new ValidationException("Missing request path");
        }
        String path = resource;
        String query = "";
        int q = resource.indexOf('?');
        if (q >= 0) {
            path = resource.substring(0, q);
            query = resource.substring(q + 1);
        }
        Map<String, String> params = new HashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(decode(key), decode(value));
        }

        String gameId = params.get("gameId");
        if (isBlank(gameId)) {
            String[] segments = path.split("/");
            String last = segments.length == 0 ? "" : segments[segments.length - 1];
            if (!last.isEmpty() && !"ws".equals(last)) gameId = decode(last);
        }
        String playerId = params.get("playerId");
        if (isBlank(gameId)) {
            throw new ValidationException("gameId is required");
        }
        if (isBlank(playerId)) {
            throw new ValidationException("playerId is required");
        }
        String sessionId = params.get("sessionId");
        if (isBlank(sessionId)) sessionId = UUID.randomUUID().toString();
        return new ConnectionParams(gameId.trim().toLowerCase(), playerId.trim(), sessionId.trim());
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Bad query encoding: " + s, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
