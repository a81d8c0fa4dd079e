package com.kekopoly.server.network;

import java.net.InetSocketAddress;

import org.java_websocket.WebSocket;
import org.java_websocket.framing.Framedata;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.kekopoly.server.error.GameException;
import com.kekopoly.server.hub.Client;
import com.kekopoly.server.hub.ConnectionHub;
import com.kekopoly.shared.dto.ErrorDTO;
import com.kekopoly.shared.message.MessageCodec;
import com.kekopoly.shared.util.EventType;

/**
 * Socket front end. Each connection is bound to a hub {@link Client} on
 * open, kept as the socket's attachment, and torn down through the hub
 * when it closes or errors.
 */
public class GameWebSocketServer extends WebSocketServer {

    private static final Logger log = LoggerFactory.getLogger(GameWebSocketServer.class);

    private static final int CLOSE_POLICY = 1008;

    private final ConnectionHub hub;
    private final MessageCodec codec;
    private final int connectionLostTimeoutSeconds;

    public GameWebSocketServer(InetSocketAddress address, ConnectionHub hub, MessageCodec codec, int connectionLostTimeoutSeconds) {
        super(address);
        this.hub = hub;
        this.codec = codec;
        this.connectionLostTimeoutSeconds = connectionLostTimeoutSeconds;
        setReuseAddr(true);
    }

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        String label = String.valueOf(conn.getRemoteSocketAddress());
        try {
            ConnectionParams params = ConnectionParams.parse(handshake.getResourceDescriptor());
            Client client = hub.handleConnection(new WebSocketChannel(conn), params.gameId(), params.playerId(), params.sessionId());
            conn.setAttachment(client);
        } catch (GameException e) {
            log.info("[WS] rejected {}: {} {}", label, e.getCode().wireName(), e.getMessage());
            reject(conn, e);
        }
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        Client client = conn.getAttachment();
        log.debug("[WS] closed {} code={} reason={} remote={}", client != null ? client : conn.getRemoteSocketAddress(), code, reason, remote);
        hub.handleDisconnect(client);
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        Client client = conn.getAttachment();
        if (client == null) {
            log.debug("[WS] message on unbound socket {} ignored", conn.getRemoteSocketAddress());
            return;
        }
        hub.handleMessage(client, message);
    }

    @Override
    public void onWebsocketPong(WebSocket conn, Framedata f) {
        super.onWebsocketPong(conn, f);
        Client client = conn.getAttachment();
        hub.markPong(client);
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
        if (conn == null) {
            log.error("[WS] server error", ex);
            return;
        }
        Client client = conn.getAttachment();
        log.warn("[WS] error on {}: {}", client != null ? client : conn.getRemoteSocketAddress(), ex.toString());
        hub.handleDisconnect(client);
    }

    @Override
    public void onStart() {
        setConnectionLostTimeout(connectionLostTimeoutSeconds);
        log.info("[WS] listening on port {}", getPort());
    }

    private void reject(WebSocket conn, GameException e) {
        try {
            conn.send(codec.encode(EventType.ERROR.wireName(), new ErrorDTO(e.getCode().wireName(), e.getMessage())));
        } catch (JsonProcessingException je) {
            log.error("[WS] could not serialize rejection", je);
        } catch (RuntimeException se) {
            log.debug("[WS] could not send rejection: {}", se.getMessage());
        }
        conn.close(CLOSE_POLICY, e.getMessage());
    }
}
