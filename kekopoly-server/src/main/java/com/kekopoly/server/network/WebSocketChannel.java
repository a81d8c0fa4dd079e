package com.kekopoly.server.network;

import org.java_websocket.WebSocket;

import com.kekopoly.server.hub.ClientChannel;

/** {@link ClientChannel} over a Java-WebSocket connection. */
final class WebSocketChannel implements ClientChannel {

    private final WebSocket conn;
    private final String label;

    WebSocketChannel(WebSocket conn) {
        this.conn = conn;
        this.label = String.valueOf(conn.getRemoteSocketAddress());
    }

    @Override
    public void send(String frame) {
        conn.send(frame);
    }

    @Override
    public void sendPing() {
        conn.sendPing();
    }

    @Override
    public void close(int code, String reason) {
        conn.close(code, reason);
    }

    @Override
    public boolean isOpen() {
        return conn.isOpen();
    }

    @Override
    public String label() {
        return label;
    }
}
