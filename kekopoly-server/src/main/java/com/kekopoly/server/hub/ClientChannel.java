package com.kekopoly.server.hub;

/**
 * The hub's view of one socket. Implementations wrap the transport so the
 * hub and its pumps can be driven without a network.
 */
public interface ClientChannel {

    /** Writes one text frame; throws on I/O failure. */
    void send(String frame);

    void sendPing();

    void close(int code, String reason);

    boolean isOpen();

    /** Short label for log lines, usually the remote address. */
    String label();
}
