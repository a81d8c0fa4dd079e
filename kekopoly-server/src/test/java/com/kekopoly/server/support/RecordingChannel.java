package com.kekopoly.server.support;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kekopoly.server.hub.ClientChannel;

/** In-memory socket that records every frame written to it. */
public class RecordingChannel implements ClientChannel {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String label;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private final AtomicInteger pings = new AtomicInteger();
    private volatile boolean open = true;
    private volatile int closeCode = -1;
    private volatile boolean failSends;

    public RecordingChannel(String label) {
        this.label = label;
    }

    @Override
    public void send(String frame) {
        if (failSends) throw new IllegalStateException("broken pipe");
        frames.add(frame);
    }

    @Override
    public void sendPing() {
        pings.incrementAndGet();
    }

    @Override
    public void close(int code, String reason) {
        open = false;
        closeCode = code;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public String label() {
        return label;
    }

    public void failSends() {
        failSends = true;
    }

    public int closeCode() {
        return closeCode;
    }

    public int pings() {
        return pings.get();
    }

    public List<String> frames() {
        return List.copyOf(frames);
    }

    public List<String> types() {
        List<String> types = new ArrayList<>();
        for (JsonNode n : messages()) types.add(n.path("type").asText());
        return types;
    }

    public List<JsonNode> messages() {
        List<JsonNode> out = new ArrayList<>();
        for (String f : frames) {
            try {
                out.add(MAPPER.readTree(f));
            } catch (JsonProcessingException e) {
                throw new AssertionError("not JSON: " + f, e);
            }
        }
        return out;
    }

    public List<JsonNode> messagesOfType(String type) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode n : messages()) {
            if (type.equals(n.path("type").asText())) out.add(n);
        }
        return out;
    }

    /** Polls until {@code type} has arrived {@code count} times. */
    public boolean awaitType(String type, int count, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (messagesOfType(type).size() >= count) return true;
            Thread.sleep(5);
        }
        return messagesOfType(type).size() >= count;
    }
}
