package com.kekopoly.server.registry;

public record HostChange(String gameId, String previousHostId, String newHostId) {}
