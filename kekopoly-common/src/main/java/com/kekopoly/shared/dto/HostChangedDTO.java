package com.kekopoly.shared.dto;

public record HostChangedDTO(String gameId, String hostId, String previousHostId) {}
