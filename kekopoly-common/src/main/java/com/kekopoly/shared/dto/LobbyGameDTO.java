package com.kekopoly.shared.dto;

public record LobbyGameDTO(String gameId, String code, String name, String hostId, int playerCount, int maxPlayers) {}
