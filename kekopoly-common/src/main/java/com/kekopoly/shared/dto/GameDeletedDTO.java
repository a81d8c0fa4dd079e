package com.kekopoly.shared.dto;

public record GameDeletedDTO(String gameId, String reason, String message) {}
