package com.kekopoly.shared.dto;

import java.util.Map;

import com.kekopoly.shared.util.ActionType;

public record ActionResultDTO(String gameId, String playerId, ActionType action, String requestId, Map<String, Object> detail) {}
