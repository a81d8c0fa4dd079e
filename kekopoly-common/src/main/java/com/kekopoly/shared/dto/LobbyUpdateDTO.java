package com.kekopoly.shared.dto;

import java.util.List;

public record LobbyUpdateDTO(List<LobbyGameDTO> games) {}
