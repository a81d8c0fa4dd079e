package com.kekopoly.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HostVerificationDTO(String gameId, boolean success, String hostId, String message) {}
