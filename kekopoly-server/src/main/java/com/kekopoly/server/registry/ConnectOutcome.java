package com.kekopoly.server.registry;

import java.util.List;

/**
 * Result of {@link SessionRegistry#playerConnected}. Events are returned
 * rather than published so the caller can order them after its own
 * acknowledgements.
 */
public record ConnectOutcome(boolean restored, boolean resumed, List<GameEvent> events) {}
