package com.kekopoly.server.rules;

import java.util.Map;

/**
 * What a rule application did. {@code sendToJail} asks the turn engine to
 * jail the acting player; {@code endsTurn} asks it to advance the turn.
 */
public record ActionOutcome(Map<String, Object> detail, boolean sendToJail, boolean endsTurn) {

    public static ActionOutcome of(Map<String, Object> detail) {
        return new ActionOutcome(detail, false, false);
    }
}
