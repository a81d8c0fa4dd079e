package com.kekopoly.server.error;

import com.kekopoly.shared.util.ErrorCode;

public class StateConflictException extends GameException {

    public StateConflictException(String message) {
        super(ErrorCode.STATE_CONFLICT, message);
    }

    public StateConflictException(String message, Throwable cause) {
        super(ErrorCode.STATE_CONFLICT, message, cause);
    }
}
