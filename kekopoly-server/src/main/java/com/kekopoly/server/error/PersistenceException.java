package com.kekopoly.server.error;

import com.kekopoly.shared.util.ErrorCode;

public class PersistenceException extends GameException {

    public PersistenceException(String message) {
        super(ErrorCode.PERSISTENCE, message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE, message, cause);
    }
}
