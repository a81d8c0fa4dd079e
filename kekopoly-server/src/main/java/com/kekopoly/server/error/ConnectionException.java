package com.kekopoly.server.error;

import com.kekopoly.shared.util.ErrorCode;

public class ConnectionException extends GameException {

    public ConnectionException(String message) {
        super(ErrorCode.CONNECTION, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(ErrorCode.CONNECTION, message, cause);
    }
}
