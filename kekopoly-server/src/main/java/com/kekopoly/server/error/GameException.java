package com.kekopoly.server.error;

import com.kekopoly.shared.util.ErrorCode;

/**
 * Base of every failure the registry and hub report to a caller.
 * The code travels to the client inside an {@code error} event.
 */
public class GameException extends RuntimeException {

    private final ErrorCode code;

    public GameException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GameException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
