package com.kekopoly.server.error;

import com.kekopoly.shared.util.ErrorCode;

public class ResourceExhaustedException extends GameException {

    public ResourceExhaustedException(String message) {
        super(ErrorCode.RESOURCE_EXHAUSTED, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(ErrorCode.RESOURCE_EXHAUSTED, message, cause);
    }
}
