package com.kekopoly.server.error;

import com.kekopoly.shared.util.ErrorCode;

public class NotFoundException extends GameException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
