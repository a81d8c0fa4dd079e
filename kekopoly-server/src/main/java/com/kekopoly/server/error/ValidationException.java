package com.kekopoly.server.error;

import com.kekopoly.shared.util.ErrorCode;

public class ValidationException extends GameException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION, message, cause);
    }
}
