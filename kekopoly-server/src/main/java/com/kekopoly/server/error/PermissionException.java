package com.kekopoly.server.error;

import com.kekopoly.shared.util.ErrorCode;

public class PermissionException extends GameException {

    public PermissionException(String message) {
        super(ErrorCode.PERMISSION, message);
    }

    public PermissionException(String message, Throwable cause) {
        super(ErrorCode.PERMISSION, message, cause);
    }
}
