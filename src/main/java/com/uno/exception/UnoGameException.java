package com.uno.exception;

import lombok.Getter;

/**
 * A rejected game operation. Nothing has been changed when this is thrown.
 */
@Getter
public class UnoGameException extends RuntimeException {

    private final GameErrorCode code;

    public UnoGameException(GameErrorCode code) {
        super(code.getMessage());
        this.code = code;
    }

    public UnoGameException(GameErrorCode code, String message) {
        super(message);
        this.code = code;
    }
}
