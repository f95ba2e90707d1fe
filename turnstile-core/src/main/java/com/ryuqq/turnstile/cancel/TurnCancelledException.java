package com.ryuqq.turnstile.cancel;

/**
 * 취소 신호를 받은 TurnProcessor가 종료할 때 던지는 예외.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public class TurnCancelledException extends RuntimeException {

    public TurnCancelledException(String message) {
        super(message);
    }

    public TurnCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
