package com.ryuqq.turnstile.cancel;

/**
 * 스케줄러 종료로 인해 토큰이 reject될 때 사용되는 예외.
 *
 * <p>호출자가 "턴이 실패함"과 "서비스가 종료 중임"을 구분할 수 있도록
 * TurnProcessor 오류와 별도의 타입을 사용합니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public class SchedulerShutdownException extends RuntimeException {

    public SchedulerShutdownException(String message) {
        super(message);
    }
}
