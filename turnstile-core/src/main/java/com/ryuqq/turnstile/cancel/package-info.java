/**
 * 취소와 종료 신호.
 *
 * <ul>
 *   <li>{@link com.ryuqq.turnstile.cancel.CancellationToken} - 실행별 취소 핸들</li>
 *   <li>{@link com.ryuqq.turnstile.cancel.TurnCancelledException} - 취소된 턴의 종료 예외</li>
 *   <li>{@link com.ryuqq.turnstile.cancel.SchedulerShutdownException} - shutdown 시 토큰 거부 사유</li>
 * </ul>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.cancel;
