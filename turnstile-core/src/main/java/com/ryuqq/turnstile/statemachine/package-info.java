/**
 * 토큰과 실행(Run)의 상태 머신.
 *
 * <ul>
 *   <li>{@link com.ryuqq.turnstile.statemachine.TokenState} / {@link com.ryuqq.turnstile.statemachine.TokenStateTransition}</li>
 *   <li>{@link com.ryuqq.turnstile.statemachine.RunStatus} / {@link com.ryuqq.turnstile.statemachine.RunStatusTransition}</li>
 * </ul>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.statemachine;
