/**
 * 턴 실행 결과 타입 ({@link com.ryuqq.turnstile.outcome.RunOutcome}).
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.outcome;
