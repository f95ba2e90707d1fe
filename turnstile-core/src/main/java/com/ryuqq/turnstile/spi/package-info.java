/**
 * Service Provider Interfaces.
 *
 * <p>Turnstile이 외부와 맞닿는 경계입니다.</p>
 *
 * <h2>SPI</h2>
 * <ul>
 *   <li>{@link com.ryuqq.turnstile.spi.TurnProcessor} - 턴 처리기 (필수)</li>
 *   <li>{@link com.ryuqq.turnstile.spi.InjectionChannel} - 실행 중 이벤트 주입 capability</li>
 *   <li>{@link com.ryuqq.turnstile.spi.RunLedger} - 실행 생명주기 기록 (선택)</li>
 * </ul>
 *
 * <h2>기본 구현</h2>
 * <ul>
 *   <li>{@link com.ryuqq.turnstile.spi.noop.NoOpRunLedger}</li>
 *   <li>{@link com.ryuqq.turnstile.spi.noop.NoOpInjectionChannel}</li>
 * </ul>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.spi;
