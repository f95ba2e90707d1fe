/**
 * Runner Adapter Layer - TurnScheduler 구현체.
 *
 * <p>이 패키지는 {@link com.ryuqq.turnstile.application.scheduler.TurnScheduler}의
 * 스레드별 실행 구현체와 그 설정을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.turnstile.adapter.runner.ThreadRunScheduler} - 스레드당 단일 실행, debounce, busy injection</li>
 *   <li>{@link com.ryuqq.turnstile.adapter.runner.SchedulerConfig} - debounce/drain/busy 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ThreadRunScheduler)
 *   ↓ implements
 * application (TurnScheduler interface)
 *   ↓ depends on
 * core (ThreadId, Event, MessageBuffer, RunOutcome, TokenState)
 *   ↓ depends on
 * core/spi (TurnProcessor, RunLedger interface)
 * </pre>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.adapter.runner;
