/**
 * Application Layer - 호출자용 스케줄러 포트.
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ThreadRunScheduler)
 *   ↓ implements
 * application (TurnScheduler interface)
 *   ↓ depends on
 * core (ThreadId, Event, TurnResponse, MessageBuffer, SPI)
 * </pre>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.application.scheduler;
