/**
 * Contract test support for {@link com.ryuqq.turnstile.application.scheduler.TurnScheduler} implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.turnstile.testkit.contract.AbstractSchedulerContractTest} - fixtures and await helpers</li>
 *   <li>{@link com.ryuqq.turnstile.testkit.contract.ScriptedTurnProcessor} - scriptable processor with overlap detection</li>
 * </ul>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.testkit.contract;
