/**
 * Core domain model package containing identifiers and message types.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.turnstile.model.ThreadId} - Conversation thread (unit of serialization)</li>
 *   <li>{@link com.ryuqq.turnstile.model.TokenId} - Caller's claim on a future result</li>
 *   <li>{@link com.ryuqq.turnstile.model.RunId} - One execution of the turn processor</li>
 * </ul>
 *
 * <h2>Messages</h2>
 * <ul>
 *   <li>{@link com.ryuqq.turnstile.model.Event} - Inbound conversational event</li>
 *   <li>{@link com.ryuqq.turnstile.model.TurnResponse} - Terminal message of a turn</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Turnstile Team
 */
package com.ryuqq.turnstile.model;
