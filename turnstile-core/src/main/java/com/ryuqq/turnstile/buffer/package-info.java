/**
 * Message buffer: per-thread debounced queue of token-tagged batches.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.turnstile.buffer.MessageBuffer} - enqueue, drain, readiness, token drop</li>
 *   <li>{@link com.ryuqq.turnstile.buffer.BufferedBatch} - one submitted batch</li>
 *   <li>{@link com.ryuqq.turnstile.buffer.DrainDescriptor} / {@link com.ryuqq.turnstile.buffer.TokenPart} - drain result</li>
 *   <li>{@link com.ryuqq.turnstile.buffer.DrainPolicy} - all-together vs one-by-one</li>
 *   <li>{@link com.ryuqq.turnstile.buffer.DebounceMode} - how arrivals move the window</li>
 * </ul>
 *
 * <h2>Thread-Safety</h2>
 * <p>Each thread's queue has its own monitor. Operations on different threads never contend.</p>
 *
 * @since 1.0.0
 * @author Turnstile Team
 */
package com.ryuqq.turnstile.buffer;
