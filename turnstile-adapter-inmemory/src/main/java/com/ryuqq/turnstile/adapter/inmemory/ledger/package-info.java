/**
 * In-memory {@link com.ryuqq.turnstile.spi.RunLedger} for tests and local runs.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.adapter.inmemory.ledger;
