/**
 * SPI의 No-Op 구현.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.spi.noop;
