/**
 * 스케줄러와 TurnProcessor 사이의 요청 계약.
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
package com.ryuqq.turnstile.contract;
