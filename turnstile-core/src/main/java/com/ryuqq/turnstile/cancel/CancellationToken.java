package com.ryuqq.turnstile.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 턴 실행 취소 핸들.
 *
 * <p>스케줄러가 실행마다 하나씩 생성하여 TurnProcessor에게 전달합니다.
 * TurnProcessor는 {@link #throwIfCancelled()}를 주기적으로 호출하거나
 * {@link #onCancel(Runnable)}으로 하위 작업(HTTP 요청, 프로세스 등)을 중단해야 합니다.</p>
 *
 * <p><strong>동시성:</strong> cancel()은 여러 스레드에서 호출되어도 리스너를 한 번만 실행합니다.</p>
 *
 * @author Turnstile Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * 취소 신호 전송.
     *
     * @return 이번 호출로 취소 상태가 된 경우 true (이미 취소된 경우 false)
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Listener listener : listeners) {
            listener.fire();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 취소된 경우 {@link TurnCancelledException}을 던집니다.
     *
     * @throws TurnCancelledException 취소 신호를 받은 경우
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new TurnCancelledException("Turn cancelled");
        }
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>이미 취소된 상태라면 리스너를 즉시 실행합니다.</p>
     *
     * @param listener 취소 시 실행할 콜백
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Listener registered = new Listener(listener);
        listeners.add(registered);
        if (cancelled.get()) {
            registered.fire();
        }
    }

    // cancel()과 onCancel()이 경합해도 한 번만 실행
    private static final class Listener {

        private final Runnable delegate;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Listener(Runnable delegate) {
            this.delegate = delegate;
        }

        private void fire() {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            try {
                delegate.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed", e);
            }
        }
    }
}
