package com.ryuqq.monobuild.application.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 실행 취소 신호 (사용자 인터럽트, 타임아웃, 첫 실패 시 중단).
 *
 * <p>한 번 설정되면 되돌릴 수 없습니다. 첫 번째 {@link #cancel} 호출의 사유만 기록되며,
 * 리스너는 그 호출 스레드에서 한 번만 실행됩니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * 취소 요청.
     *
     * @param cancelReason 취소 사유
     * @return 이번 호출로 처음 취소되었으면 true
     */
    public boolean cancel(String cancelReason) {
        String effective = cancelReason == null || cancelReason.isBlank() ? "cancelled" : cancelReason;
        if (!reason.compareAndSet(null, effective)) {
            return false;
        }
        log.warn("Cancellation requested: {}", effective);
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * 취소 사유.
     *
     * @return 사유 (취소되지 않았으면 null)
     */
    public String getReason() {
        return reason.get();
    }

    /**
     * 취소 시 실행할 리스너 등록. 이미 취소된 상태면 즉시 실행됩니다.
     *
     * @param listener 리스너
     */
    public void onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
    }

    /**
     * 리스너 제거.
     *
     * @param listener 등록했던 리스너
     */
    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }
}
