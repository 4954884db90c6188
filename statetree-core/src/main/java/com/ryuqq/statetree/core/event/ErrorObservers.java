package com.ryuqq.statetree.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 프로세스 전역 ErrorObserver 보관소.
 *
 * <p>리스너 예외는 변경 호출자에게 다시 던져지지 않고 이곳에 등록된 observer로 보고됩니다.
 * 기본값은 {@link LoggingErrorObserver}입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ErrorObservers.set((event, error) -&gt; metrics.increment("statetree.listener.error"));
 * ...
 * ErrorObservers.reset();
 * </pre>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class ErrorObservers {

    private static final Logger log = LoggerFactory.getLogger(ErrorObservers.class);
    private static final ErrorObserver DEFAULT = new LoggingErrorObserver();

    private static volatile ErrorObserver current = DEFAULT;

    // Utility class - prevent instantiation
    private ErrorObservers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전역 observer 교체.
     *
     * @param observer 새 observer
     * @throws IllegalArgumentException observer가 null인 경우
     */
    public static void set(ErrorObserver observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        current = observer;
    }

    /**
     * 현재 observer 조회.
     *
     * @return 현재 observer
     */
    public static ErrorObserver get() {
        return current;
    }

    /**
     * 기본 observer로 복원.
     */
    public static void reset() {
        current = DEFAULT;
    }

    /**
     * 실패를 현재 observer에 보고.
     *
     * <p>observer 자체가 예외를 던지면 로그만 남기고 무시합니다 (디스패치 중단 방지).</p>
     *
     * @param event 전달 중이던 이벤트 (nullable)
     * @param error 실패 원인
     */
    public static void report(ChangeEvent event, Throwable error) {
        try {
            current.onError(event, error);
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (RuntimeException | Error observerFailure) {
            log.error("ErrorObserver failed while reporting {}", error.toString(), observerFailure);
        }
    }
}
