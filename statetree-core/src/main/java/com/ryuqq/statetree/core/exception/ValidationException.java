package com.ryuqq.statetree.core.exception;

import com.ryuqq.statetree.core.model.Path;

/**
 * 값 또는 스냅샷 구조가 모델의 타입 가드를 통과하지 못한 경우.
 *
 * <p>이 예외는 변경이 적용되기 전에 호출자에게 동기적으로 전달됩니다.
 * 예외가 발생한 호출은 아무것도 변경하지 않습니다.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public class ValidationException extends StateTreeException {

    private final Path path;

    /**
     * 생성자.
     *
     * @param path 검증에 실패한 위치 (절대 경로)
     * @param message 오류 메시지
     */
    public ValidationException(Path path, String message) {
        super(path == null || path.isEmpty() ? message : message + " (path: " + path + ")");
        this.path = path == null ? Path.empty() : path;
    }

    /**
     * 검증에 실패한 위치.
     *
     * @return 절대 경로
     */
    public Path getPath() {
        return path;
    }
}
