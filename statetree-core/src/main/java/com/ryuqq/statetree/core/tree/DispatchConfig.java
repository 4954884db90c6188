package com.ryuqq.statetree.core.tree;

/**
 * 디스패처 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxCascadePasses: 한 번의 drain에서 리스너가 유발할 수 있는 후속 패스 최대 개수 (기본 100)</li>
 * </ul>
 *
 * <p>리스너가 변경을 일으키면 새 디스패치 패스가 현재 패스 뒤에 큐잉됩니다.
 * 리스너끼리 서로를 계속 변경하는 경우 이 한도에서 중단하고
 * {@link com.ryuqq.statetree.core.exception.DispatchOverflowException}을 보고합니다.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 * @param maxCascadePasses 후속 패스 최대 개수 (1 이상이어야 함)
 */
public record DispatchConfig(int maxCascadePasses) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxCascadePasses=100</p>
     */
    public DispatchConfig() {
        this(100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DispatchConfig {
        if (maxCascadePasses <= 0) {
            throw new IllegalArgumentException(
                "maxCascadePasses must be positive (current: " + maxCascadePasses + ")"
            );
        }
    }

    /**
     * maxCascadePasses만 변경한 새 인스턴스 생성.
     *
     * @param maxCascadePasses 새 한도
     * @return 새 DispatchConfig 인스턴스
     */
    public DispatchConfig withMaxCascadePasses(int maxCascadePasses) {
        return new DispatchConfig(maxCascadePasses);
    }
}
