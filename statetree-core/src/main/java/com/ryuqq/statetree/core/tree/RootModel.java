package com.ryuqq.statetree.core.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 트리의 최상위 노드 (Root Aggregator).
 *
 * <p>모든 컴포넌트는 결국 RootModel로 변경을 보고합니다. RootModel은 트리의 arena와
 * 디스패처를 소유하며, 외부 코드에 전체 경로 이벤트
 * ({@code change:device.features.developer} 등)를 노출합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>트리 전체 스냅샷 교체를 단일 디스패치 패스로 병합 ({@link #replace})</li>
 *   <li>임의 변경 묶음을 단일 패스로 처리 ({@link #batch})</li>
 *   <li>트리 해제 ({@link #close()}) 이후 모든 변경 거부</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RootModel spark = new RootModel("spark");
 * spark.on("change", event -&gt; persistState());
 * spark.on("change:device.features", event -&gt; applyToggles());
 * ...
 * spark.close();
 * </pre>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class RootModel extends ObservableNode {

    private static final Logger log = LoggerFactory.getLogger(RootModel.class);

    /**
     * 기본 설정으로 생성.
     *
     * @param name 루트 이름 (이벤트 경로에는 포함되지 않음)
     */
    public RootModel(String name) {
        this(name, new DispatchConfig());
    }

    /**
     * 생성자.
     *
     * @param name 루트 이름 (이벤트 경로에는 포함되지 않음)
     * @param config 디스패처 설정
     * @throws IllegalArgumentException name이 유효하지 않거나 config가 null인 경우
     */
    public RootModel(String name, DispatchConfig config) {
        super(new ModelTree(config), null, name);
    }

    /**
     * 디스패처 설정 조회.
     *
     * @return 설정
     */
    public DispatchConfig config() {
        return tree.dispatcher().config();
    }

    /**
     * 트리에 등록된 컴포넌트 수 (인라인 속성 집합 포함).
     *
     * @return 컴포넌트 수 (닫힌 트리는 0)
     */
    public int componentCount() {
        return tree.size();
    }

    /**
     * 트리 해제.
     *
     * <p>arena를 비우고 이후의 모든 변경 호출을 {@link IllegalStateException}으로 거부합니다.
     * 여러 번 호출해도 안전합니다.</p>
     */
    public void close() {
        if (tree.isClosed()) {
            return;
        }
        int released = tree.size();
        listeners().clear();
        tree.close();
        log.debug("State tree '{}' closed: {} components released", name(), released);
    }

    public boolean isClosed() {
        return tree.isClosed();
    }
}
