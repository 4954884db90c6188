package com.ryuqq.statetree.core.event;

import com.ryuqq.statetree.core.model.EventKey;
import com.ryuqq.statetree.core.model.Path;
import com.ryuqq.statetree.core.tree.ModelComponent;

/**
 * 리스너에 전달되는 변경 알림.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>key:</strong> 이벤트 키 ({@code change} 또는 {@code change:<상대 경로>})</li>
 *   <li><strong>target:</strong> 이벤트를 발행한 컴포넌트 (리스너가 등록된 노드/컬렉션)</li>
 *   <li><strong>attribute:</strong> 속성 값 변경인 경우 변경된 속성 키, 그 외 null</li>
 *   <li><strong>value:</strong> 경로의 새 값 (속성 값, 컬렉션 경로는 {@link com.ryuqq.statetree.core.model.EntryDiff},
 *       노드 경로는 해당 노드, generic change는 target)</li>
 * </ul>
 *
 * @param key 이벤트 키
 * @param target 발행 컴포넌트
 * @param attribute 변경된 속성 키 (nullable)
 * @param value 새 값 (속성이 제거된 경우 null)
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public record ChangeEvent(
    EventKey key,
    ModelComponent target,
    String attribute,
    Object value
) {

    public ChangeEvent {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }

    /**
     * 이벤트 이름 (예: {@code change:features.developer}).
     *
     * @return 이벤트 이름
     */
    public String name() {
        return key.name();
    }

    /**
     * target 기준 상대 경로.
     *
     * @return 상대 경로 (generic change는 빈 경로)
     */
    public Path path() {
        return key.path();
    }

    /**
     * generic {@code change} 이벤트인지 확인.
     *
     * @return generic이면 true
     */
    public boolean isGeneric() {
        return key.isGeneric();
    }
}
