/**
 * 계층형 반응 모델의 컴포넌트와 디스패치 구현.
 *
 * <h2>컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statetree.core.tree.AttributeSet} - 키/값 속성 리프</li>
 *   <li>{@link com.ryuqq.statetree.core.tree.EntryCollection} - key로 식별되는 레코드 시퀀스</li>
 *   <li>{@link com.ryuqq.statetree.core.tree.ObservableNode} - 컴포넌트를 조합하고 변경을 상위로 전파</li>
 *   <li>{@link com.ryuqq.statetree.core.tree.RootModel} - 최상위 노드, arena와 디스패처 소유</li>
 * </ul>
 *
 * <h2>디스패치 패스</h2>
 * <p>외부 변경 호출 하나가 패스 하나입니다. 패스 안의 모든 변경은 수집된 후 한 번에 발행되며,
 * 각 스코프의 리스너는 패스마다 최대 1회 호출됩니다.</p>
 *
 * <h2>스레드 모델</h2>
 * <p>단일 스레드, 동기 발행. 트리는 생성한 클라이언트가 독점 소유합니다.</p>
 *
 * @since 1.0.0
 * @author StateTree Team
 */
package com.ryuqq.statetree.core.tree;
