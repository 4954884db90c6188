package com.ryuqq.statetree.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 트리 내 위치를 나타내는 세그먼트 시퀀스.
 *
 * <p>루트로부터 각 노드의 {@code name}을 차례로 이어 붙인 경로입니다.
 * 문자열 표현은 세그먼트를 점(.)으로 연결한 형태입니다 (예: {@code device.features.developer}).</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>세그먼트는 null 또는 빈 문자열 불가</li>
 *   <li>세그먼트에 점(.)과 콜론(:) 사용 불가</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class Path {

    private static final Path EMPTY = new Path(List.of());

    private final List<String> segments;

    private Path(List<String> segments) {
        this.segments = segments;
    }

    /**
     * 빈 경로 (루트 자신).
     *
     * @return 빈 Path
     */
    public static Path empty() {
        return EMPTY;
    }

    /**
     * 세그먼트 목록으로 Path 생성.
     *
     * @param segments 경로 세그먼트
     * @return Path 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 세그먼트가 포함된 경우
     */
    public static Path of(String... segments) {
        if (segments == null) {
            throw new IllegalArgumentException("segments cannot be null");
        }
        Path path = EMPTY;
        for (String segment : segments) {
            path = path.child(segment);
        }
        return path;
    }

    /**
     * 점으로 구분된 문자열을 Path로 변환.
     *
     * @param dotted 예: {@code device.features}; 빈 문자열은 빈 경로
     * @return Path 인스턴스
     * @throws IllegalArgumentException dotted가 null이거나 빈 세그먼트를 포함하는 경우
     */
    public static Path parse(String dotted) {
        if (dotted == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (dotted.isEmpty()) {
            return EMPTY;
        }
        return of(dotted.split("\\.", -1));
    }

    /**
     * 세그먼트 유효성 검증.
     *
     * @param segment 검증할 세그먼트
     * @return 검증된 세그먼트
     * @throws IllegalArgumentException 유효하지 않은 경우
     */
    public static String requireSegment(String segment) {
        if (segment == null || segment.isBlank()) {
            throw new IllegalArgumentException("path segment cannot be null or blank");
        }
        if (segment.indexOf('.') >= 0 || segment.indexOf(':') >= 0) {
            throw new IllegalArgumentException("path segment cannot contain '.' or ':' (segment: " + segment + ")");
        }
        return segment;
    }

    /**
     * 하위 경로 생성.
     *
     * @param segment 추가할 세그먼트
     * @return 새 Path
     */
    public Path child(String segment) {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(requireSegment(segment));
        return new Path(Collections.unmodifiableList(next));
    }

    /**
     * ancestor 기준의 상대 경로.
     *
     * @param ancestor 조상 경로
     * @return 상대 경로
     * @throws IllegalArgumentException ancestor가 이 경로의 접두사가 아닌 경우
     */
    public Path relativeTo(Path ancestor) {
        if (!startsWith(ancestor)) {
            throw new IllegalArgumentException(ancestor + " is not a prefix of " + this);
        }
        if (ancestor.segments.size() == segments.size()) {
            return EMPTY;
        }
        return new Path(segments.subList(ancestor.segments.size(), segments.size()));
    }

    /**
     * 접두사 여부 확인.
     *
     * @param prefix 접두사 후보
     * @return prefix로 시작하면 true
     */
    public boolean startsWith(Path prefix) {
        if (prefix == null || prefix.segments.size() > segments.size()) {
            return false;
        }
        return segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    public List<String> segments() {
        return segments;
    }

    public int depth() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Path path = (Path) o;
        return segments.equals(path.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
