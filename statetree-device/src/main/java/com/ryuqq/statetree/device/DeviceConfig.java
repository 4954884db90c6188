package com.ryuqq.statetree.device;

import java.util.List;

/**
 * Device 모델 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>nodeName: 루트 아래 device 노드 이름 (기본 "device")</li>
 *   <li>featureCategories: features 아래 생성할 기능 컬렉션 (기본 developer, entitlement, user)</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 * @param nodeName device 노드 이름
 * @param featureCategories 기능 카테고리 목록 (1개 이상, 중복 불가)
 */
public record DeviceConfig(String nodeName, List<String> featureCategories) {

    /**
     * 기본 카테고리.
     */
    public static final List<String> DEFAULT_CATEGORIES = List.of("developer", "entitlement", "user");

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: nodeName="device", featureCategories=developer, entitlement, user</p>
     */
    public DeviceConfig() {
        this("device", DEFAULT_CATEGORIES);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DeviceConfig {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("nodeName cannot be null or blank");
        }
        if (featureCategories == null || featureCategories.isEmpty()) {
            throw new IllegalArgumentException("featureCategories cannot be null or empty");
        }
        featureCategories = List.copyOf(featureCategories);
        if (featureCategories.stream().distinct().count() != featureCategories.size()) {
            throw new IllegalArgumentException("featureCategories cannot contain duplicates (current: " + featureCategories + ")");
        }
    }

    /**
     * nodeName만 변경한 새 인스턴스 생성.
     *
     * @param nodeName 새 노드 이름
     * @return 새 DeviceConfig 인스턴스
     */
    public DeviceConfig withNodeName(String nodeName) {
        return new DeviceConfig(nodeName, this.featureCategories);
    }

    /**
     * featureCategories만 변경한 새 인스턴스 생성.
     *
     * @param featureCategories 새 카테고리 목록
     * @return 새 DeviceConfig 인스턴스
     */
    public DeviceConfig withFeatureCategories(List<String> featureCategories) {
        return new DeviceConfig(this.nodeName, featureCategories);
    }
}
