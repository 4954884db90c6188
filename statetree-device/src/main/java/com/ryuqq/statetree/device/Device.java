package com.ryuqq.statetree.device;

import com.ryuqq.statetree.core.event.ChangeListener;
import com.ryuqq.statetree.core.model.AttributeType;
import com.ryuqq.statetree.core.tree.ObservableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 기기(WDM device) 상태 모델.
 *
 * <p>루트 아래에 {@code device} 노드를 만들고, 그 아래 {@code features} 노드와
 * 카테고리별 기능 컬렉션을 구성합니다. 등록 응답 본문이 도착하면
 * {@link #processRegistrationSuccess(Map)}가 본문 전체를 단일 디스패치 패스로 반영합니다.</p>
 *
 * <p><strong>트리 구조 (기본 설정):</strong></p>
 * <pre>
 * spark (RootModel)
 *  └─ device          (인라인 속성: url, webSocketUrl, deviceType, name, ...)
 *      ├─ services    (이름 있는 속성 집합: 서비스 이름 → URL)
 *      └─ features
 *          ├─ developer    (EntryCollection)
 *          ├─ entitlement  (EntryCollection)
 *          └─ user         (EntryCollection)
 * </pre>
 *
 * <p><strong>이벤트 예시:</strong></p>
 * <ul>
 *   <li>기능 하나 추가 → device.features {@code change:developer}, device {@code change:features.developer},
 *       root {@code change:device.features.developer} 등 스코프마다 1회</li>
 *   <li>url 변경 → device {@code change:url}, root {@code change:device.url}</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class Device {

    private static final Logger log = LoggerFactory.getLogger(Device.class);

    /**
     * Name of the named attribute set holding service URLs.
     */
    public static final String SERVICES = "services";

    private final ObservableNode node;
    private final Features features;

    /**
     * 기본 설정으로 생성.
     *
     * @param parent device 노드를 붙일 부모 (보통 RootModel)
     */
    public Device(ObservableNode parent) {
        this(parent, new DeviceConfig());
    }

    /**
     * 생성자.
     *
     * @param parent device 노드를 붙일 부모
     * @param config 설정
     * @throws IllegalArgumentException parent 또는 config가 null인 경우
     */
    public Device(ObservableNode parent, DeviceConfig config) {
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.node = parent.addNode(config.nodeName());
        node.define("url", AttributeType.STRING);
        node.define("webSocketUrl", AttributeType.STRING);
        node.define("deviceType", AttributeType.STRING);
        node.define("name", AttributeType.STRING);
        node.define("model", AttributeType.STRING);
        node.define("systemName", AttributeType.STRING);
        node.define("systemVersion", AttributeType.STRING);
        node.define("intranetInactivityDuration", AttributeType.NUMBER);
        node.addAttributeSet(SERVICES);
        this.features = new Features(node, config.featureCategories());
    }

    /**
     * 등록 응답 본문 반영.
     *
     * <p>본문은 트리 구조대로 분배됩니다: 스칼라 키는 device 인라인 속성, {@code services}는
     * 서비스 집합, {@code features.<category>}는 각 기능 컬렉션으로 갑니다.
     * 기능 레코드에 {@code value}가 없으면 {@code val}을 해석해 채웁니다.</p>
     *
     * @param body 역직렬화된 등록 응답 본문
     * @throws com.ryuqq.statetree.core.exception.ValidationException 본문이 모델 구조와 맞지 않는 경우
     */
    public void processRegistrationSuccess(Map<String, ?> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        node.replace(normalize(body));
        log.debug("Device registration applied: url={}", url());
    }

    /**
     * 등록 해제: 모든 속성, 서비스, 기능을 단일 패스로 비웁니다.
     */
    public void clear() {
        node.batch(() -> {
            node.attributes().replaceAll(Map.of());
            node.attributeSet(SERVICES).replaceAll(Map.of());
            for (String category : features.categoryNames()) {
                features.category(category).replaceAll(List.of());
            }
        });
        log.debug("Device state cleared");
    }

    /**
     * 등록 여부 (url이 있으면 등록된 것으로 봄).
     *
     * @return 등록되어 있으면 true
     */
    public boolean isRegistered() {
        return node.get("url") != null;
    }

    public String url() {
        return (String) node.get("url");
    }

    public String webSocketUrl() {
        return (String) node.get("webSocketUrl");
    }

    /**
     * 서비스 URL 조회.
     *
     * @param service 서비스 이름 (예: conversationServiceUrl)
     * @return URL (없으면 null)
     */
    public String serviceUrl(String service) {
        Object url = node.attributeSet(SERVICES).get(service);
        return url == null ? null : url.toString();
    }

    public Object get(String attribute) {
        return node.get(attribute);
    }

    public Features features() {
        return features;
    }

    public void on(String eventName, ChangeListener listener) {
        node.on(eventName, listener);
    }

    public void off(String eventName, ChangeListener listener) {
        node.off(eventName, listener);
    }

    public ObservableNode node() {
        return node;
    }

    /**
     * Returns the state as a registration-shaped map.
     *
     * @return snapshot
     */
    public Map<String, Object> toSnapshot() {
        return node.toSnapshot();
    }

    private Map<String, Object> normalize(Map<String, ?> body) {
        Map<String, Object> copy = new LinkedHashMap<>(body);
        Object rawFeatures = copy.get(Features.NODE_NAME);
        if (rawFeatures instanceof Map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            ((Map<?, ?>) rawFeatures).forEach((category, records) ->
                normalized.put(String.valueOf(category), records instanceof List ? withValues((List<?>) records) : records));
            copy.put(Features.NODE_NAME, normalized);
        }
        return copy;
    }

    private static List<Object> withValues(List<?> records) {
        List<Object> result = new ArrayList<>(records.size());
        for (Object record : records) {
            if (record instanceof Map && !((Map<?, ?>) record).containsKey("value")) {
                Map<Object, Object> filled = new LinkedHashMap<>((Map<?, ?>) record);
                Object val = filled.get("val");
                filled.put("value", Feature.parseValue(val == null ? null : val.toString()));
                result.add(filled);
            } else {
                result.add(record);
            }
        }
        return result;
    }
}
