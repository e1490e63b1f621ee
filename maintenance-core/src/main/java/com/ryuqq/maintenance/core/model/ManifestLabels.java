package com.ryuqq.maintenance.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Manifest 엔트리를 분류하고 조회하는 데 쓰이는 불변 label 집합.
 *
 * <p>조회는 부분집합 일치로 동작합니다. 이 집합의 모든 key가 후보 엔트리의
 * label에 같은 값으로 존재하면 일치로 봅니다. 후보에 추가 label이 있어도 무방합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ManifestLabels.MAINTENANCE.matches(Map.of("type", "maintenance"));              // true
 * ManifestLabels.MAINTENANCE.matches(Map.of("type", "maintenance", "v", "2"));    // true
 * ManifestLabels.MAINTENANCE.matches(Map.of("type", "snapshot"));                 // false
 * </pre>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public final class ManifestLabels {

    /**
     * 유지보수 파라미터 엔트리의 분류 label: {@code {type: "maintenance"}}.
     */
    public static final ManifestLabels MAINTENANCE = of(Map.of("type", "maintenance"));

    private final Map<String, String> values;

    private ManifestLabels(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("labels cannot be null or empty");
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, String> e : values.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new IllegalArgumentException("label key cannot be null or blank");
            }
            if (e.getValue() == null) {
                throw new IllegalArgumentException("label value cannot be null (key: " + e.getKey() + ")");
            }
            sorted.put(e.getKey(), e.getValue());
        }
        this.values = Collections.unmodifiableMap(sorted);
    }

    /**
     * label 집합 생성.
     *
     * @param values key/value 쌍 (비어있으면 안 됨)
     * @return ManifestLabels 인스턴스
     * @throws IllegalArgumentException null, 빈 맵, 빈 key 또는 null 값이 포함된 경우
     */
    public static ManifestLabels of(Map<String, String> values) {
        return new ManifestLabels(values);
    }

    /**
     * key 순으로 정렬된 읽기 전용 label 맵.
     *
     * @return label 맵
     */
    public Map<String, String> asMap() {
        return values;
    }

    /**
     * 후보 label이 이 집합을 모두 포함하는지 확인.
     *
     * @param candidate 엔트리의 label (null이면 false)
     * @return 모든 label이 같은 값으로 존재하면 true
     */
    public boolean matches(Map<String, String> candidate) {
        if (candidate == null) {
            return false;
        }
        for (Map.Entry<String, String> e : values.entrySet()) {
            if (!e.getValue().equals(candidate.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ManifestLabels) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ManifestLabels" + values;
    }
}
