package com.ryuqq.maintenance.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Manifest 엔트리의 메타데이터 (payload 제외).
 *
 * <p>조회(find) 결과로 반환되며, payload를 읽지 않고도 중복 엔트리 중 하나를
 * 결정적으로 고를 수 있는 정보를 담고 있습니다.</p>
 *
 * @param id 엔트리 식별자
 * @param labels 엔트리 label (읽기 전용 복사본)
 * @param length payload 길이 (bytes)
 * @param modTime 백엔드가 기록한 생성 시각 (null 허용)
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public record EntryMetadata(
    ManifestId id,
    Map<String, String> labels,
    int length,
    Instant modTime
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 labels가 null이거나 length가 음수인 경우
     */
    public EntryMetadata {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative (current: " + length + ")");
        }
        labels = Map.copyOf(labels);
        // modTime은 null 허용
    }
}
