package com.ryuqq.maintenance.core.picker;

import com.ryuqq.maintenance.core.model.EntryMetadata;
import com.ryuqq.maintenance.core.model.ManifestId;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;

/**
 * 중복 manifest 엔트리 중 하나를 결정적으로 선택.
 *
 * <p>두 클라이언트가 거의 동시에 독립적으로 엔트리를 생성하면 같은 label 아래에
 * 여러 엔트리가 공존할 수 있습니다. 어느 쪽을 고르든 상관없지만, 같은 엔트리 집합을 본
 * 모든 reader는 항상 같은 엔트리를 골라야 합니다.</p>
 *
 * <p><strong>선택 규칙:</strong></p>
 * <pre>
 * ORDER = modTime 오름차순 (null이 가장 앞) → ManifestId 오름차순
 * pick  = ORDER 기준 최댓값
 * </pre>
 *
 * <p>{@link #ORDER}는 전순서이므로 max는 교환·결합 법칙을 만족합니다.
 * 결과는 후보 집합에만 의존하고 순회 순서나 실행 프로세스와 무관합니다.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public final class LatestEntryPicker {

    /**
     * 엔트리 전순서: modTime (null 우선) 다음 ManifestId.
     */
    public static final Comparator<EntryMetadata> ORDER = Comparator
        .comparing(EntryMetadata::modTime, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
        .thenComparing(EntryMetadata::id);

    private LatestEntryPicker() {
    }

    /**
     * 후보 중 하나를 선택.
     *
     * @param candidates 같은 label을 가진 후보 엔트리 (비어있으면 안 됨)
     * @return {@link #ORDER} 기준 최댓값
     * @throws IllegalArgumentException candidates가 null이거나 비어있거나 null 원소를 포함하는 경우
     */
    public static EntryMetadata pick(Collection<EntryMetadata> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates cannot be null or empty");
        }
        EntryMetadata latest = null;
        for (EntryMetadata candidate : candidates) {
            if (candidate == null) {
                throw new IllegalArgumentException("candidates cannot contain null");
            }
            if (latest == null || ORDER.compare(candidate, latest) > 0) {
                latest = candidate;
            }
        }
        return latest;
    }

    /**
     * 후보 중 선택된 엔트리의 식별자.
     *
     * @param candidates 같은 label을 가진 후보 엔트리 (비어있으면 안 됨)
     * @return 선택된 엔트리의 ManifestId
     * @throws IllegalArgumentException candidates가 null이거나 비어있는 경우
     */
    public static ManifestId pickId(Collection<EntryMetadata> candidates) {
        return pick(candidates).id();
    }
}
