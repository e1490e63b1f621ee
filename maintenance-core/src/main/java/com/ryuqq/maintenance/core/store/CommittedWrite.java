package com.ryuqq.maintenance.core.store;

import com.ryuqq.maintenance.core.exception.ParamsRetireException;
import com.ryuqq.maintenance.core.model.ManifestId;
import com.ryuqq.maintenance.core.spi.ManifestWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * commit이 끝나고 retire 대기 중인 쓰기 (2단계).
 *
 * <p>새 엔트리는 이미 저장되었으므로 이 단계에서 무엇이 실패해도 새 값은 유지됩니다.
 * 남은 이전 엔트리는 다음 읽기에서 {@code LatestEntryPicker}가 처리하거나
 * 이후의 쓰기가 정리합니다.</p>
 *
 * <p><strong>retire 규칙:</strong></p>
 * <ul>
 *   <li>스냅샷 순서대로 하나씩 삭제</li>
 *   <li>첫 실패에서 중단하고 {@link ParamsRetireException} 발생</li>
 *   <li>실패 후 다시 호출하면 남은 엔트리부터 재개</li>
 *   <li>이번에 commit한 엔트리는 스냅샷에 있어도 삭제하지 않음</li>
 *   <li>다른 writer가 이미 지운 엔트리는 백엔드가 no-op으로 처리</li>
 * </ul>
 *
 * <p>스레드 안전하지 않습니다.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public final class CommittedWrite {

    private static final Logger log = LoggerFactory.getLogger(CommittedWrite.class);
    private final ManifestWriter manifests;
    private final ManifestId committedId;
    private final List<ManifestId> staleIds;
    private int nextIndex;
    private boolean retired;

    CommittedWrite(ManifestWriter manifests, ManifestId committedId, List<ManifestId> staleIds) {
        this.manifests = manifests;
        this.committedId = committedId;
        this.staleIds = staleIds;
    }

    /**
     * @return 이번 쓰기가 생성한 엔트리 식별자
     */
    public ManifestId committedId() {
        return committedId;
    }

    /**
     * @return 아직 삭제되지 않은 이전 엔트리 식별자
     */
    public List<ManifestId> remainingStaleIds() {
        return staleIds.subList(nextIndex, staleIds.size());
    }

    /**
     * @return 모든 이전 엔트리가 삭제되었으면 true
     */
    public boolean isRetired() {
        return retired;
    }

    /**
     * 이전 엔트리 삭제.
     *
     * @throws IllegalStateException 이미 모두 삭제된 경우
     * @throws ParamsRetireException 삭제 실패 시 (새 엔트리는 이미 저장됨)
     */
    public void retire() {
        if (retired) {
            throw new IllegalStateException("write already retired");
        }
        while (nextIndex < staleIds.size()) {
            ManifestId staleId = staleIds.get(nextIndex);
            if (!staleId.equals(committedId)) {
                try {
                    manifests.delete(staleId);
                } catch (RuntimeException e) {
                    log.warn("Failed to retire maintenance manifest {}, {} stale entries remain",
                        staleId.getValue(), staleIds.size() - nextIndex);
                    throw new ParamsRetireException(committedId, remainingStaleIds(), e);
                }
            }
            nextIndex++;
        }
        retired = true;
        log.debug("Retired {} maintenance manifests superseded by {}", staleIds.size(), committedId.getValue());
    }
}
