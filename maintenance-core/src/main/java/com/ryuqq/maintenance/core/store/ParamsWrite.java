package com.ryuqq.maintenance.core.store;

import com.ryuqq.maintenance.core.exception.ParamsCommitException;
import com.ryuqq.maintenance.core.model.MaintenanceParams;
import com.ryuqq.maintenance.core.model.ManifestId;
import com.ryuqq.maintenance.core.model.ManifestLabels;
import com.ryuqq.maintenance.core.spi.ManifestWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * commit 대기 중인 유지보수 파라미터 쓰기 (1단계).
 *
 * <p>{@link MaintenanceParamsStore#beginWrite}가 만든 스냅샷을 들고 있으며,
 * {@link #commit(MaintenanceParams)}이 성공해야만 {@link CommittedWrite#retire()}로 넘어갈 수 있습니다.
 * 이 순서 덕분에 관찰 가능한 모든 시점에 유효한 엔트리가 최소 하나 존재합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * ParamsWrite ──commit()──→ CommittedWrite ──retire()──→ (완료)
 *      │
 *      └── commit 실패 → ParamsCommitException (아무것도 삭제되지 않음)
 * </pre>
 *
 * <p>스레드 안전하지 않습니다. 한 번의 쓰기는 한 스레드에서 진행해야 합니다.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public final class ParamsWrite {

    private static final Logger log = LoggerFactory.getLogger(ParamsWrite.class);
    private final ManifestWriter manifests;
    private final ManifestLabels labels;
    private final List<ManifestId> staleIds;
    private boolean committed;

    ParamsWrite(ManifestWriter manifests, ManifestLabels labels, List<ManifestId> staleIds) {
        this.manifests = manifests;
        this.labels = labels;
        this.staleIds = List.copyOf(staleIds);
    }

    /**
     * 쓰기 시작 시점에 보였던 엔트리.
     *
     * @return retire 단계에서 삭제할 엔트리 식별자
     */
    public List<ManifestId> staleIds() {
        return staleIds;
    }

    /**
     * 새 엔트리 생성.
     *
     * @param params 저장할 파라미터
     * @return retire 대기 중인 쓰기
     * @throws IllegalArgumentException params가 null인 경우
     * @throws IllegalStateException 이미 commit된 경우
     * @throws ParamsCommitException 엔트리 생성 실패 시 (기존 엔트리는 그대로)
     */
    public CommittedWrite commit(MaintenanceParams params) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        if (committed) {
            throw new IllegalStateException("write already committed");
        }

        ManifestId id;
        try {
            id = manifests.create(labels, params);
        } catch (RuntimeException e) {
            throw new ParamsCommitException(e);
        }
        committed = true;
        log.info("Committed maintenance manifest {} ({} stale)", id.getValue(), staleIds.size());
        return new CommittedWrite(manifests, id, staleIds);
    }
}
