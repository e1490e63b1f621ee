package com.ryuqq.maintenance.core.store;

import com.ryuqq.maintenance.core.model.MaintenanceParams;
import com.ryuqq.maintenance.core.model.ManifestLabels;

/**
 * MaintenanceParamsStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>labels: 파라미터 엔트리의 분류 label (기본 {@code {type: "maintenance"}})</li>
 *   <li>defaultParams: 저장된 엔트리가 없을 때 반환할 값 (기본 {@link MaintenanceParams#defaults()})</li>
 * </ul>
 *
 * <p>같은 저장소를 공유하는 모든 클라이언트는 같은 labels를 사용해야 합니다.
 * 다르면 서로의 엔트리를 보지 못합니다.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 * @param labels 분류 label (null 불가)
 * @param defaultParams 기본 파라미터 (null 불가)
 */
public record MaintenanceParamsStoreConfig(ManifestLabels labels, MaintenanceParams defaultParams) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: labels={@link ManifestLabels#MAINTENANCE}, defaultParams={@link MaintenanceParams#defaults()}</p>
     */
    public MaintenanceParamsStoreConfig() {
        this(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MaintenanceParamsStoreConfig {
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        if (defaultParams == null) {
            throw new IllegalArgumentException("defaultParams cannot be null");
        }
    }

    /**
     * labels만 변경한 새 인스턴스 생성.
     *
     * @param labels 새로운 분류 label
     * @return 새 MaintenanceParamsStoreConfig 인스턴스
     */
    public MaintenanceParamsStoreConfig withLabels(ManifestLabels labels) {
        return new MaintenanceParamsStoreConfig(labels, this.defaultParams);
    }

    /**
     * defaultParams만 변경한 새 인스턴스 생성.
     *
     * @param defaultParams 새로운 기본 파라미터
     * @return 새 MaintenanceParamsStoreConfig 인스턴스
     */
    public MaintenanceParamsStoreConfig withDefaultParams(MaintenanceParams defaultParams) {
        return new MaintenanceParamsStoreConfig(this.labels, defaultParams);
    }
}
