package com.ryuqq.maintenance.core.model;

import java.time.Duration;

/**
 * 저장소 전역 유지보수 파라미터.
 *
 * <p>manifest payload로 직렬화되어 {@link ManifestLabels#MAINTENANCE} label 아래에 저장됩니다.
 * 저장된 값은 절대 제자리에서 수정되지 않으며, 변경은 항상 "새 엔트리 생성 후 이전 엔트리 삭제"입니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>owner:</strong> 마지막으로 소유권을 기록한 클라이언트 ({@code user@host}). 참고용이며 배타성을 보장하지 않음</li>
 *   <li><strong>quickCycle:</strong> 가벼운 유지보수 주기</li>
 *   <li><strong>fullCycle:</strong> 전체 유지보수 주기</li>
 *   <li><strong>logRetention:</strong> 유지보수 로그 보존 정책</li>
 * </ul>
 *
 * @param owner 소유자 신원 문자열 (null은 빈 문자열로 정규화)
 * @param quickCycle quick 사이클 파라미터
 * @param fullCycle full 사이클 파라미터
 * @param logRetention 로그 보존 정책
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public record MaintenanceParams(
    String owner,
    CycleParams quickCycle,
    CycleParams fullCycle,
    LogRetentionOptions logRetention
) {

    private static final Duration DEFAULT_QUICK_INTERVAL = Duration.ofHours(1);
    private static final Duration DEFAULT_FULL_INTERVAL = Duration.ofHours(24);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 사이클 또는 보존 정책이 null인 경우
     */
    public MaintenanceParams {
        if (owner == null) {
            owner = "";
        }
        if (quickCycle == null) {
            throw new IllegalArgumentException("quickCycle cannot be null");
        }
        if (fullCycle == null) {
            throw new IllegalArgumentException("fullCycle cannot be null");
        }
        if (logRetention == null) {
            throw new IllegalArgumentException("logRetention cannot be null");
        }
    }

    /**
     * 기본 유지보수 파라미터.
     *
     * <p>저장된 파라미터가 없을 때 반환되는 값입니다.
     * full 사이클 24시간, quick 사이클 1시간 (둘 다 활성화), 기본 로그 보존 정책, 소유자 없음.</p>
     *
     * @return 기본 MaintenanceParams
     */
    public static MaintenanceParams defaults() {
        return new MaintenanceParams(
            "",
            CycleParams.enabled(DEFAULT_QUICK_INTERVAL),
            CycleParams.enabled(DEFAULT_FULL_INTERVAL),
            LogRetentionOptions.defaults()
        );
    }

    /**
     * 주어진 클라이언트가 소유자인지 확인.
     *
     * <p>{@code owner}와 {@link ClientIdentity#usernameAtHost()}가 정확히 일치할 때만 true.
     * 소유자가 비어있으면 항상 false.</p>
     *
     * @param identity 비교할 클라이언트 신원
     * @return 소유자 여부
     * @throws IllegalArgumentException identity가 null인 경우
     */
    public boolean isOwnedBy(ClientIdentity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        return owner.equals(identity.usernameAtHost());
    }

    /**
     * owner만 변경한 새 인스턴스 생성.
     *
     * @param owner 새로운 소유자
     * @return 새 MaintenanceParams 인스턴스
     */
    public MaintenanceParams withOwner(String owner) {
        return new MaintenanceParams(owner, quickCycle, fullCycle, logRetention);
    }

    /**
     * quickCycle만 변경한 새 인스턴스 생성.
     *
     * @param quickCycle 새로운 quick 사이클
     * @return 새 MaintenanceParams 인스턴스
     */
    public MaintenanceParams withQuickCycle(CycleParams quickCycle) {
        return new MaintenanceParams(owner, quickCycle, fullCycle, logRetention);
    }

    /**
     * fullCycle만 변경한 새 인스턴스 생성.
     *
     * @param fullCycle 새로운 full 사이클
     * @return 새 MaintenanceParams 인스턴스
     */
    public MaintenanceParams withFullCycle(CycleParams fullCycle) {
        return new MaintenanceParams(owner, quickCycle, fullCycle, logRetention);
    }

    /**
     * logRetention만 변경한 새 인스턴스 생성.
     *
     * @param logRetention 새로운 로그 보존 정책
     * @return 새 MaintenanceParams 인스턴스
     */
    public MaintenanceParams withLogRetention(LogRetentionOptions logRetention) {
        return new MaintenanceParams(owner, quickCycle, fullCycle, logRetention);
    }
}
