package com.ryuqq.maintenance.core.model;

import java.time.Duration;

/**
 * 유지보수 사이클(quick 또는 full)의 실행 파라미터.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CycleParams quick = CycleParams.enabled(Duration.ofHours(1));
 * CycleParams full = CycleParams.disabled(Duration.ofHours(24));
 * </pre>
 *
 * @param enabled 사이클 실행 여부
 * @param interval 실행 간격 (null 불가, 음수 불가)
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public record CycleParams(boolean enabled, Duration interval) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException interval이 null이거나 음수인 경우
     */
    public CycleParams {
        if (interval == null) {
            throw new IllegalArgumentException("interval cannot be null");
        }
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be non-negative (current: " + interval + ")");
        }
    }

    /**
     * 활성화된 사이클 생성.
     *
     * @param interval 실행 간격
     * @return CycleParams 인스턴스
     */
    public static CycleParams enabled(Duration interval) {
        return new CycleParams(true, interval);
    }

    /**
     * 비활성화된 사이클 생성.
     *
     * @param interval 실행 간격 (다시 활성화될 때 사용)
     * @return CycleParams 인스턴스
     */
    public static CycleParams disabled(Duration interval) {
        return new CycleParams(false, interval);
    }

    /**
     * enabled만 변경한 새 인스턴스 생성.
     *
     * @param enabled 새로운 실행 여부
     * @return 새 CycleParams 인스턴스
     */
    public CycleParams withEnabled(boolean enabled) {
        return new CycleParams(enabled, this.interval);
    }

    /**
     * interval만 변경한 새 인스턴스 생성.
     *
     * @param interval 새로운 실행 간격
     * @return 새 CycleParams 인스턴스
     */
    public CycleParams withInterval(Duration interval) {
        return new CycleParams(this.enabled, interval);
    }
}
