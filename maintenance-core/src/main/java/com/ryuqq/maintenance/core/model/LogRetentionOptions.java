package com.ryuqq.maintenance.core.model;

import java.time.Duration;

/**
 * 유지보수 로그 보존 정책.
 *
 * <p>이 모듈은 정책을 저장하고 전달할 뿐이며, 실제 정리(sweep)는 외부 컴포넌트가 수행합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxCount: 10000개</li>
 *   <li>maxAge: 30일</li>
 *   <li>maxTotalSize: 1 GiB</li>
 * </ul>
 *
 * @param maxCount 보존할 최대 로그 개수 (0 이상)
 * @param maxAge 보존 기간 (null 불가, 음수 불가)
 * @param maxTotalSize 보존할 로그의 최대 총 크기 (bytes, 0 이상)
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public record LogRetentionOptions(int maxCount, Duration maxAge, long maxTotalSize) {

    private static final int DEFAULT_MAX_COUNT = 10_000;
    private static final Duration DEFAULT_MAX_AGE = Duration.ofDays(30);
    private static final long DEFAULT_MAX_TOTAL_SIZE = 1L << 30;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LogRetentionOptions {
        if (maxCount < 0) {
            throw new IllegalArgumentException("maxCount must be non-negative (current: " + maxCount + ")");
        }
        if (maxAge == null) {
            throw new IllegalArgumentException("maxAge cannot be null");
        }
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be non-negative (current: " + maxAge + ")");
        }
        if (maxTotalSize < 0) {
            throw new IllegalArgumentException("maxTotalSize must be non-negative (current: " + maxTotalSize + ")");
        }
    }

    /**
     * 기본 보존 정책.
     *
     * @return 기본 LogRetentionOptions
     */
    public static LogRetentionOptions defaults() {
        return new LogRetentionOptions(DEFAULT_MAX_COUNT, DEFAULT_MAX_AGE, DEFAULT_MAX_TOTAL_SIZE);
    }

    /**
     * maxCount만 변경한 새 인스턴스 생성.
     *
     * @param maxCount 새로운 최대 개수
     * @return 새 LogRetentionOptions 인스턴스
     */
    public LogRetentionOptions withMaxCount(int maxCount) {
        return new LogRetentionOptions(maxCount, this.maxAge, this.maxTotalSize);
    }

    /**
     * maxAge만 변경한 새 인스턴스 생성.
     *
     * @param maxAge 새로운 보존 기간
     * @return 새 LogRetentionOptions 인스턴스
     */
    public LogRetentionOptions withMaxAge(Duration maxAge) {
        return new LogRetentionOptions(this.maxCount, maxAge, this.maxTotalSize);
    }

    /**
     * maxTotalSize만 변경한 새 인스턴스 생성.
     *
     * @param maxTotalSize 새로운 최대 총 크기 (bytes)
     * @return 새 LogRetentionOptions 인스턴스
     */
    public LogRetentionOptions withMaxTotalSize(long maxTotalSize) {
        return new LogRetentionOptions(this.maxCount, this.maxAge, maxTotalSize);
    }
}
