package com.ryuqq.maintenance.core.model;

/**
 * Manifest 엔트리의 불투명(opaque) 식별자.
 *
 * <p>식별자는 백엔드가 엔트리 생성 시 발급하며, 엔트리 자체와 마찬가지로 불변입니다.
 * 여러 프로세스가 같은 엔트리 집합을 보고 같은 엔트리를 고를 수 있도록
 * {@link String#compareTo(String)} 순서(UTF-16 code unit 순서)로 전순서(total order)를 정의합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public final class ManifestId implements Comparable<ManifestId> {

    private final String value;

    private ManifestId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ManifestId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ManifestId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * ManifestId 생성.
     *
     * @param value 식별자 값
     * @return ManifestId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ManifestId of(String value) {
        return new ManifestId(value);
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ManifestId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ManifestId that = (ManifestId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ManifestId{" + value + '}';
    }
}
