package com.ryuqq.maintenance.core.store;

import com.ryuqq.maintenance.core.exception.MaintenanceParamsException;
import com.ryuqq.maintenance.core.exception.OwnershipCheckException;
import com.ryuqq.maintenance.core.exception.ParamsLoadException;
import com.ryuqq.maintenance.core.exception.ParamsLookupException;
import com.ryuqq.maintenance.core.model.EntryMetadata;
import com.ryuqq.maintenance.core.model.MaintenanceParams;
import com.ryuqq.maintenance.core.model.ManifestId;
import com.ryuqq.maintenance.core.picker.LatestEntryPicker;
import com.ryuqq.maintenance.core.spi.ManifestIndexException;
import com.ryuqq.maintenance.core.spi.Repository;
import com.ryuqq.maintenance.core.spi.RepositoryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 저장소 전역 유지보수 파라미터 저장소.
 *
 * <p>manifest index에는 제자리 수정도 잠금도 없습니다. 이 클래스는 조회 → 선택 → 로드
 * 읽기 경로와, commit → retire 2단계 쓰기 경로로 여러 writer가 경쟁해도
 * 하나의 유효한 값으로 수렴하게 합니다.</p>
 *
 * <p><strong>읽기 경로:</strong></p>
 * <pre>
 * 1. find(labels)            → 엔트리 0..N개
 * 2. 0개                     → defaultParams 반환 (오류 아님)
 * 3. 1개 이상                → LatestEntryPicker로 하나 선택
 * 4. load(id)                → MaintenanceParams
 * </pre>
 *
 * <p><strong>쓰기 경로:</strong></p>
 * <pre>
 * 1. beginWrite  → 현재 보이는 엔트리 스냅샷
 * 2. commit      → 새 엔트리 생성 (실패 시 아무것도 삭제하지 않음)
 * 3. retire      → 스냅샷의 엔트리를 하나씩 삭제
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>호출 간 상태가 없으므로 여러 스레드에서 공유해도 안전</li>
 *   <li>백그라운드 작업, 재시도, 타임아웃 없음 (호출자의 책임)</li>
 *   <li>owner 필드는 참고용이며 상호 배제를 제공하지 않음</li>
 * </ul>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public final class MaintenanceParamsStore {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceParamsStore.class);
    private final MaintenanceParamsStoreConfig config;

    /**
     * 기본 설정으로 생성.
     */
    public MaintenanceParamsStore() {
        this(new MaintenanceParamsStoreConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public MaintenanceParamsStore(MaintenanceParamsStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 분류 label과 일치하는 모든 엔트리 조회.
     *
     * <p>중복 엔트리가 얼마나 쌓였는지 확인하는 운영 도구에서도 사용합니다.</p>
     *
     * @param repository 저장소
     * @return 일치하는 엔트리 (비어있을 수 있음)
     * @throws ParamsLookupException 조회 실패 시
     */
    public List<EntryMetadata> findEntries(Repository repository) {
        requireRepository(repository);
        try {
            List<EntryMetadata> entries = repository.manifests().find(config.labels());
            return entries == null ? List.of() : List.copyOf(entries);
        } catch (RuntimeException e) {
            throw new ParamsLookupException(e);
        }
    }

    /**
     * 유지보수 파라미터가 설정되어 있는지 확인.
     *
     * <p>payload를 읽지 않으므로 {@link #getParams(Repository)}보다 가볍습니다.</p>
     *
     * @param repository 저장소
     * @return 엔트리가 하나 이상 있으면 true
     * @throws ParamsLookupException 조회 실패 시
     */
    public boolean hasParams(Repository repository) {
        return !findEntries(repository).isEmpty();
    }

    /**
     * 유지보수 파라미터 조회.
     *
     * <p>엔트리가 없으면 설정된 기본값을 반환합니다. 여러 개면 {@link LatestEntryPicker}가
     * 고른 하나를 반환합니다. 두 클라이언트가 거의 동시에 엔트리를 만든 경우이며,
     * 어느 쪽이든 상관없지만 모든 reader가 같은 쪽을 고릅니다.</p>
     *
     * @param repository 저장소
     * @return 유효한 유지보수 파라미터
     * @throws ParamsLookupException 조회 실패 시
     * @throws ParamsLoadException 엔트리 로드 또는 역직렬화 실패 시
     */
    public MaintenanceParams getParams(Repository repository) {
        List<EntryMetadata> entries = findEntries(repository);
        if (entries.isEmpty()) {
            log.debug("No maintenance manifest found, using defaults");
            return config.defaultParams();
        }
        if (entries.size() > 1) {
            log.debug("Found {} maintenance manifests, picking one", entries.size());
        }

        ManifestId manifestId = LatestEntryPicker.pickId(entries);
        MaintenanceParams params;
        try {
            params = repository.manifests().load(manifestId, MaintenanceParams.class);
        } catch (RuntimeException e) {
            throw new ParamsLoadException(manifestId, e);
        }
        if (params == null) {
            throw new ParamsLoadException(manifestId, new ManifestIndexException("empty payload"));
        }
        return params;
    }

    /**
     * 현재 연결된 클라이언트가 유지보수 소유자인지 확인.
     *
     * <p>참고용 검사입니다. 접근을 허용하거나 거부하지 않으며, 이 프로세스가 유지보수를
     * 맡고 있다고 "믿는지"만 알려줍니다. 기본값이 반환된 경우(소유자 없음)는 false입니다.</p>
     *
     * @param repository 저장소
     * @return owner가 {@code repository.clientIdentity().usernameAtHost()}와 같으면 true
     * @throws OwnershipCheckException 파라미터 조회 실패 시
     */
    public boolean isOwnedByCurrentIdentity(Repository repository) {
        MaintenanceParams params;
        try {
            params = getParams(repository);
        } catch (MaintenanceParamsException e) {
            throw new OwnershipCheckException(e);
        }
        return params.isOwnedBy(repository.clientIdentity());
    }

    /**
     * 2단계 쓰기 시작.
     *
     * <p>현재 보이는 엔트리를 스냅샷으로 잡습니다. 새 엔트리를 만들기 전에 조회해야
     * 나중에 retire 단계가 자기 자신의 엔트리를 지우지 않습니다.</p>
     *
     * @param repository 쓰기 가능한 저장소
     * @return commit 대기 중인 쓰기
     * @throws ParamsLookupException 조회 실패 시
     */
    public ParamsWrite beginWrite(RepositoryWriter repository) {
        List<EntryMetadata> entries = findEntries(repository);
        List<ManifestId> stale = new ArrayList<>(entries.size());
        for (EntryMetadata entry : entries) {
            stale.add(entry.id());
        }
        return new ParamsWrite(repository.manifests(), config.labels(), stale);
    }

    /**
     * 유지보수 파라미터 저장.
     *
     * <p>{@code beginWrite(repository).commit(params).retire()}와 같습니다.
     * retire 중 실패하면 새 엔트리는 이미 저장된 상태로 {@code ParamsRetireException}이 발생합니다.</p>
     *
     * @param repository 쓰기 가능한 저장소
     * @param params 저장할 파라미터
     * @return 새로 저장된 엔트리의 식별자
     * @throws ParamsLookupException 조회 실패 시
     * @throws com.ryuqq.maintenance.core.exception.ParamsCommitException 새 엔트리 생성 실패 시 (기존 엔트리 유지)
     * @throws com.ryuqq.maintenance.core.exception.ParamsRetireException 이전 엔트리 삭제 실패 시
     */
    public ManifestId setParams(RepositoryWriter repository, MaintenanceParams params) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        CommittedWrite committed = beginWrite(repository).commit(params);
        committed.retire();
        return committed.committedId();
    }

    /**
     * 현재 클라이언트를 유지보수 소유자로 기록.
     *
     * <p>현재 파라미터를 읽어 owner만 바꾼 뒤 같은 2단계 쓰기로 저장합니다.
     * 두 클라이언트가 동시에 호출하면 둘 다 자신이 소유자라고 믿을 수 있습니다.</p>
     *
     * @param repository 쓰기 가능한 저장소
     * @return 저장된 파라미터
     * @throws MaintenanceParamsException 읽기 또는 쓰기 실패 시
     */
    public MaintenanceParams claimOwnership(RepositoryWriter repository) {
        String owner = repository.clientIdentity().usernameAtHost();
        MaintenanceParams params = getParams(repository).withOwner(owner);
        setParams(repository, params);
        log.info("Maintenance ownership claimed by {}", owner);
        return params;
    }

    private static void requireRepository(Repository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
    }
}
