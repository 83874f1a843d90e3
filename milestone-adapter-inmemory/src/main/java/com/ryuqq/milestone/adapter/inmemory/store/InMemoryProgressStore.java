package com.ryuqq.milestone.adapter.inmemory.store;

import com.ryuqq.milestone.core.model.ProgressMutation;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.spi.ProgressStore;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ProgressStore}의 In-memory 구현.
 *
 * <p>레코드는 {@link ConcurrentHashMap}에 두고 {@code commit}은 {@link ConcurrentHashMap#compute} 안에서
 * mutation을 실행합니다. 한 워크플로우의 commit은 순서대로 적용되고 서로 다른 워크플로우는 경합하지 않습니다.</p>
 *
 * <p><strong>용도:</strong></p>
 * <ul>
 *   <li>계약 테스트와 단위 테스트</li>
 *   <li>dry-run용 임시 저장소 ({@link #seededFrom(ProgressStore, Clock)}로 영속 저장소에서 복사)</li>
 * </ul>
 *
 * <p><strong>제약사항:</strong></p>
 * <ul>
 *   <li>프로세스 재시작 시 데이터 손실</li>
 *   <li>실제 실행의 재개 용도로는 부적합</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryProgressStore implements ProgressStore {

    private final ConcurrentHashMap<WorkflowName, ProgressRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryProgressStore() {
        this(Clock.systemUTC());
    }

    public InMemoryProgressStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * {@code source}의 모든 레코드를 복사한 임시 저장소를 만듭니다.
     *
     * <p>이후 임시 저장소에 대한 commit은 {@code source}에 반영되지 않습니다.</p>
     *
     * @param source 복사할 저장소
     * @param clock 초기 레코드용 Clock
     * @return 복사된 저장소
     */
    public static InMemoryProgressStore seededFrom(ProgressStore source, Clock clock) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        InMemoryProgressStore store = new InMemoryProgressStore(clock);
        store.records.putAll(source.loadAll());
        return store;
    }

    @Override
    public Optional<ProgressRecord> load(WorkflowName workflow) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        return Optional.ofNullable(records.get(workflow));
    }

    @Override
    public Map<WorkflowName, ProgressRecord> loadAll() {
        return Collections.unmodifiableMap(new TreeMap<>(records));
    }

    @Override
    public ProgressRecord commit(WorkflowName workflow, ProgressMutation mutation) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }
        return records.compute(workflow, (key, current) -> {
            ProgressRecord base = current != null ? current : ProgressRecord.initial(key, clock.instant());
            ProgressRecord next = mutation.apply(base);
            if (next == null) {
                throw new IllegalStateException("Mutation returned null for " + key);
            }
            base.requireValidSuccessor(next);
            return next;
        });
    }

    /**
     * 모든 레코드를 삭제합니다.
     */
    public void clear() {
        records.clear();
    }

    public int size() {
        return records.size();
    }
}
