package com.ryuqq.milestone.core.spi;

import com.ryuqq.milestone.core.model.ProgressMutation;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.WorkflowName;

import java.util.Map;
import java.util.Optional;

/**
 * 워크플로우별 진행 상황을 크래시에 안전하게 보관하는 저장소.
 *
 * <p>카운터, 통과한 임계값, 체크포인트, 속성은 {@link #commit}으로만 바뀝니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>원자성: commit 도중 크래시가 나도 이전 레코드나 새 레코드 중 하나가 온전히 남아야 함</li>
 *   <li>순서: 한 워크플로우의 commit은 순서대로 적용. 서로 다른 워크플로우는 동시에 commit 가능</li>
 *   <li>불변식: 모든 commit은 저장된 레코드 기준으로
 *       {@link ProgressRecord#requireValidSuccessor(ProgressRecord)} 검사를 통과해야 함</li>
 *   <li>전방 호환: 저장된 데이터의 알 수 없는 워크플로우나 필드 때문에 로딩이 실패하면 안 됨</li>
 * </ul>
 *
 * <p>엔진 시작 시 열고 종료 시 닫습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ProgressStore extends AutoCloseable {

    /**
     * 워크플로우의 레코드를 읽습니다.
     *
     * @param workflow 워크플로우 이름
     * @return 마지막으로 커밋된 레코드 (커밋한 적이 없으면 empty)
     * @throws IllegalArgumentException workflow가 null인 경우
     */
    Optional<ProgressRecord> load(WorkflowName workflow);

    /**
     * 저장된 모든 레코드를 읽습니다.
     *
     * @return 워크플로우 이름별 레코드 (이름순)
     */
    Map<WorkflowName, ProgressRecord> loadAll();

    /**
     * 현재 레코드에 변경을 적용하고 결과를 원자적으로 저장합니다.
     *
     * <p>레코드가 아직 없으면 mutation은
     * {@link ProgressRecord#initial(WorkflowName, java.time.Instant)}을 받습니다.</p>
     *
     * @param workflow 워크플로우 이름
     * @param mutation 적용할 변경
     * @return 커밋된 레코드
     * @throws IllegalArgumentException workflow 또는 mutation이 null인 경우
     * @throws IllegalStateException 결과가 진행 불변식을 위반하는 경우
     */
    ProgressRecord commit(WorkflowName workflow, ProgressMutation mutation);

    /**
     * 자원을 해제합니다. 기본 구현은 아무것도 하지 않습니다.
     */
    @Override
    default void close() {
    }
}
