package com.ryuqq.milestone.core.spi;

import com.ryuqq.milestone.core.model.CoAuthor;
import com.ryuqq.milestone.core.model.RateSnapshot;
import com.ryuqq.milestone.core.model.RepositoryId;

import java.util.List;
import java.util.Optional;

/**
 * 자격 증명 하나에 묶인 원격 협업 API.
 *
 * <p>엔진은 이 계약에만 의존합니다. 구현체는 이 저장소 밖에 있고 CLI가 찾아 씁니다.
 * 함께 배포되는 구현체는 {@link com.ryuqq.milestone.core.spi.noop.DryRunRemoteClient}뿐입니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>멱등성: 모든 변경 연산은 멱등성 키를 받습니다. 같은 키로 다시 호출하면 두 번째 산출물을
 *       만들지 않고 첫 호출이 만든 산출물을 돌려줘야 합니다.</li>
 *   <li>실패: HTTP 상태, 오류 코드, 보고된 경우 남은 할당량과 초기화 시각을 담은
 *       {@link RemoteCallException}을 던집니다.</li>
 *   <li>예산: 서버가 보고한 {@link RateSnapshot}이 있으면 모든 응답에 붙입니다.</li>
 *   <li>Thread-safe: 동시에 실행되는 워크플로우가 한 인스턴스를 공유할 수 있습니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RemoteClient {

    /**
     * 자격 증명으로 인증된 login을 반환합니다.
     *
     * @return 인증된 login
     */
    RemoteResponse<String> authenticatedLogin();

    /**
     * 현재 1차 예산을 반환합니다. 이 호출은 예산을 소비하지 않습니다.
     *
     * @return 예산 스냅샷
     */
    RemoteResponse<RateSnapshot> rateLimit();

    /**
     * 저장소를 조회합니다.
     *
     * @param repository owner/name
     * @return 저장소 (없으면 empty)
     */
    RemoteResponse<Optional<RemoteRepository>> findRepository(RepositoryId repository);

    /**
     * 기본 브랜치가 초기화된 저장소를 만듭니다.
     *
     * @param repository owner/name
     * @param description 저장소 설명
     * @param idempotencyKey 멱등성 키
     * @return 생성된 저장소
     */
    RemoteResponse<RemoteRepository> createRepository(RepositoryId repository, String description, String idempotencyKey);

    /**
     * 변경을 담은 브랜치를 만들고 Pull Request를 열어 병합합니다.
     *
     * @param repository owner/name
     * @param changeSet 변경 (branch가 작업 브랜치)
     * @param idempotencyKey 멱등성 키
     * @return 병합된 Pull Request
     */
    RemoteResponse<RemoteArtifact> mergeChangeSet(RepositoryId repository, ChangeSet changeSet, String idempotencyKey);

    RemoteResponse<RemoteArtifact> createIssue(RepositoryId repository, String title, String body, String idempotencyKey);

    RemoteResponse<RemoteArtifact> closeIssue(RepositoryId repository, long number, String idempotencyKey);

    /**
     * 이 자격 증명으로 변경을 커밋하고 공동 작성자를 커밋 메타데이터에 남깁니다.
     *
     * @param repository owner/name
     * @param changeSet 변경 (branch가 null이면 기본 브랜치)
     * @param coAuthor 커밋에 기록할 공동 작성자
     * @param idempotencyKey 멱등성 키
     * @return 커밋 (id는 commit sha)
     */
    RemoteResponse<RemoteArtifact> createCoAuthoredCommit(RepositoryId repository, ChangeSet changeSet,
                                                          CoAuthor coAuthor, String idempotencyKey);

    RemoteResponse<CollaboratorStatus> addCollaborator(RepositoryId repository, String login, String idempotencyKey);

    /**
     * 이 자격 증명으로 저장소의 대기 중인 협업 초대를 수락합니다.
     *
     * @param repository owner/name
     * @param idempotencyKey 멱등성 키
     * @return 초대를 수락했으면 true, 대기 중인 초대가 없으면 false
     */
    RemoteResponse<Boolean> acceptInvitation(RepositoryId repository, String idempotencyKey);

    /**
     * Discussion 카테고리 목록을 조회합니다.
     *
     * @param repository owner/name
     * @return 카테고리 목록 (Discussion이 꺼져 있으면 빈 목록)
     */
    RemoteResponse<List<DiscussionCategory>> discussionCategories(RepositoryId repository);

    RemoteResponse<RemoteArtifact> createDiscussion(RepositoryId repository, String categoryId, String title,
                                                    String body, String idempotencyKey);

    RemoteResponse<RemoteArtifact> postDiscussionComment(String discussionId, String body, String idempotencyKey);

    RemoteResponse<RemoteArtifact> markCommentAccepted(String commentId, String idempotencyKey);

    /**
     * {@code reviewer}에게 리뷰를 요청하되 리뷰 없이도 병합할 수 있는 Pull Request를 엽니다.
     *
     * @param repository owner/name
     * @param changeSet 변경 (branch가 작업 브랜치)
     * @param reviewer 리뷰를 요청할 login
     * @param idempotencyKey 멱등성 키
     * @return Pull Request
     */
    RemoteResponse<RemoteArtifact> createBypassPullRequest(RepositoryId repository, ChangeSet changeSet,
                                                           String reviewer, String idempotencyKey);

    RemoteResponse<RemoteArtifact> mergePullRequest(RepositoryId repository, long number, String idempotencyKey);
}
