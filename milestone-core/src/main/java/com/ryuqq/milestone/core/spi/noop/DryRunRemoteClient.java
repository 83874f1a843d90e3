package com.ryuqq.milestone.core.spi.noop;

import com.ryuqq.milestone.core.model.CoAuthor;
import com.ryuqq.milestone.core.model.RateSnapshot;
import com.ryuqq.milestone.core.model.RepositoryId;
import com.ryuqq.milestone.core.spi.ChangeSet;
import com.ryuqq.milestone.core.spi.CollaboratorStatus;
import com.ryuqq.milestone.core.spi.DiscussionCategory;
import com.ryuqq.milestone.core.spi.RemoteArtifact;
import com.ryuqq.milestone.core.spi.RemoteClient;
import com.ryuqq.milestone.core.spi.RemoteRepository;
import com.ryuqq.milestone.core.spi.RemoteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dry-run RemoteClient 구현.
 *
 * <p>네트워크 효과 없이 항상 합성된 성공 응답을 반환합니다. 상태 머신과 로깅 경로는
 * 실제 실행과 동일하게 동작합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>생성 계열 호출: 멱등성 키별로 한 번만 합성 artefact 생성, 같은 키는 같은 결과</li>
 *   <li>저장소 조회: 항상 존재</li>
 *   <li>토론 카테고리: 답변 가능한 Q&amp;A 카테고리 하나</li>
 *   <li>협업자 추가: 항상 ACTIVE</li>
 *   <li>응답에 예산 스냅샷을 싣지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DryRunRemoteClient implements RemoteClient {

    private static final Logger log = LoggerFactory.getLogger(DryRunRemoteClient.class);

    private static final long SYNTHETIC_LIMIT = 5000;

    private final String login;
    private final Clock clock;
    private final ConcurrentMap<String, RemoteArtifact> artifacts = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * 생성자.
     *
     * @param login 이 클라이언트가 흉내 내는 사용자
     * @param clock 합성 예산 초기화 시각 계산용
     */
    public DryRunRemoteClient(String login, Clock clock) {
        if (login == null || login.isBlank()) {
            throw new IllegalArgumentException("login cannot be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.login = login;
        this.clock = clock;
    }

    @Override
    public RemoteResponse<String> authenticatedLogin() {
        return RemoteResponse.of(login);
    }

    @Override
    public RemoteResponse<RateSnapshot> rateLimit() {
        return RemoteResponse.of(new RateSnapshot(SYNTHETIC_LIMIT, SYNTHETIC_LIMIT, clock.instant().plus(Duration.ofHours(1))));
    }

    @Override
    public RemoteResponse<Optional<RemoteRepository>> findRepository(RepositoryId repository) {
        return RemoteResponse.of(Optional.of(new RemoteRepository(repository, "main")));
    }

    @Override
    public RemoteResponse<RemoteRepository> createRepository(RepositoryId repository, String description, String idempotencyKey) {
        synthesize("createRepository", idempotencyKey);
        return RemoteResponse.of(new RemoteRepository(repository, "main"));
    }

    @Override
    public RemoteResponse<RemoteArtifact> mergeChangeSet(RepositoryId repository, ChangeSet changeSet, String idempotencyKey) {
        return RemoteResponse.of(synthesize("mergeChangeSet", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> createIssue(RepositoryId repository, String title, String body, String idempotencyKey) {
        return RemoteResponse.of(synthesize("createIssue", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> closeIssue(RepositoryId repository, long number, String idempotencyKey) {
        return RemoteResponse.of(synthesize("closeIssue", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> createCoAuthoredCommit(RepositoryId repository, ChangeSet changeSet,
                                                                 CoAuthor coAuthor, String idempotencyKey) {
        return RemoteResponse.of(synthesize("createCoAuthoredCommit", idempotencyKey));
    }

    @Override
    public RemoteResponse<CollaboratorStatus> addCollaborator(RepositoryId repository, String collaborator, String idempotencyKey) {
        synthesize("addCollaborator", idempotencyKey);
        return RemoteResponse.of(CollaboratorStatus.ACTIVE);
    }

    @Override
    public RemoteResponse<Boolean> acceptInvitation(RepositoryId repository, String idempotencyKey) {
        synthesize("acceptInvitation", idempotencyKey);
        return RemoteResponse.of(Boolean.FALSE);
    }

    @Override
    public RemoteResponse<List<DiscussionCategory>> discussionCategories(RepositoryId repository) {
        return RemoteResponse.of(List.of(new DiscussionCategory("dry-run-category", "Q&A", "q-a", true)));
    }

    @Override
    public RemoteResponse<RemoteArtifact> createDiscussion(RepositoryId repository, String categoryId, String title,
                                                           String body, String idempotencyKey) {
        return RemoteResponse.of(synthesize("createDiscussion", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> postDiscussionComment(String discussionId, String body, String idempotencyKey) {
        return RemoteResponse.of(synthesize("postDiscussionComment", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> markCommentAccepted(String commentId, String idempotencyKey) {
        return RemoteResponse.of(synthesize("markCommentAccepted", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> createBypassPullRequest(RepositoryId repository, ChangeSet changeSet,
                                                                  String reviewer, String idempotencyKey) {
        return RemoteResponse.of(synthesize("createBypassPullRequest", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> mergePullRequest(RepositoryId repository, long number, String idempotencyKey) {
        return RemoteResponse.of(synthesize("mergePullRequest", idempotencyKey));
    }

    /**
     * 지금까지 합성한 artefact 수.
     *
     * @return 고유 멱등성 키 수
     */
    public int synthesizedCount() {
        return artifacts.size();
    }

    private RemoteArtifact synthesize(String operation, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("idempotencyKey cannot be null or blank");
        }
        return artifacts.computeIfAbsent(idempotencyKey, key -> {
            long number = sequence.incrementAndGet();
            log.info("[dry-run] {} as {} ({})", operation, login, key);
            return new RemoteArtifact("dry-run-" + number, number, null);
        });
    }
}
