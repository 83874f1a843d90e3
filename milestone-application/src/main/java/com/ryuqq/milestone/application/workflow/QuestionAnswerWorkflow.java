package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.spi.DiscussionCategory;
import com.ryuqq.milestone.core.spi.RemoteArtifact;
import com.ryuqq.milestone.core.workflow.NextStep;
import com.ryuqq.milestone.core.workflow.StepAction;
import com.ryuqq.milestone.core.workflow.StepContext;
import com.ryuqq.milestone.core.workflow.StepOutcome;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 질문 → 답변 → 채택 사이클 워크플로우.
 *
 * <p><strong>준비 단계:</strong></p>
 * <ol>
 *   <li>discussions: 토론 카테고리 선택 (없으면 Blocked)</li>
 *   <li>collaborator: 보조 자격 증명 협업자 등록</li>
 * </ol>
 *
 * <p><strong>반복 단계 체크포인트:</strong></p>
 * <ul>
 *   <li>question: PRIMARY가 연 토론 ID</li>
 *   <li>answer: SECONDARY가 단 답변 ID</li>
 * </ul>
 *
 * <p>재개 시 체크포인트가 있는 하위 호출은 다시 하지 않으므로 질문이 중복 생성되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QuestionAnswerWorkflow extends AbstractThresholdWorkflow {

    static final String CATEGORY_ATTRIBUTE = "discussion.category";
    static final String QUESTION = "question";
    static final String ANSWER = "answer";

    private static final Comparator<DiscussionCategory> PREFERENCE = Comparator
        .comparingInt(QuestionAnswerWorkflow::rank);

    private final CollaboratorSetup collaboratorSetup;

    public QuestionAnswerWorkflow(WorkflowEnvironment environment, WorkflowSettings settings) {
        super(WorkflowKind.QUESTION_ANSWER.workflowName(), environment, settings);
        this.collaboratorSetup = new CollaboratorSetup(name, environment, settings.autoAcceptInvitation());
    }

    @Override
    protected Optional<NextStep> setup(ProgressRecord progress) {
        if (progress.attribute(CATEGORY_ATTRIBUTE).isEmpty()) {
            return Optional.of(new NextStep.Step(
                StepId.setup(name, "discussions"),
                "select discussion category",
                this::selectCategory
            ));
        }
        return collaboratorSetup.stepFor(progress);
    }

    private StepOutcome selectCategory(StepContext context) throws InterruptedException {
        AttemptOutcome<List<DiscussionCategory>> categories = context.call(CredentialRole.PRIMARY,
            client -> client.discussionCategories(environment.repository()));
        if (!categories.isSuccess()) {
            return StepOutcome.failed(categories);
        }
        Optional<DiscussionCategory> chosen = choose(categories.payload());
        if (chosen.isEmpty()) {
            return StepOutcome.blocked("discussions are not enabled on " + environment.repository()
                + "; enable discussions and run again");
        }
        return StepOutcome.recorded(Map.of(CATEGORY_ATTRIBUTE, chosen.get().id()));
    }

    /**
     * 카테고리 선택 순서: 답변 채택 가능 → slug q-a/qa → 이름 general → 첫 번째.
     *
     * @param categories 저장소의 카테고리
     * @return 선택된 카테고리 (목록이 비었으면 empty)
     */
    static Optional<DiscussionCategory> choose(List<DiscussionCategory> categories) {
        if (categories == null || categories.isEmpty()) {
            return Optional.empty();
        }
        return categories.stream().min(PREFERENCE);
    }

    private static int rank(DiscussionCategory category) {
        if (category.answerable()) {
            return 0;
        }
        String slug = category.slug() == null ? "" : category.slug().toLowerCase(Locale.ROOT);
        if (slug.equals("q-a") || slug.equals("qa")) {
            return 1;
        }
        if (category.name() != null && category.name().equalsIgnoreCase("general")) {
            return 2;
        }
        return 3;
    }

    @Override
    protected StepAction action(long index) {
        return context -> {
            if (!context.hasCredential(CredentialRole.SECONDARY)) {
                return StepOutcome.failed(FailureKind.PRECONDITION, "secondary credential is required for " + name);
            }
            String categoryId = context.progress().attribute(CATEGORY_ATTRIBUTE).orElseThrow();

            String questionId = context.checkpoints().get(QUESTION);
            if (questionId == null) {
                AttemptOutcome<RemoteArtifact> question = context.call(CredentialRole.PRIMARY,
                    client -> client.createDiscussion(environment.repository(), categoryId,
                        "Question " + index,
                        "How would you approach item " + index + "?",
                        context.stepId().subKey(QUESTION)));
                if (!question.isSuccess()) {
                    return StepOutcome.failed(question);
                }
                questionId = question.payload().id();
                context.checkpoint(QUESTION, questionId);
            }

            String answerId = context.checkpoints().get(ANSWER);
            if (answerId == null) {
                String discussionId = questionId;
                AttemptOutcome<RemoteArtifact> answer = context.call(CredentialRole.SECONDARY,
                    client -> client.postDiscussionComment(discussionId,
                        "Answer to question " + index,
                        context.stepId().subKey(ANSWER)));
                if (!answer.isSuccess()) {
                    return StepOutcome.failed(answer);
                }
                answerId = answer.payload().id();
                context.checkpoint(ANSWER, answerId);
            }

            String commentId = answerId;
            AttemptOutcome<RemoteArtifact> accepted = context.call(CredentialRole.PRIMARY,
                client -> client.markCommentAccepted(commentId, context.stepId().subKey("accept")));
            if (!accepted.isSuccess()) {
                return StepOutcome.failed(accepted);
            }
            return StepOutcome.advanced();
        };
    }
}
