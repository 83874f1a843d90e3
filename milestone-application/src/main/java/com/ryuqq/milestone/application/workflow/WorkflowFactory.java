package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.workflow.Workflow;

/**
 * WorkflowKind와 설정으로 Workflow 인스턴스 생성.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowFactory {

    private WorkflowFactory() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 계획의 설정으로 워크플로우 생성.
     *
     * @param kind 워크플로우 변형
     * @param plan 실행 계획
     * @return Workflow
     */
    public static Workflow create(WorkflowKind kind, WorkflowPlan plan) {
        WorkflowEnvironment environment = plan.environment();
        WorkflowSettings settings = plan.settingsFor(kind);
        return switch (kind) {
            case BATCH_COUNTER -> new BatchCounterWorkflow(environment, settings);
            case TIME_BOXED -> new TimeBoxedWorkflow(environment, settings);
            case ALTERNATING -> new AlternatingCoAuthorWorkflow(environment, settings);
            case QUESTION_ANSWER -> new QuestionAnswerWorkflow(environment, settings);
            case REVIEW_BYPASS -> new ReviewBypassWorkflow(environment, settings);
        };
    }

    public static Workflow repositorySetup(WorkflowEnvironment environment) {
        return new RepositorySetupWorkflow(environment);
    }
}
