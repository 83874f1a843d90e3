package com.ryuqq.milestone.cli.config;

import com.ryuqq.milestone.adapter.runner.EngineConfig;
import com.ryuqq.milestone.application.workflow.WorkflowEnvironment;
import com.ryuqq.milestone.application.workflow.WorkflowKind;
import com.ryuqq.milestone.application.workflow.WorkflowPlan;
import com.ryuqq.milestone.application.workflow.WorkflowSettings;
import com.ryuqq.milestone.core.model.Credential;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RepositoryId;
import com.ryuqq.milestone.core.protection.RateLimiterConfig;
import com.ryuqq.milestone.core.protection.RetryPolicyConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 모든 값이 확정된 명령행 설정.
 *
 * <p>{@link YamlConfigLoader}가 만들고, 명령행 옵션은 {@code withX} 메서드로 덧씌웁니다.</p>
 *
 * @param repository 대상 저장소
 * @param primary 주 자격 증명
 * @param secondary 보조 자격 증명 (nullable)
 * @param workflows 기본값을 덮어쓰는 워크플로우별 설정
 * @param rateLimiter RateLimiter 설정
 * @param retry 재시도 설정
 * @param concurrency 워커 스레드 수 (0이면 워크플로우당 하나)
 * @param maxDuration 실행 제한 시간 (nullable)
 * @param dryRun dry-run 여부
 * @param progressFile 진행 파일 경로
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MilestoneConfig(
    RepositoryId repository,
    Credential primary,
    Credential secondary,
    Map<WorkflowKind, WorkflowSettings> workflows,
    RateLimiterConfig rateLimiter,
    RetryPolicyConfig retry,
    int concurrency,
    Duration maxDuration,
    boolean dryRun,
    Path progressFile
) {

    public static final Path DEFAULT_PROGRESS_FILE = Path.of("progress.json");

    private static final String PLACEHOLDER_MARKER = "${";

    public MilestoneConfig {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        EnumMap<WorkflowKind, WorkflowSettings> copy = new EnumMap<>(WorkflowKind.class);
        if (workflows != null) {
            copy.putAll(workflows);
        }
        workflows = Collections.unmodifiableMap(copy);
        rateLimiter = rateLimiter == null ? new RateLimiterConfig() : rateLimiter;
        retry = retry == null ? new RetryPolicyConfig() : retry;
        progressFile = progressFile == null ? DEFAULT_PROGRESS_FILE : progressFile;
    }

    /**
     * 워크플로우 계획을 만듭니다.
     *
     * <p>리뷰 우회 워크플로우의 reviewer가 설정되지 않으면 보조 자격 증명의 login을 씁니다.</p>
     *
     * @return 엔진에 넘길 계획
     */
    public WorkflowPlan toPlan() {
        WorkflowPlan plan = new WorkflowPlan(new WorkflowEnvironment(repository, primary, secondary), workflows);
        WorkflowSettings review = plan.settingsFor(WorkflowKind.REVIEW_BYPASS);
        if (review.reviewer() == null && secondary != null) {
            plan = plan.with(WorkflowKind.REVIEW_BYPASS, review.withReviewer(secondary.login()));
        }
        return plan;
    }

    public EngineConfig toEngineConfig() {
        return new EngineConfig(concurrency, rateLimiter, retry, maxDuration);
    }

    /**
     * 토큰에 아직 치환되지 않은 {@code ${VAR}} 참조가 남은 역할.
     *
     * @return 자리표시자 토큰을 가진 역할 (모두 치환되었으면 빈 목록)
     */
    public List<CredentialRole> unresolvedCredentials() {
        List<CredentialRole> unresolved = new ArrayList<>();
        if (primary.token().contains(PLACEHOLDER_MARKER)) {
            unresolved.add(CredentialRole.PRIMARY);
        }
        if (secondary != null && secondary.token().contains(PLACEHOLDER_MARKER)) {
            unresolved.add(CredentialRole.SECONDARY);
        }
        return unresolved;
    }

    public MilestoneConfig withDryRun(boolean dryRun) {
        return new MilestoneConfig(repository, primary, secondary, workflows, rateLimiter, retry,
            concurrency, maxDuration, dryRun, progressFile);
    }

    public MilestoneConfig withProgressFile(Path progressFile) {
        return new MilestoneConfig(repository, primary, secondary, workflows, rateLimiter, retry,
            concurrency, maxDuration, dryRun, progressFile);
    }

    public MilestoneConfig withMaxDuration(Duration maxDuration) {
        return new MilestoneConfig(repository, primary, secondary, workflows, rateLimiter, retry,
            concurrency, maxDuration, dryRun, progressFile);
    }

    @Override
    public String toString() {
        return "MilestoneConfig{repository=" + repository + ", primary=" + primary + ", secondary=" + secondary
            + ", workflows=" + workflows.keySet() + ", dryRun=" + dryRun + ", progressFile=" + progressFile + "}";
    }
}
