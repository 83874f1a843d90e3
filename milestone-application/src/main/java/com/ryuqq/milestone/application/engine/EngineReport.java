package com.ryuqq.milestone.application.engine;

import com.ryuqq.milestone.application.runner.RunStatistics;
import com.ryuqq.milestone.application.runner.WorkflowReport;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RateBudget;
import com.ryuqq.milestone.core.model.WorkflowName;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 엔진 실행 결과.
 *
 * @param reports 워크플로우별 결과 (실행 순서)
 * @param dryRun dry-run 실행 여부
 * @param elapsed 전체 소요 시간
 * @param budgets 실행 종료 시점의 역할별 예산 (조회된 역할만)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EngineReport(List<WorkflowReport> reports, boolean dryRun, Duration elapsed,
                           Map<CredentialRole, RateBudget> budgets) {

    public EngineReport {
        reports = reports == null ? List.of() : List.copyOf(reports);
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
        budgets = budgets == null || budgets.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(budgets));
    }

    public EngineReport(List<WorkflowReport> reports, boolean dryRun, Duration elapsed) {
        this(reports, dryRun, elapsed, Map.of());
    }

    /**
     * 모든 워크플로우가 COMPLETED, BLOCKED, DISABLED 중 하나로 끝났는지 여부.
     *
     * @return 성공이면 true
     */
    public boolean allSuccessful() {
        return reports.stream().allMatch(r -> r.getStatus().isSuccessful());
    }

    public Optional<WorkflowReport> find(WorkflowName workflow) {
        return reports.stream().filter(r -> r.getWorkflow().equals(workflow)).findFirst();
    }

    /**
     * 모든 워크플로우의 호출 통계 합계.
     *
     * @return 합산된 RunStatistics
     */
    public RunStatistics totals() {
        return reports.stream().map(WorkflowReport::getStatistics).reduce(RunStatistics.EMPTY, RunStatistics::plus);
    }

    public int totalStepsExecuted() {
        return reports.stream().mapToInt(WorkflowReport::getStepsExecuted).sum();
    }
}
