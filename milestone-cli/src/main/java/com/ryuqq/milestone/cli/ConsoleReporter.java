package com.ryuqq.milestone.cli;

import com.ryuqq.milestone.application.engine.EngineReport;
import com.ryuqq.milestone.application.runner.RunStatistics;
import com.ryuqq.milestone.application.runner.WorkflowListener;
import com.ryuqq.milestone.application.runner.WorkflowReport;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.RateBudget;
import com.ryuqq.milestone.core.model.WorkflowName;

import java.io.PrintWriter;
import java.util.Map;

/**
 * 운영자에게 마일스톤 이벤트와 실행 요약을 출력합니다.
 *
 * <p>리스너 콜백은 워커 스레드에서 호출되므로 출력은 writer 단위로 직렬화합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConsoleReporter implements WorkflowListener {

    private final PrintWriter out;

    public ConsoleReporter(PrintWriter out) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.out = out;
    }

    @Override
    public void thresholdCrossed(WorkflowName workflow, long threshold) {
        synchronized (out) {
            out.printf("[%s] milestone reached: %d%n", workflow, threshold);
            out.flush();
        }
    }

    @Override
    public void workflowFinished(WorkflowReport report) {
        synchronized (out) {
            out.printf("[%s] %s%n", report.getWorkflow(), describe(report));
            out.flush();
        }
    }

    /**
     * 워크플로우별 결과와 호출 통계, 합계, 자격 증명별 남은 예산을 출력합니다.
     *
     * @param out 출력 대상
     * @param report 엔진 실행 결과
     */
    public static void printSummary(PrintWriter out, EngineReport report) {
        synchronized (out) {
            out.printf("%nRun %s in %ds%s%n", report.allSuccessful() ? "finished" : "stopped",
                report.elapsed().toSeconds(), report.dryRun() ? " (dry run, nothing was changed)" : "");
            for (WorkflowReport workflow : report.reports()) {
                out.printf("  %-22s %s%n", workflow.getWorkflow(), describe(workflow));
                out.printf("  %-22s %s%n", "", statistics(workflow.getStepsExecuted(), workflow.getStatistics()));
            }
            out.printf("  %-22s %s%n", "total", statistics(report.totalStepsExecuted(), report.totals()));
            for (Map.Entry<CredentialRole, RateBudget> entry : report.budgets().entrySet()) {
                RateBudget budget = entry.getValue();
                out.printf("  %-22s %d/%d remaining%s%n", entry.getKey() + " budget",
                    budget.remaining(), budget.limit(),
                    budget.resetAt() == null ? "" : ", resets at " + budget.resetAt());
            }
            if (!report.allSuccessful()) {
                out.println("Rerun the same command to resume from the last committed step.");
            }
            out.flush();
        }
    }

    /**
     * 워크플로우별 커밋된 진행 상황을 출력합니다.
     *
     * @param out 출력 대상
     * @param records 워크플로우별 커밋된 레코드
     * @param targets 워크플로우별 최종 임계값 (없으면 "-"로 출력)
     */
    public static void printStatus(PrintWriter out, Map<WorkflowName, ProgressRecord> records,
                                   Map<WorkflowName, Long> targets) {
        if (records.isEmpty()) {
            out.println("No progress recorded yet.");
            out.flush();
            return;
        }
        out.printf("%-22s %-13s %-10s %-28s %s%n", "WORKFLOW", "PROGRESS", "STATE", "THRESHOLDS", "LAST STEP");
        records.forEach((name, record) -> {
            Long target = targets.get(name);
            String progress = record.counter() + "/" + (target == null ? "-" : String.valueOf(target));
            out.printf("%-22s %-13s %-10s %-28s %s%n",
                name,
                progress,
                record.completed() ? "completed" : "open",
                record.crossedThresholds(),
                record.lastStepId() == null ? "-" : record.lastStepId());
        });
        out.flush();
    }

    static String statistics(int steps, RunStatistics statistics) {
        return String.format("%d steps, %d calls (%d failed), %d checkpoints, paused %ds",
            steps, statistics.remoteCalls(), statistics.failedCalls(), statistics.checkpoints(),
            statistics.paused().toSeconds());
    }

    private static String describe(WorkflowReport report) {
        StringBuilder line = new StringBuilder(report.getStatus().name());
        if (report.getFailureKind() != null) {
            line.append(" (").append(report.getFailureKind()).append(')');
        }
        if (report.getStepId() != null) {
            line.append(" at ").append(report.getStepId());
        }
        if (report.getRecord() != null) {
            line.append(", counter ").append(report.getRecord().counter());
        }
        if (report.getMessage() != null) {
            line.append(": ").append(report.getMessage());
        }
        return line.toString();
    }
}
