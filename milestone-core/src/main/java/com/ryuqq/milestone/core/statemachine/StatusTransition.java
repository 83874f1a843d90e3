package com.ryuqq.milestone.core.statemachine;

/**
 * 워크플로우 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING, DISABLED, STOPPED_RESUMABLE, CANCELLED</li>
 *   <li>RUNNING → COMPLETED, BLOCKED, STOPPED_RESUMABLE, STOPPED_UNACHIEVABLE, CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkflowStatus from, WorkflowStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        // 허용된 전이만 통과
        boolean valid = switch (from) {
            case PENDING -> to == WorkflowStatus.RUNNING
                || to == WorkflowStatus.DISABLED
                || to == WorkflowStatus.STOPPED_RESUMABLE
                || to == WorkflowStatus.CANCELLED;
            case RUNNING -> to.isTerminal() && to != WorkflowStatus.DISABLED;
            default -> false; // 종료 상태 (위에서 이미 체크)
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static WorkflowStatus transition(WorkflowStatus current, WorkflowStatus next) {
        validate(current, next);
        return next;
    }
}
