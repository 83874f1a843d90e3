package com.ryuqq.milestone.core.model;

/**
 * 워크플로우의 고유 이름.
 *
 * <p>진행 기록의 키로 사용되며, 단계 식별자({@link StepId})의 접두어가 됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 소문자 영숫자로 시작, 소문자 영숫자/하이픈(-)/언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowName implements Comparable<WorkflowName> {

    private final String value;

    private WorkflowName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkflowName cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("WorkflowName length cannot exceed 64 characters");
        }
        if (!value.matches("^[a-z0-9][a-z0-9\\-_]*$")) {
            throw new IllegalArgumentException(
                "WorkflowName contains invalid characters. Only lowercase alphanumeric, hyphen, and underscore are allowed: " + value
            );
        }
        this.value = value;
    }

    /**
     * WorkflowName 생성.
     *
     * @param value 이름
     * @return WorkflowName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static WorkflowName of(String value) {
        return new WorkflowName(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(WorkflowName other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowName that = (WorkflowName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
