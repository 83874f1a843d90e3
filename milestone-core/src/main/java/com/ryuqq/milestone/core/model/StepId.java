package com.ryuqq.milestone.core.model;

/**
 * 단계의 결정적 식별자.
 *
 * <p>워크플로우 이름과 단계 인덱스(또는 설정 단계 레이블)로부터 파생됩니다.
 * 같은 진행 기록에서 재개하면 항상 같은 StepId가 계산되므로, 원격 호출의 멱등성 키로 사용됩니다.</p>
 *
 * <p><strong>형식:</strong></p>
 * <ul>
 *   <li>카운터 단계: {@code <workflow>/step-<index>}</li>
 *   <li>설정 단계: {@code <workflow>/setup-<label>}</li>
 *   <li>하위 호출 키: {@code <stepId>/<part>}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepId {

    private final String value;

    private StepId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StepId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("StepId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-z0-9][a-z0-9\\-_]*/[a-z0-9][a-z0-9\\-_]*$")) {
            throw new IllegalArgumentException("StepId must be in <workflow>/<label> form: " + value);
        }
        this.value = value;
    }

    /**
     * 카운터 단계 식별자 생성.
     *
     * @param workflow 워크플로우 이름
     * @param index 단계 인덱스 (1 이상)
     * @return StepId
     * @throws IllegalArgumentException index가 양수가 아닌 경우
     */
    public static StepId indexed(WorkflowName workflow, long index) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (index <= 0) {
            throw new IllegalArgumentException("index must be positive (current: " + index + ")");
        }
        return new StepId(workflow.getValue() + "/step-" + index);
    }

    /**
     * 설정 단계 식별자 생성.
     *
     * @param workflow 워크플로우 이름
     * @param label 설정 레이블 (예: "collaborator")
     * @return StepId
     */
    public static StepId setup(WorkflowName workflow, String label) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        return new StepId(workflow.getValue() + "/setup-" + label);
    }

    /**
     * 시도 단위 식별자 생성.
     *
     * <p>같은 단계를 처음부터 다시 시도해야 할 때, 이전 시도와 멱등성 키가 겹치지 않도록 사용합니다.</p>
     *
     * @param workflow 워크플로우 이름
     * @param attempt 시도 번호 (1 이상)
     * @return StepId
     */
    public static StepId attempt(WorkflowName workflow, long attempt) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        return new StepId(workflow.getValue() + "/attempt-" + attempt);
    }

    /**
     * 저장된 문자열로부터 복원.
     *
     * @param value StepId 문자열
     * @return StepId
     */
    public static StepId parse(String value) {
        return new StepId(value);
    }

    /**
     * 하위 호출용 멱등성 키 생성.
     *
     * <p>한 단계가 여러 원격 호출로 구성될 때 각 호출을 구분합니다.</p>
     *
     * @param part 하위 호출 이름 (예: "question", "answer")
     * @return 멱등성 키
     */
    public String subKey(String part) {
        if (part == null || part.isBlank()) {
            throw new IllegalArgumentException("part cannot be null or blank");
        }
        return value + "/" + part;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepId stepId = (StepId) o;
        return value.equals(stepId.value);
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
