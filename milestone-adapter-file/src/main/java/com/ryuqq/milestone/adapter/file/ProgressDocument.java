package com.ryuqq.milestone.adapter.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 진행 파일의 디스크 형식.
 *
 * <pre>
 * { "formatVersion": 1, "updatedAt": "...", "workflows": { "&lt;name&gt;": { ... } } }
 * </pre>
 *
 * <p>알 수 없는 속성은 무시하므로 새 버전이 쓴 파일도 읽을 수 있습니다.</p>
 *
 * @param formatVersion 형식 버전
 * @param updatedAt 마지막 쓰기 시각
 * @param workflows 워크플로우 이름별 레코드
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgressDocument(int formatVersion, Instant updatedAt, Map<String, Entry> workflows) {

    static final int FORMAT_VERSION = 1;

    public ProgressDocument {
        workflows = workflows == null ? Map.of() : workflows;
    }

    static ProgressDocument of(Map<WorkflowName, ProgressRecord> records, Instant now) {
        Map<String, Entry> entries = new TreeMap<>();
        records.forEach((name, record) -> entries.put(name.getValue(), Entry.from(record)));
        return new ProgressDocument(FORMAT_VERSION, now, entries);
    }

    /**
     * @throws IllegalArgumentException 항목이 레코드 불변식을 위반하는 경우
     */
    Map<WorkflowName, ProgressRecord> toRecords() {
        Map<WorkflowName, ProgressRecord> records = new TreeMap<>();
        workflows.forEach((name, entry) -> {
            WorkflowName workflow = WorkflowName.of(name);
            records.put(workflow, entry.toRecord(workflow));
        });
        return records;
    }

    /**
     * 워크플로우 하나의 레코드.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
        long counter,
        List<Long> crossedThresholds,
        String lastStepId,
        boolean completed,
        Instant updatedAt,
        String checkpointStepId,
        Map<String, String> checkpoints,
        Map<String, String> attributes
    ) {

        static Entry from(ProgressRecord record) {
            return new Entry(
                record.counter(),
                record.crossedThresholds(),
                record.lastStepId() == null ? null : record.lastStepId().getValue(),
                record.completed(),
                record.updatedAt(),
                record.checkpointStepId() == null ? null : record.checkpointStepId().getValue(),
                new LinkedHashMap<>(record.checkpoints()),
                new LinkedHashMap<>(record.attributes())
            );
        }

        ProgressRecord toRecord(WorkflowName workflow) {
            return new ProgressRecord(
                workflow,
                counter,
                crossedThresholds,
                lastStepId == null ? null : StepId.parse(lastStepId),
                completed,
                updatedAt == null ? Instant.EPOCH : updatedAt,
                checkpointStepId == null ? null : StepId.parse(checkpointStepId),
                checkpoints,
                attributes
            );
        }
    }
}
