package com.ryuqq.milestone.adapter.file;

/**
 * 진행 파일을 읽거나 쓰는 중 발생한 I/O 실패.
 *
 * <p>쓰기에 실패해도 디스크의 커밋된 진행 상황은 바뀌지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProgressStoreException extends RuntimeException {

    public ProgressStoreException(String message) {
        super(message);
    }

    public ProgressStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
