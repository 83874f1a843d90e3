package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.core.model.RateSnapshot;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.Fatal;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.outcome.Retryable;
import com.ryuqq.milestone.core.spi.RemoteCallException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * RemoteCallException을 AttemptOutcome으로 분류.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>429, 또는 403 + (remaining=0 | 요청 제한 오류 코드 | Retry-After) → THROTTLED</li>
 *   <li>응답 없음(네트워크), 408, 5xx → TRANSIENT</li>
 *   <li>401, 403 → AUTH</li>
 *   <li>404, 410 → PRECONDITION</li>
 *   <li>나머지 4xx → VALIDATION</li>
 * </ul>
 *
 * <p>THROTTLED의 retryAt: Retry-After → 스냅샷 resetAt → now + throttleWait 순.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RemoteErrorClassifier {

    /**
     * 기본 요청 한도 초과 오류 코드.
     */
    public static final String PRIMARY_LIMIT_CODE = "rate_limited";

    /**
     * 남용 감지(secondary limit) 오류 코드. 쿨다운 대상.
     */
    public static final String SECONDARY_LIMIT_CODE = "secondary_rate_limited";

    private static final Set<String> THROTTLE_CODES = Set.of(PRIMARY_LIMIT_CODE, SECONDARY_LIMIT_CODE, "abuse_detected");

    private final Duration throttleWait;

    public RemoteErrorClassifier(Duration throttleWait) {
        if (throttleWait == null || throttleWait.isNegative()) {
            throw new IllegalArgumentException("throttleWait must be non-negative");
        }
        this.throttleWait = throttleWait;
    }

    /**
     * 실패 분류.
     *
     * @param e 원격 호출 실패
     * @param now 현재 시각
     * @param <T> 결과 타입
     * @return Retryable(THROTTLED | TRANSIENT) 또는 Fatal
     */
    public <T> AttemptOutcome<T> classify(RemoteCallException e, Instant now) {
        int status = e.getStatus();
        String message = e.getMessage() == null ? "HTTP " + status : e.getMessage();

        if (isThrottled(e)) {
            return new Retryable<>(FailureKind.THROTTLED, message, retryAt(e, now));
        }
        if (status == RemoteCallException.NO_RESPONSE || status == 408 || status >= 500) {
            return new Retryable<>(FailureKind.TRANSIENT, message, null);
        }
        String code = e.getErrorCode() != null ? e.getErrorCode() : "HTTP-" + status;
        if (status == 401 || status == 403) {
            return new Fatal<>(FailureKind.AUTH, code, message);
        }
        if (status == 404 || status == 410) {
            return new Fatal<>(FailureKind.PRECONDITION, code, message);
        }
        return new Fatal<>(FailureKind.VALIDATION, code, message);
    }

    /**
     * 쿨다운 신호 여부.
     *
     * <p>소진된 스냅샷의 resetAt이 아직 미래인 기본 한도 초과는 RateLimiter가 resetAt까지 대기하므로
     * 쿨다운이 아닙니다. 그 외 THROTTLED(Retry-After, 남용 감지 코드, 스냅샷 없음, 이미 지난 resetAt)는
     * 쿨다운으로 처리합니다.</p>
     *
     * @param e 원격 호출 실패
     * @param now 현재 시각
     * @return 쿨다운을 걸어야 하면 true
     */
    public boolean isCooldown(RemoteCallException e, Instant now) {
        if (!isThrottled(e)) {
            return false;
        }
        if (e.getRetryAfter() != null || SECONDARY_LIMIT_CODE.equals(normalizedCode(e))
            || "abuse_detected".equals(normalizedCode(e))) {
            return true;
        }
        RateSnapshot snapshot = e.getRateSnapshot();
        // 지난 resetAt은 observe 직후 refresh가 예산을 복원하므로 대기가 생기지 않음
        return snapshot == null || !snapshot.isExhausted() || !snapshot.resetAt().isAfter(now);
    }

    private static boolean isThrottled(RemoteCallException e) {
        int status = e.getStatus();
        if (status == 429) {
            return true;
        }
        if (status != 403) {
            return false;
        }
        RateSnapshot snapshot = e.getRateSnapshot();
        return (snapshot != null && snapshot.isExhausted())
            || THROTTLE_CODES.contains(normalizedCode(e))
            || e.getRetryAfter() != null;
    }

    private Instant retryAt(RemoteCallException e, Instant now) {
        if (e.getRetryAfter() != null) {
            return now.plus(e.getRetryAfter());
        }
        if (e.getRateSnapshot() != null && e.getRateSnapshot().resetAt().isAfter(now)) {
            return e.getRateSnapshot().resetAt();
        }
        return now.plus(throttleWait);
    }

    private static String normalizedCode(RemoteCallException e) {
        return e.getErrorCode() == null ? null : e.getErrorCode().toLowerCase(Locale.ROOT);
    }
}
