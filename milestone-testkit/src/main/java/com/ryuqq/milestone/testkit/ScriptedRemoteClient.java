package com.ryuqq.milestone.testkit;

import com.ryuqq.milestone.core.model.CoAuthor;
import com.ryuqq.milestone.core.model.RateSnapshot;
import com.ryuqq.milestone.core.model.RepositoryId;
import com.ryuqq.milestone.core.spi.ChangeSet;
import com.ryuqq.milestone.core.spi.CollaboratorStatus;
import com.ryuqq.milestone.core.spi.DiscussionCategory;
import com.ryuqq.milestone.core.spi.RemoteArtifact;
import com.ryuqq.milestone.core.spi.RemoteCallException;
import com.ryuqq.milestone.core.spi.RemoteClient;
import com.ryuqq.milestone.core.spi.RemoteRepository;
import com.ryuqq.milestone.core.spi.RemoteResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Programmable {@link RemoteClient} for contract tests.
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Simulated budget: every call except {@code rateLimit} spends one unit; an empty budget answers 403
 *       with an exhausted snapshot until the window resets on the {@link ManualClock}</li>
 *   <li>Scripted failures per operation ({@link #failNext(String, RemoteCallException...)})</li>
 *   <li>Simulated crashes after an operation took effect ({@link #crashAfter(String)})</li>
 *   <li>Latency that advances the clock</li>
 *   <li>Idempotent artefacts: a repeated key returns the first artefact and creates nothing</li>
 *   <li>Call journal for assertions</li>
 * </ul>
 *
 * <p>Operation names are the {@link RemoteClient} method names.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedRemoteClient implements RemoteClient {

    private static final Duration WINDOW = Duration.ofHours(1);

    private final String login;
    private final ManualClock clock;
    private final Object lock = new Object();

    private long limit = 5000;
    private long remaining = 5000;
    private Instant resetAt;
    private Duration latency = Duration.ZERO;
    private boolean repositoryExists = true;
    private CollaboratorStatus collaboratorStatus = CollaboratorStatus.ACTIVE;
    private List<DiscussionCategory> categories = List.of(new DiscussionCategory("DIC_qa", "Q&A", "q-a", true));

    private final Map<String, Deque<RuntimeException>> failures = new HashMap<>();
    private final Map<String, Integer> crashes = new HashMap<>();
    private final Map<String, RemoteArtifact> artifacts = new LinkedHashMap<>();
    private final Map<String, Integer> created = new HashMap<>();
    private final List<String> journal = new ArrayList<>();
    private long sequence;
    private int rejections;

    public ScriptedRemoteClient(String login, ManualClock clock) {
        if (login == null || login.isBlank()) {
            throw new IllegalArgumentException("login cannot be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.login = login;
        this.clock = clock;
        this.resetAt = clock.instant().plus(WINDOW);
    }

    // ============================================================
    // Scripting
    // ============================================================

    public ScriptedRemoteClient withBudget(long limit, long remaining, Instant resetAt) {
        synchronized (lock) {
            this.limit = limit;
            this.remaining = remaining;
            this.resetAt = resetAt;
        }
        return this;
    }

    public ScriptedRemoteClient withLatency(Duration latency) {
        synchronized (lock) {
            this.latency = latency;
        }
        return this;
    }

    public ScriptedRemoteClient withoutRepository() {
        synchronized (lock) {
            this.repositoryExists = false;
        }
        return this;
    }

    public ScriptedRemoteClient withCollaboratorStatus(CollaboratorStatus status) {
        synchronized (lock) {
            this.collaboratorStatus = status;
        }
        return this;
    }

    public ScriptedRemoteClient withDiscussionCategories(List<DiscussionCategory> categories) {
        synchronized (lock) {
            this.categories = List.copyOf(categories);
        }
        return this;
    }

    /**
     * Queues failures for the next invocations of {@code operation}, in order.
     *
     * @param operation method name, e.g. {@code "mergeChangeSet"}
     * @param errors failures to raise
     * @return this client
     */
    public ScriptedRemoteClient failNext(String operation, RemoteCallException... errors) {
        synchronized (lock) {
            failures.computeIfAbsent(operation, k -> new ArrayDeque<>()).addAll(Arrays.asList(errors));
        }
        return this;
    }

    /**
     * Lets the next {@code operation} take effect, then throws as if the process died
     * before the response was handled.
     *
     * @param operation method name
     * @return this client
     */
    public ScriptedRemoteClient crashAfter(String operation) {
        return crashAfter(operation, 1);
    }

    /**
     * Lets {@code occurrence} further invocations of {@code operation} take effect and throws
     * after the last of them.
     *
     * @param operation method name
     * @param occurrence which upcoming invocation crashes, starting at 1
     * @return this client
     */
    public ScriptedRemoteClient crashAfter(String operation, int occurrence) {
        if (occurrence <= 0) {
            throw new IllegalArgumentException("occurrence must be positive (current: " + occurrence + ")");
        }
        synchronized (lock) {
            crashes.put(operation, occurrence);
        }
        return this;
    }

    // ============================================================
    // Inspection
    // ============================================================

    public List<String> journal() {
        synchronized (lock) {
            return List.copyOf(journal);
        }
    }

    /**
     * Number of invocations of an operation, repeats and failures included.
     *
     * @param operation method name
     * @return invocation count
     */
    public int calls(String operation) {
        synchronized (lock) {
            return (int) journal.stream().filter(entry -> entry.equals(operation) || entry.startsWith(operation + ":")).count();
        }
    }

    /**
     * Number of distinct artefacts an operation created.
     *
     * @param operation method name
     * @return created count
     */
    public int created(String operation) {
        synchronized (lock) {
            return created.getOrDefault(operation, 0);
        }
    }

    /**
     * Number of calls refused because the simulated budget was empty.
     *
     * @return rejected call count
     */
    public int rejections() {
        synchronized (lock) {
            return rejections;
        }
    }

    public long remaining() {
        synchronized (lock) {
            return remaining;
        }
    }

    public String login() {
        return login;
    }

    // ============================================================
    // RemoteClient
    // ============================================================

    @Override
    public RemoteResponse<String> authenticatedLogin() {
        return handle("authenticatedLogin", null, () -> login);
    }

    @Override
    public RemoteResponse<RateSnapshot> rateLimit() {
        synchronized (lock) {
            journal.add("rateLimit");
            refresh();
            RateSnapshot snapshot = snapshot();
            return new RemoteResponse<>(snapshot, snapshot);
        }
    }

    @Override
    public RemoteResponse<Optional<RemoteRepository>> findRepository(RepositoryId repository) {
        return handle("findRepository", null,
            () -> repositoryExists ? Optional.of(new RemoteRepository(repository, "main")) : Optional.empty());
    }

    @Override
    public RemoteResponse<RemoteRepository> createRepository(RepositoryId repository, String description, String idempotencyKey) {
        return handle("createRepository", idempotencyKey, () -> {
            artifact("createRepository", idempotencyKey);
            repositoryExists = true;
            return new RemoteRepository(repository, "main");
        });
    }

    @Override
    public RemoteResponse<RemoteArtifact> mergeChangeSet(RepositoryId repository, ChangeSet changeSet, String idempotencyKey) {
        return handle("mergeChangeSet", idempotencyKey, () -> artifact("mergeChangeSet", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> createIssue(RepositoryId repository, String title, String body, String idempotencyKey) {
        return handle("createIssue", idempotencyKey, () -> artifact("createIssue", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> closeIssue(RepositoryId repository, long number, String idempotencyKey) {
        return handle("closeIssue", idempotencyKey, () -> artifact("closeIssue", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> createCoAuthoredCommit(RepositoryId repository, ChangeSet changeSet,
                                                                 CoAuthor coAuthor, String idempotencyKey) {
        return handle("createCoAuthoredCommit", idempotencyKey, () -> artifact("createCoAuthoredCommit", idempotencyKey));
    }

    @Override
    public RemoteResponse<CollaboratorStatus> addCollaborator(RepositoryId repository, String login, String idempotencyKey) {
        return handle("addCollaborator", idempotencyKey, () -> {
            artifact("addCollaborator", idempotencyKey);
            return collaboratorStatus;
        });
    }

    @Override
    public RemoteResponse<Boolean> acceptInvitation(RepositoryId repository, String idempotencyKey) {
        return handle("acceptInvitation", idempotencyKey, () -> {
            artifact("acceptInvitation", idempotencyKey);
            return Boolean.TRUE;
        });
    }

    @Override
    public RemoteResponse<List<DiscussionCategory>> discussionCategories(RepositoryId repository) {
        return handle("discussionCategories", null, () -> categories);
    }

    @Override
    public RemoteResponse<RemoteArtifact> createDiscussion(RepositoryId repository, String categoryId, String title,
                                                           String body, String idempotencyKey) {
        return handle("createDiscussion", idempotencyKey, () -> artifact("createDiscussion", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> postDiscussionComment(String discussionId, String body, String idempotencyKey) {
        return handle("postDiscussionComment", idempotencyKey, () -> artifact("postDiscussionComment", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> markCommentAccepted(String commentId, String idempotencyKey) {
        return handle("markCommentAccepted", idempotencyKey, () -> artifact("markCommentAccepted", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> createBypassPullRequest(RepositoryId repository, ChangeSet changeSet,
                                                                  String reviewer, String idempotencyKey) {
        return handle("createBypassPullRequest", idempotencyKey, () -> artifact("createBypassPullRequest", idempotencyKey));
    }

    @Override
    public RemoteResponse<RemoteArtifact> mergePullRequest(RepositoryId repository, long number, String idempotencyKey) {
        return handle("mergePullRequest", idempotencyKey, () -> artifact("mergePullRequest", idempotencyKey));
    }

    // ============================================================
    // Internals
    // ============================================================

    private <T> RemoteResponse<T> handle(String operation, String key, Supplier<T> effect) {
        synchronized (lock) {
            journal.add(key == null ? operation : operation + ":" + key);
            if (!latency.isZero()) {
                clock.advance(latency);
            }
            refresh();
            if (remaining == 0) {
                rejections++;
                throw new RemoteCallException(403, "rate_limited", "API rate limit exceeded for " + login, snapshot(), null);
            }
            remaining--;

            Deque<RuntimeException> queued = failures.get(operation);
            if (queued != null && !queued.isEmpty()) {
                throw queued.poll();
            }

            T value = effect.get();
            Integer countdown = crashes.get(operation);
            if (countdown != null) {
                if (countdown == 1) {
                    crashes.remove(operation);
                    throw new IllegalStateException("simulated crash after " + operation);
                }
                crashes.put(operation, countdown - 1);
            }
            return new RemoteResponse<>(value, snapshot());
        }
    }

    private RemoteArtifact artifact(String operation, String key) {
        return artifacts.computeIfAbsent(key, k -> {
            created.merge(operation, 1, Integer::sum);
            long number = ++sequence;
            return new RemoteArtifact(operation + "-" + number, number, null);
        });
    }

    private void refresh() {
        Instant now = clock.instant();
        if (!now.isBefore(resetAt)) {
            remaining = limit;
            resetAt = now.plus(WINDOW);
        }
    }

    private RateSnapshot snapshot() {
        return new RateSnapshot(limit, remaining, resetAt);
    }
}
