package com.ryuqq.milestone.adapter.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ryuqq.milestone.core.model.ProgressMutation;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.spi.ProgressStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON 파일 하나에 저장하는 {@link ProgressStore}.
 *
 * <p><strong>쓰기 절차 (commit마다):</strong></p>
 * <ol>
 *   <li>메모리 사본에 mutation을 적용하고 검증</li>
 *   <li>현재 파일을 {@code .backups/progress-<millis>-<seq>.json}으로 복사 (최신 {@value #MAX_BACKUPS}개 유지)</li>
 *   <li>같은 디렉토리의 임시 파일에 새 문서를 쓰고 {@code fsync}</li>
 *   <li>임시 파일을 대상 파일로 이동 ({@code ATOMIC_MOVE}, 실패 시 {@code REPLACE_EXISTING})</li>
 *   <li>메모리 사본을 공개</li>
 * </ol>
 *
 * <p>쓰기에 실패하면 파일과 메모리 뷰 모두 그대로 두고 {@link ProgressStoreException}을 던집니다.</p>
 *
 * <p><strong>열 때 복구:</strong> 읽을 수 없는 본 파일은 {@code .backups/corrupted-<millis>.json}으로
 * 옮기고 읽을 수 있는 가장 최근 백업을 복원합니다. 읽을 수 있는 백업이 없으면 빈 상태로 시작합니다.
 * 빈 본 파일은 진행 기록 없음으로 취급합니다.</p>
 *
 * <p><strong>Thread-safe:</strong> commit은 락 하나로 직렬화하고, 읽기는 마지막으로 공개된 맵을 봅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FileProgressStore implements ProgressStore {

    private static final Logger log = LoggerFactory.getLogger(FileProgressStore.class);

    /**
     * 유지할 순환 백업 수.
     */
    public static final int MAX_BACKUPS = 5;

    static final String BACKUP_DIRECTORY = ".backups";
    static final String BACKUP_PREFIX = "progress-";
    static final String CORRUPTED_PREFIX = "corrupted-";

    private final Path file;
    private final Path backupDirectory;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Map<WorkflowName, ProgressRecord> records;
    private long backupSequence;

    /**
     * 진행 파일을 엽니다 (없으면 준비만 합니다).
     *
     * @param file 진행 파일 경로
     * @param clock 타임스탬프용 Clock
     * @throws ProgressStoreException 디렉토리를 준비할 수 없는 경우
     */
    public FileProgressStore(Path file, Clock clock) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.file = file.toAbsolutePath();
        this.backupDirectory = this.file.getParent().resolve(BACKUP_DIRECTORY);
        this.clock = clock;
        try {
            Files.createDirectories(backupDirectory);
        } catch (IOException e) {
            throw new ProgressStoreException("Failed to create backup directory " + backupDirectory, e);
        }
        this.records = Collections.unmodifiableMap(open());
    }

    public FileProgressStore(Path file) {
        this(file, Clock.systemUTC());
    }

    @Override
    public Optional<ProgressRecord> load(WorkflowName workflow) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        return Optional.ofNullable(records.get(workflow));
    }

    @Override
    public Map<WorkflowName, ProgressRecord> loadAll() {
        return records;
    }

    @Override
    public ProgressRecord commit(WorkflowName workflow, ProgressMutation mutation) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }
        writeLock.lock();
        try {
            ProgressRecord current = records.get(workflow);
            ProgressRecord base = current != null ? current : ProgressRecord.initial(workflow, clock.instant());
            ProgressRecord next = mutation.apply(base);
            if (next == null) {
                throw new IllegalStateException("Mutation returned null for " + workflow);
            }
            base.requireValidSuccessor(next);

            Map<WorkflowName, ProgressRecord> updated = new TreeMap<>(records);
            updated.put(workflow, next);
            backupCurrent();
            writeAtomically(file, Jsons.toBytes(ProgressDocument.of(updated, clock.instant())));
            records = Collections.unmodifiableMap(updated);
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 현재 진행 문서를 {@code target}에 씁니다.
     *
     * @param target 내보낼 경로
     * @throws ProgressStoreException I/O 실패 시
     */
    public void export(Path target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        Path absolute = target.toAbsolutePath();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException e) {
            throw new ProgressStoreException("Failed to create export directory for " + target, e);
        }
        writeAtomically(absolute, Jsons.toBytes(ProgressDocument.of(records, clock.instant())));
        log.info("Exported progress to {}", absolute);
    }

    public Path getFile() {
        return file;
    }

    public Path getBackupDirectory() {
        return backupDirectory;
    }

    // ============================================================
    // 열기 / 복구
    // ============================================================

    private Map<WorkflowName, ProgressRecord> open() {
        if (!Files.exists(file)) {
            log.info("No progress file at {}, starting fresh", file);
            return new TreeMap<>();
        }
        try {
            Optional<Map<WorkflowName, ProgressRecord>> loaded = read(file);
            if (loaded.isPresent()) {
                log.info("Loaded progress for {} workflows from {}", loaded.get().size(), file);
                return loaded.get();
            }
            log.warn("Progress file {} is empty, starting fresh", file);
            return new TreeMap<>();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Progress file {} is unreadable: {}", file, e.getMessage());
        }

        preserveCorrupted();
        for (Path backup : backupsNewestFirst()) {
            try {
                Optional<Map<WorkflowName, ProgressRecord>> recovered = read(backup);
                if (recovered.isPresent()) {
                    writeAtomically(file, Files.readAllBytes(backup));
                    log.warn("Recovered progress from backup {}", backup);
                    return recovered.get();
                }
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Backup {} is unreadable: {}", backup, e.getMessage());
            }
        }
        log.warn("No readable backup in {}, starting fresh", backupDirectory);
        return new TreeMap<>();
    }

    private static Optional<Map<WorkflowName, ProgressRecord>> read(Path path) throws IOException {
        byte[] content = Files.readAllBytes(path);
        if (new String(content, StandardCharsets.UTF_8).isBlank()) {
            return Optional.empty();
        }
        try {
            ProgressDocument document = Jsons.mapper().readValue(content, ProgressDocument.class);
            if (document == null) {
                return Optional.empty();
            }
            return Optional.of(document.toRecords());
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid progress JSON in " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private void preserveCorrupted() {
        Path target = backupDirectory.resolve(CORRUPTED_PREFIX + clock.millis() + ".json");
        try {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Moved unreadable progress file to {}", target);
        } catch (IOException e) {
            log.error("Failed to preserve unreadable progress file {}: {}", file, e.getMessage());
        }
    }

    // ============================================================
    // 백업
    // ============================================================

    private void backupCurrent() {
        if (!Files.exists(file)) {
            return;
        }
        String name = String.format("%s%013d-%06d.json", BACKUP_PREFIX, clock.millis(), backupSequence++ % 1_000_000);
        Path backup = backupDirectory.resolve(name);
        try {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            // 백업 실패는 commit을 막지 않음
            log.warn("Failed to back up progress file to {}: {}", backup, e.getMessage());
            return;
        }
        List<Path> backups = backupsNewestFirst();
        for (int i = MAX_BACKUPS; i < backups.size(); i++) {
            try {
                Files.deleteIfExists(backups.get(i));
            } catch (IOException e) {
                log.warn("Failed to delete old backup {}: {}", backups.get(i), e.getMessage());
            }
        }
    }

    List<Path> backupsNewestFirst() {
        List<Path> backups = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDirectory, BACKUP_PREFIX + "*.json")) {
            for (Path path : stream) {
                backups.add(path);
            }
        } catch (IOException e) {
            log.warn("Failed to list backups in {}: {}", backupDirectory, e.getMessage());
        }
        backups.sort(Collections.reverseOrder());
        return backups;
    }

    // ============================================================
    // 원자적 쓰기
    // ============================================================

    private static void writeAtomically(Path target, byte[] content) {
        Path directory = target.getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + target.getFileName() + "-", ".tmp");
            try (FileOutputStream out = new FileOutputStream(temp.toFile())) {
                out.write(content);
                out.flush();
                out.getFD().sync();
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new ProgressStoreException("Failed to write " + target, e);
        }
    }
}
