package com.registry.engine.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.StorageException;
import com.registry.core.model.AuditEntry;
import com.registry.core.model.RegistryLayout;
import com.registry.core.model.RetryPolicy;
import com.registry.core.model.StoragePath;
import com.registry.core.storage.StorageBackend;
import com.registry.core.storage.StorageLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Append-only promotion log of a model, one JSON object per line in
 * {@code audit/promotions.jsonl}.
 *
 * Appends for a model are serialized by an advisory lock. Inside the lock
 * an entry whose timestamp does not exceed the last logged one is moved
 * one microsecond past it, so timestamps strictly increase even when the
 * clock stalls or steps backwards.
 *
 * Only newline-terminated lines are entries. An unterminated tail is a
 * write that never completed: readers ignore it and the next append cuts
 * it off before writing.
 */
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final StorageBackend backend;
    private final ObjectMapper objectMapper;
    private final Duration lockTimeout;

    public AuditLog(StorageBackend backend, ObjectMapper objectMapper, Duration lockTimeout) {
        this.backend = backend;
        this.objectMapper = objectMapper;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Append one entry in a single attempt.
     *
     * @return The entry as logged, with its final timestamp
     * @throws StorageException if the lock or the write fails
     */
    public AuditEntry append(String task, String model, AuditEntry entry) {
        return append(task, model, entry, RetryPolicy.noRetry());
    }

    /**
     * Append one entry, retrying failed attempts with backoff.
     *
     * A failed attempt may still have reached the log. Before writing again
     * the log is searched for the exact line of the earlier attempt; its
     * timestamp is unique in the log, so a match means the entry is recorded.
     *
     * @return The entry as logged, with its final timestamp
     * @throws StorageException once the attempts are exhausted
     */
    public AuditEntry append(String task, String model, AuditEntry entry, RetryPolicy retryPolicy) {
        AtomicReference<AuditEntry> attempted = new AtomicReference<>();
        int attempt = 1;
        while (true) {
            try {
                return appendOnce(task, model, entry, attempted);
            } catch (StorageException e) {
                if (!retryPolicy.hasMoreAttempts(attempt)) {
                    throw e;
                }
                Duration backoff = retryPolicy.computeBackoff(attempt);
                log.warn("Audit append for {}/{} failed (attempt {}/{}), retrying in {} ms: {}",
                    task, model, attempt, retryPolicy.maxAttempts(), backoff.toMillis(), e.getMessage());
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(interrupted);
                    throw e;
                }
                attempt++;
            }
        }
    }

    /**
     * All entries of a model, oldest first. Empty if nothing was promoted yet.
     *
     * @throws StorageException if a complete line cannot be parsed
     */
    public List<AuditEntry> readAll(String task, String model) {
        return read(RegistryLayout.auditLogPath(task, model)).entries();
    }

    /**
     * Parse the whole log so a corrupted one is reported before anything
     * that must be audited is changed.
     *
     * @throws StorageException if a complete line cannot be parsed
     */
    public void requireReadable(String task, String model) {
        read(RegistryLayout.auditLogPath(task, model));
    }

    private AuditEntry appendOnce(String task, String model, AuditEntry entry, AtomicReference<AuditEntry> attempted) {
        StoragePath logPath = RegistryLayout.auditLogPath(task, model);
        try (StorageLock lock = backend.lock(RegistryLayout.auditLockPath(task, model), lockTimeout)) {
            LogContents contents = read(logPath);
            AuditEntry earlier = attempted.get();
            if (earlier != null && contents.entries().contains(earlier)) {
                log.info("Audit entry at {} was recorded by an earlier attempt", earlier.ts());
                return earlier;
            }
            if (contents.hasTornTail()) {
                log.warn("Removing {} bytes of an incomplete audit entry at the end of {}",
                    contents.raw().length - contents.completeLength(), backend.locate(logPath));
                backend.writeAtomic(logPath, Arrays.copyOf(contents.raw(), contents.completeLength()));
            }

            AuditEntry logged = entry;
            Instant last = contents.lastTimestamp();
            if (last != null && !entry.ts().isAfter(last)) {
                logged = entry.withTimestamp(last.plus(1, ChronoUnit.MICROS));
            }
            attempted.set(logged);
            backend.append(logPath, toLine(logged));
            log.debug("Audit {} {} {} -> {} by {}", logged.action(), logged.alias(), logged.from(), logged.to(), logged.actor());
            return logged;
        }
    }

    private LogContents read(StoragePath logPath) {
        byte[] raw;
        try {
            raw = backend.readAll(logPath);
        } catch (NotFoundException e) {
            return new LogContents(new byte[0], 0, List.of());
        }
        int completeLength = raw.length;
        while (completeLength > 0 && raw[completeLength - 1] != '\n') {
            completeLength--;
        }
        if (completeLength < raw.length) {
            // An append in flight or one that never finished
            log.debug("Ignoring {} unterminated bytes at the end of {}", raw.length - completeLength, backend.locate(logPath));
        }

        List<AuditEntry> entries = new ArrayList<>();
        String[] lines = new String(raw, 0, completeLength, StandardCharsets.UTF_8).split("\n");
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isBlank()) {
                entries.add(parse(lines[i], logPath, i + 1));
            }
        }
        return new LogContents(raw, completeLength, entries);
    }

    private AuditEntry parse(String line, StoragePath logPath, int lineNumber) {
        try {
            return objectMapper.readValue(line, AuditEntry.class);
        } catch (JsonProcessingException e) {
            throw (StorageException) new StorageException(
                "Malformed audit entry at line " + lineNumber + " of " + backend.locate(logPath), e
            ).with(StorageException.CTX_PATH, backend.locate(logPath));
        }
    }

    private byte[] toLine(AuditEntry entry) {
        try {
            return (objectMapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize audit entry", e);
        }
    }

    private record LogContents(byte[] raw, int completeLength, List<AuditEntry> entries) {

        boolean hasTornTail() {
            return completeLength < raw.length;
        }

        Instant lastTimestamp() {
            return entries.isEmpty() ? null : entries.get(entries.size() - 1).ts();
        }
    }
}
