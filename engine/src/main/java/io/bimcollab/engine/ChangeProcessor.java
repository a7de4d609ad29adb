// file: engine/src/main/java/io/bimcollab/engine/ChangeProcessor.java
package io.bimcollab.engine;

import io.bimcollab.core.Change;
import io.bimcollab.core.ChangeStatus;
import io.bimcollab.core.Conflict;
import io.bimcollab.core.ConflictDetector;
import io.bimcollab.core.Version;
import io.bimcollab.storage.Session;
import io.bimcollab.storage.SessionStore;
import io.bimcollab.storage.VersionPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single background worker that drains submitted changes for all sessions.
 * <p>
 * Flow per queue item, under the store lock:
 *  1) Skip if the session is gone or the change already left the journal
 *     (folded into a version or resolved away).
 *  2) Compare the change against every other journal change, PENDING ones
 *     included (and, if enabled, the latest version's changes).
 *  3) New conflicts found, or the change is already part of an unresolved
 *     conflict: record them, mark the change CONFLICTED.
 *  4) Clean: mark it APPLIED and auto-save when the VersionPolicy says so.
 *     The auto-save takes processed changes only.
 * <p>
 * A pair with a recorded conflict is never compared again, so a pair yields
 * at most one conflict whichever of its changes is dequeued first.
 * <p>
 * One worker and one FIFO queue serialize every conflict and version decision.
 * Producers never wait for the worker. A failing item is logged and dropped,
 * the worker keeps going.
 */
public final class ChangeProcessor implements AutoCloseable {

    /** Queue payload. */
    public record QueuedChange(String sessionId, Change change) {
        public QueuedChange {
            Objects.requireNonNull(sessionId, "sessionId");
            Objects.requireNonNull(change, "change");
        }
    }

    private final SessionStore store;
    private final ConflictDetector detector;
    private final VersionManager versions;
    private final VersionPolicy policy;
    private final boolean detectAcrossVersions;

    private final BlockingQueue<QueuedChange> queue = new LinkedBlockingQueue<>();
    private final ExecutorService worker;

    // submitted/finished are guarded by 'this'; finished counts processed, skipped and dropped items.
    private long submitted;
    private long finished;
    private volatile boolean started = false;
    private volatile boolean closed = false;

    public ChangeProcessor(SessionStore store,
                           ConflictDetector detector,
                           VersionManager versions,
                           VersionPolicy policy,
                           boolean detectAcrossVersions,
                           String threadName) {
        this.store = Objects.requireNonNull(store, "store");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.versions = Objects.requireNonNull(versions, "versions");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.detectAcrossVersions = detectAcrossVersions;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /** Start the worker. Idempotent. */
    public synchronized void start() {
        if (closed) throw new IllegalStateException("ChangeProcessor is closed");
        if (started) return;
        started = true;
        worker.execute(this::runLoop);
    }

    /** Enqueue a journaled change. Never blocks. */
    public void submit(String sessionId, Change change) {
        var item = new QueuedChange(sessionId, change);
        synchronized (this) {
            if (closed) throw new IllegalStateException("ChangeProcessor is closed");
            submitted++;
        }
        queue.add(item);
    }

    /** @throws IllegalStateException once {@link #close()} was called */
    public void ensureOpen() {
        if (closed) throw new IllegalStateException("ChangeProcessor is closed");
    }

    /** Number of items waiting in the queue. */
    public int backlog() {
        return queue.size();
    }

    /**
     * Wait until every item submitted so far has been taken off the queue and
     * finished.
     *
     * @return false if the timeout elapsed first
     */
    public synchronized boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (finished < submitted) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }

    /**
     * Stop the worker. Items still queued are not processed.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
        }
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                AuditLogger.logOperation("change-processor-stop", "-", "-", "worker did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int left = queue.size();
        if (left > 0) {
            AuditLogger.logOperation("change-processor-stop", "-", "-", "unprocessed=" + left);
        }
    }

    // ---------- internals ----------

    private void runLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            QueuedChange item;
            try {
                item = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            processSafe(item);
        }
    }

    private void processSafe(QueuedChange item) {
        try {
            process(item);
        } catch (Exception e) {
            AuditLogger.logDropped(item.sessionId(), item.change(), e);
        } finally {
            synchronized (this) {
                finished++;
                notifyAll();
            }
        }
    }

    /**
     * Process one item. Visible for tests that drive processing without the
     * worker thread.
     */
    void process(QueuedChange item) {
        Change change = item.change();
        Result result = store.locked(() -> {
            Optional<Session> found = store.find(item.sessionId());
            if (found.isEmpty()) {
                return Result.skipped("session no longer exists");
            }
            Session session = found.get();
            if (!session.inJournal(change.changeId())) {
                return Result.skipped("no longer in journal");
            }

            List<Conflict> conflicts = detect(session, change);
            conflicts.forEach(session::addConflict);
            if (!conflicts.isEmpty() || session.hasUnresolvedConflictInvolving(change.changeId())) {
                session.markConflicted(change.changeId());
                return new Result(ChangeStatus.CONFLICTED, conflicts, null, null);
            }

            // The authoritative model lives outside the engine; applying is a status change here.
            session.markApplied(change.changeId());
            Version v = null;
            if (policy.shouldFold(session)) {
                v = versions.autoSave(session, change.userId());
            }
            return new Result(ChangeStatus.APPLIED, List.of(), v, null);
        });

        if (result.skipReason() != null) {
            AuditLogger.logSkipped(item.sessionId(), change, result.skipReason());
            return;
        }
        for (Conflict c : result.conflicts()) {
            AuditLogger.logConflict(item.sessionId(), c);
        }
        AuditLogger.logProcessed(item.sessionId(), change, result.status());
        if (result.version() != null) {
            AuditLogger.logVersion(item.sessionId(), result.version());
        }
    }

    /**
     * New conflicts between {@code incoming} and every other journal change,
     * plus the latest version's changes when enabled. The earlier-journaled
     * change of a pair is change1. Pairs that already have a conflict are skipped.
     */
    private List<Conflict> detect(Session session, Change incoming) {
        List<Conflict> out = new ArrayList<>();
        if (detectAcrossVersions) {
            session.latestVersion().ifPresent(v -> {
                for (Change folded : v.changes()) {
                    out.addAll(detectPair(session, folded, incoming));
                }
            });
        }
        boolean seen = false;
        for (Change other : List.copyOf(session.journal())) {
            if (other.changeId().equals(incoming.changeId())) {
                seen = true;
            } else if (seen) {
                out.addAll(detectPair(session, incoming, other));
            } else {
                out.addAll(detectPair(session, other, incoming));
            }
        }
        return out;
    }

    private List<Conflict> detectPair(Session session, Change first, Change second) {
        if (session.hasConflictBetween(first.changeId(), second.changeId())) {
            return List.of();
        }
        return detector.detect(List.of(first), second);
    }

    private record Result(ChangeStatus status, List<Conflict> conflicts, Version version, String skipReason) {
        static Result skipped(String reason) {
            return new Result(null, List.of(), null, reason);
        }
    }
}
