// file: engine/src/main/java/io/bimcollab/engine/CollaborationEngine.java
package io.bimcollab.engine;

import io.bimcollab.core.Change;
import io.bimcollab.core.ChangeStatus;
import io.bimcollab.core.ChangeType;
import io.bimcollab.core.ConflictDetector;
import io.bimcollab.core.Permission;
import io.bimcollab.core.ResolutionStrategy;
import io.bimcollab.core.UserRole;
import io.bimcollab.engine.export.SessionExport;
import io.bimcollab.engine.export.SessionExporter;
import io.bimcollab.engine.view.ChangeView;
import io.bimcollab.engine.view.ConflictView;
import io.bimcollab.engine.view.SessionStatus;
import io.bimcollab.engine.view.VersionView;
import io.bimcollab.storage.Session;
import io.bimcollab.storage.SessionStore;
import io.bimcollab.storage.VersionPolicy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Library entry point: sessions, changes, conflicts, versions, branches.
 * <p>
 * Threading:
 *  - Every public method is safe to call from any thread.
 *  - {@code makeChange} journals the change and returns; conflict detection
 *    and auto-versioning happen later on the single worker thread.
 *    Callers observe the outcome through {@code getChanges} / {@code getConflicts}.
 *  - {@link #awaitIdle(Duration)} waits for the worker to catch up.
 * <p>
 * Errors are the unchecked {@link io.bimcollab.core.CollaborationException}
 * subclasses, thrown synchronously to the caller.
 */
public final class CollaborationEngine implements AutoCloseable {

    private final EngineConfig config;
    private final SessionStore store;
    private final Clock clock;

    private final SessionManager sessions;
    private final ConflictManager conflicts;
    private final VersionManager versions;
    private final ChangeProcessor processor;
    private final SessionExporter exporter = new SessionExporter();

    /** Engine with default config and the system UTC clock, worker already started. */
    public CollaborationEngine() {
        this(EngineConfig.defaults(), new SessionStore(), Clock.systemUTC());
        start();
    }

    /** Fully wired engine; call {@link #start()} before submitting changes for processing. */
    public CollaborationEngine(EngineConfig config, SessionStore store, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");

        ConflictDetector detector = new ConflictDetector(config.conflictWindow());
        this.sessions = new SessionManager(store, clock);
        this.conflicts = new ConflictManager(store, clock);
        this.versions = new VersionManager(store, clock, detector, conflicts);
        this.processor = new ChangeProcessor(
                store,
                detector,
                versions,
                new VersionPolicy(config.versionEvery()),
                config.detectAcrossVersions(),
                config.workerThreadName()
        );
    }

    /** Start the background worker. Returns this for chaining. */
    public CollaborationEngine start() {
        processor.start();
        AuditLogger.logOperation("engine-start", "-", "-", String.format(
                "window=%ds versionEvery=%d acrossVersions=%s",
                config.conflictWindow().toSeconds(), config.versionEvery(), config.detectAcrossVersions()));
        return this;
    }

    public EngineConfig config() {
        return config;
    }

    // ---------- sessions ----------

    public String createSession(String modelId, String ownerId, String ownerUsername, String ownerEmail) {
        return sessions.create(modelId, ownerId, ownerUsername, ownerEmail);
    }

    /** Join as VIEWER. */
    public boolean joinSession(String sessionId, String userId, String username, String email) {
        return sessions.join(sessionId, userId, username, email, UserRole.VIEWER);
    }

    public boolean joinSession(String sessionId, String userId, String username, String email, UserRole role) {
        return sessions.join(sessionId, userId, username, email, role);
    }

    public boolean leaveSession(String sessionId, String userId) {
        return sessions.leave(sessionId, userId);
    }

    public SessionStatus getSessionStatus(String sessionId) {
        return sessions.status(sessionId);
    }

    // ---------- changes ----------

    public String makeChange(String sessionId,
                             String userId,
                             ChangeType changeType,
                             String elementId,
                             String elementType,
                             Map<String, Object> newValue) {
        return makeChange(sessionId, userId, changeType, elementId, elementType, newValue, null, null, null);
    }

    public String makeChange(String sessionId,
                             String userId,
                             ChangeType changeType,
                             String elementId,
                             String elementType,
                             Map<String, Object> newValue,
                             Map<String, Object> oldValue,
                             String description) {
        return makeChange(sessionId, userId, changeType, elementId, elementType, newValue, oldValue, description, null);
    }

    /**
     * Journal a change as PENDING and queue it for processing.
     *
     * @return the new change id
     * @throws io.bimcollab.core.SessionNotFoundException  unknown session
     * @throws io.bimcollab.core.PermissionDeniedException user lacks write
     * @throws IllegalStateException                      engine is closed; nothing is journaled
     */
    public String makeChange(String sessionId,
                             String userId,
                             ChangeType changeType,
                             String elementId,
                             String elementType,
                             Map<String, Object> newValue,
                             Map<String, Object> oldValue,
                             String description,
                             Map<String, Object> metadata) {
        processor.ensureOpen();
        Change change = store.locked(() -> {
            Session session = store.require(sessionId);
            AccessControl.requirePermission(session, userId, Permission.WRITE);
            Instant now = clock.instant();
            Change c = new Change(
                    UUID.randomUUID().toString(),
                    userId,
                    now,
                    changeType,
                    elementId,
                    elementType,
                    oldValue,
                    newValue,
                    description,
                    metadata
            );
            session.appendChange(c);
            session.touch(now);
            return c;
        });
        try {
            processor.submit(sessionId, change);
        } catch (IllegalStateException e) {
            // closed between the check and the submit
            store.locked(() -> store.find(sessionId).map(s -> s.removeChange(change.changeId())).orElse(false));
            throw e;
        }
        return change.changeId();
    }

    /** Active journal entries with their status, in journal order. */
    public List<ChangeView> getChanges(String sessionId, String userId) {
        return getChanges(sessionId, userId, null);
    }

    /** As {@link #getChanges(String, String)}, keeping only changes with timestamp >= since. */
    public List<ChangeView> getChanges(String sessionId, String userId, Instant since) {
        return store.locked(() -> {
            Session session = store.require(sessionId);
            AccessControl.requireMember(session, userId);
            AccessControl.requirePermission(session, userId, Permission.READ);
            List<ChangeView> out = new ArrayList<>();
            for (Change c : session.journal()) {
                if (since != null && c.timestamp().isBefore(since)) {
                    continue;
                }
                out.add(ChangeView.of(c, session.statusOf(c.changeId()).orElse(ChangeStatus.PENDING)));
            }
            return out;
        });
    }

    // ---------- conflicts ----------

    public List<ConflictView> getConflicts(String sessionId, String userId) {
        return conflicts.unresolved(sessionId, userId);
    }

    public boolean resolveConflict(String sessionId, String conflictId, ResolutionStrategy strategy, String resolvedBy) {
        return conflicts.resolve(sessionId, conflictId, strategy, resolvedBy);
    }

    // ---------- versions ----------

    public String createVersion(String sessionId, String userId, String description) {
        return versions.createVersion(sessionId, userId, description, List.of());
    }

    public String createVersion(String sessionId, String userId, String description, List<String> tags) {
        return versions.createVersion(sessionId, userId, description, tags);
    }

    public List<VersionView> getVersions(String sessionId, String userId) {
        return versions.versions(sessionId, userId);
    }

    public String createBranch(String sessionId, String userId, String name, String description) {
        return versions.createBranch(sessionId, userId, name, description);
    }

    public boolean mergeBranch(String targetSessionId, String sourceSessionId, String userId, ResolutionStrategy strategy) {
        return versions.mergeBranch(targetSessionId, sourceSessionId, userId, strategy);
    }

    // ---------- export ----------

    /** Snapshot of the whole collaboration record of a session; requires read. */
    public SessionExport exportSession(String sessionId, String userId) {
        return store.locked(() -> {
            Session session = store.require(sessionId);
            AccessControl.requirePermission(session, userId, Permission.READ);
            return SessionExport.of(session, clock.instant());
        });
    }

    public String exportSessionJson(String sessionId, String userId) {
        return exporter.toJson(exportSession(sessionId, userId));
    }

    // ---------- lifecycle ----------

    /**
     * Block until every change submitted so far has been processed.
     *
     * @return false on timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return processor.awaitIdle(timeout);
    }

    /** Stop the worker. Changes still queued stay PENDING. */
    @Override
    public void close() {
        processor.close();
        AuditLogger.logOperation("engine-stop", "-", "-", null);
    }
}
