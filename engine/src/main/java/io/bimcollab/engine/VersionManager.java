// file: engine/src/main/java/io/bimcollab/engine/VersionManager.java
package io.bimcollab.engine;

import io.bimcollab.core.Change;
import io.bimcollab.core.Conflict;
import io.bimcollab.core.ConflictDetector;
import io.bimcollab.core.ConflictResolver;
import io.bimcollab.core.Permission;
import io.bimcollab.core.ResolutionStrategy;
import io.bimcollab.core.Version;
import io.bimcollab.engine.view.VersionView;
import io.bimcollab.storage.Session;
import io.bimcollab.storage.SessionStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Version history operations: snapshots, branches and merges.
 * <p>
 * Folding:
 *  - An explicit version or a merge takes every journal change, whatever its
 *    status, in journal order, and clears the journal.
 *  - An auto-save takes only processed changes; PENDING ones stay journaled.
 *  - versionNumber = previous + 1, parentVersion = previous version id.
 *  - Conflict detection afterwards only sees changes made since the fold.
 * <p>
 * Branches are full sessions seeded with the parent's users, permissions and
 * versions; they are not deltas. A merge replays the source branch's active
 * changes onto the target and always ends with a version on the target.
 */
public final class VersionManager {

    public static final String AUTO_SAVE = "Auto-save";

    private final SessionStore store;
    private final Clock clock;
    private final ConflictDetector detector;
    private final ConflictManager conflicts;

    public VersionManager(SessionStore store, Clock clock, ConflictDetector detector, ConflictManager conflicts) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.conflicts = Objects.requireNonNull(conflicts, "conflicts");
    }

    /**
     * Snapshot the journal of {@code sessionId} into a new version.
     *
     * @return id of the new version
     */
    public String createVersion(String sessionId, String userId, String description, List<String> tags) {
        Version v = store.locked(() -> {
            Session session = store.require(sessionId);
            AccessControl.requirePermission(session, userId, Permission.WRITE);
            Version created = fold(session, userId, description, tags);
            session.touch(created.timestamp());
            return created;
        });
        AuditLogger.logVersion(sessionId, v);
        return v.versionId();
    }

    /** Version metadata ordered by version number. */
    public List<VersionView> versions(String sessionId, String userId) {
        return store.locked(() -> {
            Session session = store.require(sessionId);
            AccessControl.requirePermission(session, userId, Permission.READ);
            return session.versions().stream().map(VersionView::of).toList();
        });
    }

    /**
     * Fold the journal into a new version. Caller holds the store lock.
     */
    Version fold(Session session, String userId, String description, List<String> tags) {
        requireLock();
        return append(session, userId, description, tags, session.drainJournal());
    }

    /**
     * Auto-save fold: only processed changes go into the version, PENDING
     * ones stay journaled for the worker. Caller holds the store lock.
     */
    Version autoSave(Session session, String userId) {
        requireLock();
        return append(session, userId, AUTO_SAVE, List.of("auto-save"), session.drainProcessed());
    }

    private Version append(Session session, String userId, String description, List<String> tags, List<Change> changes) {
        String parent = session.latestVersion().map(Version::versionId).orElse(null);
        Version v = new Version(
                UUID.randomUUID().toString(),
                session.nextVersionNumber(),
                clock.instant(),
                userId,
                description,
                changes,
                parent,
                tags
        );
        session.appendVersion(v);
        return v;
    }

    private void requireLock() {
        if (!store.isHeldByCurrentThread()) {
            throw new IllegalStateException("fold requires the session store lock");
        }
    }

    /**
     * Create a branch of {@code sessionId}.
     *
     * @return session id of the branch
     */
    public String createBranch(String sessionId, String userId, String name, String description) {
        String branchId = UUID.randomUUID().toString();
        store.locked(() -> {
            Session parent = store.require(sessionId);
            AccessControl.requirePermission(parent, userId, Permission.WRITE);
            Instant now = clock.instant();
            store.put(parent.branch(branchId, name, description, now));
            parent.touch(now);
            return branchId;
        });
        AuditLogger.logOperation("create-branch", sessionId, userId,
                "branch=" + branchId + (name == null ? "" : " name=" + name));
        return branchId;
    }

    /**
     * Merge the active changes of {@code sourceSessionId} into {@code targetSessionId}.
     * <p>
     * Per source change, in journal order:
     *  - no conflict with the target journal: journaled on the target as APPLIED.
     *  - conflicts and MANUAL: conflicts recorded unresolved, change journaled as CONFLICTED.
     *  - conflicts and any other strategy: each conflict is recorded and settled
     *    right away with that strategy. A source change that lost once in this
     *    merge is never re-admitted by a later conflict.
     * <p>
     * A version described "Merged from {sourceSessionId}" is created on the
     * target in every case. The source session is left as it is.
     */
    public boolean mergeBranch(String targetSessionId,
                               String sourceSessionId,
                               String userId,
                               ResolutionStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        MergeReport report = store.locked(() -> {
            Session target = store.require(targetSessionId);
            Session source = store.require(sourceSessionId);
            AccessControl.requirePermission(target, userId, Permission.WRITE);
            if (target == source) {
                throw new IllegalArgumentException("cannot merge session " + targetSessionId + " into itself");
            }

            Instant now = clock.instant();
            ConflictResolver resolver = ConflictResolver.forStrategy(strategy, clock);
            Set<String> dropped = new HashSet<>();
            List<Conflict> recorded = new ArrayList<>();
            int applied = 0;

            for (Change change : List.copyOf(source.journal())) {
                if (target.inJournal(change.changeId())) {
                    continue;
                }
                List<Conflict> found = detector.detect(List.copyOf(target.journal()), change);
                if (found.isEmpty()) {
                    target.putApplied(change);
                    applied++;
                    continue;
                }

                if (strategy == ResolutionStrategy.MANUAL) {
                    target.appendChange(change);
                    target.markConflicted(change.changeId());
                    found.forEach(target::addConflict);
                    recorded.addAll(found);
                    continue;
                }

                for (Conflict c : found) {
                    target.addConflict(c);
                    dropped.addAll(conflicts.settle(target, c, resolver, userId, now, id -> !dropped.contains(id)));
                    recorded.add(c);
                }
            }

            Version v = fold(target, userId, "Merged from " + sourceSessionId, List.of("merge"));
            target.touch(now);
            return new MergeReport(applied, recorded, v);
        });

        for (Conflict c : report.conflicts()) {
            AuditLogger.logConflict(targetSessionId, c);
        }
        AuditLogger.logVersion(targetSessionId, report.version());
        AuditLogger.logOperation("merge-branch", targetSessionId, userId, String.format(
                "source=%s strategy=%s applied=%d conflicts=%d",
                sourceSessionId, strategy.wireName(), report.applied(), report.conflicts().size()));
        return true;
    }

    private record MergeReport(int applied, List<Conflict> conflicts, Version version) {}
}
