// file: storage/src/main/java/io/bimcollab/storage/Session.java
package io.bimcollab.storage;

import io.bimcollab.core.Change;
import io.bimcollab.core.ChangeStatus;
import io.bimcollab.core.Conflict;
import io.bimcollab.core.Permission;
import io.bimcollab.core.User;
import io.bimcollab.core.Version;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One collaborative editing context for a single model.
 * <p>
 * State:
 *  - users and their permission sets (userId -> ...).
 *  - the active change journal: changes not yet folded into a Version,
 *    in insertion order, each with a {@link ChangeStatus}.
 *  - every conflict ever detected (resolved ones are kept for audit).
 *  - the ordered version history.
 * <p>
 * Not thread safe. Every read and write must happen while holding the
 * owning {@link SessionStore}'s lock.
 */
public final class Session {

    private final String sessionId;
    private final String modelId;
    private final Instant createdAt;
    private Instant lastActivity;

    private final Map<String, User> users = new LinkedHashMap<>();
    private final Map<String, Set<Permission>> permissions = new HashMap<>();

    private final Map<String, Change> journal = new LinkedHashMap<>();
    private final Map<String, ChangeStatus> statuses = new HashMap<>();

    private final List<Conflict> conflicts = new ArrayList<>();
    private final List<Version> versions = new ArrayList<>();

    // Branch lineage; all null for root sessions.
    private final String parentSessionId;
    private final String branchName;
    private final String branchDescription;

    public Session(String sessionId, String modelId, Instant createdAt) {
        this(sessionId, modelId, createdAt, null, null, null);
    }

    private Session(String sessionId,
                    String modelId,
                    Instant createdAt,
                    String parentSessionId,
                    String branchName,
                    String branchDescription) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.modelId = Objects.requireNonNull(modelId, "modelId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActivity = createdAt;
        this.parentSessionId = parentSessionId;
        this.branchName = branchName;
        this.branchDescription = branchDescription;
    }

    // ---------- identity ----------

    public String sessionId() { return sessionId; }

    public String modelId() { return modelId; }

    public Instant createdAt() { return createdAt; }

    public Instant lastActivity() { return lastActivity; }

    public void touch(Instant now) { this.lastActivity = now; }

    public Optional<String> parentSessionId() { return Optional.ofNullable(parentSessionId); }

    public Optional<String> branchName() { return Optional.ofNullable(branchName); }

    public Optional<String> branchDescription() { return Optional.ofNullable(branchDescription); }

    // ---------- users ----------

    /** Insert or overwrite a user together with its permission set. */
    public void putUser(User user) {
        users.put(user.userId(), user);
        permissions.put(user.userId(), user.permissions());
    }

    /** @return false if the user was not present */
    public boolean removeUser(String userId) {
        permissions.remove(userId);
        return users.remove(userId) != null;
    }

    public boolean hasUser(String userId) {
        return users.containsKey(userId);
    }

    public Optional<User> user(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    public Collection<User> users() {
        return Collections.unmodifiableCollection(users.values());
    }

    /** Permission set of the user; empty if the user is not in the session. */
    public Set<Permission> permissionsOf(String userId) {
        return permissions.getOrDefault(userId, Set.of());
    }

    public boolean hasPermission(String userId, Permission permission) {
        return permissionsOf(userId).contains(permission);
    }

    // ---------- journal ----------

    /** Journal a freshly submitted change as PENDING. */
    public void appendChange(Change change) {
        if (journal.putIfAbsent(change.changeId(), change) != null) {
            throw new IllegalArgumentException("duplicate changeId " + change.changeId());
        }
        statuses.put(change.changeId(), ChangeStatus.PENDING);
    }

    /** Journal (or re-journal) a change directly as APPLIED. */
    public void putApplied(Change change) {
        journal.put(change.changeId(), change);
        statuses.put(change.changeId(), ChangeStatus.APPLIED);
    }

    public void markApplied(String changeId) {
        setStatus(changeId, ChangeStatus.APPLIED);
    }

    public void markConflicted(String changeId) {
        setStatus(changeId, ChangeStatus.CONFLICTED);
    }

    /** @return false if the change was not in the journal */
    public boolean removeChange(String changeId) {
        statuses.remove(changeId);
        return journal.remove(changeId) != null;
    }

    public boolean inJournal(String changeId) {
        return journal.containsKey(changeId);
    }

    public Optional<ChangeStatus> statusOf(String changeId) {
        return Optional.ofNullable(statuses.get(changeId));
    }

    /** Read-only live view of the journal in insertion order. */
    public Collection<Change> journal() {
        return Collections.unmodifiableCollection(journal.values());
    }

    public int journalSize() {
        return journal.size();
    }

    public int appliedCount() {
        int n = 0;
        for (ChangeStatus s : statuses.values()) {
            if (s == ChangeStatus.APPLIED) n++;
        }
        return n;
    }

    /** Remove and return every journaled change, in insertion order. */
    public List<Change> drainJournal() {
        List<Change> drained = List.copyOf(journal.values());
        journal.clear();
        statuses.clear();
        return drained;
    }

    /**
     * Remove and return the journaled changes that were already processed
     * (not PENDING), in insertion order. PENDING changes stay journaled.
     */
    public List<Change> drainProcessed() {
        List<Change> drained = new ArrayList<>();
        var it = journal.values().iterator();
        while (it.hasNext()) {
            Change c = it.next();
            if (statuses.get(c.changeId()) != ChangeStatus.PENDING) {
                drained.add(c);
                statuses.remove(c.changeId());
                it.remove();
            }
        }
        return List.copyOf(drained);
    }

    private void setStatus(String changeId, ChangeStatus status) {
        if (!journal.containsKey(changeId)) {
            throw new IllegalArgumentException("change " + changeId + " not in journal of session " + sessionId);
        }
        statuses.put(changeId, status);
    }

    // ---------- conflicts ----------

    public void addConflict(Conflict conflict) {
        conflicts.add(conflict);
    }

    /** Every conflict, resolved or not, in detection order. */
    public List<Conflict> conflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    public List<Conflict> unresolvedConflicts() {
        return conflicts.stream().filter(c -> !c.isResolved()).toList();
    }

    /** True if a conflict, resolved or not, was already recorded for this pair of changes. */
    public boolean hasConflictBetween(String changeId1, String changeId2) {
        for (Conflict c : conflicts) {
            if (c.involves(changeId1) && c.involves(changeId2)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasUnresolvedConflictInvolving(String changeId) {
        for (Conflict c : conflicts) {
            if (!c.isResolved() && c.involves(changeId)) {
                return true;
            }
        }
        return false;
    }

    public Optional<Conflict> findUnresolvedConflict(String conflictId) {
        for (Conflict c : conflicts) {
            if (c.conflictId().equals(conflictId) && !c.isResolved()) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    // ---------- versions ----------

    public List<Version> versions() {
        return Collections.unmodifiableList(versions);
    }

    public Optional<Version> latestVersion() {
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    public int nextVersionNumber() {
        return versions.size() + 1;
    }

    /**
     * Append a version. Numbers must be gapless and the parent must be the
     * current latest version.
     */
    public void appendVersion(Version version) {
        int expected = nextVersionNumber();
        if (version.versionNumber() != expected) {
            throw new IllegalStateException(
                    "expected version number %d, got %d".formatted(expected, version.versionNumber()));
        }
        String expectedParent = latestVersion().map(Version::versionId).orElse(null);
        if (!Objects.equals(expectedParent, version.parentVersion())) {
            throw new IllegalStateException(
                    "version parent must be %s, got %s".formatted(expectedParent, version.parentVersion()));
        }
        versions.add(version);
    }

    // ---------- branching ----------

    /**
     * New session for a branch: same model, users, permissions and version
     * history, with an empty journal and no conflicts.
     */
    public Session branch(String branchSessionId, String name, String description, Instant now) {
        Session b = new Session(branchSessionId, modelId, now, sessionId, name, description);
        b.users.putAll(users);
        b.permissions.putAll(permissions);
        b.versions.addAll(versions);
        return b;
    }
}
