// file: engine/src/main/java/io/bimcollab/engine/ConflictManager.java
package io.bimcollab.engine;

import io.bimcollab.core.Change;
import io.bimcollab.core.Conflict;
import io.bimcollab.core.ConflictNotFoundException;
import io.bimcollab.core.ConflictResolver;
import io.bimcollab.core.Permission;
import io.bimcollab.core.ResolutionStrategy;
import io.bimcollab.engine.view.ConflictView;
import io.bimcollab.storage.Session;
import io.bimcollab.storage.SessionStore;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Settles conflicts and applies resolver outcomes to a session journal.
 * <p>
 * Outcome semantics on the journal:
 *  - Apply:    superseded changes leave the journal; the winner is marked
 *              APPLIED. A synthetic winner (a merge result) is journaled as
 *              APPLIED. A winner that is no longer journaled was already
 *              folded into a version and is only re-journaled when the
 *              caller asks for it (branch merges do).
 *  - Discard:  rejected changes leave the journal.
 *  - Deferred: journal untouched.
 */
public final class ConflictManager {

    private final SessionStore store;
    private final Clock clock;

    public ConflictManager(SessionStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Resolve an unresolved conflict of a session.
     *
     * @throws io.bimcollab.core.SessionNotFoundException   unknown session
     * @throws io.bimcollab.core.PermissionDeniedException  resolver lacks write
     * @throws ConflictNotFoundException                    unknown or already resolved conflict
     */
    public boolean resolve(String sessionId, String conflictId, ResolutionStrategy strategy, String resolvedBy) {
        Objects.requireNonNull(strategy, "strategy");
        Conflict settled = store.locked(() -> {
            Session session = store.require(sessionId);
            AccessControl.requirePermission(session, resolvedBy, Permission.WRITE);
            Conflict conflict = session.findUnresolvedConflict(conflictId)
                    .orElseThrow(() -> new ConflictNotFoundException(conflictId));

            Instant now = clock.instant();
            settle(session, conflict, ConflictResolver.forStrategy(strategy, clock), resolvedBy, now, id -> false);
            session.touch(now);
            return conflict;
        });
        AuditLogger.logResolution(sessionId, settled, settled.resolution());
        return true;
    }

    /** Unresolved conflicts of a session, in detection order. */
    public List<ConflictView> unresolved(String sessionId, String userId) {
        return store.locked(() -> {
            Session session = store.require(sessionId);
            AccessControl.requireMember(session, userId);
            AccessControl.requirePermission(session, userId, Permission.READ);
            return session.unresolvedConflicts().stream().map(ConflictView::of).toList();
        });
    }

    /**
     * Run {@code resolver} on {@code conflict}, apply the outcome to the
     * journal and record the resolution. Caller holds the store lock.
     *
     * @param admitAbsent whether a winning conflict change that is not in the
     *                    journal gets journaled, by change id
     * @return ids of the changes this outcome dropped
     */
    Set<String> settle(Session session,
                       Conflict conflict,
                       ConflictResolver resolver,
                       String resolvedBy,
                       Instant now,
                       Predicate<String> admitAbsent) {
        if (!store.isHeldByCurrentThread()) {
            throw new IllegalStateException("settle requires the session store lock");
        }
        Set<String> dropped = new LinkedHashSet<>();
        ConflictResolver.Outcome outcome = resolver.resolve(conflict);

        if (outcome instanceof ConflictResolver.Outcome.Apply apply) {
            Change winner = apply.applied();
            for (Change loser : apply.superseded()) {
                if (!loser.changeId().equals(winner.changeId())) {
                    session.removeChange(loser.changeId());
                    dropped.add(loser.changeId());
                }
            }
            if (session.inJournal(winner.changeId())) {
                session.markApplied(winner.changeId());
            } else if (!conflict.involves(winner.changeId()) || admitAbsent.test(winner.changeId())) {
                session.putApplied(winner);
            }
        } else if (outcome instanceof ConflictResolver.Outcome.Discard discard) {
            for (Change rejected : discard.rejected()) {
                session.removeChange(rejected.changeId());
                dropped.add(rejected.changeId());
            }
        }
        // Deferred: nothing to apply.

        conflict.resolve(resolver.strategy(), resolvedBy, now);
        return dropped;
    }
}
