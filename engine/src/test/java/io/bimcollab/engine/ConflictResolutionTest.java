package io.bimcollab.engine;

import io.bimcollab.core.ChangeStatus;
import io.bimcollab.core.ChangeType;
import io.bimcollab.core.ConflictNotFoundException;
import io.bimcollab.core.PermissionDeniedException;
import io.bimcollab.core.ResolutionStrategy;
import io.bimcollab.core.SessionNotFoundException;
import io.bimcollab.core.UserRole;
import io.bimcollab.engine.view.ConflictView;
import io.bimcollab.storage.SessionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolutionTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private MutableClock clock;
    private CollaborationEngine engine;
    private String session;
    private String aliceChange;
    private String bobChange;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(T0);
        engine = new CollaborationEngine(EngineConfig.defaults(), new SessionStore(), clock).start();
        session = engine.createSession("tower-b", "alice", "Alice", "alice@example.com");
        engine.joinSession(session, "bob", "Bob", "bob@example.com", UserRole.EDITOR);
        engine.joinSession(session, "vic", "Vic", "vic@example.com");
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    /** alice then bob, 30s apart, on the same door. */
    private ConflictView conflictOnDoor() throws InterruptedException {
        aliceChange = engine.makeChange(session, "alice", ChangeType.PROPERTY_CHANGE, "door_7", "door",
                Map.of("height", 2.1, "finish", "oak"));
        assertTrue(engine.awaitIdle(Duration.ofSeconds(5)));
        clock.advance(Duration.ofSeconds(30));
        bobChange = engine.makeChange(session, "bob", ChangeType.PROPERTY_CHANGE, "door_7", "door",
                Map.of("height", 2.3));
        assertTrue(engine.awaitIdle(Duration.ofSeconds(5)));
        List<ConflictView> conflicts = engine.getConflicts(session, "alice");
        assertEquals(1, conflicts.size());
        return conflicts.get(0);
    }

    private ChangeStatus statusOf(String changeId) {
        return engine.getChanges(session, "alice").stream()
                .filter(c -> c.changeId().equals(changeId))
                .map(c -> c.status())
                .findFirst()
                .orElse(null);
    }

    @Test
    void incoming_change_is_marked_conflicted_until_resolved() throws Exception {
        conflictOnDoor();
        assertEquals(ChangeStatus.APPLIED, statusOf(aliceChange));
        assertEquals(ChangeStatus.CONFLICTED, statusOf(bobChange));
    }

    @Test
    void second_resolution_of_same_conflict_is_not_found() throws Exception {
        var c = conflictOnDoor();
        engine.resolveConflict(session, c.conflictId(), ResolutionStrategy.LAST_WRITER_WINS, "bob");

        var ex = assertThrows(ConflictNotFoundException.class,
                () -> engine.resolveConflict(session, c.conflictId(), ResolutionStrategy.REJECT, "alice"));
        assertEquals(c.conflictId(), ex.conflictId());
        assertThrows(ConflictNotFoundException.class,
                () -> engine.resolveConflict(session, "no-such-conflict", ResolutionStrategy.REJECT, "alice"));
    }

    @Test
    void resolution_is_recorded_with_resolver_and_time() throws Exception {
        var c = conflictOnDoor();
        clock.advance(Duration.ofMinutes(1));
        engine.resolveConflict(session, c.conflictId(), ResolutionStrategy.AUTOMATIC, "bob");

        var recorded = engine.exportSession(session, "alice").conflicts().get(0);
        assertEquals("automatic", recorded.resolution());
        assertEquals("bob", recorded.resolvedBy());
        assertEquals(T0.plusSeconds(90), recorded.resolvedAt());
        assertNull(statusOf(aliceChange));
        assertEquals(ChangeStatus.APPLIED, statusOf(bobChange));
    }

    @Test
    void merge_replaces_both_changes_with_one_combined_change() throws Exception {
        var c = conflictOnDoor();
        engine.resolveConflict(session, c.conflictId(), ResolutionStrategy.MERGE, "alice");

        var journal = engine.exportSession(session, "alice").changes();
        assertEquals(1, journal.size());
        var merged = journal.get(0);
        assertEquals("alice+bob", merged.userId());
        assertEquals(Map.of("height", 2.3, "finish", "oak"), merged.newValue());
        assertEquals("applied", merged.status());
        assertEquals(List.of(aliceChange, bobChange), merged.metadata().get("mergedFrom"));
    }

    @Test
    void reject_removes_both_changes() throws Exception {
        var c = conflictOnDoor();
        engine.resolveConflict(session, c.conflictId(), ResolutionStrategy.REJECT, "alice");

        assertTrue(engine.getChanges(session, "alice").isEmpty());
    }

    @Test
    void manual_only_marks_the_conflict_resolved() throws Exception {
        var c = conflictOnDoor();
        engine.resolveConflict(session, c.conflictId(), ResolutionStrategy.MANUAL, "alice");

        assertTrue(engine.getConflicts(session, "alice").isEmpty());
        assertEquals(ChangeStatus.APPLIED, statusOf(aliceChange));
        assertEquals(ChangeStatus.CONFLICTED, statusOf(bobChange));
    }

    @Test
    void viewer_cannot_resolve_but_can_list() throws Exception {
        var c = conflictOnDoor();

        assertEquals(1, engine.getConflicts(session, "vic").size());
        assertThrows(PermissionDeniedException.class,
                () -> engine.resolveConflict(session, c.conflictId(), ResolutionStrategy.REJECT, "vic"));
        assertThrows(SessionNotFoundException.class,
                () -> engine.resolveConflict("nope", c.conflictId(), ResolutionStrategy.REJECT, "alice"));
        assertEquals(1, engine.getConflicts(session, "alice").size());
    }

    @Test
    void changes_outside_the_window_do_not_conflict() throws Exception {
        engine.makeChange(session, "alice", ChangeType.UPDATE, "wall_3", "wall", Map.of("h", 1));
        clock.advance(Duration.ofMinutes(5));
        engine.makeChange(session, "bob", ChangeType.UPDATE, "wall_3", "wall", Map.of("h", 2));
        assertTrue(engine.awaitIdle(Duration.ofSeconds(5)));

        assertTrue(engine.getConflicts(session, "alice").isEmpty());
        assertTrue(engine.getChanges(session, "alice").stream().allMatch(ch -> ch.status() == ChangeStatus.APPLIED));
    }
}
