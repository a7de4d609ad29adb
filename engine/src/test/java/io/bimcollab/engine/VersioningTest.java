package io.bimcollab.engine;

import io.bimcollab.core.ChangeStatus;
import io.bimcollab.core.ChangeType;
import io.bimcollab.core.PermissionDeniedException;
import io.bimcollab.core.ResolutionStrategy;
import io.bimcollab.core.SessionNotFoundException;
import io.bimcollab.core.UserRole;
import io.bimcollab.storage.SessionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VersioningTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private CollaborationEngine engine;

    private String open(EngineConfig config) {
        engine = new CollaborationEngine(config, new SessionStore(), clock).start();
        String s = engine.createSession("tower-b", "alice", "Alice", "alice@example.com");
        engine.joinSession(s, "bob", "Bob", "bob@example.com", UserRole.EDITOR);
        engine.joinSession(s, "vic", "Vic", "vic@example.com", UserRole.VIEWER);
        return s;
    }

    @AfterEach
    void tearDown() {
        if (engine != null) engine.close();
    }

    private void awaitIdle() throws InterruptedException {
        assertTrue(engine.awaitIdle(Duration.ofSeconds(5)));
    }

    @Test
    void create_version_snapshots_journal_and_chains_parents() throws Exception {
        String s = open(EngineConfig.defaults());
        engine.makeChange(s, "alice", ChangeType.CREATE, "wall_1", "wall", Map.of("h", 3));
        engine.makeChange(s, "bob", ChangeType.CREATE, "wall_2", "wall", Map.of("h", 3));
        awaitIdle();

        clock.advance(Duration.ofMinutes(1));
        String v1 = engine.createVersion(s, "bob", "ground floor walls", List.of("milestone"));
        assertTrue(engine.getChanges(s, "alice").isEmpty());

        engine.makeChange(s, "alice", ChangeType.DELETE, "wall_2", "wall", Map.of());
        awaitIdle();
        String v2 = engine.createVersion(s, "alice", "drop wall 2");

        var versions = engine.getVersions(s, "vic");
        assertEquals(2, versions.size());
        assertEquals(v1, versions.get(0).versionId());
        assertEquals(1, versions.get(0).versionNumber());
        assertEquals(2, versions.get(0).changeCount());
        assertEquals("bob", versions.get(0).userId());
        assertEquals(List.of("milestone"), versions.get(0).tags());
        assertEquals(T0.plusSeconds(60), versions.get(0).timestamp());
        assertEquals(v2, versions.get(1).versionId());
        assertEquals(2, versions.get(1).versionNumber());
        assertEquals(v1, versions.get(1).parentVersion());
        assertEquals(1, versions.get(1).changeCount());
    }

    @Test
    void viewer_cannot_version_or_branch() {
        String s = open(EngineConfig.defaults());
        assertThrows(PermissionDeniedException.class, () -> engine.createVersion(s, "vic", "nope"));
        assertThrows(PermissionDeniedException.class, () -> engine.createBranch(s, "vic", "b", null));
        assertThrows(SessionNotFoundException.class, () -> engine.createVersion("nope", "alice", "x"));
    }

    @Test
    void version_boundary_hides_older_changes_from_detection_by_default() throws Exception {
        String s = open(EngineConfig.defaults());
        engine.makeChange(s, "alice", ChangeType.UPDATE, "beam_4", "beam", Map.of("d", 300));
        awaitIdle();
        engine.createVersion(s, "alice", "checkpoint");

        clock.advance(Duration.ofSeconds(10));
        String bobs = engine.makeChange(s, "bob", ChangeType.UPDATE, "beam_4", "beam", Map.of("d", 320));
        awaitIdle();

        assertTrue(engine.getConflicts(s, "alice").isEmpty());
        assertEquals(ChangeStatus.APPLIED, engine.getChanges(s, "alice").get(0).status());
        assertEquals(bobs, engine.getChanges(s, "alice").get(0).changeId());
    }

    @Test
    void cross_version_detection_sees_latest_version_when_enabled() throws Exception {
        String s = open(EngineConfig.defaults().withDetectAcrossVersions(true));
        String alices = engine.makeChange(s, "alice", ChangeType.UPDATE, "beam_4", "beam", Map.of("d", 300));
        awaitIdle();
        engine.createVersion(s, "alice", "checkpoint");

        clock.advance(Duration.ofSeconds(10));
        engine.makeChange(s, "bob", ChangeType.UPDATE, "beam_4", "beam", Map.of("d", 320));
        awaitIdle();

        var conflicts = engine.getConflicts(s, "alice");
        assertEquals(1, conflicts.size());
        assertEquals(alices, conflicts.get(0).change1().changeId());
        assertEquals(ChangeStatus.CONFLICTED, engine.getChanges(s, "alice").get(0).status());
    }

    @Test
    void auto_version_cadence_follows_config() throws Exception {
        String s = open(EngineConfig.defaults().withVersionEvery(3));
        for (int i = 0; i < 7; i++) {
            engine.makeChange(s, "alice", ChangeType.CREATE, "col_" + i, "column", Map.of());
        }
        awaitIdle();

        var versions = engine.getVersions(s, "alice");
        assertEquals(2, versions.size());
        assertEquals(3, versions.get(1).changeCount());
        assertEquals(versions.get(0).versionId(), versions.get(1).parentVersion());
        assertEquals(1, engine.getChanges(s, "alice").size());
    }

    @Test
    void merge_without_conflicts_applies_branch_changes_and_versions_target() throws Exception {
        String s = open(EngineConfig.defaults());
        engine.makeChange(s, "alice", ChangeType.UPDATE, "roof", "roof", Map.of("pitch", 30));
        awaitIdle();
        String branch = engine.createBranch(s, "alice", "annex", "annex wing");
        engine.makeChange(branch, "bob", ChangeType.CREATE, "annex_wall", "wall", Map.of("h", 3));
        awaitIdle();

        assertTrue(engine.mergeBranch(s, branch, "alice", ResolutionStrategy.MANUAL));

        var versions = engine.getVersions(s, "alice");
        var merged = versions.get(versions.size() - 1);
        assertEquals("Merged from " + branch, merged.description());
        assertEquals(2, merged.changeCount());
        assertTrue(engine.getConflicts(s, "alice").isEmpty());
        assertEquals(1, engine.getChanges(branch, "bob").size());
    }

    @Test
    void manual_merge_leaves_conflicts_open() throws Exception {
        String s = open(EngineConfig.defaults());
        engine.makeChange(s, "alice", ChangeType.MOVE, "stair_1", "stair", Map.of("x", 0));
        awaitIdle();
        String branch = engine.createBranch(s, "bob", "stairs", null);
        clock.advance(Duration.ofSeconds(15));
        engine.makeChange(branch, "bob", ChangeType.MOVE, "stair_1", "stair", Map.of("x", 2));
        awaitIdle();

        engine.mergeBranch(s, branch, "alice", ResolutionStrategy.MANUAL);

        var open = engine.getConflicts(s, "alice");
        assertEquals(1, open.size());
        assertEquals("bob", open.get(0).userId2());
        var versions = engine.getVersions(s, "alice");
        assertEquals(2, versions.get(versions.size() - 1).changeCount());

        engine.resolveConflict(s, open.get(0).conflictId(), ResolutionStrategy.LAST_WRITER_WINS, "alice");
        assertTrue(engine.getConflicts(s, "alice").isEmpty());
    }

    @Test
    void last_writer_merge_brings_in_the_newer_branch_change() throws Exception {
        String s = open(EngineConfig.defaults());
        engine.makeChange(s, "alice", ChangeType.MOVE, "stair_1", "stair", Map.of("x", 0));
        awaitIdle();
        String branch = engine.createBranch(s, "bob", "stairs", null);
        clock.advance(Duration.ofSeconds(15));
        String bobs = engine.makeChange(branch, "bob", ChangeType.MOVE, "stair_1", "stair", Map.of("x", 2));
        awaitIdle();

        engine.mergeBranch(s, branch, "alice", ResolutionStrategy.LAST_WRITER_WINS);

        var exported = engine.exportSession(s, "alice");
        var last = exported.versions().get(exported.versions().size() - 1);
        assertEquals(1, last.changes().size());
        assertEquals(bobs, last.changes().get(0).changeId());
        assertEquals("last_writer_wins", exported.conflicts().get(0).resolution());
    }

    @Test
    void merge_strategy_combines_branch_and_target_changes() throws Exception {
        String s = open(EngineConfig.defaults());
        String alices = engine.makeChange(s, "alice", ChangeType.MOVE, "stair_1", "stair", Map.of("x", 0, "mat", "steel"));
        awaitIdle();
        String branch = engine.createBranch(s, "bob", "stairs", null);
        clock.advance(Duration.ofSeconds(15));
        String bobs = engine.makeChange(branch, "bob", ChangeType.MOVE, "stair_1", "stair", Map.of("x", 2));
        awaitIdle();

        engine.mergeBranch(s, branch, "alice", ResolutionStrategy.MERGE);

        var exported = engine.exportSession(s, "alice");
        var last = exported.versions().get(exported.versions().size() - 1);
        assertEquals(1, last.changes().size());
        var merged = last.changes().get(0);
        assertEquals("alice+bob", merged.userId());
        assertEquals(Map.of("x", 2, "mat", "steel"), merged.newValue());
        assertEquals(List.of(alices, bobs), merged.metadata().get("mergedFrom"));
        assertEquals("merge", exported.conflicts().get(0).resolution());
        assertTrue(engine.getConflicts(s, "alice").isEmpty());
    }

    @Test
    void merge_needs_both_sessions_and_write_on_target() {
        String s = open(EngineConfig.defaults());
        String branch = engine.createBranch(s, "alice", "b", null);

        assertThrows(SessionNotFoundException.class,
                () -> engine.mergeBranch(s, "nope", "alice", ResolutionStrategy.MERGE));
        assertThrows(SessionNotFoundException.class,
                () -> engine.mergeBranch("nope", branch, "alice", ResolutionStrategy.MERGE));
        assertThrows(PermissionDeniedException.class,
                () -> engine.mergeBranch(s, branch, "vic", ResolutionStrategy.MERGE));
        assertThrows(IllegalArgumentException.class,
                () -> engine.mergeBranch(s, s, "alice", ResolutionStrategy.MERGE));
    }
}
