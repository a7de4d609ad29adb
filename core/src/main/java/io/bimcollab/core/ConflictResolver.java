// file: core/src/main/java/io/bimcollab/core/ConflictResolver.java
package io.bimcollab.core;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Policy that turns a conflicting pair of changes into an {@link Outcome}.
 * <p>
 * Resolvers are pure: they never touch a session. The caller applies the
 * outcome to the journal and records the resolution on the Conflict.
 */
public interface ConflictResolver {

    /** Strategy this resolver implements, recorded on the conflict. */
    ResolutionStrategy strategy();

    Outcome resolve(Conflict conflict);

    /**
     * What to do with the two changes of a conflict:
     *  - Apply:    {@code applied} takes effect, every change in {@code superseded} is dropped.
     *              {@code applied} may be a synthetic change that was never journaled.
     *  - Discard:  every change in {@code rejected} is dropped, nothing takes effect.
     *  - Deferred: nothing changes; the decision is made out of band.
     */
    sealed interface Outcome permits Outcome.Apply, Outcome.Discard, Outcome.Deferred {
        record Apply(Change applied, List<Change> superseded) implements Outcome {
            public Apply {
                Objects.requireNonNull(applied, "applied");
                superseded = List.copyOf(superseded);
            }
        }

        record Discard(List<Change> rejected) implements Outcome {
            public Discard {
                rejected = List.copyOf(rejected);
            }
        }

        record Deferred() implements Outcome {}
    }

    /**
     * Resolver for a strategy. AUTOMATIC maps to last-writer-wins.
     */
    static ConflictResolver forStrategy(ResolutionStrategy strategy, Clock clock) {
        Objects.requireNonNull(strategy, "strategy");
        return switch (strategy) {
            case LAST_WRITER_WINS -> new LastWriterWins(ResolutionStrategy.LAST_WRITER_WINS);
            case AUTOMATIC -> new LastWriterWins(ResolutionStrategy.AUTOMATIC);
            case MERGE -> new ShallowMerge(clock, () -> UUID.randomUUID().toString());
            case REJECT -> new RejectBoth();
            case MANUAL -> new Manual();
        };
    }

    /**
     * Keep the change with the later timestamp. On equal timestamps the
     * incoming change (change2) wins.
     */
    final class LastWriterWins implements ConflictResolver {
        private final ResolutionStrategy recordedAs;

        public LastWriterWins() {
            this(ResolutionStrategy.LAST_WRITER_WINS);
        }

        LastWriterWins(ResolutionStrategy recordedAs) {
            this.recordedAs = recordedAs;
        }

        @Override public ResolutionStrategy strategy() { return recordedAs; }

        @Override public Outcome resolve(Conflict conflict) {
            Change a = conflict.change1();
            Change b = conflict.change2();
            if (a.timestamp().isAfter(b.timestamp())) {
                return new Outcome.Apply(a, List.of(b));
            }
            return new Outcome.Apply(b, List.of(a));
        }
    }

    /**
     * Shallow merge of both newValue maps into one synthetic change.
     * <p>
     * The chronologically later change overwrites colliding keys. The merged
     * change is authored "{earlierUser}+{laterUser}" and keeps the earlier
     * change's type, element type and oldValue.
     */
    final class ShallowMerge implements ConflictResolver {
        private final Clock clock;
        private final Supplier<String> ids;

        public ShallowMerge(Clock clock, Supplier<String> ids) {
            this.clock = Objects.requireNonNull(clock, "clock");
            this.ids = Objects.requireNonNull(ids, "ids");
        }

        @Override public ResolutionStrategy strategy() { return ResolutionStrategy.MERGE; }

        @Override public Outcome resolve(Conflict conflict) {
            Change earlier = conflict.change1();
            Change later = conflict.change2();
            if (later.timestamp().isBefore(earlier.timestamp())) {
                earlier = conflict.change2();
                later = conflict.change1();
            }
            return new Outcome.Apply(merge(earlier, later), List.of(conflict.change1(), conflict.change2()));
        }

        /** Merge {@code later} over {@code earlier}. */
        public Change merge(Change earlier, Change later) {
            Map<String, Object> merged = new LinkedHashMap<>(earlier.newValue());
            merged.putAll(later.newValue());

            return new Change(
                    ids.get(),
                    earlier.userId() + "+" + later.userId(),
                    clock.instant(),
                    earlier.changeType(),
                    earlier.elementId(),
                    earlier.elementType(),
                    earlier.oldValue(),
                    merged,
                    "Merged changes from " + earlier.userId() + " and " + later.userId(),
                    Map.of("mergedFrom", List.of(earlier.changeId(), later.changeId()))
            );
        }
    }

    /** Apply neither change. */
    final class RejectBoth implements ConflictResolver {
        @Override public ResolutionStrategy strategy() { return ResolutionStrategy.REJECT; }

        @Override public Outcome resolve(Conflict conflict) {
            return new Outcome.Discard(List.of(conflict.change1(), conflict.change2()));
        }
    }

    /** Mark resolved without touching either change. */
    final class Manual implements ConflictResolver {
        @Override public ResolutionStrategy strategy() { return ResolutionStrategy.MANUAL; }

        @Override public Outcome resolve(Conflict conflict) {
            return new Outcome.Deferred();
        }
    }
}
