// file: bench/src/main/java/io/bimcollab/bench/ChangeThroughputBench.java
package io.bimcollab.bench;

import io.bimcollab.core.ChangeType;
import io.bimcollab.core.UserRole;
import io.bimcollab.engine.CollaborationEngine;
import io.bimcollab.engine.EngineConfig;
import io.bimcollab.engine.view.SessionStatus;
import io.bimcollab.storage.SessionStore;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.LogManager;

/**
 * In-process workload driver: many editors hammering one session.
 *
 * Usage:
 *   java -cp bench.jar io.bimcollab.bench.ChangeThroughputBench \
 *     --threads 8 \
 *     --duration-seconds 10 \
 *     --elements 200 \
 *     --zipf-skew 0.99 \
 *     --conflict-window-seconds 300 \
 *     --version-every 10
 *
 * Each thread is one EDITOR in the session. Engine flags (see
 * {@link EngineConfig#fromArgs(String[])}) are passed through.
 *
 * Output:
 *   - Summary line to stderr (submit throughput and latency, plus the
 *     session's conflict and version counts once the worker drained).
 *   - CSV to stdout with per-call samples:
 *       op,success,latency_ms
 */
public final class ChangeThroughputBench {

    private static final Set<String> BENCH_FLAGS = Set.of("threads", "duration-seconds", "elements", "zipf-skew");

    private record Sample(String op, boolean ok, double latencyMs) {}

    public static void main(String[] args) throws Exception {
        configureLogging();
        Map<String, String> cfg = parseArgs(args);

        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int durationSeconds = Integer.parseInt(cfg.getOrDefault("duration-seconds", "10"));
        int elements = Integer.parseInt(cfg.getOrDefault("elements", "200"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));

        EngineConfig engineConfig = EngineConfig.fromArgs(args);
        try (CollaborationEngine engine =
                     new CollaborationEngine(engineConfig, new SessionStore(), Clock.systemUTC()).start()) {
            runBenchmark(engine, threads, durationSeconds, new ZipfianElementGenerator("element-", elements, zipfSkew, 42L));
        }
    }

    /** Keep only this driver's flags; everything else belongs to EngineConfig. */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--") && BENCH_FLAGS.contains(a.substring(2))) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(a.substring(2), args[++i]);
            }
        }
        return out;
    }

    private static void configureLogging() {
        try (InputStream in = ChangeThroughputBench.class.getResourceAsStream("/bench-logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("could not load bench-logging.properties: " + e.getMessage());
        }
    }

    private static void runBenchmark(CollaborationEngine engine,
                                     int threads,
                                     int durationSeconds,
                                     ZipfianElementGenerator elements) throws Exception {
        String sessionId = engine.createSession("bench-model", "owner", "owner", "owner@bench.local");
        for (int t = 0; t < threads; t++) {
            engine.joinSession(sessionId, "editor-" + t, "editor-" + t, "editor-" + t + "@bench.local", UserRole.EDITOR);
        }

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicLong opCount = new AtomicLong();
        long endTime = System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds);

        for (int t = 0; t < threads; t++) {
            String userId = "editor-" + t;
            exec.submit(() -> {
                ThreadLocalRandom rnd = ThreadLocalRandom.current();
                while (System.nanoTime() < endTime) {
                    String elementId = elements.nextElementId();
                    Map<String, Object> value = Map.of("width", rnd.nextInt(100, 5000), "editor", userId);
                    long start = System.nanoTime();
                    boolean ok = false;
                    try {
                        engine.makeChange(sessionId, userId, ChangeType.PROPERTY_CHANGE, elementId, "wall", value);
                        ok = true;
                    } catch (RuntimeException e) {
                        ok = false;
                    } finally {
                        double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
                        samples.add(new Sample("make_change", ok, latencyMs));
                        opCount.incrementAndGet();
                    }
                }
            });
        }
        exec.shutdown();
        exec.awaitTermination(durationSeconds + 5L, TimeUnit.SECONDS);

        long drainStart = System.nanoTime();
        boolean drained = engine.awaitIdle(Duration.ofSeconds(60));
        double drainMs = (System.nanoTime() - drainStart) / 1_000_000.0;

        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);

        summarizeAndPrint(all, opCount.get(), durationSeconds, engine.getSessionStatus(sessionId), drained, drainMs);
    }

    private static void summarizeAndPrint(List<Sample> all,
                                          long totalOps,
                                          int durationSeconds,
                                          SessionStatus status,
                                          boolean drained,
                                          double drainMs) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        double throughput = totalOps / (double) durationSeconds;

        List<Double> latencies = new ArrayList<>(all.size());
        for (Sample s : all) {
            if (s.ok()) {
                latencies.add(s.latencyMs());
            }
        }
        Collections.sort(latencies);

        long okCount = all.stream().filter(Sample::ok).count();
        long errCount = all.size() - okCount;

        System.err.printf(
                "throughput=%.2f changes/s, ok=%d, err=%d, p50=%.3fms, p95=%.3fms, p99=%.3fms, "
                        + "drained=%s in %.1fms, conflicts=%d (unresolved=%d), versions=%d, journal=%d%n",
                throughput, okCount, errCount,
                percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99),
                drained, drainMs,
                status.conflictCount(), status.unresolvedConflictCount(), status.versionCount(),
                status.activeChangeCount()
        );

        System.out.println("op,success,latency_ms");
        for (Sample s : all) {
            System.out.printf("%s,%s,%.3f%n", s.op(), s.ok() ? "1" : "0", s.latencyMs());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
