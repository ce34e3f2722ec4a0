// file: bench/src/main/java/io/pagetree/bench/EditWorkloadBench.java
package io.pagetree.bench;

import io.pagetree.core.FieldState;
import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.core.TreeNode;
import io.pagetree.core.TreeValidator;
import io.pagetree.editor.DocumentSession;
import io.pagetree.editor.EditorConfig;
import io.pagetree.editor.drag.ButtonType;
import io.pagetree.storage.FileSnapshotStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Edit workload driver: every thread owns one document session and runs a random mix of
 * editor operations against it for a fixed time. Every {@code validate-every} operations
 * the session's tree is checked against its pages; failures are counted and logged.
 *
 * Usage:
 *   java -cp bench.jar io.pagetree.bench.EditWorkloadBench \
 *     --threads 4 \
 *     --duration-seconds 30 \
 *     --initial-pages 50 \
 *     --max-pages 2000 \
 *     --undo-ratio 0.1 \
 *     --drag-ratio 0.3 \
 *     --save-every 500 \
 *     --validate-every 100 \
 *     --seed 42
 *
 * Output:
 *   - Summary line to stderr (includes invalid_trees, expected to be 0).
 *   - CSV to stdout with per-op latency samples:
 *       op,success,latency_ms
 */
public final class EditWorkloadBench {

    private static final Logger log = Logger.getLogger(EditWorkloadBench.class.getName());

    private static final class Sample {
        final String op;
        final boolean ok;
        final double latencyMs;

        Sample(String op, boolean ok, double latencyMs) {
            this.op = op;
            this.ok = ok;
            this.latencyMs = latencyMs;
        }
    }

    public static void main(String[] args) throws Exception {
        // Per-edit logging would dominate the measurement.
        Logger.getLogger("io.pagetree").setLevel(Level.WARNING);

        Map<String, String> cfg = parseArgs(args);

        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int durationSeconds = Integer.parseInt(cfg.getOrDefault("duration-seconds", "30"));
        int initialPages = Integer.parseInt(cfg.getOrDefault("initial-pages", "50"));
        int maxPages = Integer.parseInt(cfg.getOrDefault("max-pages", "2000"));
        double undoRatio = Double.parseDouble(cfg.getOrDefault("undo-ratio", "0.1"));
        double dragRatio = Double.parseDouble(cfg.getOrDefault("drag-ratio", "0.3"));
        int saveEvery = Integer.parseInt(cfg.getOrDefault("save-every", "500"));
        int validateEvery = Integer.parseInt(cfg.getOrDefault("validate-every", "100"));
        long seed = Long.parseLong(cfg.getOrDefault("seed", "42"));

        runBenchmark(threads, durationSeconds, initialPages, maxPages, undoRatio, dragRatio,
                saveEvery, validateEvery, seed);
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static void runBenchmark(
            int threads,
            int durationSeconds,
            int initialPages,
            int maxPages,
            double undoRatio,
            double dragRatio,
            int saveEvery,
            int validateEvery,
            long seed
    ) throws Exception {

        Path saveDir = Files.createTempDirectory("pagetree-bench");
        try {
            runWorkers(saveDir, threads, durationSeconds, initialPages, maxPages, undoRatio, dragRatio,
                    saveEvery, validateEvery, seed);
        } finally {
            deleteRecursively(saveDir);
        }
    }

    private static void runWorkers(
            Path saveDir,
            int threads,
            int durationSeconds,
            int initialPages,
            int maxPages,
            double undoRatio,
            double dragRatio,
            int saveEvery,
            int validateEvery,
            long seed
    ) throws Exception {
        EditorConfig config = EditorConfig.defaults();

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicLong opCount = new AtomicLong();
        AtomicLong invalidTrees = new AtomicLong();
        long endTime = System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds);

        for (int t = 0; t < threads; t++) {
            Random rnd = new Random(seed + t);
            FileSnapshotStore store = new FileSnapshotStore(saveDir.resolve("worker-" + t));
            DocumentSession session = new DocumentSession(config, store, Runnable::run);
            session.loadPages(seedPages(initialPages));
            session.toggleTreeMode();

            exec.submit(() -> {
                long ops = 0;
                while (System.nanoTime() < endTime) {
                    String op = pickOp(rnd, session, maxPages, undoRatio, dragRatio);
                    long start = System.nanoTime();
                    boolean ok = false;
                    try {
                        ok = apply(op, session, rnd);
                        ops++;
                        if (saveEvery > 0 && ops % saveEvery == 0) {
                            session.save();
                        }
                        if (validateEvery > 0 && ops % validateEvery == 0 && !checkTree(session, op)) {
                            invalidTrees.incrementAndGet();
                        }
                    } catch (RuntimeException e) {
                        log.log(Level.WARNING, op + " failed", e);
                    } finally {
                        double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
                        samples.add(new Sample(op, ok, latencyMs));
                        opCount.incrementAndGet();
                    }
                }
            });
        }
        exec.shutdown();
        exec.awaitTermination(durationSeconds + 5L, TimeUnit.SECONDS);

        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);

        summarizeAndPrint(all, opCount.get(), invalidTrees.get(), durationSeconds);
    }

    static boolean checkTree(DocumentSession session, String lastOp) {
        var state = session.state();
        var result = TreeValidator.validate(state.tree(), state.pages().size());
        if (!result.valid()) {
            log.warning("Invalid tree after " + lastOp + ": " + String.join("; ", result.errors()));
        }
        return result.valid();
    }

    static void deleteRecursively(Path dir) {
        try (var paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.log(Level.WARNING, "Could not remove bench directory " + dir, e);
        }
    }

    private static List<Page> seedPages(int count) {
        List<Page> pages = new ArrayList<>(count);
        for (int i = 0; i < Math.max(1, count); i++) {
            pages.add(Page.of(i, new FieldState("board-" + i), "page " + i));
        }
        return pages;
    }

    private static String pickOp(Random rnd, DocumentSession session, int maxPages, double undoRatio, double dragRatio) {
        double roll = rnd.nextDouble();
        if (roll < undoRatio) return rnd.nextBoolean() ? "undo" : "redo";
        roll -= undoRatio;
        if (roll < dragRatio) return "drag";
        if (session.state().pages().size() >= maxPages) return rnd.nextBoolean() ? "remove" : "comment";
        switch (rnd.nextInt(4)) {
            case 0: return "branch";
            case 1: return "insert";
            case 2: return "remove";
            default: return "comment";
        }
    }

    private static boolean apply(String op, DocumentSession session, Random rnd) {
        switch (op) {
            case "undo":
                return session.undo();
            case "redo":
                return session.redo();
            case "branch":
                return session.addBranch(randomNode(session, rnd));
            case "insert":
                return session.insertAfter(randomNode(session, rnd));
            case "remove":
                session.selectNode(randomNode(session, rnd));
                return session.removeCurrentNode(rnd.nextBoolean());
            case "comment": {
                int page = session.state().currentIndex();
                return session.updateComment(page, "edited " + rnd.nextInt(1000));
            }
            case "drag": {
                if (!session.startDrag(randomNode(session, rnd))) return false;
                NodeId target = randomNode(session, rnd);
                if (rnd.nextBoolean()) {
                    session.hoverNode(target);
                } else {
                    session.hoverButton(target, rnd.nextBoolean() ? ButtonType.INSERT : ButtonType.BRANCH);
                }
                return session.drop();
            }
            default:
                throw new IllegalArgumentException("unknown op: " + op);
        }
    }

    private static NodeId randomNode(DocumentSession session, Random rnd) {
        List<TreeNode> nodes = session.state().tree().preOrder();
        List<NodeId> real = new ArrayList<>(nodes.size());
        for (TreeNode n : nodes) {
            if (!n.isVirtual()) real.add(n.id());
        }
        return real.get(rnd.nextInt(real.size()));
    }

    private static void summarizeAndPrint(List<Sample> all, long totalOps, long invalidTrees, int durationSeconds) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        double throughput = totalOps / (double) durationSeconds;

        List<Double> latencies = new ArrayList<>(all.size());
        for (Sample s : all) {
            if (s.ok) {
                latencies.add(s.latencyMs);
            }
        }
        Collections.sort(latencies);

        double p50 = percentile(latencies, 0.50);
        double p95 = percentile(latencies, 0.95);
        double p99 = percentile(latencies, 0.99);

        long okCount = all.stream().filter(s -> s.ok).count();
        long rejected = all.size() - okCount;

        System.err.printf(
                "throughput=%.2f ops/s, applied=%d, no-op=%d, invalid_trees=%d, p50=%.3fms, p95=%.3fms, p99=%.3fms%n",
                throughput, okCount, rejected, invalidTrees, p50, p95, p99
        );

        // CSV to stdout.
        System.out.println("op,success,latency_ms");
        for (Sample s : all) {
            System.out.printf("%s,%s,%.3f%n", s.op, s.ok ? "1" : "0", s.latencyMs);
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
