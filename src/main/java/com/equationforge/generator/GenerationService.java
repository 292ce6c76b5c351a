package com.equationforge.generator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

@Service
public class GenerationService {

    public static final String CSV_HEADER = "equation";
    private static final String DEFAULT_OUTPUT_DIRECTORY = "equations";
    private static final int PROGRESS_BATCH = 1 << 16;
    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    public static void main(String[] args) {
        GenerationService generationService = new GenerationService();
        for (GameMode mode : GameMode.values()) {
            GenerationOptions options = GenerationOptions.builder()
                    .mode(mode)
                    .build();
            GenerationResult result = generationService.runGeneration(options);
            generationService.persistEquations(result, Path.of(DEFAULT_OUTPUT_DIRECTORY));
        }
    }

    public List<EquationPattern> patterns(GameMode mode) {
        return PatternGenerator.patternsFor(mode);
    }

    public GenerationResult runGeneration(GenerationOptions options) {
        Objects.requireNonNull(options, "options");
        long start = System.nanoTime();
        GameMode mode = options.mode();
        List<EquationPattern> patterns = PatternGenerator.patternsFor(mode);
        long totalCandidates = 0;
        for (EquationPattern pattern : patterns) {
            totalCandidates += pattern.candidateCount();
        }

        List<Shard> shards = planShards(patterns, options.candidateLimit());
        long plannedCandidates = 0;
        for (Shard shard : shards) {
            plannedCandidates += shard.limit();
        }
        log.info("Generating {} equations: {} patterns, {} shards, {} candidates, parallelism {}",
                mode.label(), patterns.size(), shards.size(), plannedCandidates, options.parallelism());

        ProgressLogger progressLogger = ProgressLogger.create(options.progressLogPercentStep(), plannedCandidates);
        List<ShardResult> shardResults = options.parallelism() == 1
                ? runSequentially(shards, progressLogger)
                : runConcurrently(shards, options.parallelism(), progressLogger);

        List<String> equations = new ArrayList<>();
        EquationFilter.Tally tally = EquationFilter.Tally.EMPTY;
        for (ShardResult shardResult : shardResults) {
            equations.addAll(shardResult.equations());
            tally = tally.plus(shardResult.tally());
        }

        Duration spent = Duration.ofNanos(System.nanoTime() - start);
        GenerationResult result = new GenerationResult(
                mode,
                equations,
                tally.accepted(),
                tally.examined(),
                totalCandidates,
                patterns.size(),
                spent);
        String timeLabel = String.format(Locale.US, "%.1f s", spent.toNanos() / 1_000_000_000.0);
        log.info("Generation {}: {} (spent={})", mode.label(), result.summary(), timeLabel);
        return result;
    }

    public Path persistEquations(GenerationResult result, Path directory) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(directory, "directory");
        List<String> lines = new ArrayList<>(result.equations().size() + 1);
        lines.add(CSV_HEADER);
        lines.addAll(result.equations());
        try {
            Files.createDirectories(directory);
            Path path = equationsPath(result.mode(), directory);
            // Readers see either the previous table or the new one, never a partial file.
            Path temp = Files.createTempFile(directory, result.mode().label() + "_equations", ".tmp");
            try {
                Files.write(temp, lines, StandardCharsets.UTF_8);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.info("Saved {} {} equations to {}", result.equations().size(), result.mode().label(), path);
            return path;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to persist " + result.mode().label() + " equations", ex);
        }
    }

    public static Path equationsPath(GameMode mode, Path directory) {
        return directory.resolve(mode.label() + "_equations.csv");
    }

    // A candidate limit keeps the first candidates of every pattern, in enumeration order.
    static List<Shard> planShards(List<EquationPattern> patterns, Long candidateLimit) {
        List<Shard> shards = new ArrayList<>();
        for (EquationPattern pattern : patterns) {
            PositionAlphabet first = pattern.positions().get(0);
            long remaining = candidateLimit == null ? pattern.candidateCount() : candidateLimit;
            for (int i = 0; i < first.size() && remaining > 0; i++) {
                EquationPattern narrowed = pattern.withFirstSymbol(first.symbolAt(i));
                long limit = Math.min(remaining, narrowed.candidateCount());
                shards.add(new Shard(narrowed, limit));
                remaining -= limit;
            }
        }
        return shards;
    }

    private List<ShardResult> runSequentially(List<Shard> shards, ProgressLogger progressLogger) {
        List<ShardResult> results = new ArrayList<>(shards.size());
        for (Shard shard : shards) {
            results.add(runShard(shard, progressLogger));
        }
        return results;
    }

    private List<ShardResult> runConcurrently(List<Shard> shards, int parallelism, ProgressLogger progressLogger) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int poolSize = Math.min(parallelism, shards.size());
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("equation-worker-");
        executor.setDaemon(true);
        executor.initialize();
        try {
            List<CompletableFuture<ShardResult>> futures = new ArrayList<>(shards.size());
            for (Shard shard : shards) {
                futures.add(CompletableFuture.supplyAsync(() -> runShard(shard, progressLogger), executor));
            }
            List<ShardResult> results = new ArrayList<>(shards.size());
            for (CompletableFuture<ShardResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Generation interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Generation shard failed", cause);
        } finally {
            executor.shutdown();
        }
    }

    private ShardResult runShard(Shard shard, ProgressLogger progressLogger) {
        List<String> equations = new ArrayList<>();
        EquationFilter filter = new EquationFilter(equations::add);
        Iterator<String> candidates = new CandidateEnumerator(shard.pattern()).iterator();
        long reported = 0;
        while (candidates.hasNext() && filter.examined() < shard.limit()) {
            filter.test(candidates.next());
            if (progressLogger != null && filter.examined() - reported >= PROGRESS_BATCH) {
                progressLogger.record(filter.examined() - reported);
                reported = filter.examined();
            }
        }
        if (progressLogger != null && filter.examined() > reported) {
            progressLogger.record(filter.examined() - reported);
        }
        log.debug("Shard {} done: {}/{} accepted", shard.pattern().label(), filter.accepted(), filter.examined());
        return new ShardResult(equations, filter.tally());
    }

    private static final class ProgressLogger {
        private final long totalCandidates;
        private final int stepPercent;
        private long examined;
        private int nextPercent;

        private ProgressLogger(long totalCandidates, int stepPercent) {
            this.totalCandidates = Math.max(totalCandidates, 1);
            this.stepPercent = stepPercent;
            this.nextPercent = stepPercent;
        }

        static ProgressLogger create(Integer requestedPercentStep, long totalCandidates) {
            if (requestedPercentStep == null) {
                return null;
            }
            return new ProgressLogger(totalCandidates, requestedPercentStep);
        }

        synchronized void record(long delta) {
            examined += delta;
            int percent = (int) Math.min(100, examined * 100 / totalCandidates);
            boolean crossed = false;
            while (nextPercent <= 100 && percent >= nextPercent) {
                nextPercent += stepPercent;
                crossed = true;
            }
            if (crossed) {
                log.info("Examined {}% of candidates ({}/{}).", percent, examined, totalCandidates);
            }
        }
    }

    record Shard(EquationPattern pattern, long limit) {
    }

    private record ShardResult(List<String> equations, EquationFilter.Tally tally) {
    }
}
