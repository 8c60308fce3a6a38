package com.entity.dedup.api;

import com.entity.dedup.blocking.BlockBuilder;
import com.entity.dedup.blocking.BlockFilter;
import com.entity.dedup.clustering.ClusterEngine;
import com.entity.dedup.clustering.LocalClustering;
import com.entity.dedup.core.model.Block;
import com.entity.dedup.core.model.DuplicateCluster;
import com.entity.dedup.core.model.SourceRecord;
import com.entity.dedup.logging.LogContext;
import com.entity.dedup.metrics.MetricsService;
import com.entity.dedup.scoring.PairwiseScorer;
import com.entity.dedup.scoring.ScoredBlock;
import com.entity.dedup.scoring.ScoringWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the deduplication pipeline.
 *
 * <p>A run blocks the records, splits and filters the blocks, scores every pair inside a
 * sub-block, clusters each sub-block on its distance matrix, and finally merges the local
 * clusters across blocks with a union-find. Sub-blocks are independent and may be processed
 * on a fixed thread pool; the merge always runs on the calling thread once every sub-block
 * has finished, so the output does not depend on {@code numThreads}.</p>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public class Deduplicator {
    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final DeduplicatorConfig config;
    private final BlockBuilder blockBuilder;
    private final PairwiseScorer scorer;
    private final ClusterEngine clusterEngine;
    private final MetricsService metrics;

    public Deduplicator(DeduplicatorConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.blockBuilder = new BlockBuilder(config.getBlockingRule());
        this.scorer = new PairwiseScorer(config.getComparators(), config.getAggregator(), config.getMaxComparisonsPerBlock());
        this.clusterEngine = new ClusterEngine(config.getClusteringOracle(), config.getClusteringOptions());
        this.metrics = config.getMetricsService();
        log.debug("deduplicator.created comparators={} aggregation={} blocking={} clustering={} threads={}",
                config.getComparators().attributes(), config.getAggregationStrategy().configName(),
                config.getBlockingRule() == null ? "none" : config.getBlockingRule().describe(),
                config.getClusteringOptions(), config.getNumThreads());
    }

    /**
     * Deduplicates records with the default run options.
     */
    public DeduplicationResult deduplicate(List<? extends Map<String, ?>> records) {
        return deduplicate(records, RunOptions.defaults());
    }

    /**
     * Deduplicates records.
     *
     * @param records input records; a record is identified by its position in this list
     * @param options per-run options such as the similarity threshold
     * @return the clusters, ordered by smallest member index, with run statistics
     * @throws ConfigurationException if a comparator attribute occurs in no record
     */
    public DeduplicationResult deduplicate(List<? extends Map<String, ?>> records, RunOptions options) {
        Objects.requireNonNull(records, "records is required");
        RunOptions runOptions = options != null ? options : RunOptions.defaults();
        String runId = LogContext.generateRunId();

        try (LogContext ctx = LogContext.forRun(runId)) {
            long start = System.nanoTime();
            List<SourceRecord> sourceRecords = ingest(records);
            validateAttributes(sourceRecords);
            log.info("dedup.run.started records={} threshold={}", sourceRecords.size(), runOptions.getSimilarityThreshold());

            List<Block> blocks = blockBuilder.build(sourceRecords);
            List<Block> subBlocks = new ArrayList<>();
            int skipped = 0;
            for (Block block : blocks) {
                for (Block subBlock : config.getBlockSplitter().split(block)) {
                    if (isRejected(subBlock)) {
                        skipped++;
                        log.debug("dedup.block.skipped blockId={} size={}", subBlock.id(), subBlock.size());
                        continue;
                    }
                    metrics.recordBlockSize(subBlock.size());
                    subBlocks.add(subBlock);
                }
            }
            log.debug("dedup.blocking.completed blocks={} subBlocks={} skipped={}", blocks.size(), subBlocks.size() + skipped, skipped);

            List<BlockOutcome> outcomes = processBlocks(runId, subBlocks, runOptions.getSimilarityThreshold());

            List<LocalClustering> clusterings = new ArrayList<>(outcomes.size());
            List<ScoringWarning> warnings = new ArrayList<>();
            long comparisons = 0;
            long oracleFailures = 0;
            for (BlockOutcome outcome : outcomes) {
                clusterings.add(outcome.clustering());
                warnings.addAll(outcome.scored().warnings());
                comparisons += outcome.scored().comparisons();
                if (outcome.clustering().oracleFailed()) {
                    oracleFailures++;
                }
            }

            boolean includeSingletons = runOptions.getIncludeSingletons() != null
                    ? runOptions.getIncludeSingletons()
                    : config.isIncludeSingletons();
            List<DuplicateCluster> clusters = new ArrayList<>();
            for (List<Integer> group : ClusterEngine.merge(sourceRecords.size(), clusterings)) {
                if (group.size() < 2 && !includeSingletons) {
                    continue;
                }
                List<SourceRecord> members = group.stream().map(sourceRecords::get).toList();
                DuplicateCluster cluster = new DuplicateCluster(UUID.randomUUID().toString(), members);
                metrics.recordClusterSize(cluster.size());
                clusters.add(cluster);
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            RunStatistics statistics = new RunStatistics(runId, sourceRecords.size(), blocks.size(),
                    subBlocks.size() + skipped, skipped, comparisons, warnings.size(), oracleFailures,
                    clusters.size(), duration);

            metrics.incrementRecords(sourceRecords.size());
            metrics.incrementComparisons(comparisons);
            metrics.incrementComparatorFailures(warnings.size());
            for (long i = 0; i < oracleFailures; i++) {
                metrics.incrementOracleFailures();
            }
            metrics.recordRunDuration(duration);

            if (!warnings.isEmpty()) {
                log.warn("dedup.run.degraded comparatorFailures={} oracleFailures={}", warnings.size(), oracleFailures);
            }
            log.info("dedup.run.completed stats={}", statistics);
            return new DeduplicationResult(clusters, statistics, warnings);
        }
    }

    private List<SourceRecord> ingest(List<? extends Map<String, ?>> records) {
        List<SourceRecord> sourceRecords = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            Map<String, ?> attributes = records.get(i);
            if (attributes == null) {
                log.warn("dedup.record.null index={}", i);
                sourceRecords.add(new SourceRecord(i, Map.of()));
            } else {
                sourceRecords.add(new SourceRecord(i, withoutNullKeys(attributes)));
            }
        }
        return sourceRecords;
    }

    private static Map<String, Object> withoutNullKeys(Map<String, ?> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private void validateAttributes(List<SourceRecord> records) {
        if (config.getSchema() != null || records.isEmpty()) {
            return;
        }
        for (String attribute : config.getComparators().attributes()) {
            boolean present = records.stream().anyMatch(r -> r.has(attribute));
            if (!present) {
                throw new ConfigurationException("Comparator attribute '" + attribute + "' does not occur in any record");
            }
        }
    }

    private boolean isRejected(Block subBlock) {
        BlockFilter filter = config.getBlockFilter();
        return filter != null && filter.reject(subBlock);
    }

    private List<BlockOutcome> processBlocks(String runId, List<Block> subBlocks, double threshold) {
        int threads = Math.min(config.getNumThreads(), Math.max(1, subBlocks.size()));
        if (threads <= 1) {
            List<BlockOutcome> outcomes = new ArrayList<>(subBlocks.size());
            for (Block subBlock : subBlocks) {
                outcomes.add(processBlock(runId, subBlock, threshold));
            }
            return outcomes;
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<BlockOutcome>> futures = subBlocks.stream()
                    .map(subBlock -> CompletableFuture.supplyAsync(
                            () -> processBlock(runId, subBlock, threshold), executor))
                    .toList();
            List<BlockOutcome> outcomes = new ArrayList<>(futures.size());
            for (CompletableFuture<BlockOutcome> future : futures) {
                outcomes.add(future.join());
            }
            return outcomes;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            shutdown(executor);
        }
    }

    private BlockOutcome processBlock(String runId, Block subBlock, double threshold) {
        try (LogContext ctx = LogContext.forBlock(runId, subBlock.id())) {
            ScoredBlock scored = scorer.score(subBlock);
            LocalClustering clustering = clusterEngine.clusterBlock(scored, threshold);
            log.debug("dedup.block.processed blockId={} size={} comparisons={} clusters={} noise={}",
                    subBlock.id(), subBlock.size(), scored.comparisons(),
                    clustering.clusters().size(), clustering.noiseCount());
            return new BlockOutcome(scored, clustering);
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public DeduplicatorConfig getConfig() {
        return config;
    }

    private record BlockOutcome(ScoredBlock scored, LocalClustering clustering) {
    }
}
