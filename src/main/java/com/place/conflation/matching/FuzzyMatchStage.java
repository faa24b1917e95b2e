package com.place.conflation.matching;

import com.place.conflation.bulk.ProgressCallback;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.PlaceRecord;
import com.place.conflation.similarity.BlockingKeyStrategy;
import com.place.conflation.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Scores ProviderA records against ProviderB records that share a blocking key.
 *
 * <p>The ProviderA side of each bucket is cut into at most {@code parallelism} slices and each
 * slice is scored by an independent task that returns its own candidate list; the lists are
 * merged afterwards. The unblocked scan is a single bucket, so it still spreads over the pool. A pair that shares several keys is scored only in the bucket of
 * its smallest shared key, so the merged list holds every qualifying pair exactly once.</p>
 */
public class FuzzyMatchStage {
    private static final Logger log = LoggerFactory.getLogger(FuzzyMatchStage.class);

    private final SimilarityAlgorithm similarity;
    private final BlockingKeyStrategy blockingStrategy;
    private final double threshold;
    private final int parallelism;

    public FuzzyMatchStage(SimilarityAlgorithm similarity, BlockingKeyStrategy blockingStrategy,
                           double threshold, int parallelism) {
        if (threshold < 0.0 || threshold > 100.0) {
            throw new IllegalArgumentException("threshold must be between 0 and 100");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.similarity = similarity;
        this.blockingStrategy = blockingStrategy;
        this.threshold = threshold;
        this.parallelism = parallelism;
    }

    /**
     * Returns every pair whose name and address similarities are both at or above the threshold.
     */
    public List<FuzzyCandidate> findCandidates(List<PlaceRecord> sideA, List<PlaceRecord> sideB,
                                               ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        if (sideA.isEmpty() || sideB.isEmpty()) {
            return List.of();
        }

        Map<PlaceRecord, SortedSet<String>> keysByRecord = new HashMap<>();
        Map<String, List<PlaceRecord>> bucketsA = partition(sideA, keysByRecord);
        Map<String, List<PlaceRecord>> bucketsB = partition(sideB, keysByRecord);

        List<Callable<List<FuzzyCandidate>>> tasks = new ArrayList<>();
        for (Map.Entry<String, List<PlaceRecord>> entry : bucketsA.entrySet()) {
            List<PlaceRecord> bucketB = bucketsB.get(entry.getKey());
            if (bucketB != null) {
                String key = entry.getKey();
                for (List<PlaceRecord> slice : slices(entry.getValue())) {
                    tasks.add(() -> scoreBucket(key, slice, bucketB, keysByRecord));
                }
            }
        }
        log.debug("fuzzy.blocking bucketsA={} bucketsB={} tasks={}",
                bucketsA.size(), bucketsB.size(), tasks.size());

        List<FuzzyCandidate> candidates = parallelism == 1 || tasks.size() <= 1
                ? runSequentially(tasks, cb)
                : runInPool(tasks, cb);

        log.info("fuzzy.scoring.completed tasks={} candidates={}", tasks.size(), candidates.size());
        return candidates;
    }

    List<List<PlaceRecord>> slices(List<PlaceRecord> bucketA) {
        int sliceSize = Math.max(1, (bucketA.size() + parallelism - 1) / parallelism);
        List<List<PlaceRecord>> slices = new ArrayList<>();
        for (int from = 0; from < bucketA.size(); from += sliceSize) {
            slices.add(bucketA.subList(from, Math.min(from + sliceSize, bucketA.size())));
        }
        return slices;
    }

    private Map<String, List<PlaceRecord>> partition(List<PlaceRecord> records,
                                                     Map<PlaceRecord, SortedSet<String>> keysByRecord) {
        Map<String, List<PlaceRecord>> buckets = new TreeMap<>();
        for (PlaceRecord record : records) {
            SortedSet<String> keys = new TreeSet<>(blockingStrategy.generateKeys(record));
            keysByRecord.put(record, keys);
            for (String key : keys) {
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }
        return buckets;
    }

    private List<FuzzyCandidate> scoreBucket(String key, List<PlaceRecord> bucketA, List<PlaceRecord> bucketB,
                                             Map<PlaceRecord, SortedSet<String>> keysByRecord) {
        List<FuzzyCandidate> local = new ArrayList<>();
        for (PlaceRecord a : bucketA) {
            SortedSet<String> keysA = keysByRecord.get(a);
            for (PlaceRecord b : bucketB) {
                if (!key.equals(firstSharedKey(keysA, keysByRecord.get(b)))) {
                    continue;
                }
                double nameSim = similarity.score(a.normalized(AttributeKind.NAME), b.normalized(AttributeKind.NAME));
                if (nameSim < threshold) {
                    continue;
                }
                double addressSim = similarity.score(a.normalized(AttributeKind.ADDRESS),
                        b.normalized(AttributeKind.ADDRESS));
                if (addressSim >= threshold) {
                    local.add(new FuzzyCandidate(a, b, nameSim, addressSim));
                }
            }
        }
        return local;
    }

    private static String firstSharedKey(SortedSet<String> keysA, Set<String> keysB) {
        for (String key : keysA) {
            if (keysB.contains(key)) {
                return key;
            }
        }
        return null;
    }

    private List<FuzzyCandidate> runSequentially(List<Callable<List<FuzzyCandidate>>> tasks, ProgressCallback cb) {
        List<FuzzyCandidate> merged = new ArrayList<>();
        long done = 0;
        for (Callable<List<FuzzyCandidate>> task : tasks) {
            try {
                merged.addAll(task.call());
            } catch (Exception e) {
                throw new LinkageException("Fuzzy scoring failed: " + e.getMessage(), e);
            }
            done++;
            cb.onProgress(done, tasks.size(), "Scored " + done + " of " + tasks.size() + " slices");
        }
        return merged;
    }

    private List<FuzzyCandidate> runInPool(List<Callable<List<FuzzyCandidate>>> tasks, ProgressCallback cb) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
        try {
            List<Future<List<FuzzyCandidate>>> futures = new ArrayList<>(tasks.size());
            for (Callable<List<FuzzyCandidate>> task : tasks) {
                futures.add(executor.submit(task));
            }

            List<FuzzyCandidate> merged = new ArrayList<>();
            long done = 0;
            for (Future<List<FuzzyCandidate>> future : futures) {
                merged.addAll(future.get());
                done++;
                cb.onProgress(done, tasks.size(), "Scored " + done + " of " + tasks.size() + " slices");
            }
            return merged;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LinkageException("Fuzzy scoring interrupted", e);
        } catch (ExecutionException e) {
            throw new LinkageException("Fuzzy scoring failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("fuzzy.executor.shutdown.timeout");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
