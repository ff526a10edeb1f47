package com.subreq.batch;

import com.subreq.course.OfferedCourse;
import com.subreq.crosswalk.Crosswalk;
import com.subreq.engine.BatchResult;
import com.subreq.engine.EligibilityEngine;
import com.subreq.exception.SubReqException;
import com.subreq.requirement.SubRequirementRaw;
import com.subreq.result.EligibilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates sub-requirement rows in parallel, one batch per requirement-year pair.
 * <p>
 * Each batch derives its own criteria; the crosswalk and course list are immutable
 * and shared. Batch results are merged in batch order, so the merged set does not
 * depend on which worker finishes first.
 * <p>
 * The worker pool lives as long as the runner and is released by {@link #shutdown()}.
 */
public class RequirementYearBatchRunner {

    private static final Logger log = LoggerFactory.getLogger(RequirementYearBatchRunner.class);

    private final EligibilityEngine engine;
    private final int parallelism;
    private final ExecutorService workers;

    public RequirementYearBatchRunner(EligibilityEngine engine, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
        }
        this.engine = engine;
        this.parallelism = parallelism;

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r);
            t.setName("subreq-batch-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Partition rows by requirement years and evaluate every batch.
     *
     * @param rows      All raw sub-requirement rows
     * @param courses   Offered courses
     * @param crosswalk Crosswalk
     * @return Merged results and counters
     * @throws SubReqException if any batch fails or the runner has been shut down
     */
    public BatchRun run(List<SubRequirementRaw> rows, List<OfferedCourse> courses, Crosswalk crosswalk) {
        if (workers.isShutdown()) {
            throw new SubReqException("Batch runner has been shut down");
        }
        Map<RequirementYears, List<SubRequirementRaw>> batches = partition(rows);
        log.info("Evaluating {} sub-requirement rows in {} requirement-year batches with parallelism {}",
                rows.size(), batches.size(), parallelism);

        Map<RequirementYears, Future<BatchResult>> futures = new LinkedHashMap<>();
        try {
            for (Map.Entry<RequirementYears, List<SubRequirementRaw>> batch : batches.entrySet()) {
                futures.put(batch.getKey(), workers.submit(() -> {
                    BatchResult result = engine.evaluate(batch.getValue(), courses, crosswalk);
                    log.info("Batch {} done: {} rows, {} results",
                            batch.getKey(), result.rowsRead(), result.results().size());
                    return result;
                }));
            }
            return merge(futures);
        } catch (RejectedExecutionException e) {
            futures.values().forEach(f -> f.cancel(true));
            throw new SubReqException("Batch runner has been shut down", e);
        } catch (SubReqException e) {
            futures.values().forEach(f -> f.cancel(true));
            throw e;
        }
    }

    /**
     * Stop accepting batches and release the worker threads. Batches already
     * submitted run to completion.
     */
    public void shutdown() {
        if (!workers.isShutdown()) {
            log.info("Shutting down batch runner with {} workers", parallelism);
            workers.shutdown();
        }
    }

    public boolean isShutdown() {
        return workers.isShutdown();
    }

    private BatchRun merge(Map<RequirementYears, Future<BatchResult>> futures) {
        Map<EligibilityResult.ResultKey, EligibilityResult> merged = new LinkedHashMap<>();
        int rowsRead = 0;
        int criteriaRows = 0;
        int filteredValues = 0;

        for (Map.Entry<RequirementYears, Future<BatchResult>> entry : futures.entrySet()) {
            BatchResult result = await(entry.getKey(), entry.getValue());
            for (EligibilityResult row : result.results()) {
                merged.putIfAbsent(row.resultKey(), row);
            }
            rowsRead += result.rowsRead();
            criteriaRows += result.criteriaRows();
            filteredValues += result.filteredValues();
        }
        return new BatchRun(new LinkedHashSet<>(merged.values()), futures.size(), rowsRead, criteriaRows,
                filteredValues);
    }

    private BatchResult await(RequirementYears years, Future<BatchResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubReqException("Interrupted while waiting for batch " + years, e);
        } catch (ExecutionException e) {
            throw new SubReqException("Batch " + years + " failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    static Map<RequirementYears, List<SubRequirementRaw>> partition(List<SubRequirementRaw> rows) {
        Map<RequirementYears, List<SubRequirementRaw>> batches = new LinkedHashMap<>();
        for (SubRequirementRaw row : rows) {
            batches.computeIfAbsent(RequirementYears.of(row), k -> new ArrayList<>()).add(row);
        }
        return batches;
    }

    public int getParallelism() {
        return parallelism;
    }
}
