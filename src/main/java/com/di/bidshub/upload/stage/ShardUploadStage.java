package com.di.bidshub.upload.stage;

import com.di.bidshub.upload.plan.ShardDescriptor;
import com.di.bidshub.util.MdcPropagation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the pending shards of one plan on a bounded worker pool.
 *
 * <h3>Concurrency</h3>
 * A {@code FixedThreadPool(concurrency)} is the only limit; each worker owns one shard
 * end-to-end, so at most {@code concurrency} shards are materialized at once.
 *
 * <h3>Failure isolation</h3>
 * A shard that fails is recorded in its outcome and the others keep going.
 *
 * <h3>Cancellation and timeout</h3>
 * When the token is cancelled or the run timeout elapses, no new shard starts. The stage
 * returns only after every worker has stopped, so each outcome is final: a shard that
 * committed while draining is reported as committed, and nothing runs on after the run ends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShardUploadStage {

    private final ShardUploader uploader;

    /**
     * @return one outcome per given shard, ordered by shard index
     */
    public List<ShardOutcome> execute(UploadContext ctx, List<ShardDescriptor> shards) {
        if (shards.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(ctx.settings().concurrency(), shards.size());
        log.info("[SHARD] run={} dispatching {} shard(s) on {} worker(s)", ctx.runId(), shards.size(), workers);

        AtomicInteger   seq      = new AtomicInteger();
        ThreadFactory   tf       = r -> {
            var t = new Thread(r, "shard-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(workers, tf));

        List<CompletableFuture<ShardOutcome>> futures = new ArrayList<>(shards.size());
        for (ShardDescriptor shard : shards) {
            CompletableFuture<ShardOutcome> f = CompletableFuture
                    .supplyAsync(() -> uploader.upload(ctx, shard), executor)
                    .exceptionally(ex -> {
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        log.error("[SHARD] {} worker crashed: {}", shard.shardId(), cause.getMessage(), cause);
                        return ShardOutcome.failed(shard.shardIndex(), 1, cause);
                    });
            futures.add(f);
        }

        boolean interrupted = false;
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(ctx.settings().runTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            ctx.cancellation().cancel("run timeout of " + ctx.settings().runTimeout() + " elapsed");
            log.error("[SHARD] run={} timed out after {}; draining in-flight shards",
                    ctx.runId(), ctx.settings().runTimeout());
        } catch (ExecutionException e) {
            // exceptionally() above turns every failure into an outcome
            throw new IllegalStateException("Shard stage execution error", e.getCause());
        } catch (InterruptedException e) {
            interrupted = true;
            ctx.cancellation().cancel("interrupted");
            log.warn("[SHARD] run={} interrupted; draining in-flight shards", ctx.runId());
        } finally {
            executor.shutdown();
        }

        if (ctx.cancellation().isCancelled()) {
            interrupted |= drain(ctx, executor);
        }

        List<ShardOutcome> outcomes = new ArrayList<>(shards.size());
        for (int i = 0; i < shards.size(); i++) {
            CompletableFuture<ShardOutcome> f = futures.get(i);
            // not done after the pool terminated: the task never started
            outcomes.add(f.isDone() ? f.join() : ShardOutcome.cancelled(shards.get(i).shardIndex(), 0));
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        outcomes.sort(Comparator.comparingInt(ShardOutcome::shardIndex));
        return outcomes;
    }

    /**
     * Waits for workers to finish the attempt they are in. Queued shards see the cancelled
     * token and return at once. Workers still busy after the grace period are interrupted.
     *
     * @return whether the calling thread was interrupted while waiting
     */
    private static boolean drain(UploadContext ctx, ExecutorService executor) {
        Duration grace = ctx.settings().cancelGracePeriod();
        try {
            if (executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                return false;
            }
            log.error("[SHARD] run={} workers still busy after {}; interrupting them", ctx.runId(), grace);
            executor.shutdownNow();
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("[SHARD] run={} workers did not stop after interruption", ctx.runId());
            }
            return false;
        } catch (InterruptedException e) {
            executor.shutdownNow();
            return true;
        }
    }
}
