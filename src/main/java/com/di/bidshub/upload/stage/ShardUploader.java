package com.di.bidshub.upload.stage;

import com.di.bidshub.exception.EncodingException;
import com.di.bidshub.exception.FailureCategory;
import com.di.bidshub.exception.TransferException;
import com.di.bidshub.upload.assemble.EncodedBatch;
import com.di.bidshub.upload.assemble.RecordAssembler;
import com.di.bidshub.upload.assemble.SerializedShard;
import com.di.bidshub.upload.assemble.ShardSerializer;
import com.di.bidshub.upload.manifest.UploadManifest;
import com.di.bidshub.upload.plan.ShardDescriptor;
import com.di.bidshub.upload.remote.RemoteStore;
import com.di.bidshub.upload.remote.TransferHandle;
import com.di.bidshub.upload.remote.TransferReceipt;
import com.di.bidshub.util.UploadMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * Drives one shard through {@link ShardState}: assemble, serialize, transmit, verify, commit.
 *
 * <h3>Memory</h3>
 * The encoded batch holds file references only. The serialized shard lives in a spool
 * file that is deleted when this method returns.
 *
 * <h3>Retries</h3>
 * <ul>
 *   <li>Assembly: up to {@code encodingMaxAttempts}, re-reading the shard's files unless
 *       the run was cancelled in between.</li>
 *   <li>Transfer: up to {@code transferBackoff.maxAttempts} with exponential backoff,
 *       re-sending the same spool file under the same shard identifier.</li>
 * </ul>
 * A size or checksum mismatch reported by the store counts as a retryable transfer failure.
 *
 * <h3>Commit</h3>
 * A shard is committed only after the store confirms it and the confirmation matches the
 * local size and CRC32C; then the remote manifest entry is written and the local ledger
 * entry is made durable, in that order.
 */
@Slf4j
@Component
public class ShardUploader {

    private final RecordAssembler assembler;
    private final ShardSerializer serializer;
    private final RemoteStore     remoteStore;
    private final UploadMetrics   metrics;
    private final Clock           clock;
    private final Sleeper         sleeper;

    @Autowired
    public ShardUploader(RecordAssembler assembler,
                         ShardSerializer serializer,
                         RemoteStore remoteStore,
                         UploadMetrics metrics) {
        this(assembler, serializer, remoteStore, metrics, Clock.systemUTC(), Sleeper.threadSleep());
    }

    ShardUploader(RecordAssembler assembler,
                  ShardSerializer serializer,
                  RemoteStore remoteStore,
                  UploadMetrics metrics,
                  Clock clock,
                  Sleeper sleeper) {
        this.assembler   = assembler;
        this.serializer  = serializer;
        this.remoteStore = remoteStore;
        this.metrics     = metrics;
        this.clock       = clock;
        this.sleeper     = sleeper;
    }

    /**
     * Never throws for shard-level failures; they are reported in the outcome so sibling
     * shards keep running.
     */
    public ShardOutcome upload(UploadContext ctx, ShardDescriptor shard) {
        int        idx   = shard.shardIndex();
        Instant    start = clock.instant();
        ShardState state = ShardState.PENDING;

        if (ctx.cancellation().isCancelled()) {
            log.info("[SHARD] {} not started: {}", shard.shardId(), ctx.cancellation().getReason());
            metrics.recordCancelled();
            return ShardOutcome.cancelled(idx, 0);
        }

        /* ---- Assembling ---- */
        SerializedShard serialized = null;
        int encodingAttempts = 0;
        while (serialized == null) {
            encodingAttempts++;
            state = state.transitionTo(ShardState.ASSEMBLING);
            try {
                serialized = assembleAndSerialize(ctx, shard);
            } catch (EncodingException | UncheckedIOException e) {
                if (encodingAttempts >= ctx.settings().encodingMaxAttempts()) {
                    state = state.transitionTo(ShardState.FAILED);
                    log.error("[SHARD] {} {} in assembly after {} attempt(s): {}",
                            shard.shardId(), state, encodingAttempts, e.getMessage());
                    metrics.recordFailed();
                    return ShardOutcome.failed(idx, encodingAttempts, e);
                }
                if (ctx.cancellation().isCancelled()) {
                    state = state.transitionTo(ShardState.PENDING);
                    log.info("[SHARD] {} released during assembly: {}", shard.shardId(),
                            ctx.cancellation().getReason());
                    metrics.recordCancelled();
                    return ShardOutcome.cancelled(idx, encodingAttempts);
                }
                log.warn("[SHARD] {} assembly attempt {}/{} failed: {}", shard.shardId(),
                        encodingAttempts, ctx.settings().encodingMaxAttempts(), e.getMessage());
                metrics.recordRetry();
            }
        }

        try {
            return transmit(ctx, shard, serialized, state, start);
        } finally {
            discard(serialized);
        }
    }

    /* ---- Transmitting ---- */
    private ShardOutcome transmit(UploadContext ctx, ShardDescriptor shard, SerializedShard serialized,
                                  ShardState state, Instant start) {
        int           idx     = shard.shardIndex();
        BackoffPolicy backoff = ctx.settings().transferBackoff();
        for (int attempt = 1; ; attempt++) {
            if (ctx.cancellation().isCancelled()) {
                state = state.transitionTo(ShardState.PENDING);
                log.info("[SHARD] {} released before transfer: {}", shard.shardId(), ctx.cancellation().getReason());
                metrics.recordCancelled();
                return ShardOutcome.cancelled(idx, attempt - 1);
            }
            state = state.transitionTo(ShardState.TRANSMITTING);
            try {
                TransferReceipt receipt = transmitAndVerify(ctx, serialized);
                commit(ctx, serialized, receipt);
                state = state.transitionTo(ShardState.COMMITTED);

                Duration took = Duration.between(start, clock.instant());
                metrics.recordCommitted(serialized.sizeBytes(), took);
                log.info("[SHARD] {} {} rows={} bytes={} revision={} attempts={} in {}ms",
                        shard.shardId(), state, serialized.numRows(), serialized.sizeBytes(),
                        receipt.revision(), attempt, took.toMillis());
                return ShardOutcome.committed(idx, attempt, serialized.sizeBytes(), receipt.revision());

            } catch (RuntimeException e) {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                boolean retryable = cause instanceof TransferException te
                        ? te.isRetryable()
                        : FailureCategory.categorize(cause).isRetryable();

                if (!retryable || !backoff.canRetryAfter(attempt)) {
                    state = state.transitionTo(ShardState.FAILED);
                    log.error("[SHARD] {} {} in transfer after {} attempt(s) [{}]: {}", shard.shardId(), state,
                            attempt, FailureCategory.categorize(cause), cause.getMessage());
                    metrics.recordFailed();
                    return ShardOutcome.failed(idx, attempt, cause);
                }

                Duration delay = backoff.delayAfter(attempt);
                log.warn("[SHARD] {} transfer attempt {}/{} failed [{}]: {}; retrying in {}ms", shard.shardId(),
                        attempt, backoff.maxAttempts(), FailureCategory.categorize(cause),
                        cause.getMessage(), delay.toMillis());
                metrics.recordRetry();
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    ctx.cancellation().cancel("interrupted");
                }
            }
        }
    }

    /* ------------------------------------------------------------------ */

    private SerializedShard assembleAndSerialize(UploadContext ctx, ShardDescriptor shard) {
        EncodedBatch batch = assembler.assemble(shard.records(), ctx.schema());
        return serializer.serialize(ctx.datasetId(), shard.shardIndex(), batch);
    }

    private TransferReceipt transmitAndVerify(UploadContext ctx, SerializedShard serialized) {
        TransferHandle  handle  = remoteStore.beginShardTransfer(ctx.datasetId(), ctx.planFingerprint(), serialized);
        TransferReceipt receipt = remoteStore.confirmTransfer(handle);

        if (receipt.committedSize() != serialized.sizeBytes()) {
            throw new TransferException(String.format("size mismatch for shard %d: local=%d remote=%d",
                    serialized.shardIndex(), serialized.sizeBytes(), receipt.committedSize()), true);
        }
        if (!Objects.equals(receipt.checksum(), serialized.crc32c())) {
            throw new TransferException(String.format("checksum mismatch for shard %d: local=%s remote=%s",
                    serialized.shardIndex(), serialized.crc32c(), receipt.checksum()), true);
        }
        return receipt;
    }

    private void commit(UploadContext ctx, SerializedShard serialized, TransferReceipt receipt) {
        remoteStore.appendManifestEntry(ctx.datasetId(), ctx.planFingerprint(), serialized.shardIndex(),
                receipt.revision());
        ctx.ledger().append(UploadManifest.Entry.builder()
                .shardIndex(serialized.shardIndex())
                .revision(receipt.revision())
                .sizeBytes(serialized.sizeBytes())
                .checksum(serialized.crc32c())
                .rowCount(serialized.numRows())
                .committedAt(clock.instant())
                .build()).join();
    }

    private static void discard(SerializedShard serialized) {
        try {
            serialized.delete();
        } catch (IOException e) {
            log.warn("[SHARD] could not delete spool file {}: {}", serialized.file(), e.getMessage());
        }
    }
}
