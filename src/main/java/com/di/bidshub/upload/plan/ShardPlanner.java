package com.di.bidshub.upload.plan;

import com.di.bidshub.upload.scan.EntityRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Partitions validated records into byte-bounded shards.
 *
 * <p>Records are ordered by (subject, session, modality) ascending and accumulated
 * greedily: a shard closes when adding the next record would push its declared bytes
 * over the budget. A record larger than the budget on its own becomes a singleton shard.
 * The same input always yields the same boundaries, which is what makes resumption safe.
 */
@Slf4j
@Component
public class ShardPlanner {

    /**
     * @throws IllegalArgumentException if {@code shardSizeBudgetBytes <= 0}
     */
    public List<ShardDescriptor> plan(List<EntityRecord> validatedRecords, long shardSizeBudgetBytes) {
        if (shardSizeBudgetBytes <= 0) {
            throw new IllegalArgumentException("shardSizeBudgetBytes must be > 0: " + shardSizeBudgetBytes);
        }

        List<EntityRecord> ordered = new ArrayList<>(validatedRecords);
        ordered.sort(EntityRecord.PARTITION_ORDER);

        List<ShardDescriptor> shards  = new ArrayList<>();
        List<EntityRecord>    current = new ArrayList<>();
        long                  bytes   = 0;
        int                   oversized = 0;

        for (EntityRecord r : ordered) {
            if (!current.isEmpty() && bytes + r.sizeBytes() > shardSizeBudgetBytes) {
                shards.add(new ShardDescriptor(shards.size(), current, bytes));
                current = new ArrayList<>();
                bytes = 0;
            }
            if (r.sizeBytes() > shardSizeBudgetBytes) {
                oversized++;
            }
            current.add(r);
            bytes += r.sizeBytes();
        }
        if (!current.isEmpty()) {
            shards.add(new ShardDescriptor(shards.size(), current, bytes));
        }

        if (oversized > 0) {
            log.warn("[PLAN] {} record(s) exceed the {}B budget and were planned as singleton shards",
                    oversized, shardSizeBudgetBytes);
        }
        log.info("[PLAN] records={} shards={} budget={}B", ordered.size(), shards.size(), shardSizeBudgetBytes);
        return shards;
    }

    /**
     * SHA-256 over every shard's index, member paths and sizes. Two plans with the same
     * fingerprint have identical boundaries.
     */
    public static String fingerprint(List<ShardDescriptor> shards) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (ShardDescriptor s : shards) {
            md.update(("#" + s.shardIndex() + "\n").getBytes(StandardCharsets.UTF_8));
            for (EntityRecord r : s.records()) {
                md.update((r.relativePath() + "\t" + r.sizeBytes() + "\n").getBytes(StandardCharsets.UTF_8));
            }
        }
        return HexFormat.of().formatHex(md.digest());
    }
}
