package com.di.bidshub.upload.plan;

import com.di.bidshub.upload.scan.EntityRecord;

import java.util.List;

/**
 * Contiguous, disjoint slice of the validated record set.
 *
 * @param shardIndex    zero-based position in the ordered plan
 * @param records       records in partition order
 * @param declaredBytes sum of the records' declared sizes
 */
public record ShardDescriptor(int shardIndex, List<EntityRecord> records, long declaredBytes) {

    public ShardDescriptor {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public EntityRecord first() {
        return records.get(0);
    }

    public EntityRecord last() {
        return records.get(records.size() - 1);
    }

    /** {@code shard-00012}, the shard-scoped identifier used in object names and logs. */
    public String shardId() {
        return String.format("shard-%05d", shardIndex);
    }
}
