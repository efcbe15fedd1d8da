package com.di.bidshub.upload.manifest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Durable record of which shards of a dataset have been committed remotely.
 *
 * <p>Created when a run starts, appended to once per committed shard, and closed only
 * when every planned shard index is present. Persisted as
 * {@code {state-dir}/{datasetId}.manifest.json} so an interrupted run can resume.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UploadManifest {

    private String  datasetId;
    private String  runId;

    /** {@link com.di.bidshub.upload.plan.ShardPlanner#fingerprint} of the plan being uploaded. */
    private String  planFingerprint;
    private int     plannedShardCount;

    private boolean closed;
    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private List<Entry> committed = new ArrayList<>();

    @JsonIgnore
    public Set<Integer> committedIndices() {
        Set<Integer> out = new TreeSet<>();
        for (Entry e : committed) {
            out.add(e.getShardIndex());
        }
        return out;
    }

    /** Order-independent: every index in [0, plannedShardCount) has an entry. */
    @JsonIgnore
    public boolean isComplete() {
        Set<Integer> have = committedIndices();
        for (int i = 0; i < plannedShardCount; i++) {
            if (!have.contains(i)) {
                return false;
            }
        }
        return true;
    }

    /* ---------------------------------------------------------------------- */

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {

        private int     shardIndex;

        /** Revision the remote store assigned to the shard object. */
        private String  revision;

        private long    sizeBytes;

        /** Base64 big-endian CRC32C verified against the remote copy. */
        private String  checksum;

        private int     rowCount;
        private Instant committedAt;
    }
}
