package com.di.bidshub.upload.dto;

import com.di.bidshub.upload.validation.ValidationReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * End-of-run summary. A run is {@code COMPLETE} only when every planned shard is committed
 * and the consumer-visible manifest has been published.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunReport {

    public enum Status { COMPLETE, INCOMPLETE, CANCELLED }

    private String runId;
    private String datasetId;
    private String datasetKind;
    private Status status;

    private ValidationReport validation;

    private String planFingerprint;
    private int    plannedShardCount;

    /** True when an open manifest from an interrupted run was resumed. */
    private boolean resumed;

    /** Shard indices committed by this run. */
    @Builder.Default
    private List<Integer> committed = new ArrayList<>();

    /** Shard indices already committed by an earlier run and not re-uploaded. */
    @Builder.Default
    private List<Integer> skipped = new ArrayList<>();

    /** Shard index → failure reason. */
    @Builder.Default
    private Map<Integer, String> failed = new LinkedHashMap<>();

    /** Shard indices left uncommitted because the run was cancelled. */
    @Builder.Default
    private List<Integer> cancelled = new ArrayList<>();

    private long    bytesTransmitted;
    private Instant startedAt;
    private Instant finishedAt;
    private long    durationMillis;

    /** Human-readable summary or error detail. */
    private String  message;

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }
}
