package com.di.bidshub.upload.assemble;

import com.di.bidshub.dataset.FeatureSchema;

import java.util.List;
import java.util.Map;

/**
 * Column-major, shard-final batch: one list per schema column, all of length {@code numRows}.
 * Built directly at shard granularity and never re-sliced afterwards.
 *
 * @param schema       layout the columns follow
 * @param columns      column name → values in row order ({@link PayloadRef} for binary columns)
 * @param numRows      row count
 * @param payloadBytes total bytes referenced by binary columns
 */
public record EncodedBatch(FeatureSchema schema,
                           Map<String, List<Object>> columns,
                           int numRows,
                           long payloadBytes) {
}
