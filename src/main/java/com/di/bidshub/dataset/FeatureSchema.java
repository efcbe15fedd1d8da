package com.di.bidshub.dataset;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered column layout a cohort exposes. Used by the record assembler to build
 * shard-final batches.
 */
public record FeatureSchema(List<ColumnSpec> columns) {

    public FeatureSchema {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("feature schema needs at least one column");
        }
        Set<String> names = new LinkedHashSet<>();
        for (ColumnSpec c : columns) {
            if (!names.add(c.name())) {
                throw new IllegalArgumentException("duplicate column name: " + c.name());
            }
        }
        columns = List.copyOf(columns);
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSpec::name).toList();
    }

    public boolean hasPayload() {
        return columns.stream().anyMatch(c -> c.source() == ColumnSpec.ColumnSource.PAYLOAD);
    }

    /** Layout shared by the BIDS cohorts: metadata columns plus one binary NIfTI column. */
    public static FeatureSchema bidsDefault() {
        return new FeatureSchema(List.of(
                ColumnSpec.string("subject_id", ColumnSpec.ColumnSource.SUBJECT_ID),
                ColumnSpec.string("session_id", ColumnSpec.ColumnSource.SESSION_ID),
                ColumnSpec.string("modality", ColumnSpec.ColumnSource.MODALITY),
                ColumnSpec.string("datatype", ColumnSpec.ColumnSource.DATATYPE),
                ColumnSpec.string("file_name", ColumnSpec.ColumnSource.FILE_NAME),
                ColumnSpec.int64("size_bytes", ColumnSpec.ColumnSource.SIZE_BYTES),
                ColumnSpec.string("sha256", ColumnSpec.ColumnSource.SHA256),
                ColumnSpec.binary("nifti")));
    }
}
