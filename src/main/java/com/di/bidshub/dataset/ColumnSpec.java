package com.di.bidshub.dataset;

/**
 * One column of a cohort's target layout.
 *
 * @param name   column name written to the shard
 * @param type   logical column type
 * @param source which record attribute (or the payload) fills the column
 */
public record ColumnSpec(String name, ColumnType type, ColumnSource source) {

    public enum ColumnType {
        STRING,
        INT64,
        BINARY
    }

    public enum ColumnSource {
        SUBJECT_ID,
        SESSION_ID,
        MODALITY,
        DATATYPE,
        FILE_NAME,
        SIZE_BYTES,
        SHA256,
        PAYLOAD
    }

    public static ColumnSpec string(String name, ColumnSource source) {
        return new ColumnSpec(name, ColumnType.STRING, source);
    }

    public static ColumnSpec int64(String name, ColumnSource source) {
        return new ColumnSpec(name, ColumnType.INT64, source);
    }

    public static ColumnSpec binary(String name) {
        return new ColumnSpec(name, ColumnType.BINARY, ColumnSource.PAYLOAD);
    }
}
