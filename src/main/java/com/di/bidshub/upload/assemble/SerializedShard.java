package com.di.bidshub.upload.assemble;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One serialized shard spooled to local disk, plus the values the remote copy must match.
 * The owner deletes the spool file once the shard is committed or abandoned.
 *
 * @param shardIndex shard position in the plan
 * @param file       spool file holding the gzip-compressed columnar document
 * @param sizeBytes  length of {@code file}
 * @param crc32c     base64 big-endian CRC32C of the file's bytes
 * @param numRows    rows in the shard
 */
public record SerializedShard(int shardIndex, Path file, long sizeBytes, String crc32c, int numRows) {

    public InputStream open() throws IOException {
        return Files.newInputStream(file);
    }

    /** Whole document in memory; for small shards and tests only. */
    public byte[] readBytes() {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read spooled shard " + file, e);
        }
    }

    public void delete() throws IOException {
        Files.deleteIfExists(file);
    }
}
