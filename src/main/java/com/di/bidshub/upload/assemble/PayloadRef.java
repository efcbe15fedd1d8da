package com.di.bidshub.upload.assemble;

import java.nio.file.Path;

/**
 * Binary column value: the file whose bytes are streamed into the shard at serialization
 * time. Holding a reference keeps a batch's heap footprint independent of payload size.
 *
 * @param path      file to read
 * @param sizeBytes length verified at assembly; the serializer fails if the stream differs
 */
public record PayloadRef(Path path, long sizeBytes) {
}
