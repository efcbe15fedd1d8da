package com.di.bidshub.upload.assemble;

import com.di.bidshub.exception.EncodingException;
import com.di.bidshub.upload.config.UploadProperties;
import com.di.bidshub.util.Checksums;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32C;
import java.util.zip.CheckedOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Serializes an {@link EncodedBatch} as one gzip-compressed, column-major JSON document:
 *
 * <pre>
 * { "format": "bidshub-columnar/1", "datasetId": "...", "shardIndex": 3, "numRows": 42,
 *   "schema":  [ {"name": "subject_id", "type": "STRING"}, ... ],
 *   "columns": { "subject_id": [...], "nifti": ["&lt;base64&gt;", ...] } }
 * </pre>
 *
 * The document is generated with a streaming {@link JsonGenerator} straight into a gzip
 * spool file while its CRC32C accumulates; payload files are base64-streamed from disk.
 * Heap use per shard is a few buffers regardless of the shard's size.
 */
@Slf4j
@Component
public class ShardSerializer {

    public static final String FORMAT = "bidshub-columnar/1";

    private static final int BUFFER = 64 * 1024;

    private final ObjectMapper objectMapper;
    private final Path         spoolDir;

    /** Spools to the JVM temp directory. */
    public ShardSerializer() {
        this((Path) null);
    }

    @Autowired
    public ShardSerializer(UploadProperties properties) {
        this(properties.getSpoolDir() == null || properties.getSpoolDir().isBlank()
                ? null : Path.of(properties.getSpoolDir()));
    }

    public ShardSerializer(Path spoolDir) {
        this.spoolDir     = spoolDir;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws EncodingException     a payload could not be read or no longer matches its size
     * @throws UncheckedIOException  the spool file could not be written
     */
    public SerializedShard serialize(String datasetId, int shardIndex, EncodedBatch batch) {
        Path file = createSpoolFile(shardIndex);
        CRC32C crc = new CRC32C();
        boolean written = false;
        try {
            try (OutputStream      raw = new CheckedOutputStream(
                         new BufferedOutputStream(Files.newOutputStream(file), BUFFER), crc);
                 GZIPOutputStream  gz  = new GZIPOutputStream(raw, BUFFER);
                 JsonGenerator     gen = objectMapper.getFactory().createGenerator(gz)) {
                writeDocument(gen, datasetId, shardIndex, batch);
            }
            written = true;
        } catch (IOException e) {
            throw new UncheckedIOException("Serialization failed for shard " + shardIndex, e);
        } finally {
            if (!written) {
                discard(file);
            }
        }

        long size = sizeOf(file);
        log.debug("[ASSEMBLE] shard={} rows={} serialized={}B spool={}", shardIndex, batch.numRows(), size, file);
        return new SerializedShard(shardIndex, file, size, Checksums.crc32cBase64(crc), batch.numRows());
    }

    /** Reads a serialized shard back into its document form. */
    public Map<String, Object> deserialize(SerializedShard shard) {
        return deserialize(shard.readBytes());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> deserialize(byte[] bytes) {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return objectMapper.readValue(in, Map.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read serialized shard", e);
        }
    }

    /* ------------------------------------------------------------------ */

    private void writeDocument(JsonGenerator gen, String datasetId, int shardIndex, EncodedBatch batch)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("format", FORMAT);
        gen.writeStringField("datasetId", datasetId);
        gen.writeNumberField("shardIndex", shardIndex);
        gen.writeNumberField("numRows", batch.numRows());

        gen.writeArrayFieldStart("schema");
        for (var c : batch.schema().columns()) {
            gen.writeStartObject();
            gen.writeStringField("name", c.name());
            gen.writeStringField("type", c.type().name());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeObjectFieldStart("columns");
        for (Map.Entry<String, List<Object>> column : batch.columns().entrySet()) {
            gen.writeArrayFieldStart(column.getKey());
            for (Object value : column.getValue()) {
                if (value instanceof PayloadRef ref) {
                    writePayload(gen, ref);
                } else {
                    gen.writeObject(value);
                }
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();

        gen.writeEndObject();
    }

    private static void writePayload(JsonGenerator gen, PayloadRef ref) throws IOException {
        InputStream opened;
        try {
            opened = Files.newInputStream(ref.path());
        } catch (IOException e) {
            throw new EncodingException(ref.path(), e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        try (CountingPayloadStream in = new CountingPayloadStream(opened, ref)) {
            gen.writeBinary(in, -1);
            if (in.count != ref.sizeBytes()) {
                throw new EncodingException(ref.path(), String.format(
                        "size changed since assembly (declared=%d, read=%d)", ref.sizeBytes(), in.count));
            }
        }
    }

    private Path createSpoolFile(int shardIndex) {
        String prefix = String.format("bidshub-shard-%05d-", shardIndex);
        try {
            if (spoolDir == null) {
                return Files.createTempFile(prefix, ".json.gz");
            }
            Files.createDirectories(spoolDir);
            return Files.createTempFile(spoolDir, prefix, ".json.gz");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create spool file for shard " + shardIndex, e);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            discard(file);
            throw new UncheckedIOException("Cannot stat spool file " + file, e);
        }
    }

    private static void discard(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[ASSEMBLE] could not delete spool file {}: {}", file, e.getMessage());
        }
    }

    /** Counts payload bytes and reports read failures against the record they belong to. */
    private static final class CountingPayloadStream extends FilterInputStream {
        private final PayloadRef ref;
        private long count;

        CountingPayloadStream(InputStream in, PayloadRef ref) {
            super(in);
            this.ref = ref;
        }

        @Override
        public int read() {
            int b = guarded(() -> super.read());
            if (b >= 0) {
                count++;
            }
            return b;
        }

        @Override
        public int read(byte[] buf, int off, int len) {
            int n = guarded(() -> super.read(buf, off, len));
            if (n > 0) {
                count += n;
            }
            return n;
        }

        private int guarded(IoRead op) {
            try {
                return op.read();
            } catch (IOException e) {
                throw new EncodingException(ref.path(), e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            }
        }
    }

    @FunctionalInterface
    private interface IoRead {
        int read() throws IOException;
    }
}
