package com.di.bidshub.upload.assemble;

import com.di.bidshub.dataset.ColumnSpec;
import com.di.bidshub.dataset.FeatureSchema;
import com.di.bidshub.exception.EncodingException;
import com.di.bidshub.upload.scan.EntityRecord;
import com.di.bidshub.util.Checksums;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lays out exactly one batch of records in the cohort's feature schema. Nothing outside
 * the given batch is touched.
 *
 * <p>Payloads are verified here (present, readable, same size as scanned) but carried as
 * {@link PayloadRef}s; {@link ShardSerializer} streams the bytes into the shard.
 */
@Slf4j
@Component
public class RecordAssembler {

    /**
     * @throws EncodingException naming the first record whose payload could not be read, or
     *                           whose size changed since the scan
     */
    public EncodedBatch assemble(List<EntityRecord> batch, FeatureSchema schema) {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (ColumnSpec c : schema.columns()) {
            columns.put(c.name(), new ArrayList<>(batch.size()));
        }

        long payloadBytes = 0;
        for (EntityRecord record : batch) {
            PayloadRef payload = schema.hasPayload() ? reference(record) : null;
            String     sha256  = null;

            for (ColumnSpec c : schema.columns()) {
                Object value = switch (c.source()) {
                    case SUBJECT_ID -> record.subject();
                    case SESSION_ID -> record.session();
                    case MODALITY   -> record.modality();
                    case DATATYPE   -> record.datatype();
                    case FILE_NAME  -> record.fileName();
                    case SIZE_BYTES -> record.sizeBytes();
                    case SHA256     -> {
                        if (sha256 == null) {
                            sha256 = digest(record);
                        }
                        yield sha256;
                    }
                    case PAYLOAD    -> payload;
                };
                columns.get(c.name()).add(value);
            }
            if (payload != null) {
                payloadBytes += payload.sizeBytes();
            }
        }

        log.debug("[ASSEMBLE] rows={} payloadBytes={}", batch.size(), payloadBytes);
        return new EncodedBatch(schema, columns, batch.size(), payloadBytes);
    }

    private static PayloadRef reference(EntityRecord record) {
        long size;
        try {
            size = Files.size(record.path());
        } catch (IOException e) {
            throw new EncodingException(record.path(), e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        if (size != record.sizeBytes()) {
            throw new EncodingException(record.path(), String.format(
                    "size changed since scan (declared=%d, read=%d)", record.sizeBytes(), size));
        }
        if (!Files.isReadable(record.path())) {
            throw new EncodingException(record.path(), "not readable");
        }
        return new PayloadRef(record.path(), size);
    }

    private static String digest(EntityRecord record) {
        try {
            return Checksums.sha256Hex(record.path());
        } catch (IOException e) {
            throw new EncodingException(record.path(), e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
