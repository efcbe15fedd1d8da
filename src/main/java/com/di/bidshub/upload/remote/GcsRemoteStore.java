package com.di.bidshub.upload.remote;

import com.di.bidshub.exception.FailureCategory;
import com.di.bidshub.exception.TransferException;
import com.di.bidshub.upload.assemble.SerializedShard;
import com.di.bidshub.upload.config.GcsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link RemoteStore} on Google Cloud Storage.
 *
 * <pre>
 * gs://{bucket}/{prefix}/{datasetId}/plans/{planKey}/data/shard-NNNNN.json.gz     shard objects
 * gs://{bucket}/{prefix}/{datasetId}/plans/{planKey}/entries/shard-NNNNN.json     committed-shard entries
 * gs://{bucket}/{prefix}/{datasetId}/manifest.json                                consumer-visible, written last
 * </pre>
 *
 * Re-uploading a shard of the same plan overwrites the same object name, so retries are
 * idempotent. A new plan writes under its own key, leaving the objects of the currently
 * published manifest intact until {@code manifest.json} is replaced. The object generation
 * serves as the shard revision.
 */
@Slf4j
@Component
public class GcsRemoteStore implements RemoteStore {

    private final Storage       storage;
    private final GcsProperties properties;
    private final ObjectMapper  objectMapper;

    public GcsRemoteStore(Storage storage, GcsProperties properties) {
        this.storage      = storage;
        this.properties   = properties;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public TransferHandle beginShardTransfer(String datasetId, String planFingerprint, SerializedShard shard) {
        String objectName = shardObject(datasetId, planFingerprint, shard.shardIndex());
        BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucket(), objectName))
                .setContentType("application/gzip")
                .build();
        try {
            storage.createFrom(info, shard.file());
        } catch (StorageException e) {
            throw translate("upload of gs://" + bucket() + "/" + objectName, e);
        } catch (IOException e) {
            throw new TransferException("upload of gs://" + bucket() + "/" + objectName + " failed: "
                    + e.getMessage(), FailureCategory.categorize(e).isRetryable(), e);
        }
        log.debug("[GCS] wrote {}B → gs://{}/{}", shard.sizeBytes(), bucket(), objectName);
        return new TransferHandle(datasetId, shard.shardIndex(), objectName);
    }

    @Override
    public TransferReceipt confirmTransfer(TransferHandle handle) {
        Blob blob;
        try {
            blob = storage.get(BlobId.of(bucket(), handle.objectName()));
        } catch (StorageException e) {
            throw translate("stat of gs://" + bucket() + "/" + handle.objectName(), e);
        }
        if (blob == null) {
            throw new TransferException("Object missing after upload: gs://" + bucket() + "/"
                    + handle.objectName(), true);
        }
        long   size       = blob.getSize() == null ? -1L : blob.getSize();
        String generation = blob.getGeneration() == null ? "0" : String.valueOf(blob.getGeneration());
        return new TransferReceipt(size, blob.getCrc32c(), generation);
    }

    @Override
    public void appendManifestEntry(String datasetId, String planFingerprint, int shardIndex, String revision) {
        String objectName = entriesPrefix(datasetId, planFingerprint) + shardName(shardIndex) + ".json";
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("datasetId", datasetId);
        entry.put("planFingerprint", planFingerprint);
        entry.put("shardIndex", shardIndex);
        entry.put("revision", revision);
        entry.put("path", shardObject(datasetId, planFingerprint, shardIndex));
        writeJson(objectName, entry);
    }

    @Override
    public void finalizeManifest(String datasetId, String planFingerprint, int plannedShardCount) {
        String entriesPrefix = entriesPrefix(datasetId, planFingerprint);
        Map<Integer, Map<String, Object>> byIndex = new TreeMap<>();
        try {
            for (Blob blob : storage.list(bucket(), Storage.BlobListOption.prefix(entriesPrefix)).iterateAll()) {
                Map<String, Object> entry = readEntry(blob);
                int index = ((Number) entry.get("shardIndex")).intValue();
                if (index >= 0 && index < plannedShardCount) {
                    byIndex.put(index, entry);
                }
            }
        } catch (StorageException e) {
            throw translate("listing of gs://" + bucket() + "/" + entriesPrefix, e);
        }
        if (byIndex.size() != plannedShardCount) {
            List<Integer> missing = new ArrayList<>();
            for (int i = 0; i < plannedShardCount; i++) {
                if (!byIndex.containsKey(i)) {
                    missing.add(i);
                }
            }
            throw new TransferException("Cannot publish gs://" + bucket() + "/" + entriesPrefix
                    + ": entries missing for shard(s) " + missing, false);
        }
        List<Map<String, Object>> shards = new ArrayList<>(byIndex.values());

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("datasetId", datasetId);
        manifest.put("planFingerprint", planFingerprint);
        manifest.put("finalizedAt", Instant.now());
        manifest.put("shardCount", shards.size());
        manifest.put("shards", shards);

        String objectName = datasetRoot(datasetId) + "/manifest.json";
        writeJson(objectName, manifest);
        log.info("[MANIFEST] published {} shard(s) → gs://{}/{}", shards.size(), bucket(), objectName);
    }

    /* ------------------------------------------------------------------ */

    @SuppressWarnings("unchecked")
    private Map<String, Object> readEntry(Blob blob) {
        try {
            return objectMapper.readValue(blob.getContent(), Map.class);
        } catch (IOException e) {
            throw new TransferException("Unreadable manifest entry gs://" + bucket() + "/" + blob.getName(), false, e);
        }
    }

    private void writeJson(String objectName, Object body) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(body);
        } catch (IOException e) {
            throw new TransferException("Cannot serialize " + objectName, false, e);
        }
        BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucket(), objectName))
                .setContentType("application/json")
                .build();
        try {
            storage.create(info, json);
        } catch (StorageException e) {
            throw translate("write of gs://" + bucket() + "/" + objectName, e);
        }
    }

    private static TransferException translate(String what, StorageException e) {
        FailureCategory category = FailureCategory.categorize(e);
        return new TransferException(what + " failed (" + category + ", code=" + e.getCode() + "): "
                + e.getMessage(), category.isRetryable(), e);
    }

    private String shardObject(String datasetId, String planFingerprint, int shardIndex) {
        return planRoot(datasetId, planFingerprint) + "/data/" + shardName(shardIndex) + ".json.gz";
    }

    private String entriesPrefix(String datasetId, String planFingerprint) {
        return planRoot(datasetId, planFingerprint) + "/entries/";
    }

    private String planRoot(String datasetId, String planFingerprint) {
        return datasetRoot(datasetId) + "/plans/" + RemoteStore.planKey(planFingerprint);
    }

    private String datasetRoot(String datasetId) {
        String prefix = properties.normalizedPrefix();
        return prefix.isEmpty() ? datasetId : prefix + "/" + datasetId;
    }

    private static String shardName(int shardIndex) {
        return String.format("shard-%05d", shardIndex);
    }

    private String bucket() {
        String bucket = properties.getBucket();
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalStateException("bidshub.gcs.bucket is not configured");
        }
        return bucket;
    }
}
