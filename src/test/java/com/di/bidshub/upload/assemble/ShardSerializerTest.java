package com.di.bidshub.upload.assemble;

import com.di.bidshub.dataset.FeatureSchema;
import com.di.bidshub.exception.EncodingException;
import com.di.bidshub.upload.BidsTreeFixture;
import com.di.bidshub.upload.scan.EntityScanner;
import com.di.bidshub.util.Checksums;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ShardSerializer Tests")
class ShardSerializerTest {

    @TempDir
    Path root;

    @TempDir
    Path spoolDir;

    private ShardSerializer serializer;

    @BeforeEach
    void setUp() {
        serializer = new ShardSerializer(spoolDir);
    }

    @Test
    @DisplayName("Should write a gzip columnar document with its CRC32C")
    @SuppressWarnings("unchecked")
    void testSerialize_Document() throws Exception {
        BidsTreeFixture.standard(root, 2, 1, 24);
        var records = new EntityScanner().scanAll(root);
        EncodedBatch batch = new RecordAssembler().assemble(records, FeatureSchema.bidsDefault());

        SerializedShard shard = serializer.serialize("ds-arc", 3, batch);

        assertEquals(3, shard.shardIndex());
        assertEquals(2, shard.numRows());
        byte[] bytes = shard.readBytes();
        assertEquals(bytes.length, shard.sizeBytes());
        assertEquals(Checksums.crc32cBase64(bytes), shard.crc32c());
        assertEquals((byte) 0x1f, bytes[0]);
        assertEquals((byte) 0x8b, bytes[1]);

        Map<String, Object> doc = serializer.deserialize(shard);
        assertEquals(ShardSerializer.FORMAT, doc.get("format"));
        assertEquals("ds-arc", doc.get("datasetId"));
        assertEquals(3, doc.get("shardIndex"));
        assertEquals(8, ((List<?>) doc.get("schema")).size());

        Map<String, List<Object>> columns = (Map<String, List<Object>>) doc.get("columns");
        assertEquals(List.of("1", "1"), columns.get("session_id"));
        byte[] nifti = Base64.getDecoder().decode((String) columns.get("nifti").get(1));
        assertArrayEquals(Files.readAllBytes(records.get(1).path()), nifti);
    }

    @Test
    @DisplayName("Should produce identical bytes for the same batch")
    void testSerialize_Stable() {
        BidsTreeFixture.standard(root, 1, 2, 24);
        EncodedBatch batch = new RecordAssembler().assemble(new EntityScanner().scanAll(root),
                FeatureSchema.bidsDefault());

        assertEquals(serializer.serialize("ds", 0, batch).crc32c(), serializer.serialize("ds", 0, batch).crc32c());
    }

    @Test
    @DisplayName("Should spool the shard into the configured directory and delete it on request")
    void testSerialize_SpoolFile() throws Exception {
        BidsTreeFixture.standard(root, 1, 1, 24);
        EncodedBatch batch = new RecordAssembler().assemble(new EntityScanner().scanAll(root),
                FeatureSchema.bidsDefault());

        SerializedShard shard = serializer.serialize("ds", 4, batch);

        assertEquals(spoolDir, shard.file().getParent());
        assertTrue(shard.file().getFileName().toString().startsWith("bidshub-shard-00004-"));
        assertEquals(Files.size(shard.file()), shard.sizeBytes());

        shard.delete();
        assertFalse(Files.exists(shard.file()));
    }

    @Test
    @DisplayName("Should reject a payload that changed size after assembly and leave no spool file")
    void testSerialize_PayloadChangedAfterAssembly() throws Exception {
        BidsTreeFixture tree = BidsTreeFixture.standard(root, 2, 1, 24);
        var records = new EntityScanner().scanAll(root);
        EncodedBatch batch = new RecordAssembler().assemble(records, FeatureSchema.bidsDefault());
        tree.file("M0002", "1", "anat", "T1w", 4096);

        EncodingException e = assertThrows(EncodingException.class,
                () -> serializer.serialize("ds", 0, batch));

        assertEquals(records.get(1).path(), e.getRecordPath());
        assertTrue(e.getMessage().contains("size changed"));
        try (Stream<Path> left = Files.list(spoolDir)) {
            assertEquals(0, left.count());
        }
    }

    @Test
    @DisplayName("Should report a payload deleted after assembly against its record")
    void testSerialize_PayloadDeletedAfterAssembly() throws Exception {
        BidsTreeFixture.standard(root, 1, 1, 24);
        var records = new EntityScanner().scanAll(root);
        EncodedBatch batch = new RecordAssembler().assemble(records, FeatureSchema.bidsDefault());
        Files.delete(records.get(0).path());

        EncodingException e = assertThrows(EncodingException.class,
                () -> serializer.serialize("ds", 0, batch));

        assertEquals(records.get(0).path(), e.getRecordPath());
        try (Stream<Path> left = Files.list(spoolDir)) {
            assertEquals(0, left.count());
        }
    }
}
