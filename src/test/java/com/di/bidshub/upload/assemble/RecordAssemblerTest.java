package com.di.bidshub.upload.assemble;

import com.di.bidshub.dataset.ColumnSpec;
import com.di.bidshub.dataset.FeatureSchema;
import com.di.bidshub.exception.EncodingException;
import com.di.bidshub.upload.BidsTreeFixture;
import com.di.bidshub.upload.scan.EntityRecord;
import com.di.bidshub.upload.scan.EntityScanner;
import com.di.bidshub.util.Checksums;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordAssembler Tests")
class RecordAssemblerTest {

    private final RecordAssembler assembler = new RecordAssembler();
    private final EntityScanner   scanner   = new EntityScanner();

    @TempDir
    Path root;

    @Test
    @DisplayName("Should lay out one row per record in schema column order")
    void testAssemble_Columns() throws Exception {
        BidsTreeFixture.standard(root, 2, 1, 32);
        List<EntityRecord> records = scanner.scanAll(root);

        EncodedBatch batch = assembler.assemble(records, FeatureSchema.bidsDefault());

        assertEquals(2, batch.numRows());
        assertEquals(64, batch.payloadBytes());
        assertThat(batch.columns().keySet()).containsExactlyElementsOf(FeatureSchema.bidsDefault().columnNames());
        assertEquals(List.of("M0001", "M0002"), batch.columns().get("subject_id"));
        assertEquals(List.of(32L, 32L), batch.columns().get("size_bytes"));

        PayloadRef ref = (PayloadRef) batch.columns().get("nifti").get(0);
        assertEquals(records.get(0).path(), ref.path());
        assertEquals(32L, ref.sizeBytes());
        byte[] payload = Files.readAllBytes(records.get(0).path());
        assertEquals(Checksums.sha256Hex(payload), batch.columns().get("sha256").get(0));
    }

    @Test
    @DisplayName("Should not read payloads for a metadata-only schema")
    void testAssemble_MetadataOnly() {
        BidsTreeFixture.standard(root, 1, 1, 32);
        FeatureSchema schema = new FeatureSchema(List.of(
                ColumnSpec.string("subject_id", ColumnSpec.ColumnSource.SUBJECT_ID),
                ColumnSpec.string("file_name", ColumnSpec.ColumnSource.FILE_NAME)));

        EncodedBatch batch = assembler.assemble(scanner.scanAll(root), schema);

        assertEquals(0, batch.payloadBytes());
        assertEquals(List.of("sub-M0001_ses-1_T1w.nii.gz"), batch.columns().get("file_name"));
    }

    @Test
    @DisplayName("Should name the record whose file is gone")
    void testAssemble_MissingFile() throws Exception {
        BidsTreeFixture.standard(root, 2, 1, 32);
        List<EntityRecord> records = scanner.scanAll(root);
        Files.delete(records.get(1).path());

        EncodingException e = assertThrows(EncodingException.class,
                () -> assembler.assemble(records, FeatureSchema.bidsDefault()));
        assertEquals(records.get(1).path(), e.getRecordPath());
    }

    @Test
    @DisplayName("Should fail when a file changed size since the scan")
    void testAssemble_SizeChanged() {
        BidsTreeFixture tree = BidsTreeFixture.standard(root, 1, 1, 32);
        List<EntityRecord> records = scanner.scanAll(root);
        tree.file("M0001", "1", "anat", "T1w", 16);

        EncodingException e = assertThrows(EncodingException.class,
                () -> assembler.assemble(records, FeatureSchema.bidsDefault()));
        assertTrue(e.getMessage().contains("size changed"));
    }
}
