package com.di.bidshub.upload.scan;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;

/**
 * One discoverable imaging file: subject × session × modality.
 *
 * <p>Holds only stat-level metadata. The payload is read later, one batch at a time,
 * by the record assembler.
 *
 * @param subject      subject label without the {@code sub-} prefix
 * @param session      session label without the {@code ses-} prefix
 * @param modality     BIDS suffix, e.g. {@code T1w}
 * @param datatype     datatype directory ({@code anat}, {@code dwi}, ...); empty when the
 *                     file sits directly in the session directory
 * @param path         absolute file path
 * @param relativePath path relative to the dataset root, '/'-separated
 * @param sizeBytes    size reported by the file system at scan time
 * @param discoveredAt scan timestamp
 */
public record EntityRecord(
        String  subject,
        String  session,
        String  modality,
        String  datatype,
        Path    path,
        String  relativePath,
        long    sizeBytes,
        Instant discoveredAt) {

    /** Partition key: subject, session, modality ascending; relative path breaks ties. */
    public static final Comparator<EntityRecord> PARTITION_ORDER = Comparator
            .comparing(EntityRecord::subject)
            .thenComparing(EntityRecord::session)
            .thenComparing(EntityRecord::modality)
            .thenComparing(EntityRecord::relativePath);

    public String fileName() {
        return path.getFileName().toString();
    }
}
