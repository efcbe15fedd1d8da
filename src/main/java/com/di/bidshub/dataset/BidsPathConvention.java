package com.di.bidshub.dataset;

import com.di.bidshub.upload.scan.BidsFileName;
import com.di.bidshub.upload.scan.EntityRecord;

import java.util.Optional;

/**
 * BIDS naming rules checked per record:
 * {@code sub-<s>/ses-<t>/<datatype>/sub-<s>_ses-<t>[_key-value]*_<suffix>.nii[.gz]}.
 */
public final class BidsPathConvention {

    private BidsPathConvention() {
    }

    public static Optional<String> violation(EntityRecord record, DatasetProfile profile) {
        String fileName = record.path().getFileName().toString();
        Optional<BidsFileName> parsed = BidsFileName.parse(fileName);
        if (parsed.isEmpty()) {
            return Optional.of("file name is not a BIDS NIfTI name: " + fileName);
        }
        BidsFileName name = parsed.get();
        if (!record.subject().equals(name.subject())) {
            return Optional.of("sub-" + name.subject() + " in file name but directory is sub-" + record.subject());
        }
        if (!record.session().equals(name.session())) {
            return Optional.of("ses-" + name.session() + " in file name but directory is ses-" + record.session());
        }
        if (!record.modality().equals(name.suffix())) {
            return Optional.of("suffix " + name.suffix() + " does not match modality " + record.modality());
        }
        Optional<String> datatype = profile.datatypeFor(record.modality());
        if (datatype.isEmpty()) {
            return Optional.of("modality " + record.modality() + " is not published by " + profile.kind());
        }
        if (!datatype.get().equals(record.datatype())) {
            return Optional.of("modality " + record.modality() + " expected under '" + datatype.get()
                    + "' but found under '" + record.datatype() + "'");
        }
        return Optional.empty();
    }
}
