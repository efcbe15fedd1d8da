package com.di.bidshub.upload.scan;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed BIDS NIfTI file name: {@code sub-<s>_ses-<t>[_key-value]*_<suffix>.nii[.gz]}.
 * The suffix may itself be hyphenated, e.g. {@code lesion-msk}.
 */
public record BidsFileName(String subject, String session, String entities, String suffix) {

    private static final Pattern NAME = Pattern.compile(
            "^sub-([A-Za-z0-9]+)_ses-([A-Za-z0-9]+)((?:_[A-Za-z0-9]+-[A-Za-z0-9]+)*)_([A-Za-z0-9]+(?:-[A-Za-z0-9]+)*)\\.nii(?:\\.gz)?$");

    public static Optional<BidsFileName> parse(String fileName) {
        Matcher m = NAME.matcher(fileName);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new BidsFileName(m.group(1), m.group(2), m.group(3), m.group(4)));
    }

    public static boolean isNifti(String fileName) {
        return fileName.endsWith(".nii") || fileName.endsWith(".nii.gz");
    }

    /** Text after the last underscore, extension stripped; the whole stem when there is none. */
    public static String suffixOf(String fileName) {
        String stem = fileName.endsWith(".nii.gz")
                ? fileName.substring(0, fileName.length() - ".nii.gz".length())
                : fileName.endsWith(".nii") ? fileName.substring(0, fileName.length() - ".nii".length()) : fileName;
        int underscore = stem.lastIndexOf('_');
        return underscore < 0 ? stem : stem.substring(underscore + 1);
    }
}
