package com.di.bidshub.upload.validation;

import com.di.bidshub.dataset.DatasetProfile;
import com.di.bidshub.upload.scan.EntityRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Structural gate run before any expensive work.
 *
 * <h3>Checks</h3>
 * <ol>
 *   <li><strong>zero-byte</strong>: any record with declared size 0 is fatal.</li>
 *   <li><strong>file-exists</strong>: a record whose file vanished since the scan is fatal.</li>
 *   <li><strong>expected-count[group]</strong>: observed vs expected per grouping key,
 *       accepted down to {@link TolerancePolicy#minimumAccepted(long)}; an accepted
 *       under-count is a warning.</li>
 *   <li><strong>path-shape</strong>: every path follows the cohort's naming convention.</li>
 * </ol>
 * All checks always run so the report is complete after one pass. Only metadata is
 * inspected; no file is opened.
 */
@Slf4j
@Service
public class IntegrityValidator {

    public static final String DATASET_GROUP  = "dataset";
    public static final String SUBJECT_GROUP  = "subject:";
    public static final String MODALITY_GROUP = "modality:";

    private final Clock clock;

    public IntegrityValidator() {
        this(Clock.systemUTC());
    }

    IntegrityValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationReport validate(List<EntityRecord> records,
                                     Map<String, Integer> expectedCounts,
                                     TolerancePolicy tolerance,
                                     DatasetProfile profile) {

        ValidationReport.ValidationReportBuilder report = ValidationReport.builder()
                .datasetKind(profile.kind())
                .recordCount(records.size())
                .totalBytes(records.stream().mapToLong(EntityRecord::sizeBytes).sum())
                .createdAt(clock.instant());

        report.check(checkRecords("zero-byte", records, r -> r.sizeBytes() == 0,
                "zero-length file(s), likely truncated or corrupt"));
        report.check(checkRecords("file-exists", records, r -> !Files.isRegularFile(r.path()),
                "file(s) disappeared after the scan"));
        checkExpectedCounts(records, expectedCounts, tolerance).forEach(report::check);
        report.check(checkPathShape(records, profile));

        ValidationReport result = report.build();
        for (CheckResult c : result.getChecks()) {
            if (c.getStatus() == CheckStatus.PASS) {
                log.debug("[VALIDATE] {} PASS {}", c.getName(), c.getDetail());
            } else {
                log.warn("[VALIDATE] {} {} {} offending={}",
                        c.getName(), c.getStatus(), c.getDetail(), c.getOffendingPaths().size());
            }
        }
        log.info("[VALIDATE] {}", result.summary());
        return result;
    }

    /** Fraction-based convenience overload. */
    public ValidationReport validate(List<EntityRecord> records,
                                     Map<String, Integer> expectedCounts,
                                     double tolerance,
                                     DatasetProfile profile) {
        return validate(records, expectedCounts, TolerancePolicy.fraction(tolerance), profile);
    }

    /* ------------------------------------------------------------------ */

    private static CheckResult checkRecords(String name, List<EntityRecord> records,
                                            Predicate<EntityRecord> offending, String description) {
        List<String> paths = records.stream()
                .filter(offending)
                .map(r -> r.path().toString())
                .toList();
        return CheckResult.builder()
                .name(name)
                .status(paths.isEmpty() ? CheckStatus.PASS : CheckStatus.FAIL)
                .observed(paths.size())
                .offendingPaths(paths)
                .detail(paths.isEmpty()
                        ? "all " + records.size() + " record(s) ok"
                        : paths.size() + " " + description)
                .build();
    }

    private static List<CheckResult> checkExpectedCounts(List<EntityRecord> records,
                                                         Map<String, Integer> expectedCounts,
                                                         TolerancePolicy tolerance) {
        if (expectedCounts == null || expectedCounts.isEmpty()) {
            return List.of(CheckResult.builder()
                    .name("expected-count")
                    .status(CheckStatus.WARN)
                    .observed(records.size())
                    .detail("no expected counts supplied; count check skipped")
                    .build());
        }

        List<CheckResult> out = new ArrayList<>();
        for (Map.Entry<String, Integer> e : new TreeMap<>(expectedCounts).entrySet()) {
            String group    = e.getKey();
            long   expected = e.getValue() == null ? 0 : e.getValue();
            long   observed = records.stream().filter(groupFilter(group)).count();
            long   floor    = tolerance.minimumAccepted(expected);

            CheckStatus status;
            String detail;
            if (observed >= expected) {
                status = CheckStatus.PASS;
                detail = String.format("observed=%d expected=%d", observed, expected);
            } else if (observed >= floor) {
                status = CheckStatus.WARN;
                detail = String.format("partial: observed=%d expected=%d accepted down to %d (%s)",
                        observed, expected, floor, tolerance.describe());
            } else {
                status = CheckStatus.FAIL;
                detail = String.format("under-count: observed=%d expected=%d minimum=%d (%s)",
                        observed, expected, floor, tolerance.describe());
            }
            out.add(CheckResult.builder()
                    .name("expected-count[" + group + "]")
                    .status(status)
                    .observed(observed)
                    .expected(expected)
                    .tolerance(tolerance.describe())
                    .detail(detail)
                    .build());
        }
        return out;
    }

    private static CheckResult checkPathShape(List<EntityRecord> records, DatasetProfile profile) {
        List<String> paths = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        for (EntityRecord r : records) {
            Optional<String> violation = profile.pathViolation(r);
            if (violation.isPresent()) {
                paths.add(r.path().toString());
                if (reasons.size() < 5) {
                    reasons.add(r.relativePath() + ": " + violation.get());
                }
            }
        }
        return CheckResult.builder()
                .name("path-shape")
                .status(paths.isEmpty() ? CheckStatus.PASS : CheckStatus.FAIL)
                .observed(paths.size())
                .offendingPaths(paths)
                .detail(paths.isEmpty()
                        ? "all paths follow the " + profile.kind() + " naming convention"
                        : paths.size() + " naming violation(s), e.g. " + String.join("; ", reasons))
                .build();
    }

    /**
     * @throws IllegalArgumentException for a grouping key that is not one of the known forms
     */
    static Predicate<EntityRecord> groupFilter(String group) {
        if (DATASET_GROUP.equals(group)) {
            return r -> true;
        }
        if (group.startsWith(SUBJECT_GROUP)) {
            String subject = stripPrefix(group.substring(SUBJECT_GROUP.length()), "sub-");
            return r -> r.subject().equals(subject);
        }
        if (group.startsWith(MODALITY_GROUP)) {
            String modality = group.substring(MODALITY_GROUP.length());
            return r -> r.modality().equals(modality);
        }
        throw new IllegalArgumentException("Unknown expected-count grouping key: '" + group
                + "' (use dataset, subject:<id> or modality:<label>)");
    }

    private static String stripPrefix(String value, String prefix) {
        return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
    }
}
