package com.di.bidshub.upload.scan;

import com.di.bidshub.exception.ScanException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Walks a BIDS dataset root and yields one {@link EntityRecord} per NIfTI file found at
 * {@code sub-*}/{@code ses-*}/[{@code <datatype>}/].
 *
 * <p>Only stat-level inspection is performed; file contents are never opened. The
 * returned stream is lazy over subjects and every call re-reads the tree, so scanning is
 * restartable and side-effect free.
 *
 * <p>An unreadable subject or session directory is logged and skipped: partial local
 * mirrors are legitimate and are judged later by the integrity validator.
 */
@Slf4j
@Component
public class EntityScanner {

    private final Clock clock;

    public EntityScanner() {
        this(Clock.systemUTC());
    }

    EntityScanner(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws ScanException if {@code root} is missing, not a directory or unreadable
     */
    public Stream<EntityRecord> scan(Path root) {
        Path absRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(absRoot)) {
            throw new ScanException("Dataset root does not exist or is not a directory: " + absRoot);
        }
        if (!Files.isReadable(absRoot)) {
            throw new ScanException("Dataset root is not readable: " + absRoot);
        }

        List<Path> subjects;
        try {
            subjects = children(absRoot).stream()
                    .filter(p -> Files.isDirectory(p) && name(p).startsWith("sub-"))
                    .toList();
        } catch (IOException e) {
            throw new ScanException("Cannot list dataset root " + absRoot, e);
        }

        Instant discoveredAt = clock.instant();
        log.info("[SCAN] root={} subjects={}", absRoot, subjects.size());

        return subjects.stream()
                .flatMap(subject -> childrenQuietly(subject).stream()
                        .filter(p -> Files.isDirectory(p) && name(p).startsWith("ses-"))
                        .flatMap(session -> filesInSession(absRoot, subject, session, discoveredAt)));
    }

    /** Eager convenience over {@link #scan(Path)}. */
    public List<EntityRecord> scanAll(Path root) {
        try (Stream<EntityRecord> records = scan(root)) {
            List<EntityRecord> all = records.toList();
            log.info("[SCAN] discovered {} record(s) under {}", all.size(), root);
            return all;
        }
    }

    /* ------------------------------------------------------------------ */

    private Stream<EntityRecord> filesInSession(Path root, Path subject, Path session, Instant discoveredAt) {
        String subjectLabel = name(subject).substring("sub-".length());
        String sessionLabel = name(session).substring("ses-".length());

        List<EntityRecord> out = new ArrayList<>();
        for (Path child : childrenQuietly(session)) {
            if (Files.isDirectory(child)) {
                for (Path file : childrenQuietly(child)) {
                    toRecord(root, file, subjectLabel, sessionLabel, name(child), discoveredAt).ifPresent(out::add);
                }
            } else {
                toRecord(root, child, subjectLabel, sessionLabel, "", discoveredAt).ifPresent(out::add);
            }
        }
        return out.stream();
    }

    private Optional<EntityRecord> toRecord(Path root, Path file, String subject, String session,
                                            String datatype, Instant discoveredAt) {
        String fileName = name(file);
        if (!BidsFileName.isNifti(fileName)) {
            return Optional.empty();
        }
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            log.warn("[SCAN] cannot stat {} ({}); skipping", file, e.getMessage());
            return Optional.empty();
        }
        if (!attrs.isRegularFile()) {
            return Optional.empty();
        }
        String relative = root.relativize(file).toString().replace('\\', '/');
        return Optional.of(new EntityRecord(
                subject, session, BidsFileName.suffixOf(fileName), datatype,
                file, relative, attrs.size(), discoveredAt));
    }

    private static List<Path> childrenQuietly(Path dir) {
        try {
            return children(dir);
        } catch (IOException e) {
            log.warn("[SCAN] cannot list {} ({}); treating as empty", dir, e.getMessage());
            return List.of();
        }
    }

    private static List<Path> children(Path dir) throws IOException {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) {
                if (!name(p).startsWith(".")) {
                    out.add(p);
                }
            }
        }
        out.sort(Comparator.comparing(EntityScanner::name));
        return out;
    }

    private static String name(Path p) {
        return p.getFileName().toString();
    }
}
