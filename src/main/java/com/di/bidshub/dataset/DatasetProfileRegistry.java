package com.di.bidshub.dataset;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of {@link DatasetProfile} beans keyed by their normalized kind.
 *
 * <p>All profile beans are discovered through dependency injection; lookups are
 * case-insensitive and duplicate kinds are rejected at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetProfileRegistry {

    private final List<DatasetProfile> profiles;

    private Map<String, DatasetProfile> profilesByKind;

    @PostConstruct
    void initialize() {
        if (profiles == null || profiles.isEmpty()) {
            log.warn("No DatasetProfile beans found. Registry will be empty.");
            profilesByKind = Collections.emptyMap();
            return;
        }

        Map<String, List<DatasetProfile>> grouped = profiles.stream()
                .peek(DatasetProfileRegistry::validateKind)
                .collect(Collectors.groupingBy(p -> normalizeKind(p.kind())));

        String duplicates = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> String.format("'%s' -> %s", e.getKey(), e.getValue()))
                .collect(Collectors.joining(" ; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate DatasetProfile kind() values detected: " + duplicates);
        }

        profilesByKind = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().get(0)));
        log.info("Registered {} dataset profile(s): {}", profilesByKind.size(), profilesByKind.keySet());
    }

    /**
     * @throws IllegalArgumentException if no profile is registered for {@code kind}
     */
    public DatasetProfile getProfile(String kind) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Dataset kind cannot be null or blank");
        }
        DatasetProfile profile = profilesByKind.get(normalizeKind(kind));
        if (profile == null) {
            throw new IllegalArgumentException(String.format(
                    "Unsupported dataset kind: '%s'. Available kinds: %s", kind, profilesByKind.keySet()));
        }
        return profile;
    }

    public Set<String> getRegisteredKinds() {
        return Collections.unmodifiableSet(profilesByKind.keySet());
    }

    private static void validateKind(DatasetProfile profile) {
        if (profile.kind() == null || profile.kind().isBlank()) {
            throw new IllegalStateException(String.format(
                    "Profile %s returned blank kind()", profile.getClass().getName()));
        }
    }

    private static String normalizeKind(String kind) {
        return kind.trim().toLowerCase(Locale.ROOT);
    }
}
