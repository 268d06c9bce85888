package edu.uconn.newscube.transform;

import edu.uconn.newscube.entity.DimEntity;
import edu.uconn.newscube.model.RegistryEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Authority list of known organisations. Registry rows whose names normalize
 * identically are merged at load time into one canonical entry.
 */
@Slf4j
public class CompanyRegistry {

    private static final CompanyRegistry EMPTY = new CompanyRegistry(Map.of(), Set.of(), 0);

    private final Map<String, RegistryEntry> canonicalByNormalized;

    /**
     * Normalized forms plus lowercase registry names, used for text scanning.
     */
    private final Set<String> knownNames;

    /**
     * Rows folded into an existing canonical entry at load time.
     */
    private final int mergedVariants;

    private CompanyRegistry(Map<String, RegistryEntry> canonicalByNormalized, Set<String> knownNames,
                            int mergedVariants) {
        this.canonicalByNormalized = canonicalByNormalized;
        this.knownNames = knownNames;
        this.mergedVariants = mergedVariants;
    }

    public static CompanyRegistry empty() {
        return EMPTY;
    }

    /**
     * Builds the registry. When two rows share a normalized form the longer
     * name is kept; on equal length the variant containing a space wins.
     * Names longer than {@link DimEntity#MAX_NAME_LENGTH} are skipped.
     */
    public static CompanyRegistry of(List<RegistryEntry> rows) {
        Map<String, RegistryEntry> canonical = new HashMap<>();
        Set<String> known = new LinkedHashSet<>();
        int merged = 0;
        int tooLong = 0;

        for (RegistryEntry row : rows) {
            String name = row.getName() == null ? "" : row.getName().strip();
            if (name.isEmpty() || "nan".equalsIgnoreCase(name) || "none".equalsIgnoreCase(name)) {
                continue;
            }
            if (name.length() > DimEntity.MAX_NAME_LENGTH) {
                tooLong++;
                continue;
            }
            String normalized = EntityNames.normalize(name);
            if (normalized.isEmpty()) {
                continue;
            }

            RegistryEntry candidate = new RegistryEntry(name, row.getEntityType());
            if (canonical.containsKey(normalized)) {
                merged++;
            }
            canonical.merge(normalized, candidate, CompanyRegistry::preferredName);
            known.add(normalized);
            known.add(name.toLowerCase(Locale.ROOT));
        }

        if (tooLong > 0) {
            log.warn("Skipped {} registry names longer than {} characters", tooLong, DimEntity.MAX_NAME_LENGTH);
        }
        if (merged > 0) {
            log.info("Merged {} registry name variants into {} canonical companies", merged, canonical.size());
        }
        return new CompanyRegistry(Collections.unmodifiableMap(canonical), Collections.unmodifiableSet(known), merged);
    }

    private static RegistryEntry preferredName(RegistryEntry existing, RegistryEntry candidate) {
        String current = existing.getName();
        String challenger = candidate.getName();
        if (challenger.length() > current.length()) {
            return candidate;
        }
        if (challenger.length() == current.length() && challenger.contains(" ") && !current.contains(" ")) {
            return candidate;
        }
        return existing;
    }

    public Optional<RegistryEntry> lookup(String normalizedName) {
        return Optional.ofNullable(canonicalByNormalized.get(normalizedName));
    }

    public Set<String> getKnownNames() {
        return knownNames;
    }

    /**
     * True when any known name occurs inside the given lowercase text.
     */
    public boolean mentionsKnownName(String lowercaseText) {
        for (String known : knownNames) {
            if (lowercaseText.contains(known)) {
                return true;
            }
        }
        return false;
    }

    public int getMergedVariants() {
        return mergedVariants;
    }

    public int size() {
        return canonicalByNormalized.size();
    }

    public boolean isEmpty() {
        return canonicalByNormalized.isEmpty();
    }
}
