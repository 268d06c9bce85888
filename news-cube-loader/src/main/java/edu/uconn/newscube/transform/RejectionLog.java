package edu.uconn.newscube.transform;

import edu.uconn.newscube.entity.RejectedEntity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Frequency table of entity candidates that failed validation. The first
 * reason recorded for a name is the one reported.
 */
public class RejectionLog {

    public static final String REASON_FILTERED_TERM = "Contains filtered medical or clinical term";
    public static final String REASON_NOT_COMPANY = "Failed validation (not recognized as company name)";
    public static final String REASON_TOO_SHORT = "Normalized name too short";
    public static final String REASON_TOO_LONG = "Name longer than the entity dimension allows";

    private final Map<String, Integer> counts = new LinkedHashMap<>();
    private final Map<String, String> reasons = new LinkedHashMap<>();

    /**
     * Counts one rejection. Names longer than the report column are cut to
     * {@link RejectedEntity#MAX_NAME_LENGTH} characters.
     */
    public void reject(String candidate, String reason) {
        String name = reportName(candidate);
        counts.merge(name, 1, Integer::sum);
        reasons.putIfAbsent(name, reason);
    }

    /**
     * Adds every count of {@code other} into this log.
     */
    public void mergeFrom(RejectionLog other) {
        other.counts.forEach((name, count) -> {
            counts.merge(name, count, Integer::sum);
            reasons.putIfAbsent(name, other.reasons.get(name));
        });
    }

    public int count(String candidate) {
        return counts.getOrDefault(reportName(candidate), 0);
    }

    private static String reportName(String candidate) {
        String name = candidate.strip();
        return name.length() > RejectedEntity.MAX_NAME_LENGTH
            ? name.substring(0, RejectedEntity.MAX_NAME_LENGTH).strip()
            : name;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public int size() {
        return counts.size();
    }

    /**
     * @return report rows, most frequent first, ties by name
     */
    public List<RejectedEntity> toReport() {
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()))
            .map(entry -> RejectedEntity.builder()
                .rejectedEntity(entry.getKey())
                .occurrenceCount(entry.getValue())
                .reason(reasons.get(entry.getKey()))
                .build())
            .collect(Collectors.toList());
    }
}
