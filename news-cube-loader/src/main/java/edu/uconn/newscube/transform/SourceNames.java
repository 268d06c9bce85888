package edu.uconn.newscube.transform;

import java.util.List;
import java.util.Locale;

/**
 * Validation and classification of publication source names.
 */
public final class SourceNames {

    public static final String TYPE_UNKNOWN = "Unknown";

    private static final int MAX_LENGTH = 100;

    private static final List<String> NEWS = List.of("news", "times", "post", "journal", "report");
    private static final List<String> GOVERNMENT = List.of("fda", "ema", "who", "nih", "gov");
    private static final List<String> ACADEMIC = List.of("university", "college", "institute");
    private static final List<String> INDUSTRY = List.of("biotech", "pharma", "medical", "health");

    private SourceNames() {
    }

    /**
     * Rejects values that are almost certainly misaligned cells: empty or
     * single characters, pure digits, over-long text, or no letter or digit at all.
     */
    public static boolean isValid(String source) {
        if (source == null) {
            return false;
        }
        String name = source.strip();
        if (name.length() < 2 || name.length() > MAX_LENGTH) {
            return false;
        }
        if (name.chars().allMatch(Character::isDigit)) {
            return false;
        }
        return name.chars().anyMatch(Character::isLetterOrDigit);
    }

    public static String classify(String source) {
        String lower = source.toLowerCase(Locale.ROOT);
        if (containsAny(lower, NEWS)) {
            return "News";
        }
        if (containsAny(lower, GOVERNMENT)) {
            return "Government";
        }
        if (containsAny(lower, ACADEMIC)) {
            return "Academic";
        }
        if (containsAny(lower, INDUSTRY)) {
            return "Industry";
        }
        return "Other";
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
