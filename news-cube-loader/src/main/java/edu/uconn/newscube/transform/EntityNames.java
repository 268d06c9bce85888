package edu.uconn.newscube.transform;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Identity rules for organisation names. Two names denote the same entity
 * iff {@link #normalize(String)} returns the same string for both.
 */
public final class EntityNames {

    /**
     * Corporate suffixes stripped from the end of a name before comparison.
     */
    public static final Set<String> CORPORATE_SUFFIXES = Set.of(
        "inc", "incorporated", "corp", "corporation", "ltd", "limited",
        "llc", "llp", "co", "company", "group", "holdings", "labs", "laboratories",
        "therapeutics", "pharma", "biotech", "biosciences", "biopharmaceuticals",
        "pharmaceuticals", "biotechnology", "technologies", "solutions",
        "systems", "international", "global", "ag", "sa", "nv", "plc",
        "gmbh", "kk", "ltda", "srl", "spa", "sas"
    );

    /**
     * Suffixes that may trail a name in running text, as a regex alternation.
     */
    static final String TRAILING_SUFFIX_ALTERNATION =
        "inc|incorporated|corp|corporation|ltd|limited|llc|pharmaceuticals|pharma"
            + "|biotech|biotechnology|therapeutics|biosciences";

    // longest first so "biopharmaceuticals" is tried before "pharmaceuticals"
    private static final List<Pattern> SUFFIX_PATTERNS = CORPORATE_SUFFIXES.stream()
        .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
        .map(suffix -> Pattern.compile("\\s+" + Pattern.quote(suffix) + "[\\s.,;:]*$",
            Pattern.UNICODE_CHARACTER_CLASS))
        .collect(Collectors.toUnmodifiableList());

    private static final Pattern AMPERSAND = Pattern.compile("\\s*&\\s*", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SPACED_AND = Pattern.compile("\\s+and\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-.,;:+'\"]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGES = Pattern.compile("^[^a-z0-9]+|[^a-z0-9]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private EntityNames() {
    }

    /**
     * Folds a display name to its identity key: lowercase, {@code &} and
     * {@code and} unified, trailing corporate suffixes removed, then every
     * space, hyphen and punctuation mark dropped. "AstraZeneca",
     * "Astra Zeneca" and "AstraZeneca Inc" all fold to {@code astrazeneca}.
     *
     * @return the normalized form, empty for null or blank input
     */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String folded = name.strip().toLowerCase(Locale.ROOT);
        folded = AMPERSAND.matcher(folded).replaceAll(" and ");
        folded = SPACED_AND.matcher(folded).replaceAll("and");
        for (Pattern suffix : SUFFIX_PATTERNS) {
            folded = suffix.matcher(folded).replaceAll("");
        }
        folded = SEPARATORS.matcher(folded).replaceAll("");
        return EDGES.matcher(folded).replaceAll("");
    }

    /**
     * First word of the name in normalized form, e.g. {@code reata} for
     * "Reata Pharmaceuticals".
     */
    public static String coreWord(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String[] words = WHITESPACE.split(name.strip());
        return normalize(words[0]);
    }

    /**
     * True when the whole name folds down to its first word, as with "Reata"
     * or "Reata Inc".
     */
    public static boolean isSingleWord(String name) {
        String normalized = normalize(name);
        return !normalized.isEmpty() && normalized.equals(coreWord(name));
    }

    /**
     * Whitespace-separated words of the name, each normalized; words that
     * normalize to nothing are dropped.
     */
    public static List<String> words(String name) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(name.strip()))
            .map(EntityNames::normalize)
            .filter(word -> !word.isEmpty())
            .collect(Collectors.toList());
    }

    static boolean hasCorporateSuffix(String lowercaseName) {
        for (String suffix : CORPORATE_SUFFIXES) {
            if (lowercaseName.endsWith(suffix) || lowercaseName.contains(" " + suffix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Python-style title casing: a letter is upper-cased when it follows a
     * non-letter, lower-cased otherwise.
     */
    static String titleCase(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                result.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                result.append(c);
                previousIsLetter = false;
            }
        }
        return result.toString();
    }
}
