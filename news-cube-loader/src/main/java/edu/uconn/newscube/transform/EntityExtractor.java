package edu.uconn.newscube.transform;

import edu.uconn.newscube.entity.DimEntity;
import edu.uconn.newscube.model.ArticleRecord;
import edu.uconn.newscube.model.EntityCandidate;
import edu.uconn.newscube.model.NormalizedText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds organisations mentioned in an article.
 *
 * <p>Three strategies run in priority order:
 * <ol>
 *   <li>the upstream keyword hints, validated by a company-name heuristic (0.9)</li>
 *   <li>a scan of the normalized text for names known to the registry (0.7)</li>
 *   <li>a registry override that replaces name and type and lifts confidence to 1.0</li>
 * </ol>
 * Candidates are deduplicated per article by {@link EntityNames#normalize(String)}.
 */
@Slf4j
@Component
public class EntityExtractor {

    static final double HINT_CONFIDENCE = 0.9;
    static final double TEXT_SCAN_CONFIDENCE = 0.7;
    static final double REGISTRY_CONFIDENCE = 1.0;

    static final String TYPE_COMPANY = "Company";
    static final String TYPE_ORGANIZATION = "Organization";

    private static final int CONTEXT_CHARS = 20;
    private static final int MAX_NAME_LENGTH = 50;
    private static final int MAX_TICKER_LENGTH = 5;

    static final List<String> FILTER_WORDS = List.of(
        "alzheimer", "oncology", "neurology", "immunology", "hematology",
        "diabetes", "cancer", "therapeutic", "drug", "treatment", "therapy",
        "patient", "clinical", "trial", "approval", "fda", "ema", "regulatory",
        "disease", "disorder", "syndrome", "condition", "biomarker"
    );

    private static final List<String> ORGANIZATION_PATTERNS = List.of(
        "fda", "ema", "who", "nih", "university", "college", "institute", "hospital"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final CompanyRegistry registry;

    /**
     * Per known name: the suffixed form, the bare form, and the surface-form
     * recovery pattern.
     */
    private final Map<String, Pattern[]> knownNamePatterns = new LinkedHashMap<>();

    public EntityExtractor(CompanyRegistry registry) {
        this.registry = registry;
        for (String known : registry.getKnownNames()) {
            String quoted = Pattern.quote(known);
            knownNamePatterns.put(known, new Pattern[] {
                Pattern.compile("\\b" + quoted + "\\s+(?:" + EntityNames.TRAILING_SUFFIX_ALTERNATION + ")\\b"),
                Pattern.compile("\\b" + quoted + "\\b"),
                Pattern.compile("\\b" + quoted + "[^\\s,.;:]*")
            });
        }
        log.info("Initialized EntityExtractor with {} known company names", knownNamePatterns.size());
    }

    public List<EntityCandidate> extract(ArticleRecord article, NormalizedText normalized, RejectionLog rejections) {
        Map<String, EntityCandidate> found = new LinkedHashMap<>();
        String fullText = (nullToEmpty(article.getHeadline()) + " " + nullToEmpty(article.getBody()))
            .toLowerCase(Locale.ROOT);

        for (String displayName : extractFromHints(article.getKeywordHints(), rejections)) {
            addCandidate(found, displayName, HINT_CONFIDENCE, fullText, rejections);
        }
        for (String displayName : extractKnownCompanies(normalized.getCombined())) {
            addCandidate(found, displayName, TEXT_SCAN_CONFIDENCE, fullText, rejections);
        }

        found.replaceAll((key, candidate) -> registry.lookup(key)
            .map(entry -> new EntityCandidate(entry.getName(), entry.getEntityType(),
                REGISTRY_CONFIDENCE, candidate.getMentionCount()))
            .orElse(candidate));

        return new ArrayList<>(found.values());
    }

    /**
     * Extracts every article of a batch and collects the batch's best
     * representation of each entity.
     */
    public BatchExtraction batchExtract(List<? extends ArticleRecord> articles, List<NormalizedText> normalized) {
        List<List<EntityCandidate>> perArticle = new ArrayList<>(articles.size());
        Map<String, EntityCandidate> dimensionCandidates = new LinkedHashMap<>();
        RejectionLog rejections = new RejectionLog();

        for (int i = 0; i < articles.size(); i++) {
            List<EntityCandidate> entities = extract(articles.get(i), normalized.get(i), rejections);
            perArticle.add(entities);
            for (EntityCandidate entity : entities) {
                String key = EntityNames.normalize(entity.getDisplayName());
                if (!key.isEmpty()) {
                    dimensionCandidates.merge(key, entity, EntityExtractor::preferred);
                }
            }
        }

        return new BatchExtraction(perArticle, dimensionCandidates, rejections);
    }

    /**
     * Picks the better representation of one entity: higher confidence, then
     * the longer display name, then the lexically smaller one.
     */
    public static EntityCandidate preferred(EntityCandidate existing, EntityCandidate challenger) {
        int byConfidence = Double.compare(challenger.getConfidence(), existing.getConfidence());
        if (byConfidence != 0) {
            return byConfidence > 0 ? challenger : existing;
        }
        int byLength = Integer.compare(challenger.getDisplayName().length(), existing.getDisplayName().length());
        if (byLength != 0) {
            return byLength > 0 ? challenger : existing;
        }
        return challenger.getDisplayName().compareTo(existing.getDisplayName()) < 0 ? challenger : existing;
    }

    private void addCandidate(Map<String, EntityCandidate> found, String displayName, double confidence,
                              String fullText, RejectionLog rejections) {
        if (displayName.length() > DimEntity.MAX_NAME_LENGTH) {
            rejections.reject(displayName, RejectionLog.REASON_TOO_LONG);
            return;
        }
        String key = EntityNames.normalize(displayName);
        int mentions = countMentions(displayName, fullText);
        EntityCandidate existing = found.get(key);

        if (existing == null || confidence > existing.getConfidence()) {
            int mentionCount = existing == null ? mentions : Math.max(mentions, existing.getMentionCount());
            found.put(key, new EntityCandidate(displayName, classifyEntityType(displayName), confidence, mentionCount));
        } else {
            found.put(key, existing.withMentionCount(Math.max(existing.getMentionCount(), mentions)));
        }
    }

    List<String> extractFromHints(String keywordHints, RejectionLog rejections) {
        List<String> names = new ArrayList<>();
        if (keywordHints == null) {
            return names;
        }
        String hints = keywordHints.strip();
        if (hints.isEmpty() || "nan".equalsIgnoreCase(hints) || "none".equalsIgnoreCase(hints)) {
            return names;
        }

        for (String token : TagMatcher.HINT_DELIMITERS.split(hints)) {
            String keyword = token.strip();
            if (keyword.length() < 2) {
                continue;
            }
            String lower = keyword.toLowerCase(Locale.ROOT);
            if (containsFilterWord(lower)) {
                rejections.reject(keyword, RejectionLog.REASON_FILTERED_TERM);
            } else if (!isLikelyCompanyName(keyword)) {
                rejections.reject(keyword, RejectionLog.REASON_NOT_COMPANY);
            } else if (EntityNames.normalize(keyword).length() < 2) {
                rejections.reject(keyword, RejectionLog.REASON_TOO_SHORT);
            } else {
                names.add(keyword);
            }
        }
        return names;
    }

    /**
     * Scans lowercase normalized text for registry names and recovers the
     * surface form around the first hit.
     */
    List<String> extractKnownCompanies(String text) {
        List<String> names = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return names;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, Pattern[]> entry : knownNamePatterns.entrySet()) {
            if (!lower.contains(entry.getKey())) {
                continue;
            }
            Pattern[] patterns = entry.getValue();
            recoverSurfaceForm(lower, text, patterns[0], patterns[2])
                .or(() -> recoverSurfaceForm(lower, text, patterns[1], patterns[2]))
                .ifPresent(names::add);
        }
        return names;
    }

    private static Optional<String> recoverSurfaceForm(String lower, String text, Pattern hit, Pattern fullName) {
        Matcher matcher = hit.matcher(lower);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int start = Math.max(0, matcher.start() - CONTEXT_CHARS);
        int end = Math.min(text.length(), matcher.end() + CONTEXT_CHARS);
        Matcher surface = fullName.matcher(text.substring(start, end));
        if (!surface.find()) {
            return Optional.empty();
        }
        String displayName = EntityNames.titleCase(surface.group().strip());
        return EntityNames.normalize(displayName).isEmpty() ? Optional.empty() : Optional.of(displayName);
    }

    boolean isLikelyCompanyName(String text) {
        if (text == null || text.length() < 2) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT).strip();
        if (lower.length() < 2 || lower.length() > MAX_NAME_LENGTH) {
            return false;
        }
        if (containsFilterWord(lower)) {
            return false;
        }
        if (registry.mentionsKnownName(lower)) {
            return true;
        }
        if (EntityNames.hasCorporateSuffix(lower)) {
            return true;
        }

        String[] words = WHITESPACE.split(text.strip());
        boolean capitalised = Character.isUpperCase(words[0].charAt(0));
        if (words.length == 1) {
            return capitalised && text.length() <= MAX_TICKER_LENGTH;
        }
        return words.length <= 5 && capitalised;
    }

    static String classifyEntityType(String displayName) {
        String lower = displayName.toLowerCase(Locale.ROOT);
        for (String pattern : ORGANIZATION_PATTERNS) {
            if (lower.contains(pattern)) {
                return TYPE_ORGANIZATION;
            }
        }
        return TYPE_COMPANY;
    }

    /**
     * Whole-word, case-insensitive occurrences of the name, optionally
     * followed by a corporate suffix, in lowercase text.
     */
    int countMentions(String displayName, String lowercaseText) {
        if (displayName == null || lowercaseText == null || lowercaseText.isEmpty()) {
            return 0;
        }
        String name = displayName.toLowerCase(Locale.ROOT).strip();
        if (name.isEmpty()) {
            return 0;
        }
        Pattern pattern = Pattern.compile(
            "\\b" + Pattern.quote(name) + "(?:\\s+(?:" + EntityNames.TRAILING_SUFFIX_ALTERNATION + "))?\\b");

        int count = 0;
        Matcher matcher = pattern.matcher(lowercaseText);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static boolean containsFilterWord(String lower) {
        for (String word : FILTER_WORDS) {
            if (lower.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
