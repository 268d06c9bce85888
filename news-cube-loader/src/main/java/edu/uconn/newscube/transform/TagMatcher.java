package edu.uconn.newscube.transform;

import edu.uconn.newscube.model.ArticleRecord;
import edu.uconn.newscube.model.NormalizedText;
import edu.uconn.newscube.model.TagDefinition;
import edu.uconn.newscube.model.TagMatch;
import edu.uconn.newscube.model.TagTaxonomy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches articles to taxonomy tags using two independent strategies: the
 * upstream keyword-hint column and a whole-word search of the normalized
 * text. The highest confidence per tag wins.
 */
@Slf4j
@Component
public class TagMatcher {

    static final double HINT_CONFIDENCE = 0.9;

    static final Pattern HINT_DELIMITERS = Pattern.compile("[;,|]");

    private static final int HEADLINE_TOKENS = 20;
    private static final int SUBSTANTIAL_TEXT_TOKENS = 10;
    private static final List<String> MEDICAL_TERMS = List.of("cancer", "therapy", "treatment", "drug", "clinical");

    private final Map<String, TagDefinition> definitionsByName = new LinkedHashMap<>();
    private final Map<String, Pattern> patternsByTag = new LinkedHashMap<>();
    private final Map<String, List<String>> tagsByKeyword = new HashMap<>();

    public TagMatcher(TagTaxonomy taxonomy) {
        for (TagDefinition definition : taxonomy.getDefinitions()) {
            String tagName = definition.getName();
            definitionsByName.putIfAbsent(tagName, definition);

            Set<String> keywords = new LinkedHashSet<>();
            keywords.add(tagName.toLowerCase(Locale.ROOT).strip());
            for (String keyword : definition.getKeywords()) {
                keywords.add(keyword.toLowerCase(Locale.ROOT).strip());
            }
            keywords.remove("");

            for (String keyword : keywords) {
                List<String> owners = tagsByKeyword.computeIfAbsent(keyword, k -> new ArrayList<>());
                if (!owners.contains(tagName)) {
                    owners.add(tagName);
                }
            }

            if (!patternsByTag.containsKey(tagName)) {
                patternsByTag.put(tagName, compileKeywordPattern(keywords));
            }
        }
        log.info("Initialized TagMatcher with {} tag patterns and {} indexed keywords",
            patternsByTag.size(), tagsByKeyword.size());
    }

    /**
     * Longer phrases are tried first so "phase 3" wins over "phase".
     */
    private static Pattern compileKeywordPattern(Set<String> keywords) {
        String alternation = keywords.stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * @return matched tags ordered by descending confidence, then tag name
     */
    public List<TagMatch> match(ArticleRecord article, NormalizedText normalized) {
        Map<String, Double> confidences = new HashMap<>();

        for (String tagName : matchHints(article.getKeywordHints())) {
            confidences.merge(tagName, HINT_CONFIDENCE, Math::max);
        }
        searchText(normalized.getCombined()).forEach((tagName, confidence) ->
            confidences.merge(tagName, confidence, Math::max));

        return confidences.entrySet().stream()
            .map(entry -> new TagMatch(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparingDouble(TagMatch::getConfidence).reversed()
                .thenComparing(TagMatch::getTagName))
            .collect(Collectors.toList());
    }

    Set<String> matchHints(String keywordHints) {
        Set<String> matched = new LinkedHashSet<>();
        if (keywordHints == null || keywordHints.isBlank() || "nan".equalsIgnoreCase(keywordHints.strip())) {
            return matched;
        }
        for (String token : HINT_DELIMITERS.split(keywordHints)) {
            String keyword = token.strip().toLowerCase(Locale.ROOT);
            if (keyword.isEmpty()) {
                continue;
            }
            List<String> owners = tagsByKeyword.get(keyword);
            if (owners != null) {
                matched.addAll(owners);
            }
        }
        return matched;
    }

    Map<String, Double> searchText(String searchText) {
        Map<String, Double> matched = new LinkedHashMap<>();
        if (searchText == null || searchText.isEmpty()) {
            return matched;
        }

        for (Map.Entry<String, Pattern> entry : patternsByTag.entrySet()) {
            Set<String> uniqueMatches = new LinkedHashSet<>();
            Matcher matcher = entry.getValue().matcher(searchText);
            while (matcher.find()) {
                uniqueMatches.add(matcher.group().toLowerCase(Locale.ROOT));
            }
            if (!uniqueMatches.isEmpty()) {
                matched.put(entry.getKey(), calculateConfidence(entry.getKey(), uniqueMatches, searchText));
            }
        }
        return matched;
    }

    double calculateConfidence(String tagName, Set<String> uniqueMatches, String searchText) {
        int unique = uniqueMatches.size();
        double confidence = Math.min(0.8, 0.4 + unique * 0.1);

        String[] tokens = searchText.split(" ");
        if (tokens.length > SUBSTANTIAL_TEXT_TOKENS) {
            String headline = " " + String.join(" ", List.of(tokens).subList(0, Math.min(HEADLINE_TOKENS, tokens.length))) + " ";
            boolean inHeadline = uniqueMatches.stream().anyMatch(keyword -> headline.contains(" " + keyword + " "));
            if (inHeadline) {
                confidence = Math.min(1.0, confidence + 0.2);
            }
        }

        TagDefinition definition = definitionsByName.get(tagName);
        if (definition != null) {
            if ("Event".equals(definition.getCategory()) && unique > 1) {
                confidence = Math.min(1.0, confidence + 0.1);
            }
            if ("Therapy".equals(definition.getCategory())
                && MEDICAL_TERMS.stream().anyMatch(searchText::contains)) {
                confidence = Math.min(1.0, confidence + 0.1);
            }
        }

        return Math.round(confidence * 100.0) / 100.0;
    }
}
