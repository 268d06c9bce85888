package edu.uconn.newscube.transform;

import edu.uconn.newscube.config.NewsCubeProperties;
import edu.uconn.newscube.entity.BridgeFactEntity;
import edu.uconn.newscube.entity.BridgeFactTag;
import edu.uconn.newscube.entity.DimEntity;
import edu.uconn.newscube.entity.DimSource;
import edu.uconn.newscube.entity.DimTag;
import edu.uconn.newscube.entity.DimTime;
import edu.uconn.newscube.entity.FactDocument;
import edu.uconn.newscube.model.ArticleRecord;
import edu.uconn.newscube.model.EnrichedArticle;
import edu.uconn.newscube.model.EntityCandidate;
import edu.uconn.newscube.model.PrebuiltDimensions;
import edu.uconn.newscube.model.StarSchema;
import edu.uconn.newscube.model.TagDefinition;
import edu.uconn.newscube.model.TagMatch;
import edu.uconn.newscube.model.TagTaxonomy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Assembles the seven star schema tables from enriched articles.
 *
 * <p>Surrogate keys are assigned over sorted, deduplicated members so the
 * same input always yields the same keys. Dimensions can be supplied
 * pre-built from scan-phase accumulators or derived here from the articles;
 * both paths apply the same identity rules.
 */
@Slf4j
@Component
public class StarSchemaBuilder {

    public static final int FIRST_SOURCE_KEY = 1;
    public static final int FIRST_TAG_KEY = 10;
    public static final int FIRST_ENTITY_KEY = 200;
    public static final long FIRST_FACT_ID = 1001L;

    private static final int UNRESOLVED_SAMPLE_SIZE = 10;

    private final String entityDomain;

    public StarSchemaBuilder(NewsCubeProperties properties) {
        this.entityDomain = properties.getEntityDomain();
    }

    /**
     * Builds every table, deriving the time, source and entity dimensions
     * from the articles themselves.
     */
    public StarSchema build(List<EnrichedArticle> articles, TagTaxonomy taxonomy) {
        List<Integer> dateKeys = articles.stream()
            .map(enriched -> CalendarDates.dateKeyOf(enriched.getArticle().getDate()))
            .collect(Collectors.toList());
        List<String> sources = articles.stream()
            .map(enriched -> enriched.getArticle().getSource())
            .collect(Collectors.toList());
        List<EntityCandidate> entities = articles.stream()
            .flatMap(enriched -> enriched.getEntities().stream())
            .collect(Collectors.toList());

        PrebuiltDimensions dimensions = new PrebuiltDimensions(
            buildDimTime(dateKeys), buildDimSource(sources), buildDimEntity(entities));
        return build(articles, taxonomy, dimensions);
    }

    public StarSchema build(List<EnrichedArticle> articles, TagTaxonomy taxonomy, PrebuiltDimensions dimensions) {
        log.info("Building star schema for {} articles", articles.size());

        List<DimTag> dimTag = buildDimTag(taxonomy);
        List<FactDocument> facts = buildFactDocuments(articles, dimensions.getDimTime(), dimensions.getDimSource());

        Map<String, Integer> tagKeys = new HashMap<>();
        dimTag.forEach(tag -> tagKeys.putIfAbsent(tag.getTagName(), tag.getTagKey()));

        List<BridgeFactTag> bridgeFactTag = new ArrayList<>();
        int unresolvedTags = 0;
        for (int i = 0; i < articles.size(); i++) {
            Long factId = facts.get(i).getFactId();
            for (TagMatch match : articles.get(i).getTags()) {
                Integer tagKey = tagKeys.get(match.getTagName());
                if (tagKey == null) {
                    unresolvedTags++;
                    continue;
                }
                bridgeFactTag.add(BridgeFactTag.builder()
                    .factId(factId)
                    .tagKey(tagKey)
                    .confidenceScore(BigDecimal.valueOf(match.getConfidence()).setScale(2, RoundingMode.HALF_UP))
                    .build());
            }
        }
        if (unresolvedTags > 0) {
            log.warn("{} tag matches had no Dim_Tag row and were skipped", unresolvedTags);
        }

        Set<String> unresolvedEntities = new TreeSet<>();
        List<BridgeFactEntity> bridgeFactEntity =
            buildBridgeFactEntity(articles, facts, dimensions.getDimEntity(), unresolvedEntities);

        applyAggregates(facts, bridgeFactTag);

        StarSchema schema = StarSchema.builder()
            .factDocuments(facts)
            .dimTime(dimensions.getDimTime())
            .dimSource(dimensions.getDimSource())
            .dimTag(dimTag)
            .dimEntity(dimensions.getDimEntity())
            .bridgeFactTag(bridgeFactTag)
            .bridgeFactEntity(bridgeFactEntity)
            .unresolvedEntities(unresolvedEntities)
            .unresolvedTagCount(unresolvedTags)
            .build();

        log.info("Star schema built: {} facts, {} dates, {} sources, {} tags, {} entities, "
                + "{} tag relationships, {} entity relationships",
            facts.size(), schema.getDimTime().size(), schema.getDimSource().size(), dimTag.size(),
            schema.getDimEntity().size(), bridgeFactTag.size(), bridgeFactEntity.size());
        return schema;
    }

    /**
     * One row per distinct date key, ascending. The sentinel key yields the
     * 1900-01-01 row.
     */
    public List<DimTime> buildDimTime(Collection<Integer> dateKeys) {
        return new TreeSet<>(dateKeys).stream()
            .map(CalendarDates::fromDateKey)
            .map(CalendarDates::toDimTime)
            .collect(Collectors.toList());
    }

    /**
     * Valid, trimmed, distinct source names in natural order, keyed from 1.
     */
    public List<DimSource> buildDimSource(Collection<String> sourceNames) {
        Set<String> valid = sourceNames.stream()
            .filter(SourceNames::isValid)
            .map(String::strip)
            .collect(Collectors.toCollection(TreeSet::new));

        List<DimSource> rows = new ArrayList<>(valid.size());
        int key = FIRST_SOURCE_KEY;
        for (String name : valid) {
            rows.add(DimSource.builder()
                .sourceKey(key++)
                .sourceName(name)
                .sourceType(SourceNames.classify(name))
                .build());
        }
        return rows;
    }

    /**
     * Taxonomy order, keyed from 10.
     */
    public List<DimTag> buildDimTag(TagTaxonomy taxonomy) {
        List<DimTag> rows = new ArrayList<>(taxonomy.size());
        int key = FIRST_TAG_KEY;
        for (TagDefinition definition : taxonomy.getDefinitions()) {
            rows.add(DimTag.builder()
                .tagKey(key++)
                .tagName(definition.getName())
                .tagCategory(definition.getCategory())
                .tagDomain(definition.getDomain())
                .build());
        }
        return rows;
    }

    /**
     * One row per normalized identity, sorted by display name then type,
     * keyed from 200.
     */
    public List<DimEntity> buildDimEntity(Collection<EntityCandidate> candidates) {
        Map<String, EntityCandidate> byIdentity = new HashMap<>();
        for (EntityCandidate candidate : candidates) {
            String identity = EntityNames.normalize(candidate.getDisplayName());
            if (!identity.isEmpty()) {
                byIdentity.merge(identity, candidate, EntityExtractor::preferred);
            }
        }

        List<EntityCandidate> sorted = new ArrayList<>(byIdentity.values());
        sorted.sort(Comparator.comparing(EntityCandidate::getDisplayName)
            .thenComparing(EntityCandidate::getEntityType));

        List<DimEntity> rows = new ArrayList<>(sorted.size());
        int key = FIRST_ENTITY_KEY;
        for (EntityCandidate candidate : sorted) {
            rows.add(DimEntity.builder()
                .entityKey(key++)
                .entityName(candidate.getDisplayName())
                .entityType(candidate.getEntityType())
                .entityDomain(entityDomain)
                .build());
        }
        return rows;
    }

    List<FactDocument> buildFactDocuments(List<EnrichedArticle> articles, List<DimTime> dimTime,
                                          List<DimSource> dimSource) {
        Map<Integer, DimTime> timeByKey = new HashMap<>();
        dimTime.forEach(row -> timeByKey.put(row.getDateKey(), row));
        Map<String, DimSource> sourceByName = new HashMap<>();
        dimSource.forEach(row -> sourceByName.put(row.getSourceName(), row));

        List<FactDocument> facts = new ArrayList<>(articles.size());
        for (int i = 0; i < articles.size(); i++) {
            ArticleRecord article = articles.get(i).getArticle();
            long factId = FIRST_FACT_ID + i;

            int dateKey = CalendarDates.dateKeyOf(article.getDate());
            DimTime time = timeByKey.computeIfAbsent(dateKey,
                key -> CalendarDates.toDimTime(CalendarDates.fromDateKey(key)));

            String rawSource = article.getSource() == null ? SourceNames.TYPE_UNKNOWN : article.getSource().strip();
            DimSource source = sourceByName.get(rawSource);

            facts.add(FactDocument.builder()
                .factId(factId)
                .documentId(documentId(article, i))
                .dateKey(dateKey)
                .sourceKey(source == null ? FIRST_SOURCE_KEY : source.getSourceKey())
                .year(time.getYear())
                .quarter(time.getQuarter())
                .month(time.getMonth())
                .dateString(time.getDateString())
                .sourceName(source == null ? rawSource : source.getSourceName())
                .sourceType(source == null ? SourceNames.TYPE_UNKNOWN : source.getSourceType())
                .headline(clean(article.getHeadline()))
                .bodyText(clean(article.getBody()))
                .newsLink(clean(article.getNewsLink()))
                .cleanedText(clean(article.getCleanedText()))
                .consolidatedText(clean(article.getConsolidatedText()))
                .matchedKeywords(clean(article.getKeywordHints()))
                .sentimentScore(parseSentiment(article.getSentimentScore()))
                .qcStatus(clean(article.getQcStatus()))
                .build());
        }
        return facts;
    }

    private List<BridgeFactEntity> buildBridgeFactEntity(List<EnrichedArticle> articles, List<FactDocument> facts,
                                                         List<DimEntity> dimEntity, Set<String> unresolved) {
        EntityKeyResolver resolver = new EntityKeyResolver(dimEntity);
        List<BridgeFactEntity> rows = new ArrayList<>();
        int misses = 0;

        for (int i = 0; i < articles.size(); i++) {
            Long factId = facts.get(i).getFactId();
            Map<Integer, BridgeFactEntity> byEntityKey = new LinkedHashMap<>();

            for (EntityCandidate candidate : articles.get(i).getEntities()) {
                Integer entityKey = resolver.resolve(candidate.getDisplayName()).orElse(null);
                if (entityKey == null) {
                    misses++;
                    unresolved.add(candidate.getDisplayName());
                    continue;
                }
                BridgeFactEntity existing = byEntityKey.get(entityKey);
                if (existing == null) {
                    byEntityKey.put(entityKey, BridgeFactEntity.builder()
                        .factId(factId)
                        .entityKey(entityKey)
                        .mentionCount(candidate.getMentionCount())
                        .build());
                } else {
                    existing.setMentionCount(Math.max(existing.getMentionCount(), candidate.getMentionCount()));
                }
            }
            rows.addAll(byEntityKey.values());
        }

        if (misses > 0) {
            List<String> sample = unresolved.stream().limit(UNRESOLVED_SAMPLE_SIZE).collect(Collectors.toList());
            log.warn("{} entity mentions ({} distinct names) could not be resolved to Dim_Entity, e.g. {}",
                misses, unresolved.size(), sample);
        }
        return rows;
    }

    private static void applyAggregates(List<FactDocument> facts, List<BridgeFactTag> bridgeFactTag) {
        Map<Long, Integer> tagCounts = new TreeMap<>();
        bridgeFactTag.forEach(row -> tagCounts.merge(row.getFactId(), 1, Integer::sum));

        for (FactDocument fact : facts) {
            int tagCount = tagCounts.getOrDefault(fact.getFactId(), 0);
            fact.setTagCount(tagCount);
            fact.setHasKeyEvent(tagCount > 0 ? FactDocument.KEY_EVENT_YES : FactDocument.KEY_EVENT_NO);
        }
    }

    private static String documentId(ArticleRecord article, int index) {
        String id = clean(article.getDocumentId());
        if (id.length() > FactDocument.MAX_DOCUMENT_ID_LENGTH) {
            log.warn("Document id of {} characters at row {} is replaced by doc_{}", id.length(), index, index);
            return "doc_" + index;
        }
        return id.isEmpty() ? "doc_" + index : id;
    }

    /**
     * Trims pass-through text; null and the literals "nan" and "none" become empty.
     */
    static String clean(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return "nan".equals(lower) || "none".equals(lower) ? "" : trimmed;
    }

    static Double parseSentiment(String value) {
        String text = clean(value);
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric sentiment score '{}'", text);
            return null;
        }
    }
}
