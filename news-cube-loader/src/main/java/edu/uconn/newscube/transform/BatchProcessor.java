package edu.uconn.newscube.transform;

import edu.uconn.newscube.exception.StarSchemaException;
import edu.uconn.newscube.model.ArticleRecord;
import edu.uconn.newscube.model.EnrichedArticle;
import edu.uconn.newscube.model.EntityCandidate;
import edu.uconn.newscube.model.NormalizedText;
import edu.uconn.newscube.model.PrebuiltDimensions;
import edu.uconn.newscube.model.StarSchema;
import edu.uconn.newscube.model.TagTaxonomy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemReader;
import org.springframework.batch.item.ItemStream;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Streams articles through normalization, tag matching and entity
 * extraction one batch at a time, accumulating the distinct dates, sources
 * and entities seen so far. {@link #finalizeSchema()} then assigns keys over
 * the complete sets, so the output does not depend on the batch size.
 *
 * <p>One instance serves exactly one run.
 */
@Slf4j
public class BatchProcessor {

    public enum Phase {
        SCANNING,
        FINALIZED
    }

    private final TextNormalizer normalizer;
    private final TagMatcher tagMatcher;
    private final EntityExtractor entityExtractor;
    private final StarSchemaBuilder schemaBuilder;
    private final TagTaxonomy taxonomy;
    private final int batchSize;

    private final List<EnrichedArticle> processed = new ArrayList<>();
    private final Set<Integer> dateKeys = new TreeSet<>();
    private final Set<String> sourceNames = new TreeSet<>();
    private final Map<String, EntityCandidate> entities = new HashMap<>();
    private final RejectionLog rejections = new RejectionLog();

    private Phase phase = Phase.SCANNING;
    private int batchCount;

    public BatchProcessor(TextNormalizer normalizer, TagMatcher tagMatcher, EntityExtractor entityExtractor,
                          StarSchemaBuilder schemaBuilder, TagTaxonomy taxonomy, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive, was " + batchSize);
        }
        this.normalizer = normalizer;
        this.tagMatcher = tagMatcher;
        this.entityExtractor = entityExtractor;
        this.schemaBuilder = schemaBuilder;
        this.taxonomy = taxonomy;
        this.batchSize = batchSize;
    }

    /**
     * Enriches one batch and merges its dimension members into the accumulators.
     *
     * @throws IllegalStateException if the schema has already been finalized
     */
    public void processBatch(List<? extends ArticleRecord> batch) {
        if (phase != Phase.SCANNING) {
            throw new IllegalStateException("Cannot process a batch after the star schema was finalized");
        }
        batchCount++;

        List<NormalizedText> normalized = batch.stream()
            .map(normalizer::normalize)
            .collect(Collectors.toList());
        BatchExtraction extraction = entityExtractor.batchExtract(batch, normalized);

        for (int i = 0; i < batch.size(); i++) {
            ArticleRecord article = batch.get(i);
            processed.add(new EnrichedArticle(article,
                tagMatcher.match(article, normalized.get(i)),
                extraction.getPerArticle().get(i)));

            dateKeys.add(CalendarDates.dateKeyOf(article.getDate()));
            if (SourceNames.isValid(article.getSource())) {
                sourceNames.add(article.getSource().strip());
            }
        }
        extraction.getDimensionCandidates().forEach((identity, candidate) ->
            entities.merge(identity, candidate, EntityExtractor::preferred));
        rejections.mergeFrom(extraction.getRejections());

        log.info("Processed batch {}: {} articles ({} total), {} dates, {} sources, {} entities accumulated",
            batchCount, batch.size(), processed.size(), dateKeys.size(), sourceNames.size(), entities.size());
    }

    /**
     * Builds the dimensions from the accumulators and assembles the star schema.
     *
     * @throws IllegalStateException if called twice
     * @throws StarSchemaException if no article was processed
     */
    public StarSchema finalizeSchema() {
        if (phase != Phase.SCANNING) {
            throw new IllegalStateException("Star schema was already finalized");
        }
        phase = Phase.FINALIZED;

        if (processed.isEmpty()) {
            throw new StarSchemaException("No articles were read; refusing to build an empty star schema");
        }

        log.info("Finalizing star schema from {} articles in {} batches", processed.size(), batchCount);
        PrebuiltDimensions dimensions = new PrebuiltDimensions(
            schemaBuilder.buildDimTime(dateKeys),
            schemaBuilder.buildDimSource(sourceNames),
            schemaBuilder.buildDimEntity(entities.values()));

        StarSchema schema = schemaBuilder.build(processed, taxonomy, dimensions);
        if (!rejections.isEmpty()) {
            log.info("{} distinct entity candidates were rejected", rejections.size());
        }
        return schema.toBuilder()
            .rejectedEntities(rejections.toReport())
            .build();
    }

    /**
     * Reads every item in chunks of the configured batch size, then finalizes.
     * Readers that are also {@link ItemStream}s are opened and closed here.
     */
    public StarSchema run(ItemReader<? extends ArticleRecord> reader) throws Exception {
        ItemStream stream = reader instanceof ItemStream ? (ItemStream) reader : null;
        if (stream != null) {
            stream.open(new ExecutionContext());
        }
        try {
            List<ArticleRecord> chunk = new ArrayList<>(batchSize);
            ArticleRecord item;
            while ((item = reader.read()) != null) {
                chunk.add(item);
                if (chunk.size() == batchSize) {
                    processBatch(chunk);
                    chunk = new ArrayList<>(batchSize);
                }
            }
            if (!chunk.isEmpty()) {
                processBatch(chunk);
            }
        } finally {
            if (stream != null) {
                stream.close();
            }
        }
        return finalizeSchema();
    }

    public Phase getPhase() {
        return phase;
    }

    public int getProcessedCount() {
        return processed.size();
    }
}
