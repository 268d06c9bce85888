package edu.uconn.newscube.output;

import edu.uconn.newscube.config.NewsCubeProperties;
import edu.uconn.newscube.model.ArticleRecord;
import edu.uconn.newscube.model.EnrichedArticle;
import edu.uconn.newscube.model.EntityCandidate;
import edu.uconn.newscube.model.StarSchema;
import edu.uconn.newscube.model.TagDefinition;
import edu.uconn.newscube.model.TagMatch;
import edu.uconn.newscube.model.TagTaxonomy;
import edu.uconn.newscube.transform.RejectionLog;
import edu.uconn.newscube.transform.StarSchemaBuilder;

import java.util.List;

/**
 * Small star schemas for writer tests.
 */
final class StarSchemaFixtures {

    private static final TagTaxonomy TAXONOMY = new TagTaxonomy(List.of(
        TagDefinition.builder().name("acquisition").category("Event").domain("Business")
            .keyword("acquisition").build(),
        TagDefinition.builder().name("fda approval").category("Clinical").domain("Healthcare")
            .keyword("fda approval").build()));

    private StarSchemaFixtures() {
    }

    /**
     * Two documents, two sources, three entities and one rejected candidate.
     */
    static StarSchema twoDocuments() {
        List<EnrichedArticle> articles = List.of(
            new EnrichedArticle(
                ArticleRecord.builder()
                    .documentId("A1").date("2024-03-15").source("Fierce Biotech")
                    .headline("Pfizer to acquire Seagen, \"biggest deal\"").body("Line one\nline two")
                    .sentimentScore("0.45").qcStatus("Pass")
                    .build(),
                List.of(new TagMatch("acquisition", 0.9)),
                List.of(new EntityCandidate("Pfizer Inc", "Company", 1.0, 2),
                    new EntityCandidate("Seagen", "Company", 0.7, 1))),
            new EnrichedArticle(
                ArticleRecord.builder()
                    .documentId("A2").date("not-a-date").source("STAT News").headline("Reata wins")
                    .build(),
                List.of(new TagMatch("fda approval", 0.5)),
                List.of(new EntityCandidate("Reata Pharmaceuticals", "Company", 1.0, 1))));

        RejectionLog rejections = new RejectionLog();
        rejections.reject("Oncology", RejectionLog.REASON_FILTERED_TERM);

        return new StarSchemaBuilder(new NewsCubeProperties()).build(articles, TAXONOMY).toBuilder()
            .rejectedEntities(rejections.toReport())
            .build();
    }

    /**
     * A single untagged document.
     */
    static StarSchema oneDocument() {
        List<EnrichedArticle> articles = List.of(new EnrichedArticle(
            ArticleRecord.builder().documentId("B1").date("2024-04-01").source("Endpoints News")
                .headline("Quiet day").build(),
            List.of(),
            List.of()));
        return new StarSchemaBuilder(new NewsCubeProperties()).build(articles, TAXONOMY);
    }
}
