package edu.uconn.newscube.output;

import edu.uconn.newscube.config.NewsCubeProperties;
import edu.uconn.newscube.entity.FactDocument;
import edu.uconn.newscube.entity.RejectedEntity;
import edu.uconn.newscube.model.ArticleRecord;
import edu.uconn.newscube.model.RegistryEntry;
import edu.uconn.newscube.model.StarSchema;
import edu.uconn.newscube.model.TagTaxonomy;
import edu.uconn.newscube.repository.BridgeFactEntityRepository;
import edu.uconn.newscube.repository.BridgeFactTagRepository;
import edu.uconn.newscube.repository.DimEntityRepository;
import edu.uconn.newscube.repository.DimSourceRepository;
import edu.uconn.newscube.repository.DimTagRepository;
import edu.uconn.newscube.repository.DimTimeRepository;
import edu.uconn.newscube.repository.FactDocumentRepository;
import edu.uconn.newscube.repository.RejectedEntityRepository;
import edu.uconn.newscube.transform.BatchProcessor;
import edu.uconn.newscube.transform.CompanyRegistry;
import edu.uconn.newscube.transform.EntityExtractor;
import edu.uconn.newscube.transform.StarSchemaBuilder;
import edu.uconn.newscube.transform.TagMatcher;
import edu.uconn.newscube.transform.TextNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.batch.item.support.ListItemReader;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for JpaStarSchemaWriter against in-memory H2.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import(JpaStarSchemaWriter.class)
@DisplayName("JpaStarSchemaWriter Tests")
class JpaStarSchemaWriterTest {

    @Autowired
    private JpaStarSchemaWriter writer;

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private FactDocumentRepository factDocumentRepository;

    @Autowired
    private DimTimeRepository dimTimeRepository;

    @Autowired
    private DimSourceRepository dimSourceRepository;

    @Autowired
    private DimTagRepository dimTagRepository;

    @Autowired
    private DimEntityRepository dimEntityRepository;

    @Autowired
    private BridgeFactTagRepository bridgeFactTagRepository;

    @Autowired
    private BridgeFactEntityRepository bridgeFactEntityRepository;

    @Autowired
    private RejectedEntityRepository rejectedEntityRepository;

    @Test
    @DisplayName("Should persist every star schema table")
    void shouldPersistAllTables() {
        // When
        writer.write(StarSchemaFixtures.twoDocuments());
        entityManager.flush();
        entityManager.clear();

        // Then
        assertThat(factDocumentRepository.count()).isEqualTo(2);
        assertThat(dimTimeRepository.count()).isEqualTo(2);
        assertThat(dimSourceRepository.count()).isEqualTo(2);
        assertThat(dimTagRepository.count()).isEqualTo(2);
        assertThat(dimEntityRepository.count()).isEqualTo(3);
        assertThat(bridgeFactTagRepository.count()).isEqualTo(2);
        assertThat(bridgeFactEntityRepository.count()).isEqualTo(3);
        assertThat(rejectedEntityRepository.count()).isEqualTo(1);

        Optional<FactDocument> first = factDocumentRepository.findByDocumentId("A1");
        assertThat(first).isPresent();
        assertThat(first.get().getFactId()).isEqualTo(1001L);
        assertThat(first.get().getHasKeyEvent()).isEqualTo("Yes");
        assertThat(first.get().getLoadedAt()).isNotNull();
    }

    @Test
    @DisplayName("Should replace the previous load instead of appending to it")
    void shouldReplacePreviousLoad() {
        // Given
        writer.write(StarSchemaFixtures.twoDocuments());
        entityManager.flush();
        entityManager.clear();

        // When
        writer.write(StarSchemaFixtures.oneDocument());
        entityManager.flush();
        entityManager.clear();

        // Then
        assertThat(factDocumentRepository.findAll())
            .extracting(FactDocument::getDocumentId)
            .containsExactly("B1");
        assertThat(dimEntityRepository.count()).isZero();
        assertThat(bridgeFactTagRepository.count()).isZero();
        assertThat(bridgeFactEntityRepository.count()).isZero();
        assertThat(rejectedEntityRepository.count()).isZero();
        assertThat(dimSourceRepository.findBySourceName("Endpoints News")).isPresent();
    }

    @Test
    @DisplayName("Should persist a schema built from over-long input cells")
    void shouldPersistOverLongInputValues() throws Exception {
        // Given
        String misalignedHint = "word ".repeat(120);
        String longId = "x".repeat(150);
        String longRegistryName = "Acme " + "Z".repeat(250);
        TagTaxonomy taxonomy = new TagTaxonomy(List.of());
        BatchProcessor processor = new BatchProcessor(new TextNormalizer(), new TagMatcher(taxonomy),
            new EntityExtractor(CompanyRegistry.of(List.of(new RegistryEntry(longRegistryName, "Company")))),
            new StarSchemaBuilder(new NewsCubeProperties()), taxonomy, 2);
        StarSchema schema = processor.run(new ListItemReader<>(List.of(
            ArticleRecord.builder()
                .documentId(longId).date("2024-03-15").source("STAT News")
                .headline("Markets").body("Shares rose. " + longRegistryName.toLowerCase())
                .keywordHints(misalignedHint).qcStatus("q".repeat(80))
                .build())));

        // When
        writer.write(schema);
        entityManager.flush();
        entityManager.clear();

        // Then
        assertThat(factDocumentRepository.findAll())
            .extracting(FactDocument::getDocumentId, FactDocument::getQcStatus)
            .containsExactly(tuple("doc_0", "q".repeat(80)));
        assertThat(dimEntityRepository.count()).isZero();
        assertThat(rejectedEntityRepository.findAll())
            .singleElement()
            .satisfies(rejected -> {
                assertThat(rejected.getRejectedEntity()).hasSizeLessThanOrEqualTo(RejectedEntity.MAX_NAME_LENGTH);
                assertThat(rejected.getRejectedEntity()).startsWith("word word");
                assertThat(rejected.getOccurrenceCount()).isEqualTo(1);
            });
    }
}
