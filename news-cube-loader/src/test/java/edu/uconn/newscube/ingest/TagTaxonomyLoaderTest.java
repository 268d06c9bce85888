package edu.uconn.newscube.ingest;

import edu.uconn.newscube.model.TagDefinition;
import edu.uconn.newscube.model.TagTaxonomy;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TagTaxonomyLoader Unit Tests")
class TagTaxonomyLoaderTest {

    private final TagTaxonomyLoader loader = new TagTaxonomyLoader();

    private static TagDefinition tag(TagTaxonomy taxonomy, String name) {
        return taxonomy.getDefinitions().stream()
            .filter(definition -> definition.getName().equals(name))
            .findFirst()
            .orElseThrow();
    }

    @Test
    @DisplayName("Should load tags from CSV in sheet order and split individually flagged rows")
    void shouldLoadCsvTaxonomy() {
        // When
        TagTaxonomy taxonomy = loader.load(new ClassPathResource("fixtures/taxonomy.csv"));

        // Then
        assertThat(taxonomy.getDefinitions())
            .extracting(TagDefinition::getName)
            .containsExactly("acquisition", "partnership", "fda approval", "oncology",
                "series a", "seed funding", "seriesa", "a round");
        assertThat(tag(taxonomy, "seriesa").getKeywords()).containsExactly("seriesa");
        assertThat(tag(taxonomy, "seriesa").getCategory()).isEqualTo("Event");
    }

    @Test
    @DisplayName("Should add sheet keywords and built-in variations")
    void shouldCollectKeywords() {
        TagTaxonomy taxonomy = loader.load(new ClassPathResource("fixtures/taxonomy.csv"));

        TagDefinition acquisition = tag(taxonomy, "acquisition");
        assertThat(acquisition.getKeywords()).startsWith("acquisition", "takeover").contains("acquire", "purchased");
        assertThat(acquisition.getCategory()).isEqualTo("Event");
        assertThat(acquisition.getDomain()).isEqualTo("Business");
        assertThat(tag(taxonomy, "fda approval").getCategory()).isEqualTo("Clinical");
    }

    @Test
    @DisplayName("Should give therapy tags the general keywords")
    void shouldAddGeneralKeywordsToTherapyTags() {
        TagTaxonomy taxonomy = loader.load(new ClassPathResource("fixtures/taxonomy.csv"));

        TagDefinition oncology = tag(taxonomy, "oncology");
        assertThat(oncology.getKeywords()).containsExactly("oncology", "cancer", "tumor");
        assertThat(oncology.getCategory()).isEqualTo("Therapy");
        assertThat(tag(taxonomy, "partnership").getKeywords()).doesNotContain("cancer");
    }

    @Test
    @DisplayName("Should read the first sheet of an Excel workbook")
    void shouldLoadWorkbook(@TempDir Path tempDir) throws Exception {
        // Given
        Path file = tempDir.resolve("tags.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet("Tags");
            writeRow(sheet, 0, List.of("Group", "Notes", "Individually", "Tag", "Keyword 1"));
            writeRow(sheet, 1, List.of("Deals", "", "", "Merger", "combination"));
            workbook.write(out);
        }

        // When
        TagTaxonomy taxonomy = loader.load(new FileSystemResource(file));

        // Then
        assertThat(taxonomy.size()).isEqualTo(1);
        TagDefinition merger = taxonomy.getDefinitions().get(0);
        assertThat(merger.getName()).isEqualTo("Merger");
        assertThat(merger.getKeywords()).contains("merger", "combination", "merged");
        assertThat(merger.getCategory()).isEqualTo("Event");
    }

    private static void writeRow(Sheet sheet, int index, List<String> values) {
        Row row = sheet.createRow(index);
        for (int i = 0; i < values.size(); i++) {
            row.createCell(i).setCellValue(values.get(i));
        }
    }

    @Test
    @DisplayName("Should return an empty taxonomy when the file is missing")
    void shouldHandleMissingFile(@TempDir Path tempDir) {
        assertThat(loader.load(new FileSystemResource(tempDir.resolve("absent.xlsx"))).isEmpty()).isTrue();
        assertThat(loader.load(null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should fall back to pattern-based variations")
    void shouldDeriveVariations() {
        assertThat(TagTaxonomyLoader.keywordVariations("Fda Approval")).contains("fda", "approved");
        assertThat(TagTaxonomyLoader.keywordVariations("Biotech Deal"))
            .containsExactly("agreement", "transaction", "contract");
        assertThat(TagTaxonomyLoader.keywordVariations("Series B"))
            .containsExactly("series b", "seriesb", "b round");
        assertThat(TagTaxonomyLoader.keywordVariations("Non-Dilutive Funding"))
            .containsExactly("dilutive financing", "non-dilutive financing");
        assertThat(TagTaxonomyLoader.keywordVariations("platform shift")).isEmpty();
    }
}
