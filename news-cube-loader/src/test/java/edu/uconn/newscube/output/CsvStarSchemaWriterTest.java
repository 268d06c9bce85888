package edu.uconn.newscube.output;

import com.opencsv.CSVReader;
import edu.uconn.newscube.config.NewsCubeProperties;
import edu.uconn.newscube.exception.StarSchemaException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CsvStarSchemaWriter Unit Tests")
class CsvStarSchemaWriterTest {

    @TempDir
    Path tempDir;

    private CsvStarSchemaWriter writer(Path directory) {
        NewsCubeProperties properties = new NewsCubeProperties();
        properties.getOutput().setDirectory(directory.toString());
        return new CsvStarSchemaWriter(properties);
    }

    private static List<String[]> readCsv(Path file) throws Exception {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(in)) {
            return csv.readAll();
        }
    }

    @Test
    @DisplayName("Should write one file per table and remove the staging directory")
    void shouldWriteAllTables() throws Exception {
        // Given
        Path output = tempDir.resolve("star_schema");

        // When
        writer(output).write(StarSchemaFixtures.twoDocuments());

        // Then
        try (Stream<Path> files = Files.list(output)) {
            assertThat(files.map(path -> path.getFileName().toString()))
                .containsExactlyInAnyOrder(
                    CsvStarSchemaWriter.FACT_DOCUMENT, CsvStarSchemaWriter.DIM_TIME,
                    CsvStarSchemaWriter.DIM_SOURCE, CsvStarSchemaWriter.DIM_TAG,
                    CsvStarSchemaWriter.DIM_ENTITY, CsvStarSchemaWriter.BRIDGE_FACT_TAG,
                    CsvStarSchemaWriter.BRIDGE_FACT_ENTITY, CsvStarSchemaWriter.REJECTED_ENTITIES);
        }
    }

    @Test
    @DisplayName("Should write headers and rows that survive quoting")
    void shouldWriteReadableRows() throws Exception {
        // Given
        Path output = tempDir.resolve("out");

        // When
        writer(output).write(StarSchemaFixtures.twoDocuments());

        // Then
        List<String[]> facts = readCsv(output.resolve(CsvStarSchemaWriter.FACT_DOCUMENT));
        assertThat(facts).hasSize(3);
        assertThat(facts.get(0)).startsWith("Fact_ID", "Document_ID", "Date_Key", "Source_Key");
        assertThat(facts.get(1)).startsWith("1001", "A1", "20240315", "1");
        assertThat(facts.get(1)[10]).isEqualTo("Pfizer to acquire Seagen, \"biggest deal\"");
        assertThat(facts.get(1)[11]).isEqualTo("Line one\nline two");
        assertThat(facts.get(2)[2]).isEqualTo("19000101");
        assertThat(facts.get(2)[16]).isEmpty();

        List<String[]> tags = readCsv(output.resolve(CsvStarSchemaWriter.BRIDGE_FACT_TAG));
        assertThat(tags.get(0)).containsExactly("Fact_ID", "Tag_Key", "Confidence_Score");
        assertThat(tags.get(1)).containsExactly("1001", "10", "0.90");

        List<String[]> rejected = readCsv(output.resolve(CsvStarSchemaWriter.REJECTED_ENTITIES));
        assertThat(rejected.get(1)).containsExactly("Oncology", "1", "Contains filtered medical or clinical term");
    }

    @Test
    @DisplayName("Should replace the files of a previous run")
    void shouldReplacePreviousFiles() throws Exception {
        // Given
        CsvStarSchemaWriter writer = writer(tempDir);
        writer.write(StarSchemaFixtures.twoDocuments());

        // When
        writer.write(StarSchemaFixtures.oneDocument());

        // Then
        assertThat(readCsv(tempDir.resolve(CsvStarSchemaWriter.FACT_DOCUMENT))).hasSize(2);
        assertThat(readCsv(tempDir.resolve(CsvStarSchemaWriter.DIM_ENTITY))).hasSize(1);
        assertThat(readCsv(tempDir.resolve(CsvStarSchemaWriter.REJECTED_ENTITIES))).hasSize(1);
    }

    @Test
    @DisplayName("Should fail when the output location is not a directory")
    void shouldFailForUnusableDirectory() throws Exception {
        // Given
        Path file = Files.writeString(tempDir.resolve("blocked"), "not a directory");

        // When / Then
        assertThatThrownBy(() -> writer(file).write(StarSchemaFixtures.oneDocument()))
            .isInstanceOf(StarSchemaException.class)
            .hasMessageContaining("blocked");
    }
}
