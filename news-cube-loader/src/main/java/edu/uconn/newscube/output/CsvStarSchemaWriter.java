package edu.uconn.newscube.output;

import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import edu.uconn.newscube.config.NewsCubeProperties;
import edu.uconn.newscube.entity.BridgeFactEntity;
import edu.uconn.newscube.entity.BridgeFactTag;
import edu.uconn.newscube.entity.DimEntity;
import edu.uconn.newscube.entity.DimSource;
import edu.uconn.newscube.entity.DimTag;
import edu.uconn.newscube.entity.DimTime;
import edu.uconn.newscube.entity.FactDocument;
import edu.uconn.newscube.entity.RejectedEntity;
import edu.uconn.newscube.exception.StarSchemaException;
import edu.uconn.newscube.model.StarSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes each table to {@code <Table_Name>.csv} in the output directory.
 * Files are first written to a staging directory and only moved into place
 * once all of them were written.
 */
@Slf4j
@Component
@Order(2)
@ConditionalOnProperty(prefix = "newscube.output", name = "csv-enabled", havingValue = "true", matchIfMissing = true)
public class CsvStarSchemaWriter implements StarSchemaWriter {

    static final String FACT_DOCUMENT = "Fact_Document.csv";
    static final String DIM_TIME = "Dim_Time.csv";
    static final String DIM_SOURCE = "Dim_Source.csv";
    static final String DIM_TAG = "Dim_Tag.csv";
    static final String DIM_ENTITY = "Dim_Entity.csv";
    static final String BRIDGE_FACT_TAG = "Bridge_Fact_Tag.csv";
    static final String BRIDGE_FACT_ENTITY = "Bridge_Fact_Entity.csv";
    static final String REJECTED_ENTITIES = "rejected_entities.csv";

    private final Path outputDirectory;

    public CsvStarSchemaWriter(NewsCubeProperties properties) {
        this.outputDirectory = Paths.get(properties.getOutput().getDirectory());
    }

    @Override
    public void write(StarSchema schema) {
        Path staging = null;
        try {
            Files.createDirectories(outputDirectory);
            staging = Files.createTempDirectory(outputDirectory, ".staging-");

            writeTable(staging.resolve(FACT_DOCUMENT), schema.getFactDocuments(), new String[] {
                "Fact_ID", "Document_ID", "Date_Key", "Source_Key", "Year", "Quarter", "Month", "Date_String",
                "Source_Name", "Source_Type", "Headline", "Body_Text", "News_Link", "Cleaned_Text",
                "Consolidated_Text", "Matched_Keywords", "Sentiment_Score", "QC_Status",
                "Document_Count", "Tag_Count", "Has_Key_Event"
            }, (FactDocument fact) -> values(fact.getFactId(), fact.getDocumentId(), fact.getDateKey(), fact.getSourceKey(),
                fact.getYear(), fact.getQuarter(), fact.getMonth(), fact.getDateString(), fact.getSourceName(),
                fact.getSourceType(), fact.getHeadline(), fact.getBodyText(), fact.getNewsLink(),
                fact.getCleanedText(), fact.getConsolidatedText(), fact.getMatchedKeywords(),
                fact.getSentimentScore(), fact.getQcStatus(), fact.getDocumentCount(), fact.getTagCount(),
                fact.getHasKeyEvent()));

            writeTable(staging.resolve(DIM_TIME), schema.getDimTime(), new String[] {
                "Date_Key", "Year", "Quarter", "Month", "Month_Number", "Day", "Day_of_Week", "Week_of_Year",
                "Date_String"
            }, (DimTime time) -> values(time.getDateKey(), time.getYear(), time.getQuarter(), time.getMonth(),
                time.getMonthNumber(), time.getDay(), time.getDayOfWeek(), time.getWeekOfYear(),
                time.getDateString()));

            writeTable(staging.resolve(DIM_SOURCE), schema.getDimSource(),
                new String[] {"Source_Key", "Source_Name", "Source_Type"},
                (DimSource source) -> values(source.getSourceKey(), source.getSourceName(), source.getSourceType()));

            writeTable(staging.resolve(DIM_TAG), schema.getDimTag(),
                new String[] {"Tag_Key", "Tag_Name", "Tag_Category", "Tag_Domain"},
                (DimTag tag) -> values(tag.getTagKey(), tag.getTagName(), tag.getTagCategory(), tag.getTagDomain()));

            writeTable(staging.resolve(DIM_ENTITY), schema.getDimEntity(),
                new String[] {"Entity_Key", "Entity_Name", "Entity_Type", "Entity_Domain"},
                (DimEntity entity) -> values(entity.getEntityKey(), entity.getEntityName(), entity.getEntityType(),
                    entity.getEntityDomain()));

            writeTable(staging.resolve(BRIDGE_FACT_TAG), schema.getBridgeFactTag(),
                new String[] {"Fact_ID", "Tag_Key", "Confidence_Score"},
                (BridgeFactTag bridge) -> values(bridge.getFactId(), bridge.getTagKey(),
                    bridge.getConfidenceScore()));

            writeTable(staging.resolve(BRIDGE_FACT_ENTITY), schema.getBridgeFactEntity(),
                new String[] {"Fact_ID", "Entity_Key", "Mention_Count"},
                (BridgeFactEntity bridge) -> values(bridge.getFactId(), bridge.getEntityKey(),
                    bridge.getMentionCount()));

            writeTable(staging.resolve(REJECTED_ENTITIES), schema.getRejectedEntities(),
                new String[] {"Rejected_Entity", "Occurrence_Count", "Reason"},
                (RejectedEntity rejected) -> values(rejected.getRejectedEntity(), rejected.getOccurrenceCount(),
                    rejected.getReason()));

            publish(staging);
            log.info("Wrote star schema CSV files to {}", outputDirectory.toAbsolutePath());
        } catch (IOException e) {
            throw new StarSchemaException("Failed to write star schema CSV files to " + outputDirectory, e);
        } finally {
            if (staging != null) {
                deleteRecursively(staging);
            }
        }
    }

    private static <T> void writeTable(Path file, List<T> rows, String[] header, Function<T, String[]> mapper)
            throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             ICSVWriter csv = new CSVWriterBuilder(out).build()) {
            csv.writeNext(header, false);
            for (T row : rows) {
                csv.writeNext(mapper.apply(row), false);
            }
        }
        log.debug("Staged {} rows in {}", rows.size(), file.getFileName());
    }

    private void publish(Path staging) throws IOException {
        List<Path> staged;
        try (Stream<Path> files = Files.list(staging)) {
            staged = files.sorted().collect(Collectors.toList());
        }
        for (Path file : staged) {
            Path target = outputDirectory.resolve(file.getFileName());
            try {
                Files.move(file, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    private static void deleteRecursively(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}: {}", directory, e.getMessage());
        }
    }

    private static String[] values(Object... values) {
        String[] row = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            row[i] = Objects.toString(values[i], "");
        }
        return row;
    }
}
