package edu.uconn.newscube.ingest;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import edu.uconn.newscube.config.NewsCubeProperties;
import edu.uconn.newscube.exception.StarSchemaException;
import edu.uconn.newscube.model.ArticleRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamReader;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads the cleaned article export with opencsv. Quoted fields may span
 * lines. Rows whose field count differs from the header are skipped and
 * counted rather than failing the run.
 */
@Slf4j
public class ArticleCsvItemReader implements ItemStreamReader<ArticleRecord> {

    static final String READ_COUNT_KEY = "articleCsvItemReader.read.count";
    static final String SKIPPED_COUNT_KEY = "articleCsvItemReader.skipped.count";

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Resource resource;
    private final NewsCubeProperties.Columns columns;

    private CSVReader csvReader;
    private int headerSize;

    private int documentId;
    private int date;
    private int source;
    private int headline;
    private int body;
    private int consolidatedText;
    private int keywordHints;
    private int newsLink;
    private int cleanedText;
    private int sentimentScore;
    private int qcStatus;

    private long readCount;
    private long skippedCount;

    public ArticleCsvItemReader(Resource resource, NewsCubeProperties.Columns columns) {
        this.resource = resource;
        this.columns = columns;
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        if (resource == null || !resource.exists()) {
            throw new StarSchemaException("Article input not found: " + resource);
        }
        try {
            csvReader = new CSVReaderBuilder(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))
                .build();
            String[] header = csvReader.readNext();
            if (header == null) {
                throw new StarSchemaException("Article input is empty: " + resource.getDescription());
            }
            mapHeader(header);
        } catch (IOException | CsvValidationException e) {
            close();
            throw new StarSchemaException("Could not read article input " + resource.getDescription(), e);
        } catch (StarSchemaException e) {
            close();
            throw e;
        }
        log.info("Opened article input {} with {} columns", resource.getDescription(), headerSize);
    }

    private void mapHeader(String[] header) {
        headerSize = header.length;
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i].strip();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BYTE_ORDER_MARK) {
                name = name.substring(1);
            }
            positions.putIfAbsent(name, i);
        }

        documentId = required(positions, columns.getDocumentId());
        headline = required(positions, columns.getHeadline());
        body = required(positions, columns.getBody());
        date = positions.getOrDefault(columns.getDate(), -1);
        source = positions.getOrDefault(columns.getSource(), -1);
        consolidatedText = positions.getOrDefault(columns.getConsolidatedText(), -1);
        keywordHints = positions.getOrDefault(columns.getKeywordHints(), -1);
        newsLink = positions.getOrDefault(columns.getNewsLink(), -1);
        cleanedText = positions.getOrDefault(columns.getCleanedText(), -1);
        sentimentScore = positions.getOrDefault(columns.getSentimentScore(), -1);
        qcStatus = positions.getOrDefault(columns.getQcStatus(), -1);
    }

    private int required(Map<String, Integer> positions, String column) {
        Integer position = positions.get(column);
        if (position == null) {
            throw new StarSchemaException("Required column '" + column + "' missing from "
                + resource.getDescription() + "; found " + positions.keySet());
        }
        return position;
    }

    @Override
    public ArticleRecord read() throws IOException {
        if (csvReader == null) {
            throw new IllegalStateException("Reader must be opened before reading");
        }
        while (true) {
            String[] row;
            try {
                row = csvReader.readNext();
            } catch (CsvValidationException e) {
                skippedCount++;
                log.warn("Skipping invalid article row near line {}: {}", csvReader.getLinesRead(), e.getMessage());
                continue;
            }
            if (row == null) {
                return null;
            }
            if (row.length == 1 && row[0].isBlank()) {
                continue;
            }
            if (row.length != headerSize) {
                skippedCount++;
                log.warn("Skipping malformed article row near line {}: expected {} fields, found {}",
                    csvReader.getLinesRead(), headerSize, row.length);
                continue;
            }
            readCount++;
            return toRecord(row);
        }
    }

    private ArticleRecord toRecord(String[] row) {
        return ArticleRecord.builder()
            .documentId(field(row, documentId))
            .date(field(row, date))
            .source(field(row, source))
            .headline(field(row, headline))
            .body(field(row, body))
            .consolidatedText(field(row, consolidatedText))
            .keywordHints(field(row, keywordHints))
            .newsLink(field(row, newsLink))
            .cleanedText(field(row, cleanedText))
            .sentimentScore(field(row, sentimentScore))
            .qcStatus(field(row, qcStatus))
            .build();
    }

    private static String field(String[] row, int position) {
        if (position < 0) {
            return null;
        }
        String value = row[position];
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        executionContext.putLong(READ_COUNT_KEY, readCount);
        executionContext.putLong(SKIPPED_COUNT_KEY, skippedCount);
    }

    @Override
    public void close() throws ItemStreamException {
        if (csvReader == null) {
            return;
        }
        try {
            csvReader.close();
        } catch (IOException e) {
            throw new ItemStreamException("Failed to close article input", e);
        } finally {
            csvReader = null;
        }
        if (skippedCount > 0) {
            log.warn("Skipped {} malformed article rows; {} rows read", skippedCount, readCount);
        } else {
            log.info("Read {} article rows", readCount);
        }
    }

    public long getReadCount() {
        return readCount;
    }

    public long getSkippedCount() {
        return skippedCount;
    }
}
