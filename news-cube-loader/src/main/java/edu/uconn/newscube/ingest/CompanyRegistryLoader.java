package edu.uconn.newscube.ingest;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import edu.uconn.newscube.entity.DimEntity;
import edu.uconn.newscube.exception.StarSchemaException;
import edu.uconn.newscube.model.RegistryEntry;
import edu.uconn.newscube.transform.CompanyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the company registry CSV: a {@code Company_Name} column and an
 * optional {@code Entity_Type} column defaulting to {@code Company}.
 */
@Slf4j
public class CompanyRegistryLoader {

    static final String NAME_COLUMN = "Company_Name";
    static final String TYPE_COLUMN = "Entity_Type";
    static final String DEFAULT_TYPE = "Company";

    public CompanyRegistry load(Resource resource) {
        if (resource == null || !resource.exists()) {
            log.warn("Company registry {} not found; registry matching is disabled", resource);
            return CompanyRegistry.empty();
        }

        List<String[]> rows;
        try (CSVReader reader = new CSVReaderBuilder(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)).build()) {
            rows = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new StarSchemaException("Could not read company registry " + resource.getDescription(), e);
        }

        if (rows.isEmpty()) {
            log.warn("Company registry {} is empty", resource.getDescription());
            return CompanyRegistry.empty();
        }

        List<String> header = Arrays.stream(rows.get(0))
            .map(column -> column.replace("\uFEFF", "").strip())
            .collect(Collectors.toList());
        int nameColumn = header.indexOf(NAME_COLUMN);
        int typeColumn = header.indexOf(TYPE_COLUMN);
        if (nameColumn < 0) {
            log.warn("Company registry {} has no {} column; registry matching is disabled",
                resource.getDescription(), NAME_COLUMN);
            return CompanyRegistry.empty();
        }

        List<RegistryEntry> entries = new ArrayList<>(rows.size() - 1);
        for (String[] row : rows.subList(1, rows.size())) {
            if (nameColumn >= row.length) {
                continue;
            }
            String type = typeColumn >= 0 && typeColumn < row.length ? row[typeColumn].strip() : "";
            boolean usable = !type.isEmpty() && type.length() <= DimEntity.MAX_TYPE_LENGTH;
            entries.add(new RegistryEntry(row[nameColumn].strip(), usable ? type : DEFAULT_TYPE));
        }

        CompanyRegistry registry = CompanyRegistry.of(entries);
        log.info("Loaded {} companies from {}", registry.size(), resource.getDescription());
        return registry;
    }
}
