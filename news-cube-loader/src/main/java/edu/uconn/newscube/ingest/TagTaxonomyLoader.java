package edu.uconn.newscube.ingest;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import edu.uconn.newscube.exception.StarSchemaException;
import edu.uconn.newscube.model.TagDefinition;
import edu.uconn.newscube.model.TagTaxonomy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads the tag taxonomy from the first sheet of the tag workbook, or from
 * the same layout saved as CSV.
 *
 * <p>Layout, zero-based, header row skipped:
 * <ul>
 *   <li>column 2: {@code Individually} flag, splitting the row into one tag per keyword</li>
 *   <li>column 3: tag name; rows without one hold general therapy keywords</li>
 *   <li>columns 4 to 9: extra keywords</li>
 * </ul>
 */
@Slf4j
public class TagTaxonomyLoader {

    static final int FLAG_COLUMN = 2;
    static final int NAME_COLUMN = 3;
    static final int FIRST_KEYWORD_COLUMN = 4;
    static final int LAST_KEYWORD_COLUMN = 9;

    private static final String INDIVIDUALLY = "individually";

    private static final List<String> THERAPY_TERMS =
        List.of("therapy", "cancer", "oncology", "tumor", "immunotherapy", "car-t", "adc");

    private static final List<CategoryRule> CATEGORY_RULES = List.of(
        new CategoryRule("Event", "Business", List.of(
            "acquisition", "merger", "partnership", "collaboration", "licensing",
            "buyout", "takeover", "biotech deal", "pharma deal", "m&a",
            "alliance", "option agreement", "co-development", "in-license",
            "out-license", "funding", "financing", "investment", "raises",
            "series a", "series b", "series c", "venture capital", "ipo",
            "private placement", "oversubscribed", "seed funding",
            "crossover round", "pipe", "dilutive financing", "non-dilutive funding",
            "led by", "participated", "syndicate", "biotech funding")),
        new CategoryRule("Clinical", "Healthcare", List.of(
            "clinical stage", "phase 2", "phase 3", "fda approval")),
        new CategoryRule("Manufacturing", "Operations", List.of(
            "in-house manufacturing", "contract manufacturing", "capacity shortage",
            "manufacturing", "contract")),
        new CategoryRule("Therapy", "Healthcare", List.of(
            "oncology", "cancer", "tumor", "immunotherapy", "car-t", "adc")),
        new CategoryRule("Entity", "Healthcare", List.of(
            "preclinical", "clinical-stage", "platform company", "therapeutic"))
    );

    private static final String DEFAULT_CATEGORY = "Other";
    private static final String DEFAULT_DOMAIN = "General";

    private static final Map<String, List<String>> VARIATIONS = Map.ofEntries(
        Map.entry("acquisition", List.of("acquire", "acquired", "acquires", "buy", "purchase", "purchased")),
        Map.entry("merger", List.of("merge", "merged", "merges", "combine", "combined")),
        Map.entry("partnership", List.of("partner", "partnered", "partners", "alliance", "collaborate")),
        Map.entry("collaboration", List.of("collaborate", "collaborated", "collaborates", "cooperation")),
        Map.entry("licensing", List.of("license", "licensed", "licenses", "licence", "licenced")),
        Map.entry("buyout", List.of("buy out", "bought out")),
        Map.entry("takeover", List.of("take over", "took over")),
        Map.entry("m&a  (mergers & acquisitions)", List.of("m&a", "mergers and acquisitions", "ma", "mna")),
        Map.entry("alliance", List.of("strategic alliance", "partnership")),
        Map.entry("option agreement", List.of("option", "option deal")),
        Map.entry("co-development", List.of("co development", "joint development")),
        Map.entry("in-license", List.of("in license", "in-licensing")),
        Map.entry("out-license", List.of("out license", "out-licensing")),
        Map.entry("clinical stage", List.of("clinical", "clinical-stage")),
        Map.entry("phase 2", List.of("phase ii", "phase-2")),
        Map.entry("phase 3", List.of("phase iii", "phase-3")),
        Map.entry("fda approval", List.of("fda", "approved", "approval")),
        Map.entry("funding", List.of("fund", "funded", "funds", "capital")),
        Map.entry("financing", List.of("finance", "financed")),
        Map.entry("investment", List.of("invest", "invested", "investor")),
        Map.entry("raises", List.of("raise", "raised", "raising")),
        Map.entry("venture capital", List.of("vc", "venture", "venture capitalist")),
        Map.entry("ipo", List.of("initial public offering", "public offering", "go public")),
        Map.entry("private placement", List.of("private", "placement")),
        Map.entry("round", List.of("funding round", "investment round")),
        Map.entry("capital raise", List.of("raise capital", "capital raising")),
        Map.entry("oversubscribed", List.of("over-subscribed", "over subscribed")),
        Map.entry("seed funding", List.of("seed", "seed round")),
        Map.entry("crossover round", List.of("crossover")),
        Map.entry("pipe", List.of("private investment in public equity")),
        Map.entry("led by", List.of("lead investor", "leading")),
        Map.entry("participated", List.of("participant", "participating")),
        Map.entry("syndicate", List.of("syndicated", "syndication")),
        Map.entry("biotech funding", List.of("biotech investment", "biotech capital")),
        Map.entry("preclinical", List.of("pre-clinical")),
        Map.entry("clinical-stage", List.of("clinical stage")),
        Map.entry("platform company", List.of("platform")),
        Map.entry("therapeutic", List.of("therapy"))
    );

    /**
     * @return the taxonomy, empty when the resource is not configured or missing
     */
    public TagTaxonomy load(Resource resource) {
        if (resource == null || !resource.exists()) {
            log.warn("Tag taxonomy {} not found; tag matching is disabled", resource);
            return TagTaxonomy.empty();
        }

        List<List<String>> rows = isWorkbook(resource) ? readWorkbook(resource) : readCsv(resource);
        TagTaxonomy taxonomy = buildTaxonomy(rows.size() > 1 ? rows.subList(1, rows.size()) : List.of());
        log.info("Loaded {} tag definitions from {}", taxonomy.size(), resource.getDescription());
        return taxonomy;
    }

    private static boolean isWorkbook(Resource resource) {
        String filename = resource.getFilename();
        return filename != null && filename.toLowerCase(Locale.ROOT).matches(".*\\.xls[xm]?$");
    }

    List<List<String>> readWorkbook(Resource resource) {
        DataFormatter formatter = new DataFormatter();
        try (InputStream in = resource.getInputStream();
             Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            List<List<String>> rows = new ArrayList<>();
            for (int i = sheet.getFirstRowNum(); i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                List<String> cells = new ArrayList<>();
                if (row != null) {
                    for (int j = 0; j < Math.max(0, row.getLastCellNum()); j++) {
                        cells.add(formatter.formatCellValue(row.getCell(j)));
                    }
                }
                rows.add(cells);
            }
            log.debug("Read {} rows from sheet '{}'", rows.size(), sheet.getSheetName());
            return rows;
        } catch (IOException e) {
            throw new StarSchemaException("Could not read tag workbook " + resource.getDescription(), e);
        }
    }

    List<List<String>> readCsv(Resource resource) {
        try (CSVReader reader = new CSVReaderBuilder(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)).build()) {
            List<List<String>> rows = new ArrayList<>();
            for (String[] row : reader.readAll()) {
                rows.add(Arrays.asList(row));
            }
            return rows;
        } catch (IOException | CsvException e) {
            throw new StarSchemaException("Could not read tag taxonomy " + resource.getDescription(), e);
        }
    }

    /**
     * Builds tag definitions from data rows (header already removed).
     */
    TagTaxonomy buildTaxonomy(List<List<String>> rows) {
        List<String> generalKeywords = new ArrayList<>();
        for (List<String> row : rows) {
            if (cell(row, NAME_COLUMN).isEmpty()) {
                generalKeywords.addAll(keywordCells(row));
            }
        }
        if (!generalKeywords.isEmpty()) {
            log.debug("Found {} general therapy keywords", generalKeywords.size());
        }

        List<TagDefinition> definitions = new ArrayList<>();
        for (List<String> row : rows) {
            String tagName = cell(row, NAME_COLUMN);
            if (tagName.isEmpty()) {
                continue;
            }
            String lowerName = tagName.toLowerCase(Locale.ROOT);

            Set<String> keywords = new LinkedHashSet<>();
            keywords.add(lowerName);
            keywordCells(row).forEach(keyword -> keywords.add(keyword.toLowerCase(Locale.ROOT)));
            if (THERAPY_TERMS.stream().anyMatch(lowerName::contains)) {
                generalKeywords.forEach(keyword -> keywords.add(keyword.toLowerCase(Locale.ROOT)));
            }
            keywords.addAll(keywordVariations(tagName));

            TagDefinition definition = categorize(tagName, keywords);
            boolean individually = INDIVIDUALLY.equals(cell(row, FLAG_COLUMN).toLowerCase(Locale.ROOT));
            if (individually && keywords.size() > 1) {
                for (String keyword : keywords) {
                    definitions.add(definition.toBuilder().name(keyword).clearKeywords().keyword(keyword).build());
                }
            } else {
                definitions.add(definition);
            }
        }
        return new TagTaxonomy(definitions);
    }

    private static TagDefinition categorize(String tagName, Set<String> keywords) {
        String text = (tagName + " " + String.join(" ", keywords)).toLowerCase(Locale.ROOT);
        String category = DEFAULT_CATEGORY;
        String domain = DEFAULT_DOMAIN;
        for (CategoryRule rule : CATEGORY_RULES) {
            if (rule.getTerms().stream().anyMatch(text::contains)) {
                category = rule.getCategory();
                domain = rule.getDomain();
                break;
            }
        }
        return TagDefinition.builder()
            .name(tagName)
            .category(category)
            .domain(domain)
            .keywords(keywords)
            .build();
    }

    /**
     * Synonyms and inflections for well-known deal, funding and clinical tags.
     */
    static List<String> keywordVariations(String tagName) {
        String lower = tagName.toLowerCase(Locale.ROOT);
        List<String> exact = VARIATIONS.get(lower);
        if (exact != null) {
            return exact;
        }
        if (lower.contains("deal")) {
            return List.of("agreement", "transaction", "contract");
        }
        if (lower.contains("series")) {
            String[] words = lower.split("\\s+");
            String series = words[words.length - 1];
            return List.of("series " + series, "series" + series, series + " round");
        }
        if (lower.contains("dilutive")) {
            return List.of("dilutive financing", "non-dilutive financing");
        }
        return List.of();
    }

    private static List<String> keywordCells(List<String> row) {
        List<String> keywords = new ArrayList<>();
        for (int i = FIRST_KEYWORD_COLUMN; i <= LAST_KEYWORD_COLUMN; i++) {
            String keyword = cell(row, i);
            if (!keyword.isEmpty() && !"nan".equalsIgnoreCase(keyword)) {
                keywords.add(keyword);
            }
        }
        return keywords;
    }

    private static String cell(List<String> row, int index) {
        if (index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index).strip();
    }

    @Value
    private static class CategoryRule {
        String category;
        String domain;
        List<String> terms;
    }
}
