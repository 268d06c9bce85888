package edu.uconn.newscube.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

/**
 * Settings for a star schema run, bound from the {@code newscube.*} keys of
 * application.yml or the command line.
 */
@Data
@ConfigurationProperties(prefix = "newscube")
public class NewsCubeProperties {

    /**
     * Rows per scanned batch. Affects memory and runtime only, never output.
     */
    private int batchSize = 5000;

    /**
     * Value written to Dim_Entity.Entity_Domain.
     */
    private String entityDomain = "Healthcare";

    private Input input = new Input();

    private Taxonomy taxonomy = new Taxonomy();

    private Registry registry = new Registry();

    private Output output = new Output();

    @Data
    public static class Input {

        private Resource path;

        private Columns columns = new Columns();
    }

    /**
     * Header names of the article export.
     */
    @Data
    public static class Columns {

        private String documentId = "Amethos Id";
        private String date = "Date";
        private String source = "Source";
        private String headline = "Headline";
        private String body = "Body/abstract/extract";
        private String consolidatedText = "Consolidated_Text";
        private String keywordHints = "matched_keywords";
        private String newsLink = "News link";
        private String cleanedText = "Cleaned_Text_G";
        private String sentimentScore = "sentiment_score";
        private String qcStatus = "QC_H";
    }

    @Data
    public static class Taxonomy {

        /**
         * Tag workbook (.xlsx) or the same layout saved as .csv.
         */
        private Resource path;
    }

    @Data
    public static class Registry {

        /**
         * Company registry CSV with Company_Name and optional Entity_Type.
         */
        private Resource path;
    }

    @Data
    public static class Output {

        private String directory = "data/star_schema";

        private boolean csvEnabled = true;

        private boolean databaseEnabled = true;
    }
}
