package edu.uconn.newscube.config;

import edu.uconn.newscube.ingest.ArticleCsvItemReader;
import edu.uconn.newscube.model.ArticleRecord;
import edu.uconn.newscube.model.StarSchema;
import edu.uconn.newscube.model.TagTaxonomy;
import edu.uconn.newscube.output.StarSchemaWriter;
import edu.uconn.newscube.transform.BatchProcessor;
import edu.uconn.newscube.transform.EntityExtractor;
import edu.uconn.newscube.transform.StarSchemaBuilder;
import edu.uconn.newscube.transform.TagMatcher;
import edu.uconn.newscube.transform.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The star schema job: a chunk-oriented scan of the article export followed
 * by a tasklet that finalizes the schema and hands it to every enabled writer.
 *
 * <p>The article file can be overridden per run with the {@code input} job
 * parameter, e.g. {@code input=file:data/articles.csv}.
 */
@Slf4j
@Configuration
public class StarSchemaJobConfiguration {

    public static final String JOB_NAME = "starSchemaJob";
    public static final String SCAN_STEP_NAME = "scanArticlesStep";
    public static final String FINALIZE_STEP_NAME = "finalizeStarSchemaStep";

    @Bean
    public Job starSchemaJob(JobRepository jobRepository, Step scanArticlesStep, Step finalizeStarSchemaStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
            .incrementer(new RunIdIncrementer())
            .preventRestart()
            .start(scanArticlesStep)
            .next(finalizeStarSchemaStep)
            .build();
    }

    @Bean
    public Step scanArticlesStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                 ArticleCsvItemReader articleReader, BatchProcessor batchProcessor,
                                 NewsCubeProperties properties) {
        return new StepBuilder(SCAN_STEP_NAME, jobRepository)
            .<ArticleRecord, ArticleRecord>chunk(properties.getBatchSize(), transactionManager)
            .reader(articleReader)
            .writer(chunk -> batchProcessor.processBatch(chunk.getItems()))
            .build();
    }

    @Bean
    public Step finalizeStarSchemaStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                       BatchProcessor batchProcessor, ObjectProvider<StarSchemaWriter> writers) {
        return new StepBuilder(FINALIZE_STEP_NAME, jobRepository)
            .tasklet((contribution, chunkContext) -> {
                StarSchema schema = batchProcessor.finalizeSchema();

                List<StarSchemaWriter> enabled = writers.orderedStream().collect(Collectors.toList());
                if (enabled.isEmpty()) {
                    log.warn("No star schema writer is enabled; the schema was built but not saved");
                }
                for (StarSchemaWriter writer : enabled) {
                    writer.write(schema);
                }

                contribution.incrementWriteCount(schema.getFactDocuments().size());
                return RepeatStatus.FINISHED;
            }, transactionManager)
            .build();
    }

    /**
     * One processor per job execution; it carries the accumulators from the
     * scan step into the finalize step.
     */
    @Bean
    @JobScope
    public BatchProcessor batchProcessor(TextNormalizer textNormalizer, TagMatcher tagMatcher,
                                         EntityExtractor entityExtractor, StarSchemaBuilder starSchemaBuilder,
                                         TagTaxonomy tagTaxonomy, NewsCubeProperties properties) {
        return new BatchProcessor(textNormalizer, tagMatcher, entityExtractor, starSchemaBuilder,
            tagTaxonomy, properties.getBatchSize());
    }

    @Bean
    @StepScope
    public ArticleCsvItemReader articleReader(NewsCubeProperties properties,
                                              @Value("#{jobParameters['input']}") String input) {
        Resource resource = input == null || input.isBlank()
            ? properties.getInput().getPath()
            : new DefaultResourceLoader().getResource(input);
        return new ArticleCsvItemReader(resource, properties.getInput().getColumns());
    }
}
