package edu.uconn.newscube.config;

import edu.uconn.newscube.ingest.CompanyRegistryLoader;
import edu.uconn.newscube.ingest.TagTaxonomyLoader;
import edu.uconn.newscube.model.TagTaxonomy;
import edu.uconn.newscube.transform.CompanyRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Reference data shared by every run: the tag taxonomy and the company
 * registry, loaded once at startup.
 */
@Configuration
@EnableConfigurationProperties(NewsCubeProperties.class)
public class PipelineConfiguration {

    @Bean
    public TagTaxonomyLoader tagTaxonomyLoader() {
        return new TagTaxonomyLoader();
    }

    @Bean
    public CompanyRegistryLoader companyRegistryLoader() {
        return new CompanyRegistryLoader();
    }

    @Bean
    public TagTaxonomy tagTaxonomy(TagTaxonomyLoader loader, NewsCubeProperties properties) {
        return loader.load(properties.getTaxonomy().getPath());
    }

    @Bean
    public CompanyRegistry companyRegistry(CompanyRegistryLoader loader, NewsCubeProperties properties) {
        return loader.load(properties.getRegistry().getPath());
    }
}
