package dev.aparikh.scanerrors.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.scanerrors.source.ErrorRecordSource;
import dev.aparikh.scanerrors.source.SolrErrorRecordSource;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.HttpSolrClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({SolrConfigurationProperties.class, ErrorListProperties.class})
class SolrConfig {

    private final SolrConfigurationProperties properties;

    SolrConfig(SolrConfigurationProperties properties) {
        this.properties = properties;
    }

    @Bean
    SolrClient solrClient() {
        // Normalize base URL and core without trailing slash to avoid path issues
        String baseUrl = properties.getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String core = properties.getCore();
        if (core.startsWith("/")) {
            core = core.substring(1);
        }
        return new HttpSolrClient.Builder(baseUrl + "/" + core).build();
    }

    @Bean
    ErrorRecordSource errorRecordSource(SolrClient solrClient, ObjectMapper objectMapper) {
        return new SolrErrorRecordSource(solrClient, objectMapper, properties.getFetchBatchSize());
    }
}
