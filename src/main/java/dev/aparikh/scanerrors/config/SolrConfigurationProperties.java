package dev.aparikh.scanerrors.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Typed configuration properties for the Solr error store.
 */
@Validated
@ConfigurationProperties(prefix = "solr")
class SolrConfigurationProperties {

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String core;

    @Positive
    private int fetchBatchSize = 500;

    String getBaseUrl() {
        return baseUrl;
    }

    void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    String getCore() {
        return core;
    }

    void setCore(String core) {
        this.core = core;
    }

    int getFetchBatchSize() {
        return fetchBatchSize;
    }

    void setFetchBatchSize(int fetchBatchSize) {
        this.fetchBatchSize = fetchBatchSize;
    }
}
