package dev.aparikh.scanerrors.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

/**
 * Settings of the error listing. {@code pageSize} is fixed per deployment, never per request.
 */
@Validated
@ConfigurationProperties(prefix = "errors")
public class ErrorListProperties {

    public static final int DEFAULT_PAGE_SIZE = 50;

    @Positive
    private int pageSize = DEFAULT_PAGE_SIZE;

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }
}
