package io.b2mash.b2b.commercial.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings for the document store API, the durable source of truth for documents and
 * customers.
 *
 * @param baseUrl root URL of the store API
 * @param connectTimeout TCP connect timeout
 * @param readTimeout response read timeout
 * @param customerCacheTtl how long a resolved customer is reused before it is fetched again
 */
@ConfigurationProperties(prefix = "commercial.store")
public record DocumentStoreProperties(
    @DefaultValue("http://localhost:8000") String baseUrl,
    @DefaultValue("5s") Duration connectTimeout,
    @DefaultValue("30s") Duration readTimeout,
    @DefaultValue("5m") Duration customerCacheTtl) {}
