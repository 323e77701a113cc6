package io.b2mash.b2b.commercial.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;

/** HTTP client for the document store. The store speaks snake_case JSON. */
@Configuration
public class DocumentStoreClientConfig {

  @Bean
  public RestClient documentStoreClient(
      RestClient.Builder builder, DocumentStoreProperties properties, ObjectMapper objectMapper) {
    return configure(builder, properties, objectMapper).build();
  }

  /** Applies base URL, timeouts and the store's JSON conventions to {@code builder}. */
  public static RestClient.Builder configure(
      RestClient.Builder builder, DocumentStoreProperties properties, ObjectMapper objectMapper) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());

    ObjectMapper storeMapper =
        objectMapper
            .copy()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .messageConverters(
            converters -> {
              converters.removeIf(MappingJackson2HttpMessageConverter.class::isInstance);
              converters.add(0, new MappingJackson2HttpMessageConverter(storeMapper));
            });
  }
}
