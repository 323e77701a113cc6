package io.b2mash.b2b.commercial.customer;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.commercial.config.DocumentStoreProperties;
import io.b2mash.b2b.commercial.exception.DocumentStoreException;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Customer directory backed by the store's customer endpoint. Resolved customers are cached for
 * {@code commercial.store.customer-cache-ttl}; misses are not cached.
 */
@Component
public class RemoteCustomerDirectory implements CustomerDirectory {

  private static final Logger log = LoggerFactory.getLogger(RemoteCustomerDirectory.class);

  private final RestClient documentStoreClient;
  private final Validator validator;
  private final Cache<UUID, CustomerSummary> customerCache;

  public RemoteCustomerDirectory(
      RestClient documentStoreClient, Validator validator, DocumentStoreProperties properties) {
    this.documentStoreClient = documentStoreClient;
    this.validator = validator;
    this.customerCache =
        Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(properties.customerCacheTtl())
            .build();
  }

  @Override
  public Optional<CustomerSummary> findCustomer(UUID customerId) {
    var cached = customerCache.getIfPresent(customerId);
    if (cached != null) {
      return Optional.of(cached);
    }

    CustomerSummary customer;
    try {
      customer =
          documentStoreClient
              .get()
              .uri("/v1/commercial/customers/{id}", customerId)
              .retrieve()
              .body(CustomerSummary.class);
    } catch (HttpClientErrorException.NotFound e) {
      log.debug("Customer {} not found in directory", customerId);
      return Optional.empty();
    } catch (RestClientException e) {
      throw new DocumentStoreException("Customer lookup failed for " + customerId, e);
    }

    if (customer == null) {
      throw new DocumentStoreException(
          "Customer lookup returned an empty body for " + customerId, List.of());
    }
    var violations =
        validator.validate(customer).stream()
            .map(v -> v.getPropertyPath() + " " + v.getMessage())
            .sorted()
            .toList();
    if (!violations.isEmpty()) {
      throw new DocumentStoreException("Malformed customer " + customerId, violations);
    }
    customerCache.put(customerId, customer);
    return Optional.of(customer);
  }
}
