package io.b2mash.b2b.commercial.document.store;

import io.b2mash.b2b.commercial.document.DocumentPage;
import io.b2mash.b2b.commercial.document.DocumentQuery;
import io.b2mash.b2b.commercial.document.DocumentStore;
import io.b2mash.b2b.commercial.document.PaymentRecord;
import io.b2mash.b2b.commercial.document.StatusChange;
import io.b2mash.b2b.commercial.engine.Document;
import io.b2mash.b2b.commercial.engine.DocumentDraft;
import io.b2mash.b2b.commercial.exception.DocumentStoreException;
import io.b2mash.b2b.commercial.exception.ResourceNotFoundException;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

/** Document store reached over the commercial HTTP API. */
@Component
public class RemoteDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(RemoteDocumentStore.class);

  private static final String DOCUMENTS = "/v1/commercial/documents";
  private static final String DOCUMENT = DOCUMENTS + "/{id}";

  private final RestClient documentStoreClient;
  private final DocumentPayloadMapper mapper;

  public RemoteDocumentStore(RestClient documentStoreClient, DocumentPayloadMapper mapper) {
    this.documentStoreClient = documentStoreClient;
    this.mapper = mapper;
  }

  @Override
  public Optional<Document> findById(UUID id) {
    try {
      var payload =
          call(
              "load document",
              id,
              () ->
                  documentStoreClient
                      .get()
                      .uri(DOCUMENT, id)
                      .retrieve()
                      .body(DocumentPayload.class));
      return Optional.of(mapper.toDocument(payload));
    } catch (ResourceNotFoundException e) {
      return Optional.empty();
    }
  }

  @Override
  public DocumentPage findAll(DocumentQuery query) {
    var payload =
        call(
            "list documents",
            null,
            () ->
                documentStoreClient
                    .get()
                    .uri(uri -> listUri(uri, query))
                    .retrieve()
                    .body(DocumentPagePayload.class));
    if (payload == null || payload.items() == null) {
      throw new DocumentStoreException("Document store returned an empty page", List.of());
    }
    return new DocumentPage(
        mapper.toDocuments(payload.items()), payload.total(), payload.page(), payload.pageSize());
  }

  @Override
  public Document create(DocumentDraft draft, UUID createdBy) {
    var payload =
        call(
            "create document",
            null,
            () ->
                documentStoreClient
                    .post()
                    .uri(DOCUMENTS)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(DocumentPayload.from(draft, createdBy))
                    .retrieve()
                    .body(DocumentPayload.class));
    Document created = mapper.toDocument(payload);
    log.debug("Store assigned id {} and number {}", created.id(), created.number());
    return created;
  }

  @Override
  public Document update(Document document) {
    var payload =
        call(
            "update document",
            document.id(),
            () ->
                documentStoreClient
                    .put()
                    .uri(DOCUMENT, document.id())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(DocumentPayload.from(document))
                    .retrieve()
                    .body(DocumentPayload.class));
    return mapper.toDocument(payload);
  }

  @Override
  public Document changeStatus(UUID id, StatusChange change) {
    var body =
        new StatusChangePayload(change.status().name(), change.occurredAt(), change.actorId());
    var payload =
        call(
            "change document status",
            id,
            () ->
                documentStoreClient
                    .post()
                    .uri(DOCUMENT + "/status", id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(DocumentPayload.class));
    return mapper.toDocument(payload);
  }

  @Override
  public Document recordPayment(UUID id, PaymentRecord payment) {
    var body = new PaymentPayload(payment.amount(), payment.reference(), payment.paidAt());
    var payload =
        call(
            "record payment",
            id,
            () ->
                documentStoreClient
                    .post()
                    .uri(DOCUMENT + "/payments", id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(DocumentPayload.class));
    return mapper.toDocument(payload);
  }

  @Override
  public void delete(UUID id) {
    call(
        "delete document",
        id,
        () -> documentStoreClient.delete().uri(DOCUMENT, id).retrieve().toBodilessEntity());
  }

  private static URI listUri(UriBuilder uri, DocumentQuery query) {
    uri.path(DOCUMENTS)
        .queryParam("page", query.page())
        .queryParam("page_size", query.pageSize());
    if (query.type() != null) {
      uri.queryParam("type", query.type().name());
    }
    if (query.status() != null) {
      uri.queryParam("status", query.status().name());
    }
    if (query.customerId() != null) {
      uri.queryParam("customer_id", query.customerId());
    }
    return uri.build();
  }

  /**
   * Runs one store call. A 404 on a single document becomes {@link ResourceNotFoundException};
   * any other transport or decoding failure becomes {@link DocumentStoreException}.
   */
  private static <T> T call(String action, UUID documentId, Supplier<T> request) {
    try {
      return request.get();
    } catch (HttpClientErrorException.NotFound e) {
      if (documentId != null) {
        throw ResourceNotFoundException.document(documentId);
      }
      throw new DocumentStoreException("Document store failed to " + action, e);
    } catch (RestClientException e) {
      log.error("Document store call failed ({} {}): {}", action, documentId, e.getMessage());
      throw new DocumentStoreException("Document store failed to " + action, e);
    }
  }
}
