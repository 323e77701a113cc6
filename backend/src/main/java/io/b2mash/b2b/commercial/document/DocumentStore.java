package io.b2mash.b2b.commercial.document;

import io.b2mash.b2b.commercial.engine.Document;
import io.b2mash.b2b.commercial.engine.DocumentDraft;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence collaborator for documents. Assigns ids and numbers, stores documents and reports
 * them back as engine values. Implementations reject stored data that breaks the document
 * contract instead of substituting defaults.
 */
public interface DocumentStore {

  Optional<Document> findById(UUID id);

  DocumentPage findAll(DocumentQuery query);

  /** Persists a new draft; the returned document carries the assigned id and number. */
  Document create(DocumentDraft draft, UUID createdBy);

  /** Replaces the stored header and lines of an existing document. */
  Document update(Document document);

  Document changeStatus(UUID id, StatusChange change);

  Document recordPayment(UUID id, PaymentRecord payment);

  void delete(UUID id);
}
