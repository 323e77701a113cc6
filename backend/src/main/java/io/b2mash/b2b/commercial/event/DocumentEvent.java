package io.b2mash.b2b.commercial.event;

import io.b2mash.b2b.commercial.engine.DocumentType;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for document lifecycle events published via Spring ApplicationEventPublisher.
 * Implementations are records holding plain values only, so they remain valid after the request
 * that produced them has finished.
 *
 * <p>Events carry the data an audit trail is built from; building the trail is left to consumers.
 */
public sealed interface DocumentEvent
    permits DocumentValidatedEvent,
        DocumentStatusChangedEvent,
        DocumentPaymentRecordedEvent,
        DocumentTransformedEvent {

  String eventType();

  UUID documentId();

  DocumentType documentType();

  String documentNumber();

  /** Opaque id of the acting user. May be null for system actions. */
  UUID actorId();

  Instant occurredAt();

  Map<String, Object> details();
}
