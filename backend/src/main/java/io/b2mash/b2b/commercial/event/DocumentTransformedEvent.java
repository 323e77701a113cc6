package io.b2mash.b2b.commercial.event;

import io.b2mash.b2b.commercial.engine.DocumentType;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Published after a document derived from another one has been created. {@code documentId} is the
 * source; {@code childId} the new document.
 */
public record DocumentTransformedEvent(
    String eventType,
    UUID documentId,
    DocumentType documentType,
    String documentNumber,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID childId,
    DocumentType childType,
    String childNumber)
    implements DocumentEvent {}
