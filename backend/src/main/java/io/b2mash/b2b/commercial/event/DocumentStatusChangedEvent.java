package io.b2mash.b2b.commercial.event;

import io.b2mash.b2b.commercial.engine.DocumentStatus;
import io.b2mash.b2b.commercial.engine.DocumentType;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record DocumentStatusChangedEvent(
    String eventType,
    UUID documentId,
    DocumentType documentType,
    String documentNumber,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    DocumentStatus oldStatus,
    DocumentStatus newStatus)
    implements DocumentEvent {}
