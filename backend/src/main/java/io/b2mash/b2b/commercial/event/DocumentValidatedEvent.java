package io.b2mash.b2b.commercial.event;

import io.b2mash.b2b.commercial.engine.DocumentType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record DocumentValidatedEvent(
    String eventType,
    UUID documentId,
    DocumentType documentType,
    String documentNumber,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    int lineCount,
    BigDecimal total)
    implements DocumentEvent {}
