package io.b2mash.b2b.commercial.document;

import io.b2mash.b2b.commercial.engine.DocumentStatus;
import java.time.Instant;
import java.util.UUID;

/** A status change already accepted by the lifecycle engine, ready to be stored. */
public record StatusChange(DocumentStatus status, Instant occurredAt, UUID actorId) {}
