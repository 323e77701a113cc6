package io.b2mash.b2b.commercial.document.store;

import java.time.Instant;
import java.util.UUID;

public record StatusChangePayload(String status, Instant occurredAt, UUID actorId) {}
