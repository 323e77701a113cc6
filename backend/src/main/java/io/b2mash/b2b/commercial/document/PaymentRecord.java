package io.b2mash.b2b.commercial.document;

import java.math.BigDecimal;
import java.time.Instant;

/** A payment accepted by the lifecycle engine, ready to be stored. */
public record PaymentRecord(BigDecimal amount, String reference, Instant paidAt) {}
