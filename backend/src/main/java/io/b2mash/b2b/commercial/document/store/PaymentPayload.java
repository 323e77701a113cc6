package io.b2mash.b2b.commercial.document.store;

import java.math.BigDecimal;
import java.time.Instant;

public record PaymentPayload(BigDecimal amount, String reference, Instant paidAt) {}
