package io.b2mash.b2b.commercial.document.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

public record PaymentRequest(
    @NotNull @Positive BigDecimal amount,
    @Size(max = 100) String reference,
    Instant paidAt) {}
