package io.b2mash.b2b.commercial.document.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.List;

/** Unsaved input to price. Nothing is stored. */
public record PreviewRequest(
    @PositiveOrZero @DecimalMax("100") BigDecimal discountPercent,
    @NotNull List<@Valid @NotNull LineRequest> lines) {}
