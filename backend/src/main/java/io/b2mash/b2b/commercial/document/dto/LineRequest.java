package io.b2mash.b2b.commercial.document.dto;

import io.b2mash.b2b.commercial.engine.DocumentLine;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.UUID;

/** One line as entered by a user. Missing discount and tax default to zero. */
public record LineRequest(
    UUID productId,
    @Size(max = 50) String productCode,
    @Size(max = 500) String description,
    @NotNull @Positive BigDecimal quantity,
    @Size(max = 20) String unit,
    @NotNull @PositiveOrZero BigDecimal unitPrice,
    @PositiveOrZero @DecimalMax("100") BigDecimal discountPercent,
    @PositiveOrZero BigDecimal taxRate,
    String notes) {

  public DocumentLine toLine(int lineNumber) {
    return new DocumentLine(
        null,
        lineNumber,
        productId,
        productCode,
        description,
        quantity,
        unit,
        unitPrice,
        discountPercent != null ? discountPercent : BigDecimal.ZERO,
        taxRate != null ? taxRate : BigDecimal.ZERO,
        notes);
  }
}
