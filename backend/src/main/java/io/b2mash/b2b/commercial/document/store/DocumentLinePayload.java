package io.b2mash.b2b.commercial.document.store;

import io.b2mash.b2b.commercial.engine.DocumentLine;
import io.b2mash.b2b.commercial.engine.LineAmounts;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.UUID;

/** Wire form of a document line, including the totals the store keeps alongside the inputs. */
public record DocumentLinePayload(
    UUID id,
    @NotNull Integer lineNumber,
    UUID productId,
    String productCode,
    String description,
    @NotNull BigDecimal quantity,
    String unit,
    @NotNull BigDecimal unitPrice,
    @NotNull BigDecimal discountPercent,
    @NotNull BigDecimal taxRate,
    String notes,
    @NotNull BigDecimal subtotal,
    @NotNull BigDecimal discountAmount,
    @NotNull BigDecimal taxAmount,
    @NotNull BigDecimal total) {

  public static DocumentLinePayload from(DocumentLine line) {
    LineAmounts amounts = line.amounts().forDisplay();
    return new DocumentLinePayload(
        line.id(),
        line.lineNumber(),
        line.productId(),
        line.productCode(),
        line.description(),
        line.quantity(),
        line.unit(),
        line.unitPrice(),
        line.discountPercent(),
        line.taxRate(),
        line.notes(),
        amounts.subtotal(),
        amounts.discountAmount(),
        amounts.taxAmount(),
        amounts.total());
  }

  DocumentLine toLine() {
    return new DocumentLine(
        id,
        lineNumber,
        productId,
        productCode,
        description,
        quantity,
        unit,
        unitPrice,
        discountPercent,
        taxRate,
        notes);
  }
}
