package io.b2mash.b2b.commercial.document.dto;

import io.b2mash.b2b.commercial.engine.DocumentLine;
import io.b2mash.b2b.commercial.engine.LineAmounts;
import java.math.BigDecimal;
import java.util.UUID;

public record DocumentLineResponse(
    UUID id,
    int lineNumber,
    UUID productId,
    String productCode,
    String description,
    BigDecimal quantity,
    String unit,
    BigDecimal unitPrice,
    BigDecimal discountPercent,
    BigDecimal taxRate,
    String notes,
    BigDecimal subtotal,
    BigDecimal discountAmount,
    BigDecimal taxAmount,
    BigDecimal total) {

  public static DocumentLineResponse from(DocumentLine line) {
    LineAmounts amounts = line.amounts().forDisplay();
    return new DocumentLineResponse(
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
}
