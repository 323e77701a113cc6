package io.b2mash.b2b.commercial.engine;

import java.math.BigDecimal;

/**
 * Document-level totals, at full precision. {@code total = subtotal − discountAmount +
 * taxAmount}.
 */
public record DocumentTotals(
    BigDecimal subtotal,
    BigDecimal discountPercent,
    BigDecimal discountAmount,
    BigDecimal taxAmount,
    BigDecimal total) {

  public DocumentTotals forDisplay() {
    return new DocumentTotals(
        Amounts.forDisplay(subtotal),
        discountPercent,
        Amounts.forDisplay(discountAmount),
        Amounts.forDisplay(taxAmount),
        Amounts.forDisplay(total));
  }
}
