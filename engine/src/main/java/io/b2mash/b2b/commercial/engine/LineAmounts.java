package io.b2mash.b2b.commercial.engine;

import java.math.BigDecimal;

/**
 * Derived amounts of one document line, at full precision.
 *
 * @param subtotal quantity × unit price, less the line discount
 * @param discountAmount the line discount
 * @param taxAmount tax on the discounted subtotal
 * @param total subtotal + tax
 */
public record LineAmounts(
    BigDecimal subtotal, BigDecimal discountAmount, BigDecimal taxAmount, BigDecimal total) {

  /** Same amounts rounded for display. */
  public LineAmounts forDisplay() {
    return new LineAmounts(
        Amounts.forDisplay(subtotal),
        Amounts.forDisplay(discountAmount),
        Amounts.forDisplay(taxAmount),
        Amounts.forDisplay(total));
  }
}
