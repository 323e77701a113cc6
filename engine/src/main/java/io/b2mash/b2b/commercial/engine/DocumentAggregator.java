package io.b2mash.b2b.commercial.engine;

import java.math.BigDecimal;
import java.util.List;

/**
 * Sums a document's lines into document totals. Totals are recomputed from the complete line list
 * on every call, never patched incrementally.
 */
public final class DocumentAggregator {

  private DocumentAggregator() {}

  /** Aggregates lines with no document-level discount. */
  public static DocumentTotals aggregate(List<DocumentLine> lines) {
    return aggregate(lines, BigDecimal.ZERO);
  }

  /**
   * Aggregates lines and applies a document-level discount to the summed line subtotals. Tax is
   * the sum of line taxes and is not reduced by the document discount.
   *
   * @param lines all lines of the document
   * @param discountPercent document discount, 0 to 100
   * @return the document totals
   * @throws InputRangeException if the discount is out of range
   */
  public static DocumentTotals aggregate(List<DocumentLine> lines, BigDecimal discountPercent) {
    LineCalculator.checkDiscountPercent(discountPercent);

    BigDecimal subtotal = BigDecimal.ZERO;
    BigDecimal taxAmount = BigDecimal.ZERO;
    for (DocumentLine line : lines) {
      LineAmounts amounts = line.amounts();
      subtotal = subtotal.add(amounts.subtotal());
      taxAmount = taxAmount.add(amounts.taxAmount());
    }

    BigDecimal discountAmount = Amounts.percentOf(subtotal, discountPercent);
    BigDecimal total = subtotal.subtract(discountAmount).add(taxAmount);
    return new DocumentTotals(subtotal, discountPercent, discountAmount, taxAmount, total);
  }
}
