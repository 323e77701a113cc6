package io.b2mash.b2b.commercial.document.dto;

import io.b2mash.b2b.commercial.engine.DocumentTotals;
import io.b2mash.b2b.commercial.engine.LineAmounts;
import java.math.BigDecimal;
import java.util.List;

public record PreviewResponse(
    List<LinePreview> lines,
    BigDecimal subtotal,
    BigDecimal discountPercent,
    BigDecimal discountAmount,
    BigDecimal taxAmount,
    BigDecimal total) {

  public record LinePreview(
      int lineNumber,
      BigDecimal subtotal,
      BigDecimal discountAmount,
      BigDecimal taxAmount,
      BigDecimal total) {

    public static LinePreview from(int lineNumber, LineAmounts amounts) {
      var display = amounts.forDisplay();
      return new LinePreview(
          lineNumber,
          display.subtotal(),
          display.discountAmount(),
          display.taxAmount(),
          display.total());
    }
  }

  public static PreviewResponse from(List<LinePreview> lines, DocumentTotals totals) {
    var display = totals.forDisplay();
    return new PreviewResponse(
        lines,
        display.subtotal(),
        display.discountPercent(),
        display.discountAmount(),
        display.taxAmount(),
        display.total());
  }
}
