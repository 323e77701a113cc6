package io.b2mash.b2b.commercial.engine;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One priced item of a document. Only the inputs are held; amounts are always derived through
 * {@link LineCalculator}.
 *
 * @param id server-assigned identity, null for a line not yet persisted
 * @param lineNumber 1-based position within the document
 * @param productId optional catalogue reference, opaque to the engine
 * @param productCode optional catalogue code, opaque to the engine
 * @param description free text; must be non-blank before the document is validated
 * @param quantity greater than zero
 * @param unit optional unit of measure
 * @param unitPrice not negative
 * @param discountPercent 0 to 100
 * @param taxRate percentage, not negative
 * @param notes optional free text
 */
public record DocumentLine(
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
    String notes) {

  public DocumentLine {
    LineCalculator.checkInputs(quantity, unitPrice, discountPercent, taxRate);
  }

  /** Creates a line without identity, catalogue reference or notes. */
  public static DocumentLine of(
      int lineNumber,
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal discountPercent,
      BigDecimal taxRate) {
    return new DocumentLine(
        null,
        lineNumber,
        null,
        null,
        description,
        quantity,
        null,
        unitPrice,
        discountPercent,
        taxRate,
        null);
  }

  public LineAmounts amounts() {
    return LineCalculator.calculate(quantity, unitPrice, discountPercent, taxRate);
  }

  /** True once the line carries a non-blank description. */
  public boolean isComplete() {
    return description != null && !description.isBlank();
  }

  /** A value copy of this line without its identity, placed at {@code newLineNumber}. */
  public DocumentLine detached(int newLineNumber) {
    return new DocumentLine(
        null,
        newLineNumber,
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
