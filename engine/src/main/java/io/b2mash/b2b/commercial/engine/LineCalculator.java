package io.b2mash.b2b.commercial.engine;

import java.math.BigDecimal;

/**
 * Converts one line's quantity, unit price, discount and tax rate into its derived amounts.
 *
 * <p>Order of computation: base = quantity × unitPrice; discount = base × discount%; subtotal =
 * base − discount; tax = subtotal × taxRate%; total = subtotal + tax. Nothing is rounded here;
 * see {@link Amounts#forDisplay(BigDecimal)}.
 */
public final class LineCalculator {

  private static final BigDecimal MAX_DISCOUNT_PERCENT = BigDecimal.valueOf(100);

  private LineCalculator() {}

  /**
   * Calculates the amounts of a single line.
   *
   * @param quantity must be greater than zero
   * @param unitPrice must not be negative
   * @param discountPercent between 0 and 100 inclusive
   * @param taxRate percentage, must not be negative (may exceed 100)
   * @return the line amounts
   * @throws InputRangeException if an input is missing or out of range
   */
  public static LineAmounts calculate(
      BigDecimal quantity, BigDecimal unitPrice, BigDecimal discountPercent, BigDecimal taxRate) {
    checkInputs(quantity, unitPrice, discountPercent, taxRate);

    BigDecimal base = quantity.multiply(unitPrice);
    BigDecimal discountAmount = Amounts.percentOf(base, discountPercent);
    BigDecimal subtotal = base.subtract(discountAmount);
    BigDecimal taxAmount = Amounts.percentOf(subtotal, taxRate);
    return new LineAmounts(subtotal, discountAmount, taxAmount, subtotal.add(taxAmount));
  }

  /**
   * Checks the monetary inputs of a line without computing anything.
   *
   * @throws InputRangeException naming the first offending field
   */
  public static void checkInputs(
      BigDecimal quantity, BigDecimal unitPrice, BigDecimal discountPercent, BigDecimal taxRate) {
    requirePresent("quantity", quantity);
    requirePresent("unit_price", unitPrice);
    requirePresent("discount_percent", discountPercent);
    requirePresent("tax_rate", taxRate);

    if (quantity.signum() <= 0) {
      throw new InputRangeException("quantity", "Quantity must be greater than 0, got " + quantity);
    }
    if (unitPrice.signum() < 0) {
      throw new InputRangeException(
          "unit_price", "Unit price must not be negative, got " + unitPrice);
    }
    checkDiscountPercent(discountPercent);
    if (taxRate.signum() < 0) {
      throw new InputRangeException("tax_rate", "Tax rate must not be negative, got " + taxRate);
    }
  }

  /** Also used for the document-level discount. */
  static void checkDiscountPercent(BigDecimal discountPercent) {
    requirePresent("discount_percent", discountPercent);
    if (discountPercent.signum() < 0 || discountPercent.compareTo(MAX_DISCOUNT_PERCENT) > 0) {
      throw new InputRangeException(
          "discount_percent", "Discount must be between 0 and 100, got " + discountPercent);
    }
  }

  private static void requirePresent(String field, BigDecimal value) {
    if (value == null) {
      throw new InputRangeException(field, "Field " + field + " is required");
    }
  }
}
