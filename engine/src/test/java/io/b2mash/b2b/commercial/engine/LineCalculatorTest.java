package io.b2mash.b2b.commercial.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class LineCalculatorTest {

  @Test
  void calculate_appliesDiscountThenTax() {
    var amounts =
        LineCalculator.calculate(
            new BigDecimal("3"), new BigDecimal("100"), new BigDecimal("10"), new BigDecimal("20"));

    assertThat(amounts.discountAmount()).isEqualByComparingTo("30");
    assertThat(amounts.subtotal()).isEqualByComparingTo("270");
    assertThat(amounts.taxAmount()).isEqualByComparingTo("54");
    assertThat(amounts.total()).isEqualByComparingTo("324");
  }

  @Test
  void calculate_isDeterministic() {
    var first =
        LineCalculator.calculate(
            new BigDecimal("1.3333"),
            new BigDecimal("19.99"),
            new BigDecimal("7.5"),
            new BigDecimal("5.5"));
    var second =
        LineCalculator.calculate(
            new BigDecimal("1.3333"),
            new BigDecimal("19.99"),
            new BigDecimal("7.5"),
            new BigDecimal("5.5"));

    assertThat(second).isEqualTo(first);
  }

  @Test
  void calculate_keepsFullPrecision() {
    var amounts =
        LineCalculator.calculate(
            new BigDecimal("0.333"),
            new BigDecimal("10.01"),
            BigDecimal.ZERO,
            new BigDecimal("20"));

    // 0.333 * 10.01 = 3.33333, tax = 0.666666
    assertThat(amounts.subtotal()).isEqualByComparingTo("3.33333");
    assertThat(amounts.taxAmount()).isEqualByComparingTo("0.666666");
    assertThat(amounts.forDisplay().total()).isEqualByComparingTo("4.00");
    assertThat(amounts.forDisplay().total().scale()).isEqualTo(2);
  }

  @Test
  void calculate_totalIsSubtotalPlusTax_andSubtotalIsBaseMinusDiscount() {
    var quantity = new BigDecimal("7");
    var unitPrice = new BigDecimal("12.345");
    var amounts =
        LineCalculator.calculate(quantity, unitPrice, new BigDecimal("33"), new BigDecimal("19.6"));

    assertThat(amounts.total()).isEqualByComparingTo(amounts.subtotal().add(amounts.taxAmount()));
    assertThat(amounts.subtotal())
        .isEqualByComparingTo(quantity.multiply(unitPrice).subtract(amounts.discountAmount()));
  }

  @Test
  void calculate_allowsTaxAbove100Percent() {
    var amounts =
        LineCalculator.calculate(
            BigDecimal.ONE, new BigDecimal("10"), BigDecimal.ZERO, new BigDecimal("150"));

    assertThat(amounts.total()).isEqualByComparingTo("25");
  }

  @Test
  void calculate_rejectsNegativeQuantity() {
    assertThatThrownBy(
            () ->
                LineCalculator.calculate(
                    new BigDecimal("-1"), BigDecimal.TEN, BigDecimal.ZERO, BigDecimal.ZERO))
        .isInstanceOf(InputRangeException.class)
        .extracting("field")
        .isEqualTo("quantity");
  }

  @Test
  void calculate_rejectsZeroQuantity() {
    assertThatThrownBy(
            () ->
                LineCalculator.calculate(
                    BigDecimal.ZERO, BigDecimal.TEN, BigDecimal.ZERO, BigDecimal.ZERO))
        .isInstanceOf(InputRangeException.class);
  }

  @Test
  void calculate_rejectsNegativeUnitPrice() {
    assertThatThrownBy(
            () ->
                LineCalculator.calculate(
                    BigDecimal.ONE, new BigDecimal("-0.01"), BigDecimal.ZERO, BigDecimal.ZERO))
        .isInstanceOf(InputRangeException.class)
        .extracting("field")
        .isEqualTo("unit_price");
  }

  @Test
  void calculate_rejectsDiscountOutsideRange() {
    assertThatThrownBy(
            () ->
                LineCalculator.calculate(
                    BigDecimal.ONE, BigDecimal.TEN, new BigDecimal("100.01"), BigDecimal.ZERO))
        .isInstanceOf(InputRangeException.class)
        .extracting("field")
        .isEqualTo("discount_percent");
    assertThatThrownBy(
            () ->
                LineCalculator.calculate(
                    BigDecimal.ONE, BigDecimal.TEN, new BigDecimal("-5"), BigDecimal.ZERO))
        .isInstanceOf(InputRangeException.class);
  }

  @Test
  void calculate_rejectsNegativeTaxRate() {
    assertThatThrownBy(
            () ->
                LineCalculator.calculate(
                    BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ZERO, new BigDecimal("-1")))
        .isInstanceOf(InputRangeException.class)
        .extracting("field")
        .isEqualTo("tax_rate");
  }

  @Test
  void calculate_rejectsMissingInput() {
    assertThatThrownBy(
            () -> LineCalculator.calculate(BigDecimal.ONE, null, BigDecimal.ZERO, BigDecimal.ZERO))
        .isInstanceOf(InputRangeException.class)
        .hasMessageContaining("unit_price");
  }

  @Test
  void fullDiscount_yieldsZeroTotal() {
    var amounts =
        LineCalculator.calculate(
            new BigDecimal("2"), new BigDecimal("40"), new BigDecimal("100"), new BigDecimal("20"));

    assertThat(amounts.subtotal()).isEqualByComparingTo("0");
    assertThat(amounts.total()).isEqualByComparingTo("0");
  }
}
