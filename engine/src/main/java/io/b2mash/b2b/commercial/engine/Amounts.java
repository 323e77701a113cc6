package io.b2mash.b2b.commercial.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Decimal helpers shared by the calculators. */
public final class Amounts {

  /** Fraction digits used when an amount leaves the engine for display. */
  public static final int DISPLAY_SCALE = 2;

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private Amounts() {}

  /**
   * Returns {@code percent}% of {@code base}. Division by 100 is exact, so no precision is lost.
   */
  public static BigDecimal percentOf(BigDecimal base, BigDecimal percent) {
    return base.multiply(percent).divide(HUNDRED);
  }

  /** Rounds to {@link #DISPLAY_SCALE} digits, HALF_UP. Never used on intermediate values. */
  public static BigDecimal forDisplay(BigDecimal amount) {
    return amount.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP);
  }

  /** Compares two amounts after rounding both to display scale. */
  public static boolean sameAtDisplayScale(BigDecimal a, BigDecimal b) {
    return forDisplay(a).compareTo(forDisplay(b)) == 0;
  }
}
