package io.b2mash.b2b.timeledger.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Hour amounts are carried as {@link BigDecimal} with two decimals. */
public final class Hours {

  public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

  private Hours() {}

  public static BigDecimal of(String value) {
    return normalize(new BigDecimal(value));
  }

  public static BigDecimal normalize(BigDecimal value) {
    return value == null ? ZERO : value.setScale(2, RoundingMode.HALF_UP);
  }

  public static BigDecimal nonNegative(BigDecimal value) {
    return value.signum() < 0 ? ZERO : normalize(value);
  }
}
