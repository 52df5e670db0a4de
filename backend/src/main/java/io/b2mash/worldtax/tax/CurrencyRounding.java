package io.b2mash.worldtax.tax;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/** Rounding applied to every tax contribution. */
public record CurrencyRounding(int scale, RoundingMode mode) {

  public static final CurrencyRounding CENTS = new CurrencyRounding(2, RoundingMode.HALF_UP);

  public CurrencyRounding {
    Objects.requireNonNull(mode, "mode must not be null");
    if (scale < 0) {
      throw new IllegalArgumentException("scale must not be negative but was " + scale);
    }
  }

  public BigDecimal apply(BigDecimal value) {
    return value.setScale(scale, mode);
  }
}
