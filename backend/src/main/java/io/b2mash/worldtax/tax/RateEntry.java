package io.b2mash.worldtax.tax;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One configured rate for a region. A compound entry applies to the amount plus all tax accumulated
 * before it in the region's sequence; a flat entry applies to the amount alone.
 *
 * @param taxKind the kind of tax levied
 * @param rate fraction between 0 and 1 (e.g. 0.19 for 19%)
 * @param compound whether the entry compounds on previously accumulated tax
 */
public record RateEntry(TaxKind taxKind, BigDecimal rate, boolean compound) {

  public RateEntry {
    Objects.requireNonNull(taxKind, "taxKind must not be null");
    Objects.requireNonNull(rate, "rate must not be null");
    if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException("rate must be between 0 and 1 but was " + rate);
    }
  }

  public static RateEntry flat(TaxKind taxKind, String rate) {
    return new RateEntry(taxKind, new BigDecimal(rate), false);
  }

  public static RateEntry compounding(TaxKind taxKind, String rate) {
    return new RateEntry(taxKind, new BigDecimal(rate), true);
  }
}
