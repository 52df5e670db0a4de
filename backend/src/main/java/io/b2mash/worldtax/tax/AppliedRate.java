package io.b2mash.worldtax.tax;

import java.math.BigDecimal;

/**
 * A rate entry together with what it contributed to one evaluation.
 *
 * @param entry the configured entry
 * @param taxableBase amount the rate was applied to
 * @param taxAmount rounded contribution to the total
 */
public record AppliedRate(RateEntry entry, BigDecimal taxableBase, BigDecimal taxAmount) {

  public TaxKind taxKind() {
    return entry.taxKind();
  }

  public BigDecimal rate() {
    return entry.rate();
  }

  public boolean compound() {
    return entry.compound();
  }
}
