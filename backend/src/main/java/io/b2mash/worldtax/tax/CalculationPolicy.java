package io.b2mash.worldtax.tax;

/** How tax is computed for one transaction once all rules have been resolved. */
public enum CalculationPolicy {
  /** Seller's region rate. */
  ORIGIN,
  /** Buyer's region rate. */
  DESTINATION,
  /** Seller charges nothing; the buyer self-assesses. */
  REVERSE_CHARGE,
  /** Outside the scope of tax. */
  EXEMPT,
  /** Taxable at 0%; reported separately from exempt supplies. */
  ZERO_RATED,
  /** No consumption tax is configured for the transaction. */
  NONE;

  /** Whether a rate region is consulted under this policy. */
  public boolean usesRates() {
    return this == ORIGIN || this == DESTINATION;
  }
}
