package io.b2mash.worldtax.tax;

/**
 * Explicit rate tier a scenario may request instead of the region's default entries. {@link
 * #STANDARD} selects the default entries; {@link #ZERO} always yields a single zero-rate entry.
 */
public enum RateTier {
  STANDARD(null),
  REDUCED(TaxKind.VAT_REDUCED),
  REDUCED_ALT(TaxKind.VAT_REDUCED_ALT),
  SUPER_REDUCED(TaxKind.VAT_SUPER_REDUCED),
  PARKING(TaxKind.VAT_PARKING),
  ZERO(TaxKind.VAT_ZERO);

  private final TaxKind kind;

  RateTier(TaxKind kind) {
    this.kind = kind;
  }

  /** Catalog kind this tier selects, or null for the region's default entries. */
  public TaxKind kind() {
    return kind;
  }
}
