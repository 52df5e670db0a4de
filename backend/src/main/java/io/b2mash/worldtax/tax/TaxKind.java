package io.b2mash.worldtax.tax;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of consumption tax a rate entry levies. Reduced VAT tiers and the parking rate are alternate
 * tiers: they sit in the catalog next to the standard rate but only apply when a scenario selects
 * them explicitly.
 */
public enum TaxKind {
  VAT_STANDARD("vat_standard", false),
  VAT_REDUCED("vat_reduced", true),
  VAT_REDUCED_ALT("vat_reduced_alt", true),
  VAT_SUPER_REDUCED("vat_super_reduced", true),
  VAT_PARKING("vat_parking", true),
  VAT_ZERO("vat_zero", true),
  GST("gst", false),
  HST("hst", false),
  PST("pst", false),
  QST("qst", false),
  SALES_TAX("sales_tax", false);

  private final String key;
  private final boolean alternateTier;

  TaxKind(String key, boolean alternateTier) {
    this.key = key;
    this.alternateTier = alternateTier;
  }

  /** Identifier used in the rate document. */
  public String key() {
    return key;
  }

  public boolean isAlternateTier() {
    return alternateTier;
  }

  public static Optional<TaxKind> fromKey(String key) {
    return Arrays.stream(values()).filter(kind -> kind.key.equals(key)).findFirst();
  }
}
