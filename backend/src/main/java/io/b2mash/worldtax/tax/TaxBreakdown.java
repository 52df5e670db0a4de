package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.region.Region;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Result of one evaluation. {@code totalTax} is always the exact sum of the applied rates' tax
 * amounts.
 *
 * @param policy the resolved calculation policy
 * @param agreementName trade agreement that governed the pair, or null
 * @param rateRegion region whose rates were applied, or null when no rates apply
 * @param appliedRates applied entries in application order
 * @param totalTax total tax owed
 */
public record TaxBreakdown(
    CalculationPolicy policy,
    String agreementName,
    Region rateRegion,
    List<AppliedRate> appliedRates,
    BigDecimal totalTax) {

  public TaxBreakdown {
    appliedRates = List.copyOf(appliedRates);
  }

  static TaxBreakdown untaxed(CalculationPolicy policy, CurrencyRounding rounding) {
    return new TaxBreakdown(policy, null, null, List.of(), rounding.apply(BigDecimal.ZERO));
  }

  TaxBreakdown withAgreement(String name) {
    return new TaxBreakdown(policy, name, rateRegion, appliedRates, totalTax);
  }

  public Optional<String> agreement() {
    return Optional.ofNullable(agreementName);
  }
}
