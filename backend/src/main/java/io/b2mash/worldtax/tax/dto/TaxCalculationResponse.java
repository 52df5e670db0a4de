package io.b2mash.worldtax.tax.dto;

import io.b2mash.worldtax.region.Region;
import io.b2mash.worldtax.tax.CalculationPolicy;
import io.b2mash.worldtax.tax.TaxBreakdown;
import io.b2mash.worldtax.tax.TaxScenario;
import io.b2mash.worldtax.tax.TransactionType;
import java.math.BigDecimal;
import java.util.List;

public record TaxCalculationResponse(
    String source,
    String destination,
    TransactionType transactionType,
    BigDecimal amount,
    CalculationPolicy policy,
    String tradeAgreement,
    String rateRegion,
    List<AppliedRateResponse> appliedRates,
    BigDecimal totalTax) {

  public static TaxCalculationResponse from(
      TaxScenario scenario, BigDecimal amount, TaxBreakdown breakdown) {
    return new TaxCalculationResponse(
        scenario.sourceRegion().code(),
        scenario.destinationRegion().code(),
        scenario.transactionType(),
        amount,
        breakdown.policy(),
        breakdown.agreementName(),
        code(breakdown.rateRegion()),
        breakdown.appliedRates().stream().map(AppliedRateResponse::from).toList(),
        breakdown.totalTax());
  }

  private static String code(Region region) {
    return region != null ? region.code() : null;
  }
}
