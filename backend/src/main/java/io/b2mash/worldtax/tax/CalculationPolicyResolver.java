package io.b2mash.worldtax.tax;

import java.math.BigDecimal;

/**
 * Turns a classification and the transaction's attributes into one {@link CalculationPolicy}.
 * Thresholds compare the single transaction amount; callers tracking cumulative sales set {@code
 * ignoreThreshold} once their own total crosses the published limit.
 */
public class CalculationPolicyResolver {

  public CalculationPolicy resolve(
      Classification classification, TaxScenario scenario, BigDecimal amount) {
    var agreement = classification.agreement();
    return switch (classification.scope()) {
      case NO_AGREEMENT -> CalculationPolicy.DESTINATION;
      case EXTERNAL_EXPORT -> dispatch(agreement.rules().externalExport(), scenario, amount);
      case INTERNAL -> {
        if (agreement.isDestinationMember(scenario.destinationRegion())) {
          yield CalculationPolicy.DESTINATION;
        }
        yield agreement
            .rules()
            .internal(scenario.transactionType())
            .map(rule -> dispatch(rule, scenario, amount))
            .orElse(CalculationPolicy.DESTINATION);
      }
    };
  }

  CalculationPolicy dispatch(TaxRule rule, TaxScenario scenario, BigDecimal amount) {
    return switch (rule.type()) {
      case ORIGIN -> CalculationPolicy.ORIGIN;
      case DESTINATION -> CalculationPolicy.DESTINATION;
      case REVERSE_CHARGE -> CalculationPolicy.REVERSE_CHARGE;
      case ZERO_RATED -> CalculationPolicy.ZERO_RATED;
      case NONE -> CalculationPolicy.NONE;
      case EXEMPT -> exemption((TaxRule.Exempt) rule, scenario);
      case THRESHOLD_BASED ->
          dispatch(byThreshold((TaxRule.ThresholdBased) rule, scenario, amount), scenario, amount);
    };
  }

  private CalculationPolicy exemption(TaxRule.Exempt rule, TaxScenario scenario) {
    if (rule.requiresResaleCertificate() && !scenario.hasResaleCertificate()) {
      return CalculationPolicy.DESTINATION;
    }
    if (rule.requiresRegistration() && !scenario.buyerRegistered()) {
      return CalculationPolicy.DESTINATION;
    }
    return CalculationPolicy.EXEMPT;
  }

  private TaxRule byThreshold(
      TaxRule.ThresholdBased rule, TaxScenario scenario, BigDecimal amount) {
    boolean digital = scenario.digitalProductOrService() && rule.hasDigitalThreshold();
    var threshold = digital ? rule.thresholdDigital() : rule.threshold();
    var below = digital ? rule.belowDigital() : rule.below();
    var above = digital ? rule.aboveDigital() : rule.above();
    if (!scenario.ignoreThreshold() && amount.compareTo(threshold) < 0) {
      return below;
    }
    return above;
  }
}
