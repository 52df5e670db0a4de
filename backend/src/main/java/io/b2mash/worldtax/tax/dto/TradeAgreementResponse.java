package io.b2mash.worldtax.tax.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.b2mash.worldtax.tax.AppliesTo;
import io.b2mash.worldtax.tax.TaxRule;
import io.b2mash.worldtax.tax.TradeAgreement;
import java.math.BigDecimal;
import java.util.List;

public record TradeAgreementResponse(
    String name,
    String displayName,
    String type,
    List<String> members,
    List<String> destinationMembers,
    AppliesTo appliesTo,
    TaxRuleResponse internalB2b,
    TaxRuleResponse internalB2c,
    TaxRuleResponse externalExport) {

  public static TradeAgreementResponse from(TradeAgreement agreement) {
    var rules = agreement.rules();
    return new TradeAgreementResponse(
        agreement.name(),
        agreement.displayName(),
        agreement.type().key(),
        List.copyOf(agreement.members()),
        List.copyOf(agreement.destinationMembers()),
        agreement.appliesTo(),
        TaxRuleResponse.from(rules.internalB2b()),
        TaxRuleResponse.from(rules.internalB2c()),
        TaxRuleResponse.from(rules.externalExport()));
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record TaxRuleResponse(
      String type,
      BigDecimal threshold,
      TaxRuleResponse belowThreshold,
      TaxRuleResponse aboveThreshold,
      BigDecimal thresholdDigitalProducts,
      TaxRuleResponse belowThresholdDigitalProducts,
      TaxRuleResponse aboveThresholdDigitalProducts,
      Boolean requiresResaleCertificate,
      Boolean requiresRegistration) {

    static TaxRuleResponse from(TaxRule rule) {
      if (rule == null) {
        return null;
      }
      var type = rule.type().key();
      switch (rule.type()) {
        case THRESHOLD_BASED -> {
          var threshold = (TaxRule.ThresholdBased) rule;
          return new TaxRuleResponse(
              type,
              threshold.threshold(),
              from(threshold.below()),
              from(threshold.above()),
              threshold.thresholdDigital(),
              from(threshold.belowDigital()),
              from(threshold.aboveDigital()),
              null,
              null);
        }
        case EXEMPT -> {
          var exempt = (TaxRule.Exempt) rule;
          return new TaxRuleResponse(
              type,
              null,
              null,
              null,
              null,
              null,
              null,
              exempt.requiresResaleCertificate(),
              exempt.requiresRegistration());
        }
        default -> {
          return new TaxRuleResponse(type, null, null, null, null, null, null, null, null);
        }
      }
    }
  }
}
