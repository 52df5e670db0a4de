package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.region.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which trade agreement, if any, governs a pair of regions. Auto-detection scans the
 * registry in configuration order: first for an agreement that covers the pair as internal trade,
 * then for one the seller exports out of. Pure; reads the database only.
 */
public class JurisdictionClassifier {

  private static final Logger log = LoggerFactory.getLogger(JurisdictionClassifier.class);

  public Classification classify(
      Region source,
      Region destination,
      TradeAgreementOverride override,
      boolean digitalProductOrService,
      TaxDatabase database) {
    if (override instanceof TradeAgreementOverride.NoAgreement) {
      return Classification.noAgreement();
    }
    if (override instanceof TradeAgreementOverride.UseAgreement useAgreement) {
      // Override skips membership and coverage checks
      var agreement = database.agreement(useAgreement.name());
      return agreement.includes(source) && !agreement.includes(destination)
          ? Classification.export(agreement)
          : Classification.internal(agreement);
    }

    var classification = detect(source, destination, database);
    var agreement = classification.agreement();
    if (agreement != null && !agreement.appliesTo().covers(digitalProductOrService)) {
      log.debug(
          "Agreement {} does not cover {} supplies, treating {} -> {} as plain cross-border",
          agreement.name(),
          digitalProductOrService ? "digital" : "physical",
          source,
          destination);
      return Classification.noAgreement();
    }
    return classification;
  }

  private Classification detect(Region source, Region destination, TaxDatabase database) {
    var agreements = database.agreements();
    for (TradeAgreement agreement : agreements) {
      if (agreement.governsInternally(source, destination)) {
        return Classification.internal(agreement);
      }
    }
    for (TradeAgreement agreement : agreements) {
      if (agreement.includes(source) && !agreement.includes(destination)) {
        return Classification.export(agreement);
      }
    }
    return Classification.noAgreement();
  }
}
