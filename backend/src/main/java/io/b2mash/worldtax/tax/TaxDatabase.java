package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.exception.AgreementNotFoundException;
import io.b2mash.worldtax.region.Region;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.ObjectMapper;

/**
 * Immutable rate catalog and trade agreement registry. Built once and shared by every evaluation;
 * nothing reachable from it can be modified, so concurrent readers need no locking.
 *
 * <p>Agreements keep the order they were configured in. Auto-detection scans them in that order and
 * the first match wins.
 */
public final class TaxDatabase {

  private static final Logger log = LoggerFactory.getLogger(TaxDatabase.class);

  static final String BUILT_IN_RATES = "/tax/rates.json";
  static final String BUILT_IN_AGREEMENTS = "/tax/trade-agreements.json";

  private final Map<String, List<RateEntry>> rates;
  private final Map<String, TradeAgreement> agreements;
  private final CurrencyRounding rounding;

  public TaxDatabase(
      Map<String, List<RateEntry>> rates,
      Collection<TradeAgreement> agreements,
      CurrencyRounding rounding) {
    var rateCopy = new LinkedHashMap<String, List<RateEntry>>();
    rates.forEach((code, entries) -> rateCopy.put(code, List.copyOf(entries)));
    this.rates = Collections.unmodifiableMap(rateCopy);

    var agreementCopy = new LinkedHashMap<String, TradeAgreement>();
    for (TradeAgreement agreement : agreements) {
      if (agreementCopy.putIfAbsent(agreement.name(), agreement) != null) {
        throw new IllegalArgumentException("Duplicate trade agreement " + agreement.name());
      }
    }
    this.agreements = Collections.unmodifiableMap(agreementCopy);
    this.rounding = Objects.requireNonNull(rounding, "rounding must not be null");
    warnOnOverlappingMembers(this.agreements.values());
  }

  /** Parses the two JSON documents with a default mapper and cent rounding. */
  public static TaxDatabase fromJson(String ratesJson, String agreementsJson) {
    return new TaxDatabaseLoader(new ObjectMapper())
        .load(ratesJson, agreementsJson, CurrencyRounding.CENTS);
  }

  /** Loads the rate and agreement documents bundled on the classpath. */
  public static TaxDatabase builtIn() {
    return new TaxDatabaseLoader(new ObjectMapper())
        .loadClasspath(BUILT_IN_RATES, BUILT_IN_AGREEMENTS, CurrencyRounding.CENTS);
  }

  public TaxDatabase withRounding(CurrencyRounding rounding) {
    return new TaxDatabase(rates, agreements.values(), rounding);
  }

  /**
   * Rates for a region. An empty list means the region is configured without any tax.
   *
   * <p>A subdivision without its own entry borrows its country's entry, but only when that entry
   * carries at least one rate and no agreement lists the subdivision as a member. Otherwise the
   * region is reported as missing so the caller fails instead of charging nothing.
   */
  public Optional<List<RateEntry>> findRates(Region region) {
    var own = rates.get(region.code());
    if (own != null) {
      return Optional.of(own);
    }
    if (!region.hasSubdivision() || isAgreementMember(region.code())) {
      return Optional.empty();
    }
    var national = rates.get(region.country());
    if (national == null || national.isEmpty()) {
      return Optional.empty();
    }
    log.debug("No rates for {}, using {}", region.code(), region.country());
    return Optional.of(national);
  }

  private boolean isAgreementMember(String regionCode) {
    return agreements.values().stream().anyMatch(a -> a.members().contains(regionCode));
  }

  /** Agreements in registry order. */
  public List<TradeAgreement> agreements() {
    return List.copyOf(agreements.values());
  }

  public Optional<TradeAgreement> findAgreement(String name) {
    return Optional.ofNullable(agreements.get(name));
  }

  public TradeAgreement agreement(String name) {
    return findAgreement(name).orElseThrow(() -> new AgreementNotFoundException(name));
  }

  /** All configured rate regions keyed by code, in document order. */
  public Map<String, List<RateEntry>> rates() {
    return rates;
  }

  public CurrencyRounding rounding() {
    return rounding;
  }

  private static void warnOnOverlappingMembers(Collection<TradeAgreement> agreements) {
    var seen = new ArrayList<TradeAgreement>();
    for (TradeAgreement agreement : agreements) {
      for (TradeAgreement earlier : seen) {
        if (earlier.type() != agreement.type()) {
          continue;
        }
        var shared = new ArrayList<>(agreement.members());
        shared.retainAll(earlier.members());
        if (!shared.isEmpty()) {
          log.warn(
              "Trade agreements {} and {} share members {}; {} takes precedence",
              earlier.name(),
              agreement.name(),
              shared,
              earlier.name());
        }
      }
      seen.add(agreement);
    }
  }
}
