package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.exception.InvalidAmountException;
import io.b2mash.worldtax.exception.RateNotFoundException;
import io.b2mash.worldtax.exception.RegionNotFoundException;
import io.b2mash.worldtax.region.Region;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Looks up the rates for a resolved policy and folds them into a tax amount.
 *
 * <p>Entries are applied left to right. A flat entry taxes the original amount; a compound entry
 * taxes the original amount plus the tax accumulated so far. Each contribution is rounded before it
 * joins the running total, so the applied rates always add up to the total.
 */
public class RateAggregator {

  public TaxBreakdown aggregate(
      CalculationPolicy policy,
      Region source,
      Region destination,
      RateTier rateTier,
      BigDecimal amount,
      TaxDatabase database) {
    if (amount == null || amount.signum() < 0) {
      throw new InvalidAmountException(amount);
    }
    var rounding = database.rounding();
    var rateRegion =
        switch (policy) {
          case ORIGIN -> source;
          case DESTINATION -> destination;
          case REVERSE_CHARGE, EXEMPT, ZERO_RATED, NONE -> null;
        };
    if (rateRegion == null) {
      return TaxBreakdown.untaxed(policy, rounding);
    }

    var entries = selectEntries(rateRegion, rateTier, database);
    var applied = new ArrayList<AppliedRate>(entries.size());
    var accumulated = BigDecimal.ZERO;
    for (RateEntry entry : entries) {
      var base = entry.compound() ? amount.add(accumulated) : amount;
      var tax = rounding.apply(base.multiply(entry.rate()));
      applied.add(new AppliedRate(entry, base, tax));
      accumulated = accumulated.add(tax);
    }
    return new TaxBreakdown(policy, null, rateRegion, applied, rounding.apply(accumulated));
  }

  List<RateEntry> selectEntries(Region region, RateTier rateTier, TaxDatabase database) {
    var entries =
        database.findRates(region).orElseThrow(() -> new RegionNotFoundException(region.code()));
    if (rateTier == null || rateTier == RateTier.STANDARD) {
      var standard = entries.stream().filter(entry -> !entry.taxKind().isAlternateTier()).toList();
      if (standard.isEmpty() && !entries.isEmpty()) {
        throw new RateNotFoundException(region.code(), RateTier.STANDARD.name());
      }
      return standard;
    }
    if (rateTier == RateTier.ZERO) {
      return List.of(new RateEntry(TaxKind.VAT_ZERO, BigDecimal.ZERO, false));
    }
    var tiered = entries.stream().filter(entry -> entry.taxKind() == rateTier.kind()).toList();
    if (tiered.isEmpty()) {
      throw new RateNotFoundException(region.code(), rateTier.name());
    }
    return tiered;
  }
}
