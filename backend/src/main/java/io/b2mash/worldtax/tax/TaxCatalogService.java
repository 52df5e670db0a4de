package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.exception.RegionNotFoundException;
import io.b2mash.worldtax.region.RegionValidator;
import io.b2mash.worldtax.tax.dto.RateEntryResponse;
import io.b2mash.worldtax.tax.dto.RegionRatesResponse;
import io.b2mash.worldtax.tax.dto.TradeAgreementResponse;
import java.util.List;
import org.springframework.stereotype.Service;

/** Read-only views of the loaded rate catalog and agreement registry. */
@Service
public class TaxCatalogService {

  private final TaxDatabase taxDatabase;
  private final RegionValidator regionValidator;

  public TaxCatalogService(TaxDatabase taxDatabase, RegionValidator regionValidator) {
    this.taxDatabase = taxDatabase;
    this.regionValidator = regionValidator;
  }

  public RegionRatesResponse ratesFor(String regionCode) {
    var region = regionValidator.parse(regionCode);
    var entries =
        taxDatabase
            .findRates(region)
            .orElseThrow(() -> new RegionNotFoundException(region.code()));
    var configuredFor =
        taxDatabase.rates().containsKey(region.code()) ? region.code() : region.country();
    return new RegionRatesResponse(
        region.code(), configuredFor, entries.stream().map(RateEntryResponse::from).toList());
  }

  public List<TradeAgreementResponse> listAgreements() {
    return taxDatabase.agreements().stream().map(TradeAgreementResponse::from).toList();
  }
}
