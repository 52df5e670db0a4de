package io.b2mash.worldtax.exception;

import org.springframework.http.HttpStatus;

/** Thrown when a region is configured but has no entry for the requested rate tier. */
public class RateNotFoundException extends TaxProcessingException {

  private final String regionCode;
  private final String tier;

  public RateNotFoundException(String regionCode, String tier) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        "Rate not found",
        "No " + tier + " rate configured for region " + regionCode);
    this.regionCode = regionCode;
    this.tier = tier;
    getBody().setProperty("region", regionCode);
    getBody().setProperty("tier", tier);
  }

  public String getRegionCode() {
    return regionCode;
  }

  public String getTier() {
    return tier;
  }
}
