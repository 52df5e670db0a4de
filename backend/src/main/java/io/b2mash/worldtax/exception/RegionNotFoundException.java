package io.b2mash.worldtax.exception;

import org.springframework.http.HttpStatus;

/** Thrown when a rate region has no entry in the rate catalog. Results in HTTP 422. */
public class RegionNotFoundException extends TaxProcessingException {

  private final String regionCode;

  public RegionNotFoundException(String regionCode) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        "Region not found",
        "No tax rates configured for region " + regionCode);
    this.regionCode = regionCode;
    getBody().setProperty("region", regionCode);
  }

  public String getRegionCode() {
    return regionCode;
  }
}
