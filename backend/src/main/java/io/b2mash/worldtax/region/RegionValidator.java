package io.b2mash.worldtax.region;

import java.util.List;

/** Validates country and subdivision codes against an ISO-3166 source. */
public interface RegionValidator {

  /**
   * Returns a normalised region when both codes are known.
   *
   * @throws io.b2mash.worldtax.exception.RegionValidationException when either code is unknown
   */
  Region validate(String country, String subdivision);

  /** Validates a combined code such as "DE" or "US-CA". */
  default Region parse(String code) {
    if (code == null) {
      return validate(null, null);
    }
    int dash = code.indexOf('-');
    if (dash < 0) {
      return validate(code, null);
    }
    return validate(code.substring(0, dash), code.substring(dash + 1));
  }

  /** Lists every known country with its subdivisions, sorted by country code. */
  List<CountryInfo> countries();

  record CountryInfo(String code, String name, List<SubdivisionInfo> subdivisions) {

    public CountryInfo {
      subdivisions = List.copyOf(subdivisions);
    }
  }

  record SubdivisionInfo(String code, String name) {}
}
