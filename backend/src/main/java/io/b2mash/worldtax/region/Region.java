package io.b2mash.worldtax.region;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A tax jurisdiction: an ISO 3166-1 alpha-2 country with an optional ISO 3166-2 subdivision.
 * Codes are upper-cased and the subdivision is stored without its country prefix, so {@code
 * Region("us", "US-ca")} and {@code Region("US", "CA")} are equal.
 *
 * <p>The canonical constructor only normalises; use {@link #of(String, String)} to validate against
 * the ISO reference list.
 *
 * @param country ISO 3166-1 alpha-2 country code
 * @param subdivision subdivision suffix (e.g. "CA" for "US-CA"), or null
 */
public record Region(String country, String subdivision) {

  public Region {
    Objects.requireNonNull(country, "country must not be null");
    country = country.trim().toUpperCase(Locale.ROOT);
    if (subdivision != null) {
      subdivision = subdivision.trim().toUpperCase(Locale.ROOT);
      if (subdivision.startsWith(country + "-")) {
        subdivision = subdivision.substring(country.length() + 1);
      }
      if (subdivision.isEmpty()) {
        subdivision = null;
      }
    }
  }

  /** Validates and creates a region using the bundled ISO reference list. */
  public static Region of(String country, String subdivision) {
    return IsoRegionValidator.standard().validate(country, subdivision);
  }

  public static Region of(String country) {
    return of(country, null);
  }

  /** Parses "DE" or "US-CA" and validates the result. */
  public static Region parse(String code) {
    Objects.requireNonNull(code, "code must not be null");
    return IsoRegionValidator.standard().parse(code);
  }

  public Optional<String> subdivisionCode() {
    return Optional.ofNullable(subdivision).map(s -> country + "-" + s);
  }

  public boolean hasSubdivision() {
    return subdivision != null;
  }

  /** Identifier used by the rate catalog and agreement membership: "DE" or "US-CA". */
  public String code() {
    return subdivision == null ? country : country + "-" + subdivision;
  }

  /** Returns the country-level region this region belongs to. */
  public Region countryRegion() {
    return hasSubdivision() ? new Region(country, null) : this;
  }

  public boolean isSameCountry(Region other) {
    return country.equals(other.country);
  }

  @Override
  public String toString() {
    return code();
  }
}
