package io.b2mash.worldtax.tax;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of trade agreement. A customs union governs trade between its member countries; a federal
 * state agreement governs trade between subdivisions of one country.
 */
public enum AgreementType {
  CUSTOMS_UNION("customs_union"),
  FEDERAL_STATE("federal_state");

  private final String key;

  AgreementType(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static Optional<AgreementType> fromKey(String key) {
    return Arrays.stream(values()).filter(type -> type.key.equals(key)).findFirst();
  }
}
