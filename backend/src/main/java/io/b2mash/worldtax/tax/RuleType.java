package io.b2mash.worldtax.tax;

import java.util.Arrays;
import java.util.Optional;

/** Discriminator of {@link TaxRule}, as written in the agreement document. */
public enum RuleType {
  ORIGIN("origin"),
  DESTINATION("destination"),
  REVERSE_CHARGE("reverse_charge"),
  EXEMPT("exempt"),
  ZERO_RATED("zero_rated"),
  NONE("none"),
  THRESHOLD_BASED("threshold_based");

  private final String key;

  RuleType(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static Optional<RuleType> fromKey(String key) {
    return Arrays.stream(values()).filter(type -> type.key.equals(key)).findFirst();
  }
}
