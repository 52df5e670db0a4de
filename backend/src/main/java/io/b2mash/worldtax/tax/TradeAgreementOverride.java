package io.b2mash.worldtax.tax;

import java.util.Objects;

/** Caller override of agreement auto-detection. */
public sealed interface TradeAgreementOverride {

  static TradeAgreementOverride useAgreement(String name) {
    return new UseAgreement(name);
  }

  static TradeAgreementOverride noAgreement() {
    return new NoAgreement();
  }

  /** Apply the named agreement without membership checks. */
  record UseAgreement(String name) implements TradeAgreementOverride {
    public UseAgreement {
      Objects.requireNonNull(name, "name must not be null");
    }
  }

  /** Treat the pair as plain cross-border trade. */
  record NoAgreement() implements TradeAgreementOverride {}
}
