package io.b2mash.worldtax.tax;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of jurisdiction classification.
 *
 * @param scope how the pair relates to the agreement
 * @param agreement governing agreement, null for {@link Scope#NO_AGREEMENT}
 */
public record Classification(Scope scope, TradeAgreement agreement) {

  public enum Scope {
    /** Both parties are members of the agreement. */
    INTERNAL,
    /** The seller is a member, the buyer is not. */
    EXTERNAL_EXPORT,
    /** No agreement governs the pair. */
    NO_AGREEMENT
  }

  private static final Classification NONE = new Classification(Scope.NO_AGREEMENT, null);

  public Classification {
    Objects.requireNonNull(scope, "scope must not be null");
    if ((scope == Scope.NO_AGREEMENT) != (agreement == null)) {
      throw new IllegalArgumentException("agreement must be present unless scope is NO_AGREEMENT");
    }
  }

  public static Classification internal(TradeAgreement agreement) {
    return new Classification(Scope.INTERNAL, agreement);
  }

  public static Classification export(TradeAgreement agreement) {
    return new Classification(Scope.EXTERNAL_EXPORT, agreement);
  }

  public static Classification noAgreement() {
    return NONE;
  }

  public Optional<TradeAgreement> matchedAgreement() {
    return Optional.ofNullable(agreement);
  }

  public String agreementName() {
    return agreement != null ? agreement.name() : null;
  }
}
