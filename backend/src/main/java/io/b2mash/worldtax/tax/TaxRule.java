package io.b2mash.worldtax.tax;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A rule configured in one slot of a trade agreement. The set of rule kinds is closed; consumers
 * switch over {@link #type()} so that adding a kind breaks every switch that does not handle it.
 */
public sealed interface TaxRule {

  RuleType type();

  static TaxRule simple(RuleType type) {
    return switch (type) {
      case ORIGIN -> new Origin();
      case DESTINATION -> new Destination();
      case REVERSE_CHARGE -> new ReverseCharge();
      case EXEMPT -> new Exempt(false, false);
      case ZERO_RATED -> new ZeroRated();
      case NONE -> new NoTax();
      case THRESHOLD_BASED ->
          throw new IllegalArgumentException("threshold_based needs threshold parameters");
    };
  }

  record Origin() implements TaxRule {
    @Override
    public RuleType type() {
      return RuleType.ORIGIN;
    }
  }

  record Destination() implements TaxRule {
    @Override
    public RuleType type() {
      return RuleType.DESTINATION;
    }
  }

  record ReverseCharge() implements TaxRule {
    @Override
    public RuleType type() {
      return RuleType.REVERSE_CHARGE;
    }
  }

  /**
   * Exemption that may be conditional. When a condition is not met the buyer is charged at the
   * destination rate.
   */
  record Exempt(boolean requiresResaleCertificate, boolean requiresRegistration)
      implements TaxRule {
    @Override
    public RuleType type() {
      return RuleType.EXEMPT;
    }
  }

  record ZeroRated() implements TaxRule {
    @Override
    public RuleType type() {
      return RuleType.ZERO_RATED;
    }
  }

  record NoTax() implements TaxRule {
    @Override
    public RuleType type() {
      return RuleType.NONE;
    }
  }

  /**
   * Picks between two rules by comparing the transaction amount with a threshold. Digital products
   * use their own triple when one is configured, otherwise the physical triple. Nested thresholds
   * are not allowed.
   */
  record ThresholdBased(
      BigDecimal threshold,
      TaxRule below,
      TaxRule above,
      BigDecimal thresholdDigital,
      TaxRule belowDigital,
      TaxRule aboveDigital)
      implements TaxRule {

    public ThresholdBased {
      Objects.requireNonNull(threshold, "threshold must not be null");
      Objects.requireNonNull(below, "below must not be null");
      Objects.requireNonNull(above, "above must not be null");
      requireSimple(below);
      requireSimple(above);
      boolean anyDigital = thresholdDigital != null || belowDigital != null || aboveDigital != null;
      boolean allDigital = thresholdDigital != null && belowDigital != null && aboveDigital != null;
      if (anyDigital && !allDigital) {
        throw new IllegalArgumentException(
            "digital threshold, below and above rules must be configured together");
      }
      if (allDigital) {
        requireSimple(belowDigital);
        requireSimple(aboveDigital);
      }
    }

    public ThresholdBased(BigDecimal threshold, TaxRule below, TaxRule above) {
      this(threshold, below, above, null, null, null);
    }

    @Override
    public RuleType type() {
      return RuleType.THRESHOLD_BASED;
    }

    public boolean hasDigitalThreshold() {
      return thresholdDigital != null;
    }

    private static void requireSimple(TaxRule rule) {
      if (rule.type() == RuleType.THRESHOLD_BASED) {
        throw new IllegalArgumentException("threshold rules cannot be nested");
      }
    }
  }
}
