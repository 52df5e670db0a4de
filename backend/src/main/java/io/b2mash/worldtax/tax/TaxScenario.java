package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.exception.InvalidAmountException;
import io.b2mash.worldtax.region.Region;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One taxable transaction between a seller and a buyer. Immutable; every calculation method
 * evaluates the scenario against the database it is given and never modifies either.
 *
 * <p>{@link #calculateTax}, {@link #calculateTaxDecimal} and {@link #getRates} are all derived from
 * {@link #evaluate}, so the amount charged and the rates shown never disagree.
 */
public final class TaxScenario {

  private static final Logger log = LoggerFactory.getLogger(TaxScenario.class);

  private static final JurisdictionClassifier CLASSIFIER = new JurisdictionClassifier();
  private static final CalculationPolicyResolver RESOLVER = new CalculationPolicyResolver();
  private static final RateAggregator AGGREGATOR = new RateAggregator();

  private final Region sourceRegion;
  private final Region destinationRegion;
  private final TransactionType transactionType;
  private final TradeAgreementOverride tradeAgreementOverride;
  private final boolean digitalProductOrService;
  private final boolean hasResaleCertificate;
  private final boolean buyerRegistered;
  private final boolean ignoreThreshold;
  private final RateTier rateTier;

  private TaxScenario(Builder builder) {
    this.sourceRegion = Objects.requireNonNull(builder.sourceRegion, "sourceRegion is required");
    this.destinationRegion =
        Objects.requireNonNull(builder.destinationRegion, "destinationRegion is required");
    this.transactionType =
        Objects.requireNonNull(builder.transactionType, "transactionType is required");
    this.tradeAgreementOverride = builder.tradeAgreementOverride;
    this.digitalProductOrService = builder.digitalProductOrService;
    this.hasResaleCertificate = builder.hasResaleCertificate;
    this.buyerRegistered = builder.buyerRegistered;
    this.ignoreThreshold = builder.ignoreThreshold;
    this.rateTier = builder.rateTier;
  }

  /** Scenario with default flags: no override, physical goods, no certificate, thresholds on. */
  public static TaxScenario of(Region source, Region destination, TransactionType type) {
    return builder(source, destination, type).build();
  }

  public static Builder builder(Region source, Region destination, TransactionType type) {
    return new Builder(source, destination, type);
  }

  public Builder toBuilder() {
    return new Builder(sourceRegion, destinationRegion, transactionType)
        .tradeAgreementOverride(tradeAgreementOverride)
        .digitalProductOrService(digitalProductOrService)
        .hasResaleCertificate(hasResaleCertificate)
        .buyerRegistered(buyerRegistered)
        .ignoreThreshold(ignoreThreshold)
        .rateTier(rateTier);
  }

  /** Evaluates the scenario once: classification, policy, rate lookup and aggregation. */
  public TaxBreakdown evaluate(BigDecimal amount, TaxDatabase database) {
    Objects.requireNonNull(database, "database must not be null");
    if (amount == null || amount.signum() < 0) {
      throw new InvalidAmountException(amount);
    }
    var classification = classify(database);
    var policy = RESOLVER.resolve(classification, this, amount);
    log.debug(
        "{} {} -> {}: scope={}, agreement={}, policy={}",
        transactionType,
        sourceRegion,
        destinationRegion,
        classification.scope(),
        classification.agreementName(),
        policy);
    return AGGREGATOR
        .aggregate(policy, sourceRegion, destinationRegion, rateTier, amount, database)
        .withAgreement(classification.agreementName());
  }

  public CalculationPolicy determineCalculationPolicy(TaxDatabase database, BigDecimal amount) {
    return RESOLVER.resolve(classify(database), this, amount);
  }

  /** Tax owed on {@code amount}, rounded per the database's currency rounding. */
  public double calculateTax(double amount, TaxDatabase database) {
    return calculateTaxDecimal(toDecimal(amount), database).doubleValue();
  }

  public BigDecimal calculateTaxDecimal(BigDecimal amount, TaxDatabase database) {
    return evaluate(amount, database).totalTax();
  }

  /** The rates applied to {@code amount}, each with its contribution. */
  public List<AppliedRate> getRates(BigDecimal amount, TaxDatabase database) {
    return evaluate(amount, database).appliedRates();
  }

  public List<AppliedRate> getRates(double amount, TaxDatabase database) {
    return getRates(toDecimal(amount), database);
  }

  public boolean isSameCountry() {
    return sourceRegion.isSameCountry(destinationRegion);
  }

  public Region sourceRegion() {
    return sourceRegion;
  }

  public Region destinationRegion() {
    return destinationRegion;
  }

  public TransactionType transactionType() {
    return transactionType;
  }

  public Optional<TradeAgreementOverride> tradeAgreementOverride() {
    return Optional.ofNullable(tradeAgreementOverride);
  }

  public boolean digitalProductOrService() {
    return digitalProductOrService;
  }

  public boolean hasResaleCertificate() {
    return hasResaleCertificate;
  }

  public boolean buyerRegistered() {
    return buyerRegistered;
  }

  public boolean ignoreThreshold() {
    return ignoreThreshold;
  }

  public Optional<RateTier> rateTier() {
    return Optional.ofNullable(rateTier);
  }

  @Override
  public String toString() {
    return "TaxScenario{"
        + transactionType
        + " "
        + sourceRegion
        + " -> "
        + destinationRegion
        + ", override="
        + tradeAgreementOverride
        + ", digital="
        + digitalProductOrService
        + ", resaleCertificate="
        + hasResaleCertificate
        + ", buyerRegistered="
        + buyerRegistered
        + ", ignoreThreshold="
        + ignoreThreshold
        + ", rateTier="
        + rateTier
        + "}";
  }

  private Classification classify(TaxDatabase database) {
    return CLASSIFIER.classify(
        sourceRegion, destinationRegion, tradeAgreementOverride, digitalProductOrService, database);
  }

  private static BigDecimal toDecimal(double amount) {
    if (Double.isNaN(amount) || Double.isInfinite(amount)) {
      throw new InvalidAmountException(amount);
    }
    return BigDecimal.valueOf(amount);
  }

  public static final class Builder {

    private final Region sourceRegion;
    private final Region destinationRegion;
    private final TransactionType transactionType;
    private TradeAgreementOverride tradeAgreementOverride;
    private boolean digitalProductOrService;
    private boolean hasResaleCertificate;
    private boolean buyerRegistered;
    private boolean ignoreThreshold;
    private RateTier rateTier;

    private Builder(Region source, Region destination, TransactionType type) {
      this.sourceRegion = source;
      this.destinationRegion = destination;
      this.transactionType = type;
    }

    public Builder tradeAgreementOverride(TradeAgreementOverride override) {
      this.tradeAgreementOverride = override;
      return this;
    }

    public Builder digitalProductOrService(boolean digital) {
      this.digitalProductOrService = digital;
      return this;
    }

    public Builder hasResaleCertificate(boolean hasResaleCertificate) {
      this.hasResaleCertificate = hasResaleCertificate;
      return this;
    }

    public Builder buyerRegistered(boolean buyerRegistered) {
      this.buyerRegistered = buyerRegistered;
      return this;
    }

    public Builder ignoreThreshold(boolean ignoreThreshold) {
      this.ignoreThreshold = ignoreThreshold;
      return this;
    }

    public Builder rateTier(RateTier rateTier) {
      this.rateTier = rateTier;
      return this;
    }

    public TaxScenario build() {
      return new TaxScenario(this);
    }
  }
}
