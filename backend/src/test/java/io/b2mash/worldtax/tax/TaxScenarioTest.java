package io.b2mash.worldtax.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.worldtax.exception.AgreementNotFoundException;
import io.b2mash.worldtax.exception.InvalidAmountException;
import io.b2mash.worldtax.exception.RateNotFoundException;
import io.b2mash.worldtax.exception.RegionNotFoundException;
import io.b2mash.worldtax.region.Region;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/** End-to-end evaluations against the bundled rate and agreement documents. */
class TaxScenarioTest {

  private static TaxDatabase database;

  @BeforeAll
  static void loadDatabase() {
    database = TaxDatabase.builtIn();
  }

  private static TaxScenario.Builder scenario(
      String source, String destination, TransactionType type) {
    return TaxScenario.builder(Region.parse(source), Region.parse(destination), type);
  }

  @Test
  void domesticGermanSale_b2c_chargesGermanVat() {
    var scenario = scenario("DE", "DE", TransactionType.B2C).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(19.0);
    assertThat(scenario.getRates(100.0, database))
        .singleElement()
        .satisfies(
            rate -> {
              assertThat(rate.taxKind()).isEqualTo(TaxKind.VAT_STANDARD);
              assertThat(rate.rate()).isEqualByComparingTo("0.19");
              assertThat(rate.compound()).isFalse();
            });
  }

  @Test
  void domesticGermanSale_b2b_isNotReverseCharged() {
    var scenario = scenario("DE", "DE", TransactionType.B2B).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(19.0);
  }

  @Test
  void britishColumbiaDomestic_belowSmallSupplierThreshold_isZeroRated() {
    var scenario = scenario("CA-BC", "CA-BC", TransactionType.B2C).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(0.0);
    assertThat(scenario.determineCalculationPolicy(database, new BigDecimal("100")))
        .isEqualTo(CalculationPolicy.ZERO_RATED);
  }

  @Test
  void britishColumbiaDomestic_ignoringThreshold_compoundsPstOnGst() {
    var scenario = scenario("CA-BC", "CA-BC", TransactionType.B2C).ignoreThreshold(true).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(12.35);
  }

  @Test
  void britishColumbiaDomestic_aboveThreshold_chargesGstAndPst() {
    var scenario = scenario("CA-BC", "CA-BC", TransactionType.B2C).build();

    assertThat(scenario.calculateTax(100000.0, database)).isEqualTo(12350.0);
  }

  @Test
  void harmonizedProvince_usesDestinationHstBelowThreshold() {
    var scenario = scenario("CA-AB", "CA-ON", TransactionType.B2C).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(13.0);
  }

  @Test
  void intraEu_b2b_isReverseCharged() {
    var physical = scenario("DE", "FR", TransactionType.B2B).build();
    var digital = physical.toBuilder().digitalProductOrService(true).build();

    assertThat(physical.calculateTax(100.0, database)).isEqualTo(0.0);
    assertThat(digital.calculateTax(100.0, database)).isEqualTo(0.0);
    assertThat(physical.evaluate(new BigDecimal("100"), database).policy())
        .isEqualTo(CalculationPolicy.REVERSE_CHARGE);
  }

  @Test
  void intraEu_b2cBelowDistanceSellingThreshold_chargesOriginVat() {
    var scenario = scenario("DE", "FR", TransactionType.B2C).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(19.0);
  }

  @Test
  void intraEu_b2cDigital_chargesDestinationVat() {
    var scenario =
        scenario("DE", "FR", TransactionType.B2C).digitalProductOrService(true).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(20.0);
  }

  @Test
  void frenchDomestic_reducedAltTier_chargesReducedAltRate() {
    var scenario = scenario("FR", "FR", TransactionType.B2C).rateTier(RateTier.REDUCED_ALT).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(5.5);
  }

  @Test
  void exportOutOfEu_isZeroRated() {
    assertThat(scenario("DE", "TH", TransactionType.B2B).build().calculateTax(100.0, database))
        .isEqualTo(0.0);
    assertThat(scenario("DE", "TH", TransactionType.B2C).build().calculateTax(100.0, database))
        .isEqualTo(0.0);
  }

  @Test
  void gulfCooperationCouncil_b2bIsReverseCharged_b2cChargesOrigin() {
    assertThat(scenario("AE", "QA", TransactionType.B2B).build().calculateTax(100.0, database))
        .isEqualTo(0.0);
    assertThat(scenario("AE", "QA", TransactionType.B2C).build().calculateTax(100.0, database))
        .isEqualTo(5.0);
  }

  @Test
  void interstateSale_b2cBelowNexusThreshold_isZeroRated() {
    var scenario = scenario("US-CA", "US-WA", TransactionType.B2C).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(0.0);
    assertThat(scenario.calculateTax(100000.0, database)).isEqualTo(6500.0);
    assertThat(scenario.toBuilder().ignoreThreshold(true).build().calculateTax(100.0, database))
        .isEqualTo(6.5);
  }

  @Test
  void interstateSale_b2bWithResaleCertificate_isExempt() {
    var withCertificate =
        scenario("US-TX", "US-WA", TransactionType.B2B).hasResaleCertificate(true).build();
    var reverse =
        scenario("US-WA", "US-TX", TransactionType.B2B).hasResaleCertificate(true).build();

    assertThat(withCertificate.calculateTax(100.0, database)).isEqualTo(0.0);
    assertThat(reverse.calculateTax(100.0, database)).isEqualTo(0.0);
  }

  @Test
  void interstateSale_b2bWithoutResaleCertificate_chargesDestinationRate() {
    var scenario = scenario("US-TX", "US-WA", TransactionType.B2B).build();

    assertThat(scenario.calculateTax(100.0, database)).isEqualTo(6.5);
  }

  @Test
  void noAgreementOverride_treatsEuPairAsPlainCrossBorder() {
    var scenario =
        scenario("DE", "FR", TransactionType.B2B)
            .tradeAgreementOverride(TradeAgreementOverride.noAgreement())
            .build();

    var breakdown = scenario.evaluate(new BigDecimal("100"), database);

    assertThat(breakdown.policy()).isEqualTo(CalculationPolicy.DESTINATION);
    assertThat(breakdown.agreement()).isEmpty();
    assertThat(breakdown.totalTax()).isEqualByComparingTo("20.00");
  }

  @Test
  void unknownAgreementOverride_fails() {
    var scenario =
        scenario("DE", "FR", TransactionType.B2B)
            .tradeAgreementOverride(TradeAgreementOverride.useAgreement("UNKNOWN"))
            .build();

    assertThatThrownBy(() -> scenario.calculateTax(100.0, database))
        .isInstanceOf(AgreementNotFoundException.class);
  }

  @Test
  void missingRateTier_failsInsteadOfChargingZero() {
    var scenario =
        scenario("DE", "DE", TransactionType.B2C).rateTier(RateTier.SUPER_REDUCED).build();

    assertThatThrownBy(() -> scenario.calculateTax(100.0, database))
        .isInstanceOf(RateNotFoundException.class);
  }

  @Test
  void invalidAmounts_areRejected() {
    var scenario = scenario("DE", "DE", TransactionType.B2C).build();

    assertThatThrownBy(() -> scenario.calculateTax(-1.0, database))
        .isInstanceOf(InvalidAmountException.class);
    assertThatThrownBy(() -> scenario.calculateTax(Double.NaN, database))
        .isInstanceOf(InvalidAmountException.class);
    assertThatThrownBy(() -> scenario.calculateTax(Double.POSITIVE_INFINITY, database))
        .isInstanceOf(InvalidAmountException.class);
  }

  @Test
  void evaluate_reportsAgreementAndConsistentTotals() {
    var scenario = scenario("CA-BC", "CA-BC", TransactionType.B2B).build();

    var breakdown = scenario.evaluate(new BigDecimal("33.33"), database);
    var total = scenario.calculateTaxDecimal(new BigDecimal("33.33"), database);

    assertThat(breakdown.agreement()).contains("CA");
    assertThat(breakdown.rateRegion()).isEqualTo(Region.parse("CA-BC"));
    assertThat(breakdown.totalTax()).isEqualByComparingTo(total);
    assertThat(
            breakdown.appliedRates().stream()
                .map(AppliedRate::taxAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add))
        .isEqualByComparingTo(total);
  }

  @Test
  void agreementMemberMissingFromCatalog_failsWithRegionNotFound() {
    var incomplete =
        TaxDatabase.fromJson(
            """
            {"DE": [{"tax_kind": "vat_standard", "rate": 0.19}]}
            """,
            """
            {
              "EU": {
                "name": "European Union",
                "type": "customs_union",
                "members": ["DE", "AT"],
                "tax_rules": {
                  "internal_b2c": {"type": "destination"},
                  "external_export": {"type": "zero_rated"}
                }
              }
            }
            """);
    var scenario = scenario("DE", "AT", TransactionType.B2C).build();

    assertThatThrownBy(() -> scenario.calculateTax(100.0, incomplete))
        .isInstanceOfSatisfying(
            RegionNotFoundException.class, e -> assertThat(e.getRegionCode()).isEqualTo("AT"));
  }

  @Test
  void subdivisionMemberMissingFromCatalog_failsInsteadOfTaxingNothing() {
    var incomplete =
        TaxDatabase.fromJson(
            """
            {"US": [], "US-CA": [{"tax_kind": "sales_tax", "rate": 0.0725}]}
            """,
            """
            {
              "US": {
                "name": "United States",
                "type": "federal_state",
                "members": ["US-CA", "US-WA"],
                "tax_rules": {
                  "internal_b2c": {"type": "destination"},
                  "external_export": {"type": "zero_rated"}
                }
              }
            }
            """);
    var scenario = scenario("US-CA", "US-WA", TransactionType.B2C).build();

    assertThatThrownBy(() -> scenario.evaluate(new BigDecimal("100"), incomplete))
        .isInstanceOfSatisfying(
            RegionNotFoundException.class, e -> assertThat(e.getRegionCode()).isEqualTo("US-WA"));
  }

  @Test
  void floatAndDecimalCalculations_agree() {
    var scenario = scenario("CA-QC", "CA-QC", TransactionType.B2B).build();

    var asDouble = scenario.calculateTax(1234.56, database);
    var asDecimal = scenario.calculateTaxDecimal(new BigDecimal("1234.56"), database);

    assertThat(asDouble).isEqualTo(asDecimal.doubleValue());
    assertThat(asDouble).isGreaterThan(0.0);
  }

  @Test
  void evaluate_isRepeatable() {
    var scenario = scenario("DE", "FR", TransactionType.B2C).build();

    var first = scenario.evaluate(new BigDecimal("250.00"), database);
    var second = scenario.evaluate(new BigDecimal("250.00"), database);

    assertThat(first).isEqualTo(second);
  }

  @Test
  void isSameCountry_comparesCountryCodes() {
    assertThat(scenario("US-CA", "US-WA", TransactionType.B2C).build().isSameCountry()).isTrue();
    assertThat(scenario("DE", "FR", TransactionType.B2C).build().isSameCountry()).isFalse();
  }
}
