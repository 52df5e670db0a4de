package io.b2mash.worldtax.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.b2mash.worldtax.exception.RegionNotFoundException;
import io.b2mash.worldtax.exception.RegionValidationException;
import io.b2mash.worldtax.exception.RegionValidationException.Reason;
import io.b2mash.worldtax.region.Region;
import io.b2mash.worldtax.region.RegionValidator;
import io.b2mash.worldtax.tax.dto.TaxCalculationRequest;
import io.b2mash.worldtax.tax.dto.TaxCalculationRequest.RegionRequest;
import io.b2mash.worldtax.tax.dto.TaxCalculationResponse;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaxCalculationServiceTest {

  @Mock private RegionValidator regionValidator;

  private TaxCalculationService service;

  @BeforeEach
  void setUp() {
    service = new TaxCalculationService(TaxDatabaseFixtures.small(), regionValidator);
  }

  private void knownRegion(String country, String subdivision) {
    when(regionValidator.validate(country, subdivision))
        .thenReturn(new Region(country, subdivision));
  }

  private static TaxCalculationRequest request(
      String source, String destination, TransactionType type, String amount) {
    return new TaxCalculationRequest(
        new RegionRequest(source, null),
        new RegionRequest(destination, null),
        type,
        new BigDecimal(amount),
        null,
        false,
        false,
        false,
        false,
        false,
        null);
  }

  @Test
  void calculate_mapsBreakdownToResponse() {
    knownRegion("DE", null);
    knownRegion("FR", null);

    var response = service.calculate(request("DE", "FR", TransactionType.B2C, "100.00"));

    assertThat(response.source()).isEqualTo("DE");
    assertThat(response.destination()).isEqualTo("FR");
    assertThat(response.policy()).isEqualTo(CalculationPolicy.ORIGIN);
    assertThat(response.tradeAgreement()).isEqualTo("EU");
    assertThat(response.rateRegion()).isEqualTo("DE");
    assertThat(response.totalTax()).isEqualByComparingTo("19.00");
    assertThat(response.appliedRates())
        .singleElement()
        .satisfies(
            rate -> {
              assertThat(rate.taxKind()).isEqualTo("vat_standard");
              assertThat(rate.taxableBase()).isEqualByComparingTo("100.00");
              assertThat(rate.taxAmount()).isEqualByComparingTo("19.00");
            });
  }

  @Test
  void calculate_untaxedPolicy_hasNoRateRegion() {
    knownRegion("DE", null);
    knownRegion("FR", null);

    var response = service.calculate(request("DE", "FR", TransactionType.B2B, "100.00"));

    assertThat(response.policy()).isEqualTo(CalculationPolicy.REVERSE_CHARGE);
    assertThat(response.rateRegion()).isNull();
    assertThat(response.appliedRates()).isEmpty();
  }

  @Test
  void calculate_invalidRegion_propagatesValidationFailure() {
    when(regionValidator.validate("XX", null))
        .thenThrow(new RegionValidationException(Reason.INVALID_COUNTRY, "XX"));

    assertThatThrownBy(() -> service.calculate(request("XX", "DE", TransactionType.B2C, "1")))
        .isInstanceOf(RegionValidationException.class);
  }

  @Test
  void calculateBatch_evaluatesEachLineInOrder() {
    knownRegion("DE", null);
    knownRegion("FR", null);
    knownRegion("TH", null);

    var responses =
        service.calculateBatch(
            List.of(
                request("DE", "FR", TransactionType.B2C, "100"),
                request("DE", "TH", TransactionType.B2C, "100"),
                request("DE", "DE", TransactionType.B2C, "50")));

    assertThat(responses)
        .extracting(TaxCalculationResponse::policy)
        .containsExactly(
            CalculationPolicy.ORIGIN, CalculationPolicy.ZERO_RATED, CalculationPolicy.DESTINATION);
    assertThat(responses.get(2).totalTax()).isEqualByComparingTo("9.50");
  }

  @Test
  void calculateBatch_failingLine_failsWholeBatchAndNamesLine() {
    knownRegion("DE", null);
    knownRegion("JP", null);

    assertThatThrownBy(
            () ->
                service.calculateBatch(
                    List.of(
                        request("DE", "DE", TransactionType.B2C, "100"),
                        request("JP", "JP", TransactionType.B2C, "100"))))
        .isInstanceOfSatisfying(
            RegionNotFoundException.class,
            e -> assertThat(e.getBody().getProperties()).containsEntry("line", 1));
  }

  @Test
  void toScenario_noTradeAgreementTakesPrecedenceOverNamedAgreement() {
    knownRegion("DE", null);
    knownRegion("FR", null);
    var request =
        new TaxCalculationRequest(
            new RegionRequest("DE", null),
            new RegionRequest("FR", null),
            TransactionType.B2B,
            BigDecimal.TEN,
            "EU",
            true,
            false,
            false,
            false,
            false,
            null);

    var scenario = service.toScenario(request);

    assertThat(scenario.tradeAgreementOverride()).contains(TradeAgreementOverride.noAgreement());
  }

  @Test
  void toScenario_copiesFlags() {
    knownRegion("US", "TX");
    knownRegion("US", "WA");
    var request =
        new TaxCalculationRequest(
            new RegionRequest("US", "TX"),
            new RegionRequest("US", "WA"),
            TransactionType.B2B,
            BigDecimal.TEN,
            " US ",
            false,
            true,
            true,
            true,
            true,
            RateTier.REDUCED);

    var scenario = service.toScenario(request);

    assertThat(scenario.sourceRegion()).isEqualTo(new Region("US", "TX"));
    assertThat(scenario.tradeAgreementOverride())
        .contains(TradeAgreementOverride.useAgreement("US"));
    assertThat(scenario.digitalProductOrService()).isTrue();
    assertThat(scenario.hasResaleCertificate()).isTrue();
    assertThat(scenario.buyerRegistered()).isTrue();
    assertThat(scenario.ignoreThreshold()).isTrue();
    assertThat(scenario.rateTier()).contains(RateTier.REDUCED);
  }
}
