package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.region.Region;
import io.b2mash.worldtax.region.RegionValidator;
import io.b2mash.worldtax.tax.dto.TaxCalculationRequest;
import io.b2mash.worldtax.tax.dto.TaxCalculationRequest.RegionRequest;
import io.b2mash.worldtax.tax.dto.TaxCalculationResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.ErrorResponseException;

/** Stateless service evaluating tax scenarios against the shared {@link TaxDatabase}. */
@Service
public class TaxCalculationService {

  private static final Logger log = LoggerFactory.getLogger(TaxCalculationService.class);

  private final TaxDatabase taxDatabase;
  private final RegionValidator regionValidator;

  public TaxCalculationService(TaxDatabase taxDatabase, RegionValidator regionValidator) {
    this.taxDatabase = taxDatabase;
    this.regionValidator = regionValidator;
  }

  public TaxCalculationResponse calculate(TaxCalculationRequest request) {
    var scenario = toScenario(request);
    var breakdown = scenario.evaluate(request.amount(), taxDatabase);
    return TaxCalculationResponse.from(scenario, request.amount(), breakdown);
  }

  /**
   * Evaluates every line independently. The batch is all or nothing: the first failing line fails
   * the whole request and no partial result is returned.
   */
  public List<TaxCalculationResponse> calculateBatch(List<TaxCalculationRequest> requests) {
    var responses = new ArrayList<TaxCalculationResponse>(requests.size());
    for (int i = 0; i < requests.size(); i++) {
      try {
        responses.add(calculate(requests.get(i)));
      } catch (ErrorResponseException e) {
        log.warn("Batch line {} of {} failed: {}", i, requests.size(), e.getBody().getDetail());
        e.getBody().setProperty("line", i);
        throw e;
      }
    }
    log.debug("Evaluated batch of {} lines", responses.size());
    return responses;
  }

  /**
   * Builds the scenario for a request. An explicit {@code noTradeAgreement} takes precedence over a
   * named agreement.
   */
  TaxScenario toScenario(TaxCalculationRequest request) {
    var builder =
        TaxScenario.builder(
                region(request.source()), region(request.destination()), request.transactionType())
            .digitalProductOrService(request.digitalProductOrService())
            .hasResaleCertificate(request.hasResaleCertificate())
            .buyerRegistered(request.buyerRegistered())
            .ignoreThreshold(request.ignoreThreshold())
            .rateTier(request.rateTier());
    if (request.noTradeAgreement()) {
      builder.tradeAgreementOverride(TradeAgreementOverride.noAgreement());
    } else if (request.tradeAgreement() != null && !request.tradeAgreement().isBlank()) {
      builder.tradeAgreementOverride(
          TradeAgreementOverride.useAgreement(request.tradeAgreement().trim()));
    }
    return builder.build();
  }

  private Region region(RegionRequest request) {
    return regionValidator.validate(request.country(), request.subdivision());
  }
}
