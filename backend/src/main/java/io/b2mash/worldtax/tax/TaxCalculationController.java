package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.tax.dto.BatchTaxCalculationRequest;
import io.b2mash.worldtax.tax.dto.RegionRatesResponse;
import io.b2mash.worldtax.tax.dto.TaxCalculationRequest;
import io.b2mash.worldtax.tax.dto.TaxCalculationResponse;
import io.b2mash.worldtax.tax.dto.TradeAgreementResponse;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tax")
public class TaxCalculationController {

  private final TaxCalculationService taxCalculationService;
  private final TaxCatalogService taxCatalogService;

  public TaxCalculationController(
      TaxCalculationService taxCalculationService, TaxCatalogService taxCatalogService) {
    this.taxCalculationService = taxCalculationService;
    this.taxCatalogService = taxCatalogService;
  }

  @PostMapping("/calculate")
  public ResponseEntity<TaxCalculationResponse> calculate(
      @Valid @RequestBody TaxCalculationRequest request) {
    return ResponseEntity.ok(taxCalculationService.calculate(request));
  }

  @PostMapping("/calculate/batch")
  public ResponseEntity<List<TaxCalculationResponse>> calculateBatch(
      @Valid @RequestBody BatchTaxCalculationRequest request) {
    return ResponseEntity.ok(taxCalculationService.calculateBatch(request.lines()));
  }

  @GetMapping("/rates/{regionCode}")
  public ResponseEntity<RegionRatesResponse> getRates(@PathVariable String regionCode) {
    return ResponseEntity.ok(taxCatalogService.ratesFor(regionCode));
  }

  @GetMapping("/agreements")
  public ResponseEntity<List<TradeAgreementResponse>> listAgreements() {
    return ResponseEntity.ok(taxCatalogService.listAgreements());
  }
}
