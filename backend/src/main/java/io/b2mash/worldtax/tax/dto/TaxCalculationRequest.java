package io.b2mash.worldtax.tax.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.b2mash.worldtax.tax.RateTier;
import io.b2mash.worldtax.tax.TransactionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record TaxCalculationRequest(
    @NotNull(message = "source is required") @Valid RegionRequest source,
    @NotNull(message = "destination is required") @Valid RegionRequest destination,
    @NotNull(message = "transactionType is required") TransactionType transactionType,
    @NotNull(message = "amount is required")
        @DecimalMin(value = "0.00", message = "amount must not be negative")
        BigDecimal amount,
    @Size(max = 100, message = "tradeAgreement must not exceed 100 characters")
        String tradeAgreement,
    Boolean noTradeAgreement,
    Boolean digitalProductOrService,
    Boolean hasResaleCertificate,
    Boolean buyerRegistered,
    Boolean ignoreThreshold,
    RateTier rateTier) {

  /** Flags left out of the request body are off. */
  public TaxCalculationRequest {
    noTradeAgreement = Boolean.TRUE.equals(noTradeAgreement);
    digitalProductOrService = Boolean.TRUE.equals(digitalProductOrService);
    hasResaleCertificate = Boolean.TRUE.equals(hasResaleCertificate);
    buyerRegistered = Boolean.TRUE.equals(buyerRegistered);
    ignoreThreshold = Boolean.TRUE.equals(ignoreThreshold);
  }

  @JsonIgnore
  @AssertTrue(message = "tradeAgreement and noTradeAgreement cannot both be set")
  public boolean isOverrideUnambiguous() {
    return !(noTradeAgreement && tradeAgreement != null && !tradeAgreement.isBlank());
  }

  public record RegionRequest(
      @NotBlank(message = "country is required")
          @Size(min = 2, max = 2, message = "country must be an ISO 3166-1 alpha-2 code")
          String country,
      @Size(max = 6, message = "subdivision must not exceed 6 characters") String subdivision) {}
}
