package io.b2mash.worldtax.tax.dto;

import io.b2mash.worldtax.tax.AppliedRate;
import java.math.BigDecimal;

public record AppliedRateResponse(
    String taxKind,
    BigDecimal rate,
    boolean compound,
    BigDecimal taxableBase,
    BigDecimal taxAmount) {

  public static AppliedRateResponse from(AppliedRate applied) {
    return new AppliedRateResponse(
        applied.taxKind().key(),
        applied.rate(),
        applied.compound(),
        applied.taxableBase(),
        applied.taxAmount());
  }
}
