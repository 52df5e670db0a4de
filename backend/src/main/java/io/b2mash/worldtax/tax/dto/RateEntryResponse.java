package io.b2mash.worldtax.tax.dto;

import io.b2mash.worldtax.tax.RateEntry;
import java.math.BigDecimal;

public record RateEntryResponse(String taxKind, BigDecimal rate, boolean compound) {

  public static RateEntryResponse from(RateEntry entry) {
    return new RateEntryResponse(entry.taxKind().key(), entry.rate(), entry.compound());
  }
}
