package io.b2mash.worldtax.tax.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/** DTO record for one entry of a region's rate list in the rate document. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RateEntryDocument(
    @JsonProperty("tax_kind") String taxKind, BigDecimal rate, Boolean compound) {

  /** Returns compound with null-safe default of false. */
  public boolean compoundOrDefault() {
    return compound != null && compound;
  }
}
