package io.b2mash.worldtax.tax.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** DTO record for deserializing one agreement of the trade agreement document. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradeAgreementDocument(
    String name,
    String type,
    List<String> members,
    @JsonProperty("destination_members") List<String> destinationMembers,
    @JsonProperty("applies_to") AppliesToDocument appliesTo,
    @JsonProperty("tax_rules") TaxRulesDocument taxRules) {

  /** Returns destinationMembers with null-safe default of an empty list. */
  public List<String> destinationMembersOrEmpty() {
    return destinationMembers != null ? destinationMembers : List.of();
  }
}
