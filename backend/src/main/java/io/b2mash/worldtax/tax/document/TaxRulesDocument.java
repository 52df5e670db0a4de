package io.b2mash.worldtax.tax.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** DTO record for the tax_rules section of a trade agreement. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaxRulesDocument(
    @JsonProperty("internal_b2b") TaxRuleDocument internalB2b,
    @JsonProperty("internal_b2c") TaxRuleDocument internalB2c,
    @JsonProperty("external_export") TaxRuleDocument externalExport) {}
