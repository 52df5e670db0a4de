package io.b2mash.worldtax.tax.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/** DTO record for a single rule slot. Only the fields relevant to {@code type} are read. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaxRuleDocument(
    String type,
    BigDecimal threshold,
    @JsonProperty("below_threshold") String belowThreshold,
    @JsonProperty("above_threshold") String aboveThreshold,
    @JsonProperty("threshold_digital_products") BigDecimal thresholdDigitalProducts,
    @JsonProperty("below_threshold_digital_products") String belowThresholdDigitalProducts,
    @JsonProperty("above_threshold_digital_products") String aboveThresholdDigitalProducts,
    @JsonProperty("requires_resale_certificate") Boolean requiresResaleCertificate,
    @JsonProperty("requires_registration") Boolean requiresRegistration) {}
