package io.b2mash.worldtax.tax.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** DTO record for the applies_to section of a trade agreement. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppliesToDocument(
    @JsonProperty("physical_goods") Boolean physicalGoods,
    @JsonProperty("digital_goods") Boolean digitalGoods,
    Boolean services) {}
