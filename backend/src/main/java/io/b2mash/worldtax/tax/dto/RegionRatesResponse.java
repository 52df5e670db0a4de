package io.b2mash.worldtax.tax.dto;

import java.util.List;

/**
 * @param region the region that was asked for
 * @param configuredFor the catalog entry the rates came from; the country when a subdivision has no
 *     entry of its own
 * @param rates entries in application order
 */
public record RegionRatesResponse(
    String region, String configuredFor, List<RateEntryResponse> rates) {}
