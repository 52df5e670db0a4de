package io.b2mash.worldtax.region.dto;

import io.b2mash.worldtax.region.RegionValidator.CountryInfo;
import java.util.List;

public record CountryResponse(String code, String name, List<SubdivisionResponse> subdivisions) {

  public static CountryResponse from(CountryInfo country) {
    return new CountryResponse(
        country.code(),
        country.name(),
        country.subdivisions().stream()
            .map(s -> new SubdivisionResponse(s.code(), s.name()))
            .toList());
  }

  public record SubdivisionResponse(String code, String name) {}
}
