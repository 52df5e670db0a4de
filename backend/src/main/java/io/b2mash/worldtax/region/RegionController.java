package io.b2mash.worldtax.region;

import io.b2mash.worldtax.region.dto.CountryResponse;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/regions")
public class RegionController {

  private final RegionValidator regionValidator;

  public RegionController(RegionValidator regionValidator) {
    this.regionValidator = regionValidator;
  }

  @GetMapping
  public ResponseEntity<List<CountryResponse>> listCountries() {
    return ResponseEntity.ok(
        regionValidator.countries().stream().map(CountryResponse::from).toList());
  }

  @GetMapping("/{countryCode}")
  public ResponseEntity<CountryResponse> getCountry(@PathVariable String countryCode) {
    var country = regionValidator.validate(countryCode, null).country();
    return regionValidator.countries().stream()
        .filter(c -> c.code().equals(country))
        .findFirst()
        .map(CountryResponse::from)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
