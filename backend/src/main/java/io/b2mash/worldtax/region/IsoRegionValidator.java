package io.b2mash.worldtax.region;

import io.b2mash.worldtax.exception.RegionValidationException;
import io.b2mash.worldtax.exception.RegionValidationException.Reason;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Region validator backed by the JDK's ISO 3166-1 country list and a bundled ISO 3166-2
 * subdivision list ({@code classpath:iso/subdivisions.json}). A subdivision is only accepted for
 * countries present in the subdivision list.
 */
public class IsoRegionValidator implements RegionValidator {

  private static final Logger log = LoggerFactory.getLogger(IsoRegionValidator.class);
  private static final String SUBDIVISIONS_RESOURCE = "/iso/subdivisions.json";
  private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, String>>>
      SUBDIVISION_DOCUMENT = new TypeReference<>() {};

  private final Set<String> countries;
  private final Map<String, Map<String, String>> subdivisions;

  public IsoRegionValidator(Set<String> countries, Map<String, Map<String, String>> subdivisions) {
    this.countries = Collections.unmodifiableSet(new TreeSet<>(countries));
    var copy = new LinkedHashMap<String, Map<String, String>>();
    subdivisions.forEach(
        (country, names) ->
            copy.put(country, Collections.unmodifiableMap(new LinkedHashMap<>(names))));
    this.subdivisions = Collections.unmodifiableMap(copy);
  }

  /** Shared validator over the bundled reference data, loaded on first use. */
  public static IsoRegionValidator standard() {
    return Holder.INSTANCE;
  }

  /** Loads the bundled subdivision list with the given mapper. */
  public static IsoRegionValidator load(ObjectMapper objectMapper) {
    try (InputStream in = IsoRegionValidator.class.getResourceAsStream(SUBDIVISIONS_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing classpath resource " + SUBDIVISIONS_RESOURCE);
      }
      Map<String, LinkedHashMap<String, String>> document =
          objectMapper.readValue(in, SUBDIVISION_DOCUMENT);
      var countries = new TreeSet<>(Locale.getISOCountries(Locale.IsoCountryCode.PART1_ALPHA2));
      log.debug(
          "Loaded ISO reference data: {} countries, subdivisions for {}",
          countries.size(),
          document.keySet());
      return new IsoRegionValidator(countries, new LinkedHashMap<>(document));
    } catch (IOException | JacksonException e) {
      throw new IllegalStateException("Failed to read " + SUBDIVISIONS_RESOURCE, e);
    }
  }

  @Override
  public Region validate(String country, String subdivision) {
    if (country == null || country.isBlank()) {
      throw new RegionValidationException(Reason.INVALID_COUNTRY, String.valueOf(country));
    }
    var region = new Region(country, subdivision);
    if (!countries.contains(region.country())) {
      throw new RegionValidationException(Reason.INVALID_COUNTRY, region.country());
    }
    if (region.hasSubdivision()) {
      var known = subdivisions.get(region.country());
      if (known == null || known.isEmpty()) {
        throw new RegionValidationException(Reason.UNEXPECTED_SUBDIVISION, region.subdivision());
      }
      if (!known.containsKey(region.subdivision())) {
        throw new RegionValidationException(Reason.INVALID_SUBDIVISION, region.code());
      }
    }
    return region;
  }

  @Override
  public List<CountryInfo> countries() {
    var result = new ArrayList<CountryInfo>(countries.size());
    for (String code : countries) {
      var names = subdivisions.getOrDefault(code, Map.of());
      var divisions =
          names.entrySet().stream()
              .map(e -> new SubdivisionInfo(code + "-" + e.getKey(), e.getValue()))
              .toList();
      result.add(new CountryInfo(code, displayName(code), divisions));
    }
    return result;
  }

  private static String displayName(String code) {
    return new Locale("", code).getDisplayCountry(Locale.ENGLISH);
  }

  private static final class Holder {
    private static final IsoRegionValidator INSTANCE = load(new ObjectMapper());
  }
}
