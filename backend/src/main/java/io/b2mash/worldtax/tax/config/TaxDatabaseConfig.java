package io.b2mash.worldtax.tax.config;

import io.b2mash.worldtax.exception.TaxConfigurationException;
import io.b2mash.worldtax.exception.TaxConfigurationException.Reason;
import io.b2mash.worldtax.region.IsoRegionValidator;
import io.b2mash.worldtax.region.RegionValidator;
import io.b2mash.worldtax.tax.TaxDatabase;
import io.b2mash.worldtax.tax.TaxDatabaseLoader;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import tools.jackson.databind.ObjectMapper;

/**
 * Builds the shared {@link TaxDatabase} once at startup. A malformed document aborts context
 * startup with a {@link TaxConfigurationException}.
 */
@Configuration
@EnableConfigurationProperties(TaxDatabaseProperties.class)
public class TaxDatabaseConfig {

  private static final Logger log = LoggerFactory.getLogger(TaxDatabaseConfig.class);

  @Bean
  TaxDatabase taxDatabase(
      TaxDatabaseProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    log.info(
        "Loading tax database from {} and {}",
        properties.ratesLocation(),
        properties.agreementsLocation());
    var rates = resourceLoader.getResource(properties.ratesLocation());
    var agreements = resourceLoader.getResource(properties.agreementsLocation());
    try (InputStream ratesStream = open(rates, Reason.MALFORMED_RATES);
        InputStream agreementsStream = open(agreements, Reason.MALFORMED_AGREEMENTS)) {
      return new TaxDatabaseLoader(objectMapper)
          .load(ratesStream, agreementsStream, properties.rounding());
    } catch (IOException e) {
      throw new TaxConfigurationException(
          Reason.MALFORMED_RATES, "Failed to read tax database: " + e.getMessage(), e);
    }
  }

  @Bean
  RegionValidator regionValidator(ObjectMapper objectMapper) {
    return IsoRegionValidator.load(objectMapper);
  }

  private static InputStream open(Resource resource, Reason reason) throws IOException {
    if (!resource.exists()) {
      throw new TaxConfigurationException(reason, "Missing resource " + resource.getDescription());
    }
    return resource.getInputStream();
  }
}
