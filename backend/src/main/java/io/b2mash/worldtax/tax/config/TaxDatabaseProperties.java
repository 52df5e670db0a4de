package io.b2mash.worldtax.tax.config;

import io.b2mash.worldtax.tax.CurrencyRounding;
import java.math.RoundingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where the tax database is loaded from and how computed amounts are rounded.
 *
 * @param ratesLocation Spring resource location of the rate document
 * @param agreementsLocation Spring resource location of the trade agreement document
 * @param scale decimal places kept on every tax amount
 * @param roundingMode rounding applied at that scale
 */
@ConfigurationProperties(prefix = "worldtax.database")
public record TaxDatabaseProperties(
    String ratesLocation, String agreementsLocation, Integer scale, RoundingMode roundingMode) {

  public TaxDatabaseProperties {
    if (ratesLocation == null || ratesLocation.isBlank()) {
      ratesLocation = "classpath:tax/rates.json";
    }
    if (agreementsLocation == null || agreementsLocation.isBlank()) {
      agreementsLocation = "classpath:tax/trade-agreements.json";
    }
    if (scale == null) {
      scale = CurrencyRounding.CENTS.scale();
    }
    if (roundingMode == null) {
      roundingMode = CurrencyRounding.CENTS.mode();
    }
  }

  public CurrencyRounding rounding() {
    return new CurrencyRounding(scale, roundingMode);
  }
}
