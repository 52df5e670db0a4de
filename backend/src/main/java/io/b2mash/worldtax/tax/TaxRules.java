package io.b2mash.worldtax.tax;

import java.util.Objects;
import java.util.Optional;

/**
 * The three rule slots of a trade agreement. Internal slots are optional; the export slot is
 * required.
 */
public record TaxRules(TaxRule internalB2b, TaxRule internalB2c, TaxRule externalExport) {

  public TaxRules {
    Objects.requireNonNull(externalExport, "externalExport must not be null");
  }

  public Optional<TaxRule> internal(TransactionType transactionType) {
    return Optional.ofNullable(
        switch (transactionType) {
          case B2B -> internalB2b;
          case B2C -> internalB2c;
        });
  }
}
