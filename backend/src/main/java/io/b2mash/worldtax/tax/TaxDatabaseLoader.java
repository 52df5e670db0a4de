package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.exception.TaxConfigurationException;
import io.b2mash.worldtax.exception.TaxConfigurationException.Reason;
import io.b2mash.worldtax.tax.document.AppliesToDocument;
import io.b2mash.worldtax.tax.document.RateEntryDocument;
import io.b2mash.worldtax.tax.document.TaxRuleDocument;
import io.b2mash.worldtax.tax.document.TaxRulesDocument;
import io.b2mash.worldtax.tax.document.TradeAgreementDocument;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns the rate document and the trade agreement document into a {@link TaxDatabase}. Any schema
 * violation fails the whole load with a {@link TaxConfigurationException}; nothing is skipped.
 */
public class TaxDatabaseLoader {

  private static final Logger log = LoggerFactory.getLogger(TaxDatabaseLoader.class);

  private static final TypeReference<LinkedHashMap<String, List<RateEntryDocument>>>
      RATE_DOCUMENT = new TypeReference<>() {};
  private static final TypeReference<LinkedHashMap<String, TradeAgreementDocument>>
      AGREEMENT_DOCUMENT = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public TaxDatabaseLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public TaxDatabase load(String ratesJson, String agreementsJson, CurrencyRounding rounding) {
    var rates = parseRates(readRates(ratesJson));
    var agreements = parseAgreements(readAgreements(agreementsJson));
    log.info(
        "Loaded tax database: {} rate regions, {} trade agreements",
        rates.size(),
        agreements.size());
    return new TaxDatabase(rates, agreements, rounding);
  }

  public TaxDatabase load(InputStream rates, InputStream agreements, CurrencyRounding rounding) {
    return load(readString(rates), readString(agreements), rounding);
  }

  TaxDatabase loadClasspath(String ratesPath, String agreementsPath, CurrencyRounding rounding) {
    try (InputStream rates = TaxDatabaseLoader.class.getResourceAsStream(ratesPath);
        InputStream agreements = TaxDatabaseLoader.class.getResourceAsStream(agreementsPath)) {
      if (rates == null) {
        throw new TaxConfigurationException(
            Reason.MALFORMED_RATES, "Missing classpath resource " + ratesPath);
      }
      if (agreements == null) {
        throw new TaxConfigurationException(
            Reason.MALFORMED_AGREEMENTS, "Missing classpath resource " + agreementsPath);
      }
      return load(rates, agreements, rounding);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close tax database resources", e);
    }
  }

  private Map<String, List<RateEntryDocument>> readRates(String json) {
    try {
      var document = objectMapper.readValue(json, RATE_DOCUMENT);
      if (document == null) {
        throw new TaxConfigurationException(Reason.MALFORMED_RATES, "document is empty");
      }
      return document;
    } catch (JacksonException e) {
      throw new TaxConfigurationException(Reason.MALFORMED_RATES, e.getOriginalMessage(), e);
    }
  }

  private Map<String, TradeAgreementDocument> readAgreements(String json) {
    try {
      var document = objectMapper.readValue(json, AGREEMENT_DOCUMENT);
      if (document == null) {
        throw new TaxConfigurationException(Reason.MALFORMED_AGREEMENTS, "document is empty");
      }
      return document;
    } catch (JacksonException e) {
      throw new TaxConfigurationException(Reason.MALFORMED_AGREEMENTS, e.getOriginalMessage(), e);
    }
  }

  private static Map<String, List<RateEntry>> parseRates(
      Map<String, List<RateEntryDocument>> document) {
    var rates = new LinkedHashMap<String, List<RateEntry>>();
    document.forEach(
        (regionCode, entries) -> {
          if (entries == null) {
            throw malformedRates(regionCode, "rate list is null");
          }
          var parsed = new ArrayList<RateEntry>(entries.size());
          for (RateEntryDocument entry : entries) {
            parsed.add(parseRateEntry(regionCode, entry));
          }
          rates.put(regionCode, parsed);
        });
    return rates;
  }

  private static RateEntry parseRateEntry(String regionCode, RateEntryDocument entry) {
    if (entry == null || entry.taxKind() == null || entry.rate() == null) {
      throw malformedRates(regionCode, "entries need tax_kind and rate");
    }
    var kind =
        TaxKind.fromKey(entry.taxKind())
            .orElseThrow(() -> malformedRates(regionCode, "unknown tax_kind " + entry.taxKind()));
    try {
      return new RateEntry(kind, entry.rate(), entry.compoundOrDefault());
    } catch (IllegalArgumentException e) {
      throw malformedRates(regionCode, e.getMessage());
    }
  }

  private static List<TradeAgreement> parseAgreements(
      Map<String, TradeAgreementDocument> document) {
    var agreements = new ArrayList<TradeAgreement>(document.size());
    document.forEach((name, agreement) -> agreements.add(parseAgreement(name, agreement)));
    return agreements;
  }

  private static TradeAgreement parseAgreement(String name, TradeAgreementDocument document) {
    if (document == null) {
      throw malformedAgreement(name, "definition is null");
    }
    var type =
        AgreementType.fromKey(document.type())
            .orElseThrow(() -> malformedAgreement(name, "unknown type " + document.type()));
    if (document.members() == null || document.members().isEmpty()) {
      throw malformedAgreement(name, "members must not be empty");
    }
    if (document.taxRules() == null) {
      throw malformedAgreement(name, "tax_rules is required");
    }
    var destinationMembers = document.destinationMembersOrEmpty();
    for (String member : destinationMembers) {
      if (!document.members().contains(member)) {
        throw malformedAgreement(name, "destination member " + member + " is not a member");
      }
    }
    return new TradeAgreement(
        name,
        document.name(),
        type,
        new LinkedHashSet<>(document.members()),
        parseAppliesTo(document.appliesTo()),
        parseRules(name, document.taxRules()),
        new LinkedHashSet<>(destinationMembers));
  }

  private static AppliesTo parseAppliesTo(AppliesToDocument document) {
    if (document == null) {
      return AppliesTo.ALL;
    }
    return new AppliesTo(
        Boolean.TRUE.equals(document.physicalGoods()),
        Boolean.TRUE.equals(document.digitalGoods()),
        Boolean.TRUE.equals(document.services()));
  }

  private static TaxRules parseRules(String name, TaxRulesDocument document) {
    if (document.externalExport() == null) {
      throw malformedAgreement(name, "external_export rule is required");
    }
    return new TaxRules(
        parseRule(name, "internal_b2b", document.internalB2b()),
        parseRule(name, "internal_b2c", document.internalB2c()),
        parseRule(name, "external_export", document.externalExport()));
  }

  private static TaxRule parseRule(String name, String slot, TaxRuleDocument document) {
    if (document == null) {
      return null;
    }
    var type = ruleType(name, slot, document.type());
    return switch (type) {
      case ORIGIN, DESTINATION, REVERSE_CHARGE, ZERO_RATED, NONE -> TaxRule.simple(type);
      case EXEMPT ->
          new TaxRule.Exempt(
              Boolean.TRUE.equals(document.requiresResaleCertificate()),
              Boolean.TRUE.equals(document.requiresRegistration()));
      case THRESHOLD_BASED -> parseThresholdRule(name, slot, document);
    };
  }

  private static TaxRule parseThresholdRule(String name, String slot, TaxRuleDocument document) {
    if (document.threshold() == null
        || document.belowThreshold() == null
        || document.aboveThreshold() == null) {
      throw malformedAgreement(
          name, slot + " needs threshold, below_threshold and above_threshold");
    }
    requireNonNegative(name, slot, document.threshold());
    TaxRule below = nestedRule(name, slot, document.belowThreshold());
    TaxRule above = nestedRule(name, slot, document.aboveThreshold());
    if (document.thresholdDigitalProducts() == null
        && document.belowThresholdDigitalProducts() == null
        && document.aboveThresholdDigitalProducts() == null) {
      return new TaxRule.ThresholdBased(document.threshold(), below, above);
    }
    if (document.thresholdDigitalProducts() == null
        || document.belowThresholdDigitalProducts() == null
        || document.aboveThresholdDigitalProducts() == null) {
      throw malformedAgreement(
          name, slot + " digital threshold, below and above rules must be configured together");
    }
    requireNonNegative(name, slot, document.thresholdDigitalProducts());
    return new TaxRule.ThresholdBased(
        document.threshold(),
        below,
        above,
        document.thresholdDigitalProducts(),
        nestedRule(name, slot, document.belowThresholdDigitalProducts()),
        nestedRule(name, slot, document.aboveThresholdDigitalProducts()));
  }

  private static TaxRule nestedRule(String name, String slot, String key) {
    var type = ruleType(name, slot, key);
    if (type == RuleType.THRESHOLD_BASED) {
      throw malformedAgreement(name, slot + " threshold rules cannot be nested");
    }
    return TaxRule.simple(type);
  }

  private static RuleType ruleType(String name, String slot, String key) {
    return RuleType.fromKey(key)
        .orElseThrow(() -> malformedAgreement(name, slot + " has unknown rule type " + key));
  }

  private static void requireNonNegative(String name, String slot, BigDecimal threshold) {
    if (threshold.signum() < 0) {
      throw malformedAgreement(name, slot + " threshold must not be negative");
    }
  }

  private static String readString(InputStream in) {
    try {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read tax document", e);
    }
  }

  private static TaxConfigurationException malformedRates(String regionCode, String detail) {
    return new TaxConfigurationException(Reason.MALFORMED_RATES, regionCode + ": " + detail);
  }

  private static TaxConfigurationException malformedAgreement(String name, String detail) {
    return new TaxConfigurationException(Reason.MALFORMED_AGREEMENTS, name + ": " + detail);
  }
}
