package io.b2mash.worldtax.tax;

import io.b2mash.worldtax.region.Region;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A configured trade agreement. Members are country codes ("DE") or subdivision codes ("US-CA").
 *
 * @param name registry key, used by overrides
 * @param displayName human readable name
 * @param type customs union or federal state
 * @param members member codes in document order
 * @param appliesTo supply categories covered
 * @param rules rule slots
 * @param destinationMembers members whose own rates always apply to internal sales delivered there
 */
public record TradeAgreement(
    String name,
    String displayName,
    AgreementType type,
    Set<String> members,
    AppliesTo appliesTo,
    TaxRules rules,
    Set<String> destinationMembers) {

  public TradeAgreement {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(rules, "rules must not be null");
    displayName = displayName != null ? displayName : name;
    members = Collections.unmodifiableSet(new LinkedHashSet<>(members));
    appliesTo = appliesTo != null ? appliesTo : AppliesTo.ALL;
    destinationMembers =
        destinationMembers == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(destinationMembers));
  }

  public boolean isFederal() {
    return type == AgreementType.FEDERAL_STATE;
  }

  public boolean isCustomsUnion() {
    return type == AgreementType.CUSTOMS_UNION;
  }

  /** A region is a member when its country code or its subdivision code is listed. */
  public boolean includes(Region region) {
    return members.contains(region.country()) || members.contains(region.code());
  }

  /**
   * Whether this agreement governs a sale between the two regions as internal trade. Customs unions
   * only govern sales between different member countries, federal agreements only sales within one
   * country.
   */
  public boolean governsInternally(Region source, Region destination) {
    if (!includes(source) || !includes(destination)) {
      return false;
    }
    return isFederal() == source.isSameCountry(destination);
  }

  public boolean isDestinationMember(Region region) {
    return destinationMembers.contains(region.code())
        || destinationMembers.contains(region.country());
  }
}
