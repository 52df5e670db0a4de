package io.b2mash.worldtax.tax;

/** Categories of supply a trade agreement covers. */
public record AppliesTo(boolean physicalGoods, boolean digitalGoods, boolean services) {

  public static final AppliesTo ALL = new AppliesTo(true, true, true);

  /** Digital products and services are covered by either the digital or the services flag. */
  public boolean covers(boolean digitalProductOrService) {
    return digitalProductOrService ? digitalGoods || services : physicalGoods;
  }
}
