package io.b2mash.worldtax.tax;

/** Whether the buyer is a business or a consumer. */
public enum TransactionType {
  B2B,
  B2C
}
