package io.b2mash.worldtax.exception;

/**
 * Thrown when a rate or trade agreement document cannot be turned into a tax database. Fatal at
 * startup: the application context refuses to start rather than run with partial data.
 */
public class TaxConfigurationException extends RuntimeException {

  public enum Reason {
    MALFORMED_RATES,
    MALFORMED_AGREEMENTS
  }

  private final Reason reason;

  public TaxConfigurationException(Reason reason, String detail) {
    super(reason + ": " + detail);
    this.reason = reason;
  }

  public TaxConfigurationException(Reason reason, String detail, Throwable cause) {
    super(reason + ": " + detail, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
