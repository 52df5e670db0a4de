package io.b2mash.worldtax.exception;

import org.springframework.http.HttpStatus;

/** Thrown when an explicit trade agreement override names an agreement that is not configured. */
public class AgreementNotFoundException extends TaxProcessingException {

  private final String agreementName;

  public AgreementNotFoundException(String agreementName) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        "Trade agreement not found",
        "Trade agreement not found: " + agreementName);
    this.agreementName = agreementName;
    getBody().setProperty("agreement", agreementName);
  }

  public String getAgreementName() {
    return agreementName;
  }
}
