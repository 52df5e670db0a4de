package io.b2mash.worldtax.exception;

import org.springframework.http.HttpStatus;

/** Thrown for negative or non-finite transaction amounts. Results in HTTP 400. */
public class InvalidAmountException extends TaxProcessingException {

  public InvalidAmountException(Object amount) {
    super(
        HttpStatus.BAD_REQUEST,
        "Invalid amount",
        "Amount must be a finite, non-negative number but was " + amount);
  }
}
