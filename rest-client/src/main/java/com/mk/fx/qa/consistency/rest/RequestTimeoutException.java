package com.mk.fx.qa.consistency.rest;

/** Transport failure caused by the connect or request timeout elapsing. */
public class RequestTimeoutException extends TransportException {

  public RequestTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
