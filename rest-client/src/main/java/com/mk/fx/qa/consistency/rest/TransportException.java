package com.mk.fx.qa.consistency.rest;

/**
 * Raised when a request never produced an HTTP response: connection refused, DNS failure, I/O
 * error or timeout. HTTP error statuses are returned as {@link RestResponseData}, not thrown.
 */
public class TransportException extends RuntimeException {

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
