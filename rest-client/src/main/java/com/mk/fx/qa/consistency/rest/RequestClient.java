package com.mk.fx.qa.consistency.rest;

/**
 * Issues a single request against the system under test.
 *
 * <p>Implementations return every HTTP response, whatever its status, and throw {@link
 * TransportException} only when no response was received. A timeout is reported as {@link
 * RequestTimeoutException} so callers can tell it apart from other transport failures.
 */
@FunctionalInterface
public interface RequestClient {

  RestResponseData execute(Request request);
}
